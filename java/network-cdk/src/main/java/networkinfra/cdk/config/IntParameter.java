/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package networkinfra.cdk.config;

public class IntParameter {

    private final String key;
    private final int defaultValue;

    private IntParameter(String key, int defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public static IntParameter keyAndDefault(String key, int defaultValue) {
        return new IntParameter(key, defaultValue);
    }

    int get(AppContext context) {
        Object value = context.get(key);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number number) {
            double numberValue = number.doubleValue();
            if (numberValue != Math.rint(numberValue) || numberValue < Integer.MIN_VALUE || numberValue > Integer.MAX_VALUE) {
                throw notAnInteger(value, null);
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw notAnInteger(value, e);
        }
    }

    private IllegalArgumentException notAnInteger(Object value, Exception cause) {
        return new IllegalArgumentException(key + " must be an integer, found: " + value, cause);
    }

    public ContextValue value(int value) {
        return new ContextValue(key, value);
    }

    public ContextValue value(String value) {
        return new ContextValue(key, value);
    }

    public String key() {
        return key;
    }
}
