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

public class StringParameter {

    private final String key;
    private final String defaultValue;

    private StringParameter(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public static StringParameter keyAndDefault(String key, String defaultValue) {
        return new StringParameter(key, defaultValue);
    }

    String get(AppContext context) {
        String value = context.getStringOrDefault(key, defaultValue);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(key + " must not be empty");
        }
        return value;
    }

    public ContextValue value(String value) {
        return new ContextValue(key, value);
    }

    public String key() {
        return key;
    }

    public String defaultValue() {
        return defaultValue;
    }
}
