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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

public class StringListParameter {

    private final String key;
    private final List<String> defaultValue;

    private StringListParameter(String key, List<String> defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public static StringListParameter key(String key) {
        return new StringListParameter(key, List.of());
    }

    public static StringListParameter keyAndDefault(String key, String... defaultValue) {
        return new StringListParameter(key, List.of(defaultValue));
    }

    List<String> get(AppContext context) {
        Object value = context.get(key);
        if (value == null) {
            return defaultValue;
        }
        Stream<String> items;
        if (value instanceof List<?> list) {
            items = list.stream().filter(Objects::nonNull).map(Object::toString);
        } else {
            items = Arrays.stream(value.toString().split(","));
        }
        return items.map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList();
    }

    public ContextValue value(String... values) {
        return new ContextValue(key, String.join(",", values));
    }

    public String key() {
        return key;
    }
}
