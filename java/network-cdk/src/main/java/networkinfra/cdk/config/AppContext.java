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

import software.constructs.Construct;
import software.constructs.Node;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@FunctionalInterface
public interface AppContext {

    Object get(String key);

    default String get(StringParameter string) {
        return string.get(this);
    }

    default Optional<String> get(OptionalStringParameter string) {
        return string.get(this);
    }

    default int get(IntParameter integer) {
        return integer.get(this);
    }

    default boolean get(BooleanParameter bool) {
        return bool.get(this);
    }

    default List<String> get(StringListParameter list) {
        return list.get(this);
    }

    default String getStringOrDefault(String key, String defaultValue) {
        Object object = get(key);
        if (object instanceof String) {
            return (String) object;
        } else {
            return defaultValue;
        }
    }

    default Optional<String> getStringOpt(String key) {
        return Optional.ofNullable(getStringOrDefault(key, null));
    }

    static AppContext of(Construct scope) {
        return of(scope.getNode());
    }

    static AppContext of(Node node) {
        return node::tryGetContext;
    }

    static AppContext of(ContextValue... values) {
        Map<String, Object> map = new HashMap<>();
        for (ContextValue value : values) {
            map.put(value.key(), value.value());
        }
        return map::get;
    }

    static AppContext empty() {
        return key -> null;
    }
}
