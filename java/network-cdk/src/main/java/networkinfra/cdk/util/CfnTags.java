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
package networkinfra.cdk.util;

import software.amazon.awscdk.CfnTag;

import java.util.List;

/**
 * Tags for L1 resources, which do not pick up a name from their construct.
 */
public class CfnTags {

    private CfnTags() {
    }

    public static List<CfnTag> nameTag(String name) {
        return List.of(CfnTag.builder().key("Name").value(name).build());
    }
}
