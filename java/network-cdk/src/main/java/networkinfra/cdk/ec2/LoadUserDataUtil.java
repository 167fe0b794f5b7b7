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
package networkinfra.cdk.ec2;

import org.apache.commons.io.IOUtils;

import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

class LoadUserDataUtil {

    static final String NAT_INSTANCE_USER_DATA = "nat-instance-user-data.sh";

    private LoadUserDataUtil() {
        // Prevent instantiation
    }

    static String natInstanceUserData(EC2Parameters params) {
        return params.fillUserDataTemplate(resourceString(NAT_INSTANCE_USER_DATA));
    }

    static String resourceString(String resourcePath) {
        try {
            URL resource = Objects.requireNonNull(LoadUserDataUtil.class.getClassLoader().getResource(resourcePath));
            return IOUtils.toString(resource, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load " + resourcePath, e);
        }
    }
}
