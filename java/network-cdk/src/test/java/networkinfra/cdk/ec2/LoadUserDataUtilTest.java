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

import org.junit.jupiter.api.Test;

import networkinfra.cdk.config.AppContext;

import static networkinfra.cdk.ec2.EC2Parameters.VPC_CIDR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadUserDataUtilTest {

    @Test
    void canLoadNatInstanceUserData() {
        assertThat(LoadUserDataUtil.natInstanceUserData(
                EC2Parameters.from(AppContext.of(VPC_CIDR.value("192.168.0.0/16")))))
                .startsWith("#!/bin/bash")
                .contains("sysctl -w net.ipv4.ip_forward=1")
                .contains("-s 192.168.0.0/16 -j MASQUERADE")
                .doesNotContain("${vpcCidr}");
    }

    @Test
    void failWhenResourceIsMissing() {
        assertThatThrownBy(() -> LoadUserDataUtil.resourceString("not-a-resource.sh"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Failed to load not-a-resource.sh")
                .hasCauseInstanceOf(NullPointerException.class);
    }
}
