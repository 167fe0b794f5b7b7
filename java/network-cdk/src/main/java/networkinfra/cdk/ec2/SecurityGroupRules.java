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

import software.amazon.awscdk.services.ec2.CfnSecurityGroup.IngressProperty;

/**
 * Ingress rules for L1 security groups.
 */
class SecurityGroupRules {

    private SecurityGroupRules() {
    }

    static IngressProperty tcpFrom(int port, String cidr) {
        return IngressProperty.builder()
                .ipProtocol("tcp").fromPort(port).toPort(port)
                .cidrIp(cidr)
                .build();
    }

    static IngressProperty tcpFromGroup(int port, String securityGroupId) {
        return IngressProperty.builder()
                .ipProtocol("tcp").fromPort(port).toPort(port)
                .sourceSecurityGroupId(securityGroupId)
                .build();
    }

    // -1 covers every ICMP type and code
    static IngressProperty allIcmpFrom(String cidr) {
        return IngressProperty.builder()
                .ipProtocol("icmp").fromPort(-1).toPort(-1)
                .cidrIp(cidr)
                .build();
    }
}
