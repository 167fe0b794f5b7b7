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
package networkinfra.cdk.outputs;

import networkinfra.cdk.exports.NetworkExport;

/**
 * The outputs declared by the network stacks, by the stack that declares them.
 */
public enum NetworkOutput {
    VPC_ID(Source.VPC_STACK, NetworkExport.VPC_ID),
    PUBLIC_SUBNET_IDS(Source.VPC_STACK, NetworkExport.PUBLIC_SUBNET_IDS),
    PRIVATE_SUBNET_IDS(Source.VPC_STACK, NetworkExport.PRIVATE_SUBNET_IDS),
    PRIVATE_ROUTE_TABLE_IDS(Source.VPC_STACK, NetworkExport.PRIVATE_ROUTE_TABLE_IDS),
    INSTANCE_ID(Source.EC2_STACK, "InstanceId", "ID of the instance"),
    INSTANCE_PUBLIC_IP(Source.EC2_STACK, "InstancePublicIP", "Public IP address of the instance"),
    BASTION_PUBLIC_IP(Source.EC2_STACK, "BastionPublicIP", "Public IP address of the bastion host"),
    NAT_INSTANCE_PUBLIC_IP(Source.EC2_STACK, "NatInstancePublicIP", "Public IP address of the NAT instance"),
    NAT_INSTANCE_ID(Source.EC2_STACK, "NatInstanceId", "ID of the NAT instance"),
    PRIVATE_INSTANCE_PRIVATE_IP(Source.EC2_STACK, "PrivateInstancePrivateIP", "Private IP address of the private instance"),
    NAT_GATEWAY_ID(Source.EC2_STACK, "NatGatewayId", "ID of the NAT gateway"),
    NAT_GATEWAY_PUBLIC_IP(Source.EC2_STACK, "NatGatewayPublicIP", "Public IP address of the NAT gateway");

    /**
     * Which of the network stacks declares an output.
     */
    public enum Source {
        VPC_STACK, EC2_STACK
    }

    private final Source source;
    private final String key;
    private final String description;

    NetworkOutput(Source source, NetworkExport export) {
        this(source, export.getSuffix(), export.getDescription());
    }

    NetworkOutput(Source source, String key, String description) {
        this.source = source;
        this.key = key;
        this.description = description;
    }

    public Source getSource() {
        return source;
    }

    public String getKey() {
        return key;
    }

    public String getDescription() {
        return description;
    }
}
