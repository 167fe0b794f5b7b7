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
package networkinfra.cdk.exports;

/**
 * Values a VPC stack publishes for other stacks to import. Each is exported under the name
 * {@code <VPC stack name>-<suffix>}. Lists of IDs are joined with commas, in availability zone order.
 */
public enum NetworkExport {
    VPC_ID("VpcId", "ID of the VPC"),
    PUBLIC_SUBNET_IDS("PublicSubnetIds", "IDs of the public subnets, comma separated"),
    PRIVATE_SUBNET_IDS("PrivateSubnetIds", "IDs of the private subnets, comma separated"),
    PRIVATE_ROUTE_TABLE_IDS("PrivateRouteTableIds", "IDs of the private route tables, comma separated, one per private subnet");

    private final String suffix;
    private final String description;

    NetworkExport(String suffix, String description) {
        this.suffix = suffix;
        this.description = description;
    }

    public String exportName(String stackName) {
        return stackName + "-" + suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getDescription() {
        return description;
    }
}
