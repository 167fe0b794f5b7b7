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

import software.amazon.awscdk.Fn;

import static networkinfra.cdk.exports.NetworkExport.PRIVATE_ROUTE_TABLE_IDS;
import static networkinfra.cdk.exports.NetworkExport.PRIVATE_SUBNET_IDS;
import static networkinfra.cdk.exports.NetworkExport.PUBLIC_SUBNET_IDS;
import static networkinfra.cdk.exports.NetworkExport.VPC_ID;

/**
 * Refers to a network exported by a VPC stack in the same account and region. Each reference resolves to an
 * {@code Fn::ImportValue} in the template of the stack that uses it, so that stack must be deployed after the
 * VPC stack.
 */
public class ImportedNetwork {

    private final String vpcStackName;
    private final String vpcId;
    private final String publicSubnetIds;
    private final String privateSubnetIds;
    private final String privateRouteTableIds;

    private ImportedNetwork(String vpcStackName) {
        this.vpcStackName = vpcStackName;
        this.vpcId = importValue(vpcStackName, VPC_ID);
        this.publicSubnetIds = importValue(vpcStackName, PUBLIC_SUBNET_IDS);
        this.privateSubnetIds = importValue(vpcStackName, PRIVATE_SUBNET_IDS);
        this.privateRouteTableIds = importValue(vpcStackName, PRIVATE_ROUTE_TABLE_IDS);
    }

    public static ImportedNetwork fromStack(String vpcStackName) {
        return new ImportedNetwork(vpcStackName);
    }

    public String getVpcId() {
        return vpcId;
    }

    public String getPublicSubnetId(int index) {
        return NetworkExports.selectId(publicSubnetIds, index);
    }

    public String getPrivateSubnetId(int index) {
        return NetworkExports.selectId(privateSubnetIds, index);
    }

    public String getPrivateRouteTableId(int index) {
        return NetworkExports.selectId(privateRouteTableIds, index);
    }

    public String getVpcStackName() {
        return vpcStackName;
    }

    private static String importValue(String vpcStackName, NetworkExport export) {
        return Fn.importValue(export.exportName(vpcStackName));
    }
}
