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
package networkinfra.cdk.vpc;

import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.Tags;
import software.amazon.awscdk.services.ec2.ISubnet;
import software.amazon.awscdk.services.ec2.IpAddresses;
import software.amazon.awscdk.services.ec2.SubnetConfiguration;
import software.amazon.awscdk.services.ec2.SubnetType;
import software.amazon.awscdk.services.ec2.Vpc;
import software.constructs.Construct;

import networkinfra.cdk.config.AppContext;

import java.util.List;

import static networkinfra.cdk.config.AppParameters.SUBNET_CIDR_MASK;
import static networkinfra.cdk.config.AppParameters.VPC_CIDR;
import static networkinfra.cdk.config.AppParameters.VPC_NAME;
import static networkinfra.cdk.exports.NetworkExport.PUBLIC_SUBNET_IDS;
import static networkinfra.cdk.exports.NetworkExport.VPC_ID;
import static networkinfra.cdk.exports.NetworkExports.exportNetworkIds;
import static networkinfra.cdk.exports.NetworkExports.exportNetworkValue;

/**
 * A VPC with only public subnets, declared with the higher level construct.
 */
public class ManagedVpcStack extends Stack {

    private final Vpc vpc;

    public ManagedVpcStack(Construct scope, String id, StackProps props) {
        super(scope, id, props);
        AppContext context = AppContext.of(this);
        AvailabilityZones zones = AvailabilityZones.from(context);
        String vpcName = context.get(VPC_NAME);

        vpc = Vpc.Builder.create(this, "DemoVPC")
                .vpcName(vpcName)
                .ipAddresses(IpAddresses.cidr(context.get(VPC_CIDR)))
                .availabilityZones(zones.zoneNames(getRegion()))
                .natGateways(0)
                .subnetConfiguration(List.of(SubnetConfiguration.builder()
                        .name("Public")
                        .subnetType(SubnetType.PUBLIC)
                        .cidrMask(context.get(SUBNET_CIDR_MASK))
                        .build()))
                .enableDnsSupport(true)
                .enableDnsHostnames(false)
                .build();
        Tags.of(this).add("Name", vpcName);

        exportNetworkValue(this, VPC_ID, vpc.getVpcId());
        exportNetworkIds(this, PUBLIC_SUBNET_IDS, vpc.getPublicSubnets().stream().map(ISubnet::getSubnetId).toList());
    }

    public Vpc getVpc() {
        return vpc;
    }
}
