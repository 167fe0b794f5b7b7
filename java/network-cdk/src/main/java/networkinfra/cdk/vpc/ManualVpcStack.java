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
import software.amazon.awscdk.services.ec2.CfnInternetGateway;
import software.amazon.awscdk.services.ec2.CfnRoute;
import software.amazon.awscdk.services.ec2.CfnRouteTable;
import software.amazon.awscdk.services.ec2.CfnSubnet;
import software.amazon.awscdk.services.ec2.CfnSubnetRouteTableAssociation;
import software.amazon.awscdk.services.ec2.CfnVPC;
import software.amazon.awscdk.services.ec2.CfnVPCGatewayAttachment;
import software.constructs.Construct;

import networkinfra.cdk.config.AppContext;

import java.util.ArrayList;
import java.util.List;

import static networkinfra.cdk.config.AppParameters.VPC_CIDR;
import static networkinfra.cdk.config.AppParameters.VPC_NAME;
import static networkinfra.cdk.exports.NetworkExport.PRIVATE_ROUTE_TABLE_IDS;
import static networkinfra.cdk.exports.NetworkExport.PRIVATE_SUBNET_IDS;
import static networkinfra.cdk.exports.NetworkExport.PUBLIC_SUBNET_IDS;
import static networkinfra.cdk.exports.NetworkExport.VPC_ID;
import static networkinfra.cdk.exports.NetworkExports.exportNetworkIds;
import static networkinfra.cdk.exports.NetworkExports.exportNetworkValue;
import static networkinfra.cdk.util.CfnTags.nameTag;

/**
 * A VPC declared one resource at a time. Each availability zone gets a public subnet routed through an internet
 * gateway, and a private subnet with its own route table. The private route tables have no default route. Egress
 * from the private subnets is added by whatever stack provides NAT.
 */
public class ManualVpcStack extends Stack {

    private final CfnVPC vpc;
    private final List<CfnSubnet> publicSubnets = new ArrayList<>();
    private final List<CfnSubnet> privateSubnets = new ArrayList<>();
    private final List<CfnRouteTable> privateRouteTables = new ArrayList<>();

    public ManualVpcStack(Construct scope, String id, StackProps props) {
        super(scope, id, props);
        AppContext context = AppContext.of(this);
        AvailabilityZones zones = AvailabilityZones.from(context);
        SubnetCidrs cidrs = SubnetCidrs.from(context, zones);

        vpc = CfnVPC.Builder.create(this, "DemoVPC")
                .cidrBlock(context.get(VPC_CIDR))
                .enableDnsSupport(true)
                .enableDnsHostnames(true)
                .instanceTenancy("default")
                .tags(nameTag(context.get(VPC_NAME)))
                .build();

        CfnInternetGateway internetGateway = CfnInternetGateway.Builder.create(this, "DemoIGW")
                .tags(nameTag("DemoIGW"))
                .build();
        CfnVPCGatewayAttachment attachment = CfnVPCGatewayAttachment.Builder.create(this, "IGWAttachment")
                .vpcId(vpc.getRef())
                .internetGatewayId(internetGateway.getRef())
                .build();

        for (int i = 0; i < zones.count(); i++) {
            String label = zones.label(i);
            String zoneName = zones.zoneName(getRegion(), i);
            publicSubnets.add(CfnSubnet.Builder.create(this, "PublicSubnet" + label)
                    .vpcId(vpc.getRef())
                    .cidrBlock(cidrs.publicSubnetCidr(i))
                    .availabilityZone(zoneName)
                    .mapPublicIpOnLaunch(true)
                    .tags(nameTag("Public Subnet " + label))
                    .build());
            privateSubnets.add(CfnSubnet.Builder.create(this, "PrivateSubnet" + label)
                    .vpcId(vpc.getRef())
                    .cidrBlock(cidrs.privateSubnetCidr(i))
                    .availabilityZone(zoneName)
                    .mapPublicIpOnLaunch(false)
                    .tags(nameTag("Private Subnet " + label))
                    .build());
        }

        CfnRouteTable publicRouteTable = CfnRouteTable.Builder.create(this, "PublicRouteTable")
                .vpcId(vpc.getRef())
                .tags(nameTag("Public Route Table"))
                .build();
        CfnRoute publicRoute = CfnRoute.Builder.create(this, "PublicRoute")
                .routeTableId(publicRouteTable.getRef())
                .destinationCidrBlock("0.0.0.0/0")
                .gatewayId(internetGateway.getRef())
                .build();
        // A route to an internet gateway fails until the gateway is attached
        publicRoute.addDependency(attachment);

        for (int i = 0; i < zones.count(); i++) {
            String label = zones.label(i);
            privateRouteTables.add(CfnRouteTable.Builder.create(this, "PrivateRouteTable" + label)
                    .vpcId(vpc.getRef())
                    .tags(nameTag("Private Route Table " + label))
                    .build());
            associate("PublicSubnet" + label, publicSubnets.get(i), publicRouteTable);
            associate("PrivateSubnet" + label, privateSubnets.get(i), privateRouteTables.get(i));
        }

        exportNetworkValue(this, VPC_ID, vpc.getRef());
        exportNetworkIds(this, PUBLIC_SUBNET_IDS, refs(publicSubnets));
        exportNetworkIds(this, PRIVATE_SUBNET_IDS, refs(privateSubnets));
        exportNetworkIds(this, PRIVATE_ROUTE_TABLE_IDS, privateRouteTables.stream().map(CfnRouteTable::getRef).toList());
    }

    private void associate(String subnetId, CfnSubnet subnet, CfnRouteTable routeTable) {
        CfnSubnetRouteTableAssociation.Builder.create(this, subnetId + "RouteTableAssociation")
                .subnetId(subnet.getRef())
                .routeTableId(routeTable.getRef())
                .build();
    }

    private static List<String> refs(List<CfnSubnet> subnets) {
        return subnets.stream().map(CfnSubnet::getRef).toList();
    }

    public CfnVPC getVpc() {
        return vpc;
    }

    public List<CfnSubnet> getPublicSubnets() {
        return publicSubnets;
    }

    public List<CfnSubnet> getPrivateSubnets() {
        return privateSubnets;
    }

    public List<CfnRouteTable> getPrivateRouteTables() {
        return privateRouteTables;
    }
}
