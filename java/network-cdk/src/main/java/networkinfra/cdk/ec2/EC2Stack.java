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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.Fn;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.services.ec2.CfnEIP;
import software.amazon.awscdk.services.ec2.CfnInstance;
import software.amazon.awscdk.services.ec2.CfnInstance.NetworkInterfaceProperty;
import software.amazon.awscdk.services.ec2.CfnKeyPair;
import software.amazon.awscdk.services.ec2.CfnNatGateway;
import software.amazon.awscdk.services.ec2.CfnRoute;
import software.amazon.awscdk.services.ec2.CfnSecurityGroup;
import software.constructs.Construct;

import networkinfra.cdk.config.AppContext;
import networkinfra.cdk.exports.ImportedNetwork;
import networkinfra.cdk.outputs.NetworkOutput;
import networkinfra.cdk.vpc.AvailabilityZones;

import java.util.List;

import static networkinfra.cdk.ec2.SecurityGroupRules.allIcmpFrom;
import static networkinfra.cdk.outputs.NetworkOutput.BASTION_PUBLIC_IP;
import static networkinfra.cdk.outputs.NetworkOutput.INSTANCE_ID;
import static networkinfra.cdk.outputs.NetworkOutput.INSTANCE_PUBLIC_IP;
import static networkinfra.cdk.outputs.NetworkOutput.NAT_GATEWAY_ID;
import static networkinfra.cdk.outputs.NetworkOutput.NAT_GATEWAY_PUBLIC_IP;
import static networkinfra.cdk.outputs.NetworkOutput.NAT_INSTANCE_ID;
import static networkinfra.cdk.outputs.NetworkOutput.NAT_INSTANCE_PUBLIC_IP;
import static networkinfra.cdk.outputs.NetworkOutput.PRIVATE_INSTANCE_PRIVATE_IP;
import static networkinfra.cdk.ec2.SecurityGroupRules.tcpFrom;
import static networkinfra.cdk.ec2.SecurityGroupRules.tcpFromGroup;
import static networkinfra.cdk.util.CfnTags.nameTag;

/**
 * Declares EC2 instances in a network exported by a VPC stack. Depending on the layout this is either a single
 * public instance, or a bastion host with a NAT instance giving egress to an instance in a private subnet.
 */
public class EC2Stack extends Stack {
    private static final Logger LOGGER = LoggerFactory.getLogger(EC2Stack.class);

    private static final String ANYWHERE = "0.0.0.0/0";

    private final EC2Parameters params;
    private final ImportedNetwork network;
    private final CfnKeyPair keyPair;
    private String amazonLinuxImageId;

    public EC2Stack(Construct scope, String id, StackProps props, ImportedNetwork network) {
        super(scope, id, props);
        this.params = EC2Parameters.from(AppContext.of(this));
        this.network = network;
        EC2Layout layout = params.layout();
        LOGGER.info("Declaring EC2 layout {} in network exported by stack {}", layout.getContextName(), network.getVpcStackName());
        if (params.isSshOpenToWorld()) {
            LOGGER.warn("SSH is allowed from {}, consider restricting it by setting sshAllowedCidr", params.sshAllowedCidr());
        }
        if (layout == EC2Layout.BASTION_NAT_GATEWAY && params.zones().count() < 2) {
            throw new IllegalArgumentException("EC2 layout " + layout.getContextName() +
                    " requires at least 2 availability zones, found " + params.zones().count());
        }

        keyPair = CfnKeyPair.Builder.create(this, "DemoKeyPair")
                .keyName(params.keyName())
                .build();

        switch (layout) {
            case INSTANCE:
                createPublicInstance();
                break;
            case BASTION_NAT_INSTANCE:
            case BASTION_NAT_GATEWAY:
                createBastionWithNat(layout);
                break;
            default:
                throw new IllegalArgumentException("Unrecognised EC2 layout: " + layout);
        }
    }

    private void createPublicInstance() {
        CfnSecurityGroup securityGroup = CfnSecurityGroup.Builder.create(this, "InstanceSecurityGroup")
                .groupDescription("Allow SSH access to the instance")
                .vpcId(network.getVpcId())
                .securityGroupIngress(List.of(tcpFrom(22, params.sshAllowedCidr())))
                .build();
        CfnInstance instance = instance("EC2Instance", amazonLinuxImageId(), network.getPublicSubnetId(0), true, securityGroup);

        output(INSTANCE_ID, instance.getRef());
        output(INSTANCE_PUBLIC_IP, instance.getAttrPublicIp());
    }

    private void createBastionWithNat(EC2Layout layout) {
        CfnSecurityGroup bastionSecurityGroup = CfnSecurityGroup.Builder.create(this, "BastionSecurityGroup")
                .groupName("BastionSecurityGroup")
                .groupDescription("Allow SSH access to the bastion host")
                .vpcId(network.getVpcId())
                .securityGroupIngress(List.of(tcpFrom(22, params.sshAllowedCidr())))
                .tags(nameTag("BastionSecurityGroup"))
                .build();
        CfnSecurityGroup privateSecurityGroup = CfnSecurityGroup.Builder.create(this, "PrivateInstanceSecurityGroup")
                .groupDescription("Allow SSH access from the bastion host")
                .vpcId(network.getVpcId())
                .securityGroupIngress(List.of(tcpFromGroup(22, bastionSecurityGroup.getAttrGroupId())))
                .tags(nameTag("PrivateInstanceSecurityGroup"))
                .build();
        CfnSecurityGroup natSecurityGroup = CfnSecurityGroup.Builder.create(this, "NatInstanceSecurityGroup")
                .groupName("NatInstanceSG")
                .groupDescription("Allow traffic from the VPC to be forwarded by the NAT instance")
                .vpcId(network.getVpcId())
                .securityGroupIngress(List.of(
                        tcpFrom(80, params.vpcCidr()),
                        tcpFrom(443, params.vpcCidr()),
                        allIcmpFrom(params.vpcCidr()),
                        tcpFrom(22, params.sshAllowedCidr())))
                .tags(nameTag("NatInstanceSG"))
                .build();

        CfnInstance natInstance = instance("NatInstance", params.image().natInstanceAmiId(),
                network.getPublicSubnetId(0), true, natSecurityGroup);
        // Forwarded packets are neither from nor to the NAT instance itself
        natInstance.setSourceDestCheck(false);
        natInstance.setUserData(Fn.base64(LoadUserDataUtil.natInstanceUserData(params)));
        CfnInstance bastion = instance("BastionHost", amazonLinuxImageId(),
                network.getPublicSubnetId(0), true, bastionSecurityGroup);
        CfnInstance privateInstance = instance("PrivateEC2Instance", amazonLinuxImageId(),
                network.getPrivateSubnetId(0), false, privateSecurityGroup);

        AvailabilityZones zones = params.zones();
        CfnNatGateway natGateway = null;
        if (layout == EC2Layout.BASTION_NAT_GATEWAY) {
            natGateway = createNatGateway(network.getPublicSubnetId(zones.count() - 1));
        }
        for (int i = 0; i < zones.count(); i++) {
            CfnRoute.Builder route = CfnRoute.Builder.create(this, "PrivateSubnet" + zones.label(i) + "NatRoute")
                    .routeTableId(network.getPrivateRouteTableId(i))
                    .destinationCidrBlock(ANYWHERE);
            if (natGateway == null || i == 0) {
                route.instanceId(natInstance.getRef());
            } else {
                route.natGatewayId(natGateway.getRef());
            }
            route.build();
        }

        output(BASTION_PUBLIC_IP, bastion.getAttrPublicIp());
        output(NAT_INSTANCE_PUBLIC_IP, natInstance.getAttrPublicIp());
        output(NAT_INSTANCE_ID, natInstance.getRef());
        output(PRIVATE_INSTANCE_PRIVATE_IP, privateInstance.getAttrPrivateIp());
    }

    private CfnNatGateway createNatGateway(String publicSubnetId) {
        CfnEIP eip = CfnEIP.Builder.create(this, "NatGatewayEIP")
                .domain("vpc")
                .build();
        CfnNatGateway natGateway = CfnNatGateway.Builder.create(this, "NatGateway")
                .subnetId(publicSubnetId)
                .allocationId(eip.getAttrAllocationId())
                .tags(nameTag("NatGateway"))
                .build();
        output(NAT_GATEWAY_ID, natGateway.getRef());
        output(NAT_GATEWAY_PUBLIC_IP, eip.getAttrPublicIp());
        return natGateway;
    }

    private CfnInstance instance(String id, String imageId, String subnetId, boolean publicIp, CfnSecurityGroup securityGroup) {
        return CfnInstance.Builder.create(this, id)
                .imageId(imageId)
                .instanceType(params.instanceType())
                .keyName(keyPair.getRef())
                .networkInterfaces(List.of(NetworkInterfaceProperty.builder()
                        .deviceIndex("0")
                        .subnetId(subnetId)
                        .associatePublicIpAddress(publicIp)
                        .deleteOnTermination(true)
                        .groupSet(List.of(securityGroup.getAttrGroupId()))
                        .build()))
                .tags(nameTag(id))
                .build();
    }

    private String amazonLinuxImageId() {
        if (amazonLinuxImageId == null) {
            amazonLinuxImageId = params.image().latestAmazonLinuxImageId(this);
        }
        return amazonLinuxImageId;
    }

    private void output(NetworkOutput output, String value) {
        CfnOutput.Builder.create(this, output.getKey())
                .value(value)
                .description(output.getDescription())
                .build();
    }

    public CfnKeyPair getKeyPair() {
        return keyPair;
    }
}
