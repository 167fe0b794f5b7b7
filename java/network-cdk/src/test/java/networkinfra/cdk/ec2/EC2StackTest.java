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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import software.amazon.awscdk.App;
import software.amazon.awscdk.assertions.Match;
import software.amazon.awscdk.assertions.Template;

import networkinfra.cdk.config.ContextValue;
import networkinfra.cdk.exports.ImportedNetwork;

import java.util.List;
import java.util.Map;

import static networkinfra.cdk.config.AppParameters.AVAILABILITY_ZONE_SUFFIXES;
import static networkinfra.cdk.config.AppParameters.EC2_LAYOUT;
import static networkinfra.cdk.config.AppParameters.INSTANCE_TYPE;
import static networkinfra.cdk.config.AppParameters.KEY_NAME;
import static networkinfra.cdk.config.AppParameters.PRIVATE_SUBNET_CIDRS;
import static networkinfra.cdk.config.AppParameters.PUBLIC_SUBNET_CIDRS;
import static networkinfra.cdk.config.AppParameters.SSH_ALLOWED_CIDR;
import static networkinfra.cdk.testutil.NetworkTestHelper.getAtt;
import static networkinfra.cdk.testutil.NetworkTestHelper.importedId;
import static networkinfra.cdk.testutil.NetworkTestHelper.nameTag;
import static networkinfra.cdk.testutil.NetworkTestHelper.ref;
import static networkinfra.cdk.testutil.NetworkTestHelper.testApp;
import static networkinfra.cdk.testutil.NetworkTestHelper.testStackProps;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EC2StackTest {

    private static final String AMAZON_LINUX_IMAGE_PARAMETER_TYPE = "AWS::SSM::Parameter::Value<AWS::EC2::Image::Id>";

    @Nested
    class DeclareSingleInstance {

        @Test
        void shouldDeclarePublicInstanceWithKeyPair() {
            // When
            Template template = templateWithContext(EC2_LAYOUT.value("instance"));

            // Then
            template.resourceCountIs("AWS::EC2::Instance", 1);
            template.resourceCountIs("AWS::EC2::SecurityGroup", 1);
            template.resourceCountIs("AWS::EC2::Route", 0);
            template.hasResourceProperties("AWS::EC2::KeyPair", Map.of("KeyName", "demo-key-pair"));
            template.hasResourceProperties("AWS::EC2::Instance", Map.of(
                    "InstanceType", "t2.micro",
                    "KeyName", ref("DemoKeyPair"),
                    "NetworkInterfaces", List.of(Map.of(
                            "DeviceIndex", "0",
                            "AssociatePublicIpAddress", true,
                            "DeleteOnTermination", true,
                            "SubnetId", importedId("MyVpcStack-PublicSubnetIds", 0),
                            "GroupSet", List.of(getAtt("InstanceSecurityGroup", "GroupId")))),
                    "Tags", nameTag("EC2Instance")));
        }

        @Test
        void shouldAllowSshFromConfiguredCidr() {
            // When
            Template template = templateWithContext(
                    EC2_LAYOUT.value("instance"), SSH_ALLOWED_CIDR.value("203.0.113.0/24"));

            // Then
            template.hasResourceProperties("AWS::EC2::SecurityGroup", Map.of(
                    "VpcId", Map.of("Fn::ImportValue", "MyVpcStack-VpcId"),
                    "SecurityGroupIngress", List.of(Map.of(
                            "IpProtocol", "tcp", "FromPort", 22, "ToPort", 22, "CidrIp", "203.0.113.0/24"))));
        }

        @Test
        void shouldUseLatestAmazonLinuxImage() {
            // When
            Template template = templateWithContext(EC2_LAYOUT.value("instance"));

            // Then
            assertThat(template.findParameters("*", Map.of("Type", AMAZON_LINUX_IMAGE_PARAMETER_TYPE)))
                    .hasSize(1);
        }

        @Test
        void shouldOutputInstanceIdAndPublicIp() {
            // When
            Template template = templateWithContext(EC2_LAYOUT.value("instance"));

            // Then
            assertThat(template.findOutputs("*").keySet())
                    .containsExactlyInAnyOrder("InstanceId", "InstancePublicIP");
            template.hasOutput("InstanceId", Map.of("Value", ref("EC2Instance")));
            template.hasOutput("InstancePublicIP", Map.of("Value", getAtt("EC2Instance", "PublicIp")));
        }
    }

    @Nested
    class DeclareBastionWithNatInstance {

        @Test
        void shouldDeclareBastionNatAndPrivateInstances() {
            // When
            Template template = templateWithContext();

            // Then
            template.resourceCountIs("AWS::EC2::Instance", 3);
            template.resourceCountIs("AWS::EC2::SecurityGroup", 3);
            template.resourceCountIs("AWS::EC2::KeyPair", 1);
            template.resourceCountIs("AWS::EC2::NatGateway", 0);
            assertThat(template.findResources("AWS::EC2::Instance").keySet())
                    .containsExactlyInAnyOrder("NatInstance", "BastionHost", "PrivateEC2Instance");
            assertThat(template.findParameters("*", Map.of("Type", AMAZON_LINUX_IMAGE_PARAMETER_TYPE)))
                    .hasSize(1);
        }

        @Test
        void shouldPlacePrivateInstanceInPrivateSubnet() {
            // When
            Template template = templateWithContext(INSTANCE_TYPE.value("t3.small"));

            // Then
            template.hasResourceProperties("AWS::EC2::Instance", Map.of(
                    "InstanceType", "t3.small",
                    "NetworkInterfaces", List.of(Map.of(
                            "DeviceIndex", "0",
                            "AssociatePublicIpAddress", false,
                            "DeleteOnTermination", true,
                            "SubnetId", importedId("MyVpcStack-PrivateSubnetIds", 0),
                            "GroupSet", List.of(getAtt("PrivateInstanceSecurityGroup", "GroupId")))),
                    "Tags", nameTag("PrivateEC2Instance")));
        }

        @Test
        void shouldConfigureNatInstanceToForwardTraffic() {
            // When
            Template template = templateWithContext();

            // Then
            template.hasResourceProperties("AWS::EC2::Instance", Map.of(
                    "ImageId", "ami-0c02fb55956c7d316",
                    "SourceDestCheck", false,
                    "UserData", Map.of("Fn::Base64", Match.stringLikeRegexp("-s 10\\.0\\.0\\.0/16 -j MASQUERADE")),
                    "NetworkInterfaces", List.of(Match.objectLike(Map.of(
                            "AssociatePublicIpAddress", true,
                            "SubnetId", importedId("MyVpcStack-PublicSubnetIds", 0)))),
                    "Tags", nameTag("NatInstance")));
        }

        @Test
        void shouldOnlyAllowSshToPrivateInstanceFromBastion() {
            // When
            Template template = templateWithContext();

            // Then
            template.hasResourceProperties("AWS::EC2::SecurityGroup", Map.of(
                    "GroupName", "BastionSecurityGroup",
                    "SecurityGroupIngress", List.of(Map.of(
                            "IpProtocol", "tcp", "FromPort", 22, "ToPort", 22, "CidrIp", "0.0.0.0/0"))));
            template.hasResourceProperties("AWS::EC2::SecurityGroup", Map.of(
                    "SecurityGroupIngress", List.of(Map.of(
                            "IpProtocol", "tcp", "FromPort", 22, "ToPort", 22,
                            "SourceSecurityGroupId", getAtt("BastionSecurityGroup", "GroupId"))),
                    "Tags", nameTag("PrivateInstanceSecurityGroup")));
        }

        @Test
        void shouldAllowWebAndIcmpFromVpcToNatInstance() {
            // When
            Template template = templateWithContext(SSH_ALLOWED_CIDR.value("198.51.100.7/32"));

            // Then
            template.hasResourceProperties("AWS::EC2::SecurityGroup", Map.of(
                    "GroupName", "NatInstanceSG",
                    "SecurityGroupIngress", List.of(
                            Map.of("IpProtocol", "tcp", "FromPort", 80, "ToPort", 80, "CidrIp", "10.0.0.0/16"),
                            Map.of("IpProtocol", "tcp", "FromPort", 443, "ToPort", 443, "CidrIp", "10.0.0.0/16"),
                            Map.of("IpProtocol", "icmp", "FromPort", -1, "ToPort", -1, "CidrIp", "10.0.0.0/16"),
                            Map.of("IpProtocol", "tcp", "FromPort", 22, "ToPort", 22, "CidrIp", "198.51.100.7/32"))));
        }

        @Test
        void shouldRouteEveryPrivateSubnetThroughNatInstance() {
            // When
            Template template = templateWithContext();

            // Then
            template.resourceCountIs("AWS::EC2::Route", 2);
            assertThat(template.findResources("AWS::EC2::Route").keySet())
                    .containsExactlyInAnyOrder("PrivateSubnetANatRoute", "PrivateSubnetBNatRoute");
            template.hasResourceProperties("AWS::EC2::Route", Map.of(
                    "RouteTableId", importedId("MyVpcStack-PrivateRouteTableIds", 0),
                    "DestinationCidrBlock", "0.0.0.0/0",
                    "InstanceId", ref("NatInstance")));
            template.hasResourceProperties("AWS::EC2::Route", Map.of(
                    "RouteTableId", importedId("MyVpcStack-PrivateRouteTableIds", 1),
                    "DestinationCidrBlock", "0.0.0.0/0",
                    "InstanceId", ref("NatInstance")));
        }

        @Test
        void shouldOutputAddressesOfInstances() {
            // When
            Template template = templateWithContext();

            // Then
            assertThat(template.findOutputs("*").keySet())
                    .containsExactlyInAnyOrder("BastionPublicIP", "NatInstancePublicIP", "NatInstanceId", "PrivateInstancePrivateIP");
            template.hasOutput("BastionPublicIP", Map.of("Value", getAtt("BastionHost", "PublicIp")));
            template.hasOutput("NatInstanceId", Map.of("Value", ref("NatInstance")));
            template.hasOutput("PrivateInstancePrivateIP", Map.of("Value", getAtt("PrivateEC2Instance", "PrivateIp")));
        }

        @Test
        void shouldUseConfiguredKeyName() {
            // When
            Template template = templateWithContext(KEY_NAME.value("test-key"));

            // Then
            template.hasResourceProperties("AWS::EC2::KeyPair", Map.of("KeyName", "test-key"));
        }
    }

    @Nested
    class DeclareBastionWithNatGateway {

        @Test
        void shouldRouteFirstZoneThroughNatInstanceAndOthersThroughGateway() {
            // When
            Template template = templateWithContext(EC2_LAYOUT.value("bastion-nat-gateway"));

            // Then
            template.hasResourceProperties("AWS::EC2::Route", Map.of(
                    "RouteTableId", importedId("MyVpcStack-PrivateRouteTableIds", 0),
                    "InstanceId", ref("NatInstance")));
            template.hasResourceProperties("AWS::EC2::Route", Map.of(
                    "RouteTableId", importedId("MyVpcStack-PrivateRouteTableIds", 1),
                    "NatGatewayId", ref("NatGateway")));
        }

        @Test
        void shouldPlaceNatGatewayInLastPublicSubnet() {
            // When
            Template template = templateWithContext(EC2_LAYOUT.value("bastion-nat-gateway"),
                    AVAILABILITY_ZONE_SUFFIXES.value("a", "b", "c"),
                    PUBLIC_SUBNET_CIDRS.value("10.0.1.0/24", "10.0.2.0/24", "10.0.5.0/24"),
                    PRIVATE_SUBNET_CIDRS.value("10.0.3.0/24", "10.0.4.0/24", "10.0.6.0/24"));

            // Then
            template.resourceCountIs("AWS::EC2::NatGateway", 1);
            template.resourceCountIs("AWS::EC2::Route", 3);
            template.hasResourceProperties("AWS::EC2::EIP", Map.of("Domain", "vpc"));
            template.hasResourceProperties("AWS::EC2::NatGateway", Map.of(
                    "SubnetId", importedId("MyVpcStack-PublicSubnetIds", 2),
                    "AllocationId", getAtt("NatGatewayEIP", "AllocationId")));
            template.hasResourceProperties("AWS::EC2::Route", Map.of(
                    "RouteTableId", importedId("MyVpcStack-PrivateRouteTableIds", 2),
                    "NatGatewayId", ref("NatGateway")));
        }

        @Test
        void shouldRouteEachZoneWithoutSubnetCidrs() {
            // When
            Template template = templateWithContext(EC2_LAYOUT.value("bastion-nat-gateway"),
                    AVAILABILITY_ZONE_SUFFIXES.value("a", "b", "c"));

            // Then
            assertThat(template.findResources("AWS::EC2::Route").keySet())
                    .containsExactlyInAnyOrder("PrivateSubnetANatRoute", "PrivateSubnetBNatRoute", "PrivateSubnetCNatRoute");
        }

        @Test
        void shouldOutputNatGatewayAlongsideInstances() {
            // When
            Template template = templateWithContext(EC2_LAYOUT.value("bastion-nat-gateway"));

            // Then
            assertThat(template.findOutputs("*").keySet())
                    .containsExactlyInAnyOrder("BastionPublicIP", "NatInstancePublicIP", "NatInstanceId",
                            "PrivateInstancePrivateIP", "NatGatewayId", "NatGatewayPublicIP");
            template.hasOutput("NatGatewayPublicIP", Map.of("Value", getAtt("NatGatewayEIP", "PublicIp")));
        }

        @Test
        void shouldRefuseSingleZone() {
            // Given
            App app = testApp(EC2_LAYOUT.value("bastion-nat-gateway"),
                    AVAILABILITY_ZONE_SUFFIXES.value("a"),
                    PUBLIC_SUBNET_CIDRS.value("10.0.1.0/24"),
                    PRIVATE_SUBNET_CIDRS.value("10.0.3.0/24"));

            // When / Then
            assertThatThrownBy(() -> createStack(app))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("EC2 layout bastion-nat-gateway requires at least 2 availability zones, found 1");
        }
    }

    private static Template templateWithContext(ContextValue... values) {
        return Template.fromStack(createStack(testApp(values)));
    }

    private static EC2Stack createStack(App app) {
        return new EC2Stack(app, "MyEC2Stack", testStackProps("MyEC2Stack"), ImportedNetwork.fromStack("MyVpcStack"));
    }
}
