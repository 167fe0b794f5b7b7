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
package networkinfra.cdk.config;

public class AppParameters {

    private AppParameters() {
    }

    public static final OptionalStringParameter ACCOUNT = OptionalStringParameter.key("account");
    public static final StringParameter REGION = StringParameter.keyAndDefault("region", "us-east-1");
    public static final BooleanParameter GENERATE_BOOTSTRAP_VERSION_RULE = BooleanParameter.keyAndDefault("generateBootstrapVersionRule", false);

    public static final StringParameter VPC_STACK_NAME = StringParameter.keyAndDefault("vpcStackName", "MyVpcStack");
    public static final StringParameter VPC_LAYOUT = StringParameter.keyAndDefault("vpcLayout", "manual");
    public static final StringParameter VPC_NAME = StringParameter.keyAndDefault("vpcName", "DemoVPC");
    public static final StringParameter VPC_CIDR = StringParameter.keyAndDefault("vpcCidr", "10.0.0.0/16");
    public static final StringListParameter AVAILABILITY_ZONE_SUFFIXES = StringListParameter.keyAndDefault("availabilityZoneSuffixes", "a", "b");
    public static final StringListParameter PUBLIC_SUBNET_CIDRS = StringListParameter.keyAndDefault("publicSubnetCidrs", "10.0.1.0/24", "10.0.2.0/24");
    public static final StringListParameter PRIVATE_SUBNET_CIDRS = StringListParameter.keyAndDefault("privateSubnetCidrs", "10.0.3.0/24", "10.0.4.0/24");
    public static final IntParameter SUBNET_CIDR_MASK = IntParameter.keyAndDefault("subnetCidrMask", 24);

    public static final BooleanParameter DEPLOY_EC2 = BooleanParameter.keyAndDefault("deployEc2", true);
    public static final StringParameter EC2_STACK_NAME = StringParameter.keyAndDefault("ec2StackName", "MyEC2Stack");
    public static final StringParameter EC2_LAYOUT = StringParameter.keyAndDefault("ec2Layout", "bastion-nat-instance");
    public static final StringParameter KEY_NAME = StringParameter.keyAndDefault("keyName", "demo-key-pair");
    public static final StringParameter INSTANCE_TYPE = StringParameter.keyAndDefault("instanceType", "t2.micro");
    // Amazon Linux 2 AMI (HVM) - Kernel 5.10, SSD Volume Type, us-east-1
    public static final StringParameter NAT_INSTANCE_AMI_ID = StringParameter.keyAndDefault("natInstanceAmiId", "ami-0c02fb55956c7d316");
    public static final StringParameter SSH_ALLOWED_CIDR = StringParameter.keyAndDefault("sshAllowedCidr", "0.0.0.0/0");
}
