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

import networkinfra.cdk.exports.NetworkExports;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The outputs of a deployed VPC stack and EC2 stack, read by what they mean rather than by stack and key.
 */
public class DeployedNetwork {

    public static final String LOGIN_USER = "ec2-user";

    private final StackOutputs outputs;
    private final String vpcStackName;
    private final String ec2StackName;

    private DeployedNetwork(StackOutputs outputs, String vpcStackName, String ec2StackName) {
        this.outputs = outputs;
        this.vpcStackName = vpcStackName;
        this.ec2StackName = ec2StackName;
    }

    public static DeployedNetwork from(StackOutputs outputs, String vpcStackName, String ec2StackName) {
        return new DeployedNetwork(outputs, vpcStackName, ec2StackName);
    }

    public Optional<String> get(NetworkOutput output) {
        return outputs.get(stackName(output.getSource()), output.getKey());
    }

    public StackOutputs getStackOutputs() {
        return outputs;
    }

    public boolean isDeployed(NetworkOutput.Source source) {
        return outputs.isDeployed(stackName(source));
    }

    public List<String> getPublicSubnetIds() {
        return splitIds(NetworkOutput.PUBLIC_SUBNET_IDS);
    }

    public List<String> getPrivateSubnetIds() {
        return splitIds(NetworkOutput.PRIVATE_SUBNET_IDS);
    }

    /**
     * Builds an SSH command that reaches the private instance by jumping through the bastion host. Only available
     * for the layouts with a bastion host, once the EC2 stack is deployed.
     *
     * @return the command, if the bastion and private instance are deployed
     */
    public Optional<String> sshToPrivateInstanceCommand() {
        return get(NetworkOutput.BASTION_PUBLIC_IP).flatMap(bastionIp -> get(NetworkOutput.PRIVATE_INSTANCE_PRIVATE_IP)
                .map(privateIp -> "ssh -J " + LOGIN_USER + "@" + bastionIp + " " + LOGIN_USER + "@" + privateIp));
    }

    private List<String> splitIds(NetworkOutput output) {
        return get(output)
                .map(ids -> Arrays.stream(ids.split(NetworkExports.ID_DELIMITER)).toList())
                .orElse(List.of());
    }

    private String stackName(NetworkOutput.Source source) {
        switch (source) {
            case VPC_STACK:
                return vpcStackName;
            case EC2_STACK:
                return ec2StackName;
            default:
                throw new IllegalArgumentException("Unrecognised stack: " + source);
        }
    }
}
