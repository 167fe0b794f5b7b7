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

import software.amazon.awssdk.services.cloudformation.CloudFormationClient;

import java.io.PrintStream;
import java.util.List;

import static networkinfra.cdk.config.AppParameters.EC2_STACK_NAME;
import static networkinfra.cdk.config.AppParameters.VPC_STACK_NAME;

/**
 * Prints the outputs of a deployed network, such as the public IP of the bastion host. Takes the VPC stack name and
 * the EC2 stack name as arguments, defaulting to the default names of each stack.
 */
public class PrintStackOutputs {

    private PrintStackOutputs() {
    }

    public static void main(String[] args) {
        List<String> stackNames = stackNames(args);
        String vpcStackName = stackNames.get(0);
        String ec2StackName = stackNames.get(1);
        try (CloudFormationClient cloudFormation = CloudFormationClient.create()) {
            StackOutputs outputs = StackOutputs.load(cloudFormation, stackNames);
            print(DeployedNetwork.from(outputs, vpcStackName, ec2StackName), System.out);
        }
    }

    static List<String> stackNames(String[] args) {
        if (args.length > 2) {
            throw new IllegalArgumentException("Usage: [<vpc stack name> [<ec2 stack name>]]");
        }
        return List.of(
                args.length > 0 ? args[0] : VPC_STACK_NAME.defaultValue(),
                args.length > 1 ? args[1] : EC2_STACK_NAME.defaultValue());
    }

    static void print(DeployedNetwork network, PrintStream out) {
        if (!network.isDeployed(NetworkOutput.Source.VPC_STACK)) {
            out.println("VPC stack is not deployed");
        }
        network.getStackOutputs().toLines().forEach(out::println);
        network.sshToPrivateInstanceCommand()
                .ifPresent(command -> out.println("Connect to the private instance with: " + command));
    }
}
