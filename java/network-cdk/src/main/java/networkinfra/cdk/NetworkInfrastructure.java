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
package networkinfra.cdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awscdk.App;
import software.amazon.awscdk.DefaultStackSynthesizer;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;

import networkinfra.cdk.config.AppContext;
import networkinfra.cdk.ec2.EC2Layout;
import networkinfra.cdk.ec2.EC2Stack;
import networkinfra.cdk.exports.ImportedNetwork;
import networkinfra.cdk.vpc.VpcLayout;

import java.util.Optional;

import static networkinfra.cdk.config.AppParameters.DEPLOY_EC2;
import static networkinfra.cdk.config.AppParameters.EC2_STACK_NAME;
import static networkinfra.cdk.config.AppParameters.GENERATE_BOOTSTRAP_VERSION_RULE;
import static networkinfra.cdk.config.AppParameters.VPC_STACK_NAME;

/**
 * Declares the stacks of the app. The EC2 stack imports the network exported by the VPC stack, so it depends on
 * it.
 */
public class NetworkInfrastructure {
    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkInfrastructure.class);

    public static final String VPC_STACK_ID = "MyVpcStack";
    public static final String EC2_STACK_ID = "MyEC2Stack";

    private final Stack vpcStack;
    private final EC2Stack ec2Stack;

    private NetworkInfrastructure(Stack vpcStack, EC2Stack ec2Stack) {
        this.vpcStack = vpcStack;
        this.ec2Stack = ec2Stack;
    }

    public static NetworkInfrastructure create(App app, Environment environment) {
        AppContext context = AppContext.of(app);
        VpcLayout vpcLayout = VpcLayout.from(context);
        boolean deployEc2 = context.get(DEPLOY_EC2);
        EC2Layout ec2Layout = deployEc2 ? EC2Layout.from(context) : null;
        if (ec2Layout != null && ec2Layout.requiresPrivateSubnets() && !vpcLayout.exportsPrivateSubnets()) {
            throw new IllegalArgumentException("EC2 layout " + ec2Layout.getContextName() +
                    " requires private subnets, which are not declared by VPC layout " + vpcLayout.getContextName());
        }

        String vpcStackName = context.get(VPC_STACK_NAME);
        LOGGER.info("Declaring VPC stack {} with layout {}", vpcStackName, vpcLayout.getContextName());
        Stack vpcStack = vpcLayout.createStack(app, VPC_STACK_ID, stackProps(context, vpcStackName, environment));

        EC2Stack ec2Stack = null;
        if (deployEc2) {
            String ec2StackName = context.get(EC2_STACK_NAME);
            LOGGER.info("Declaring EC2 stack {} with layout {}", ec2StackName, ec2Layout.getContextName());
            ec2Stack = new EC2Stack(app, EC2_STACK_ID, stackProps(context, ec2StackName, environment),
                    ImportedNetwork.fromStack(vpcStackName));
            ec2Stack.addDependency(vpcStack);
        } else {
            LOGGER.info("Not declaring EC2 stack");
        }
        return new NetworkInfrastructure(vpcStack, ec2Stack);
    }

    private static StackProps stackProps(AppContext context, String stackName, Environment environment) {
        return StackProps.builder()
                .stackName(stackName)
                .env(environment)
                .synthesizer(DefaultStackSynthesizer.Builder.create()
                        .generateBootstrapVersionRule(context.get(GENERATE_BOOTSTRAP_VERSION_RULE))
                        .build())
                .build();
    }

    public Stack getVpcStack() {
        return vpcStack;
    }

    public Optional<EC2Stack> getEc2Stack() {
        return Optional.ofNullable(ec2Stack);
    }
}
