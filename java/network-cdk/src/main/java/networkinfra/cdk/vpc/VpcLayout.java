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
import software.constructs.Construct;

import networkinfra.cdk.config.AppContext;

import java.util.Arrays;

import static networkinfra.cdk.config.AppParameters.VPC_LAYOUT;

/**
 * The ways a VPC stack can be declared.
 */
public enum VpcLayout {
    /**
     * Every VPC component declared individually with L1 resources, with public and private subnets in each zone.
     */
    MANUAL("manual", true),
    /**
     * A VPC declared with the L2 construct, with only public subnets and no NAT gateways.
     */
    MANAGED("managed", false);

    private final String contextName;
    private final boolean exportsPrivateSubnets;

    VpcLayout(String contextName, boolean exportsPrivateSubnets) {
        this.contextName = contextName;
        this.exportsPrivateSubnets = exportsPrivateSubnets;
    }

    public static VpcLayout from(AppContext context) {
        String name = context.get(VPC_LAYOUT);
        return Arrays.stream(values())
                .filter(layout -> layout.contextName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(VPC_LAYOUT.key() + " must be one of " +
                        Arrays.stream(values()).map(VpcLayout::getContextName).toList() + ", found: " + name));
    }

    public Stack createStack(Construct scope, String id, StackProps props) {
        switch (this) {
            case MANUAL:
                return new ManualVpcStack(scope, id, props);
            case MANAGED:
                return new ManagedVpcStack(scope, id, props);
            default:
                throw new IllegalArgumentException("Unrecognised VPC layout: " + this);
        }
    }

    public String getContextName() {
        return contextName;
    }

    public boolean exportsPrivateSubnets() {
        return exportsPrivateSubnets;
    }
}
