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

import networkinfra.cdk.config.AppContext;

import java.util.Arrays;

import static networkinfra.cdk.config.AppParameters.EC2_LAYOUT;

/**
 * The sets of instances an EC2 stack can declare.
 */
public enum EC2Layout {
    /**
     * A single instance in a public subnet.
     */
    INSTANCE("instance", false),
    /**
     * A bastion host and a NAT instance in a public subnet, and an instance in a private subnet. Every private
     * subnet routes its outbound traffic through the NAT instance.
     */
    BASTION_NAT_INSTANCE("bastion-nat-instance", true),
    /**
     * The same instances as {@link #BASTION_NAT_INSTANCE}, but only the first private subnet routes through the
     * NAT instance. The rest route through a managed NAT gateway.
     */
    BASTION_NAT_GATEWAY("bastion-nat-gateway", true);

    private final String contextName;
    private final boolean requiresPrivateSubnets;

    EC2Layout(String contextName, boolean requiresPrivateSubnets) {
        this.contextName = contextName;
        this.requiresPrivateSubnets = requiresPrivateSubnets;
    }

    public static EC2Layout from(AppContext context) {
        String name = context.get(EC2_LAYOUT);
        return Arrays.stream(values())
                .filter(layout -> layout.contextName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(EC2_LAYOUT.key() + " must be one of " +
                        Arrays.stream(values()).map(EC2Layout::getContextName).toList() + ", found: " + name));
    }

    public String getContextName() {
        return contextName;
    }

    public boolean requiresPrivateSubnets() {
        return requiresPrivateSubnets;
    }
}
