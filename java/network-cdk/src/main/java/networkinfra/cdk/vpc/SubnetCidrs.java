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

import networkinfra.cdk.config.AppContext;
import networkinfra.cdk.config.StringListParameter;

import java.util.List;

import static networkinfra.cdk.config.AppParameters.PRIVATE_SUBNET_CIDRS;
import static networkinfra.cdk.config.AppParameters.PUBLIC_SUBNET_CIDRS;

/**
 * Explicit CIDRs for a public and a private subnet in each availability zone, for a VPC declared one subnet at a
 * time.
 */
public class SubnetCidrs {

    private final List<String> publicSubnetCidrs;
    private final List<String> privateSubnetCidrs;

    private SubnetCidrs(AvailabilityZones zones, List<String> publicSubnetCidrs, List<String> privateSubnetCidrs) {
        this.publicSubnetCidrs = requireOnePerZone(PUBLIC_SUBNET_CIDRS, publicSubnetCidrs, zones);
        this.privateSubnetCidrs = requireOnePerZone(PRIVATE_SUBNET_CIDRS, privateSubnetCidrs, zones);
    }

    public static SubnetCidrs from(AppContext context, AvailabilityZones zones) {
        return new SubnetCidrs(zones, context.get(PUBLIC_SUBNET_CIDRS), context.get(PRIVATE_SUBNET_CIDRS));
    }

    public String publicSubnetCidr(int index) {
        return publicSubnetCidrs.get(index);
    }

    public String privateSubnetCidr(int index) {
        return privateSubnetCidrs.get(index);
    }

    private static List<String> requireOnePerZone(StringListParameter parameter, List<String> cidrs, AvailabilityZones zones) {
        if (cidrs.size() != zones.count()) {
            throw new IllegalArgumentException(parameter.key() + " must contain one CIDR for each availability zone " +
                    zones.suffixes() + ", found: " + cidrs);
        }
        return cidrs;
    }
}
