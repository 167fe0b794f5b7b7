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
import networkinfra.cdk.config.AppParameters;
import networkinfra.cdk.config.StringParameter;
import networkinfra.cdk.vpc.AvailabilityZones;

public class EC2Parameters {

    public static final StringParameter KEY_NAME = AppParameters.KEY_NAME;
    public static final StringParameter INSTANCE_TYPE = AppParameters.INSTANCE_TYPE;
    public static final StringParameter SSH_ALLOWED_CIDR = AppParameters.SSH_ALLOWED_CIDR;
    public static final StringParameter VPC_CIDR = AppParameters.VPC_CIDR;

    private final EC2Layout layout;
    private final String keyName;
    private final String instanceType;
    private final String sshAllowedCidr;
    private final String vpcCidr;
    private final AvailabilityZones zones;
    private final EC2Image image;

    private EC2Parameters(AppContext context) {
        layout = EC2Layout.from(context);
        keyName = context.get(KEY_NAME);
        instanceType = context.get(INSTANCE_TYPE);
        sshAllowedCidr = context.get(SSH_ALLOWED_CIDR);
        vpcCidr = context.get(VPC_CIDR);
        zones = AvailabilityZones.from(context);
        image = EC2Image.from(context);
    }

    static EC2Parameters from(AppContext context) {
        return new EC2Parameters(context);
    }

    String fillUserDataTemplate(String template) {
        return template.replace("${vpcCidr}", vpcCidr);
    }

    boolean isSshOpenToWorld() {
        return "0.0.0.0/0".equals(sshAllowedCidr);
    }

    EC2Layout layout() {
        return layout;
    }

    String keyName() {
        return keyName;
    }

    String instanceType() {
        return instanceType;
    }

    String sshAllowedCidr() {
        return sshAllowedCidr;
    }

    String vpcCidr() {
        return vpcCidr;
    }

    AvailabilityZones zones() {
        return zones;
    }

    EC2Image image() {
        return image;
    }
}
