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

import software.amazon.awscdk.services.ec2.AmazonLinux2ImageSsmParameterProps;
import software.amazon.awscdk.services.ec2.AmazonLinuxCpuType;
import software.amazon.awscdk.services.ec2.MachineImage;
import software.constructs.Construct;

import networkinfra.cdk.config.AppContext;
import networkinfra.cdk.config.StringParameter;

import static networkinfra.cdk.config.AppParameters.NAT_INSTANCE_AMI_ID;

public class EC2Image {

    public static final StringParameter NAT_AMI_ID = NAT_INSTANCE_AMI_ID;

    private final String natInstanceAmiId;

    private EC2Image(AppContext context) {
        natInstanceAmiId = context.get(NAT_AMI_ID);
    }

    public static EC2Image from(AppContext context) {
        return new EC2Image(context);
    }

    /**
     * Finds the image ID of the latest Amazon Linux 2 release. This is resolved from a public SSM parameter at
     * deploy time, through a parameter of the stack.
     *
     * @param  scope the stack to add the parameter to
     * @return       the image ID
     */
    String latestAmazonLinuxImageId(Construct scope) {
        return MachineImage.latestAmazonLinux2(AmazonLinux2ImageSsmParameterProps.builder()
                .cpuType(AmazonLinuxCpuType.X86_64)
                .build())
                .getImage(scope).getImageId();
    }

    String natInstanceAmiId() {
        return natInstanceAmiId;
    }
}
