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

import software.amazon.awscdk.App;
import software.amazon.awscdk.AppProps;
import software.amazon.awscdk.Environment;

import networkinfra.cdk.config.AppContext;

import static networkinfra.cdk.config.AppParameters.ACCOUNT;
import static networkinfra.cdk.config.AppParameters.REGION;

/**
 * Deploys a VPC, and optionally EC2 instances in a separate stack that imports the network from the VPC stack.
 */
public class NetworkInfrastructureCdkApp {

    private NetworkInfrastructureCdkApp() {
    }

    public static void main(String[] args) {
        App app = new App(AppProps.builder()
                .analyticsReporting(false)
                .build());
        AppContext context = AppContext.of(app);
        Environment environment = Environment.builder()
                .account(context.get(ACCOUNT).orElseGet(() -> System.getenv("CDK_DEFAULT_ACCOUNT")))
                .region(context.get(REGION))
                .build();
        NetworkInfrastructure.create(app, environment);
        app.synth();
    }
}
