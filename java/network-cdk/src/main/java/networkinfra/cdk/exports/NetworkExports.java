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
package networkinfra.cdk.exports;

import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.Fn;
import software.amazon.awscdk.Stack;

import java.util.List;

public class NetworkExports {

    public static final String ID_DELIMITER = ",";

    private NetworkExports() {
    }

    public static CfnOutput exportNetworkValue(Stack stack, NetworkExport export, String value) {
        return CfnOutput.Builder.create(stack, export.getSuffix())
                .description(export.getDescription())
                .value(value)
                .exportName(export.exportName(stack.getStackName()))
                .build();
    }

    public static CfnOutput exportNetworkIds(Stack stack, NetworkExport export, List<String> ids) {
        return exportNetworkValue(stack, export, joinIds(ids));
    }

    public static String joinIds(List<String> ids) {
        return Fn.join(ID_DELIMITER, ids);
    }

    public static String selectId(String joinedIds, int index) {
        return Fn.select(index, Fn.split(ID_DELIMITER, joinedIds));
    }
}
