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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.CloudFormationException;
import software.amazon.awssdk.services.cloudformation.model.Output;
import software.amazon.awssdk.services.cloudformation.model.Stack;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The outputs of deployed CloudFormation stacks, sorted by stack name then output key. A stack that has not been
 * deployed has no entry.
 */
public class StackOutputs {
    private static final Logger LOGGER = LoggerFactory.getLogger(StackOutputs.class);

    private static final String STACK_MISSING_ERROR_CODE = "ValidationError";
    private static final String STACK_MISSING_MESSAGE_SUFFIX = "does not exist";

    private final SortedMap<String, SortedMap<String, String>> outputsByStackName;

    private StackOutputs(SortedMap<String, SortedMap<String, String>> outputsByStackName) {
        this.outputsByStackName = outputsByStackName;
    }

    /**
     * Retrieves the outputs of the given stacks. A stack that does not exist is left out. Any other failure to
     * describe a stack is thrown.
     *
     * @param  cloudFormation the CloudFormation client
     * @param  stackNames     the names of the stacks
     * @return                the outputs of each deployed stack
     */
    public static StackOutputs load(CloudFormationClient cloudFormation, List<String> stackNames) {
        SortedMap<String, SortedMap<String, String>> outputs = new TreeMap<>();
        for (String stackName : stackNames) {
            describeStack(cloudFormation, stackName)
                    .ifPresent(stack -> outputs.put(stackName, outputsOf(stack.outputs())));
        }
        return new StackOutputs(outputs);
    }

    public static StackOutputs fromMap(Map<String, Map<String, String>> outputsByStackName) {
        SortedMap<String, SortedMap<String, String>> outputs = new TreeMap<>();
        outputsByStackName.forEach((stackName, stackOutputs) -> outputs.put(stackName, new TreeMap<>(stackOutputs)));
        return new StackOutputs(outputs);
    }

    private static Optional<Stack> describeStack(CloudFormationClient cloudFormation, String stackName) {
        try {
            return cloudFormation.describeStacks(builder -> builder.stackName(stackName))
                    .stacks().stream().findFirst();
        } catch (CloudFormationException e) {
            if (isStackMissing(e)) {
                LOGGER.info("Stack {} is not deployed", stackName);
                return Optional.empty();
            }
            throw e;
        }
    }

    static boolean isStackMissing(CloudFormationException e) {
        AwsErrorDetails details = e.awsErrorDetails();
        return e.statusCode() == 400
                && details != null
                && STACK_MISSING_ERROR_CODE.equals(details.errorCode())
                && details.errorMessage() != null
                && details.errorMessage().endsWith(STACK_MISSING_MESSAGE_SUFFIX);
    }

    private static SortedMap<String, String> outputsOf(List<Output> outputs) {
        SortedMap<String, String> map = new TreeMap<>();
        for (Output output : outputs) {
            map.put(output.outputKey(), output.outputValue());
        }
        return map;
    }

    public boolean isDeployed(String stackName) {
        return outputsByStackName.containsKey(stackName);
    }

    public Optional<String> get(String stackName, String outputKey) {
        return Optional.ofNullable(outputsByStackName.get(stackName))
                .map(stackOutputs -> stackOutputs.get(outputKey));
    }

    public Map<String, Map<String, String>> toMap() {
        return Collections.unmodifiableMap(outputsByStackName);
    }

    /**
     * Lists every output as a line of the form {@code stack: key = value}.
     *
     * @return the lines, sorted by stack name then output key
     */
    public List<String> toLines() {
        return outputsByStackName.entrySet().stream()
                .flatMap(stack -> stack.getValue().entrySet().stream()
                        .map(output -> stack.getKey() + ": " + output.getKey() + " = " + output.getValue()))
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StackOutputs that = (StackOutputs) o;
        return Objects.equals(outputsByStackName, that.outputsByStackName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputsByStackName);
    }

    @Override
    public String toString() {
        return "StackOutputs{" + outputsByStackName + '}';
    }
}
