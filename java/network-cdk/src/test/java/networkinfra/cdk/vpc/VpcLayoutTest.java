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

import org.junit.jupiter.api.Test;

import networkinfra.cdk.config.AppContext;

import static networkinfra.cdk.config.AppParameters.VPC_LAYOUT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class VpcLayoutTest {

    @Test
    void shouldUseManualLayoutByDefault() {
        assertThat(VpcLayout.from(AppContext.empty())).isEqualTo(VpcLayout.MANUAL);
    }

    @Test
    void shouldReadLayoutIgnoringCase() {
        assertThat(VpcLayout.from(AppContext.of(VPC_LAYOUT.value("Managed")))).isEqualTo(VpcLayout.MANAGED);
    }

    @Test
    void shouldRefuseUnknownLayout() {
        AppContext context = AppContext.of(VPC_LAYOUT.value("custom"));

        assertThatThrownBy(() -> VpcLayout.from(context))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("vpcLayout must be one of [manual, managed], found: custom");
    }

    @Test
    void shouldOnlyExportPrivateSubnetsFromManualLayout() {
        assertThat(VpcLayout.MANUAL.exportsPrivateSubnets()).isTrue();
        assertThat(VpcLayout.MANAGED.exportsPrivateSubnets()).isFalse();
    }
}
