/*
 * Copyright 2025 AxonOps
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

package com.axonops.assetscan.config;

import com.axonops.assetscan.metrics.NoOpMetricsRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ScanConfigTest {

  @Test
  void testDefaults() {
    ScanConfig config = ScanConfig.DEFAULT;

    assertThat(config.parallelism()).isBetween(1, ScanConfig.MAX_PARALLELISM);
    assertThat(config.earlyTermination()).isTrue();
    assertThat(config.trackOccurrences()).isTrue();
    assertThat(config.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
  }

  @Test
  void testBuilderStartsFromDefaults() {
    assertThat(ScanConfig.builder().build()).isEqualTo(ScanConfig.DEFAULT);
  }

  @Test
  void testBuilderOverrides() {
    ScanConfig config =
        ScanConfig.builder().parallelism(3).earlyTermination(false).trackOccurrences(false).build();

    assertThat(config.parallelism()).isEqualTo(3);
    assertThat(config.earlyTermination()).isFalse();
    assertThat(config.trackOccurrences()).isFalse();
  }

  @Test
  void testParallelismBounds() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> ScanConfig.builder().parallelism(0).build())
        .withMessageContaining("positive");
    assertThatIllegalArgumentException()
        .isThrownBy(() -> ScanConfig.builder().parallelism(ScanConfig.MAX_PARALLELISM + 1).build())
        .withMessageContaining("cannot exceed");
    assertThat(ScanConfig.builder().parallelism(ScanConfig.MAX_PARALLELISM).build().parallelism())
        .isEqualTo(ScanConfig.MAX_PARALLELISM);
  }

  @Test
  void testNullMetricsRegistryRejected() {
    assertThatNullPointerException().isThrownBy(() -> ScanConfig.builder().metricsRegistry(null));
    assertThatNullPointerException().isThrownBy(() -> new ScanConfig(1, true, true, null));
  }
}
