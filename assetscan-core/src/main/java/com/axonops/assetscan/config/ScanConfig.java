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
import com.axonops.assetscan.metrics.ScanMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for automaton construction, scanning and corpus fan-out.
 *
 * <p>Immutable; validated in the compact constructor. The configuration given to an {@link
 * com.axonops.assetscan.api.AutomatonBuilder} travels with every automaton it builds, so scanners
 * and corpus scanners of that automaton report to the same metrics registry.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: one worker per available processor, early termination on, metrics off
 * ScanConfig config = ScanConfig.DEFAULT;
 *
 * // Sequential scanning with Dropwizard metrics
 * ScanConfig config = ScanConfig.builder()
 *     .parallelism(1)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.assets"))
 *     .build();
 * }</pre>
 *
 * @param parallelism worker threads used by {@link com.axonops.assetscan.api.CorpusScanner}; 1
 *     scans on the calling thread
 * @param earlyTermination stop scanning a document once every registered pattern has matched. Never
 *     changes the result, only the work done
 * @param trackOccurrences record which documents each pattern appeared in (the pattern to documents
 *     multimap of {@link com.axonops.assetscan.api.UsageReport})
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see com.axonops.assetscan.metrics.MetricNames
 */
public record ScanConfig(
    int parallelism,
    boolean earlyTermination,
    boolean trackOccurrences,
    ScanMetricsRegistry metricsRegistry) {

  /** Upper bound on worker threads; scans are CPU bound so more threads never help. */
  public static final int MAX_PARALLELISM = 256;

  /**
   * Default configuration.
   *
   * <p>One worker per available processor, early termination and occurrence tracking enabled,
   * metrics disabled.
   */
  public static final ScanConfig DEFAULT =
      new ScanConfig(
          defaultParallelism(),
          true, // Stop once all patterns matched
          true, // Keep pattern -> documents multimap
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  public ScanConfig {
    if (parallelism <= 0) {
      throw new IllegalArgumentException("parallelism must be positive");
    }
    if (parallelism > MAX_PARALLELISM) {
      throw new IllegalArgumentException(
          "parallelism (" + parallelism + ") cannot exceed " + MAX_PARALLELISM);
    }
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. All fields start with the defaults of {@link #DEFAULT}. */
  public static class Builder {
    private int parallelism = defaultParallelism();
    private boolean earlyTermination = true;
    private boolean trackOccurrences = true;
    private ScanMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set the number of worker threads for corpus scans.
     *
     * <p><b>Default: available processors</b>
     *
     * @param parallelism worker count (1 to {@value ScanConfig#MAX_PARALLELISM})
     * @return this builder
     */
    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    /**
     * Enable or disable early termination of a document scan.
     *
     * <p><b>Default: enabled</b>
     *
     * @param enabled true to stop once every pattern has matched
     * @return this builder
     */
    public Builder earlyTermination(boolean enabled) {
      this.earlyTermination = enabled;
      return this;
    }

    /**
     * Enable or disable the pattern to documents multimap in usage reports.
     *
     * <p><b>Default: enabled</b>. Disable for very large corpora when only the unused set matters.
     *
     * @param enabled true to record occurrences
     * @return this builder
     */
    public Builder trackOccurrences(boolean enabled) {
      this.trackOccurrences = enabled;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(ScanMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public ScanConfig build() {
      return new ScanConfig(parallelism, earlyTermination, trackOccurrences, metricsRegistry);
    }
  }

  private static int defaultParallelism() {
    return Math.min(MAX_PARALLELISM, Math.max(1, Runtime.getRuntime().availableProcessors()));
  }
}
