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

package com.axonops.assetscan.dropwizard;

import com.axonops.assetscan.config.ScanConfig;
import com.axonops.assetscan.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for ScanConfig with Dropwizard Metrics integration.
 *
 * <p>Sets up a {@link DropwizardMetricsAdapter} over an application's registry and, unless told
 * otherwise, exposes that registry via JMX so build and scan metrics can be watched while a large
 * corpus is processed.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application that already owns a registry:
 * ScanConfig config = ScanMetricsConfig.withMetrics(appRegistry, "com.myapp.assets");
 *
 * // Standalone, default prefix:
 * ScanConfig config = ScanMetricsConfig.withMetrics(new MetricRegistry());
 *
 * // Further settings on top of metrics:
 * ScanConfig config = ScanMetricsConfig.builderWithMetrics(registry, "com.myapp.assets", false)
 *     .parallelism(4)
 *     .build();
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> one JmxReporter is started for the first registry passed
 * with JMX enabled; later calls reuse it. {@link #shutdown()} stops it.
 *
 * @since 1.0.0
 */
public final class ScanMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(ScanMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private ScanMetricsConfig() {
        // Utility class
    }

    /**
     * Creates ScanConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured ScanConfig with metrics enabled
     */
    public static ScanConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates ScanConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured ScanConfig with metrics enabled
     */
    public static ScanConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builderWithMetrics(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates ScanConfig with Dropwizard Metrics using default prefix {@code "com.axonops.assetscan"}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured ScanConfig with metrics enabled
     */
    public static ScanConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Builder preloaded with the metrics adapter, for callers that also set parallelism or the
     * other scan options.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return builder with the metrics registry set
     */
    public static ScanConfig.Builder builderWithMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return ScanConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * Ensures a JmxReporter is running. Idempotent: only the first call creates one.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("AssetScan: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("AssetScan: JmxReporter started - metrics available via JMX");
            } catch (Exception e) {
                // Not fatal: the registry may already be exposed by the application
                logger.warn("AssetScan: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("AssetScan: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
