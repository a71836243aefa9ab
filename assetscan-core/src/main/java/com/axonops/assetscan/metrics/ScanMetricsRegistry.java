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

package com.axonops.assetscan.metrics;

import java.util.function.Supplier;

/**
 * Metrics sink used by the builder, scanner and corpus scanner.
 *
 * <p>Allows the library to work with or without the Dropwizard Metrics dependency. The default is
 * {@link NoOpMetricsRegistry}; {@link DropwizardMetricsAdapter} bridges to a Dropwizard
 * {@code MetricRegistry}.
 *
 * <p><strong>Thread Safety:</strong> implementations must be thread-safe. Scans running on many
 * threads report into the same registry.
 *
 * @since 1.0.0
 * @see MetricNames
 */
public interface ScanMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "scan.documents.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name (e.g., "scan.characters.total.count")
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "automaton.build.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on demand, replacing any gauge with the same name.
     * May be called concurrently for one name; the last call wins.
     *
     * @param name metric name (e.g., "automaton.nodes.current.count")
     * @param valueSupplier function that returns the current value; must be fast and non-blocking
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a previously registered gauge. No-op if absent.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
