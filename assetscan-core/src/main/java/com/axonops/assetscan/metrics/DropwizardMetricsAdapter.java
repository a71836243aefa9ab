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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} and delegates all metric operations to it, so scans
 * can be observed by any application that already exposes a registry.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * ScanConfig config = ScanConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "com.myapp.assets"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements ScanMetricsRegistry {

    public static final String DEFAULT_PREFIX = "com.axonops.assetscan";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.assetscan}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * <p>With prefix {@code "com.myapp.assets"}, the document counter appears as
     * {@code com.myapp.assets.scan.documents.total.count}.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    public MetricRegistry getRegistry() {
        return registry;
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Points the gauge {@code name} at a new value supplier.
     *
     * <p>The gauge is registered once, through the registry's atomic get-or-add, and later calls
     * only swap its supplier. Safe to call concurrently for the same name.
     */
    @Override
    @SuppressWarnings("rawtypes")
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        Objects.requireNonNull(valueSupplier, "valueSupplier cannot be null");
        String fullName = metricName(name);
        MetricRegistry.MetricSupplier<Gauge> factory = () -> new ReplaceableGauge(valueSupplier);

        Gauge gauge = registry.gauge(fullName, factory);
        if (!(gauge instanceof ReplaceableGauge)) {
            // Name taken by a gauge registered outside this adapter
            registry.remove(fullName);
            gauge = registry.gauge(fullName, factory);
        }
        if (gauge instanceof ReplaceableGauge) {
            ((ReplaceableGauge) gauge).replace(valueSupplier);
        }
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }

    private static final class ReplaceableGauge implements Gauge<Number> {
        private volatile Supplier<Number> supplier;

        ReplaceableGauge(Supplier<Number> supplier) {
            this.supplier = supplier;
        }

        void replace(Supplier<Number> supplier) {
            this.supplier = supplier;
        }

        @Override
        public Number getValue() {
            return supplier.get();
        }
    }
}
