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

package com.axonops.assetscan.test;

import com.axonops.assetscan.config.ScanConfig;
import com.axonops.assetscan.metrics.DropwizardMetricsAdapter;
import com.axonops.assetscan.metrics.NoOpMetricsRegistry;
import com.codahale.metrics.MetricRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Test utilities: configurations, random inputs and the brute-force substring oracle.
 *
 * <h2>Usage Patterns</h2>
 *
 * <pre>{@code
 * Automaton automaton = AutomatonBuilder.create(TestUtils.testConfig()).registerAll(patterns).build();
 * assertThat(automaton.scan(text).patterns()).isEqualTo(TestUtils.bruteForce(patterns, text));
 * }</pre>
 */
public final class TestUtils {
    private TestUtils() {
        // Utility class
    }

    /**
     * Sequential configuration without metrics.
     */
    public static ScanConfig testConfig() {
        return testConfigBuilder().build();
    }

    public static ScanConfig.Builder testConfigBuilder() {
        return ScanConfig.builder()
            .parallelism(1)
            .metricsRegistry(NoOpMetricsRegistry.INSTANCE);
    }

    /**
     * Configuration reporting to a Dropwizard registry under {@code prefix}.
     */
    public static ScanConfig testConfigWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix))
            .build();
    }

    /**
     * Reference answer: every pattern that is a contiguous substring of {@code text}, in first
     * occurrence order of the pattern collection.
     */
    public static Set<String> bruteForce(Collection<String> patterns, String text) {
        Set<String> found = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                found.add(pattern);
            }
        }
        return found;
    }

    /**
     * Random string over a small alphabet, so overlaps and shared prefixes/suffixes are common.
     */
    public static String randomString(Random random, String alphabet, int minLength, int maxLength) {
        int length = minLength + random.nextInt(maxLength - minLength + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    public static List<String> randomPatterns(Random random, String alphabet, int count, int maxLength) {
        List<String> patterns = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            patterns.add(randomString(random, alphabet, 1, maxLength));
        }
        return patterns;
    }
}
