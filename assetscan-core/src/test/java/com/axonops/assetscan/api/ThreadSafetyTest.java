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

package com.axonops.assetscan.api;

import com.axonops.assetscan.config.ScanConfig;
import com.axonops.assetscan.metrics.DropwizardMetricsAdapter;
import com.axonops.assetscan.test.TestUtils;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * One shared automaton scanned from many threads at once.
 */
class ThreadSafetyTest {

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentScansMatchSequential_100Threads() throws InterruptedException {
        Random random = new Random(11);
        List<String> patterns = TestUtils.randomPatterns(random, "abcd", 500, 6);
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            texts.add(TestUtils.randomString(random, "abcde", 0, 300));
        }

        Automaton automaton = AutomatonBuilder.create(TestUtils.testConfig()).registerAll(patterns).build();
        List<Set<String>> expected = new ArrayList<>();
        for (String text : texts) {
            expected.add(automaton.scan(text).patterns());
        }

        int threadCount = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        AtomicInteger mismatches = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < texts.size(); j++) {
                        int index = (threadId + j) % texts.size();
                        if (!automaton.scan(texts.get(index)).patterns().equals(expected.get(index))) {
                            mismatches.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
        assertThat(mismatches.get()).isEqualTo(0);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    @SuppressWarnings("unchecked")
    void testConcurrentBuildsSharingOneRegistry_64Threads() throws InterruptedException {
        MetricRegistry registry = new MetricRegistry();
        ScanConfig config = TestUtils.testConfigWithMetrics(registry, "p");

        int threadCount = 64;
        int buildsPerThread = 80;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < buildsPerThread; j++) {
                        AutomatonBuilder.create(config).registerAll(List.of("logo.png", "icon.png")).build();
                    }
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(failures).isEmpty();
        assertThat(registry.counter("p.automaton.builds.total.count").getCount())
            .isEqualTo(threadCount * buildsPerThread);
        Gauge<Number> patterns = (Gauge<Number>) registry.getGauges().get("p.automaton.patterns.current.count");
        assertThat(patterns.getValue().intValue()).isEqualTo(2);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentMetricsUpdates_100Threads() throws InterruptedException {
        MetricRegistry registry = new MetricRegistry();
        Automaton automaton = AutomatonBuilder.create(TestUtils.testConfigWithMetrics(registry, "test.assetscan"))
            .registerAll(List.of("logo.png", "icon.png"))
            .build();

        int threadCount = 100;
        int scansPerThread = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < scansPerThread; j++) {
                        automaton.scan("<img src='logo.png'>");
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);

        // No lost increments
        assertThat(registry.counter("test.assetscan.scan.documents.total.count").getCount())
            .isEqualTo(threadCount * scansPerThread);
        assertThat(registry.timer("test.assetscan.scan.latency").getCount())
            .isEqualTo(threadCount * scansPerThread);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentCorpusScansShareOnePool() throws InterruptedException {
        Automaton automaton = AutomatonBuilder.create(TestUtils.testConfigBuilder().parallelism(4).build())
            .registerAll(List.of("a.png", "b.png", "c.png"))
            .build();
        List<Document> documents = List.of(
            Document.of("1.html", "a.png"),
            Document.of("2.html", "b.png"),
            Document.of("3.html", "nothing"));

        int threadCount = 20;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        ConcurrentLinkedQueue<Set<String>> unused = new ConcurrentLinkedQueue<>();
        AtomicInteger errors = new AtomicInteger(0);

        try (CorpusScanner scanner = new CorpusScanner(automaton)) {
            for (int i = 0; i < threadCount; i++) {
                new Thread(() -> {
                    try {
                        start.await();
                        unused.add(scanner.scan(documents).unusedPatterns());
                    } catch (Exception e) {
                        errors.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                }).start();
            }

            start.countDown();
            done.await();
        }

        assertThat(errors.get()).isEqualTo(0);
        assertThat(unused).hasSize(threadCount).allSatisfy(set -> assertThat(set).containsExactly("c.png"));
    }
}
