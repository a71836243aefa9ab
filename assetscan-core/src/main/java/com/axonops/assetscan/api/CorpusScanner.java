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

import com.axonops.assetscan.metrics.MetricNames;
import com.axonops.assetscan.metrics.ScanMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans a document collection against one automaton: one scan per document fanned out over a
 * worker pool, fanned back in by set union.
 *
 * <p>The pool size comes from {@link com.axonops.assetscan.config.ScanConfig#parallelism()}; with
 * parallelism 1 documents are scanned on the calling thread. Workers share the automaton read-only
 * and each scan owns its cursor and accumulator, so the scan path takes no locks. Results are
 * collected in submission order, which makes occurrence lists in the report follow the order of
 * the input collection however the scans were scheduled.
 *
 * <p>Close the scanner to release its worker threads.
 *
 * <pre>{@code
 * try (CorpusScanner corpus = new CorpusScanner(automaton)) {
 *     UsageReport report = corpus.scan(documents);
 *     Set<String> unused = report.unusedPatterns();
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CorpusScanner implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CorpusScanner.class);

    private final Automaton automaton;
    private final ExecutorService workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CorpusScanner(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        int parallelism = automaton.config().parallelism();

        if (parallelism > 1) {
            AtomicInteger threadNumber = new AtomicInteger();
            this.workers = Executors.newFixedThreadPool(parallelism, r -> {
                Thread t = new Thread(r, "AssetScan-Worker-" + threadNumber.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        } else {
            this.workers = null;
        }
        logger.debug("AssetScan: Corpus scanner initialized - parallelism: {}, patterns: {}",
            parallelism, automaton.patternCount());
    }

    public Automaton automaton() {
        return automaton;
    }

    /**
     * Scans every document and partitions the pattern set into used and unused patterns.
     *
     * @param documents documents to scan; an empty collection leaves every pattern unused
     * @return usage report over the whole collection
     */
    public UsageReport scan(Collection<Document> documents) {
        checkNotClosed();
        ScanMetricsRegistry metrics = automaton.config().metricsRegistry();
        long startNanos = System.nanoTime();

        List<Document> corpus = List.copyOf(documents);
        List<MatchSet> results = scanInOrder(corpus);

        UsageAggregator aggregator = new UsageAggregator(automaton);
        for (int i = 0; i < corpus.size(); i++) {
            aggregator.accept(corpus.get(i).id(), results.get(i));
        }
        UsageReport report = aggregator.report();

        long durationNanos = System.nanoTime() - startNanos;
        metrics.incrementCounter(MetricNames.CORPUS_SCANS);
        metrics.incrementCounter(MetricNames.CORPUS_DOCUMENTS, corpus.size());
        metrics.recordTimer(MetricNames.CORPUS_SCAN_LATENCY, durationNanos);

        logger.debug("AssetScan: Corpus scanned - documents: {}, used: {}, unused: {}, timeNs: {}",
            corpus.size(), report.used().size(), report.unused().size(), durationNanos);
        return report;
    }

    /**
     * Scans every document and keeps the per-document results.
     *
     * <p>Documents sharing an id are folded into one entry holding the union of their matches.
     *
     * @return document id to its match set, in input order
     */
    public Map<String, MatchSet> scanEach(Collection<Document> documents) {
        checkNotClosed();
        List<Document> corpus = List.copyOf(documents);
        List<MatchSet> results = scanInOrder(corpus);

        Map<String, MatchSet> byDocument = new LinkedHashMap<>();
        for (int i = 0; i < corpus.size(); i++) {
            byDocument.merge(corpus.get(i).id(), results.get(i), MatchSet::union);
        }
        return byDocument;
    }

    private List<MatchSet> scanInOrder(List<Document> corpus) {
        Scanner scanner = automaton.scanner();
        List<MatchSet> results = new ArrayList<>(corpus.size());

        if (workers == null || corpus.size() <= 1) {
            for (Document document : corpus) {
                results.add(scanner.scan(document));
            }
            return results;
        }

        List<Future<MatchSet>> futures = new ArrayList<>(corpus.size());
        try {
            for (Document document : corpus) {
                futures.add(workers.submit(() -> scanner.scan(document)));
            }
            for (Future<MatchSet> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new IllegalStateException("AssetScan: Interrupted while scanning corpus", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw rethrow(e.getCause());
        }
    }

    private static void cancelAll(List<Future<MatchSet>> futures) {
        for (Future<MatchSet> future : futures) {
            future.cancel(true);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("AssetScan: Document scan failed", cause);
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("AssetScan: CorpusScanner is closed");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("AssetScan: Worker pool did not terminate within 5s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        logger.debug("AssetScan: Corpus scanner closed");
    }
}
