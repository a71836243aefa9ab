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
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Feeds documents through an {@link Automaton}.
 *
 * <p>Each call keeps a cursor (starting at the root) and a result accumulator on its own stack. For
 * every character the cursor follows fail links until it finds a goto edge for that character or
 * reaches the root, takes the edge if there is one, and adds the cursor's output set to the
 * accumulator. Every character costs at most one forward step, and fail-link steps never exceed the
 * forward steps taken so far, so a scan is linear in the document length regardless of how many
 * patterns were registered.
 *
 * <p>Thread-safe and stateless: obtain one from {@link Automaton#scanner()} and share it.
 *
 * @since 1.0.0
 */
public final class Scanner {
    private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

    private final Automaton automaton;

    Scanner(Automaton automaton) {
        this.automaton = automaton;
    }

    public Automaton automaton() {
        return automaton;
    }

    /**
     * Finds the distinct patterns occurring in a document.
     *
     * @param document document to scan
     * @return the ids of every pattern that is a substring of the content
     */
    public MatchSet scan(Document document) {
        Objects.requireNonNull(document, "document cannot be null");
        MatchSet matched = scan(document.content());
        logger.trace("AssetScan: Scanned document - id: {}, length: {}, matched: {}",
            document.id(), document.length(), matched.size());
        return matched;
    }

    /**
     * Finds the distinct patterns occurring in {@code text}.
     *
     * <p>An empty text yields an empty set. With early termination enabled the scan stops as soon
     * as every pattern has matched; the result is the same either way.
     *
     * @param text text to scan, any content
     * @return the ids of every pattern that is a substring of {@code text}
     */
    public MatchSet scan(CharSequence text) {
        Objects.requireNonNull(text, "text cannot be null");
        ScanMetricsRegistry metrics = automaton.config().metricsRegistry();
        boolean earlyTermination = automaton.config().earlyTermination();
        long startNanos = System.nanoTime();

        int patternCount = automaton.patternCount();
        BitSet matched = new BitSet(patternCount);
        int matchedCount = 0;
        int length = text.length();
        int node = Automaton.ROOT;

        int consumed = 0;
        while (consumed < length) {
            node = step(node, text.charAt(consumed++));
            int[] output = automaton.output(node);
            if (output.length == 0) {
                continue;
            }
            for (int id : output) {
                if (!matched.get(id)) {
                    matched.set(id);
                    matchedCount++;
                }
            }
            if (earlyTermination && matchedCount == patternCount) {
                break;
            }
        }

        if (consumed < length) {
            metrics.incrementCounter(MetricNames.SCAN_EARLY_TERMINATIONS);
        }
        metrics.incrementCounter(MetricNames.SCAN_DOCUMENTS);
        metrics.incrementCounter(MetricNames.SCAN_CHARACTERS, consumed);
        metrics.recordTimer(MetricNames.SCAN_LATENCY, System.nanoTime() - startNanos);

        return new MatchSet(automaton, matched);
    }

    /**
     * Finds every occurrence of every pattern in {@code text}.
     *
     * <p>Occurrences are ordered by end offset; occurrences ending at the same offset are ordered by
     * pattern id. Overlapping occurrences are all reported.
     *
     * @param text text to scan
     * @return all occurrences, empty if none
     */
    public List<Match> findAll(CharSequence text) {
        Objects.requireNonNull(text, "text cannot be null");
        List<Match> matches = new ArrayList<>();
        int node = Automaton.ROOT;

        for (int i = 0; i < text.length(); i++) {
            node = step(node, text.charAt(i));
            for (int id : automaton.output(node)) {
                PatternId patternId = new PatternId(id);
                String pattern = automaton.pattern(patternId);
                matches.add(new Match(patternId, pattern, i + 1 - pattern.length(), i + 1));
            }
        }
        return matches;
    }

    /**
     * Advances the cursor by one character: fail links until an edge on {@code c} exists or the
     * root is reached, then the edge if any.
     */
    private int step(int node, char c) {
        int next;
        while ((next = automaton.next(node, c)) == GotoTable.NO_EDGE && node != Automaton.ROOT) {
            node = automaton.fail(node);
        }
        return next == GotoTable.NO_EDGE ? Automaton.ROOT : next;
    }
}
