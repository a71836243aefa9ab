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

import java.util.Collection;
import java.util.Set;

/**
 * One-shot entry points: build an automaton from a pattern collection, scan a corpus, report.
 *
 * <p>Thread-safe: all methods can be called concurrently from multiple threads. Each call builds
 * its own automaton; keep an {@link Automaton} around instead when the same patterns are scanned
 * repeatedly.
 *
 * @since 1.0.0
 */
public final class AssetScan {

    private AssetScan() {
        // Utility class
    }

    public static Automaton compile(Collection<String> patterns) {
        return compile(patterns, ScanConfig.DEFAULT);
    }

    public static Automaton compile(Collection<String> patterns, ScanConfig config) {
        return AutomatonBuilder.create(config).registerAll(patterns).build();
    }

    /**
     * Patterns that occur in none of the documents.
     *
     * @param patterns candidate patterns (duplicates allowed)
     * @param documents corpus to search
     * @return unused patterns, in first-registration order
     */
    public static Set<String> findUnused(Collection<String> patterns, Collection<Document> documents) {
        return analyze(patterns, documents, ScanConfig.DEFAULT).unusedPatterns();
    }

    /**
     * Patterns that occur in at least one document.
     *
     * @param patterns candidate patterns (duplicates allowed)
     * @param documents corpus to search
     * @return used patterns, in first-registration order
     */
    public static Set<String> findUsed(Collection<String> patterns, Collection<Document> documents) {
        return analyze(patterns, documents, ScanConfig.DEFAULT).usedPatterns();
    }

    /**
     * Full usage report: used and unused sets plus the documents each pattern appeared in.
     */
    public static UsageReport analyze(Collection<String> patterns, Collection<Document> documents) {
        return analyze(patterns, documents, ScanConfig.DEFAULT);
    }

    public static UsageReport analyze(Collection<String> patterns, Collection<Document> documents,
                                      ScanConfig config) {
        Automaton automaton = compile(patterns, config);
        try (CorpusScanner corpus = new CorpusScanner(automaton)) {
            return corpus.scan(documents);
        }
    }

    /**
     * Tests whether any pattern occurs in {@code text}.
     */
    public static boolean containsAny(Collection<String> patterns, CharSequence text) {
        return !compile(patterns).scan(text).isEmpty();
    }
}
