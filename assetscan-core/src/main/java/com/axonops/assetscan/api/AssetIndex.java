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
import com.axonops.assetscan.metrics.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Register-build-scan lifecycle over a single pattern set.
 *
 * <p>Patterns are registered first, then {@link #build()} finalizes the automaton; scanning before
 * that throws {@link BuildNotInvokedException} at the point of the call. Registering after the
 * build throws {@link IllegalStateException}: a built pattern set is never edited, a changed set
 * needs a new index.
 *
 * <pre>{@code
 * AssetIndex index = AssetIndex.create();
 * index.registerAll(List.of("logo.png", "icon.png", "banner.png"));
 * index.build();
 * Set<String> unused = index.findUnused(documents);   // {icon.png, banner.png}
 * }</pre>
 *
 * <p>Registration and build are single threaded. Once built, scan methods may be called from any
 * number of threads.
 *
 * @since 1.0.0
 */
public final class AssetIndex {
    private static final Logger logger = LoggerFactory.getLogger(AssetIndex.class);

    private final AutomatonBuilder builder;
    private volatile Automaton automaton;

    private AssetIndex(ScanConfig config) {
        this.builder = AutomatonBuilder.create(config);
    }

    public static AssetIndex create() {
        return new AssetIndex(ScanConfig.DEFAULT);
    }

    public static AssetIndex create(ScanConfig config) {
        return new AssetIndex(Objects.requireNonNull(config, "config cannot be null"));
    }

    /**
     * Registers a pattern.
     *
     * @return the pattern's id; a duplicate gets the id of its first registration
     * @throws EmptyPatternException if the pattern is empty
     * @throws IllegalStateException if the index was already built
     */
    public PatternId register(String pattern) {
        checkNotBuilt();
        return builder.register(pattern);
    }

    /**
     * Registers several patterns in iteration order.
     *
     * @return the id of each pattern, parallel to the input
     */
    public List<PatternId> registerAll(Collection<String> patterns) {
        checkNotBuilt();
        return patterns.stream().map(builder::register).collect(Collectors.toList());
    }

    /** Distinct patterns registered so far. */
    public int patternCount() {
        return builder.patternCount();
    }

    /** Registrations folded into an earlier identical pattern. */
    public int duplicateCount() {
        return builder.duplicateCount();
    }

    /**
     * Builds the automaton. Calling it again rebuilds from the same patterns with identical
     * matching behaviour.
     */
    public synchronized Automaton build() {
        automaton = builder.build();
        return automaton;
    }

    public boolean isBuilt() {
        return automaton != null;
    }

    /**
     * @throws BuildNotInvokedException if {@link #build()} was never called
     */
    public Automaton automaton() {
        return requireBuilt("automaton()");
    }

    /**
     * @throws BuildNotInvokedException if {@link #build()} was never called
     */
    public MatchSet scan(CharSequence text) {
        return requireBuilt("scan()").scan(text);
    }

    /**
     * @throws BuildNotInvokedException if {@link #build()} was never called
     */
    public MatchSet scan(Document document) {
        return requireBuilt("scan()").scan(document);
    }

    /**
     * Scans a document collection.
     *
     * @throws BuildNotInvokedException if {@link #build()} was never called
     */
    public UsageReport scanAll(Collection<Document> documents) {
        Automaton built = requireBuilt("scanAll()");
        try (CorpusScanner corpus = new CorpusScanner(built)) {
            return corpus.scan(documents);
        }
    }

    /**
     * Patterns that occur in none of the documents, in registration order.
     *
     * @throws BuildNotInvokedException if {@link #build()} was never called
     */
    public Set<String> findUnused(Collection<Document> documents) {
        Automaton built = requireBuilt("findUnused()");
        try (CorpusScanner corpus = new CorpusScanner(built)) {
            return corpus.scan(documents).unusedPatterns();
        }
    }

    private Automaton requireBuilt(String operation) {
        Automaton built = automaton;
        if (built == null) {
            builder.config().metricsRegistry().incrementCounter(MetricNames.ERRORS_BUILD_NOT_INVOKED);
            logger.debug("AssetScan: {} called before build() - registered patterns: {}",
                operation, builder.patternCount());
            throw new BuildNotInvokedException(operation);
        }
        return built;
    }

    private void checkNotBuilt() {
        if (automaton != null) {
            throw new IllegalStateException("AssetScan: Index already built; create a new index for a changed pattern set");
        }
    }
}
