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

import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable Aho-Corasick automaton over a fixed set of patterns.
 *
 * <p>Nodes live in an arena addressed by index; the root is index 0. Each node carries its goto
 * edges, a fail index and an output set: the ids of the patterns that end at the node or at any
 * node on its fail chain. Built once by {@link AutomatonBuilder#build()}, never modified afterwards.
 *
 * <p>Thread-safe: any number of threads may scan the same automaton concurrently without
 * coordination. Each scan keeps its cursor and accumulator on its own stack.
 *
 * <pre>{@code
 * Automaton automaton = AutomatonBuilder.create()
 *     .registerAll(List.of("logo.png", "icon.png", "banner.png"))
 *     .build();
 * MatchSet used = automaton.scan("<img src='assets/logo.png'>");   // {logo.png}
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Automaton {

    static final int ROOT = 0;
    static final int[] NO_OUTPUT = new int[0];

    private final String[] patterns;
    private final Map<String, PatternId> ids;
    private final GotoTable gotoTable;
    private final int[] fail;
    private final int[][] outputs;
    private final int[] depth;
    private final ScanConfig config;
    private final Scanner scanner;

    Automaton(String[] patterns, Map<String, PatternId> ids, GotoTable gotoTable,
              int[] fail, int[][] outputs, int[] depth, ScanConfig config) {
        this.patterns = patterns;
        this.ids = Collections.unmodifiableMap(ids);
        this.gotoTable = gotoTable;
        this.fail = fail;
        this.outputs = outputs;
        this.depth = depth;
        this.config = Objects.requireNonNull(config);
        this.scanner = new Scanner(this);
    }

    /** Number of distinct patterns; ids range over {@code 0..patternCount()-1}. */
    public int patternCount() {
        return patterns.length;
    }

    /** Number of trie nodes, root included. */
    public int nodeCount() {
        return fail.length;
    }

    /**
     * Returns the pattern registered under the given id.
     *
     * @throws IndexOutOfBoundsException if the id was not assigned by this automaton's builder
     */
    public String pattern(PatternId id) {
        return patterns[Objects.checkIndex(id.value(), patterns.length)];
    }

    /** Looks up the id of a pattern; empty if the pattern is not part of this automaton. */
    public Optional<PatternId> idOf(String pattern) {
        return Optional.ofNullable(ids.get(pattern));
    }

    /** All patterns in id order. */
    public List<String> patterns() {
        return List.of(patterns);
    }

    /** The full pattern set, the universe used for unused-pattern computation. */
    public MatchSet allPatterns() {
        BitSet all = new BitSet(patterns.length);
        all.set(0, patterns.length);
        return new MatchSet(this, all);
    }

    public ScanConfig config() {
        return config;
    }

    /**
     * Returns the scanner of this automaton. Scanners hold no per-scan state and are shared.
     */
    public Scanner scanner() {
        return scanner;
    }

    /**
     * Finds the distinct patterns occurring in {@code text}.
     *
     * @see Scanner#scan(CharSequence)
     */
    public MatchSet scan(CharSequence text) {
        return scanner.scan(text);
    }

    /**
     * Finds the distinct patterns occurring in a document.
     *
     * @see Scanner#scan(Document)
     */
    public MatchSet scan(Document document) {
        return scanner.scan(document);
    }

    /**
     * Finds every occurrence of every pattern in {@code text}.
     *
     * @see Scanner#findAll(CharSequence)
     */
    public List<Match> findAll(CharSequence text) {
        return scanner.findAll(text);
    }

    // ========== Arena access (package-private, read only) ==========

    int next(int node, char c) {
        return gotoTable.next(node, c);
    }

    int fail(int node) {
        return fail[node];
    }

    int depth(int node) {
        return depth[node];
    }

    /** Output set of a node. Shared array; callers must not modify it. */
    int[] output(int node) {
        return outputs[node];
    }

    GotoTable gotoTable() {
        return gotoTable;
    }

    @Override
    public String toString() {
        return "Automaton[patterns=" + patterns.length + ", nodes=" + fail.length + "]";
    }
}
