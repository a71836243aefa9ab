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
import com.axonops.assetscan.metrics.ScanMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Collects patterns and builds an {@link Automaton} from them.
 *
 * <p>Construction runs in two phases:
 * <ol>
 *   <li><b>Trie insertion</b> - each pattern is walked from the root, creating nodes as needed; the
 *       terminal node records the pattern id.</li>
 *   <li><b>Failure links and output sets</b> - nodes are visited breadth first. A node's fail link
 *       depends only on shallower nodes, so by the time a node is visited every link it needs is
 *       resolved. Right after its fail link is set, the fail target's output set is merged into the
 *       node's own.</li>
 * </ol>
 *
 * <p>Duplicate registrations are folded: the first registration's id is returned again. The
 * aliasing is visible through {@link #registrations()} and {@link #duplicateCount()}.
 *
 * <p>Not thread-safe. Register and build on one thread, then share the built automaton freely.
 * {@link #build()} may be called more than once; each call builds a fresh automaton from the
 * patterns registered so far, and patterns registered later only affect later builds.
 *
 * @since 1.0.0
 */
public final class AutomatonBuilder {
    private static final Logger logger = LoggerFactory.getLogger(AutomatonBuilder.class);

    private static final int NO_PATTERN = -1;

    private final ScanConfig config;
    private final List<String> patterns = new ArrayList<>();
    private final Map<String, PatternId> ids = new HashMap<>();
    private final List<PatternId> registrations = new ArrayList<>();
    private int duplicates;
    private int attempts;

    private AutomatonBuilder(ScanConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public static AutomatonBuilder create() {
        return new AutomatonBuilder(ScanConfig.DEFAULT);
    }

    public static AutomatonBuilder create(ScanConfig config) {
        return new AutomatonBuilder(config);
    }

    /**
     * Registers a pattern.
     *
     * @param pattern non-empty pattern
     * @return the pattern's id; for a duplicate, the id of its first registration
     * @throws EmptyPatternException if the pattern has zero length
     * @throws NullPointerException if the pattern is null
     */
    public PatternId register(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        ScanMetricsRegistry metrics = config.metricsRegistry();
        int position = attempts++;

        if (pattern.isEmpty()) {
            metrics.incrementCounter(MetricNames.ERRORS_EMPTY_PATTERN);
            throw new EmptyPatternException(position);
        }
        metrics.incrementCounter(MetricNames.PATTERNS_REGISTERED);

        PatternId existing = ids.get(pattern);
        if (existing != null) {
            duplicates++;
            metrics.incrementCounter(MetricNames.PATTERNS_DUPLICATE);
            registrations.add(existing);
            logger.trace("AssetScan: Duplicate pattern folded - registration: {}, id: {}", position, existing);
            return existing;
        }

        PatternId id = new PatternId(patterns.size());
        patterns.add(pattern);
        ids.put(pattern, id);
        registrations.add(id);
        return id;
    }

    /**
     * Registers every pattern of a collection, in iteration order.
     *
     * <p>Fails fast: patterns before an empty one stay registered.
     *
     * @return this builder
     * @throws EmptyPatternException if any pattern has zero length
     */
    public AutomatonBuilder registerAll(Collection<String> patterns) {
        Objects.requireNonNull(patterns, "patterns cannot be null");
        for (String pattern : patterns) {
            register(pattern);
        }
        return this;
    }

    /**
     * Ids returned by every successful {@link #register(String)} call, in call order.
     *
     * <p>A repeated id marks a duplicate registration aliased to its first occurrence.
     */
    public List<PatternId> registrations() {
        return Collections.unmodifiableList(new ArrayList<>(registrations));
    }

    /** Looks up the id assigned to a pattern; empty if it was never registered. */
    public Optional<PatternId> idOf(String pattern) {
        return Optional.ofNullable(ids.get(pattern));
    }

    /** Number of distinct patterns registered so far. */
    public int patternCount() {
        return patterns.size();
    }

    /** Number of registrations folded into an earlier identical pattern. */
    public int duplicateCount() {
        return duplicates;
    }

    public ScanConfig config() {
        return config;
    }

    /**
     * Builds an immutable automaton over all patterns registered so far.
     *
     * <p>Runs in time linear in the total length of the patterns (times the alphabet lookup cost)
     * and is paid once, not per scan.
     *
     * @return new automaton; an automaton built from zero patterns matches nothing
     */
    public Automaton build() {
        ScanMetricsRegistry metrics = config.metricsRegistry();
        long startNanos = System.nanoTime();

        String[] snapshot = patterns.toArray(new String[0]);
        List<TreeMap<Character, Integer>> children = new ArrayList<>();
        List<Integer> terminals = new ArrayList<>();
        insertAll(snapshot, children, terminals);

        GotoTable gotoTable = compact(children);
        int nodeCount = gotoTable.nodeCount();
        int[] fail = new int[nodeCount];
        int[] depth = new int[nodeCount];
        int[][] outputs = new int[nodeCount][];
        linkFailures(gotoTable, terminals, fail, depth, outputs);

        Automaton automaton = new Automaton(snapshot, new HashMap<>(ids), gotoTable, fail, outputs, depth, config);

        long durationNanos = System.nanoTime() - startNanos;
        metrics.incrementCounter(MetricNames.AUTOMATON_BUILDS);
        metrics.recordTimer(MetricNames.AUTOMATON_BUILD_LATENCY, durationNanos);
        // Gauges hold plain counts so the registry never keeps an automaton alive
        int patternCount = automaton.patternCount();
        metrics.registerGauge(MetricNames.AUTOMATON_NODES, () -> nodeCount);
        metrics.registerGauge(MetricNames.AUTOMATON_PATTERNS, () -> patternCount);

        logger.debug("AssetScan: Automaton built - patterns: {}, duplicatesFolded: {}, nodes: {}, timeNs: {}",
            snapshot.length, duplicates, nodeCount, durationNanos);
        return automaton;
    }

    /**
     * Phase 1: inserts every pattern into a trie of sorted child maps. Node 0 is the root.
     */
    private static void insertAll(String[] patterns, List<TreeMap<Character, Integer>> children,
                                  List<Integer> terminals) {
        children.add(new TreeMap<>());
        terminals.add(NO_PATTERN);

        for (int id = 0; id < patterns.length; id++) {
            String pattern = patterns[id];
            int node = Automaton.ROOT;
            for (int i = 0; i < pattern.length(); i++) {
                char c = pattern.charAt(i);
                Integer child = children.get(node).get(c);
                if (child == null) {
                    child = children.size();
                    children.add(new TreeMap<>());
                    terminals.add(NO_PATTERN);
                    children.get(node).put(c, child);
                }
                node = child;
            }
            terminals.set(node, id);
        }
    }

    /**
     * Flattens the child maps into the arena's goto arrays, keeping node indices.
     */
    private static GotoTable compact(List<TreeMap<Character, Integer>> children) {
        int nodeCount = children.size();
        int[] offsets = new int[nodeCount + 1];
        char[] labels = new char[nodeCount - 1];
        int[] targets = new int[nodeCount - 1];

        int edge = 0;
        for (int node = 0; node < nodeCount; node++) {
            offsets[node] = edge;
            for (Map.Entry<Character, Integer> entry : children.get(node).entrySet()) {
                labels[edge] = entry.getKey();
                targets[edge] = entry.getValue();
                edge++;
            }
        }
        offsets[nodeCount] = edge;
        return new GotoTable(offsets, labels, targets);
    }

    /**
     * Phase 2: breadth-first failure links, merging each fail target's outputs into its node.
     */
    private static void linkFailures(GotoTable gotoTable, List<Integer> terminals,
                                     int[] fail, int[] depth, int[][] outputs) {
        int[] queue = new int[gotoTable.nodeCount()];
        int head = 0;
        int tail = 0;

        fail[Automaton.ROOT] = Automaton.ROOT;
        outputs[Automaton.ROOT] = Automaton.NO_OUTPUT;

        // Depth 1: always fail to the root
        for (int e = gotoTable.edgeStart(Automaton.ROOT); e < gotoTable.edgeEnd(Automaton.ROOT); e++) {
            int child = gotoTable.target(e);
            fail[child] = Automaton.ROOT;
            depth[child] = 1;
            outputs[child] = withTerminal(terminals.get(child), Automaton.NO_OUTPUT);
            queue[tail++] = child;
        }

        while (head < tail) {
            int parent = queue[head++];
            for (int e = gotoTable.edgeStart(parent); e < gotoTable.edgeEnd(parent); e++) {
                char c = gotoTable.label(e);
                int node = gotoTable.target(e);

                int candidate = fail[parent];
                int next;
                while ((next = gotoTable.next(candidate, c)) == GotoTable.NO_EDGE && candidate != Automaton.ROOT) {
                    candidate = fail[candidate];
                }
                fail[node] = next == GotoTable.NO_EDGE ? Automaton.ROOT : next;
                depth[node] = depth[parent] + 1;
                outputs[node] = withTerminal(terminals.get(node), outputs[fail[node]]);
                queue[tail++] = node;
            }
        }
    }

    /**
     * Output set of a node: its own terminal pattern (if any) plus its fail target's outputs.
     * Nodes without a terminal share the fail target's array.
     */
    private static int[] withTerminal(int terminal, int[] inherited) {
        if (terminal == NO_PATTERN) {
            return inherited;
        }
        int[] merged = new int[inherited.length + 1];
        int i = 0;
        while (i < inherited.length && inherited[i] < terminal) {
            merged[i] = inherited[i];
            i++;
        }
        merged[i] = terminal;
        System.arraycopy(inherited, i, merged, i + 1, inherited.length - i);
        return merged;
    }
}
