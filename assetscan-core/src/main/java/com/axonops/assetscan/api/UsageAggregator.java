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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Combines per-document match sets into a corpus-wide used/unused partition.
 *
 * <p>The static functions are pure and total for sets from the same automaton:
 * <ul>
 *   <li>{@link #union(Automaton, Collection)} - patterns used anywhere</li>
 *   <li>{@link #unused(MatchSet, MatchSet)} - {@code all - used}</li>
 * </ul>
 *
 * <p>An instance accumulates incrementally: {@link #accept(String, MatchSet)} per document builds
 * the union and, when occurrence tracking is enabled, the pattern to documents multimap. Partial
 * aggregators over disjoint document subsets combine with {@link #merge(UsageAggregator)}; union is
 * commutative and associative, so the used and unused sets never depend on the order documents
 * were processed in. Occurrence lists follow accept/merge order.
 *
 * <p>Instances are not thread-safe; give each worker its own and merge them.
 *
 * @since 1.0.0
 */
public final class UsageAggregator {

    private final Automaton automaton;
    private final boolean trackOccurrences;
    private final BitSet used;
    private final Map<Integer, List<String>> occurrences = new TreeMap<>();
    private int documentCount;

    public UsageAggregator(Automaton automaton) {
        this(automaton, automaton.config().trackOccurrences());
    }

    public UsageAggregator(Automaton automaton, boolean trackOccurrences) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        this.trackOccurrences = trackOccurrences;
        this.used = new BitSet(automaton.patternCount());
    }

    /**
     * Union of per-document match sets.
     *
     * @param automaton the automaton all sets come from (anchors the empty union)
     * @param results per-document match sets
     * @return every pattern matched by at least one document
     * @throws ForeignMatchSetException if a set comes from another automaton
     */
    public static MatchSet union(Automaton automaton, Collection<MatchSet> results) {
        BitSet union = new BitSet(automaton.patternCount());
        for (MatchSet result : results) {
            requireFrom(automaton, result);
            result.addTo(union);
        }
        return new MatchSet(automaton, union);
    }

    /**
     * Set difference {@code all - used}.
     *
     * @throws ForeignMatchSetException if the sets come from different automatons
     */
    public static MatchSet unused(MatchSet all, MatchSet used) {
        return all.difference(used);
    }

    /**
     * Adds one document's matches.
     *
     * @param documentId identity reported in occurrence lists
     * @param matched the document's match set
     * @return this aggregator
     */
    public UsageAggregator accept(String documentId, MatchSet matched) {
        Objects.requireNonNull(documentId, "documentId cannot be null");
        requireFrom(automaton, matched);
        documentCount++;
        matched.addTo(used);
        if (trackOccurrences) {
            for (PatternId id : matched) {
                occurrences.computeIfAbsent(id.value(), k -> new ArrayList<>()).add(documentId);
            }
        }
        return this;
    }

    /**
     * Folds another aggregator over the same automaton into this one.
     *
     * @return this aggregator
     * @throws ForeignMatchSetException if {@code other} aggregates another automaton
     * @throws IllegalArgumentException if {@code other} is this aggregator, or only one of the two
     *     tracks occurrences
     */
    public UsageAggregator merge(UsageAggregator other) {
        Objects.requireNonNull(other, "other cannot be null");
        if (other == this) {
            throw new IllegalArgumentException("AssetScan: cannot merge an aggregator into itself");
        }
        if (other.automaton != automaton) {
            throw new ForeignMatchSetException("cannot merge aggregators of " + other.automaton + " and " + automaton);
        }
        if (other.trackOccurrences != trackOccurrences) {
            throw new IllegalArgumentException("AssetScan: cannot merge aggregators with different occurrence tracking"
                + " (this: " + trackOccurrences + ", other: " + other.trackOccurrences + ")");
        }
        documentCount += other.documentCount;
        used.or(other.used);
        if (trackOccurrences) {
            other.occurrences.forEach((id, documents) ->
                occurrences.computeIfAbsent(id, k -> new ArrayList<>()).addAll(documents));
        }
        return this;
    }

    public MatchSet used() {
        return new MatchSet(automaton, (BitSet) used.clone());
    }

    public MatchSet unused() {
        return unused(automaton.allPatterns(), used());
    }

    public int documentCount() {
        return documentCount;
    }

    /**
     * Snapshot of the aggregation so far. Later {@code accept} calls do not affect it.
     */
    public UsageReport report() {
        Map<String, List<String>> byPattern = new LinkedHashMap<>();
        occurrences.forEach((id, documents) ->
            byPattern.put(automaton.pattern(new PatternId(id)), List.copyOf(documents)));
        MatchSet usedSnapshot = used();
        return new UsageReport(usedSnapshot, unused(automaton.allPatterns(), usedSnapshot), byPattern, documentCount);
    }

    private static void requireFrom(Automaton automaton, MatchSet matched) {
        if (matched.automaton() != automaton) {
            throw new ForeignMatchSetException(matched.automaton() + " vs " + automaton);
        }
    }
}
