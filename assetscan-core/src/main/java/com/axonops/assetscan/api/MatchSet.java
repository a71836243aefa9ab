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

import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable set of pattern ids drawn from one automaton's id space.
 *
 * <p>Returned by scans and by the aggregation functions of {@link UsageAggregator}. Ids can be
 * resolved back to pattern strings with {@link #patterns()}. Combining sets from different
 * automatons throws {@link ForeignMatchSetException}.
 *
 * @since 1.0.0
 */
public final class MatchSet implements Iterable<PatternId> {

    private final Automaton automaton;
    private final BitSet bits;

    /** Takes ownership of {@code bits}; the caller must not modify it afterwards. */
    MatchSet(Automaton automaton, BitSet bits) {
        this.automaton = Objects.requireNonNull(automaton);
        this.bits = bits;
    }

    public static MatchSet empty(Automaton automaton) {
        return new MatchSet(automaton, new BitSet());
    }

    /**
     * Creates a set from explicit ids.
     *
     * @throws IndexOutOfBoundsException if an id was not assigned by the automaton
     */
    public static MatchSet of(Automaton automaton, PatternId... ids) {
        BitSet bits = new BitSet(automaton.patternCount());
        for (PatternId id : ids) {
            bits.set(Objects.checkIndex(id.value(), automaton.patternCount()));
        }
        return new MatchSet(automaton, bits);
    }

    public Automaton automaton() {
        return automaton;
    }

    public boolean contains(PatternId id) {
        return bits.get(id.value());
    }

    /** Whether the given pattern string is in this set. False for strings not in the automaton. */
    public boolean contains(String pattern) {
        return automaton.idOf(pattern).map(this::contains).orElse(false);
    }

    public int size() {
        return bits.cardinality();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    /** Ids in ascending order. */
    public Set<PatternId> ids() {
        Set<PatternId> ids = bits.stream()
            .mapToObj(PatternId::new)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return Collections.unmodifiableSet(ids);
    }

    /** Pattern strings in id (registration) order. */
    public Set<String> patterns() {
        Set<String> patterns = bits.stream()
            .mapToObj(id -> automaton.pattern(new PatternId(id)))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return Collections.unmodifiableSet(patterns);
    }

    public MatchSet union(MatchSet other) {
        requireSameAutomaton(other);
        BitSet result = (BitSet) bits.clone();
        result.or(other.bits);
        return new MatchSet(automaton, result);
    }

    /** Ids in this set but not in {@code other}. */
    public MatchSet difference(MatchSet other) {
        requireSameAutomaton(other);
        BitSet result = (BitSet) bits.clone();
        result.andNot(other.bits);
        return new MatchSet(automaton, result);
    }

    /** Adds this set's ids to {@code target} without copying. */
    void addTo(BitSet target) {
        target.or(bits);
    }

    void requireSameAutomaton(MatchSet other) {
        if (other.automaton != automaton) {
            throw new ForeignMatchSetException(other.automaton + " vs " + automaton);
        }
    }

    @Override
    public Iterator<PatternId> iterator() {
        return ids().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchSet other)) {
            return false;
        }
        return automaton == other.automaton && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(automaton) + bits.hashCode();
    }

    @Override
    public String toString() {
        return "MatchSet" + patterns();
    }
}
