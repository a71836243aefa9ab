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

/**
 * Dense identifier of a registered pattern, assigned in registration order starting at 0.
 *
 * <p>Identifiers are stable for the lifetime of one {@link Automaton} and only meaningful within
 * the builder that assigned them.
 *
 * @param value zero-based identifier
 * @since 1.0.0
 */
public record PatternId(int value) implements Comparable<PatternId> {

    public PatternId {
        if (value < 0) {
            throw new IllegalArgumentException("pattern id must be non-negative: " + value);
        }
    }

    @Override
    public int compareTo(PatternId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
