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
 * Goto function of the trie, stored as flat arrays indexed by node.
 *
 * <p>The outgoing edges of node {@code n} occupy {@code [offsets[n], offsets[n + 1])} in
 * {@code labels} and {@code targets}, with labels sorted ascending so a lookup is a binary search
 * within that slice. Every node except the root has exactly one incoming edge, so both edge arrays
 * have {@code nodeCount - 1} entries.
 *
 * <p>Immutable once constructed; the arrays are never exposed.
 */
final class GotoTable {

    static final int NO_EDGE = -1;

    private final int[] offsets;
    private final char[] labels;
    private final int[] targets;

    GotoTable(int[] offsets, char[] labels, int[] targets) {
        if (offsets.length == 0 || labels.length != targets.length
                || offsets[offsets.length - 1] != labels.length) {
            throw new IllegalArgumentException("inconsistent goto table: " + offsets.length
                + " offsets, " + labels.length + " labels, " + targets.length + " targets");
        }
        this.offsets = offsets;
        this.labels = labels;
        this.targets = targets;
    }

    /**
     * Follows the edge labelled {@code c} out of {@code node}.
     *
     * @return child index, or {@link #NO_EDGE}
     */
    int next(int node, char c) {
        int lo = offsets[node];
        int hi = offsets[node + 1] - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            char label = labels[mid];
            if (label < c) {
                lo = mid + 1;
            } else if (label > c) {
                hi = mid - 1;
            } else {
                return targets[mid];
            }
        }
        return NO_EDGE;
    }

    int nodeCount() {
        return offsets.length - 1;
    }

    int edgeStart(int node) {
        return offsets[node];
    }

    int edgeEnd(int node) {
        return offsets[node + 1];
    }

    char label(int edge) {
        return labels[edge];
    }

    int target(int edge) {
        return targets[edge];
    }
}
