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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Corpus-wide partition of a pattern set into used and unused patterns.
 *
 * <p>Immutable snapshot produced by {@link UsageAggregator#report()}.
 *
 * @param used patterns occurring in at least one document
 * @param unused registered patterns occurring in no document
 * @param occurrences matched pattern to the ids of every document it appeared in, in the order the
 *     documents were aggregated, keyed in registration order; empty when occurrence tracking is
 *     disabled
 * @param documentCount number of documents aggregated
 * @since 1.0.0
 */
public record UsageReport(
    MatchSet used,
    MatchSet unused,
    Map<String, List<String>> occurrences,
    int documentCount) {

    public UsageReport {
        occurrences = Collections.unmodifiableMap(new LinkedHashMap<>(occurrences));
    }

    /** Used pattern strings, in registration order. */
    public Set<String> usedPatterns() {
        return used.patterns();
    }

    /** Unused pattern strings, in registration order. */
    public Set<String> unusedPatterns() {
        return unused.patterns();
    }

    /**
     * Documents in which the given pattern appeared.
     *
     * @return document ids, or an empty list if the pattern never matched
     */
    public List<String> documentsContaining(String pattern) {
        return occurrences.getOrDefault(pattern, List.of());
    }
}
