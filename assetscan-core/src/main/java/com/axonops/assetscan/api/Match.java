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
 * A single occurrence of a pattern inside a document.
 *
 * @param id identifier of the matched pattern
 * @param pattern the matched pattern text
 * @param start offset of the first matched character (inclusive)
 * @param end offset after the last matched character (exclusive)
 * @since 1.0.0
 */
public record Match(PatternId id, String pattern, int start, int end) {

    public int length() {
        return end - start;
    }
}
