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

import java.util.Objects;

/**
 * One unit of already-loaded content to scan, with an external identity (usually a file path).
 *
 * <p>The content is treated as an arbitrary character sequence; scanning never fails on binary or
 * malformed text and never mutates it.
 *
 * @param id external identity, reported back in usage reports
 * @param content the text to scan
 * @since 1.0.0
 */
public record Document(String id, CharSequence content) {

    public Document {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(content, "content cannot be null");
    }

    public static Document of(String id, CharSequence content) {
        return new Document(id, content);
    }

    public int length() {
        return content.length();
    }

    @Override
    public String toString() {
        return "Document[" + id + ", " + content.length() + " chars]";
    }
}
