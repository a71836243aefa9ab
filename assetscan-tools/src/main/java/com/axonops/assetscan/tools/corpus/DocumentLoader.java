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

package com.axonops.assetscan.tools.corpus;

import com.axonops.assetscan.api.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Reads files into {@link Document}s keyed by path.
 *
 * <p>Content is decoded as UTF-8 with malformed sequences replaced, so binary or mis-encoded
 * files still load. A file that cannot be read is logged at WARN and skipped.
 *
 * @since 1.0.0
 */
public final class DocumentLoader {
    private static final Logger logger = LoggerFactory.getLogger(DocumentLoader.class);

    /**
     * Loads every readable file, in input order.
     */
    public List<Document> load(Collection<Path> files) {
        List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            load(file).ifPresent(documents::add);
        }
        logger.debug("AssetScan: Loaded {} of {} files", documents.size(), files.size());
        return documents;
    }

    /**
     * Loads one file.
     *
     * @return the document, or empty if the file could not be read
     */
    public Optional<Document> load(Path file) {
        try {
            return Optional.of(Document.of(file.toString(), decode(Files.readAllBytes(file))));
        } catch (IOException e) {
            logger.warn("AssetScan: Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    static String decode(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }
}
