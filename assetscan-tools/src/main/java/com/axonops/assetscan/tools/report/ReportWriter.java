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

package com.axonops.assetscan.tools.report;

import com.axonops.assetscan.tools.corpus.CorpusException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes report files into one output directory.
 *
 * <p>JSON reports are pretty printed with Gson and HTML escaping disabled, so names such as
 * {@code a&b.png} appear verbatim.
 *
 * @since 1.0.0
 */
public final class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private final Path outputDirectory;

    public ReportWriter(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory cannot be null");
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    /**
     * Serializes {@code value} to {@code fileName} as JSON.
     *
     * @return the written file
     * @throws CorpusException if the file cannot be written
     */
    public Path writeJson(String fileName, Object value) {
        Path target = prepare(fileName);
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            GSON.toJson(value, writer);
        } catch (IOException e) {
            throw new CorpusException("Failed to write report", target.toString(), e);
        }
        logger.info("AssetScan: Wrote {}", target);
        return target;
    }

    /**
     * Writes {@code content} verbatim.
     *
     * @return the written file
     * @throws CorpusException if the file cannot be written
     */
    public Path writeText(String fileName, String content) {
        Path target = prepare(fileName);
        try {
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorpusException("Failed to write report", target.toString(), e);
        }
        logger.info("AssetScan: Wrote {}", target);
        return target;
    }

    private Path prepare(String fileName) {
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new CorpusException("Failed to create output directory", outputDirectory.toString(), e);
        }
        return outputDirectory.resolve(fileName);
    }
}
