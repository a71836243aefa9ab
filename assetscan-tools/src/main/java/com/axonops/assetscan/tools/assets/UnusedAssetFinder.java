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

package com.axonops.assetscan.tools.assets;

import com.axonops.assetscan.api.AssetIndex;
import com.axonops.assetscan.api.Document;
import com.axonops.assetscan.api.UsageReport;
import com.axonops.assetscan.config.ScanConfig;
import com.axonops.assetscan.tools.corpus.CorpusWalker;
import com.axonops.assetscan.tools.corpus.DocumentLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Finds asset files whose names appear in no source file.
 *
 * <p>Asset names are the file names (not paths) of every file under the asset directories.
 * Sources are the markup, script and style files under the source directories. Every asset name
 * becomes one pattern; a name occurring anywhere in any source, even inside a longer token, counts
 * as used.
 *
 * <pre>{@code
 * UnusedAssetFinder finder = new UnusedAssetFinder(new CorpusWalker(), new DocumentLoader(), ScanConfig.DEFAULT);
 * UnusedAssets result = finder.find(List.of(Path.of("src/assets/images")), List.of(Path.of("src")));
 * result.unusedAssets();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class UnusedAssetFinder {
    private static final Logger logger = LoggerFactory.getLogger(UnusedAssetFinder.class);

    /** Source files searched for asset references. */
    public static final List<String> SOURCE_GLOBS = List.of("*.html", "*.ts", "*.js", "*.scss", "*.css");

    private final CorpusWalker walker;
    private final DocumentLoader loader;
    private final ScanConfig config;

    public UnusedAssetFinder(CorpusWalker walker, DocumentLoader loader, ScanConfig config) {
        this.walker = Objects.requireNonNull(walker, "walker cannot be null");
        this.loader = Objects.requireNonNull(loader, "loader cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Walks both directory sets, scans the sources and reports asset usage.
     *
     * @param assetDirectories directories holding the assets; every file counts
     * @param sourceDirectories directories holding the sources
     * @return asset names, source files and the usage report
     */
    public UnusedAssets find(Collection<Path> assetDirectories, Collection<Path> sourceDirectories) {
        long startNanos = System.nanoTime();

        List<Path> assetFiles = walker.collect(assetDirectories, List.of("*"));
        List<String> assetNames = assetFiles.stream()
            .map(path -> path.getFileName().toString())
            .collect(Collectors.toList());
        logger.info("AssetScan: Found {} asset files", assetNames.size());

        List<Path> sourceFiles = walker.collect(sourceDirectories, SOURCE_GLOBS);
        logger.info("AssetScan: Found {} html, js, ts, scss, css files", sourceFiles.size());

        List<Document> documents = loader.load(sourceFiles);
        logger.info("AssetScan: Read {} files into memory", documents.size());

        AssetIndex index = AssetIndex.create(config);
        index.registerAll(assetNames);
        index.build();
        UsageReport report = index.scanAll(documents);

        logger.info("AssetScan: Found {} used assets, {} unused assets in {} ms",
            report.used().size(), report.unused().size(), (System.nanoTime() - startNanos) / 1_000_000);

        List<String> sourceNames = sourceFiles.stream()
            .map(path -> path.getFileName().toString())
            .collect(Collectors.toList());
        return new UnusedAssets(assetNames, sourceNames, report);
    }
}
