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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursively collects regular files under a root directory.
 *
 * <p>A file is skipped when the name of its <em>immediate</em> parent directory is in the
 * exclusion list. Files deeper below an excluded directory are still collected, so
 * {@code vendor/bourbon/x.scss} is skipped but {@code vendor/bourbon/lib/x.scss} is not.
 *
 * <p>Unreadable subdirectories and files are logged at WARN and skipped, the way
 * {@link DocumentLoader} skips unreadable files.
 *
 * <p>Results are sorted by path so reports are stable across runs.
 *
 * @since 1.0.0
 */
public final class CorpusWalker {
    private static final Logger logger = LoggerFactory.getLogger(CorpusWalker.class);

    /** Vendored style directories left out of every walk unless overridden. */
    public static final List<String> DEFAULT_EXCLUDES = List.of("bourbon", "custom", "neat");

    private final Set<String> excludedDirectories;

    public CorpusWalker() {
        this(DEFAULT_EXCLUDES);
    }

    public CorpusWalker(Collection<String> excludedDirectories) {
        this.excludedDirectories = Set.copyOf(Objects.requireNonNull(excludedDirectories, "excludedDirectories cannot be null"));
    }

    /**
     * Files under {@code root} whose file name matches {@code glob}.
     *
     * @param root directory to walk
     * @param glob file name glob such as {@code *} or {@code *.scss}
     * @throws CorpusException if {@code root} is not a directory or cannot be read
     */
    public List<Path> collect(Path root, String glob) {
        return collect(List.of(root), List.of(glob));
    }

    /**
     * Files under any of the roots matching any of the globs, each file at most once.
     *
     * @throws CorpusException if a root is not a directory or cannot be read
     */
    public List<Path> collect(Collection<Path> roots, Collection<String> globs) {
        List<PathMatcher> matchers = globs.stream()
            .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
            .collect(Collectors.toList());

        List<Path> files = new ArrayList<>();
        for (Path root : roots) {
            files.addAll(walk(root, matchers));
        }
        List<Path> distinct = files.stream().distinct().sorted().collect(Collectors.toList());

        logger.debug("AssetScan: Collected {} files - roots: {}, globs: {}", distinct.size(), roots, globs);
        return distinct;
    }

    private List<Path> walk(Path root, List<PathMatcher> matchers) {
        if (!Files.isDirectory(root)) {
            throw new CorpusException("Not a directory", root.toString());
        }
        FileCollector collector = new FileCollector(root, matchers);
        try {
            Files.walkFileTree(root, collector);
        } catch (IOException e) {
            throw new CorpusException("Failed to walk directory", root.toString(), e);
        }
        return collector.files;
    }

    /**
     * Collects matching files. Subdirectories and files that cannot be read are logged and
     * skipped; only a failure on the root itself aborts the walk.
     */
    final class FileCollector extends SimpleFileVisitor<Path> {
        private final Path root;
        private final List<PathMatcher> matchers;
        final List<Path> files = new ArrayList<>();

        FileCollector(Path root, List<PathMatcher> matchers) {
            this.root = root;
            this.matchers = matchers;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (Files.isRegularFile(file) && matchesAny(matchers, file.getFileName()) && !isExcluded(file)) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
            if (file.equals(root)) {
                throw e;
            }
            logger.warn("AssetScan: Skipping unreadable path {} - {}", file, e.toString());
            return FileVisitResult.CONTINUE;
        }
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path fileName) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    boolean isExcluded(Path file) {
        Path parent = file.getParent();
        if (parent == null || parent.getFileName() == null) {
            return false;
        }
        return excludedDirectories.contains(parent.getFileName().toString());
    }
}
