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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class CorpusWalkerTest {

    @TempDir
    Path root;

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, relative);
        return file;
    }

    @Test
    void testCollectsMatchingFilesRecursively() throws IOException {
        Path page = touch("app/index.html");
        Path style = touch("app/styles/site.scss");
        touch("app/readme.md");

        List<Path> files = new CorpusWalker().collect(List.of(root), List.of("*.html", "*.scss"));

        assertThat(files).containsExactly(page, style);
    }

    @Test
    void testExcludesOnlyImmediateParent() throws IOException {
        touch("vendor/bourbon/_mixins.scss");
        touch("vendor/neat/_grid.scss");
        Path nested = touch("vendor/bourbon/lib/_helpers.scss");
        Path kept = touch("styles/site.scss");

        List<Path> files = new CorpusWalker().collect(root, "*.scss");

        assertThat(files).containsExactlyInAnyOrder(nested, kept);
    }

    @Test
    void testCustomExclusions() throws IOException {
        Path bourbon = touch("bourbon/a.css");
        touch("legacy/b.css");

        List<Path> files = new CorpusWalker(List.of("legacy")).collect(root, "*.css");

        assertThat(files).containsExactly(bourbon);
    }

    @Test
    void testStarMatchesEveryFileButNoDirectories() throws IOException {
        Path logo = touch("images/logo.png");
        Path icon = touch("images/icons/icon.svg");

        List<Path> files = new CorpusWalker().collect(root, "*");

        assertThat(files).containsExactlyInAnyOrder(logo, icon);
    }

    @Test
    void testOverlappingRootsYieldEachFileOnce() throws IOException {
        Path page = touch("app/index.html");

        List<Path> files = new CorpusWalker().collect(List.of(root, root.resolve("app")), List.of("*.html"));

        assertThat(files).containsExactly(page);
    }

    @Test
    void testUnreadableSubdirectoryIsSkipped() throws IOException {
        Path kept = touch("app/index.html");
        Path locked = Files.createDirectories(root.resolve("vendor/locked"));
        CorpusWalker walker = new CorpusWalker();
        CorpusWalker.FileCollector collector =
            walker.new FileCollector(root, List.of(FileSystems.getDefault().getPathMatcher("glob:*.html")));

        FileVisitResult result = collector.visitFileFailed(locked, new AccessDeniedException(locked.toString()));
        collector.visitFile(kept, Files.readAttributes(kept, BasicFileAttributes.class));

        assertThat(result).isEqualTo(FileVisitResult.CONTINUE);
        assertThat(collector.files).containsExactly(kept);
    }

    @Test
    void testUnreadableRootAborts() {
        CorpusWalker.FileCollector collector = new CorpusWalker().new FileCollector(root, List.of());

        assertThatThrownBy(() -> collector.visitFileFailed(root, new AccessDeniedException(root.toString())))
            .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void testWalkContinuesPastPermissionDeniedDirectory() throws IOException {
        Path kept = touch("app/index.html");
        Path locked = touch("vendor/locked/hidden.html").getParent();
        Set<PosixFilePermission> original = Files.getPosixFilePermissions(locked);
        Files.setPosixFilePermissions(locked, Set.of());
        try {
            // Superuser reads through missing permissions
            assumeFalse(Files.isReadable(locked), "directory permissions are not enforced for this user");

            List<Path> files = new CorpusWalker().collect(root, "*.html");

            assertThat(files).containsExactly(kept);
        } finally {
            Files.setPosixFilePermissions(locked, original);
        }
    }

    @Test
    void testMissingRootFails() {
        Path missing = root.resolve("missing");

        assertThatThrownBy(() -> new CorpusWalker().collect(missing, "*"))
            .isInstanceOf(CorpusException.class)
            .hasMessageStartingWith("AssetScan:")
            .hasMessageContaining("missing");
    }
}
