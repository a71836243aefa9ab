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

package com.axonops.assetscan.tools.cli;

import com.axonops.assetscan.tools.corpus.CorpusWalker;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by all commands. Each command reads the ones it needs.
 */
final class CliOptions {
    final List<Path> images = new ArrayList<>();
    final List<Path> directories = new ArrayList<>();
    final List<Path> files = new ArrayList<>();
    final List<String> excludes = new ArrayList<>(CorpusWalker.DEFAULT_EXCLUDES);
    final List<String> errors = new ArrayList<>();
    Path output = Path.of(".");
    Integer parallelism;
    boolean metrics;
    boolean jmx;
    boolean help;

    static CliOptions parse(String... args) {
        CliOptions options = new CliOptions();
        Args.match()
            .onValues(Args.options("-i", "--images"), values -> options.images.addAll(paths(values)))
            .onValues(Args.options("-d", "--directory"), values -> options.directories.addAll(paths(values)))
            .onValues(Args.options("-f", "--files", "--file"), values -> options.files.addAll(paths(values)))
            .onValues(Args.options("-x", "--exclude"), values -> {
                options.excludes.clear();
                options.excludes.addAll(values);
            })
            .on(Args.options("-o", "--output"), (String value) -> {
                if (value == null) {
                    options.errors.add("--output requires a directory");
                } else {
                    options.output = Path.of(value);
                }
            })
            .on(Args.options("-p", "--parallelism"), (String value) -> options.parallelism = parseParallelism(value, options.errors))
            .on(Args.options("--metrics"), () -> options.metrics = true)
            .on(Args.options("--jmx"), () -> options.jmx = true)
            .on(Args.options("-h", "--help"), () -> options.help = true)
            .rest(rest -> {
                if (!rest.isEmpty()) {
                    options.errors.add("Unrecognized arguments: " + String.join(" ", rest));
                }
            })
            .parse(args);
        return options;
    }

    private static List<Path> paths(List<String> values) {
        List<Path> paths = new ArrayList<>(values.size());
        for (String value : values) {
            paths.add(Path.of(value));
        }
        return paths;
    }

    private static Integer parseParallelism(String value, List<String> errors) {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            errors.add("--parallelism requires a number, got: " + value);
            return null;
        }
    }
}
