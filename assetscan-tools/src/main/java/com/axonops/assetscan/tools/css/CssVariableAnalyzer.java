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

package com.axonops.assetscan.tools.css;

import com.axonops.assetscan.api.Document;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cross-checks CSS custom property declarations against their {@code var(--name)} usages.
 *
 * <p>Declarations are read from a set of declaration files ({@code --name:}); usages from the
 * style sources. A used but undeclared variable is reported with the file names using it; a
 * declared but never used variable is reported as unused.
 *
 * @since 1.0.0
 */
public final class CssVariableAnalyzer {

    static final Pattern USAGE = Pattern.compile("var\\((--[a-zA-Z0-9-]+)\\)");
    static final Pattern DECLARATION = Pattern.compile("(--[\\w-]+):");

    public static final String DECLARED_FILE = "declared_variables.json";
    public static final String UNDECLARED_FILE = "undeclared_variables.json";
    public static final String UNUSED_FILE = "unused_variables.json";

    /**
     * Result of {@link #analyze}.
     *
     * @param declared every declared variable, sorted
     * @param undeclared used but undeclared variable to the file names using it
     * @param unused declared variables used nowhere, sorted
     */
    public record Report(SortedSet<String> declared, Map<String, List<String>> undeclared, SortedSet<String> unused) {
    }

    public Report analyze(Collection<Document> declarationFiles, Collection<Document> styleFiles) {
        SortedSet<String> declared = new TreeSet<>();
        for (Document document : declarationFiles) {
            declared.addAll(declarations(document.content()));
        }

        Map<String, List<String>> undeclared = new LinkedHashMap<>();
        Set<String> used = new LinkedHashSet<>();
        for (Document document : styleFiles) {
            Set<String> usages = usages(document.content());
            used.addAll(usages);
            String fileName = fileName(document.id());
            for (String variable : usages) {
                if (!declared.contains(variable)) {
                    undeclared.computeIfAbsent(variable, k -> new ArrayList<>()).add(fileName);
                }
            }
        }

        SortedSet<String> unused = new TreeSet<>(declared);
        unused.removeAll(used);
        return new Report(declared, undeclared, unused);
    }

    /** Variables declared in {@code content}, in first occurrence order. */
    public static Set<String> declarations(CharSequence content) {
        return firstGroups(DECLARATION, content);
    }

    /** Variables referenced through {@code var(...)} in {@code content}, in first occurrence order. */
    public static Set<String> usages(CharSequence content) {
        return firstGroups(USAGE, content);
    }

    private static Set<String> firstGroups(Pattern pattern, CharSequence content) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        return found;
    }

    private static String fileName(String documentId) {
        Path fileName = Path.of(documentId).getFileName();
        return fileName == null ? documentId : fileName.toString();
    }
}
