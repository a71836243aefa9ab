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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects SASS ({@code $name: value;}) and CSS custom property ({@code --name: value;})
 * definitions across style files and groups each variable as unique, duplicated with one value,
 * or conflicting.
 *
 * <p>CSS properties are only read inside selector blocks, and are attributed to
 * {@code <file>.<selector>} with the selector's leading {@code :}, {@code #} or {@code .} removed.
 * A class selector therefore reads {@code a.scss.dark}, never {@code a.scss..dark}. Within one file
 * (or one block) a later definition of the same variable replaces an earlier one.
 *
 * <p>Not thread-safe.
 *
 * @since 1.0.0
 */
public final class SassVariableAnalyzer {

    static final Pattern SASS_VARIABLE = Pattern.compile("(\\$[\\w-]+):\\s+([^;]+);");
    static final Pattern CSS_VARIABLE = Pattern.compile("(--[\\w-]+):\\s+([^;]+);");
    static final Pattern SELECTOR_BLOCK = Pattern.compile("([:#.]?[\\w-]+)\\s*\\{([^}]*)\\}");

    private static final Pattern LINE_COMMENT = Pattern.compile("\\s*//[^\\n]*");
    private static final Pattern SASS_LINE = Pattern.compile("\\$[\\w-]+[^\\n]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n+");

    public static final String SASS_FILE = "sass_variables.scss";
    public static final String CSS_FILE = "css_variables.scss";

    /** One definition of a variable. */
    public record Definition(String source, String value) {
    }

    private final Map<String, List<Definition>> sassVariables = new LinkedHashMap<>();
    private final Map<String, List<Definition>> cssVariables = new LinkedHashMap<>();

    /**
     * Adds the definitions found in one file.
     *
     * @param fileName name used to attribute definitions
     * @param content file content
     * @return this analyzer
     */
    public SassVariableAnalyzer accept(String fileName, String content) {
        Objects.requireNonNull(fileName, "fileName cannot be null");
        Objects.requireNonNull(content, "content cannot be null");

        addAll(sassVariables, definitions(SASS_VARIABLE, content), fileName);

        Matcher block = SELECTOR_BLOCK.matcher(stripNonCss(content));
        while (block.find()) {
            String selector = strip(strip(strip(block.group(1), ':'), '#'), '.').strip();
            addAll(cssVariables, definitions(CSS_VARIABLE, block.group(2)), fileName + "." + selector);
        }
        return this;
    }

    public Map<String, List<Definition>> sassVariables() {
        return sassVariables;
    }

    public Map<String, List<Definition>> cssVariables() {
        return cssVariables;
    }

    /** Report text for SASS variables. */
    public String renderSass() {
        return render(sassVariables);
    }

    /** Report text for CSS variables, wrapped in a {@code :cssVariables} block. */
    public String renderCss() {
        return ":cssVariables{\n" + render(cssVariables) + "}";
    }

    private static String render(Map<String, List<Definition>> variables) {
        StringBuilder unique = new StringBuilder();
        StringBuilder duplicate = new StringBuilder();
        StringBuilder conflict = new StringBuilder();

        for (Map.Entry<String, List<Definition>> entry : variables.entrySet()) {
            List<Definition> definitions = entry.getValue();
            if (definitions.size() == 1) {
                appendRow(unique, entry.getKey(), definitions.get(0));
                continue;
            }
            StringBuilder section = valuesMatch(definitions) ? duplicate : conflict;
            for (Definition definition : definitions) {
                appendRow(section, entry.getKey(), definition);
            }
            section.append('\n');
        }

        return "//Unique Values\n" + unique
            + "\n\n//Duplicate Values\n" + duplicate
            + "\n\n//Conflicting Values\n" + conflict;
    }

    private static void appendRow(StringBuilder out, String variable, Definition definition) {
        out.append(variable).append(": ").append(definition.value())
            .append("; //").append(definition.source()).append('\n');
    }

    private static boolean valuesMatch(List<Definition> definitions) {
        Set<String> values = new HashSet<>();
        for (Definition definition : definitions) {
            values.add(definition.value());
        }
        return values.size() == 1;
    }

    private static Map<String, String> definitions(Pattern pattern, String content) {
        Map<String, String> found = new LinkedHashMap<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            found.put(matcher.group(1).strip(), matcher.group(2).strip());
        }
        return found;
    }

    private static void addAll(Map<String, List<Definition>> target, Map<String, String> found, String source) {
        for (Map.Entry<String, String> entry : found.entrySet()) {
            target.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                .add(new Definition(source, entry.getValue()));
        }
    }

    /**
     * Drops line comments and SASS variable lines so only selector blocks remain.
     */
    static String stripNonCss(String content) {
        String stripped = LINE_COMMENT.matcher(content).replaceAll("");
        stripped = SASS_LINE.matcher(stripped).replaceAll("");
        return BLANK_LINES.matcher(stripped).replaceAll("\n").strip();
    }

    private static String strip(String value, char c) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == c) {
            start++;
        }
        while (end > start && value.charAt(end - 1) == c) {
            end--;
        }
        return value.substring(start, end);
    }
}
