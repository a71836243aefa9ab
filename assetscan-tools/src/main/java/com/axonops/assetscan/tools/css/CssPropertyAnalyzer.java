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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Counts how often each {@code property: value} pair is written across style files, and how
 * often each class body (its normalized property list) is repeated.
 *
 * <p>Repeated class bodies are candidates for a shared mixin or utility class. Class bodies are
 * only collected from {@code .scss} files.
 *
 * @since 1.0.0
 */
public final class CssPropertyAnalyzer {

    static final Pattern PROPERTY_LINE = Pattern.compile("^\\s*([\\w-]*):\\s*([^;]*)", Pattern.MULTILINE);
    static final Pattern BLOCK_PROPERTY = Pattern.compile("\\s*([\\w-]*):\\s*([^;]*)");

    private static final Pattern BLOCK_OPENING = Pattern.compile("[^}]*\\{\\n");
    private static final Pattern BLOCK_CLOSING = Pattern.compile("\\s*\\}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String DELIMITER = "||";

    public static final String PROPERTIES_FILE = "properties.json";
    public static final String CLASS_PROPERTIES_FILE = "class_properties.json";

    /** A property/value pair and how often it was written. */
    public record PropertyCount(String property, String value, int count) {
    }

    /** A normalized class body, {@code prop:value;prop:value}, and how often it was written. */
    public record ClassBodyCount(String body, int count) {
    }

    /**
     * Property/value frequencies over all documents, most frequent first. Ties keep first
     * occurrence order.
     */
    public List<PropertyCount> propertyCounts(Collection<Document> documents) {
        Map<List<String>, Integer> counts = new LinkedHashMap<>();
        for (Document document : documents) {
            Matcher matcher = PROPERTY_LINE.matcher(document.content());
            while (matcher.find()) {
                counts.merge(List.of(matcher.group(1), matcher.group(2)), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<List<String>, Integer>comparingByValue().reversed())
            .map(e -> new PropertyCount(e.getKey().get(0), e.getKey().get(1), e.getValue()))
            .collect(Collectors.toList());
    }

    /**
     * Class body frequencies over the {@code .scss} documents, most frequent first.
     */
    public List<ClassBodyCount> classBodyCounts(Collection<Document> documents) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Document document : documents) {
            if (!document.id().endsWith(".scss")) {
                continue;
            }
            for (String body : classBodies(document.content().toString())) {
                counts.merge(body, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .map(e -> new ClassBodyCount(e.getKey(), e.getValue()))
            .collect(Collectors.toList());
    }

    /**
     * Splits {@code content} into class bodies and normalizes each to {@code prop:value;...}.
     * Bodies without any property are dropped.
     */
    static List<String> classBodies(String content) {
        String marked = BLOCK_OPENING.matcher(content).replaceAll("\n" + Matcher.quoteReplacement(DELIMITER));
        marked = BLOCK_CLOSING.matcher(marked).replaceAll(Matcher.quoteReplacement(DELIMITER) + "\n");
        String collapsed = WHITESPACE.matcher(marked).replaceAll(" ").strip();

        List<String> bodies = new ArrayList<>();
        for (String block : collapsed.split(Pattern.quote(DELIMITER))) {
            String trimmed = block.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            List<String> properties = new ArrayList<>();
            Matcher matcher = BLOCK_PROPERTY.matcher(trimmed);
            while (matcher.find()) {
                properties.add(matcher.group(1).strip() + ":" + matcher.group(2).strip());
            }
            if (!properties.isEmpty()) {
                bodies.add(String.join(";", properties));
            }
        }
        bodies.sort(Comparator.naturalOrder());
        return bodies;
    }

    /** Rows of {@code [property, value, count]}. */
    public static List<List<Object>> propertyRows(List<PropertyCount> counts) {
        return counts.stream()
            .map(c -> List.<Object>of(c.property(), c.value(), c.count()))
            .collect(Collectors.toList());
    }

    /** Rows of {@code [body, count]}. */
    public static List<List<Object>> classBodyRows(List<ClassBodyCount> counts) {
        return counts.stream()
            .map(c -> List.<Object>of(c.body(), c.count()))
            .collect(Collectors.toList());
    }
}
