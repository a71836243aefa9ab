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

import com.axonops.assetscan.test.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class UsageAggregatorTest {

    private Automaton automaton;

    @BeforeEach
    void setUp() {
        automaton = AutomatonBuilder.create(TestUtils.testConfig())
            .registerAll(List.of("logo.png", "icon.png", "banner.png", "bg.jpg"))
            .build();
    }

    @Test
    void testUnionOfPerDocumentSets() {
        MatchSet first = automaton.scan("logo.png");
        MatchSet second = automaton.scan("bg.jpg and logo.png");

        MatchSet used = UsageAggregator.union(automaton, List.of(first, second));

        assertThat(used.patterns()).containsExactly("logo.png", "bg.jpg");
    }

    @Test
    void testUnionOfNothingIsEmpty() {
        assertThat(UsageAggregator.union(automaton, List.of()).isEmpty()).isTrue();
    }

    @Test
    void testUnusedIsSetDifference() {
        MatchSet used = automaton.scan("icon.png");

        MatchSet unused = UsageAggregator.unused(automaton.allPatterns(), used);

        assertThat(unused.patterns()).containsExactly("logo.png", "banner.png", "bg.jpg");
        assertThat(unused.union(used)).isEqualTo(automaton.allPatterns());
    }

    @Test
    void testAggregationLaw() {
        Random random = new Random(77);
        List<String> patterns = TestUtils.randomPatterns(random, "abc", 40, 4);
        Automaton random40 = AutomatonBuilder.create(TestUtils.testConfig()).registerAll(patterns).build();

        List<String> texts = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            texts.add(TestUtils.randomString(random, "abc", 0, 30));
        }

        UsageAggregator aggregator = new UsageAggregator(random40);
        for (int i = 0; i < texts.size(); i++) {
            aggregator.accept("doc" + i, random40.scan(texts.get(i)));
        }

        Set<String> expectedUsed = new LinkedHashSet<>();
        for (String text : texts) {
            expectedUsed.addAll(TestUtils.bruteForce(patterns, text));
        }
        Set<String> expectedUnused = new LinkedHashSet<>(patterns);
        expectedUnused.removeAll(expectedUsed);

        assertThat(aggregator.used().patterns()).containsExactlyInAnyOrderElementsOf(expectedUsed);
        assertThat(aggregator.unused().patterns()).containsExactlyInAnyOrderElementsOf(expectedUnused);
    }

    @Test
    void testOccurrencesFollowAcceptOrder() {
        UsageAggregator aggregator = new UsageAggregator(automaton, true);
        aggregator.accept("b.html", automaton.scan("logo.png"));
        aggregator.accept("a.css", automaton.scan("url(logo.png) url(bg.jpg)"));
        aggregator.accept("c.ts", automaton.scan("nothing"));

        UsageReport report = aggregator.report();

        assertThat(report.documentCount()).isEqualTo(3);
        assertThat(report.documentsContaining("logo.png")).containsExactly("b.html", "a.css");
        assertThat(report.documentsContaining("bg.jpg")).containsExactly("a.css");
        assertThat(report.documentsContaining("icon.png")).isEmpty();
        assertThat(report.occurrences().keySet()).containsExactly("logo.png", "bg.jpg");
        assertThat(report.unusedPatterns()).containsExactly("icon.png", "banner.png");
    }

    @Test
    void testOccurrenceTrackingCanBeDisabled() {
        UsageAggregator aggregator = new UsageAggregator(automaton, false);
        aggregator.accept("a.css", automaton.scan("logo.png"));

        UsageReport report = aggregator.report();

        assertThat(report.occurrences()).isEmpty();
        assertThat(report.usedPatterns()).containsExactly("logo.png");
    }

    @Test
    void testMergeIsOrderIndependentForUsage() {
        List<String> texts = List.of("logo.png", "banner.png", "", "bg.jpg logo.png");

        UsageAggregator forward = new UsageAggregator(automaton);
        texts.forEach(t -> forward.accept(t, automaton.scan(t)));

        List<String> shuffled = new ArrayList<>(texts);
        Collections.reverse(shuffled);
        UsageAggregator left = new UsageAggregator(automaton);
        UsageAggregator right = new UsageAggregator(automaton);
        left.accept(shuffled.get(0), automaton.scan(shuffled.get(0)));
        left.accept(shuffled.get(1), automaton.scan(shuffled.get(1)));
        right.accept(shuffled.get(2), automaton.scan(shuffled.get(2)));
        right.accept(shuffled.get(3), automaton.scan(shuffled.get(3)));
        UsageAggregator merged = right.merge(left);

        assertThat(merged.used()).isEqualTo(forward.used());
        assertThat(merged.unused()).isEqualTo(forward.unused());
        assertThat(merged.documentCount()).isEqualTo(4);
        assertThat(merged.report().documentsContaining("logo.png")).hasSize(2);
    }

    @Test
    void testMergeIntoSelfRejected() {
        UsageAggregator aggregator = new UsageAggregator(automaton);
        aggregator.accept("d1", automaton.scan("logo.png"));

        assertThatThrownBy(() -> aggregator.merge(aggregator))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("itself");

        assertThat(aggregator.documentCount()).isEqualTo(1);
        assertThat(aggregator.report().documentsContaining("logo.png")).containsExactly("d1");
    }

    @Test
    void testMergeWithDifferentOccurrenceTrackingRejected() {
        UsageAggregator tracking = new UsageAggregator(automaton, true);
        UsageAggregator counting = new UsageAggregator(automaton, false);
        tracking.accept("d1", automaton.scan("logo.png"));
        counting.accept("d2", automaton.scan("icon.png"));

        assertThatThrownBy(() -> tracking.merge(counting))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("occurrence tracking");
        assertThatThrownBy(() -> counting.merge(tracking))
            .isInstanceOf(IllegalArgumentException.class);

        // A rejected merge leaves both sides untouched
        UsageReport report = tracking.report();
        assertThat(report.documentCount()).isEqualTo(1);
        assertThat(report.usedPatterns()).containsExactly("logo.png");
        assertThat(report.occurrences()).containsOnlyKeys("logo.png");
    }

    @Test
    void testReportIsSnapshot() {
        UsageAggregator aggregator = new UsageAggregator(automaton);
        aggregator.accept("a", automaton.scan("logo.png"));
        UsageReport report = aggregator.report();

        aggregator.accept("b", automaton.scan("icon.png"));

        assertThat(report.usedPatterns()).containsExactly("logo.png");
        assertThat(report.documentsContaining("logo.png")).containsExactly("a");
        assertThatThrownBy(() -> report.occurrences().put("x", List.of()))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testForeignMatchSetsRejected() {
        Automaton other = AutomatonBuilder.create(TestUtils.testConfig())
            .registerAll(List.of("logo.png", "icon.png", "banner.png", "bg.jpg"))
            .build();
        MatchSet foreign = other.scan("logo.png");

        assertThatThrownBy(() -> UsageAggregator.union(automaton, List.of(foreign)))
            .isInstanceOf(ForeignMatchSetException.class);
        assertThatThrownBy(() -> UsageAggregator.unused(automaton.allPatterns(), foreign))
            .isInstanceOf(ForeignMatchSetException.class);
        assertThatThrownBy(() -> new UsageAggregator(automaton).accept("x", foreign))
            .isInstanceOf(ForeignMatchSetException.class);
        assertThatThrownBy(() -> new UsageAggregator(automaton).merge(new UsageAggregator(other)))
            .isInstanceOf(ForeignMatchSetException.class);
    }
}
