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

import com.axonops.assetscan.config.ScanConfig;
import com.axonops.assetscan.test.TestUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Scan semantics: overlaps, empty inputs, occurrence listing and early termination.
 */
@DisplayName("Scanner")
class ScannerTest {

    private static Automaton automaton(String... patterns) {
        return AutomatonBuilder.create(TestUtils.testConfig()).registerAll(List.of(patterns)).build();
    }

    @Test
    @DisplayName("Shorter pattern reported when the cursor first reaches the longer pattern's node")
    void testOverlappingPatterns() {
        Automaton automaton = automaton("ab", "abc");

        assertThat(automaton.scan("xabcx").patterns()).containsExactly("ab", "abc");
    }

    @Test
    void testSuffixPatternReportedThroughFailChain() {
        Automaton automaton = automaton("abcd", "bc", "c");

        assertThat(automaton.scan("xabcx").patterns()).containsExactly("bc", "c");
    }

    @Test
    void testEmptyDocumentMatchesNothing() {
        Automaton automaton = automaton("logo.png", "icon.png");

        MatchSet matched = automaton.scan("");

        assertThat(matched.isEmpty()).isTrue();
        assertThat(matched.size()).isZero();
    }

    @Test
    void testEmptyPatternSetMatchesNothing() {
        Automaton automaton = automaton();

        assertThat(automaton.scan("anything at all").isEmpty()).isTrue();
        assertThat(automaton.scan("").isEmpty()).isTrue();
    }

    @Test
    void testImageReferenceScenario() {
        Automaton automaton = automaton("logo.png", "icon.png", "banner.png");

        MatchSet used = automaton.scan("<img src='assets/logo.png'>");

        assertThat(used.patterns()).containsExactly("logo.png");
        assertThat(UsageAggregator.unused(automaton.allPatterns(), used).patterns())
            .containsExactly("icon.png", "banner.png");
    }

    @Test
    @DisplayName("Plain substring containment: no word or path boundary awareness")
    void testMatchesInsideLongerToken() {
        Automaton automaton = automaton("icon.png");

        assertThat(automaton.scan("url(bigicon.pngx)").patterns()).containsExactly("icon.png");
    }

    @Test
    void testMatchingIsCaseSensitive() {
        Automaton automaton = automaton("Logo.png");

        assertThat(automaton.scan("logo.png").isEmpty()).isTrue();
        assertThat(automaton.scan("LOGO.PNG").isEmpty()).isTrue();
        assertThat(automaton.scan("Logo.png").size()).isEqualTo(1);
    }

    @Test
    void testBinaryContentNeverFails() {
        Automaton automaton = automaton("PNG", "\u0000\u0001");
        String binary = "\u0089PNG\r\n\u001a\n\u0000\u0001\u0000\uFFFF\uD800";

        assertThat(automaton.scan(binary).patterns()).containsExactly("PNG", "\u0000\u0001");
    }

    @Test
    void testPatternLongerThanDocument() {
        Automaton automaton = automaton("background-image.png");

        assertThat(automaton.scan("background").isEmpty()).isTrue();
    }

    @Test
    void testScanAcceptsAnyCharSequence() {
        Automaton automaton = automaton("hero.jpg");
        StringBuilder content = new StringBuilder("<section style=\"background: url(");
        content.append("/img/hero.jpg)\">");

        assertThat(automaton.scan(content).patterns()).containsExactly("hero.jpg");
    }

    @Test
    void testScanDocument() {
        Automaton automaton = automaton("a.svg", "b.svg");

        MatchSet matched = automaton.scanner().scan(Document.of("src/app.html", "<img src=b.svg>"));

        assertThat(matched.patterns()).containsExactly("b.svg");
    }

    @Test
    void testRepeatedOccurrencesCountOnce() {
        Automaton automaton = automaton("aa");

        MatchSet matched = automaton.scan("aaaaaa");

        assertThat(matched.size()).isEqualTo(1);
        assertThat(matched.ids()).containsExactly(new PatternId(0));
    }

    @Test
    void testFindAllReportsEveryOccurrence() {
        Automaton automaton = automaton("he", "she", "his", "hers");

        List<Match> matches = automaton.findAll("ushers");

        assertThat(matches)
            .extracting(Match::pattern, Match::start, Match::end)
            .containsExactly(
                tuple("he", 2, 4),
                tuple("she", 1, 4),
                tuple("hers", 2, 6));
    }

    @Test
    void testFindAllOverlappingRepeats() {
        Automaton automaton = automaton("aa");

        assertThat(automaton.findAll("aaaa"))
            .extracting(Match::start)
            .containsExactly(0, 1, 2);
    }

    @Test
    void testFindAllOnEmptyInput() {
        assertThat(automaton("x").findAll("")).isEmpty();
    }

    @Test
    void testEarlyTerminationDoesNotChangeResult() {
        List<String> patterns = List.of("a", "ab", "b");
        Automaton eager = AutomatonBuilder.create(TestUtils.testConfigBuilder().earlyTermination(true).build())
            .registerAll(patterns).build();
        Automaton full = AutomatonBuilder.create(TestUtils.testConfigBuilder().earlyTermination(false).build())
            .registerAll(patterns).build();

        for (String text : List.of("ab", "abxxxxxxxx", "ba", "xxab", "a", "")) {
            assertThat(eager.scan(text).patterns()).as(text).isEqualTo(full.scan(text).patterns());
        }
    }

    @Test
    void testScannerIsSharedPerAutomaton() {
        Automaton automaton = automaton("x");

        assertThat(automaton.scanner()).isSameAs(automaton.scanner());
        assertThat(automaton.scanner().automaton()).isSameAs(automaton);
    }

    @Test
    void testDefaultConfigScans() {
        Automaton automaton = AutomatonBuilder.create().registerAll(List.of("x")).build();

        assertThat(automaton.config()).isEqualTo(ScanConfig.DEFAULT);
        assertThat(automaton.scan("xyz").patterns()).containsExactly("x");
    }
}
