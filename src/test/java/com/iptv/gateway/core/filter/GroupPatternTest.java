package com.iptv.gateway.core.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GroupPatternTest {

    @Nested
    @DisplayName("Substring patterns")
    class SubstringPatterns {

        @Test
        @DisplayName("Matches anywhere in the label, ignoring case")
        void matchesContainedText() {
            assertThat(GroupPattern.matches("World News HD", "news")).isTrue();
            assertThat(GroupPattern.matches("world news hd", "NEWS")).isTrue();
            assertThat(GroupPattern.matches("Sports", "news")).isFalse();
        }

        @Test
        @DisplayName("Every label contains itself")
        void labelMatchesItself() {
            for (String label : new String[]{"UK", "Kids", "VOD - Action", "Series - Drama"}) {
                assertThat(GroupPattern.matches(label, label)).as(label).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("Wildcard patterns")
    class WildcardPatterns {

        @Test
        @DisplayName("Star matches any run of characters across the whole label")
        void starMatchesAnyRun() {
            assertThat(GroupPattern.matches("UK Movies", "uk*")).isTrue();
            assertThat(GroupPattern.matches("US Sports", "*sport*")).isTrue();
            assertThat(GroupPattern.matches("Sports US", "uk*")).isFalse();
        }

        @Test
        @DisplayName("Question mark matches exactly one character")
        void questionMarkMatchesOneCharacter() {
            assertThat(GroupPattern.matches("UK", "?k")).isTrue();
            assertThat(GroupPattern.matches("UKK", "?k")).isFalse();
            assertThat(GroupPattern.matches("K", "?k")).isFalse();
        }

        @Test
        @DisplayName("A lone star matches every label")
        void loneStarMatchesEverything() {
            assertThat(GroupPattern.matches("", "*")).isTrue();
            assertThat(GroupPattern.matches("Anything at all", "*")).isTrue();
        }

        @Test
        @DisplayName("Backtracks over several stars")
        void backtracksOverSeveralStars() {
            assertThat(GroupPattern.matches("abcabcabd", "*abd")).isTrue();
            assertThat(GroupPattern.matches("ab-cd-ef", "a*c*f")).isTrue();
            assertThat(GroupPattern.matches("ab-cd-eg", "a*c*f")).isFalse();
        }
    }

    @Nested
    @DisplayName("Multi-word patterns")
    class TokenPatterns {

        @Test
        @DisplayName("Each pattern word must match the label word at the same position")
        void matchesWordByWord() {
            assertThat(GroupPattern.matches("US| Sports HD", "us sports")).isTrue();
            assertThat(GroupPattern.matches("Sports US", "us sports")).isFalse();
        }

        @Test
        @DisplayName("Label needs at least as many words as the pattern")
        void rejectsShorterLabels() {
            assertThat(GroupPattern.matches("US", "us sports")).isFalse();
            assertThat(GroupPattern.matches("US Sports Extra", "us sports")).isTrue();
        }

        @Test
        @DisplayName("Words with wildcards are glob-matched against the whole label word")
        void wildcardWords() {
            assertThat(GroupPattern.matches("VOD - Action", "vod - *")).isTrue();
            assertThat(GroupPattern.matches("UK Movies", "u? movies")).isTrue();
            assertThat(GroupPattern.matches("USA Movies", "u? movies")).isFalse();
        }

        @Test
        @DisplayName("Mixes substring and wildcard words")
        void mixedWords() {
            assertThat(GroupPattern.matches("Sports HD", "sport h*")).isTrue();
            assertThat(GroupPattern.matches("Sports", "sport h*")).isFalse();
        }

        @Test
        @DisplayName("Extra whitespace in either side is ignored")
        void collapsesWhitespace() {
            assertThat(GroupPattern.matches("  US    Sports ", "us   sports")).isTrue();
        }
    }

    @Test
    @DisplayName("Compiled pattern keeps its source text")
    void keepsSource() {
        GroupPattern pattern = GroupPattern.compile("UK*");

        assertThat(pattern.source()).isEqualTo("UK*");
        assertThat(pattern.matches("uk sport")).isTrue();
    }
}
