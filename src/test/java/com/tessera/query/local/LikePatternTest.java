package com.tessera.query.local;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LikePattern Tests")
class LikePatternTest {

    @Test
    @DisplayName("Percent matches any sequence, including the empty one")
    void percentMatchesAnySequence() {
        LikePattern pattern = LikePattern.compile("abc%");

        assertThat(pattern.matches("abc")).isTrue();
        assertThat(pattern.matches("abcdef")).isTrue();
        assertThat(pattern.matches("xabc")).isFalse();
        assertThat(pattern.matches("ab")).isFalse();
    }

    @Test
    @DisplayName("Underscore matches exactly one character")
    void underscoreMatchesOneCharacter() {
        LikePattern pattern = LikePattern.compile("a_c");

        assertThat(pattern.matches("abc")).isTrue();
        assertThat(pattern.matches("a-c")).isTrue();
        assertThat(pattern.matches("ac")).isFalse();
        assertThat(pattern.matches("abbc")).isFalse();
    }

    @Test
    @DisplayName("Regex metacharacters are literal")
    void regexMetacharactersAreLiteral() {
        LikePattern pattern = LikePattern.compile("a.b[1]%");

        assertThat(pattern.matches("a.b[1]")).isTrue();
        assertThat(pattern.matches("a.b[1]xyz")).isTrue();
        assertThat(pattern.matches("axb1")).isFalse();
    }

    @Test
    @DisplayName("Pattern is anchored and spans newlines")
    void patternIsAnchored() {
        assertThat(LikePattern.compile("%mid%").matches("start\nmid\nend")).isTrue();
        assertThat(LikePattern.compile("mid").matches("amid")).isFalse();
    }

    @Test
    @DisplayName("Null values never match")
    void nullNeverMatches() {
        assertThat(LikePattern.compile("%").matches(null)).isFalse();
    }

    @Test
    @DisplayName("Null pattern is rejected")
    void nullPatternRejected() {
        assertThatThrownBy(() -> LikePattern.compile(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToRegex_QuotesLiteralRuns() {
        assertThat(LikePattern.toRegex("a%b_")).isEqualTo("^\\Qa\\E.*\\Qb\\E.$");
    }
}
