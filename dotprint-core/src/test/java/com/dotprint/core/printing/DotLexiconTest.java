package com.dotprint.core.printing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DotLexicon}.
 */
class DotLexiconTest {

    @ParameterizedTest
    @ValueSource(strings = {"node", "edge", "graph", "digraph", "subgraph", "strict", "NODE", "Graph", "DiGraph"})
    void isKeyword_reservedWordsInAnyCase_returnsTrue(String text) {
        assertThat(DotLexicon.isKeyword(text)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"nodes", "graphs", "edge1", "label", ""})
    void isKeyword_otherWords_returnsFalse(String text) {
        assertThat(DotLexicon.isKeyword(text)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a", "node_1", "_private", "Ünïcode", "x86_64", "A1b2"})
    void isIdString_validIdentifiers_returnsTrue(String text) {
        assertThat(DotLexicon.isIdString(text)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1abc", "a b", "a-b", "a.b", "\"a\"", "-x"})
    void isIdString_invalidIdentifiers_returnsFalse(String text) {
        assertThat(DotLexicon.isIdString(text)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "42", "-7", "3.14", ".5", "3.", "-.5", "-0.25"})
    void isNumString_numerals_returnsTrue(String text) {
        assertThat(DotLexicon.isNumString(text)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "-", ".", "-.", "1.2.3", "1e5", "+1", "--1", "1-", "12a"})
    void isNumString_nonNumerals_returnsFalse(String text) {
        assertThat(DotLexicon.isNumString(text)).isFalse();
    }

    @Test
    void classify_checksCategoriesInOrder() {
        assertThat(DotLexicon.classify("")).isEqualTo(TokenClass.EMPTY);
        assertThat(DotLexicon.classify("subgraph")).isEqualTo(TokenClass.KEYWORD);
        assertThat(DotLexicon.classify("cluster_0")).isEqualTo(TokenClass.IDENTIFIER);
        assertThat(DotLexicon.classify("-1.5")).isEqualTo(TokenClass.NUMBER);
        assertThat(DotLexicon.classify("hello world")).isEqualTo(TokenClass.OTHER);
    }

    @Test
    void isIdStart_highCharacters_areAccepted() {
        assertThat(DotLexicon.isIdStart('\u0080')).isTrue();
        assertThat(DotLexicon.isIdStart('é')).isTrue();
        assertThat(DotLexicon.isIdStart('7')).isFalse();
        assertThat(DotLexicon.isIdPart('7')).isTrue();
        assertThat(DotLexicon.isIdPart('-')).isFalse();
    }
}
