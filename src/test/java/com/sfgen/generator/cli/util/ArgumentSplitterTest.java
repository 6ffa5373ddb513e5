package com.sfgen.generator.cli.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ArgumentSplitter.
 */
class ArgumentSplitterTest {

    @Test
    void testWhitespaceSeparatesWords() {
        assertThat(ArgumentSplitter.split("  --struct Person\t--tag   db \n--export "))
                .containsExactly("--struct", "Person", "--tag", "db", "--export");
    }

    @Test
    void testEmptyInput() {
        assertThat(ArgumentSplitter.split("")).isEmpty();
        assertThat(ArgumentSplitter.split("   ")).isEmpty();
    }

    @Test
    void testSingleQuotesAreLiteral() {
        assertThat(ArgumentSplitter.split("--tag-regex '^col=(\\w+)$' x"))
                .containsExactly("--tag-regex", "^col=(\\w+)$", "x");
    }

    @Test
    void testDoubleQuotesHandleEscapes() {
        assertThat(ArgumentSplitter.split("--prefix \"a \\\"b\\\" \\$c \\n\""))
                .containsExactly("--prefix", "a \"b\" $c \\n");
    }

    @Test
    void testAdjacentQuotedPartsFormOneWord() {
        assertThat(ArgumentSplitter.split("a'b c'\"d\"e")).containsExactly("ab cde");
        assertThat(ArgumentSplitter.split("'' x")).containsExactly("", "x");
    }

    @Test
    void testBackslashOutsideQuotes() {
        assertThat(ArgumentSplitter.split("a\\ b c")).containsExactly("a b", "c");
        assertThat(ArgumentSplitter.split("a \\\nb")).containsExactly("a", "b");
    }

    @Test
    void testCommentAtWordStart() {
        assertThat(ArgumentSplitter.split("--struct Person # trailing words\n--tag db"))
                .containsExactly("--struct", "Person", "--tag", "db");
        assertThat(ArgumentSplitter.split("a#b")).containsExactly("a#b");
    }

    @Test
    void testUnclosedQuoteFails() {
        assertThatThrownBy(() -> ArgumentSplitter.split("--tag 'db"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("EOF found when expecting closing quote");
        assertThatThrownBy(() -> ArgumentSplitter.split("--tag \"db"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("EOF found when expecting closing quote");
    }

    @Test
    void testTrailingEscapeFails() {
        assertThatThrownBy(() -> ArgumentSplitter.split("--tag db\\"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("EOF found after escape character");
    }
}
