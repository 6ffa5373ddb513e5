package com.sfgen.generator.parser;

import com.sfgen.generator.parser.GoToken.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GoTokenizer.
 */
class GoTokenizerTest {

    @Test
    void testSemicolonInsertedAfterIdentifierAtLineEnd() {
        List<GoToken> tokens = tokenize("package models\n");

        assertThat(types(tokens)).containsExactly(
                TokenType.PACKAGE, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF);
    }

    @Test
    void testNoSemicolonAfterOpeningBrace() {
        List<GoToken> tokens = tokenize("type A struct {\n}\n");

        assertThat(types(tokens)).containsExactly(
                TokenType.TYPE, TokenType.IDENTIFIER, TokenType.STRUCT, TokenType.LBRACE,
                TokenType.RBRACE, TokenType.SEMICOLON, TokenType.EOF);
    }

    @Test
    void testCommentsAreSkipped() {
        List<GoToken> tokens = tokenize("""
                // leading comment
                package a /* inline */ // trailing
                """);

        assertThat(values(tokens)).containsExactly("package", "a", "\n", "");
    }

    @Test
    void testMultiLineBlockCommentActsAsNewline() {
        List<GoToken> tokens = tokenize("x /* one\ntwo */ y");

        assertThat(types(tokens)).containsExactly(
                TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF);
    }

    @Test
    void testInterpretedStringIsUnescaped() {
        List<GoToken> tokens = tokenize("\"json:\\\"name\\\"\"");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.STRING_LITERAL);
        assertThat(tokens.get(0).getValue()).isEqualTo("json:\"name\"");
    }

    @Test
    void testRawStringKeepsBackslashesAndDropsCarriageReturns() {
        List<GoToken> tokens = tokenize("`db:\"a\\b\"\r\nx`");

        assertThat(tokens.get(0).getValue()).isEqualTo("db:\"a\\b\"\nx");
    }

    @Test
    void testChannelArrowAndEllipsis() {
        List<GoToken> tokens = tokenize("<-chan ...int");

        assertThat(types(tokens)).startsWith(TokenType.ARROW, TokenType.CHAN, TokenType.ELLIPSIS, TokenType.IDENTIFIER);
    }

    @Test
    void testNumbersWithExponentAndHex() {
        List<GoToken> tokens = tokenize("1e-3 0x1p+2 0o17");

        assertThat(tokens).filteredOn(token -> token.is(TokenType.NUMERIC_LITERAL))
                .extracting(GoToken::getValue)
                .containsExactly("1e-3", "0x1p+2", "0o17");
    }

    @Test
    void testTokenPositions() {
        List<GoToken> tokens = tokenize("package a\n\ntype B int\n");

        GoToken typeToken = tokens.stream().filter(token -> token.is(TokenType.TYPE)).findFirst().orElseThrow();
        assertThat(typeToken.getLine()).isEqualTo(3);
        assertThat(typeToken.getColumn()).isEqualTo(1);
    }

    @Test
    void testUnterminatedStringFails() {
        assertThatThrownBy(() -> tokenize("\"abc\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("test.go:1:1")
                .hasMessageContaining("string literal not terminated");
    }

    @Test
    void testUnterminatedBlockCommentFails() {
        assertThatThrownBy(() -> tokenize("/* never closed"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("comment not terminated");
    }

    private static List<GoToken> tokenize(String source) {
        return new GoTokenizer(source, "test.go").tokenize();
    }

    private static List<TokenType> types(List<GoToken> tokens) {
        return tokens.stream().map(GoToken::getType).toList();
    }

    private static List<String> values(List<GoToken> tokens) {
        return tokens.stream().map(GoToken::getValue).toList();
    }
}
