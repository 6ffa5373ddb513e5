package com.sfgen.generator.parser;

import com.sfgen.generator.codegen.util.GoStringLiterals;
import com.sfgen.generator.parser.GoToken.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tokenizer for Go source files.
 *
 * Comments are dropped and semicolons are inserted at line ends following
 * the Go language rules, so the parser only ever sees explicit statement
 * terminators.
 */
public class GoTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("package", TokenType.PACKAGE),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("type", TokenType.TYPE),
        Map.entry("func", TokenType.FUNC),
        Map.entry("var", TokenType.VAR),
        Map.entry("const", TokenType.CONST),
        Map.entry("struct", TokenType.STRUCT),
        Map.entry("interface", TokenType.INTERFACE),
        Map.entry("map", TokenType.MAP),
        Map.entry("chan", TokenType.CHAN)
    );

    private static final Map<Character, TokenType> PUNCTUATION = Map.ofEntries(
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry('{', TokenType.LBRACE),
        Map.entry('}', TokenType.RBRACE),
        Map.entry(',', TokenType.COMMA),
        Map.entry(';', TokenType.SEMICOLON),
        Map.entry('.', TokenType.DOT),
        Map.entry('*', TokenType.STAR),
        Map.entry('=', TokenType.ASSIGN),
        Map.entry('~', TokenType.TILDE)
    );

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
        "<-", "++", "--", ":=", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>", "&^",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^="
    );

    // Tokens after which a newline terminates the statement.
    private static final Set<TokenType> SEMICOLON_TRIGGERS = EnumSet.of(
        TokenType.IDENTIFIER,
        TokenType.NUMERIC_LITERAL,
        TokenType.STRING_LITERAL,
        TokenType.RUNE_LITERAL,
        TokenType.RPAREN,
        TokenType.RBRACKET,
        TokenType.RBRACE
    );

    private final String source;
    private final String fileName;
    private final List<GoToken> tokens = new ArrayList<>();
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public GoTokenizer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source file.
     */
    public List<GoToken> tokenize() {
        while (true) {
            boolean sawNewline = skipWhitespaceAndComments();
            if (sawNewline) {
                insertSemicolon();
            }
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }
        insertSemicolon();
        tokens.add(new GoToken(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void insertSemicolon() {
        if (tokens.isEmpty()) {
            return;
        }
        GoToken last = tokens.get(tokens.size() - 1);
        boolean trigger = SEMICOLON_TRIGGERS.contains(last.getType())
                || (last.getType() == TokenType.OPERATOR
                    && ("++".equals(last.getValue()) || "--".equals(last.getValue())));
        if (trigger) {
            tokens.add(new GoToken(TokenType.SEMICOLON, "\n", last.getLine(), last.getColumn()));
        }
    }

    /**
     * Skips whitespace and comments, reporting whether a line break was
     * crossed (a block comment spanning lines counts as one).
     */
    private boolean skipWhitespaceAndComments() {
        boolean newline = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                newline = true;
                advanceChar();
            } else if (Character.isWhitespace(c)) {
                advanceChar();
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advanceChar();
                }
            } else if (c == '/' && peekChar(1) == '*') {
                int startLine = line;
                int startCol = column;
                advanceChar();
                advanceChar();
                while (pos < source.length() && !(source.charAt(pos) == '*' && peekChar(1) == '/')) {
                    if (source.charAt(pos) == '\n') {
                        newline = true;
                    }
                    advanceChar();
                }
                if (pos >= source.length()) {
                    throw new ParseException(fileName, startLine, startCol, "comment not terminated");
                }
                advanceChar();
                advanceChar();
            } else {
                break;
            }
        }
        return newline;
    }

    private GoToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        if (c == '"') {
            return readInterpretedString(startLine, startCol);
        }
        if (c == '`') {
            return readRawString(startLine, startCol);
        }
        if (c == '\'') {
            return readRune(startLine, startCol);
        }
        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekChar(1)))) {
            return readNumber(startLine, startCol);
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword(startLine, startCol);
        }
        if (c == '.' && peekChar(1) == '.' && peekChar(2) == '.') {
            advanceChar();
            advanceChar();
            advanceChar();
            return new GoToken(TokenType.ELLIPSIS, "...", startLine, startCol);
        }
        if (pos + 1 < source.length()) {
            String two = source.substring(pos, pos + 2);
            if (TWO_CHAR_OPERATORS.contains(two)) {
                advanceChar();
                advanceChar();
                TokenType type = "<-".equals(two) ? TokenType.ARROW : TokenType.OPERATOR;
                return new GoToken(type, two, startLine, startCol);
            }
        }
        advanceChar();
        TokenType type = PUNCTUATION.getOrDefault(c, TokenType.OPERATOR);
        return new GoToken(type, String.valueOf(c), startLine, startCol);
    }

    private GoToken readInterpretedString(int startLine, int startCol) {
        advanceChar();
        int bodyStart = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                String body = source.substring(bodyStart, pos);
                advanceChar();
                try {
                    return new GoToken(TokenType.STRING_LITERAL, GoStringLiterals.unescape(body), startLine, startCol);
                } catch (IllegalArgumentException e) {
                    throw new ParseException(fileName, startLine, startCol, e.getMessage());
                }
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                advanceChar();
            }
            advanceChar();
        }
        throw new ParseException(fileName, startLine, startCol, "string literal not terminated");
    }

    private GoToken readRawString(int startLine, int startCol) {
        advanceChar();
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            advanceChar();
            if (c == '`') {
                return new GoToken(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
            }
            // Carriage returns are discarded from raw string values.
            if (c != '\r') {
                sb.append(c);
            }
        }
        throw new ParseException(fileName, startLine, startCol, "raw string literal not terminated");
    }

    private GoToken readRune(int startLine, int startCol) {
        advanceChar();
        int bodyStart = pos;
        while (pos < source.length() && source.charAt(pos) != '\'') {
            if (source.charAt(pos) == '\n') {
                throw new ParseException(fileName, startLine, startCol, "rune literal not terminated");
            }
            if (source.charAt(pos) == '\\') {
                advanceChar();
            }
            advanceChar();
        }
        if (pos >= source.length()) {
            throw new ParseException(fileName, startLine, startCol, "rune literal not terminated");
        }
        String body = source.substring(bodyStart, pos);
        advanceChar();
        return new GoToken(TokenType.RUNE_LITERAL, body, startLine, startCol);
    }

    private GoToken readNumber(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                advanceChar();
            } else if ((c == '+' || c == '-') && isExponentMarker(source.charAt(pos - 1), source, start)) {
                advanceChar();
            } else {
                break;
            }
        }
        return new GoToken(TokenType.NUMERIC_LITERAL, source.substring(start, pos), startLine, startCol);
    }

    private static boolean isExponentMarker(char previous, String source, int numberStart) {
        boolean hex = source.startsWith("0x", numberStart) || source.startsWith("0X", numberStart);
        return hex ? (previous == 'p' || previous == 'P') : (previous == 'e' || previous == 'E');
    }

    private GoToken readIdentifierOrKeyword(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                advanceChar();
            } else {
                break;
            }
        }
        String value = source.substring(start, pos);
        TokenType keywordType = KEYWORDS.get(value);
        if (keywordType != null) {
            return new GoToken(keywordType, value, startLine, startCol);
        }
        return new GoToken(TokenType.IDENTIFIER, value, startLine, startCol);
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advanceChar() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
