package com.sfgen.generator.codegen.util;

/**
 * Encoding and decoding of Go interpreted string literals.
 */
public class GoStringLiterals {

    private GoStringLiterals() {
        // Utility class
    }

    /**
     * Quotes a value the way Go's {@code %q} verb does for printable text.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        value.codePoints().forEach(cp -> {
            switch (cp) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case 0x07 -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case 0x0B -> sb.append("\\v");
                default -> {
                    if (cp < 0x20 || cp == 0x7F) {
                        sb.append(String.format("\\x%02x", cp));
                    } else {
                        sb.appendCodePoint(cp);
                    }
                }
            }
        });
        sb.append('"');
        return sb.toString();
    }

    /**
     * Decodes the body of an interpreted string literal (the text between
     * the double quotes).
     *
     * @throws IllegalArgumentException on an invalid escape sequence
     */
    public static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 >= body.length()) {
                throw new IllegalArgumentException("unterminated escape sequence");
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'a' -> sb.append((char) 0x07);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append((char) 0x0B);
                case '\\' -> sb.append('\\');
                case '"' -> sb.append('"');
                case '\'' -> sb.append('\'');
                case 'x' -> {
                    sb.append((char) parseHex(body, i, 2));
                    i += 2;
                }
                case 'u' -> {
                    sb.appendCodePoint(parseHex(body, i, 4));
                    i += 4;
                }
                case 'U' -> {
                    sb.appendCodePoint(parseHex(body, i, 8));
                    i += 8;
                }
                default -> {
                    if (e >= '0' && e <= '7') {
                        if (i + 2 > body.length()) {
                            throw new IllegalArgumentException("invalid octal escape");
                        }
                        String octal = body.substring(i - 1, i + 2);
                        try {
                            sb.append((char) Integer.parseInt(octal, 8));
                        } catch (NumberFormatException ex) {
                            throw new IllegalArgumentException("invalid octal escape: \\" + octal, ex);
                        }
                        i += 2;
                    } else {
                        throw new IllegalArgumentException("unknown escape sequence: \\" + e);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int parseHex(String body, int start, int digits) {
        if (start + digits > body.length()) {
            throw new IllegalArgumentException("truncated hex escape");
        }
        String hex = body.substring(start, start + digits);
        if (!hex.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("invalid hex escape: " + hex);
        }
        long value = Long.parseLong(hex, 16);
        if (value > Character.MAX_CODE_POINT && digits == 8) {
            throw new IllegalArgumentException("escape sequence is invalid Unicode code point: " + hex);
        }
        return (int) value;
    }
}
