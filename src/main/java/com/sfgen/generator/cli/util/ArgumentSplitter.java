package com.sfgen.generator.cli.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command string into arguments the way a POSIX shell does, without
 * any expansion: whitespace separates words, single quotes keep text
 * literally, double quotes allow backslash escapes, a backslash outside
 * quotes escapes the next character, and {@code #} at the start of a word
 * starts a comment.
 */
public class ArgumentSplitter {

    private ArgumentSplitter() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException on an unclosed quote or a trailing
     *                                  backslash
     */
    public static List<String> split(String input) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        int i = 0;
        int length = input.length();
        while (i < length) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
                i++;
            } else if (c == '#' && !inWord) {
                while (i < length && input.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '\'') {
                int close = input.indexOf('\'', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("EOF found when expecting closing quote");
                }
                word.append(input, i + 1, close);
                inWord = true;
                i = close + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(input, i + 1, word);
                inWord = true;
            } else if (c == '\\') {
                if (i + 1 >= length) {
                    throw new IllegalArgumentException("EOF found after escape character");
                }
                // An escaped newline joins lines.
                if (input.charAt(i + 1) != '\n') {
                    word.append(input.charAt(i + 1));
                    inWord = true;
                }
                i += 2;
            } else {
                word.append(c);
                inWord = true;
                i++;
            }
        }
        if (inWord) {
            words.add(word.toString());
        }
        return words;
    }

    private static int readDoubleQuoted(String input, int start, StringBuilder word) {
        int i = start;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < input.length()) {
                char next = input.charAt(i + 1);
                if (next == '"' || next == '\\' || next == '$' || next == '`') {
                    word.append(next);
                    i += 2;
                    continue;
                }
                if (next == '\n') {
                    i += 2;
                    continue;
                }
            }
            word.append(c);
            i++;
        }
        throw new IllegalArgumentException("EOF found when expecting closing quote");
    }
}
