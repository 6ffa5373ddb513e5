package com.sfgen.generator.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and evaluates the build constraint lines at the top of a Go source
 * file against a {@link BuildContext}.
 *
 * A {@code //go:build} line takes precedence; without one, all
 * {@code // +build} lines must be satisfied. Constraints only count in the
 * comment header before the package clause.
 */
public final class BuildConstraints {

    private static final String GO_BUILD = "//go:build";
    private static final String PLUS_BUILD = "// +build";

    private BuildConstraints() {
        // Utility class
    }

    /**
     * @throws ParseException when a {@code //go:build} expression is malformed
     */
    public static boolean isSatisfied(String source, String fileName, BuildContext context) {
        String goBuild = null;
        int goBuildLine = 0;
        List<String> plusBuild = new ArrayList<>();
        boolean inBlockComment = false;
        String[] lines = source.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (inBlockComment) {
                inBlockComment = !line.contains("*/");
                continue;
            }
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("/*")) {
                inBlockComment = !line.contains("*/");
                continue;
            }
            if (!line.startsWith("//")) {
                break;
            }
            if (goBuild == null && isDirective(line, GO_BUILD)) {
                goBuild = line.substring(GO_BUILD.length()).strip();
                goBuildLine = i + 1;
            } else if (isDirective(line, PLUS_BUILD)) {
                plusBuild.add(line.substring(PLUS_BUILD.length()).strip());
            }
        }

        if (goBuild != null) {
            return new ExpressionEvaluator(goBuild, context, fileName, goBuildLine).evaluate();
        }
        return plusBuild.stream().allMatch(line -> evaluatePlusBuild(line, context));
    }

    private static boolean isDirective(String line, String prefix) {
        return line.startsWith(prefix)
                && (line.length() == prefix.length() || Character.isWhitespace(line.charAt(prefix.length())));
    }

    /**
     * Space-separated options are alternatives; comma-separated terms within
     * an option must all hold.
     */
    private static boolean evaluatePlusBuild(String line, BuildContext context) {
        if (line.isEmpty()) {
            return true;
        }
        for (String option : line.split("\\s+")) {
            boolean all = true;
            for (String term : option.split(",")) {
                boolean negated = term.startsWith("!");
                String tag = negated ? term.substring(1) : term;
                if (tag.isEmpty() || context.hasTag(tag) == negated) {
                    all = false;
                    break;
                }
            }
            if (all) {
                return true;
            }
        }
        return false;
    }

    /**
     * Recursive-descent evaluation of {@code //go:build} expressions:
     * {@code ||}, {@code &&}, {@code !}, parentheses and tags.
     */
    private static final class ExpressionEvaluator {
        private final String text;
        private final BuildContext context;
        private final String fileName;
        private final int line;
        private int pos = 0;

        ExpressionEvaluator(String text, BuildContext context, String fileName, int line) {
            this.text = text;
            this.context = context;
            this.fileName = fileName;
            this.line = line;
        }

        boolean evaluate() {
            boolean result = parseOr();
            skipSpaces();
            if (pos < text.length()) {
                throw error("invalid //go:build expression: " + text);
            }
            return result;
        }

        private boolean parseOr() {
            boolean result = parseAnd();
            while (consume("||")) {
                // No short-circuit: the right side must still be consumed.
                boolean right = parseAnd();
                result = result || right;
            }
            return result;
        }

        private boolean parseAnd() {
            boolean result = parseNot();
            while (consume("&&")) {
                boolean right = parseNot();
                result = result && right;
            }
            return result;
        }

        private boolean parseNot() {
            if (consume("!")) {
                return !parseNot();
            }
            if (consume("(")) {
                boolean inner = parseOr();
                if (!consume(")")) {
                    throw error("missing ) in //go:build expression: " + text);
                }
                return inner;
            }
            skipSpaces();
            int start = pos;
            while (pos < text.length() && isTagChar(text.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw error("invalid //go:build expression: " + text);
            }
            return context.hasTag(text.substring(start, pos));
        }

        private boolean consume(String token) {
            skipSpaces();
            if (text.startsWith(token, pos)) {
                pos += token.length();
                return true;
            }
            return false;
        }

        private void skipSpaces() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private ParseException error(String message) {
            return new ParseException(fileName, line, 1, message);
        }

        private static boolean isTagChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '.';
        }
    }
}
