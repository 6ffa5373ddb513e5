package com.sfgen.generator.model;

import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.Value;

/**
 * An import spec of a Go source file.
 */
@Value
public class GoImport {

    private static final Pattern MAJOR_VERSION = Pattern.compile("v[0-9]+");

    /**
     * Explicit import name, {@code null} when the package is imported under
     * its own name. May be {@code "_"} or {@code "."}.
     */
    String alias;

    @NonNull
    String path;

    /**
     * The identifier code in the importing file uses to qualify names from
     * this package.
     */
    public String qualifier() {
        return alias != null ? alias : guessPackageName(path);
    }

    public boolean isBlankOrDot() {
        return "_".equals(alias) || ".".equals(alias);
    }

    /**
     * Whether this unaliased import could bring {@code packageName} into
     * scope, allowing for the common {@code go-} prefix and {@code .go} or
     * {@code -go} suffix on repository names ({@code go-sqlite3},
     * {@code go.uuid}, {@code redis-go}).
     */
    public boolean mayDeclarePackage(String packageName) {
        if (alias != null) {
            return false;
        }
        String guessed = guessPackageName(path);
        if (guessed.equals(packageName)) {
            return true;
        }
        String trimmed = guessed;
        if (trimmed.startsWith("go-") || trimmed.startsWith("go.")) {
            trimmed = trimmed.substring(3);
        }
        if (trimmed.endsWith("-go") || trimmed.endsWith(".go")) {
            trimmed = trimmed.substring(0, trimmed.length() - 3);
        }
        return trimmed.equals(packageName) || trimmed.replaceAll("[-.]", "").equals(packageName);
    }

    /**
     * Best guess of the package clause name behind an import path, following
     * the usual conventions: the last path element, skipping a major version
     * suffix ({@code /v2}) and dropping a gopkg.in style {@code .vN} suffix.
     */
    public static String guessPackageName(String importPath) {
        String[] elements = importPath.split("/");
        String last = elements[elements.length - 1];
        if (MAJOR_VERSION.matcher(last).matches() && elements.length > 1) {
            last = elements[elements.length - 2];
        }
        int versionDot = last.indexOf(".v");
        if (versionDot > 0 && MAJOR_VERSION.matcher(last.substring(versionDot + 1)).matches()) {
            last = last.substring(0, versionDot);
        }
        return last;
    }
}
