package com.sfgen.generator.codegen.naming;

import java.util.Locale;

import com.sfgen.generator.codegen.model.NamingOptions;

/**
 * Derives the names of generated types, constants and files.
 *
 * The case of the first character of a base name is the only thing that
 * makes generated identifiers exported or unexported.
 */
public class ConstantNamingEngine {

    private static final String PREFIX_SUFFIX = "Field";

    private ConstantNamingEngine() {
        // Utility class
    }

    /**
     * Computes the base name shared by the generated type and all constants.
     *
     * @param options     naming options of the request
     * @param metadataKey struct tag key, may be {@code null}
     * @param recordName  struct name as requested
     */
    public static String baseName(NamingOptions options, String metadataKey, String recordName) {
        String key = metadataKey == null ? "" : metadataKey;
        String casedKey = options.isExportCasing() || options.isIncludeRecordNameInPrefix()
                ? key.toUpperCase(Locale.ROOT)
                : key.toLowerCase(Locale.ROOT);

        String prefix;
        if (options.getExplicitPrefix() != null) {
            prefix = options.getExplicitPrefix();
        } else if (options.isIncludeRecordNameInPrefix()) {
            prefix = recordName + casedKey + PREFIX_SUFFIX;
        } else {
            prefix = casedKey + PREFIX_SUFFIX;
        }
        return withFirstCharacterCase(prefix, options.isExportCasing());
    }

    public static String constantName(String baseName, String fieldIdentifier) {
        return baseName + fieldIdentifier;
    }

    /**
     * Default file name: {@code [struct]_[base]_generated.go}, lower-cased.
     */
    public static String defaultOutputFileName(String recordName, String baseName) {
        return recordName.toLowerCase(Locale.ROOT) + "_" + baseName.toLowerCase(Locale.ROOT) + "_generated.go";
    }

    /**
     * Method receiver name for the generated type.
     */
    public static String receiverName(String baseName) {
        if (baseName.isEmpty()) {
            throw new IllegalArgumentException("base name must not be empty");
        }
        return withFirstCharacterCase(baseName.substring(0, baseName.offsetByCodePoints(0, 1)), false);
    }

    /**
     * Returns a copy of {@code value} with its first code point upper- or
     * lower-cased.
     */
    public static String withFirstCharacterCase(String value, boolean upper) {
        if (value.isEmpty()) {
            return value;
        }
        int first = value.codePointAt(0);
        int cased = upper ? Character.toUpperCase(first) : Character.toLowerCase(first);
        return new StringBuilder(value.length())
                .appendCodePoint(cased)
                .append(value, Character.charCount(first), value.length())
                .toString();
    }
}
