package com.sfgen.generator.codegen.metadata;

import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Reads the generator's own {@code sfgen} tag, which overrides the constant
 * value of a field regardless of other tags.
 *
 * Accepted forms:
 * <pre>
 *   sfgen:"name"
 *   sfgen:"name,json:jsonName db:dbName"
 * </pre>
 * A {@code key:value} entry whose key is the requested tag key replaces
 * {@code name}. An empty result counts as no override.
 */
@UtilityClass
public class FieldNameOverride {

    public static final String TAG_KEY = "sfgen";

    public static Optional<String> resolve(StructTags tags, String targetKey) {
        Optional<StructTag> override = tags.get(TAG_KEY);
        if (override.isEmpty()) {
            return Optional.empty();
        }
        String tagValue = override.get().value();
        if (tagValue.isEmpty()) {
            return Optional.empty();
        }

        String[] parts = tagValue.strip().split(",", 2);
        String name = parts[0];
        if (parts.length == 2) {
            for (String entry : parts[1].split(" ")) {
                String trimmed = entry.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                String[] keyValue = trimmed.split(":", 2);
                if (keyValue.length != 2 || !keyValue[0].equals(targetKey)) {
                    continue;
                }
                if (!keyValue[1].isEmpty()) {
                    name = keyValue[1];
                    break;
                }
            }
        }
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }
}
