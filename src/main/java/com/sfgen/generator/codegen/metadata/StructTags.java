package com.sfgen.generator.codegen.metadata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.sfgen.generator.codegen.util.GoStringLiterals;

/**
 * Parsed struct tag: the space separated {@code key:"value"} pairs
 * conventionally stored in a Go struct field's tag string.
 */
public class StructTags {

    private static final StructTags EMPTY = new StructTags(List.of());

    private final List<StructTag> tags;

    private StructTags(List<StructTag> tags) {
        this.tags = List.copyOf(tags);
    }

    /**
     * Parses a raw tag string.
     *
     * @throws StructTagSyntaxException when a key, colon or quoted value is
     *                                  malformed
     */
    public static StructTags parse(String raw) throws StructTagSyntaxException {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        List<StructTag> tags = new ArrayList<>();
        String rest = raw;
        while (!rest.isEmpty()) {
            int i = 0;
            while (i < rest.length() && rest.charAt(i) == ' ') {
                i++;
            }
            rest = rest.substring(i);
            if (rest.isEmpty()) {
                break;
            }

            i = 0;
            while (i < rest.length() && rest.charAt(i) > ' ' && rest.charAt(i) != ':'
                    && rest.charAt(i) != '"' && rest.charAt(i) != 0x7f) {
                i++;
            }
            if (i == 0) {
                throw new StructTagSyntaxException("bad syntax for struct tag key in `" + raw + "`");
            }
            if (i + 1 >= rest.length() || rest.charAt(i) != ':') {
                throw new StructTagSyntaxException("bad syntax for struct tag pair in `" + raw + "`");
            }
            if (rest.charAt(i + 1) != '"') {
                throw new StructTagSyntaxException("bad syntax for struct tag value in `" + raw + "`");
            }
            String key = rest.substring(0, i);
            rest = rest.substring(i + 1);

            i = 1;
            while (i < rest.length() && rest.charAt(i) != '"') {
                if (rest.charAt(i) == '\\') {
                    i++;
                }
                i++;
            }
            if (i >= rest.length()) {
                throw new StructTagSyntaxException("bad syntax for struct tag value in `" + raw + "`");
            }
            String quoted = rest.substring(1, i);
            rest = rest.substring(i + 1);

            String value;
            try {
                value = GoStringLiterals.unescape(quoted);
            } catch (IllegalArgumentException e) {
                throw new StructTagSyntaxException("bad syntax for struct tag value in `" + raw + "`: " + e.getMessage());
            }
            String[] parts = value.split(",", -1);
            tags.add(new StructTag(key, parts[0], List.copyOf(Arrays.asList(parts).subList(1, parts.length))));
        }
        return new StructTags(tags);
    }

    /**
     * First tag with the given key.
     */
    public Optional<StructTag> get(String key) {
        return tags.stream().filter(tag -> tag.getKey().equals(key)).findFirst();
    }

    public List<StructTag> all() {
        return tags;
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }
}
