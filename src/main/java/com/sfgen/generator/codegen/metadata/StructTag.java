package com.sfgen.generator.codegen.metadata;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code key:"name,option,..."} entry of a struct tag.
 */
@Value
public class StructTag {

    @NonNull
    String key;

    /**
     * Part of the value before the first comma.
     */
    @NonNull
    String name;

    @NonNull
    List<String> options;

    /**
     * The value with name and options joined back together.
     */
    public String value() {
        if (options.isEmpty()) {
            return name;
        }
        return name + "," + String.join(",", options);
    }
}
