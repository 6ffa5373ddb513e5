package com.sfgen.generator.codegen.model;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity of one package load: the same directory loaded with a different
 * package selector or test setting is a different load.
 */
@Value
@Builder
public class SourceLocation {

    /**
     * Absolute, normalized directory holding the package sources.
     */
    @NonNull
    Path directory;

    /**
     * Package name used to choose between several packages found in the
     * directory; {@code null} when not given.
     */
    String packageSelector;

    boolean includeTestSources;

    public static SourceLocation of(Path directory, String packageSelector, boolean includeTestSources) {
        return new SourceLocation(directory.toAbsolutePath().normalize(),
                packageSelector == null || packageSelector.isBlank() ? null : packageSelector,
                includeTestSources);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(directory.toString());
        if (packageSelector != null) {
            sb.append('#').append(packageSelector);
        }
        if (includeTestSources) {
            sb.append(" (with tests)");
        }
        return sb.toString();
    }
}
