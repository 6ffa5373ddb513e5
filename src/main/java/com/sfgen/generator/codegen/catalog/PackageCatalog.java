package com.sfgen.generator.codegen.catalog;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

import com.sfgen.generator.codegen.model.SourceLocation;

/**
 * Immutable snapshot of every package loaded for one run.
 */
public class PackageCatalog {

    private final Map<SourceLocation, LoadedPackage> packages;

    public PackageCatalog(Map<SourceLocation, LoadedPackage> packages) {
        this.packages = Map.copyOf(packages);
    }

    public Optional<LoadedPackage> lookup(SourceLocation location) {
        return Optional.ofNullable(packages.get(location));
    }

    /**
     * A loaded package with the given import path, preferring one loaded
     * with test sources since it declares a superset of the types.
     */
    public Optional<LoadedPackage> findByImportPath(String importPath) {
        return packages.values().stream()
                .filter(pkg -> pkg.getImportPath().equals(importPath))
                .max(Comparator.comparing(pkg -> pkg.getLocation().isIncludeTestSources()));
    }

    public Collection<LoadedPackage> packages() {
        return packages.values();
    }

    public int size() {
        return packages.size();
    }
}
