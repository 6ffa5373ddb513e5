package com.sfgen.generator.codegen.catalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.codegen.exception.LoadException;
import com.sfgen.generator.codegen.model.SourceLocation;
import com.sfgen.generator.codegen.util.FailFastTasks;
import com.sfgen.generator.model.GoSourceFile;
import com.sfgen.generator.model.TypeDeclaration;
import com.sfgen.generator.parser.BuildContext;
import com.sfgen.generator.parser.GoSourceParser;
import com.sfgen.generator.parser.ParseException;

/**
 * Loads every distinct source location once, concurrently, into a
 * {@link PackageCatalog}.
 *
 * The first failing location aborts the load; the others are cancelled.
 * The returned catalog is an immutable snapshot.
 */
public class PackageCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(PackageCatalogLoader.class);

    private static final String SOURCE_SUFFIX = ".go";
    private static final String TEST_SUFFIX = "_test.go";

    private final int parallelism;
    private final GoModuleLocator moduleLocator;
    private final BuildContext buildContext;

    public PackageCatalogLoader(int parallelism) {
        this(parallelism, BuildContext.host());
    }

    public PackageCatalogLoader(int parallelism, BuildContext buildContext) {
        this(parallelism, new GoModuleLocator(), buildContext);
    }

    public PackageCatalogLoader(int parallelism, GoModuleLocator moduleLocator, BuildContext buildContext) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.moduleLocator = moduleLocator;
        this.buildContext = buildContext;
    }

    public PackageCatalog load(Collection<SourceLocation> locations) {
        // Keys are claimed up front, so each distinct location is loaded once.
        Map<SourceLocation, Callable<LoadedPackage>> tasks = new LinkedHashMap<>();
        for (SourceLocation location : locations) {
            tasks.putIfAbsent(location, () -> loadPackage(location));
        }
        log.debug("Loading {} distinct package location(s) for {}/{}", tasks.size(),
                buildContext.getGoos(), buildContext.getGoarch());

        try {
            return new PackageCatalog(FailFastTasks.runAll(tasks, parallelism,
                    (location, cause) -> new LoadException(location, String.valueOf(cause.getMessage()), cause)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadException("interrupted while loading packages", e);
        }
    }

    LoadedPackage loadPackage(SourceLocation location) {
        Path dir = location.getDirectory();
        if (!Files.isDirectory(dir)) {
            throw new LoadException(location, "directory does not exist");
        }

        List<Path> sources = listSources(location);
        if (sources.isEmpty()) {
            throw new LoadException(location, "no Go files in " + dir);
        }

        String directoryImportPath;
        try {
            directoryImportPath = moduleLocator.importPathOf(dir).orElse(null);
        } catch (UncheckedIOException e) {
            throw new LoadException(location, e.getMessage(), e.getCause());
        }
        Map<String, List<GoSourceFile>> filesByPackage = new LinkedHashMap<>();
        for (Path source : sources) {
            GoSourceFile file = parseFile(location, source, directoryImportPath);
            if (file.isBuildIgnored()) {
                log.debug("Skipping {}: excluded by build constraints", source);
                continue;
            }
            filesByPackage.computeIfAbsent(file.getPackageName(), name -> new ArrayList<>()).add(file);
        }

        Map<String, List<GoSourceFile>> candidates = filesByPackage;
        if (candidates.size() != 1 && location.getPackageSelector() != null) {
            candidates = filesByPackage.entrySet().stream()
                    .filter(entry -> entry.getKey().equals(location.getPackageSelector()))
                    .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        }
        if (candidates.size() != 1) {
            filesByPackage.keySet().forEach(name -> log.warn("Found package {}#{}", dir, name));
            throw new LoadException(location, "expected to find 1 package, found " + candidates.size()
                    + (filesByPackage.isEmpty() ? "" : " " + filesByPackage.keySet()));
        }

        Map.Entry<String, List<GoSourceFile>> selected = candidates.entrySet().iterator().next();
        LoadedPackage loaded = buildSymbolTable(location, selected.getKey(), selected.getValue());
        log.debug("Loaded package {} ({}) with {} type declaration(s) from {} file(s)",
                loaded.describe(), loaded.getImportPath(), loaded.getDeclarations().size(),
                loaded.getFileNames().size());
        return loaded;
    }

    private List<Path> listSources(SourceLocation location) {
        try (Stream<Path> entries = Files.list(location.getDirectory())) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> isSourceFile(path.getFileName().toString(), location.isIncludeTestSources()))
                    .filter(this::matchesPlatform)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new LoadException(location, "failed to list directory: " + e.getMessage(), e);
        }
    }

    static boolean isSourceFile(String fileName, boolean includeTests) {
        if (!fileName.endsWith(SOURCE_SUFFIX) || fileName.startsWith(".") || fileName.startsWith("_")) {
            return false;
        }
        return includeTests || !fileName.endsWith(TEST_SUFFIX);
    }

    private boolean matchesPlatform(Path source) {
        if (buildContext.matchesFileName(source.getFileName().toString())) {
            return true;
        }
        log.debug("Skipping {}: file name targets another platform", source);
        return false;
    }

    private GoSourceFile parseFile(SourceLocation location, Path source, String directoryImportPath) {
        String content;
        try {
            content = Files.readString(source);
        } catch (IOException e) {
            throw new LoadException(location, "failed to read " + source + ": " + e.getMessage(), e);
        }
        try {
            return GoSourceParser.parseSource(content, source.getFileName().toString(), directoryImportPath,
                    buildContext);
        } catch (ParseException e) {
            throw new LoadException(location, e.getMessage(), e);
        }
    }

    private LoadedPackage buildSymbolTable(SourceLocation location, String packageName, List<GoSourceFile> files) {
        Map<String, TypeDeclaration> declarations = new LinkedHashMap<>();
        for (GoSourceFile file : files) {
            for (TypeDeclaration declaration : file.getTypeDeclarations()) {
                TypeDeclaration previous = declarations.putIfAbsent(declaration.getName(), declaration);
                if (previous != null) {
                    throw new LoadException(location, String.format("%s:%d: %s redeclared in this block (previous declaration at %s:%d)",
                            declaration.getSourceFile(), declaration.getSourceLine(), declaration.getName(),
                            previous.getSourceFile(), previous.getSourceLine()));
                }
            }
        }

        return LoadedPackage.builder()
                .location(location)
                .packageName(packageName)
                .importPath(files.get(0).getImportPath())
                .declarations(declarations)
                .fileNames(files.stream().map(GoSourceFile::getFileName).toList())
                .build();
    }
}
