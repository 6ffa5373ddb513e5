package com.sfgen.generator.codegen.catalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps directories to Go import paths using the nearest enclosing
 * {@code go.mod} file.
 *
 * Thread-safe; parsed module files are cached per directory.
 */
public class GoModuleLocator {
    private static final Logger log = LoggerFactory.getLogger(GoModuleLocator.class);

    static final String MODULE_FILE = "go.mod";

    private static final Pattern MODULE_DIRECTIVE =
            Pattern.compile("^\\s*module\\s+(\"([^\"]+)\"|`([^`]+)`|(\\S+))");

    private final ConcurrentMap<Path, Optional<String>> modulePathByRoot = new ConcurrentHashMap<>();

    /**
     * Import path of the package in {@code directory}, or empty when the
     * directory is not inside a module.
     */
    public Optional<String> importPathOf(Path directory) {
        Path dir = directory.toAbsolutePath().normalize();
        for (Path candidate = dir; candidate != null; candidate = candidate.getParent()) {
            if (!Files.isRegularFile(candidate.resolve(MODULE_FILE))) {
                continue;
            }
            Optional<String> modulePath = modulePathByRoot.computeIfAbsent(candidate, this::readModulePath);
            if (modulePath.isEmpty()) {
                return Optional.empty();
            }
            Path relative = candidate.relativize(dir);
            if (relative.toString().isEmpty()) {
                return modulePath;
            }
            StringBuilder importPath = new StringBuilder(modulePath.get());
            for (Path element : relative) {
                importPath.append('/').append(element);
            }
            return Optional.of(importPath.toString());
        }
        return Optional.empty();
    }

    private Optional<String> readModulePath(Path moduleRoot) {
        Path moduleFile = moduleRoot.resolve(MODULE_FILE);
        try {
            Optional<String> modulePath = parseModulePath(Files.readAllLines(moduleFile));
            if (modulePath.isEmpty()) {
                log.warn("No module directive in {}", moduleFile);
            } else {
                log.debug("Module {} rooted at {}", modulePath.get(), moduleRoot);
            }
            return modulePath;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + moduleFile, e);
        }
    }

    static Optional<String> parseModulePath(List<String> lines) {
        for (String line : lines) {
            int comment = line.indexOf("//");
            String content = comment >= 0 ? line.substring(0, comment) : line;
            Matcher matcher = MODULE_DIRECTIVE.matcher(content);
            if (!matcher.find()) {
                continue;
            }
            for (int group = 2; group <= 4; group++) {
                if (matcher.group(group) != null) {
                    return Optional.of(matcher.group(group));
                }
            }
        }
        return Optional.empty();
    }
}
