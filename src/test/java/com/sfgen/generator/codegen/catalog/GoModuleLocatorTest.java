package com.sfgen.generator.codegen.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GoModuleLocator.
 */
class GoModuleLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void testModuleRootAndNestedDirectories() throws IOException {
        Files.writeString(tempDir.resolve("go.mod"), "module example.com/app\n\ngo 1.21\n");
        Path nested = Files.createDirectories(tempDir.resolve("internal/models"));

        GoModuleLocator locator = new GoModuleLocator();

        assertThat(locator.importPathOf(tempDir)).contains("example.com/app");
        assertThat(locator.importPathOf(nested)).contains("example.com/app/internal/models");
        assertThat(locator.importPathOf(nested.resolve("../models"))).contains("example.com/app/internal/models");
    }

    @Test
    void testNearestModuleWins() throws IOException {
        Files.writeString(tempDir.resolve("go.mod"), "module example.com/outer\n");
        Path inner = Files.createDirectories(tempDir.resolve("tools/gen"));
        Files.writeString(tempDir.resolve("tools/go.mod"), "module example.com/tools\n");

        assertThat(new GoModuleLocator().importPathOf(inner)).contains("example.com/tools/gen");
    }

    @Test
    void testDirectoryOutsideModule() {
        assertThat(new GoModuleLocator().importPathOf(tempDir)).isEmpty();
    }

    @Test
    void testModuleFileWithoutDirective() throws IOException {
        Files.writeString(tempDir.resolve("go.mod"), "go 1.21\n");

        assertThat(new GoModuleLocator().importPathOf(tempDir)).isEmpty();
    }

    @Test
    void testParseModulePathForms() {
        assertThat(GoModuleLocator.parseModulePath(List.of("// comment", "module example.com/a // trailing")))
                .contains("example.com/a");
        assertThat(GoModuleLocator.parseModulePath(List.of("module \"example.com/quoted\"")))
                .contains("example.com/quoted");
        assertThat(GoModuleLocator.parseModulePath(List.of("module `example.com/raw`")))
                .contains("example.com/raw");
        assertThat(GoModuleLocator.parseModulePath(List.of("require example.com/dep v1.0.0"))).isEmpty();
    }
}
