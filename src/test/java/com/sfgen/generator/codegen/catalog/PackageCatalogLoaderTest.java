package com.sfgen.generator.codegen.catalog;

import com.sfgen.generator.codegen.exception.LoadException;
import com.sfgen.generator.codegen.model.SourceLocation;
import com.sfgen.generator.parser.BuildContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PackageCatalogLoader.
 */
class PackageCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private Path modelsDir;
    private PackageCatalogLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("go.mod"), "module example.com/app\n");
        modelsDir = Files.createDirectories(tempDir.resolve("models"));
        loader = new PackageCatalogLoader(2);
    }

    @Test
    void testLoadSinglePackage() throws IOException {
        write("person.go", """
                package models

                type Person struct {
                    Name string
                }
                """);
        write("address.go", """
                package models

                type Address struct{ City string }
                """);

        PackageCatalog catalog = loader.load(List.of(location(null, false)));

        LoadedPackage pkg = catalog.lookup(location(null, false)).orElseThrow();
        assertThat(pkg.getPackageName()).isEqualTo("models");
        assertThat(pkg.getImportPath()).isEqualTo("example.com/app/models");
        assertThat(pkg.getFileNames()).containsExactly("address.go", "person.go");
        assertThat(pkg.lookup("Person")).isPresent();
        assertThat(pkg.lookup("Address")).isPresent();
        assertThat(pkg.describe()).endsWith("models#models");
    }

    @Test
    void testSameLocationIsLoadedOnce() throws IOException {
        write("person.go", "package models\ntype Person struct{}\n");

        PackageCatalog catalog = loader.load(List.of(location(null, false), location(null, false)));

        assertThat(catalog.size()).isEqualTo(1);
    }

    @Test
    void testTestFilesOnlyWhenRequested() throws IOException {
        write("person.go", "package models\ntype Person struct{}\n");
        write("person_test.go", "package models\ntype fixture struct{ ID int }\n");

        PackageCatalog catalog = loader.load(List.of(location(null, false), location(null, true)));

        assertThat(catalog.size()).isEqualTo(2);
        assertThat(catalog.lookup(location(null, false)).orElseThrow().lookup("fixture")).isEmpty();
        assertThat(catalog.lookup(location(null, true)).orElseThrow().lookup("fixture")).isPresent();
        assertThat(catalog.findByImportPath("example.com/app/models").orElseThrow().getLocation()
                .isIncludeTestSources()).isTrue();
    }

    @Test
    void testSelectorChoosesBetweenPackages() throws IOException {
        write("person.go", "package models\ntype Person struct{}\n");
        write("person_test.go", "package models_test\ntype Example struct{ Name string }\n");

        assertThatThrownBy(() -> loader.load(List.of(location(null, true))))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("expected to find 1 package, found 2");

        PackageCatalog catalog = loader.load(List.of(location("models_test", true)));
        LoadedPackage pkg = catalog.lookup(location("models_test", true)).orElseThrow();
        assertThat(pkg.getImportPath()).isEqualTo("example.com/app/models_test");
        assertThat(pkg.lookup("Example")).isPresent();
    }

    @Test
    void testSelectorIgnoredWhenOnlyOnePackage() throws IOException {
        write("person.go", "package models\ntype Person struct{}\n");

        PackageCatalog catalog = loader.load(List.of(location("other", false)));

        assertThat(catalog.lookup(location("other", false)).orElseThrow().getPackageName()).isEqualTo("models");
    }

    @Test
    void testBuildIgnoredAndHiddenFilesAreSkipped() throws IOException {
        write("person.go", "package models\ntype Person struct{}\n");
        write("gen.go", "//go:build ignore\n\npackage main\n\ntype Generator struct{}\n");
        write("_scratch.go", "package scratch\n");
        write(".hidden.go", "package hidden\n");

        LoadedPackage pkg = loader.load(List.of(location(null, false))).lookup(location(null, false)).orElseThrow();

        assertThat(pkg.getFileNames()).containsExactly("person.go");
        assertThat(pkg.lookup("Generator")).isEmpty();
    }

    @Test
    void testPlatformFilesAreChosenForTargetPlatform() throws IOException {
        write("conn.go", "package models\ntype Conn struct{ raw sysConn }\n");
        write("conn_linux.go", "package models\n\ntype sysConn struct{ fd int }\n");
        write("conn_windows.go", "package models\n\ntype sysConn struct{ handle uintptr }\n");
        write("poll.go", "//go:build linux || darwin\n\npackage models\n\ntype poller struct{}\n");
        write("poll_other.go", "//go:build !linux && !darwin\n\npackage models\n\ntype poller struct{}\n");

        LoadedPackage onLinux = new PackageCatalogLoader(1, BuildContext.of("linux", "amd64"))
                .load(List.of(location(null, false))).lookup(location(null, false)).orElseThrow();
        assertThat(onLinux.getFileNames()).containsExactly("conn.go", "conn_linux.go", "poll.go");
        assertThat(onLinux.lookup("sysConn").orElseThrow().getSourceFile()).isEqualTo("conn_linux.go");

        LoadedPackage onWindows = new PackageCatalogLoader(1, BuildContext.of("windows", "amd64"))
                .load(List.of(location(null, false))).lookup(location(null, false)).orElseThrow();
        assertThat(onWindows.getFileNames()).containsExactly("conn.go", "conn_windows.go", "poll_other.go");
        assertThat(onWindows.lookup("sysConn").orElseThrow().getSourceFile()).isEqualTo("conn_windows.go");
    }

    @Test
    void testUnmatchedQualifierDoesNotFailTheLoad() throws IOException {
        write("models.go", """
                package models

                import "github.com/mattn/go-sqlite3"

                type Conn struct { C *sqlite3.SQLiteConn }
                type Legacy struct { H *cgo.Handle }
                type Person struct { Name string }
                """);

        LoadedPackage pkg = loader.load(List.of(location(null, false))).lookup(location(null, false)).orElseThrow();

        assertThat(pkg.lookup("Person")).isPresent();
        assertThat(pkg.lookup("Legacy")).isPresent();
    }

    @Test
    void testDuplicateDeclarationFails() throws IOException {
        write("a.go", "package models\ntype Person struct{}\n");
        write("b.go", "package models\n\ntype Person struct{}\n");

        assertThatThrownBy(() -> loader.load(List.of(location(null, false))))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("b.go:3: Person redeclared in this block (previous declaration at a.go:2)");
    }

    @Test
    void testParseErrorFails() throws IOException {
        write("broken.go", "package models\ntype Person struct {\n");

        assertThatThrownBy(() -> loader.load(List.of(location(null, false))))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("broken.go:");
    }

    @Test
    void testMissingDirectoryFails() {
        SourceLocation missing = SourceLocation.of(tempDir.resolve("nope"), null, false);

        assertThatThrownBy(() -> loader.load(List.of(missing)))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("directory does not exist");
    }

    @Test
    void testDirectoryWithoutSourcesFails() {
        assertThatThrownBy(() -> loader.load(List.of(location(null, false))))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("no Go files in");
    }

    @Test
    void testFirstFailureAbortsWholeLoad() throws IOException {
        write("person.go", "package models\ntype Person struct{}\n");
        SourceLocation missing = SourceLocation.of(tempDir.resolve("nope"), null, false);

        assertThatThrownBy(() -> loader.load(List.of(location(null, false), missing)))
                .isInstanceOf(LoadException.class);
    }

    @Test
    void testIsSourceFile() {
        assertThat(PackageCatalogLoader.isSourceFile("a.go", false)).isTrue();
        assertThat(PackageCatalogLoader.isSourceFile("a_test.go", false)).isFalse();
        assertThat(PackageCatalogLoader.isSourceFile("a_test.go", true)).isTrue();
        assertThat(PackageCatalogLoader.isSourceFile("_a.go", true)).isFalse();
        assertThat(PackageCatalogLoader.isSourceFile(".a.go", true)).isFalse();
        assertThat(PackageCatalogLoader.isSourceFile("a.txt", true)).isFalse();
    }

    @Test
    void testInvalidParallelism() {
        assertThatThrownBy(() -> new PackageCatalogLoader(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private SourceLocation location(String selector, boolean tests) {
        return SourceLocation.of(modelsDir, selector, tests);
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(modelsDir.resolve(name), content);
    }
}
