package com.sfgen.generator.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BuildConstraints.
 */
class BuildConstraintsTest {

    private final BuildContext linux = BuildContext.of("linux", "amd64");
    private final BuildContext darwin = BuildContext.of("darwin", "arm64");

    @Test
    void testNoConstraint() {
        assertThat(satisfied("package models\n", linux)).isTrue();
    }

    @Test
    void testIgnoreTagExcludesEverywhere() {
        String source = "//go:build ignore\n\npackage main\n";

        assertThat(satisfied(source, linux)).isFalse();
        assertThat(satisfied(source, darwin)).isFalse();
        assertThat(satisfied("// +build ignore\n\npackage main\n", linux)).isFalse();
    }

    @Test
    void testGoBuildExpression() {
        String source = """
                // Copyright notice.

                //go:build (linux || darwin) && !arm64

                package models
                """;

        assertThat(satisfied(source, linux)).isTrue();
        assertThat(satisfied(source, darwin)).isFalse();
        assertThat(satisfied("//go:build unix\n\npackage models\n", darwin)).isTrue();
    }

    @Test
    void testGoBuildTakesPrecedenceOverPlusBuild() {
        String source = """
                //go:build linux
                // +build darwin

                package models
                """;

        assertThat(satisfied(source, linux)).isTrue();
        assertThat(satisfied(source, darwin)).isFalse();
    }

    @Test
    void testPlusBuildLines() {
        String source = """
                // +build linux,amd64 darwin
                // +build !cgo_only

                package models
                """;

        assertThat(satisfied(source, linux)).isTrue();
        assertThat(satisfied(source, darwin)).isTrue();
        assertThat(satisfied(source, BuildContext.of("linux", "arm64"))).isFalse();
    }

    @Test
    void testConstraintsAfterPackageClauseDoNotCount() {
        String source = """
                package models

                //go:build ignore
                """;

        assertThat(satisfied(source, linux)).isTrue();
    }

    @Test
    void testConstraintAfterBlockComment() {
        String source = """
                /*
                   Package models.
                */

                //go:build windows

                package models
                """;

        assertThat(satisfied(source, linux)).isFalse();
    }

    @Test
    void testMalformedExpressionFails() {
        assertThatThrownBy(() -> satisfied("//go:build linux &&\n\npackage models\n", linux))
                .isInstanceOf(ParseException.class)
                .hasMessageStartingWith("conn.go:1:1:")
                .hasMessageContaining("invalid //go:build expression");
        assertThatThrownBy(() -> satisfied("//go:build (linux\n\npackage models\n", linux))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("missing )");
    }

    private static boolean satisfied(String source, BuildContext context) {
        return BuildConstraints.isSatisfied(source, "conn.go", context);
    }
}
