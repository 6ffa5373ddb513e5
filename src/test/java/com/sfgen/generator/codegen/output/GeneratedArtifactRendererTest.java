package com.sfgen.generator.codegen.output;

import com.sfgen.generator.codegen.model.GenerationResult;
import com.sfgen.generator.codegen.model.GoGenerateEnvironment;
import com.sfgen.generator.codegen.model.ImportReference;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GeneratedArtifactRenderer.
 */
class GeneratedArtifactRendererTest {

    private final GeneratedArtifactRenderer renderer = new GeneratedArtifactRenderer();

    private static final String BODY = """
            // Constants generated from [Person] struct field
            const (
            \tfieldName = "Name"
            )
            """;

    @Test
    void testMinimalFile() throws IOException {
        GenerationResult result = result(BODY).build();

        String rendered = renderer.render(result, GoGenerateEnvironment.builder().build());

        assertThat(rendered).isEqualTo("// Code generated by sfgen; DO NOT EDIT.\n"
                + "\n"
                + "package models\n"
                + "\n"
                + BODY);
    }

    @Test
    void testSourceLineAndImports() throws IOException {
        GenerationResult result = result(BODY)
                .requiredReference(ImportReference.of("time"))
                .requiredReference(new ImportReference("github.com/Masterminds/squirrel", "sq"))
                .build();
        GoGenerateEnvironment environment = GoGenerateEnvironment.fromMap(Map.of(
                GoGenerateEnvironment.GOPACKAGE, "models",
                GoGenerateEnvironment.GOFILE, "person.go",
                GoGenerateEnvironment.GOLINE, "7"));

        String rendered = renderer.render(result, environment);

        assertThat(rendered).isEqualTo("// Code generated by sfgen; DO NOT EDIT.\n"
                + "\n"
                + "// Source models.person.go:7\n"
                + "\n"
                + "package models\n"
                + "\n"
                + "import (\n"
                + "\t\"time\"\n"
                + "\tsq \"github.com/Masterminds/squirrel\"\n"
                + ")\n"
                + "\n"
                + BODY);
    }

    @Test
    void testEmptyBody() throws IOException {
        String rendered = renderer.render(result("").build(), GoGenerateEnvironment.builder().build());

        assertThat(rendered).isEqualTo("// Code generated by sfgen; DO NOT EDIT.\n\npackage models\n");
    }

    @Test
    void testTrailingBlankLinesOfBodyAreDropped() throws IOException {
        String rendered = renderer.render(result(BODY + "\n\n").build(), GoGenerateEnvironment.builder().build());

        assertThat(rendered).endsWith(")\n");
    }

    private static GenerationResult.GenerationResultBuilder result(String body) {
        return GenerationResult.builder()
                .outputTarget(Path.of("models/person_field_generated.go"))
                .outputPackage("models")
                .textFragment(body)
                .constantCount(1);
    }
}
