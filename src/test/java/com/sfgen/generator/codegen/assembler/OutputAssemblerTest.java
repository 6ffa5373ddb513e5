package com.sfgen.generator.codegen.assembler;

import com.sfgen.generator.codegen.catalog.PackageCatalog;
import com.sfgen.generator.codegen.catalog.PackageCatalogLoader;
import com.sfgen.generator.codegen.encoder.TypeExpressionEncoder;
import com.sfgen.generator.codegen.exception.AssemblyException;
import com.sfgen.generator.codegen.exception.AssemblyException.Reason;
import com.sfgen.generator.codegen.exception.ResolutionException;
import com.sfgen.generator.codegen.model.ConstantStyle;
import com.sfgen.generator.codegen.model.GenerationRequest;
import com.sfgen.generator.codegen.model.GenerationResult;
import com.sfgen.generator.codegen.model.ImportReference;
import com.sfgen.generator.codegen.model.NamingOptions;
import com.sfgen.generator.codegen.model.SourceLocation;
import com.sfgen.generator.codegen.resolver.StructResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OutputAssembler.
 */
class OutputAssemblerTest {

    @TempDir
    Path tempDir;

    private Path modelsDir;
    private SourceLocation models;
    private OutputAssembler assembler;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("go.mod"), "module example.com/app\n");
        modelsDir = Files.createDirectories(tempDir.resolve("models"));
        Files.writeString(modelsDir.resolve("models.go"), """
                package models

                import (
                    "net/url"
                    "time"
                )

                type Person struct {
                    Name    string    `db:"name"`
                    Born    time.Time `db:"born"`
                }

                type Site struct {
                    Home    url.URL       `db:"home"`
                    Updated time.Time     `db:"updated"`
                    TTL     time.Duration `db:"ttl"`
                }
                """);
        models = SourceLocation.of(modelsDir, null, false);

        PackageCatalog catalog = new PackageCatalogLoader(2).load(List.of(models));
        assembler = new OutputAssembler(new StructResolver(catalog, new TypeExpressionEncoder()),
                new FragmentRenderer(), 2);
    }

    @Test
    void testRequestsSharingOutputFileAreJoined() {
        Path target = modelsDir.resolve("fields_generated.go");

        Map<Path, GenerationResult> results = assembler.assemble(List.of(
                request("Person", ConstantStyle.TYPED).outputTarget(target).build(),
                request("Site", ConstantStyle.TYPED).outputTarget(target)
                        .namingOptions(NamingOptions.builder().explicitPrefix("siteField").build()).build()));

        assertThat(results).containsOnlyKeys(target);
        GenerationResult result = results.get(target);
        assertThat(result.getConstantCount()).isEqualTo(5);
        assertThat(result.getOutputPackage()).isEqualTo("models");
        assertThat(result.getTextFragment())
                .contains("[Person] struct field")
                .contains("[Site] struct field");
        assertThat(result.getTextFragment().indexOf("[Person]")).isLessThan(result.getTextFragment().indexOf("[Site]"));
        assertThat(result.getRequiredReferences()).isEmpty();
    }

    @Test
    void testResultsFollowRequestOrder() {
        Path first = modelsDir.resolve("b_generated.go");
        Path second = modelsDir.resolve("a_generated.go");

        Map<Path, GenerationResult> results = assembler.assemble(List.of(
                request("Site", ConstantStyle.NONE).outputTarget(first).build(),
                request("Person", ConstantStyle.NONE).outputTarget(second).build()));

        assertThat(results.keySet()).containsExactly(first, second);
    }

    @Test
    void testGenericStyleCollectsReferencesInFirstUseOrder() {
        Path target = modelsDir.resolve("generic_generated.go");

        GenerationResult result = assembler.assemble(List.of(
                request("Site", ConstantStyle.GENERIC).outputTarget(target).build())).get(target);

        assertThat(result.getRequiredReferences()).containsExactly(
                ImportReference.of("net/url"), ImportReference.of("time"));
        assertThat(result.getTextFragment()).contains("dbFieldHome dbField[url.URL] = \"home\"");
    }

    @Test
    void testConflictingPackagesForOneFileFail() {
        Path target = modelsDir.resolve("fields_generated.go");

        assertThatThrownBy(() -> assembler.assemble(List.of(
                request("Person", ConstantStyle.NONE).outputTarget(target).build(),
                request("Site", ConstantStyle.NONE).outputTarget(modelsDir.resolve("./fields_generated.go"))
                        .outputPackage("models_test").build())))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("Cannot use both models and models_test package values")
                .extracting(e -> ((AssemblyException) e).getReason())
                .isEqualTo(Reason.CONFLICTING_PACKAGE);
    }

    @Test
    void testCheckedGroupFailureIsAnAssemblyError() {
        Path target = modelsDir.resolve("fields_generated.go");
        IOException cause = new IOException("disk full");

        AssemblyException failure = OutputAssembler.groupFailure(target, cause);

        assertThat(failure.getReason()).isEqualTo(Reason.GROUP_FAILED);
        assertThat(failure).hasMessage("failed to generate " + target + ": disk full").hasCause(cause);
    }

    @Test
    void testEnumerationHelperNeedsNominalStyle() {
        GenerationRequest alias = request("Person", ConstantStyle.ALIAS)
                .namingOptions(NamingOptions.builder().enumerationHelperRequested(true).build())
                .build();
        GenerationRequest untyped = alias.toBuilder().style(ConstantStyle.NONE).build();

        assertThatThrownBy(() -> assembler.assemble(List.of(alias)))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("invalid style alias")
                .extracting(e -> ((AssemblyException) e).getReason())
                .isEqualTo(Reason.INCOMPATIBLE_STYLE);
        assertThatThrownBy(() -> assembler.assemble(List.of(untyped)))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("invalid style none");
    }

    @Test
    void testResolutionFailureAbortsAssembly() {
        assertThatThrownBy(() -> assembler.assemble(List.of(
                request("Person", ConstantStyle.NONE).outputTarget(modelsDir.resolve("a_generated.go")).build(),
                request("Missing", ConstantStyle.NONE).outputTarget(modelsDir.resolve("b_generated.go")).build())))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("Missing");
    }

    @Test
    void testAssemblyIsRepeatable() {
        List<GenerationRequest> requests = List.of(
                request("Person", ConstantStyle.GENERIC).build(),
                request("Site", ConstantStyle.TYPED).outputTarget(modelsDir.resolve("site_generated.go")).build());

        assertThat(assembler.assemble(requests)).isEqualTo(assembler.assemble(requests));
    }

    private GenerationRequest.GenerationRequestBuilder request(String recordName, ConstantStyle style) {
        return GenerationRequest.builder()
                .sourceLocation(models)
                .recordName(recordName)
                .metadataKey("db")
                .style(style)
                .outputTarget(modelsDir.resolve("person_dbfield_generated.go"))
                .outputPackage("models")
                .outputImportPath("example.com/app/models");
    }
}
