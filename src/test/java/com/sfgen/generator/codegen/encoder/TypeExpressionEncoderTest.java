package com.sfgen.generator.codegen.encoder;

import com.sfgen.generator.codegen.exception.EncodingException;
import com.sfgen.generator.codegen.model.ImportReference;
import com.sfgen.generator.model.GoImport;
import com.sfgen.generator.model.TypeExpr;
import com.sfgen.generator.model.TypeExpr.ChannelDirection;
import com.sfgen.generator.model.TypeExpr.ChannelType;
import com.sfgen.generator.model.TypeExpr.NamedType;
import com.sfgen.generator.model.TypeExpr.PrimitiveType;
import com.sfgen.generator.model.TypeExpr.TypeParameter;
import com.sfgen.generator.model.TypeExpr.UnsupportedType;
import com.sfgen.generator.parser.GoSourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeExpressionEncoder.
 */
class TypeExpressionEncoderTest {

    private static final String HOME = "example.com/app/models";
    private static final List<GoImport> IMPORTS = List.of(
            new GoImport(null, "time"),
            new GoImport("sq", "github.com/Masterminds/squirrel"),
            new GoImport(null, "github.com/jackc/pgx/v5"),
            new GoImport(null, "gopkg.in/yaml.v3"));

    private final TypeExpressionEncoder encoder = new TypeExpressionEncoder();

    @Test
    void testPrimitiveNeedsNoImport() {
        EncodedType encoded = encoder.encode(new PrimitiveType("int64"), HOME);

        assertThat(encoded.getText()).isEqualTo("int64");
        assertThat(encoded.getReferences()).isEmpty();
    }

    @Test
    void testLocalTypeIsUnqualifiedAtHome() {
        EncodedType encoded = encode("*Person");

        assertThat(encoded.getText()).isEqualTo("*Person");
        assertThat(encoded.getReferences()).isEmpty();
    }

    @Test
    void testLocalTypeIsQualifiedFromAnotherPackage() {
        TypeExpr type = parse("[]Person");

        EncodedType encoded = encoder.encode(type, "example.com/app/consts");

        assertThat(encoded.getText()).isEqualTo("[]models.Person");
        assertThat(encoded.getReferences()).containsExactly(ImportReference.of(HOME));
    }

    @Test
    void testImportAliasIsKeptOnlyWhenItDiffersFromPackageName() {
        EncodedType encoded = encode("map[sq.SelectBuilder]*pgx.Conn");

        assertThat(encoded.getText()).isEqualTo("map[sq.SelectBuilder]*pgx.Conn");
        assertThat(encoded.getReferences()).containsExactly(
                new ImportReference("github.com/Masterminds/squirrel", "sq"),
                ImportReference.of("github.com/jackc/pgx/v5"));
    }

    @Test
    void testReferencesAreDeduplicated() {
        EncodedType encoded = encode("func(time.Time, time.Duration) (time.Time, error)");

        assertThat(encoded.getText()).isEqualTo("func(time.Time, time.Duration) (time.Time, error)");
        assertThat(encoded.getReferences()).containsExactly(ImportReference.of("time"));
    }

    @Test
    void testVariadicAndSingleResultSignature() {
        assertThat(encode("func(string, ...any) error").getText()).isEqualTo("func(string, ...any) error");
        assertThat(encode("func()").getText()).isEqualTo("func()");
    }

    @Test
    void testChannelsAndArrays() {
        assertThat(encode("<-chan [4]byte").getText()).isEqualTo("<-chan [4]byte");
        assertThat(encode("chan<- struct{}").getText()).isEqualTo("chan<- struct{}");
        assertThat(encoder.encode(new ChannelType(ChannelDirection.BOTH,
                new ChannelType(ChannelDirection.RECEIVE_ONLY, new PrimitiveType("int"))), HOME).getText())
                .isEqualTo("chan (<-chan int)");
    }

    @Test
    void testArrayLengthConstantIsQualifiedLikeTypes() {
        TypeExpr type = parse("[Size]byte");

        assertThat(encoder.encode(type, HOME).getText()).isEqualTo("[Size]byte");

        EncodedType elsewhere = encoder.encode(type, "example.com/app/consts");
        assertThat(elsewhere.getText()).isEqualTo("[models.Size]byte");
        assertThat(elsewhere.getReferences()).containsExactly(ImportReference.of(HOME));
    }

    @Test
    void testArrayLengthFromImportedConstantNeedsImport() {
        TypeExpr type = GoSourceParser.parseTypeExpression("[sha256.Size]byte", "models", HOME,
                List.of(new GoImport(null, "crypto/sha256")), Set.of());

        EncodedType encoded = encoder.encode(type, HOME);

        assertThat(encoded.getText()).isEqualTo("[sha256.Size]byte");
        assertThat(encoded.getReferences()).containsExactly(ImportReference.of("crypto/sha256"));
    }

    @Test
    void testArrayLengthExpressionFails() {
        assertThatThrownBy(() -> encode("[N * 2]int"))
                .isInstanceOf(EncodingException.class)
                .hasMessageContaining("array length N*2");
    }

    @Test
    void testRenamedPackageGetsImportAlias() {
        TypeExpr type = GoSourceParser.parseTypeExpression("*sqlite3.SQLiteConn", "models", HOME,
                List.of(new GoImport(null, "github.com/mattn/go-sqlite3")), Set.of());

        EncodedType encoded = encoder.encode(type, HOME);

        assertThat(encoded.getText()).isEqualTo("*sqlite3.SQLiteConn");
        assertThat(encoded.getReferences())
                .containsExactly(new ImportReference("github.com/mattn/go-sqlite3", "sqlite3"));
    }

    @Test
    void testGenericInstantiation() {
        EncodedType encoded = encode("Box[map[string]yaml.Node, []int]");

        assertThat(encoded.getText()).isEqualTo("Box[map[string]yaml.Node, []int]");
        assertThat(encoded.getReferences()).containsExactly(ImportReference.of("gopkg.in/yaml.v3"));
    }

    @Test
    void testTypeParameterBecomesAny() {
        assertThat(encoder.encode(new TypeParameter("T"), HOME).getText()).isEqualTo("any");
        assertThat(encoder.encode(new NamedType(HOME, "models", "Box", List.of(new TypeParameter("T"))), HOME)
                .getText()).isEqualTo("Box[any]");
    }

    @Test
    void testUnsupportedTypeFails() {
        assertThatThrownBy(() -> encoder.encode(new UnsupportedType("struct{...}"), HOME))
                .isInstanceOf(EncodingException.class)
                .hasMessageContaining("struct{...}");
    }

    @Test
    void testEncodedTextParsesBackToSameType() {
        String[] sources = {
                "map[string][]*sq.SelectBuilder",
                "func(int, ...time.Duration) (bool, error)",
                "chan<- map[pgx.Identifier][2]yaml.Node",
                "[time.Nanosecond][Size]int",
                "Box[Pair[string, int]]",
        };
        for (String source : sources) {
            TypeExpr type = parse(source);
            String text = encoder.encode(type, HOME).getText();
            assertThat(parse(text)).as(source).isEqualTo(type);
        }
    }

    private EncodedType encode(String source) {
        return encoder.encode(parse(source), HOME);
    }

    private static TypeExpr parse(String source) {
        return GoSourceParser.parseTypeExpression(source, "models", HOME, IMPORTS, Set.of());
    }
}
