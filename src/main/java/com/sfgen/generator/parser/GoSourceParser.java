package com.sfgen.generator.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.model.GoImport;
import com.sfgen.generator.model.GoSourceFile;
import com.sfgen.generator.model.StructField;
import com.sfgen.generator.model.TypeDeclaration;
import com.sfgen.generator.model.TypeExpr;
import com.sfgen.generator.model.TypeExpr.ArrayType;
import com.sfgen.generator.model.TypeExpr.ChannelDirection;
import com.sfgen.generator.model.TypeExpr.ChannelType;
import com.sfgen.generator.model.TypeExpr.ConstantName;
import com.sfgen.generator.model.TypeExpr.FunctionType;
import com.sfgen.generator.model.TypeExpr.MapType;
import com.sfgen.generator.model.TypeExpr.NamedType;
import com.sfgen.generator.model.TypeExpr.PointerType;
import com.sfgen.generator.model.TypeExpr.PrimitiveType;
import com.sfgen.generator.model.TypeExpr.SliceType;
import com.sfgen.generator.model.TypeExpr.TypeParameter;
import com.sfgen.generator.model.TypeExpr.UnsupportedType;
import com.sfgen.generator.parser.GoToken.TokenType;

/**
 * Parser for the declaration level of Go source files.
 *
 * Parsing only:
 * - Reads the package clause and imports
 * - Builds type declarations, with struct fields and tags
 * - Resolves identifiers in field types to predeclared types, type
 *   parameters or package-qualified named types
 *
 * Function, variable and constant declarations are skipped without being
 * interpreted.
 */
public class GoSourceParser {
    private static final Logger log = LoggerFactory.getLogger(GoSourceParser.class);

    static final Set<String> PREDECLARED_TYPES = Set.of(
            "bool", "string", "error", "any", "comparable", "byte", "rune", "uintptr",
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64",
            "float32", "float64", "complex64", "complex128");

    private final List<GoToken> tokens;
    private final String fileName;
    private final String directoryImportPath;
    private int pos = 0;

    private String packageName;
    private String importPath;
    private final Map<String, GoImport> importsByQualifier = new HashMap<>();
    private final List<GoImport> unaliasedImports = new ArrayList<>();
    private Set<String> typeParametersInScope = Set.of();

    /**
     * @param tokens              tokens of one file
     * @param fileName            file name used in diagnostics
     * @param directoryImportPath import path of the file's directory, or
     *                            {@code null} when it is not inside a module
     */
    public GoSourceParser(List<GoToken> tokens, String fileName, String directoryImportPath) {
        this.tokens = tokens;
        this.fileName = fileName;
        this.directoryImportPath = directoryImportPath;
    }

    /**
     * Tokenizes and parses one source file, judging its build constraints
     * for the host platform.
     */
    public static GoSourceFile parseSource(String source, String fileName, String directoryImportPath) {
        return parseSource(source, fileName, directoryImportPath, BuildContext.host());
    }

    public static GoSourceFile parseSource(String source, String fileName, String directoryImportPath,
                                           BuildContext buildContext) {
        List<GoToken> tokens = new GoTokenizer(source, fileName).tokenize();
        GoSourceFile file = new GoSourceParser(tokens, fileName, directoryImportPath).parse();
        if (!BuildConstraints.isSatisfied(source, fileName, buildContext)) {
            return file.toBuilder().buildIgnored(true).build();
        }
        return file;
    }

    /**
     * Parses a stand-alone type expression as if it appeared in a file of the
     * given package with the given imports.
     */
    public static TypeExpr parseTypeExpression(String text, String packageName, String importPath,
                                               Collection<GoImport> imports, Set<String> typeParameters) {
        List<GoToken> tokens = new GoTokenizer(text, "<type>").tokenize();
        GoSourceParser parser = new GoSourceParser(tokens, "<type>", importPath);
        parser.packageName = packageName;
        parser.importPath = importPath;
        imports.forEach(parser::registerImport);
        parser.typeParametersInScope = Set.copyOf(typeParameters);
        TypeExpr type = parser.parseType();
        parser.skipSemicolons();
        if (!parser.isAtEnd()) {
            throw parser.error(parser.peek(), "unexpected " + describe(parser.peek()) + " after type");
        }
        return type;
    }

    public GoSourceFile parse() {
        skipSemicolons();
        expect(TokenType.PACKAGE);
        packageName = expect(TokenType.IDENTIFIER).getValue();
        expectSemicolon();
        importPath = computeImportPath();

        GoSourceFile.GoSourceFileBuilder file = GoSourceFile.builder()
                .fileName(fileName)
                .packageName(packageName)
                .importPath(importPath);

        skipSemicolons();
        while (check(TokenType.IMPORT)) {
            parseImportDecl(file);
            skipSemicolons();
        }

        int typeCount = 0;
        while (!isAtEnd()) {
            GoToken token = peek();
            switch (token.getType()) {
                case TYPE -> typeCount += parseTypeDecl(file);
                case FUNC, VAR, CONST -> skipDeclaration();
                case SEMICOLON -> advance();
                case IMPORT -> throw error(token, "imports must appear before other declarations");
                default -> throw error(token, "non-declaration statement outside function body: " + describe(token));
            }
        }

        log.debug("Parsed {}: package {} ({}), {} type declarations", fileName, packageName, importPath, typeCount);
        return file.build();
    }

    private String computeImportPath() {
        if (directoryImportPath == null) {
            return packageName;
        }
        if (packageName.endsWith("_test") && fileName.endsWith("_test.go")) {
            return directoryImportPath + "_test";
        }
        return directoryImportPath;
    }

    // ---- imports ----

    private void parseImportDecl(GoSourceFile.GoSourceFileBuilder file) {
        expect(TokenType.IMPORT);
        if (match(TokenType.LPAREN)) {
            skipSemicolons();
            while (!check(TokenType.RPAREN)) {
                file.goImport(parseImportSpec());
                if (!check(TokenType.RPAREN)) {
                    expectSemicolon();
                }
                skipSemicolons();
            }
            expect(TokenType.RPAREN);
        } else {
            file.goImport(parseImportSpec());
        }
        expectSemicolon();
    }

    private GoImport parseImportSpec() {
        String alias = null;
        if (match(TokenType.DOT)) {
            alias = ".";
        } else if (check(TokenType.IDENTIFIER)) {
            alias = advance().getValue();
        }
        GoToken pathToken = expect(TokenType.STRING_LITERAL);
        if (pathToken.getValue().isEmpty()) {
            throw error(pathToken, "empty import path");
        }
        GoImport goImport = new GoImport(alias, pathToken.getValue());
        registerImport(goImport);
        return goImport;
    }

    private void registerImport(GoImport goImport) {
        if (!goImport.isBlankOrDot()) {
            importsByQualifier.put(goImport.qualifier(), goImport);
        }
        if (goImport.getAlias() == null) {
            unaliasedImports.add(goImport);
        }
    }

    // ---- type declarations ----

    private int parseTypeDecl(GoSourceFile.GoSourceFileBuilder file) {
        expect(TokenType.TYPE);
        int count = 0;
        if (match(TokenType.LPAREN)) {
            skipSemicolons();
            while (!check(TokenType.RPAREN)) {
                file.typeDeclaration(parseTypeSpec());
                count++;
                if (!check(TokenType.RPAREN)) {
                    expectSemicolon();
                }
                skipSemicolons();
            }
            expect(TokenType.RPAREN);
        } else {
            file.typeDeclaration(parseTypeSpec());
            count++;
        }
        expectSemicolon();
        return count;
    }

    private TypeDeclaration parseTypeSpec() {
        GoToken nameToken = expect(TokenType.IDENTIFIER);
        List<String> typeParameters = List.of();
        if (check(TokenType.LBRACKET) && looksLikeTypeParameters()) {
            typeParameters = parseTypeParameters();
        }
        boolean alias = match(TokenType.ASSIGN);

        TypeDeclaration.TypeDeclarationBuilder declaration = TypeDeclaration.builder()
                .name(nameToken.getValue())
                .typeParameters(typeParameters)
                .alias(alias)
                .sourceFile(fileName)
                .sourceLine(nameToken.getLine());

        typeParametersInScope = Set.copyOf(typeParameters);
        try {
            if (check(TokenType.STRUCT)) {
                declaration.fields(parseStructBody());
            } else {
                declaration.underlying(parseType());
            }
        } finally {
            typeParametersInScope = Set.of();
        }
        return declaration.build();
    }

    /**
     * Distinguishes {@code type A[T any] ...} from {@code type A [N]int}.
     * A bracket opening with a name followed by something that can start a
     * constraint is a type parameter list.
     */
    private boolean looksLikeTypeParameters() {
        if (peekAt(1).getType() != TokenType.IDENTIFIER) {
            return false;
        }
        return switch (peekAt(2).getType()) {
            case IDENTIFIER, COMMA, STAR, TILDE, LBRACKET, INTERFACE, MAP, CHAN, FUNC, STRUCT, LPAREN, ARROW -> true;
            default -> false;
        };
    }

    private List<String> parseTypeParameters() {
        expect(TokenType.LBRACKET);
        List<String> names = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            names.add(expect(TokenType.IDENTIFIER).getValue());
            if (match(TokenType.COMMA)) {
                continue;
            }
            skipConstraint();
            match(TokenType.COMMA);
        }
        expect(TokenType.RBRACKET);
        return names;
    }

    private void skipConstraint() {
        int depth = 0;
        while (!isAtEnd()) {
            GoToken token = peek();
            if (depth == 0 && (token.is(TokenType.COMMA) || token.is(TokenType.RBRACKET))) {
                return;
            }
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth--;
            }
            advance();
        }
        throw error(peek(), "unterminated type parameter list");
    }

    private List<StructField> parseStructBody() {
        expect(TokenType.STRUCT);
        expect(TokenType.LBRACE);
        List<StructField> fields = new ArrayList<>();
        skipSemicolons();
        while (!check(TokenType.RBRACE)) {
            parseFieldDecl(fields);
            if (!check(TokenType.RBRACE)) {
                expectSemicolon();
            }
            skipSemicolons();
        }
        expect(TokenType.RBRACE);
        return fields;
    }

    private void parseFieldDecl(List<StructField> fields) {
        int line = peek().getLine();

        if (check(TokenType.STAR) || isEmbeddedFieldStart()) {
            int start = pos;
            TypeExpr type = parseType();
            fields.add(StructField.builder()
                    .name(embeddedFieldName(type, start))
                    .type(type)
                    .tag(parseOptionalTag())
                    .embedded(true)
                    .sourceLine(line)
                    .build());
            return;
        }

        List<String> names = new ArrayList<>();
        names.add(expect(TokenType.IDENTIFIER).getValue());
        while (match(TokenType.COMMA)) {
            names.add(expect(TokenType.IDENTIFIER).getValue());
        }
        TypeExpr type = parseType();
        String tag = parseOptionalTag();
        for (String name : names) {
            fields.add(StructField.builder()
                    .name(name)
                    .type(type)
                    .tag(tag)
                    .sourceLine(line)
                    .build());
        }
    }

    private boolean isEmbeddedFieldStart() {
        if (!check(TokenType.IDENTIFIER)) {
            return false;
        }
        GoToken next = peekAt(1);
        switch (next.getType()) {
            case DOT, SEMICOLON, STRING_LITERAL, RBRACE:
                return true;
            case LBRACKET:
                if (isSliceOrArrayBracket(pos + 1)) {
                    return false;
                }
                GoToken afterArgs = tokenAfterMatchingBracket(pos + 1);
                return afterArgs.is(TokenType.SEMICOLON)
                        || afterArgs.is(TokenType.STRING_LITERAL)
                        || afterArgs.is(TokenType.RBRACE);
            default:
                return false;
        }
    }

    private String embeddedFieldName(TypeExpr type, int start) {
        TypeExpr base = type instanceof PointerType pointer ? pointer.element() : type;
        if (base instanceof NamedType named) {
            return named.name();
        }
        if (base instanceof PrimitiveType primitive) {
            return primitive.name();
        }
        if (base instanceof UnsupportedType) {
            // Unresolved qualified name: the field is named after the type identifier.
            int index = tokenAt(start).is(TokenType.STAR) ? start + 1 : start;
            if (tokenAt(index).is(TokenType.IDENTIFIER) && tokenAt(index + 1).is(TokenType.DOT)
                    && tokenAt(index + 2).is(TokenType.IDENTIFIER)) {
                return tokenAt(index + 2).getValue();
            }
        }
        GoToken token = previous();
        throw error(token, "invalid embedded field type");
    }

    private String parseOptionalTag() {
        if (check(TokenType.STRING_LITERAL)) {
            return advance().getValue();
        }
        return "";
    }

    // ---- type expressions ----

    private TypeExpr parseType() {
        GoToken token = peek();
        switch (token.getType()) {
            case IDENTIFIER:
                return parseTypeName();
            case STAR:
                advance();
                return new PointerType(parseType());
            case LBRACKET:
                return parseSliceOrArray();
            case MAP: {
                advance();
                expect(TokenType.LBRACKET);
                TypeExpr key = parseType();
                expect(TokenType.RBRACKET);
                return new MapType(key, parseType());
            }
            case CHAN: {
                advance();
                ChannelDirection direction = match(TokenType.ARROW) ? ChannelDirection.SEND_ONLY : ChannelDirection.BOTH;
                return new ChannelType(direction, parseType());
            }
            case ARROW:
                advance();
                expect(TokenType.CHAN);
                return new ChannelType(ChannelDirection.RECEIVE_ONLY, parseType());
            case FUNC:
                advance();
                return parseSignature();
            case STRUCT:
                advance();
                // Empty literals are written back verbatim.
                return skipBalancedBraces() ? new PrimitiveType("struct{}") : new UnsupportedType("struct{...}");
            case INTERFACE:
                advance();
                return skipBalancedBraces() ? new PrimitiveType("interface{}") : new UnsupportedType("interface{...}");
            case LPAREN: {
                advance();
                TypeExpr inner = parseType();
                expect(TokenType.RPAREN);
                return inner;
            }
            default:
                throw error(token, "expected type, found " + describe(token));
        }
    }

    private TypeExpr parseTypeName() {
        GoToken first = expect(TokenType.IDENTIFIER);
        if (match(TokenType.DOT)) {
            String qualifier = first.getValue();
            GoToken name = expect(TokenType.IDENTIFIER);
            List<TypeExpr> typeArguments = parseTypeArguments();
            GoImport goImport = importsByQualifier.get(qualifier);
            if (goImport == null) {
                goImport = findImportDeclaringPackage(qualifier);
            }
            if (goImport == null) {
                // Only fatal if a generated file ever needs this type.
                log.debug("{}:{}:{}: no import provides package {}", fileName, first.getLine(), first.getColumn(),
                        qualifier);
                return new UnsupportedType(qualifier + "." + name.getValue() + " (undefined: " + qualifier + " at "
                        + fileName + ":" + first.getLine() + ":" + first.getColumn() + ")");
            }
            return new NamedType(goImport.getPath(), qualifier, name.getValue(), typeArguments);
        }
        String name = first.getValue();
        if (typeParametersInScope.contains(name)) {
            return new TypeParameter(name);
        }
        if (PREDECLARED_TYPES.contains(name)) {
            return new PrimitiveType(name);
        }
        return new NamedType(importPath, packageName, name, parseTypeArguments());
    }

    /**
     * Import whose package clause name may differ from its path, such as
     * {@code sqlite3} from {@code github.com/mattn/go-sqlite3}.
     */
    private GoImport findImportDeclaringPackage(String qualifier) {
        for (GoImport candidate : unaliasedImports) {
            if (candidate.mayDeclarePackage(qualifier)) {
                return candidate;
            }
        }
        return null;
    }

    private List<TypeExpr> parseTypeArguments() {
        if (!check(TokenType.LBRACKET)) {
            return List.of();
        }
        advance();
        List<TypeExpr> arguments = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            arguments.add(parseType());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RBRACKET);
        if (arguments.isEmpty()) {
            throw error(previous(), "empty type argument list");
        }
        return arguments;
    }

    private TypeExpr parseSliceOrArray() {
        expect(TokenType.LBRACKET);
        if (match(TokenType.RBRACKET)) {
            return new SliceType(parseType());
        }
        int start = pos;
        StringBuilder length = new StringBuilder();
        int depth = 0;
        while (!isAtEnd() && !(depth == 0 && check(TokenType.RBRACKET))) {
            GoToken token = advance();
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth--;
            }
            length.append(token.getValue());
        }
        int end = pos;
        expect(TokenType.RBRACKET);
        TypeExpr element = parseType();

        GoToken first = tokens.get(start);
        if (end - start == 1 && first.is(TokenType.IDENTIFIER)) {
            return new ArrayType(length.toString(), new ConstantName(importPath, packageName, first.getValue()),
                    element);
        }
        if (end - start == 3 && first.is(TokenType.IDENTIFIER) && tokens.get(start + 1).is(TokenType.DOT)
                && tokens.get(start + 2).is(TokenType.IDENTIFIER)) {
            String qualifier = first.getValue();
            GoImport goImport = importsByQualifier.get(qualifier);
            if (goImport == null) {
                goImport = findImportDeclaringPackage(qualifier);
            }
            if (goImport == null) {
                return new UnsupportedType("[" + length + "]... (undefined: " + qualifier + " at "
                        + fileName + ":" + first.getLine() + ":" + first.getColumn() + ")");
            }
            return new ArrayType(length.toString(),
                    new ConstantName(goImport.getPath(), qualifier, tokens.get(start + 2).getValue()), element);
        }
        return new ArrayType(length.toString(), element);
    }

    private FunctionType parseSignature() {
        expect(TokenType.LPAREN);
        ParameterList parameters = parseParameterList();
        ParameterList results = ParameterList.EMPTY;
        if (match(TokenType.LPAREN)) {
            results = parseParameterList();
            if (results.variadic()) {
                throw error(previous(), "cannot use ... in result list");
            }
        } else if (peek().startsType()) {
            results = new ParameterList(List.of(parseType()), false);
        }
        return new FunctionType(parameters.types(), results.types(), parameters.variadic());
    }

    /**
     * Parses a parameter or result list up to and including the closing
     * parenthesis. Go lists are either fully named ({@code a, b int}) or
     * fully unnamed ({@code int, string}); bare identifiers in a named list
     * share the type of the next named entry.
     */
    private ParameterList parseParameterList() {
        List<ParameterEntry> entries = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            entries.add(parseParameterEntry());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        GoToken close = expect(TokenType.RPAREN);

        boolean named = entries.stream().anyMatch(entry -> entry.name() != null);
        List<TypeExpr> types = new ArrayList<>();
        boolean variadic = false;
        if (named) {
            int pendingNames = 0;
            for (ParameterEntry entry : entries) {
                if (entry.name() == null) {
                    if (entry.soleIdentifier() == null || entry.variadic()) {
                        throw error(close, "mixed named and unnamed parameters");
                    }
                    pendingNames++;
                    continue;
                }
                for (int i = 0; i <= pendingNames; i++) {
                    types.add(entry.type());
                }
                pendingNames = 0;
                variadic = entry.variadic();
            }
            if (pendingNames > 0) {
                throw error(close, "mixed named and unnamed parameters");
            }
        } else {
            for (ParameterEntry entry : entries) {
                types.add(entry.type());
                variadic = entry.variadic();
            }
        }
        for (int i = 0; i < entries.size() - 1; i++) {
            if (entries.get(i).variadic()) {
                throw error(close, "can only use ... with final parameter in list");
            }
        }
        return new ParameterList(types, variadic);
    }

    private ParameterEntry parseParameterEntry() {
        if (check(TokenType.IDENTIFIER) && isNamedParameter()) {
            String name = advance().getValue();
            boolean variadic = match(TokenType.ELLIPSIS);
            return new ParameterEntry(name, null, variadic, parseType());
        }
        boolean variadic = match(TokenType.ELLIPSIS);
        int start = pos;
        TypeExpr type = parseType();
        String soleIdentifier = (pos == start + 1 && tokens.get(start).is(TokenType.IDENTIFIER))
                ? tokens.get(start).getValue()
                : null;
        return new ParameterEntry(null, soleIdentifier, variadic, type);
    }

    private boolean isNamedParameter() {
        GoToken next = peekAt(1);
        if (next.is(TokenType.ELLIPSIS)) {
            return true;
        }
        if (next.is(TokenType.LBRACKET)) {
            return isSliceOrArrayBracket(pos + 1);
        }
        return next.startsType();
    }

    private record ParameterEntry(String name, String soleIdentifier, boolean variadic, TypeExpr type) {
    }

    private record ParameterList(List<TypeExpr> types, boolean variadic) {
        static final ParameterList EMPTY = new ParameterList(List.of(), false);
    }

    // ---- skipping ----

    private void skipDeclaration() {
        advance();
        int depth = 0;
        while (!isAtEnd()) {
            GoToken token = peek();
            if (depth == 0 && token.is(TokenType.SEMICOLON)) {
                advance();
                return;
            }
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth--;
                if (depth < 0) {
                    throw error(token, "unexpected " + describe(token));
                }
            }
            advance();
        }
        if (depth != 0) {
            throw error(peek(), "unexpected end of file");
        }
    }

    /**
     * Skips a brace-delimited body, returning whether it held nothing but
     * semicolons.
     */
    private boolean skipBalancedBraces() {
        expect(TokenType.LBRACE);
        int depth = 1;
        boolean empty = true;
        while (depth > 0) {
            if (isAtEnd()) {
                throw error(peek(), "unexpected end of file");
            }
            GoToken token = advance();
            if (token.is(TokenType.LBRACE)) {
                depth++;
            } else if (token.is(TokenType.RBRACE)) {
                depth--;
            }
            if (depth > 0 && !token.is(TokenType.SEMICOLON)) {
                empty = false;
            }
        }
        return empty;
    }

    private boolean isSliceOrArrayBracket(int bracketIndex) {
        GoToken inside = tokenAt(bracketIndex + 1);
        return inside.is(TokenType.RBRACKET) || inside.is(TokenType.NUMERIC_LITERAL) || inside.is(TokenType.ELLIPSIS);
    }

    private GoToken tokenAfterMatchingBracket(int bracketIndex) {
        int depth = 0;
        for (int i = bracketIndex; i < tokens.size(); i++) {
            GoToken token = tokens.get(i);
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth--;
                if (depth == 0) {
                    return tokenAt(i + 1);
                }
            }
        }
        return tokens.get(tokens.size() - 1);
    }

    // ---- token helpers ----

    private void skipSemicolons() {
        while (check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private void expectSemicolon() {
        if (isAtEnd()) {
            return;
        }
        expect(TokenType.SEMICOLON);
    }

    private GoToken expect(TokenType type) {
        GoToken token = peek();
        if (token.getType() != type) {
            throw error(token, "expected " + type.name().toLowerCase() + ", found " + describe(token));
        }
        return advance();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }

    private GoToken peek() {
        return tokenAt(pos);
    }

    private GoToken peekAt(int offset) {
        return tokenAt(pos + offset);
    }

    private GoToken tokenAt(int index) {
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private GoToken advance() {
        GoToken token = peek();
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private GoToken previous() {
        return tokens.get(Math.max(0, pos - 1));
    }

    private ParseException error(GoToken token, String message) {
        return new ParseException(fileName, token.getLine(), token.getColumn(), message);
    }

    private static String describe(GoToken token) {
        if (token.is(TokenType.EOF)) {
            return "EOF";
        }
        if (token.is(TokenType.SEMICOLON) && "\n".equals(token.getValue())) {
            return "newline";
        }
        return "'" + token.getValue() + "'";
    }
}
