package com.sfgen.generator.codegen.resolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.codegen.catalog.LoadedPackage;
import com.sfgen.generator.codegen.catalog.PackageCatalog;
import com.sfgen.generator.codegen.encoder.EncodedType;
import com.sfgen.generator.codegen.encoder.TypeExpressionEncoder;
import com.sfgen.generator.codegen.exception.EncodingException;
import com.sfgen.generator.codegen.exception.ResolutionException;
import com.sfgen.generator.codegen.exception.ResolutionException.Reason;
import com.sfgen.generator.codegen.metadata.FieldNameOverride;
import com.sfgen.generator.codegen.metadata.StructTag;
import com.sfgen.generator.codegen.metadata.StructTagSyntaxException;
import com.sfgen.generator.codegen.metadata.StructTags;
import com.sfgen.generator.codegen.model.GenerationRequest;
import com.sfgen.generator.codegen.model.ResolvedField;
import com.sfgen.generator.codegen.model.ResolvedStruct;
import com.sfgen.generator.codegen.naming.ConstantNamingEngine;
import com.sfgen.generator.model.StructField;
import com.sfgen.generator.model.TypeDeclaration;
import com.sfgen.generator.model.TypeExpr;
import com.sfgen.generator.model.TypeExpr.NamedType;
import com.sfgen.generator.model.TypeExpr.PointerType;

import lombok.RequiredArgsConstructor;

/**
 * Flattens a struct into the ordered list of fields constants are generated
 * for.
 *
 * Fields promoted from embedded structs follow the struct's own fields and
 * are dropped when an own field already produced the same constant name.
 * Between two embedded structs promoting the same name, the one embedded
 * first wins.
 *
 * Reads only the immutable catalog; safe to share between threads.
 */
@RequiredArgsConstructor
public class StructResolver {
    private static final Logger log = LoggerFactory.getLogger(StructResolver.class);

    static final String EXCLUDED_VALUE = "-";

    private final PackageCatalog catalog;
    private final TypeExpressionEncoder encoder;

    public ResolvedStruct resolve(GenerationRequest request) {
        Pattern capture = compileCaptureExpression(request);

        LoadedPackage pkg = catalog.lookup(request.getSourceLocation())
                .orElseThrow(() -> new ResolutionException(Reason.NOT_FOUND,
                        "package " + request.getSourceLocation() + " was not loaded"));

        TypeDeclaration declaration = findDeclaration(pkg, request.getRecordName());
        StructTarget target = followToStruct(pkg, declaration)
                .orElseThrow(() -> new ResolutionException(Reason.NOT_A_RECORD,
                        "cannot use type " + request.getRecordName() + ", only named struct types are supported"));

        String baseName = ConstantNamingEngine.baseName(
                request.getNamingOptions(), request.getMetadataKey(), request.getRecordName());
        String homeModule = request.getOutputImportPath() != null
                ? request.getOutputImportPath()
                : pkg.getImportPath();

        FieldWalk walk = new FieldWalk(request, capture, baseName, homeModule);
        List<ResolvedField> fields = walk.collect(target, new HashSet<>());
        log.debug("Resolved {} field(s) of {} as {}", fields.size(), request.describe(), baseName);

        return ResolvedStruct.builder()
                .recordName(request.getRecordName())
                .baseTypeName(baseName)
                .fields(fields)
                .build();
    }

    private static Pattern compileCaptureExpression(GenerationRequest request) {
        String expression = request.getMetadataKeyCaptureExpression();
        if (expression == null || expression.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(expression);
        } catch (PatternSyntaxException e) {
            throw new ResolutionException(Reason.INVALID_CAPTURE_EXPRESSION,
                    "failed to compile regex expression \"" + expression + "\": " + e.getDescription(), e);
        }
    }

    private static TypeDeclaration findDeclaration(LoadedPackage pkg, String recordName) {
        Optional<TypeDeclaration> found = pkg.lookup(recordName);
        int dot = recordName.indexOf('.');
        if (found.isEmpty() && dot >= 0) {
            found = pkg.lookup(recordName.substring(dot + 1));
        }
        return found.orElseThrow(() -> new ResolutionException(Reason.NOT_FOUND,
                "type " + recordName + " not found in package " + pkg.describe()));
    }

    /**
     * Follows aliases and defined types ({@code type B A}) down to a struct
     * declaration. Empty when the chain ends in something else.
     *
     * @throws ResolutionException when the chain leaves the loaded packages
     */
    private Optional<StructTarget> followToStruct(LoadedPackage pkg, TypeDeclaration declaration) {
        LoadedPackage currentPackage = pkg;
        TypeDeclaration current = declaration;
        Set<String> seen = new HashSet<>();
        while (!current.isStruct()) {
            if (!seen.add(currentPackage.getImportPath() + "." + current.getName())) {
                return Optional.empty();
            }
            if (!(current.getUnderlying() instanceof NamedType named)) {
                return Optional.empty();
            }
            LoadedPackage owner = ownerOf(currentPackage, named);
            if (owner == null) {
                throw new ResolutionException(Reason.FOREIGN_EMBEDDING, "type " + named.packageName() + "."
                        + named.name() + " is declared in " + named.modulePath() + ", which was not loaded");
            }
            Optional<TypeDeclaration> next = owner.lookup(named.name());
            if (next.isEmpty()) {
                return Optional.empty();
            }
            currentPackage = owner;
            current = next.get();
        }
        return Optional.of(new StructTarget(currentPackage, current));
    }

    private LoadedPackage ownerOf(LoadedPackage from, NamedType named) {
        if (named.modulePath().equals(from.getImportPath())) {
            return from;
        }
        return catalog.findByImportPath(named.modulePath()).orElse(null);
    }

    private record StructTarget(LoadedPackage pkg, TypeDeclaration declaration) {
        String key() {
            return pkg.getImportPath() + "." + declaration.getName();
        }
    }

    /**
     * State of resolving one request.
     */
    @RequiredArgsConstructor
    private class FieldWalk {
        private final GenerationRequest request;
        private final Pattern capture;
        private final String baseName;
        private final String homeModule;

        List<ResolvedField> collect(StructTarget target, Set<String> visiting) {
            visiting.add(target.key());
            List<ResolvedField> own = new ArrayList<>();
            Map<String, ResolvedField> promoted = new LinkedHashMap<>();

            for (StructField field : target.declaration().getFields()) {
                if (!request.isIncludeUnexportedFields() && !field.isExported()) {
                    continue;
                }

                StructTags tags = parseTags(target, field);
                String value = constantValue(field, tags);
                if (EXCLUDED_VALUE.equals(value)) {
                    log.debug("Skipping excluded field {}.{}", target.declaration().getName(), field.getName());
                    continue;
                }

                if (field.isEmbedded()) {
                    Optional<StructTarget> embedded = embeddedStruct(target.pkg(), field);
                    if (embedded.isPresent()) {
                        if (visiting.contains(embedded.get().key())) {
                            continue;
                        }
                        for (ResolvedField candidate : collect(embedded.get(), visiting)) {
                            promoted.putIfAbsent(candidate.getConstantName(), candidate);
                        }
                        continue;
                    }
                }

                own.add(toResolvedField(target, field, value));
            }
            visiting.remove(target.key());

            Set<String> ownNames = new HashSet<>();
            own.forEach(field -> ownNames.add(field.getConstantName()));
            List<ResolvedField> fields = new ArrayList<>(own);
            promoted.values().stream()
                    .filter(field -> !ownNames.contains(field.getConstantName()))
                    .forEach(fields::add);
            return fields;
        }

        private StructTags parseTags(StructTarget target, StructField field) {
            try {
                return StructTags.parse(field.getTag());
            } catch (StructTagSyntaxException e) {
                throw new ResolutionException(Reason.MALFORMED_METADATA, "failed to parse struct tags for field "
                        + field.getName() + " of " + target.declaration().getName() + ": " + e.getMessage(), e);
            }
        }

        private String constantValue(StructField field, StructTags tags) {
            String metadataKey = request.getMetadataKey() == null ? "" : request.getMetadataKey();
            Optional<String> override = FieldNameOverride.resolve(tags, metadataKey);
            if (override.isPresent()) {
                return override.get();
            }
            if (metadataKey.isEmpty()) {
                return field.getName();
            }

            Optional<StructTag> tag = tags.get(metadataKey);
            if (tag.isEmpty()) {
                return field.getName();
            }
            if (capture != null) {
                String tagValue = tag.get().value();
                if (tagValue.isEmpty()) {
                    return field.getName();
                }
                Matcher matcher = capture.matcher(tagValue);
                if (matcher.find() && matcher.groupCount() >= 1) {
                    return matcher.group(1) == null ? "" : matcher.group(1);
                }
                return field.getName();
            }
            return tag.get().getName().isEmpty() ? field.getName() : tag.get().getName();
        }

        /**
         * The struct behind an embedded field, looking through one pointer,
         * aliases and instantiation.
         */
        private Optional<StructTarget> embeddedStruct(LoadedPackage pkg, StructField field) {
            TypeExpr type = field.getType();
            if (type instanceof PointerType pointer) {
                type = pointer.element();
            }
            if (!(type instanceof NamedType named)) {
                return Optional.empty();
            }
            LoadedPackage owner = ownerOf(pkg, named);
            if (owner == null) {
                throw new ResolutionException(Reason.FOREIGN_EMBEDDING, "cannot flatten embedded field "
                        + field.getName() + ": package " + named.modulePath()
                        + " was not loaded; exclude the field with sfgen:\"-\" or generate from that package too");
            }
            return owner.lookup(named.name()).flatMap(declaration -> followToStruct(owner, declaration));
        }

        private ResolvedField toResolvedField(StructTarget target, StructField field, String value) {
            ResolvedField.ResolvedFieldBuilder resolved = ResolvedField.builder()
                    .fieldIdentifier(field.getName())
                    .constantName(ConstantNamingEngine.constantName(baseName, field.getName()))
                    .constantValue(value);
            try {
                EncodedType encoded = encoder.encode(field.getType(), homeModule);
                resolved.typeText(encoded.getText()).requiredReferences(encoded.getReferences());
            } catch (EncodingException e) {
                throw new EncodingException("failed to encode type of field " + field.getName() + " of "
                        + target.declaration().getName() + ": " + e.getMessage()
                        + "; exclude the field with sfgen:\"-\"", e);
            }
            return resolved.build();
        }
    }
}
