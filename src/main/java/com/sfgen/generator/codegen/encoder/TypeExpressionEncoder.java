package com.sfgen.generator.codegen.encoder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.sfgen.generator.codegen.exception.EncodingException;
import com.sfgen.generator.codegen.model.ImportReference;
import com.sfgen.generator.model.GoImport;
import com.sfgen.generator.model.TypeExpr;
import com.sfgen.generator.model.TypeExpr.ArrayType;
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

/**
 * Writes type expressions back out as Go source text, as seen from the
 * package at {@code homeModule}.
 *
 * Stateless and thread-safe.
 */
public class TypeExpressionEncoder {

    /**
     * Stand-in for type parameters: the generated code has no type
     * parameters of its own to refer to.
     */
    static final String TYPE_PARAMETER_PLACEHOLDER = "any";

    public EncodedType encode(TypeExpr type, String homeModule) {
        StringBuilder text = new StringBuilder();
        Map<String, ImportReference> references = new LinkedHashMap<>();
        write(type, homeModule, text, references);
        return new EncodedType(text.toString(), List.copyOf(references.values()));
    }

    private void write(TypeExpr type, String homeModule, StringBuilder out, Map<String, ImportReference> refs) {
        if (type instanceof PrimitiveType primitive) {
            out.append(primitive.name());
        } else if (type instanceof PointerType pointer) {
            out.append('*');
            write(pointer.element(), homeModule, out, refs);
        } else if (type instanceof SliceType slice) {
            out.append("[]");
            write(slice.element(), homeModule, out, refs);
        } else if (type instanceof ArrayType array) {
            out.append('[');
            writeLength(array, homeModule, out, refs);
            out.append(']');
            write(array.element(), homeModule, out, refs);
        } else if (type instanceof MapType map) {
            out.append("map[");
            write(map.key(), homeModule, out, refs);
            out.append(']');
            write(map.value(), homeModule, out, refs);
        } else if (type instanceof ChannelType channel) {
            switch (channel.direction()) {
                case SEND_ONLY -> out.append("chan<- ");
                case RECEIVE_ONLY -> out.append("<-chan ");
                case BOTH -> out.append("chan ");
            }
            // "chan <-chan T" would read as "chan<- (chan T)"
            boolean parenthesize = channel.direction() == TypeExpr.ChannelDirection.BOTH
                    && channel.element() instanceof ChannelType inner
                    && inner.direction() == TypeExpr.ChannelDirection.RECEIVE_ONLY;
            if (parenthesize) {
                out.append('(');
            }
            write(channel.element(), homeModule, out, refs);
            if (parenthesize) {
                out.append(')');
            }
        } else if (type instanceof FunctionType function) {
            writeSignature(function, homeModule, out, refs);
        } else if (type instanceof TypeParameter) {
            out.append(TYPE_PARAMETER_PLACEHOLDER);
        } else if (type instanceof NamedType named) {
            writeNamed(named, homeModule, out, refs);
        } else if (type instanceof UnsupportedType unsupported) {
            throw new EncodingException("unsupported type " + unsupported.description());
        } else {
            throw new EncodingException("unhandled type " + type);
        }
    }

    private void writeSignature(FunctionType function, String homeModule, StringBuilder out,
                                Map<String, ImportReference> refs) {
        out.append("func(");
        List<TypeExpr> parameters = function.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            if (function.variadic() && i == parameters.size() - 1) {
                out.append("...");
            }
            write(parameters.get(i), homeModule, out, refs);
        }
        out.append(')');

        List<TypeExpr> results = function.results();
        if (results.isEmpty()) {
            return;
        }
        out.append(' ');
        boolean parenthesize = results.size() > 1;
        if (parenthesize) {
            out.append('(');
        }
        for (int i = 0; i < results.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            write(results.get(i), homeModule, out, refs);
        }
        if (parenthesize) {
            out.append(')');
        }
    }

    private void writeLength(ArrayType array, String homeModule, StringBuilder out, Map<String, ImportReference> refs) {
        if (array.hasLiteralLength()) {
            out.append(array.length());
            return;
        }
        ConstantName constant = array.lengthConstant();
        if (constant == null) {
            throw new EncodingException("array length " + array.length() + " is not a literal or a named constant");
        }
        writeQualifier(constant.modulePath(), constant.packageName(), homeModule, out, refs);
        out.append(constant.name());
    }

    private void writeQualifier(String modulePath, String packageName, String homeModule, StringBuilder out,
                                Map<String, ImportReference> refs) {
        if (modulePath.equals(homeModule)) {
            return;
        }
        out.append(packageName).append('.');
        String alias = packageName.equals(GoImport.guessPackageName(modulePath)) ? null : packageName;
        refs.putIfAbsent(modulePath, new ImportReference(modulePath, alias));
    }

    private void writeNamed(NamedType named, String homeModule, StringBuilder out, Map<String, ImportReference> refs) {
        writeQualifier(named.modulePath(), named.packageName(), homeModule, out, refs);
        out.append(named.name());
        if (named.typeArguments().isEmpty()) {
            return;
        }
        out.append('[');
        List<String> arguments = new ArrayList<>();
        for (TypeExpr argument : named.typeArguments()) {
            StringBuilder argumentText = new StringBuilder();
            write(argument, homeModule, argumentText, refs);
            arguments.add(argumentText.toString());
        }
        out.append(String.join(", ", arguments)).append(']');
    }
}
