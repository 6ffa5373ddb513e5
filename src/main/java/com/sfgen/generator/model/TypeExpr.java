package com.sfgen.generator.model;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A Go type expression as written on a struct field.
 *
 * The variant set is closed. Anything the front end can read but the
 * generator cannot render (interface and anonymous struct literals) is
 * carried as {@link UnsupportedType} rather than dropped.
 */
public sealed interface TypeExpr permits TypeExpr.PrimitiveType, TypeExpr.PointerType, TypeExpr.SliceType,
        TypeExpr.ArrayType, TypeExpr.MapType, TypeExpr.ChannelType, TypeExpr.FunctionType,
        TypeExpr.TypeParameter, TypeExpr.NamedType, TypeExpr.UnsupportedType {

    /**
     * Predeclared type such as {@code string}, {@code int64} or {@code error}.
     */
    record PrimitiveType(String name) implements TypeExpr {
        public PrimitiveType {
            Objects.requireNonNull(name, "name");
        }
    }

    record PointerType(TypeExpr element) implements TypeExpr {
        public PointerType {
            Objects.requireNonNull(element, "element");
        }
    }

    record SliceType(TypeExpr element) implements TypeExpr {
        public SliceType {
            Objects.requireNonNull(element, "element");
        }
    }

    /**
     * Fixed-size array. The length is kept as source text. When it names a
     * constant ({@code [Size]byte}, {@code [sha256.Size]byte}) the constant
     * is also kept as {@code lengthConstant}, so it can be qualified from
     * another package.
     */
    record ArrayType(String length, ConstantName lengthConstant, TypeExpr element) implements TypeExpr {
        private static final Pattern INTEGER_LITERAL = Pattern.compile("[0-9][0-9a-fA-FxXoObB_]*");

        public ArrayType {
            Objects.requireNonNull(length, "length");
            Objects.requireNonNull(element, "element");
        }

        public ArrayType(String length, TypeExpr element) {
            this(length, null, element);
        }

        public boolean hasLiteralLength() {
            return INTEGER_LITERAL.matcher(length).matches();
        }
    }

    /**
     * Package-level constant referenced from a type, such as an array length.
     */
    record ConstantName(String modulePath, String packageName, String name) {
        public ConstantName {
            Objects.requireNonNull(modulePath, "modulePath");
            Objects.requireNonNull(packageName, "packageName");
            Objects.requireNonNull(name, "name");
        }
    }

    record MapType(TypeExpr key, TypeExpr value) implements TypeExpr {
        public MapType {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    record ChannelType(ChannelDirection direction, TypeExpr element) implements TypeExpr {
        public ChannelType {
            Objects.requireNonNull(direction, "direction");
            Objects.requireNonNull(element, "element");
        }
    }

    /**
     * Function signature. When {@code variadic} is set the last parameter is
     * the element type of the trailing {@code ...} parameter.
     */
    record FunctionType(List<TypeExpr> parameters, List<TypeExpr> results, boolean variadic) implements TypeExpr {
        public FunctionType {
            parameters = List.copyOf(parameters);
            results = List.copyOf(results);
            if (variadic && parameters.isEmpty()) {
                throw new IllegalArgumentException("variadic signature needs at least one parameter");
            }
        }
    }

    /**
     * Reference to a type parameter of the enclosing generic declaration.
     */
    record TypeParameter(String name) implements TypeExpr {
        public TypeParameter {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Declared type owned by the package at {@code modulePath}.
     *
     * @param modulePath    import path of the owning package
     * @param packageName   name the package is referred to by (import alias,
     *                      or the package clause name for local types)
     * @param name          the type's identifier
     * @param typeArguments instantiation arguments, empty when not generic
     */
    record NamedType(String modulePath, String packageName, String name, List<TypeExpr> typeArguments)
            implements TypeExpr {
        public NamedType {
            Objects.requireNonNull(modulePath, "modulePath");
            Objects.requireNonNull(packageName, "packageName");
            Objects.requireNonNull(name, "name");
            typeArguments = List.copyOf(typeArguments);
        }

        public NamedType(String modulePath, String packageName, String name) {
            this(modulePath, packageName, name, List.of());
        }
    }

    record UnsupportedType(String description) implements TypeExpr {
        public UnsupportedType {
            Objects.requireNonNull(description, "description");
        }
    }

    enum ChannelDirection {
        BOTH,
        SEND_ONLY,
        RECEIVE_ONLY
    }
}
