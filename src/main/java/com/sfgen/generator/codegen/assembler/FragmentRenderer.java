package com.sfgen.generator.codegen.assembler;

import java.util.List;

import com.sfgen.generator.codegen.model.ConstantStyle;
import com.sfgen.generator.codegen.model.GenerationRequest;
import com.sfgen.generator.codegen.model.ResolvedField;
import com.sfgen.generator.codegen.model.ResolvedStruct;
import com.sfgen.generator.codegen.naming.ConstantNamingEngine;
import com.sfgen.generator.codegen.util.GoStringLiterals;

/**
 * Writes the Go declarations generated for one request: the constant type,
 * its methods and the constant block.
 */
public class FragmentRenderer {

    public String render(GenerationRequest request, ResolvedStruct resolved) {
        ConstantStyle style = request.getStyle();
        String recordName = request.getRecordName();
        String baseName = resolved.getBaseTypeName();
        String receiver = ConstantNamingEngine.receiverName(baseName);
        String receiverType = style == ConstantStyle.GENERIC ? baseName + "[T]" : baseName;

        StringBuilder out = new StringBuilder();
        if (style != ConstantStyle.NONE) {
            out.append("// ").append(baseName).append(" is a strong type generated from ").append(recordName)
                    .append(". Its type is used for all of its related generated constants.\n");
        }
        switch (style) {
            case ALIAS -> out.append("type ").append(baseName).append(" = string\n");
            case TYPED -> out.append("type ").append(baseName).append(" string\n");
            case GENERIC -> out.append("type ").append(baseName).append("[T any] string\n");
            case NONE -> {
                // untyped constants
            }
        }
        if (style.isNominal()) {
            out.append('\n')
                    .append("// String implements the [fmt.Stringer] interface\n")
                    .append("func (").append(receiver).append(' ').append(receiverType)
                    .append(") String() string { return (string)(").append(receiver).append(") }\n");
        }

        if (request.getNamingOptions().isEnumerationHelperRequested()) {
            appendSeparator(out);
            appendEnumerationHelper(out, recordName, baseName, receiver, receiverType, resolved.constantValues());
        }

        if (!resolved.getFields().isEmpty()) {
            appendSeparator(out);
            out.append("// Constants generated from [").append(recordName).append("] struct field\n");
            out.append("const (\n");
            for (ResolvedField field : resolved.getFields()) {
                out.append('\t').append(field.getConstantName());
                switch (style) {
                    case ALIAS, TYPED -> out.append(' ').append(baseName);
                    case GENERIC -> out.append(' ').append(baseName)
                            .append('[').append(field.getTypeText()).append(']');
                    case NONE -> {
                        // untyped
                    }
                }
                out.append(" = ").append(GoStringLiterals.quote(field.getConstantValue())).append('\n');
            }
            out.append(")\n");
        }
        return out.toString();
    }

    private static void appendEnumerationHelper(StringBuilder out, String recordName, String baseName,
                                                String receiver, String receiverType, List<String> values) {
        out.append("// All was generated from the [").append(recordName)
                .append("] struct. It returns an array of all [").append(baseName)
                .append("]'s associated constant values.\n");
        out.append("func (").append(receiver).append(' ').append(receiverType).append(") All() [")
                .append(values.size()).append("]string {\n");
        if (values.isEmpty()) {
            out.append("\treturn [0]string{}\n");
        } else {
            out.append("\treturn [").append(values.size()).append("]string{\n");
            for (String value : values) {
                out.append("\t\t").append(GoStringLiterals.quote(value)).append(",\n");
            }
            out.append("\t}\n");
        }
        out.append("}\n");
    }

    private static void appendSeparator(StringBuilder out) {
        if (out.length() > 0) {
            out.append('\n');
        }
    }
}
