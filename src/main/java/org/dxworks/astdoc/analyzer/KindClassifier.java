package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.model.SemanticKind;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps tree-sitter-rust kind tags to {@link SemanticKind}s.
 * Adding a tag to the table is the only change needed to extend the taxonomy.
 */
public final class KindClassifier {

    private static final Map<String, SemanticKind> TABLE;

    static {
        Map<String, SemanticKind> table = new HashMap<>();
        table.put("source_file", SemanticKind.ROOT);

        table.put("line_comment", SemanticKind.COMMENT);
        table.put("block_comment", SemanticKind.COMMENT);

        table.put("use_declaration", SemanticKind.IMPORT);
        table.put("extern_crate_declaration", SemanticKind.IMPORT);

        table.put("struct_item", SemanticKind.STRUCT);
        table.put("union_item", SemanticKind.STRUCT);
        table.put("enum_item", SemanticKind.ENUM);
        table.put("attribute_item", SemanticKind.DERIVE);
        table.put("inner_attribute_item", SemanticKind.DERIVE);

        table.put("function_item", SemanticKind.FUNCTION);
        table.put("function_signature_item", SemanticKind.METHOD);
        table.put("field_declaration", SemanticKind.FIELD);
        table.put("enum_variant", SemanticKind.FIELD);
        table.put("let_declaration", SemanticKind.VARIABLE);
        table.put("const_item", SemanticKind.VARIABLE);
        table.put("static_item", SemanticKind.VARIABLE);
        table.put("type_item", SemanticKind.TYPE);
        table.put("trait_item", SemanticKind.TRAIT);
        table.put("impl_item", SemanticKind.IMPL);

        table.put("if_expression", SemanticKind.IF);
        table.put("else_clause", SemanticKind.ELSE);
        table.put("loop_expression", SemanticKind.LOOP);
        table.put("while_expression", SemanticKind.LOOP);
        table.put("for_expression", SemanticKind.LOOP);
        table.put("tuple_expression", SemanticKind.TUPLE);
        table.put("tuple_type", SemanticKind.TUPLE);
        table.put("array_expression", SemanticKind.ARRAY);
        table.put("array_type", SemanticKind.ARRAY);
        table.put("call_expression", SemanticKind.FUNCTION_CALL);
        table.put("macro_invocation", SemanticKind.FUNCTION_CALL);

        // recovered parse errors carry no meaning of their own, their content is still walked
        table.put("ERROR", SemanticKind.UNDEFINED);
        TABLE = Collections.unmodifiableMap(table);
    }

    private KindClassifier() {
    }

    public static Optional<SemanticKind> classify(String tag) {
        if (tag == null) return Optional.empty();
        return Optional.ofNullable(TABLE.get(tag));
    }

    /**
     * Classification with misses folded into {@link SemanticKind#UNDEFINED}.
     */
    public static SemanticKind kindOf(SyntaxNode node) {
        return classify(node.kind()).orElse(SemanticKind.UNDEFINED);
    }

    public static boolean is(SyntaxNode node, SemanticKind kind) {
        return kindOf(node) == kind;
    }
}
