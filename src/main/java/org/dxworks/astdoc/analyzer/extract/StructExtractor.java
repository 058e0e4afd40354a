package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.analyzer.KindClassifier;
import org.dxworks.astdoc.model.AttributeInfo;
import org.dxworks.astdoc.model.FieldInfo;
import org.dxworks.astdoc.model.SemanticKind;
import org.dxworks.astdoc.model.StructInfo;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class StructExtractor implements CategoryExtractor<StructInfo> {

    private final ExtractionContext context;

    public StructExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<StructInfo> extract(SyntaxNode node) {
        List<StructInfo> structs = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (KindClassifier.is(child, SemanticKind.STRUCT)) {
                analyzeStruct(node, child).ifPresent(structs::add);
            }
        }
        return structs;
    }

    private Optional<StructInfo> analyzeStruct(SyntaxNode container, SyntaxNode structNode) {
        Optional<String> name = context.requiredFieldText(structNode, "name", "struct");
        if (name.isEmpty()) return Optional.empty();

        StructInfo struct = new StructInfo();
        struct.name = name.get();
        struct.attributes = context.attributes().leadingAttributes(container, structNode);
        structNode.childByField("body").ifPresent(body -> extractFields(body, struct));
        return Optional.of(struct);
    }

    private void extractFields(SyntaxNode body, StructInfo struct) {
        List<SyntaxNode> members = body.namedChildren();
        for (int i = 0; i < members.size(); i++) {
            SyntaxNode member = members.get(i);
            if (member.isKind("attribute_item", "line_comment", "block_comment", "visibility_modifier")) {
                continue;
            }
            if (!member.isKind("field_declaration")) {
                // tuple struct members are bare types
                context.diagnostics().skipped("struct field", member, "positional field has no name");
                continue;
            }

            Optional<String> fieldName = context.requiredFieldText(member, "name", "struct field");
            if (fieldName.isEmpty()) continue;

            FieldInfo field = new FieldInfo();
            field.name = fieldName.get();
            field.type = context.fieldText(member, "type").orElse(null);
            List<AttributeInfo> attributes = new ArrayList<>(context.attributes().leadingAttributes(body, i));
            attributes.addAll(context.attributes().attributes(member));
            field.attributes = attributes;
            struct.fields.add(field);
        }
    }
}
