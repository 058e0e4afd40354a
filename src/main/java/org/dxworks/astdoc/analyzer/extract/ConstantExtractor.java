package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.model.ConstantInfo;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConstantExtractor implements CategoryExtractor<ConstantInfo> {

    private final ExtractionContext context;

    public ConstantExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<ConstantInfo> extract(SyntaxNode node) {
        List<ConstantInfo> constants = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!child.isKind("const_item")) continue;

            Optional<String> name = context.requiredFieldText(child, "name", "constant");
            if (name.isEmpty()) continue;

            ConstantInfo constant = new ConstantInfo();
            constant.name = name.get();
            constant.value = context.text(child.childByField("value").orElse(child));
            constant.type = context.fieldText(child, "type").orElse(null);
            constants.add(constant);
        }
        return constants;
    }
}
