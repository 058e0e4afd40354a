package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.analyzer.KindClassifier;
import org.dxworks.astdoc.model.EnumInfo;
import org.dxworks.astdoc.model.SemanticKind;
import org.dxworks.astdoc.model.VariantInfo;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.dxworks.astdoc.analyzer.SyntaxHelper.findAllChildren;

public class EnumExtractor implements CategoryExtractor<EnumInfo> {

    private final ExtractionContext context;

    public EnumExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<EnumInfo> extract(SyntaxNode node) {
        List<EnumInfo> enums = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!KindClassifier.is(child, SemanticKind.ENUM)) continue;

            Optional<String> name = context.requiredFieldText(child, "name", "enum");
            if (name.isEmpty()) continue;

            EnumInfo enumInfo = new EnumInfo();
            enumInfo.name = name.get();
            child.childByField("body").ifPresent(body -> extractVariants(body, enumInfo));
            enums.add(enumInfo);
        }
        return enums;
    }

    private void extractVariants(SyntaxNode body, EnumInfo enumInfo) {
        for (SyntaxNode variantNode : findAllChildren(body, "enum_variant")) {
            Optional<String> name = context.requiredFieldText(variantNode, "name", "enum variant");
            if (name.isEmpty()) continue;

            VariantInfo variant = new VariantInfo();
            variant.name = name.get();
            variant.value = context.fieldText(variantNode, "value").orElse(null);
            enumInfo.variants.add(variant);
        }
    }
}
