package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.analyzer.AttributeScanner;
import org.dxworks.astdoc.analyzer.KindClassifier;
import org.dxworks.astdoc.model.RelationInfo;
import org.dxworks.astdoc.model.SemanticKind;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code impl} blocks and {@code #[derive(...)]} attributes, in source order, in one list.
 */
public class RelationExtractor implements CategoryExtractor<RelationInfo> {

    private final ExtractionContext context;

    public RelationExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<RelationInfo> extract(SyntaxNode node) {
        List<RelationInfo> relations = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (KindClassifier.is(child, SemanticKind.IMPL)) {
                Optional<String> forType = context.requiredFieldText(child, "type", "impl");
                if (forType.isEmpty()) continue;
                relations.add(RelationInfo.impl(forType.get(),
                        context.fieldText(child, "trait").orElse(null),
                        context.fieldText(child, "type_parameters").orElse(null)));
            } else if (AttributeScanner.isAttributeItem(child)) {
                context.attributes().readItem(child)
                        .filter(AttributeScanner::isDerive)
                        .ifPresent(attribute -> relations.add(
                                RelationInfo.derive(attribute, AttributeScanner.derivedTraits(attribute))));
            }
        }
        return relations;
    }
}
