package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.model.GlobalInfo;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.dxworks.astdoc.analyzer.SyntaxHelper.hasChild;

/**
 * {@code static} items.
 */
public class GlobalExtractor implements CategoryExtractor<GlobalInfo> {

    private final ExtractionContext context;

    public GlobalExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<GlobalInfo> extract(SyntaxNode node) {
        List<GlobalInfo> globals = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!child.isKind("static_item")) continue;

            Optional<String> name = context.requiredFieldText(child, "name", "global");
            if (name.isEmpty()) continue;

            GlobalInfo global = new GlobalInfo();
            global.name = name.get();
            global.value = context.text(child.childByField("value").orElse(child));
            global.type = context.fieldText(child, "type").orElse(null);
            global.mutable = hasChild(child, "mutable_specifier");
            globals.add(global);
        }
        return globals;
    }
}
