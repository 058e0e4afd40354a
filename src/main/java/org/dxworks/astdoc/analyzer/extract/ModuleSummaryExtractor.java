package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.model.ModuleSummary;
import org.dxworks.astdoc.model.SummaryItem;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Modules and impl blocks with the named items directly inside their bodies.
 * Only one level is listed: a module nested in a module appears as a child item, not with its own children.
 */
public class ModuleSummaryExtractor implements CategoryExtractor<ModuleSummary> {

    private static final String MODULE = "mod_item";
    private static final String IMPL = "impl_item";

    private final ExtractionContext context;

    public ModuleSummaryExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<ModuleSummary> extract(SyntaxNode node) {
        List<ModuleSummary> modules = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!child.isKind(MODULE, IMPL)) continue;

            Optional<String> name = nameOf(child);
            if (name.isEmpty()) {
                context.diagnostics().skipped(child.kind(), child, "no name or implementing type");
                continue;
            }

            ModuleSummary summary = new ModuleSummary();
            summary.type = child.kind();
            summary.name = name.get();
            child.childByField("body").ifPresent(body -> summary.children = summarize(body));
            modules.add(summary);
        }
        return modules;
    }

    private List<SummaryItem> summarize(SyntaxNode body) {
        List<SummaryItem> items = new ArrayList<>();
        for (SyntaxNode member : body.namedChildren()) {
            nameOf(member).ifPresent(name -> items.add(new SummaryItem(member.kind(), name)));
        }
        return items;
    }

    private Optional<String> nameOf(SyntaxNode item) {
        if (item.isKind(IMPL)) {
            return context.fieldText(item, "type");
        }
        return context.fieldText(item, "name");
    }
}
