package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.analyzer.KindClassifier;
import org.dxworks.astdoc.model.ImportInfo;
import org.dxworks.astdoc.model.SemanticKind;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

public class ImportExtractor implements CategoryExtractor<ImportInfo> {

    private final ExtractionContext context;

    public ImportExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<ImportInfo> extract(SyntaxNode node) {
        List<ImportInfo> imports = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (KindClassifier.is(child, SemanticKind.IMPORT)) {
                imports.add(new ImportInfo(context.text(child)));
            }
        }
        return imports;
    }
}
