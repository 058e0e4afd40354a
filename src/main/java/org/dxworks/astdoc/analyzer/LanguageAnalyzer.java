package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.model.DocumentReport;
import org.dxworks.astdoc.syntax.SourceText;
import org.dxworks.astdoc.syntax.SyntaxNode;

public interface LanguageAnalyzer {
    DocumentReport analyze(SourceText source, SyntaxNode rootNode, Diagnostics diagnostics);
}
