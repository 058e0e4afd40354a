package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.analyzer.AttributeScanner;
import org.dxworks.astdoc.analyzer.Diagnostics;
import org.dxworks.astdoc.syntax.SourceText;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.Optional;

/**
 * What every category extractor needs for one file: the source, the attribute scanner and the diagnostics sink.
 */
public class ExtractionContext {

    private final SourceText source;
    private final Diagnostics diagnostics;
    private final AttributeScanner attributes;

    public ExtractionContext(SourceText source, Diagnostics diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.attributes = new AttributeScanner(source, diagnostics);
    }

    public SourceText source() {
        return source;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public AttributeScanner attributes() {
        return attributes;
    }

    public String text(SyntaxNode node) {
        return source.text(node);
    }

    public Optional<String> fieldText(SyntaxNode node, String fieldName) {
        return node.childByField(fieldName).map(source::text);
    }

    /**
     * Text of a field the grammar should always provide. Absence is reported as a skipped {@code what}.
     */
    public Optional<String> requiredFieldText(SyntaxNode node, String fieldName, String what) {
        Optional<String> text = fieldText(node, fieldName);
        if (text.isEmpty()) {
            diagnostics.skipped(what, node, "no '" + fieldName + "' child");
        }
        return text;
    }
}
