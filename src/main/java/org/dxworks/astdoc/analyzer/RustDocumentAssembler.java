package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.analyzer.extract.ConstantExtractor;
import org.dxworks.astdoc.analyzer.extract.EnumExtractor;
import org.dxworks.astdoc.analyzer.extract.ExtractionContext;
import org.dxworks.astdoc.analyzer.extract.FunctionExtractor;
import org.dxworks.astdoc.analyzer.extract.GlobalExtractor;
import org.dxworks.astdoc.analyzer.extract.ImportExtractor;
import org.dxworks.astdoc.analyzer.extract.ModuleSummaryExtractor;
import org.dxworks.astdoc.analyzer.extract.RelationExtractor;
import org.dxworks.astdoc.analyzer.extract.StructExtractor;
import org.dxworks.astdoc.model.DocumentReport;
import org.dxworks.astdoc.syntax.SourceText;
import org.dxworks.astdoc.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the tree builder and every category extractor over one file and composes the report.
 * <p>
 * The category sections only look at the direct children of the root, while {@code nested_items} covers the whole
 * tree, so an item nested in a module shows up in the latter only.
 */
public class RustDocumentAssembler implements LanguageAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RustDocumentAssembler.class);

    private final boolean sortChildren;
    private final SchemaInferencer schemaInferencer = new SchemaInferencer();

    public RustDocumentAssembler() {
        this(false);
    }

    public RustDocumentAssembler(boolean sortChildren) {
        this.sortChildren = sortChildren;
    }

    @Override
    public DocumentReport analyze(SourceText source, SyntaxNode rootNode, Diagnostics diagnostics) {
        ExtractionContext context = new ExtractionContext(source, diagnostics);
        DocumentReport report = new DocumentReport();

        report.imports = new ImportExtractor(context).extract(rootNode);
        report.functions = new FunctionExtractor(context).extract(rootNode);
        report.structs = new StructExtractor(context).extract(rootNode);
        report.enums = new EnumExtractor(context).extract(rootNode);
        report.relations = new RelationExtractor(context).extract(rootNode);
        report.constants = new ConstantExtractor(context).extract(rootNode);
        report.modulesAndImpls = new ModuleSummaryExtractor(context).extract(rootNode);
        report.metadata = context.attributes().attributes(rootNode);
        report.nestedItems = new DocumentTreeBuilder(source, sortChildren).build(rootNode);
        report.globals = new GlobalExtractor(context).extract(rootNode);
        report.schemas = schemaInferencer.infer(report.structs);

        log.debug("Extracted {} functions, {} structs, {} enums, {} relations ({} diagnostics)",
                report.functions.size(), report.structs.size(), report.enums.size(), report.relations.size(),
                diagnostics.getMessages().size());
        return report;
    }
}
