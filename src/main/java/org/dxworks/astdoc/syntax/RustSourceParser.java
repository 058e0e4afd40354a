package org.dxworks.astdoc.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterRust;

/**
 * Parses Rust source with tree-sitter and exposes the root as a {@link SyntaxNode}.
 */
public class RustSourceParser {

    private static final Logger log = LoggerFactory.getLogger(RustSourceParser.class);

    private static final TSLanguage RUST = new TreeSitterRust();

    public SyntaxNode parse(String sourceCode) {
        TSTree tree;
        try {
            TSParser parser = new TSParser();
            parser.setLanguage(RUST);
            tree = parser.parseString(null, sourceCode);
        } catch (RuntimeException e) {
            throw new SourceParseException("Failed to parse Rust source: " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new SourceParseException("Failed to parse Rust source: parser returned no tree");
        }

        if (tree.getRootNode().hasError()) {
            // Partial source is expected input; ERROR nodes are flattened during extraction
            log.debug("Syntax tree contains error nodes, continuing with partial tree");
        }
        return TreeSitterNode.root(tree)
                .orElseThrow(() -> new SourceParseException("Failed to parse Rust source: empty syntax tree"));
    }
}
