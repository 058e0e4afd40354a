package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.List;

/**
 * Produces the items of one report category from the direct children of a node.
 */
public interface CategoryExtractor<T> {
    List<T> extract(SyntaxNode node);
}
