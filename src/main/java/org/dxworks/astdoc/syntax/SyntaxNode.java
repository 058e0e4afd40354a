package org.dxworks.astdoc.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a concrete syntax tree node, as handed over by the parser.
 * The extraction code only ever talks to this interface, never to the parser's own node type.
 */
public interface SyntaxNode {

    /** Grammar kind tag, e.g. {@code "function_item"}. */
    String kind();

    int startByte();

    int endByte();

    /** All children in document order, punctuation included. */
    List<SyntaxNode> children();

    /** Children that carry meaning in the grammar, punctuation excluded. */
    List<SyntaxNode> namedChildren();

    Optional<SyntaxNode> childByField(String fieldName);

    default boolean isKind(String... kinds) {
        String own = kind();
        for (String k : kinds) {
            if (k.equals(own)) return true;
        }
        return false;
    }
}
