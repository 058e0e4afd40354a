package org.dxworks.astdoc.syntax;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxNode} backed by a tree-sitter {@link TSNode}.
 * Every node keeps its {@link TSTree} reachable, the native tree is freed once the tree object is collected.
 */
public final class TreeSitterNode implements SyntaxNode {

    private final TSNode node;
    private final TSTree tree;

    private TreeSitterNode(TSNode node, TSTree tree) {
        this.node = node;
        this.tree = tree;
    }

    public static Optional<SyntaxNode> root(TSTree tree) {
        return wrap(tree.getRootNode(), tree);
    }

    private static Optional<SyntaxNode> wrap(TSNode node, TSTree tree) {
        if (node == null || node.isNull()) return Optional.empty();
        return Optional.of(new TreeSitterNode(node, tree));
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public List<SyntaxNode> children() {
        int count = node.getChildCount();
        if (count == 0) return Collections.emptyList();
        List<SyntaxNode> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            wrap(node.getChild(i), tree).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public List<SyntaxNode> namedChildren() {
        // getNamedChild(i) of the binding repeats the first named child, so filter the full child list instead
        int count = node.getChildCount();
        if (count == 0) return Collections.emptyList();
        List<SyntaxNode> result = new ArrayList<>(node.getNamedChildCount());
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && child.isNamed()) {
                result.add(new TreeSitterNode(child, tree));
            }
        }
        return result;
    }

    @Override
    public Optional<SyntaxNode> childByField(String fieldName) {
        return wrap(node.getChildByFieldName(fieldName), tree);
    }

    @Override
    public String toString() {
        return kind() + "[" + startByte() + ".." + endByte() + "]";
    }
}
