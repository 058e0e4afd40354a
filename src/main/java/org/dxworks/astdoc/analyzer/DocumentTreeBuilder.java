package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.model.DocumentElement;
import org.dxworks.astdoc.model.SemanticKind;
import org.dxworks.astdoc.syntax.SourceText;
import org.dxworks.astdoc.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds the shaped document tree from a syntax tree.
 * <p>
 * The walk is pre-order over every node, using an explicit stack so deeply nested input cannot exhaust the call
 * stack. A classified node becomes an element attached to the nearest element above it; any other node (no table
 * entry, or {@link SemanticKind#UNDEFINED}) creates nothing and its descendants attach to that same element instead.
 * Identifier tokens name the nearest element above them if it has no name yet. The root element stands for the
 * whole file and is never named this way.
 */
public class DocumentTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocumentTreeBuilder.class);

    private static final String[] IDENTIFIER_TAGS = {"identifier", "type_identifier", "field_identifier"};
    private static final int TRACE_PREVIEW = 18;

    private final SourceText source;
    private final boolean sortChildren;

    public DocumentTreeBuilder(SourceText source, boolean sortChildren) {
        this.source = source;
        this.sortChildren = sortChildren;
    }

    /**
     * Builds the tree for a whole file. The returned {@link SemanticKind#ROOT} element stands for {@code root}.
     */
    public DocumentElement build(SyntaxNode root) {
        DocumentElement document = new DocumentElement(SemanticKind.ROOT, source.preview(root));
        walk(root.children(), document, 1);
        if (sortChildren) {
            sortAll(document);
        }
        return document;
    }

    /**
     * Attaches whatever {@code node} and its descendants produce to {@code parent}.
     */
    public void build(SyntaxNode node, DocumentElement parent) {
        walk(List.of(node), parent, 0);
    }

    private void walk(List<SyntaxNode> nodes, DocumentElement parent, int depth) {
        Deque<Frame> stack = new ArrayDeque<>();
        pushAll(stack, nodes, parent, depth);

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            SyntaxNode node = frame.node;
            String text = source.text(node);
            if (log.isTraceEnabled()) {
                log.trace("{}{}: {} ·{}·", "  ".repeat(frame.depth), frame.depth, node.kind(),
                        text.substring(0, Math.min(TRACE_PREVIEW, text.length())));
            }

            if (node.isKind(IDENTIFIER_TAGS) && frame.parent.getKind() != SemanticKind.ROOT
                    && !frame.parent.hasName()) {
                frame.parent.claimName(text);
            }

            DocumentElement target = frame.parent;
            SemanticKind kind = KindClassifier.kindOf(node);
            if (materializes(kind)) {
                DocumentElement element = new DocumentElement(kind, source.preview(node));
                frame.parent.attach(element);
                target = element;
            }
            pushAll(stack, node.children(), target, frame.depth + 1);
        }
    }

    private static void pushAll(Deque<Frame> stack, List<SyntaxNode> nodes, DocumentElement parent, int depth) {
        // reversed so siblings pop in document order
        for (int i = nodes.size() - 1; i >= 0; i--) {
            stack.push(new Frame(nodes.get(i), parent, depth));
        }
    }

    private static boolean materializes(SemanticKind kind) {
        return switch (kind) {
            case ROOT, COMMENT, IMPORT, STRUCT, ENUM, DERIVE, FUNCTION, METHOD, FIELD, VARIABLE, TYPE, TRAIT, IMPL,
                    IF, ELSE, LOOP, TUPLE, ARRAY, FUNCTION_CALL -> true;
            case UNDEFINED -> false;
        };
    }

    private static void sortAll(DocumentElement document) {
        Deque<DocumentElement> stack = new ArrayDeque<>();
        stack.push(document);
        while (!stack.isEmpty()) {
            DocumentElement element = stack.pop();
            element.sortChildren(DocumentElement.KIND_NAME_ORDER);
            element.getChildren().forEach(stack::push);
        }
    }

    private static final class Frame {
        final SyntaxNode node;
        final DocumentElement parent;
        final int depth;

        Frame(SyntaxNode node, DocumentElement parent, int depth) {
            this.node = node;
            this.parent = parent;
            this.depth = depth;
        }
    }
}
