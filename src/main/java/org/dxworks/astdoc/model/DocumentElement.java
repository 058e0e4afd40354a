package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Node of the shaped document tree.
 */
@JsonPropertyOrder({"kind", "name", "text", "children", "relations"})
public class DocumentElement {

    /** Stable order by kind, then name with unnamed elements first. */
    public static final Comparator<DocumentElement> KIND_NAME_ORDER = Comparator
            .comparing(DocumentElement::getKind)
            .thenComparing(DocumentElement::getName, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final SemanticKind kind;
    private final NameSlot name = new NameSlot();
    private final String text;
    private final List<DocumentElement> children = new ArrayList<>();
    private final List<RelationEdge> relations = new ArrayList<>();

    public DocumentElement(SemanticKind kind, String text) {
        if (!kind.isMaterialized()) {
            throw new IllegalArgumentException("Cannot materialize an element of kind " + kind);
        }
        this.kind = kind;
        this.text = text;
    }

    public SemanticKind getKind() {
        return kind;
    }

    public String getName() {
        return name.get();
    }

    public String getText() {
        return text;
    }

    public List<DocumentElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<RelationEdge> getRelations() {
        return Collections.unmodifiableList(relations);
    }

    public boolean claimName(String candidate) {
        return name.claim(candidate);
    }

    public boolean hasName() {
        return name.isClaimed();
    }

    /**
     * Appends a child and records the {@code (this.kind, child.kind)} edge.
     */
    public void attach(DocumentElement child) {
        children.add(child);
        relations.add(new RelationEdge(kind, child.kind));
    }

    public void sortChildren(Comparator<DocumentElement> order) {
        // List.sort is stable
        children.sort(order);
    }
}
