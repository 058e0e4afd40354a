package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Parent kind to child kind pairing, recorded when a child element is attached.
 */
public final class RelationEdge {

    private final SemanticKind parent;
    private final SemanticKind child;

    public RelationEdge(SemanticKind parent, SemanticKind child) {
        this.parent = parent;
        this.child = child;
    }

    public SemanticKind getParent() {
        return parent;
    }

    public SemanticKind getChild() {
        return child;
    }

    @JsonValue
    @Override
    public String toString() {
        return parent.getLabel() + " -> " + child.getLabel();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationEdge)) return false;
        RelationEdge that = (RelationEdge) o;
        return parent == that.parent && child == that.child;
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, child);
    }
}
