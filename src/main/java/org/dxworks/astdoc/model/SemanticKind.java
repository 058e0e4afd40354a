package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed taxonomy imposed on syntax nodes. {@link #UNDEFINED} is never materialized in the shaped tree.
 */
public enum SemanticKind {
    ROOT("Root"),
    COMMENT("Comment"),
    IMPORT("Import"),
    STRUCT("Struct"),
    ENUM("Enum"),
    DERIVE("Derive"),
    FUNCTION("Function"),
    METHOD("Method"),
    FIELD("Field"),
    VARIABLE("Variable"),
    TYPE("Type"),
    TRAIT("Trait"),
    IMPL("Impl"),
    IF("If"),
    ELSE("Else"),
    LOOP("Loop"),
    TUPLE("Tuple"),
    ARRAY("Array"),
    FUNCTION_CALL("FunctionCall"),
    UNDEFINED("Undefined");

    private final String label;

    SemanticKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isMaterialized() {
        return this != UNDEFINED;
    }
}
