package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonInclude;

public class SchemaRelationship {
    public static final String FOREIGN_KEY = "foreign_key";

    public String field;
    public String relationship;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String target; // referenced entity, when the annotation names one

    public SchemaRelationship(String field, String relationship, String target) {
        this.field = field;
        this.relationship = relationship;
        this.target = target;
    }
}
