package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Either an {@code impl} block or a {@code derive} attribute.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelationInfo {
    public static final String IMPL = "impl";
    public static final String DERIVE = "derive";

    public String type;
    @JsonProperty("for")
    public String forType;
    @JsonProperty("trait")
    public String traitName;
    public String generics;
    public AttributeInfo details;
    public List<String> traits;

    public static RelationInfo impl(String forType, String traitName, String generics) {
        RelationInfo relation = new RelationInfo();
        relation.type = IMPL;
        relation.forType = forType;
        relation.traitName = traitName;
        relation.generics = generics;
        return relation;
    }

    public static RelationInfo derive(AttributeInfo details, List<String> traits) {
        RelationInfo relation = new RelationInfo();
        relation.type = DERIVE;
        relation.details = details;
        relation.traits = traits;
        return relation;
    }
}
