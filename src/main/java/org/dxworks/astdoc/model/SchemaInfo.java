package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class SchemaInfo {
    @JsonProperty("struct")
    public String structName;
    public List<AttributeInfo> attributes = new ArrayList<>();
    public List<FieldInfo> fields = new ArrayList<>();
    public List<SchemaRelationship> relationships = new ArrayList<>();
}
