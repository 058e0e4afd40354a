package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonInclude;

public class VariantInfo {
    public String name;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String value; // explicit discriminant
}
