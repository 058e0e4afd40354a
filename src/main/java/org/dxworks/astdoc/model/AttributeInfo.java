package org.dxworks.astdoc.model;

public class AttributeInfo {
    public String attribute;

    public AttributeInfo(String attribute) {
        this.attribute = attribute;
    }
}
