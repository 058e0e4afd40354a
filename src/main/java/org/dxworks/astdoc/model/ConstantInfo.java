package org.dxworks.astdoc.model;

public class ConstantInfo {
    public String name;
    public String value;
    public String type;
}
