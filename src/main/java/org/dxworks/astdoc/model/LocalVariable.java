package org.dxworks.astdoc.model;

public class LocalVariable {
    public String name;
    public String value;  // initializer text, the only type hint available without inference
    public String type;   // declared type, if annotated
}
