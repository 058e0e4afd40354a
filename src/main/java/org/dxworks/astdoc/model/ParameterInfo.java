package org.dxworks.astdoc.model;

public class ParameterInfo {
    public String name;
    public String type;
    public boolean isMutable;
    public boolean isReference;
    public String defaultValue; // Rust has no default arguments, kept for a stable shape
}
