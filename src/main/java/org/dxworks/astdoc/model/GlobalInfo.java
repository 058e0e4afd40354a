package org.dxworks.astdoc.model;

public class GlobalInfo {
    public String name;
    public String value;
    public String type;
    public boolean mutable;
}
