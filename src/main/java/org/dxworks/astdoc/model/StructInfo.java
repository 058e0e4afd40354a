package org.dxworks.astdoc.model;

import java.util.ArrayList;
import java.util.List;

public class StructInfo {
    public String name;
    public List<FieldInfo> fields = new ArrayList<>();
    public List<AttributeInfo> attributes = new ArrayList<>(); // attributes placed before the struct
}
