package org.dxworks.astdoc.model;

import java.util.ArrayList;
import java.util.List;

public class FieldInfo {
    public String name;
    public String type;
    public List<AttributeInfo> attributes = new ArrayList<>();
}
