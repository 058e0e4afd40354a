package org.dxworks.astdoc.model;

import java.util.ArrayList;
import java.util.List;

public class EnumInfo {
    public String name;
    public List<VariantInfo> variants = new ArrayList<>();
}
