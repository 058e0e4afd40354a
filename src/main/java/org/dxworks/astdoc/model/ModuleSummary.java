package org.dxworks.astdoc.model;

import java.util.ArrayList;
import java.util.List;

public class ModuleSummary {
    public String type; // grammar kind: "mod_item" or "impl_item"
    public String name;
    public List<SummaryItem> children = new ArrayList<>();
}
