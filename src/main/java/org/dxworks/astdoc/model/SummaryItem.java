package org.dxworks.astdoc.model;

public class SummaryItem {
    public String type;
    public String name;

    public SummaryItem(String type, String name) {
        this.type = type;
        this.name = name;
    }
}
