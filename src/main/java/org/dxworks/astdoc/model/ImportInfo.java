package org.dxworks.astdoc.model;

public class ImportInfo {
    public String name;

    public ImportInfo(String name) {
        this.name = name;
    }
}
