package org.dxworks.astdoc.model;

/**
 * Single-assignment name cell: the first claim wins, later claims are ignored.
 */
public final class NameSlot {

    private String value;

    public boolean isClaimed() {
        return value != null;
    }

    /**
     * @return {@code true} if this call set the name
     */
    public boolean claim(String name) {
        if (value != null || name == null || name.isEmpty()) return false;
        value = name;
        return true;
    }

    public String get() {
        return value;
    }
}
