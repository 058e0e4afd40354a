package org.dxworks.astdoc.model;

public class MethodCall {
    public String name;
    public Integer argumentCount;
    public int callCount = 1;

    public MethodCall(String name, Integer argumentCount) {
        this.name = name;
        this.argumentCount = argumentCount;
    }

    // For aggregation: same target called with the same number of arguments
    public boolean matches(String name, Integer argumentCount) {
        boolean nameMatch = this.name != null && this.name.equals(name);
        boolean argMatch = (this.argumentCount == null && argumentCount == null) ||
                          (this.argumentCount != null && this.argumentCount.equals(argumentCount));
        return nameMatch && argMatch;
    }
}
