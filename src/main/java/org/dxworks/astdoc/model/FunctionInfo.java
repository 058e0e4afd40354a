package org.dxworks.astdoc.model;

import java.util.ArrayList;
import java.util.List;

public class FunctionInfo {
    public String name;
    public List<ParameterInfo> parameters = new ArrayList<>();
    public String body;
    public List<MethodCall> calledMethods = new ArrayList<>();
    public List<LocalVariable> localVariables = new ArrayList<>();
    public String returnType;
    public String visibility;
    public List<AttributeInfo> attributes = new ArrayList<>();
}
