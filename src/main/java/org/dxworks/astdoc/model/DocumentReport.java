package org.dxworks.astdoc.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything extracted from one source file, one section per category.
 */
@JsonPropertyOrder({"imports", "functions", "structs", "enums", "relations", "constants",
        "modules_and_impls", "metadata", "nested_items", "globals", "schemas"})
public class DocumentReport {
    public List<ImportInfo> imports = new ArrayList<>();
    public List<FunctionInfo> functions = new ArrayList<>();
    public List<StructInfo> structs = new ArrayList<>();
    public List<EnumInfo> enums = new ArrayList<>();
    public List<RelationInfo> relations = new ArrayList<>();
    public List<ConstantInfo> constants = new ArrayList<>();
    public List<ModuleSummary> modulesAndImpls = new ArrayList<>();
    public List<AttributeInfo> metadata = new ArrayList<>();
    public DocumentElement nestedItems;
    public List<GlobalInfo> globals = new ArrayList<>();
    public List<SchemaInfo> schemas = new ArrayList<>();
}
