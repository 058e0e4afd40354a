package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.TestUtils;
import org.dxworks.astdoc.analyzer.Diagnostics;
import org.dxworks.astdoc.model.FieldInfo;
import org.dxworks.astdoc.model.StructInfo;
import org.dxworks.astdoc.syntax.FakeNode;
import org.dxworks.astdoc.syntax.SourceText;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StructExtractorTest {

    @Test
    void extractsTopLevelStructsWithFields() throws IOException {
        TestUtils.Parsed parsed = TestUtils.parse(TestUtils.sample("Inventory.rs"));

        List<StructInfo> structs = new StructExtractor(parsed.context).extract(parsed.root);

        assertEquals(List.of("Item", "Pair"), structs.stream().map(s -> s.name).collect(Collectors.toList()));
        StructInfo item = structs.get(0);
        assertEquals(List.of("id", "warehouse_id", "name"),
                item.fields.stream().map(f -> f.name).collect(Collectors.toList()));
        assertEquals("u64", item.fields.get(0).type);
        assertEquals("#[derive(Debug, Clone)]", item.attributes.get(0).attribute);

        FieldInfo warehouse = item.fields.get(1);
        assertEquals(1, warehouse.attributes.size());
        assertEquals("#[foreign_key(Warehouse)]", warehouse.attributes.get(0).attribute);
        assertTrue(item.fields.get(0).attributes.isEmpty());
    }

    @Test
    void positionalFieldsAreSkippedWithDiagnostics() throws IOException {
        TestUtils.Parsed parsed = TestUtils.parse(TestUtils.sample("Inventory.rs"));

        List<StructInfo> structs = new StructExtractor(parsed.context).extract(parsed.root);

        assertTrue(structs.get(1).fields.isEmpty());
        assertEquals(2, parsed.diagnostics.getMessages().size());
        assertTrue(parsed.diagnostics.getMessages().get(0).contains("positional field"));
    }

    @Test
    void fieldWithoutNameDoesNotStopItsSiblings() {
        String code = "struct S { i32, b: u8 } struct T;";
        FakeNode unnamed = FakeNode.node("field_declaration", code, "i32")
                .field("type", FakeNode.node("primitive_type", code, "i32"));
        FakeNode named = FakeNode.node("field_declaration", code, "b: u8")
                .field("name", FakeNode.node("field_identifier", code, "b"))
                .field("type", FakeNode.node("primitive_type", code, "u8"));
        FakeNode body = FakeNode.node("field_declaration_list", code, "{ i32, b: u8 }")
                .child(unnamed).child(named);
        FakeNode s = FakeNode.node("struct_item", code, "struct S { i32, b: u8 }")
                .field("name", FakeNode.node("type_identifier", code, "S"))
                .field("body", body);
        FakeNode t = FakeNode.node("struct_item", code, "struct T;")
                .field("name", FakeNode.node("type_identifier", code, "T"));
        FakeNode root = FakeNode.node("source_file", 0, code.length()).child(s).child(t);
        Diagnostics diagnostics = new Diagnostics();

        List<StructInfo> structs = new StructExtractor(new ExtractionContext(new SourceText(code), diagnostics))
                .extract(root);

        assertEquals(2, structs.size());
        assertEquals(1, structs.get(0).fields.size());
        assertEquals("b", structs.get(0).fields.get(0).name);
        assertEquals("u8", structs.get(0).fields.get(0).type);
        assertEquals(1, diagnostics.getMessages().size());
        assertTrue(diagnostics.getMessages().get(0).startsWith("Skipped struct field"));
    }

    @Test
    void structWithoutNameIsSkipped() {
        String code = "struct { }";
        FakeNode nameless = FakeNode.node("struct_item", 0, code.length());
        FakeNode root = FakeNode.node("source_file", 0, code.length()).child(nameless);
        Diagnostics diagnostics = new Diagnostics();

        List<StructInfo> structs = new StructExtractor(new ExtractionContext(new SourceText(code), diagnostics))
                .extract(root);

        assertTrue(structs.isEmpty());
        assertEquals(1, diagnostics.getMessages().size());
    }
}
