package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.model.AttributeInfo;
import org.dxworks.astdoc.model.FieldInfo;
import org.dxworks.astdoc.model.SchemaInfo;
import org.dxworks.astdoc.model.SchemaRelationship;
import org.dxworks.astdoc.model.StructInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaInferencerTest {

    private static FieldInfo field(String name, String... attributes) {
        FieldInfo field = new FieldInfo();
        field.name = name;
        field.type = "i64";
        for (String attribute : attributes) {
            field.attributes.add(new AttributeInfo(attribute));
        }
        return field;
    }

    @Test
    void reportsForeignKeyFields() {
        StructInfo order = new StructInfo();
        order.name = "Order";
        order.attributes.add(new AttributeInfo("#[derive(Queryable)]"));
        order.fields.add(field("id", "#[primary_key]"));
        order.fields.add(field("customer_id", "#[foreign_key(Customer)]"));
        order.fields.add(field("note"));

        List<SchemaInfo> schemas = new SchemaInferencer().infer(List.of(order));

        assertEquals(1, schemas.size());
        SchemaInfo schema = schemas.get(0);
        assertEquals("Order", schema.structName);
        assertEquals(3, schema.fields.size());
        assertEquals(1, schema.attributes.size());
        assertEquals(1, schema.relationships.size());
        SchemaRelationship relationship = schema.relationships.get(0);
        assertEquals("customer_id", relationship.field);
        assertEquals(SchemaRelationship.FOREIGN_KEY, relationship.relationship);
        assertEquals("Customer", relationship.target);
    }

    @Test
    void leavesTheStructReportUntouched() {
        StructInfo user = new StructInfo();
        user.name = "User";
        user.fields.add(field("team_id", "#[foreign_key = \"teams\"]"));

        SchemaInfo schema = new SchemaInferencer().infer(List.of(user)).get(0);
        schema.fields.clear();

        assertEquals(1, user.fields.size());
        assertEquals(1, schema.relationships.size());
    }

    @Test
    void readsTheReferencedTarget() {
        assertEquals("Customer", SchemaInferencer.targetOf("#[foreign_key(Customer)]"));
        assertEquals("crate::users::User", SchemaInferencer.targetOf("#[foreign_key( crate::users::User )]"));
        assertEquals("teams", SchemaInferencer.targetOf("#[foreign_key = \"teams\"]"));
        assertNull(SchemaInferencer.targetOf("#[foreign_key]"));
    }
}
