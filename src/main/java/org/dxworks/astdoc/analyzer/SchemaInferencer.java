package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.model.AttributeInfo;
import org.dxworks.astdoc.model.FieldInfo;
import org.dxworks.astdoc.model.SchemaInfo;
import org.dxworks.astdoc.model.SchemaRelationship;
import org.dxworks.astdoc.model.StructInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives schema views of structs, surfacing fields annotated as foreign keys.
 * The struct list passed in is not modified.
 */
public class SchemaInferencer {

    static final String FOREIGN_KEY_MARKER = "foreign_key";

    // foreign_key(User), foreign_key(crate::users::User), foreign_key = "users"
    private static final Pattern FOREIGN_KEY_TARGET =
            Pattern.compile("foreign_key\\s*(?:\\(\\s*([A-Za-z_][\\w:]*)|=\\s*\"([^\"]+)\")");

    public List<SchemaInfo> infer(List<StructInfo> structs) {
        List<SchemaInfo> schemas = new ArrayList<>();
        for (StructInfo struct : structs) {
            SchemaInfo schema = new SchemaInfo();
            schema.structName = struct.name;
            schema.attributes = new ArrayList<>(struct.attributes);
            schema.fields = new ArrayList<>(struct.fields);
            for (FieldInfo field : struct.fields) {
                foreignKey(field).ifPresent(schema.relationships::add);
            }
            schemas.add(schema);
        }
        return schemas;
    }

    private Optional<SchemaRelationship> foreignKey(FieldInfo field) {
        for (AttributeInfo attribute : field.attributes) {
            if (attribute.attribute == null || !attribute.attribute.contains(FOREIGN_KEY_MARKER)) continue;
            return Optional.of(new SchemaRelationship(field.name, SchemaRelationship.FOREIGN_KEY,
                    targetOf(attribute.attribute)));
        }
        return Optional.empty();
    }

    static String targetOf(String attributeText) {
        Matcher matcher = FOREIGN_KEY_TARGET.matcher(attributeText);
        if (!matcher.find()) return null;
        return matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
    }
}
