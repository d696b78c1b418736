package org.schemadiff.format.jsonschema;

import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.PrimitiveKind;
import org.schemadiff.model.ReferenceNode;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.UnionNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a normalized node back into a JSON Schema fragment, as plain maps ready for Jackson.
 */
final class JsonSchemaWriter {

    private JsonSchemaWriter() {
    }

    static Map<String, Object> write(SchemaNode node) {
        Map<String, Object> json = new LinkedHashMap<>();
        switch (node.getKind()) {
            case SCALAR -> {
                ScalarNode scalar = (ScalarNode) node;
                if (scalar.getPrimitive() != PrimitiveKind.ANY) {
                    json.put("type", scalar.getTypeName());
                }
                scalar.getConstraints().forEach((constraint, value) -> json.put(keyword(constraint), value));
            }
            case OBJECT -> {
                ObjectNode object = (ObjectNode) node;
                json.put("type", "object");
                Map<String, Object> properties = new LinkedHashMap<>();
                object.getFields().forEach((name, child) -> properties.put(name, write(child)));
                json.put("properties", properties);
                if (!object.getRequiredFields().isEmpty()) {
                    json.put("required", new ArrayList<>(object.getRequiredFields()));
                }
            }
            case ARRAY -> {
                ArrayNode array = (ArrayNode) node;
                json.put("type", "array");
                json.put("items", write(array.getElement()));
                if (array.getMinItems() != null) json.put("minItems", array.getMinItems());
                if (array.getMaxItems() != null) json.put("maxItems", array.getMaxItems());
            }
            case UNION -> {
                List<Object> alternatives = new ArrayList<>();
                ((UnionNode) node).getAlternatives().forEach(alt -> alternatives.add(write(alt)));
                json.put("oneOf", alternatives);
            }
            case REFERENCE -> json.put("$ref", ((ReferenceNode) node).getTarget());
        }
        return json;
    }

    private static String keyword(Constraint constraint) {
        return constraint.getKey();
    }
}
