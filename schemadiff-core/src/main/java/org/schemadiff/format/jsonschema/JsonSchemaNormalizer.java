package org.schemadiff.format.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import org.schemadiff.exception.SchemaParseException;
import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.PrimitiveKind;
import org.schemadiff.model.ReferenceNode;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.UnionNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a JSON Schema document (Jackson tree) onto the normalized node model.
 * Shared with the OpenAPI adapter, which additionally honours {@code nullable}.
 */
public class JsonSchemaNormalizer {

    public static final String TYPE_ANY = "any";
    public static final String TYPE_NEVER = "never";

    private final SchemaFormat format;
    private final boolean nullableKeyword;

    public JsonSchemaNormalizer(SchemaFormat format, boolean nullableKeyword) {
        this.format = format;
        this.nullableKeyword = nullableKeyword;
    }

    public SchemaNode normalize(JsonNode node, String pointer) throws SchemaParseException {
        if (node == null || node.isMissingNode()) {
            return ScalarNode.of(PrimitiveKind.ANY, TYPE_ANY);
        }
        if (node.isBoolean()) {
            // true는 모든 값을, false는 어떤 값도 허용하지 않는다
            return node.booleanValue() ? ScalarNode.of(PrimitiveKind.ANY, TYPE_ANY) : UnionNode.of(List.of());
        }
        if (!node.isObject()) {
            throw new SchemaParseException("Expected a schema object at " + pointer + " but found " + node.getNodeType());
        }

        SchemaNode result = normalizeShape(node, pointer);
        if (nullableKeyword && node.path("nullable").asBoolean(false)) {
            result = UnionNode.of(List.of(result, ScalarNode.of(PrimitiveKind.NULL, "null")));
        }
        if (node.path("deprecated").asBoolean(false)) {
            result = result.withMetadata(result.getMetadata().with(format, NodeMetadata.DEPRECATED, "true"));
        }
        return result;
    }

    private SchemaNode normalizeShape(JsonNode node, String pointer) throws SchemaParseException {
        if (node.hasNonNull("$ref")) {
            return ReferenceNode.of(node.get("$ref").asText());
        }
        for (String keyword : List.of("oneOf", "anyOf")) {
            if (node.has(keyword)) {
                return UnionNode.of(normalizeAll(node.get(keyword), pointer + "/" + keyword));
            }
        }
        if (node.has("allOf")) {
            return mergeAllOf(normalizeAll(node.get("allOf"), pointer + "/allOf"));
        }

        JsonNode type = node.get("type");
        if (type != null && type.isArray()) {
            if (type.size() == 1) {
                return normalizeTyped(node, type.get(0).asText(), pointer);
            }
            List<SchemaNode> alternatives = new ArrayList<>();
            for (JsonNode t : type) {
                alternatives.add(normalizeTyped(node, t.asText(), pointer));
            }
            return UnionNode.of(alternatives);
        }
        if (type != null && type.isTextual()) {
            return normalizeTyped(node, type.asText(), pointer);
        }
        if (type != null) {
            throw new SchemaParseException("'type' must be a string or an array at " + pointer);
        }

        if (node.has("properties")) {
            return normalizeTyped(node, "object", pointer);
        }
        if (node.has("items")) {
            return normalizeTyped(node, "array", pointer);
        }
        if (node.has("enum") || node.has("const")) {
            JsonNode sample = node.has("const") ? node.get("const") : node.get("enum").path(0);
            return normalizeTyped(node, inferType(sample), pointer);
        }
        return scalar(node, PrimitiveKind.ANY, TYPE_ANY);
    }

    private SchemaNode normalizeTyped(JsonNode node, String type, String pointer) throws SchemaParseException {
        return switch (type) {
            case "object" -> object(node, pointer);
            case "array" -> array(node, pointer);
            case "string" -> scalar(node, PrimitiveKind.STRING, type);
            case "integer" -> scalar(node, PrimitiveKind.INTEGER, type);
            case "number" -> scalar(node, PrimitiveKind.NUMBER, type);
            case "boolean" -> scalar(node, PrimitiveKind.BOOLEAN, type);
            case "null" -> scalar(node, PrimitiveKind.NULL, type);
            default -> throw new SchemaParseException("Unknown type '" + type + "' at " + pointer);
        };
    }

    private ObjectNode object(JsonNode node, String pointer) throws SchemaParseException {
        ObjectNode.ObjectNodeBuilder builder = ObjectNode.builder();
        JsonNode properties = node.path("properties");
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            builder.field(entry.getKey(), normalize(entry.getValue(), pointer + "/properties/" + entry.getKey()));
        }
        for (JsonNode name : node.path("required")) {
            if (properties.has(name.asText())) {
                builder.requiredField(name.asText());
            }
        }
        return builder.build();
    }

    private ArrayNode array(JsonNode node, String pointer) throws SchemaParseException {
        JsonNode items = node.get("items");
        SchemaNode element;
        if (items != null && items.isArray()) {
            element = UnionNode.of(normalizeAll(items, pointer + "/items"));
        } else {
            element = normalize(items, pointer + "/items");
        }
        return ArrayNode.builder()
                .element(element)
                .minItems(node.has("minItems") ? node.get("minItems").asInt() : null)
                .maxItems(node.has("maxItems") ? node.get("maxItems").asInt() : null)
                .build();
    }

    private ScalarNode scalar(JsonNode node, PrimitiveKind primitive, String typeName) {
        ScalarNode.ScalarNodeBuilder builder = ScalarNode.builder().primitive(primitive).typeName(typeName);

        boolean draft4ExclusiveMin = node.path("exclusiveMinimum").isBoolean() && node.get("exclusiveMinimum").asBoolean();
        boolean draft4ExclusiveMax = node.path("exclusiveMaximum").isBoolean() && node.get("exclusiveMaximum").asBoolean();
        if (node.path("minimum").isNumber()) {
            builder.constraint(draft4ExclusiveMin ? Constraint.EXCLUSIVE_MINIMUM : Constraint.MINIMUM, node.get("minimum").decimalValue());
        }
        if (node.path("maximum").isNumber()) {
            builder.constraint(draft4ExclusiveMax ? Constraint.EXCLUSIVE_MAXIMUM : Constraint.MAXIMUM, node.get("maximum").decimalValue());
        }
        if (node.path("exclusiveMinimum").isNumber()) {
            builder.constraint(Constraint.EXCLUSIVE_MINIMUM, node.get("exclusiveMinimum").decimalValue());
        }
        if (node.path("exclusiveMaximum").isNumber()) {
            builder.constraint(Constraint.EXCLUSIVE_MAXIMUM, node.get("exclusiveMaximum").decimalValue());
        }
        if (node.path("minLength").isNumber()) {
            builder.constraint(Constraint.MIN_LENGTH, node.get("minLength").decimalValue());
        }
        if (node.path("maxLength").isNumber()) {
            builder.constraint(Constraint.MAX_LENGTH, node.get("maxLength").decimalValue());
        }
        if (node.path("multipleOf").isNumber()) {
            builder.constraint(Constraint.MULTIPLE_OF, node.get("multipleOf").decimalValue());
        }
        if (node.path("pattern").isTextual()) {
            builder.constraint(Constraint.PATTERN, node.get("pattern").asText());
        }
        if (node.path("format").isTextual()) {
            builder.constraint(Constraint.FORMAT, node.get("format").asText());
        }
        if (node.has("const")) {
            builder.constraint(Constraint.ENUM, List.of(value(node.get("const"))));
        } else if (node.path("enum").isArray()) {
            List<Object> values = new ArrayList<>();
            node.get("enum").forEach(v -> values.add(value(v)));
            builder.constraint(Constraint.ENUM, List.copyOf(values));
        }
        if (node.has("default")) {
            builder.constraint(Constraint.DEFAULT_VALUE, value(node.get("default")));
        }
        return builder.build();
    }

    private List<SchemaNode> normalizeAll(JsonNode array, String pointer) throws SchemaParseException {
        if (!array.isArray()) {
            throw new SchemaParseException("Expected an array at " + pointer);
        }
        List<SchemaNode> result = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            result.add(normalize(array.get(i), pointer + "/" + i));
        }
        return result;
    }

    /**
     * allOf of plain objects is flattened into one object; anything else stays a union
     * of its branches.
     */
    private static SchemaNode mergeAllOf(List<SchemaNode> branches) {
        if (branches.size() == 1) {
            return branches.get(0);
        }
        if (branches.isEmpty() || !branches.stream().allMatch(ObjectNode.class::isInstance)) {
            return UnionNode.of(branches);
        }
        ObjectNode.ObjectNodeBuilder merged = ObjectNode.builder();
        Set<String> seen = new HashSet<>();
        for (SchemaNode branch : branches) {
            ObjectNode object = (ObjectNode) branch;
            object.getFields().forEach((name, child) -> {
                if (seen.add(name)) {
                    merged.field(name, child);
                }
            });
            object.getRequiredFields().forEach(merged::requiredField);
        }
        return merged.build();
    }

    private static String inferType(JsonNode sample) {
        if (sample.isIntegralNumber()) return "integer";
        if (sample.isNumber()) return "number";
        if (sample.isBoolean()) return "boolean";
        if (sample.isNull()) return "null";
        return "string";
    }

    /**
     * Keeps the JSON type of a literal so that {@code 1} and {@code "1"} stay distinct and
     * render back as written. Objects, arrays and null stay Jackson nodes.
     */
    private static Object value(JsonNode value) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue();
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        return value;
    }
}
