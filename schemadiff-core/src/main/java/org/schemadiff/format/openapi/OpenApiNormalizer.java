package org.schemadiff.format.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import org.schemadiff.exception.SchemaParseException;
import org.schemadiff.format.jsonschema.JsonSchemaNormalizer;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.PrimitiveKind;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flattens an OpenAPI 3.x or Swagger 2.0 document into the normalized tree.
 */
final class OpenApiNormalizer {

    static final String API_VERSION = "apiVersion";
    static final String SPEC_VERSION = "specVersion";
    static final String OPERATION_ID = "operationId";

    private static final Set<String> METHODS = Set.of("get", "put", "post", "delete", "options", "head", "patch", "trace");
    private static final List<String> PREFERRED_MEDIA_TYPES = List.of("application/json", "*/*");

    private final JsonSchemaNormalizer schemas = new JsonSchemaNormalizer(SchemaFormat.OPENAPI, true);

    SchemaNode normalize(JsonNode document) throws SchemaParseException {
        ObjectNode.ObjectNodeBuilder root = ObjectNode.builder();
        root.field(ApiLocation.PATHS, paths(document.path("paths")));
        root.field(ApiLocation.COMPONENTS, components(document));

        NodeMetadata metadata = NodeMetadata.empty();
        String apiVersion = document.path("info").path("version").asText(null);
        if (apiVersion != null) {
            metadata = metadata.with(SchemaFormat.OPENAPI, API_VERSION, apiVersion);
        }
        String specVersion = document.has("openapi") ? document.get("openapi").asText() : document.path("swagger").asText(null);
        if (specVersion != null) {
            metadata = metadata.with(SchemaFormat.OPENAPI, SPEC_VERSION, specVersion);
        }
        return root.metadata(metadata).build();
    }

    private ObjectNode paths(JsonNode paths) throws SchemaParseException {
        ObjectNode.ObjectNodeBuilder builder = ObjectNode.builder();
        Iterator<Map.Entry<String, JsonNode>> it = paths.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            builder.field(entry.getKey(), pathItem(entry.getKey(), entry.getValue()));
        }
        return builder.build();
    }

    private ObjectNode pathItem(String path, JsonNode item) throws SchemaParseException {
        ObjectNode.ObjectNodeBuilder builder = ObjectNode.builder();
        Iterator<Map.Entry<String, JsonNode>> it = item.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String method = entry.getKey().toLowerCase(Locale.ROOT);
            if (METHODS.contains(method)) {
                builder.field(method, operation(path + " " + method, item.path("parameters"), entry.getValue()));
            }
        }
        return builder.build();
    }

    private ObjectNode operation(String pointer, JsonNode sharedParameters, JsonNode operation) throws SchemaParseException {
        ObjectNode.ObjectNodeBuilder builder = ObjectNode.builder();

        // path 수준 파라미터를 먼저 두고 operation 수준 정의로 덮어쓴다
        Map<String, JsonNode> parameters = new LinkedHashMap<>();
        JsonNode body = null;
        for (JsonNode source : List.of(sharedParameters, operation.path("parameters"))) {
            for (JsonNode parameter : source) {
                if ("body".equals(parameter.path("in").asText())) {
                    body = parameter;
                } else {
                    parameters.put(parameter.path("in").asText() + ":" + parameter.path("name").asText(), parameter);
                }
            }
        }

        ObjectNode.ObjectNodeBuilder params = ObjectNode.builder();
        for (Map.Entry<String, JsonNode> entry : parameters.entrySet()) {
            JsonNode parameter = entry.getValue();
            JsonNode schema = parameter.has("schema") ? parameter.get("schema") : parameter;
            SchemaNode node = deprecated(schemas.normalize(schema, pointer + " " + entry.getKey()), parameter);
            params.field(entry.getKey(), node);
            if (parameter.path("required").asBoolean(false) || "path".equals(parameter.path("in").asText())) {
                params.requiredField(entry.getKey());
            }
        }
        builder.field(ApiLocation.PARAMETERS, params.build());

        if (operation.has("requestBody")) {
            JsonNode requestBody = operation.get("requestBody");
            builder.field(ApiLocation.REQUEST_BODY, schemas.normalize(mediaSchema(requestBody.path("content")), pointer + " requestBody"));
            if (requestBody.path("required").asBoolean(false)) {
                builder.requiredField(ApiLocation.REQUEST_BODY);
            }
        } else if (body != null) {
            builder.field(ApiLocation.REQUEST_BODY, schemas.normalize(body.path("schema"), pointer + " body"));
            if (body.path("required").asBoolean(false)) {
                builder.requiredField(ApiLocation.REQUEST_BODY);
            }
        }

        ObjectNode.ObjectNodeBuilder responses = ObjectNode.builder();
        Iterator<Map.Entry<String, JsonNode>> it = operation.path("responses").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode response = entry.getValue();
            JsonNode schema = response.has("content") ? mediaSchema(response.get("content")) : response.path("schema");
            responses.field(entry.getKey(), schema.isMissingNode()
                    ? ScalarNode.of(PrimitiveKind.NULL, "empty")
                    : schemas.normalize(schema, pointer + " response " + entry.getKey()));
        }
        builder.field(ApiLocation.RESPONSES, responses.build());

        NodeMetadata metadata = NodeMetadata.empty();
        if (operation.path("deprecated").asBoolean(false)) {
            metadata = metadata.with(SchemaFormat.OPENAPI, NodeMetadata.DEPRECATED, "true");
        }
        if (operation.hasNonNull(OPERATION_ID)) {
            metadata = metadata.with(SchemaFormat.OPENAPI, OPERATION_ID, operation.get(OPERATION_ID).asText());
        }
        return builder.metadata(metadata).build();
    }

    private ObjectNode components(JsonNode document) throws SchemaParseException {
        JsonNode components = document.path("components");
        // Swagger 2.0은 최상위 definitions / securityDefinitions를 쓴다
        JsonNode schemaDefs = components.has("schemas") ? components.get("schemas") : document.path("definitions");
        JsonNode securityDefs = components.has("securitySchemes")
                ? components.get("securitySchemes") : document.path("securityDefinitions");

        ObjectNode.ObjectNodeBuilder schemaBuilder = ObjectNode.builder();
        Iterator<Map.Entry<String, JsonNode>> it = schemaDefs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            schemaBuilder.field(entry.getKey(), schemas.normalize(entry.getValue(), "#/components/schemas/" + entry.getKey()));
        }

        ObjectNode.ObjectNodeBuilder securityBuilder = ObjectNode.builder();
        it = securityDefs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            securityBuilder.field(entry.getKey(), ScalarNode.of(PrimitiveKind.ANY, securitySignature(entry.getValue())));
        }

        return ObjectNode.builder()
                .field(ApiLocation.SCHEMAS, schemaBuilder.build())
                .field(ApiLocation.SECURITY_SCHEMES, securityBuilder.build())
                .build();
    }

    private static JsonNode mediaSchema(JsonNode content) {
        for (String mediaType : PREFERRED_MEDIA_TYPES) {
            if (content.has(mediaType)) {
                return content.get(mediaType).path("schema");
            }
        }
        Iterator<JsonNode> first = content.elements();
        return first.hasNext() ? first.next().path("schema") : content.path("schema");
    }

    private static SchemaNode deprecated(SchemaNode node, JsonNode declaration) {
        if (!declaration.path("deprecated").asBoolean(false)) {
            return node;
        }
        return node.withMetadata(node.getMetadata().with(SchemaFormat.OPENAPI, NodeMetadata.DEPRECATED, "true"));
    }

    private static String securitySignature(JsonNode scheme) {
        StringBuilder sb = new StringBuilder(scheme.path("type").asText("unknown"));
        for (String key : List.of("scheme", "in", "name", "bearerFormat", "flow")) {
            if (scheme.hasNonNull(key)) {
                sb.append(':').append(scheme.get(key).asText());
            }
        }
        return sb.toString();
    }
}
