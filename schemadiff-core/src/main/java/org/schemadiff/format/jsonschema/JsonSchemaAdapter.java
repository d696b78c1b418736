package org.schemadiff.format.jsonschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.FormatSpecificException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.exception.SchemaParseException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.migration.RenderContext;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.rules.RuleTable;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON Schema (draft 4 through 2020-12) documents.
 * <p>
 * Schemas under {@code definitions} / {@code $defs} become extra root members named
 * {@code $defs:Name} or {@code definitions:Name}, so removing a shared definition is reported
 * like removing a field.
 */
@Slf4j
public class JsonSchemaAdapter implements FormatAdapter {

    private static final List<String> DEFINITION_KEYWORDS = List.of("$defs", "definitions");

    private final ObjectMapper mapper;
    private final JsonSchemaNormalizer normalizer;
    private final JsonPatchRenderer renderer;
    private final RuleTable ruleTable;

    public JsonSchemaAdapter() {
        this(new ObjectMapper());
    }

    public JsonSchemaAdapter(ObjectMapper mapper) {
        this.mapper = mapper;
        this.normalizer = new JsonSchemaNormalizer(SchemaFormat.JSON_SCHEMA, false);
        this.renderer = new JsonPatchRenderer(mapper);
        this.ruleTable = JsonSchemaRules.table();
    }

    @Override
    public SchemaFormat format() {
        return SchemaFormat.JSON_SCHEMA;
    }

    @Override
    public void checkSyntax(String content) throws SchemaDiffException {
        readDocument(content);
    }

    @Override
    public SchemaNode normalize(Schema schema) throws SchemaDiffException {
        JsonNode document = readDocument(schema.getContent());
        SchemaNode root = normalizer.normalize(document, "#");

        if (root instanceof ObjectNode object) {
            ObjectNode.ObjectNodeBuilder builder = object.toBuilder();
            for (String keyword : DEFINITION_KEYWORDS) {
                Iterator<Map.Entry<String, JsonNode>> defs = document.path(keyword).fields();
                while (defs.hasNext()) {
                    Map.Entry<String, JsonNode> def = defs.next();
                    builder.field(keyword + JsonPatchRenderer.DEFS_SEPARATOR + def.getKey(),
                            normalizer.normalize(def.getValue(), "#/" + keyword + "/" + def.getKey()));
                }
            }
            root = builder.build();
        } else if (DEFINITION_KEYWORDS.stream().anyMatch(document::has)) {
            log.debug("Ignoring definitions of a non-object root schema");
        }
        return root;
    }

    @Override
    public RuleTable ruleTable() {
        return ruleTable;
    }

    @Override
    public String render(MigrationInstruction instruction, RenderContext context) {
        return renderer.render(instruction, context);
    }

    private JsonNode readDocument(String content) throws SchemaDiffException {
        JsonNode document;
        try {
            document = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new FormatSpecificException(SchemaFormat.JSON_SCHEMA, "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || !(document.isObject() || document.isBoolean())) {
            throw new SchemaParseException("A JSON Schema document must be an object or a boolean");
        }
        return document;
    }
}
