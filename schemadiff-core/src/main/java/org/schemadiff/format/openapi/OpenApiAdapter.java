package org.schemadiff.format.openapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.schemadiff.exception.FormatSpecificException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.exception.SchemaParseException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.migration.RenderContext;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.rules.RuleTable;

/**
 * OpenAPI 3.x and Swagger 2.0 descriptions, in JSON or YAML.
 */
public class OpenApiAdapter implements FormatAdapter {

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final OpenApiNormalizer normalizer = new OpenApiNormalizer();
    private final RuleTable ruleTable = OpenApiRules.table();

    @Override
    public SchemaFormat format() {
        return SchemaFormat.OPENAPI;
    }

    @Override
    public void checkSyntax(String content) throws SchemaDiffException {
        readDocument(content);
    }

    @Override
    public SchemaNode normalize(Schema schema) throws SchemaDiffException {
        return normalizer.normalize(readDocument(schema.getContent()));
    }

    @Override
    public RuleTable ruleTable() {
        return ruleTable;
    }

    @Override
    public String render(MigrationInstruction instruction, RenderContext context) {
        return OpenApiRenderer.render(instruction);
    }

    private JsonNode readDocument(String content) throws SchemaDiffException {
        boolean json = content.stripLeading().startsWith("{");
        JsonNode document;
        try {
            document = (json ? jsonMapper : yamlMapper).readTree(content);
        } catch (JsonProcessingException e) {
            throw new FormatSpecificException(SchemaFormat.OPENAPI,
                    "Invalid " + (json ? "JSON" : "YAML") + ": " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new SchemaParseException("An OpenAPI document must be an object");
        }
        if (!document.has("openapi") && !document.has("swagger")) {
            throw new SchemaParseException("Missing 'openapi' or 'swagger' version field");
        }
        return document;
    }
}
