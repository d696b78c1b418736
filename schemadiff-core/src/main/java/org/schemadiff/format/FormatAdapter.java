package org.schemadiff.format;

import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.migration.RenderContext;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.rules.RuleTable;

/**
 * Everything the analyzer needs to know about one schema format.
 */
public interface FormatAdapter {

    SchemaFormat format();

    /**
     * Fails when {@code content} is not a syntactically valid document of this format.
     */
    void checkSyntax(String content) throws SchemaDiffException;

    /**
     * Parses the schema and maps it onto the normalized node model.
     */
    SchemaNode normalize(Schema schema) throws SchemaDiffException;

    RuleTable ruleTable();

    /**
     * Renders one migration step in this format's own vocabulary. Must not return blank text.
     */
    String render(MigrationInstruction instruction, RenderContext context);
}
