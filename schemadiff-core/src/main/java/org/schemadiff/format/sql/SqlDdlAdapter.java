package org.schemadiff.format.sql;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.UnsupportedStatement;
import org.schemadiff.exception.FormatSpecificException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.migration.RenderContext;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.rules.RuleTable;

import java.util.List;

/**
 * SQL DDL scripts. Only {@code CREATE TABLE} statements contribute to the schema;
 * other statements must parse but are otherwise ignored.
 */
@Slf4j
public class SqlDdlAdapter implements FormatAdapter {

    private final SqlDdlNormalizer normalizer = new SqlDdlNormalizer();
    private final RuleTable ruleTable = SqlRules.table();

    @Override
    public SchemaFormat format() {
        return SchemaFormat.SQL_DDL;
    }

    @Override
    public void checkSyntax(String content) throws SchemaDiffException {
        parse(content);
    }

    @Override
    public SchemaNode normalize(Schema schema) throws SchemaDiffException {
        List<Statement> statements = parse(schema.getContent());
        log.debug("Parsed {} SQL statement(s)", statements.size());
        return normalizer.normalize(statements);
    }

    @Override
    public RuleTable ruleTable() {
        return ruleTable;
    }

    @Override
    public String render(MigrationInstruction instruction, RenderContext context) {
        return SqlRenderer.render(instruction);
    }

    private List<Statement> parse(String content) throws SchemaDiffException {
        List<Statement> statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(content).getStatements();
        } catch (JSQLParserException e) {
            throw new FormatSpecificException(SchemaFormat.SQL_DDL, "Invalid SQL: " + rootMessage(e), e);
        }
        // 파서가 복구한 문장은 UnsupportedStatement로 남으므로 문법 오류로 취급
        for (Statement statement : statements) {
            if (statement instanceof UnsupportedStatement) {
                throw new FormatSpecificException(SchemaFormat.SQL_DDL,
                        "Invalid SQL: unparseable statement '" + firstLine(statement.toString()) + "'", null);
            }
        }
        return statements;
    }

    private static String firstLine(String text) {
        return text.strip().lines().findFirst().orElse("");
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message.lines().findFirst().orElse(message);
    }
}
