package org.schemadiff.format.sql;

import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.model.Change;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders steps as DDL statements (PostgreSQL flavoured {@code ALTER TABLE}).
 */
final class SqlRenderer {

    private SqlRenderer() {
    }

    static String render(MigrationInstruction instruction) {
        SchemaPath path = instruction.getEffectiveLocation();
        if (path.depth() == 1) {
            return renderTable(instruction, path.leaf());
        }
        if (path.depth() != 2) {
            return "-- " + instruction.getChange().getDescription();
        }

        String table = path.segments().get(0);
        String column = path.leaf();
        String alter = "ALTER TABLE " + table + " ";
        Change change = instruction.getChange();
        return switch (instruction.getOperation()) {
            case ADD -> alter + "ADD COLUMN " + columnDefinition(column, instruction.getNewNode(), change.flag(Change.REQUIRED)) + ";";
            case DROP -> alter + "DROP COLUMN " + column + ";";
            case RENAME -> alter + "RENAME COLUMN " + instruction.getLocation().leaf() + " TO " + column + ";";
            case ALTER_TYPE -> alter + "ALTER COLUMN " + column + " TYPE " + change.detail(Change.NEW_TYPE).orElse("?") + ";";
            case MAKE_REQUIRED -> alter + "ALTER COLUMN " + column + " SET NOT NULL;";
            case MAKE_OPTIONAL -> alter + "ALTER COLUMN " + column + " DROP NOT NULL;";
            case UPDATE -> updateColumn(alter, column, instruction);
            case TIGHTEN, LOOSEN -> "-- " + table + "." + column + ": " + change.getDescription();
        };
    }

    private static String renderTable(MigrationInstruction instruction, String table) {
        return switch (instruction.getOperation()) {
            case ADD -> createTable(table, instruction.getNewNode());
            case DROP -> "DROP TABLE " + table + ";";
            case RENAME -> "ALTER TABLE " + instruction.getLocation().leaf() + " RENAME TO " + table + ";";
            case ALTER_TYPE, TIGHTEN, LOOSEN, UPDATE, MAKE_REQUIRED, MAKE_OPTIONAL ->
                    "-- " + table + ": " + instruction.getChange().getDescription();
        };
    }

    private static String updateColumn(String alter, String column, MigrationInstruction instruction) {
        Object before = defaultOf(instruction.getOldNode());
        Object after = defaultOf(instruction.getNewNode());
        if (after != null && !after.equals(before)) {
            return alter + "ALTER COLUMN " + column + " SET DEFAULT " + after + ";";
        }
        if (after == null && before != null) {
            return alter + "ALTER COLUMN " + column + " DROP DEFAULT;";
        }
        return "-- " + column + ": " + instruction.getChange().getDescription();
    }

    private static Object defaultOf(SchemaNode node) {
        return node instanceof ScalarNode scalar ? scalar.getConstraints().get(Constraint.DEFAULT_VALUE) : null;
    }

    static String createTable(String table, SchemaNode node) {
        if (!(node instanceof ObjectNode object)) {
            return "CREATE TABLE " + table + " ();";
        }
        List<String> columns = new ArrayList<>();
        List<String> primaryKey = new ArrayList<>();
        for (Map.Entry<String, SchemaNode> entry : object.getFields().entrySet()) {
            columns.add("    " + columnDefinition(entry.getKey(), entry.getValue(), object.isRequired(entry.getKey())));
            if (entry.getValue().getMetadata().flag(SchemaFormat.SQL_DDL, SqlDdlNormalizer.PRIMARY_KEY)) {
                primaryKey.add(entry.getKey());
            }
        }
        if (!primaryKey.isEmpty()) {
            columns.add("    PRIMARY KEY (" + String.join(", ", primaryKey) + ")");
        }
        return "CREATE TABLE " + table + " (\n" + String.join(",\n", columns) + "\n);";
    }

    static String columnDefinition(String column, SchemaNode node, boolean required) {
        StringBuilder sb = new StringBuilder(column);
        if (node instanceof ScalarNode scalar) {
            sb.append(' ').append(scalar.getTypeName());
            boolean key = node.getMetadata().flag(SchemaFormat.SQL_DDL, SqlDdlNormalizer.PRIMARY_KEY);
            if (required && !key) {
                sb.append(" NOT NULL");
            }
            Object defaultValue = scalar.getConstraints().get(Constraint.DEFAULT_VALUE);
            if (defaultValue != null) {
                sb.append(" DEFAULT ").append(defaultValue);
            }
            if (node.getMetadata().flag(SchemaFormat.SQL_DDL, SqlDdlNormalizer.UNIQUE)) {
                sb.append(" UNIQUE");
            }
        }
        return sb.toString();
    }
}
