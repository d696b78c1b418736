package org.schemadiff.format.sql;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.table.ColDataType;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.Index;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.PrimitiveKind;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tables become root members, columns become scalar members of their table.
 * Identifiers are case-insensitive, so the lower-cased name is the identity key.
 */
@Slf4j
final class SqlDdlNormalizer {

    static final String PRIMARY_KEY = "primary-key";
    static final String UNIQUE = "unique";
    static final String AUTO_INCREMENT = "auto-increment";

    private static final SchemaFormat FORMAT = SchemaFormat.SQL_DDL;

    private static final Map<String, PrimitiveKind> PRIMITIVES = Map.ofEntries(
            Map.entry("TINYINT", PrimitiveKind.INTEGER),
            Map.entry("SMALLINT", PrimitiveKind.INTEGER),
            Map.entry("MEDIUMINT", PrimitiveKind.INTEGER),
            Map.entry("INT", PrimitiveKind.INTEGER),
            Map.entry("INTEGER", PrimitiveKind.INTEGER),
            Map.entry("BIGINT", PrimitiveKind.INTEGER),
            Map.entry("INT2", PrimitiveKind.INTEGER),
            Map.entry("INT4", PrimitiveKind.INTEGER),
            Map.entry("INT8", PrimitiveKind.INTEGER),
            Map.entry("SERIAL", PrimitiveKind.INTEGER),
            Map.entry("BIGSERIAL", PrimitiveKind.INTEGER),
            Map.entry("DECIMAL", PrimitiveKind.NUMBER),
            Map.entry("NUMERIC", PrimitiveKind.NUMBER),
            Map.entry("REAL", PrimitiveKind.NUMBER),
            Map.entry("FLOAT", PrimitiveKind.NUMBER),
            Map.entry("FLOAT4", PrimitiveKind.NUMBER),
            Map.entry("FLOAT8", PrimitiveKind.NUMBER),
            Map.entry("DOUBLE", PrimitiveKind.NUMBER),
            Map.entry("DOUBLE PRECISION", PrimitiveKind.NUMBER),
            Map.entry("CHAR", PrimitiveKind.STRING),
            Map.entry("CHARACTER", PrimitiveKind.STRING),
            Map.entry("VARCHAR", PrimitiveKind.STRING),
            Map.entry("CHARACTER VARYING", PrimitiveKind.STRING),
            Map.entry("NCHAR", PrimitiveKind.STRING),
            Map.entry("NVARCHAR", PrimitiveKind.STRING),
            Map.entry("TEXT", PrimitiveKind.STRING),
            Map.entry("CLOB", PrimitiveKind.STRING),
            Map.entry("UUID", PrimitiveKind.STRING),
            Map.entry("DATE", PrimitiveKind.STRING),
            Map.entry("TIME", PrimitiveKind.STRING),
            Map.entry("TIMESTAMP", PrimitiveKind.STRING),
            Map.entry("DATETIME", PrimitiveKind.STRING),
            Map.entry("BOOLEAN", PrimitiveKind.BOOLEAN),
            Map.entry("BOOL", PrimitiveKind.BOOLEAN),
            Map.entry("BIT", PrimitiveKind.BOOLEAN),
            Map.entry("BLOB", PrimitiveKind.BYTES),
            Map.entry("BYTEA", PrimitiveKind.BYTES),
            Map.entry("BINARY", PrimitiveKind.BYTES),
            Map.entry("VARBINARY", PrimitiveKind.BYTES),
            Map.entry("JSON", PrimitiveKind.ANY),
            Map.entry("JSONB", PrimitiveKind.ANY)
    );

    SchemaNode normalize(List<Statement> statements) {
        ObjectNode.ObjectNodeBuilder root = ObjectNode.builder();
        Set<String> seen = new HashSet<>();
        for (Statement statement : statements) {
            if (!(statement instanceof CreateTable createTable)) {
                log.debug("Skipping non CREATE TABLE statement: {}", statement.getClass().getSimpleName());
                continue;
            }
            String name = unquote(createTable.getTable().getFullyQualifiedName());
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                log.warn("Table {} is defined more than once; keeping the first definition", name);
                continue;
            }
            root.field(name, table(createTable));
        }
        return root.build();
    }

    private ObjectNode table(CreateTable createTable) {
        Set<String> primaryKey = new HashSet<>();
        Set<String> unique = new HashSet<>();
        if (createTable.getIndexes() != null) {
            for (Index index : createTable.getIndexes()) {
                String type = index.getType() == null ? "" : index.getType().toUpperCase(Locale.ROOT);
                List<String> columns = index.getColumnsNames();
                if (type.contains("PRIMARY")) {
                    columns.forEach(c -> primaryKey.add(unquote(c).toLowerCase(Locale.ROOT)));
                } else if (type.contains("UNIQUE") && columns.size() == 1) {
                    unique.add(unquote(columns.get(0)).toLowerCase(Locale.ROOT));
                }
            }
        }

        ObjectNode.ObjectNodeBuilder table = ObjectNode.builder();
        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition column : createTable.getColumnDefinitions()) {
                String name = unquote(column.getColumnName());
                String key = name.toLowerCase(Locale.ROOT);
                ColumnSpec spec = ColumnSpec.parse(column.getColumnSpecs());
                boolean pk = spec.primaryKey() || primaryKey.contains(key);
                boolean notNull = spec.notNull() || pk;

                // NOT NULL은 requiredness로 표현되므로 metadata에 중복해 두지 않는다
                NodeMetadata metadata = NodeMetadata.identity(key);
                if (pk) {
                    metadata = metadata.with(FORMAT, PRIMARY_KEY, "true");
                }
                if (spec.unique() || unique.contains(key)) {
                    metadata = metadata.with(FORMAT, UNIQUE, "true");
                }
                if (spec.autoIncrement()) {
                    metadata = metadata.with(FORMAT, AUTO_INCREMENT, "true");
                }

                ScalarNode.ScalarNodeBuilder node = ScalarNode.builder()
                        .primitive(primitiveOf(column.getColDataType()))
                        .typeName(typeName(column.getColDataType()))
                        .metadata(metadata);
                if (spec.defaultValue() != null) {
                    node.constraint(Constraint.DEFAULT_VALUE, spec.defaultValue());
                }
                table.field(name, node.build());
                if (notNull) {
                    table.requiredField(name);
                }
            }
        }
        String tableName = unquote(createTable.getTable().getFullyQualifiedName());
        return table.metadata(NodeMetadata.identity(tableName.toLowerCase(Locale.ROOT))).build();
    }

    static String typeName(ColDataType type) {
        String base = type.getDataType().toUpperCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        List<String> arguments = type.getArgumentsStringList();
        if (arguments == null || arguments.isEmpty()) {
            return base;
        }
        return base + "(" + String.join(",", arguments.stream().map(String::trim).toList()) + ")";
    }

    private static PrimitiveKind primitiveOf(ColDataType type) {
        String base = type.getDataType().toUpperCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        return PRIMITIVES.getOrDefault(base, PrimitiveKind.ANY);
    }

    static String unquote(String identifier) {
        if (identifier == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : identifier.toCharArray()) {
            if (c != '"' && c != '`' && c != '[' && c != ']') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Column options as JSqlParser leaves them: a flat list of words.
     */
    record ColumnSpec(boolean notNull, boolean primaryKey, boolean unique, boolean autoIncrement, String defaultValue) {

        static ColumnSpec parse(List<String> specs) {
            if (specs == null) {
                return new ColumnSpec(false, false, false, false, null);
            }
            boolean notNull = false;
            boolean primaryKey = false;
            boolean unique = false;
            boolean autoIncrement = false;
            String defaultValue = null;
            for (int i = 0; i < specs.size(); i++) {
                String word = specs.get(i).toUpperCase(Locale.ROOT);
                String next = i + 1 < specs.size() ? specs.get(i + 1).toUpperCase(Locale.ROOT) : "";
                switch (word) {
                    case "NOT" -> {
                        if ("NULL".equals(next)) {
                            notNull = true;
                            i++;
                        }
                    }
                    case "PRIMARY" -> {
                        if ("KEY".equals(next)) {
                            primaryKey = true;
                            i++;
                        }
                    }
                    case "UNIQUE" -> unique = true;
                    case "AUTO_INCREMENT", "AUTOINCREMENT", "IDENTITY" -> autoIncrement = true;
                    case "DEFAULT" -> {
                        if (i + 1 < specs.size()) {
                            defaultValue = specs.get(++i);
                        }
                    }
                    default -> {
                        // CHECK, REFERENCES, COLLATE 등은 비교 대상이 아님
                    }
                }
            }
            return new ColumnSpec(notNull, primaryKey, unique, autoIncrement, defaultValue);
        }
    }
}
