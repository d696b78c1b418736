package org.schemadiff.format.sql;

import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.rules.RuleTable;
import org.schemadiff.rules.TypeConversion;
import org.schemadiff.rules.TypeLattice;
import org.schemadiff.rules.Verdict;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compatibility of DDL changes against existing rows and existing queries.
 */
final class SqlRules {

    private static final Pattern TYPE = Pattern.compile("([A-Z][A-Z0-9_ ]*?)\\s*(?:\\((\\d+)\\s*(?:,\\s*(\\d+))?\\))?");

    private static final Map<String, Integer> INTEGER_RANKS = Map.ofEntries(
            Map.entry("TINYINT", 0),
            Map.entry("SMALLINT", 1),
            Map.entry("INT2", 1),
            Map.entry("MEDIUMINT", 2),
            Map.entry("INT", 3),
            Map.entry("INTEGER", 3),
            Map.entry("INT4", 3),
            Map.entry("SERIAL", 3),
            Map.entry("BIGINT", 4),
            Map.entry("INT8", 4),
            Map.entry("BIGSERIAL", 4)
    );

    private static final Map<String, Integer> FLOAT_RANKS = Map.of(
            "REAL", 0,
            "FLOAT4", 0,
            "FLOAT", 1,
            "FLOAT8", 1,
            "DOUBLE", 1,
            "DOUBLE PRECISION", 1
    );

    private static final List<String> CHARACTER = List.of("CHAR", "CHARACTER", "NCHAR", "VARCHAR", "CHARACTER VARYING", "NVARCHAR");
    private static final List<String> FIXED_CHARACTER = List.of("CHAR", "CHARACTER", "NCHAR");
    private static final List<String> UNBOUNDED_TEXT = List.of("TEXT", "CLOB");
    private static final List<String> DECIMAL = List.of("DECIMAL", "NUMERIC");

    private SqlRules() {
    }

    static RuleTable table() {
        return RuleTable.builder(SchemaFormat.SQL_DDL)
                .typeLattice(lattice())
                .override(ChangeKind.REMOVED, (change, ctx) -> {
                    if (change.getLocation().depth() != 2) {
                        return Optional.empty();
                    }
                    if (change.flag(Change.REQUIRED) || isKey(change.getOldNode())) {
                        return Optional.of(Verdict.breaking(
                                "Key or NOT NULL column dropped; queries and inserts that use it fail",
                                "Stop reading and writing the column before dropping it"));
                    }
                    return Optional.of(Verdict.warning(
                            "Nullable column dropped; its data is lost",
                            "Back up the column data and check queries that select it"));
                })
                .override(ChangeKind.ADDED, (change, ctx) -> change.flag(Change.REQUIRED) && hasDefault(change.getNewNode())
                        ? Optional.of(Verdict.info("NOT NULL column added with a DEFAULT; existing rows and inserts get the default"))
                        : Optional.empty())
                .override(ChangeKind.RENAMED, (change, ctx) -> {
                    String oldName = change.detail(Change.OLD_NAME).orElse("");
                    String newName = change.detail(Change.NEW_NAME).orElse("");
                    return oldName.equalsIgnoreCase(newName)
                            ? Optional.of(Verdict.info("Identifier case changed; unquoted identifiers are case-insensitive"))
                            : Optional.empty();
                })
                .override(ChangeKind.OTHER, (change, ctx) -> Optional.of(Verdict.warning(
                        "Column default or attribute changed; rows written by existing inserts differ",
                        "Review inserts that rely on the previous default")))
                .build();
    }

    private static boolean isKey(SchemaNode node) {
        return node != null && node.getMetadata().flag(SchemaFormat.SQL_DDL, SqlDdlNormalizer.PRIMARY_KEY);
    }

    private static boolean hasDefault(SchemaNode node) {
        return node instanceof ScalarNode scalar && scalar.getConstraints().containsKey(Constraint.DEFAULT_VALUE);
    }

    static TypeLattice lattice() {
        return (oldType, newType) -> {
            if (oldType == null || newType == null) return TypeConversion.INCOMPATIBLE;
            SqlType from = SqlType.parse(oldType);
            SqlType to = SqlType.parse(newType);
            if (from == null || to == null) return TypeConversion.INCOMPATIBLE;
            if (from.equals(to)) return TypeConversion.WIDENING;

            if (INTEGER_RANKS.containsKey(from.base()) && INTEGER_RANKS.containsKey(to.base())) {
                return rank(INTEGER_RANKS.get(from.base()), INTEGER_RANKS.get(to.base()));
            }
            if (FLOAT_RANKS.containsKey(from.base()) && FLOAT_RANKS.containsKey(to.base())) {
                return rank(FLOAT_RANKS.get(from.base()), FLOAT_RANKS.get(to.base()));
            }
            if (INTEGER_RANKS.containsKey(from.base()) && (FLOAT_RANKS.containsKey(to.base()) || isUnsizedDecimal(to))) {
                return TypeConversion.WIDENING;
            }
            if (INTEGER_RANKS.containsKey(to.base()) && (FLOAT_RANKS.containsKey(from.base()) || DECIMAL.contains(from.base()))) {
                return TypeConversion.NARROWING;
            }
            if (DECIMAL.contains(from.base()) && DECIMAL.contains(to.base())) {
                return decimal(from, to);
            }
            if (isText(from) && isText(to)) {
                return text(from, to);
            }
            return TypeConversion.INCOMPATIBLE;
        };
    }

    private static TypeConversion rank(int from, int to) {
        return to >= from ? TypeConversion.WIDENING : TypeConversion.NARROWING;
    }

    private static boolean isUnsizedDecimal(SqlType type) {
        return DECIMAL.contains(type.base()) && type.size() == null;
    }

    private static boolean isText(SqlType type) {
        return CHARACTER.contains(type.base()) || UNBOUNDED_TEXT.contains(type.base());
    }

    private static TypeConversion decimal(SqlType from, SqlType to) {
        if (to.size() == null) return TypeConversion.WIDENING;
        if (from.size() == null) return TypeConversion.NARROWING;
        int fromScale = from.scale() == null ? 0 : from.scale();
        int toScale = to.scale() == null ? 0 : to.scale();
        boolean integerDigitsKept = to.size() - toScale >= from.size() - fromScale;
        return integerDigitsKept && toScale >= fromScale ? TypeConversion.WIDENING : TypeConversion.NARROWING;
    }

    private static TypeConversion text(SqlType from, SqlType to) {
        Integer fromLength = length(from);
        Integer toLength = length(to);
        if (toLength == null) return TypeConversion.WIDENING;
        if (fromLength == null) return TypeConversion.NARROWING;
        return toLength >= fromLength ? TypeConversion.WIDENING : TypeConversion.NARROWING;
    }

    /**
     * null means unbounded. A bare CHAR holds one character.
     */
    private static Integer length(SqlType type) {
        if (UNBOUNDED_TEXT.contains(type.base())) {
            return null;
        }
        if (type.size() == null && FIXED_CHARACTER.contains(type.base())) {
            return 1;
        }
        return type.size();
    }

    record SqlType(String base, Integer size, Integer scale) {

        static SqlType parse(String typeName) {
            Matcher matcher = TYPE.matcher(typeName.trim().toUpperCase(Locale.ROOT));
            if (!matcher.matches()) {
                return null;
            }
            return new SqlType(matcher.group(1).trim(),
                    matcher.group(2) == null ? null : Integer.valueOf(matcher.group(2)),
                    matcher.group(3) == null ? null : Integer.valueOf(matcher.group(3)));
        }
    }
}
