package org.schemadiff.format.protobuf;

import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.rules.RuleContext;
import org.schemadiff.rules.RuleTable;
import org.schemadiff.rules.TypeConversion;
import org.schemadiff.rules.TypeLattice;
import org.schemadiff.rules.Verdict;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Protobuf compatibility is decided on the wire: field numbers matter, names mostly don't.
 */
final class ProtobufRules {

    /**
     * old type to the new types it can be read as without loss.
     */
    private static final Map<String, Set<String>> WIDENINGS = Map.of(
            "bool", Set.of("int32", "int64", "uint32", "uint64"),
            "int32", Set.of("int64"),
            "uint32", Set.of("uint64", "int64"),
            "sint32", Set.of("sint64"),
            "string", Set.of("bytes")
    );

    /**
     * Same wire type, values reinterpreted.
     */
    private static final Set<Set<String>> REINTERPRETATIONS = Set.of(
            Set.of("int32", "uint32"),
            Set.of("int64", "uint64"),
            Set.of("fixed32", "sfixed32"),
            Set.of("fixed64", "sfixed64")
    );

    private ProtobufRules() {
    }

    static TypeLattice lattice() {
        return (oldType, newType) -> {
            if (oldType == null || newType == null) return TypeConversion.INCOMPATIBLE;
            if (oldType.equals(newType)) return TypeConversion.WIDENING;
            if (WIDENINGS.getOrDefault(oldType, Set.of()).contains(newType)) return TypeConversion.WIDENING;
            if (WIDENINGS.getOrDefault(newType, Set.of()).contains(oldType)) return TypeConversion.NARROWING;
            if (REINTERPRETATIONS.contains(Set.of(oldType, newType))) return TypeConversion.NARROWING;
            return TypeConversion.INCOMPATIBLE;
        };
    }

    static RuleTable table() {
        return RuleTable.builder(SchemaFormat.PROTOBUF)
                .typeLattice(lattice())
                .deprecationAware(true)
                .override(ChangeKind.TYPE_CHANGED, (change, ctx) -> isIdentityReuse(change, ctx)
                        ? Optional.of(Verdict.breaking(
                        "Field number reused for a different field; old data is decoded as the new type",
                        "Reserve the old number and give the new field a fresh one"))
                        : Optional.empty())
                .override(ChangeKind.ADDED, ProtobufRules::addedOnReservedNumber)
                .override(ChangeKind.RENAMED, (change, ctx) -> change.detail(Change.IDENTITY).isPresent()
                        ? Optional.of(Verdict.warning(
                        "Field renamed; the binary encoding is unchanged but JSON and text formats use the new name",
                        "Set json_name to the old name if JSON clients exist"))
                        : Optional.empty())
                .override(ChangeKind.REMOVED, ProtobufRules::removed)
                .override(ChangeKind.REQUIREDNESS_CHANGED, (change, ctx) ->
                        change.detail(Change.REQUIRED_BEFORE).map(Boolean::parseBoolean).orElse(false)
                                ? Optional.of(Verdict.breaking(
                                "Required field became optional; old readers reject messages that omit it",
                                "Upgrade every reader before writers start omitting the field"))
                                : Optional.empty())
                .build();
    }

    private static boolean isIdentityReuse(Change change, RuleContext ctx) {
        return ctx.getChanges().stream()
                .anyMatch(c -> c.getKind() == ChangeKind.RENAMED && c.getLocation().equals(change.getLocation()));
    }

    private static Optional<Verdict> addedOnReservedNumber(Change change, RuleContext ctx) {
        SchemaPath location = change.getLocation();
        if (location.depth() != 2 || change.getNewNode() == null) {
            return Optional.empty();
        }
        String number = change.getNewNode().getMetadata().getIdentity();
        Optional<SchemaNode> oldMessage = ctx.resolveOld(location.parent());
        if (number == null || oldMessage.isEmpty()) {
            return Optional.empty();
        }
        if (isReservedNumber(oldMessage.get(), Integer.parseInt(number))) {
            return Optional.of(Verdict.breaking(
                    "Field uses number " + number + ", which was reserved",
                    "Pick a number that was never used in this message"));
        }
        return Optional.empty();
    }

    private static Optional<Verdict> removed(Change change, RuleContext ctx) {
        SchemaPath location = change.getLocation();
        SchemaNode oldNode = change.getOldNode();
        if (location.depth() != 2 || oldNode == null || !oldNode.getMetadata().hasIdentity()) {
            return Optional.empty();
        }
        Optional<SchemaNode> newMessage = ctx.resolveNew(location.parent());
        if (newMessage.isPresent() && (isReservedNumber(newMessage.get(), Integer.parseInt(oldNode.getMetadata().getIdentity()))
                || isReservedName(newMessage.get(), location.leaf()))) {
            return Optional.of(Verdict.warning(
                    "Field removed and its number reserved",
                    "Confirm that no consumer still reads the field"));
        }
        if (oldNode.getMetadata().flag(SchemaFormat.PROTOBUF, NodeMetadata.DEPRECATED)) {
            return Optional.empty();
        }
        return Optional.of(Verdict.breaking(
                "Field removed; its number may later be reused with a different meaning",
                "Reserve the number (and name) of the removed field"));
    }

    static boolean isReservedNumber(SchemaNode message, int number) {
        return message.getMetadata().attribute(SchemaFormat.PROTOBUF, ProtoNormalizer.RESERVED_NUMBERS)
                .map(ranges -> Arrays.stream(ranges.split(",")).anyMatch(range -> inRange(range.trim(), number)))
                .orElse(false);
    }

    static boolean isReservedName(SchemaNode message, String name) {
        return message.getMetadata().attribute(SchemaFormat.PROTOBUF, ProtoNormalizer.RESERVED_NAMES)
                .map(names -> Arrays.asList(names.split(",")).contains(name))
                .orElse(false);
    }

    private static boolean inRange(String range, int number) {
        int dash = range.indexOf('-');
        if (dash < 0) {
            return Integer.parseInt(range) == number;
        }
        return number >= Integer.parseInt(range.substring(0, dash)) && number <= Integer.parseInt(range.substring(dash + 1));
    }
}
