package org.schemadiff.format.jsonschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.migration.MigrationOperation;
import org.schemadiff.migration.MigrationPhase;
import org.schemadiff.migration.RenderContext;
import org.schemadiff.model.Change;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Renders migration steps as RFC 6902 JSON Patch operations against the old document.
 *
 * <p>Applying the rendered steps in plan order to the old document yields a document
 * equivalent to the new one. Pointers and values are taken from the source documents
 * when the context carries them, so keyword spelling ({@code oneOf} or a {@code type}
 * array, {@code const} or {@code enum}) and JSON value types survive. Without them the
 * renderer falls back to the normalized trees.
 */
final class JsonPatchRenderer {

    static final String DEFS_SEPARATOR = ":";

    private static final List<String> UNION_KEYWORDS = List.of("oneOf", "anyOf", "allOf");
    private static final Set<String> STRUCTURAL_KEYWORDS = Set.of(
            "type", "properties", "required", "items", "oneOf", "anyOf", "allOf", "$ref", "$defs", "definitions");
    private static final Map<String, List<String>> KEYWORD_ALIASES = Map.of(
            "enum", List.of("enum", "const"),
            "minimum", List.of("minimum", "exclusiveMinimum"),
            "exclusiveMinimum", List.of("exclusiveMinimum", "minimum"),
            "maximum", List.of("maximum", "exclusiveMaximum"),
            "exclusiveMaximum", List.of("exclusiveMaximum", "maximum"));

    private final ObjectMapper mapper;

    JsonPatchRenderer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String render(MigrationInstruction instruction, RenderContext context) {
        JsonNode oldDocument = parse(context.getOldContent());
        JsonNode newDocument = parse(context.getNewContent());
        SchemaPath path = instruction.getEffectiveLocation();
        JsonNode document = instruction.getPhase() == MigrationPhase.DROP ? oldDocument : newDocument;
        String pointer = pointer(path, document);
        List<Map<String, Object>> ops = new ArrayList<>();

        if (isAlternative(path) && isStructural(instruction.getOperation())) {
            alternative(instruction, oldDocument, newDocument, ops);
        } else {
            switch (instruction.getOperation()) {
                case ADD -> {
                    ops.add(op("add", pointer, newValue(newDocument, pointer, instruction.getNewNode())));
                    required(instruction, context, oldDocument, newDocument, ops);
                }
                case DROP -> {
                    ops.add(op("remove", pointer, null));
                    required(instruction, context, oldDocument, newDocument, ops);
                }
                case RENAME -> {
                    Map<String, Object> move = new LinkedHashMap<>();
                    move.put("op", "move");
                    move.put("from", pointer(instruction.getTargetLocation().parent()
                            .child(instruction.getLocation().leaf()), newDocument));
                    move.put("path", pointer);
                    ops.add(move);
                    required(instruction, context, oldDocument, newDocument, ops);
                }
                case ALTER_TYPE -> ops.add(op("replace", pointer, newValue(newDocument, pointer, instruction.getNewNode())));
                case TIGHTEN, LOOSEN, UPDATE -> keywords(instruction, context, oldDocument, newDocument, ops);
                case MAKE_REQUIRED, MAKE_OPTIONAL -> required(instruction, context, oldDocument, newDocument, ops);
            }
        }

        try {
            return mapper.writeValueAsString(ops);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize JSON Patch for " + path, e);
        }
    }

    private JsonNode parse(String content) {
        if (content == null || content.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            JsonNode node = mapper.readTree(content);
            return node == null ? MissingNode.getInstance() : node;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Schema document no longer parses", e);
        }
    }

    private static boolean isStructural(MigrationOperation operation) {
        return operation == MigrationOperation.ADD
                || operation == MigrationOperation.DROP
                || operation == MigrationOperation.ALTER_TYPE;
    }

    /**
     * An alternative appeared, disappeared or changed type. Array indexes shift as
     * alternatives come and go, so the whole union keyword is rewritten with its new value.
     */
    private static void alternative(MigrationInstruction instruction, JsonNode oldDocument, JsonNode newDocument,
                                    List<Map<String, Object>> ops) {
        SchemaPath oldParent = instruction.getLocation().parent();
        SchemaPath newParent = instruction.getTargetLocation().parent();
        JsonNode document = instruction.getPhase() == MigrationPhase.DROP ? oldDocument : newDocument;
        String parentPointer = pointer(instruction.getPhase() == MigrationPhase.DROP ? oldParent : newParent, document);
        JsonNode before = oldDocument.at(pointer(oldParent, oldDocument));
        JsonNode after = newDocument.at(pointer(newParent, newDocument));

        if (after.isMissingNode()) {
            String pointer = pointer(instruction.getEffectiveLocation());
            if (instruction.getOperation() == MigrationOperation.DROP) {
                ops.add(op("remove", pointer, null));
            } else {
                ops.add(op(instruction.getOperation() == MigrationOperation.ADD ? "add" : "replace",
                        pointer, JsonSchemaWriter.write(instruction.getNewNode())));
            }
            return;
        }

        String keyword = unionKeyword(after);
        if (keyword != null && before.has(keyword)
                && ("type".equals(keyword) || Objects.equals(keyword, unionKeyword(before)))) {
            ops.add(op("replace", parentPointer + "/" + keyword, after.get(keyword)));
        } else {
            // 합집합 표현 방식이 바뀌었으면 부모 스키마를 통째로 바꾼다
            ops.add(op(before.isMissingNode() ? "add" : "replace", parentPointer, after));
        }
    }

    private static String unionKeyword(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        for (String keyword : UNION_KEYWORDS) {
            if (node.has(keyword)) {
                return keyword;
            }
        }
        return node.path("type").isArray() ? "type" : null;
    }

    private static Object newValue(JsonNode newDocument, String pointer, SchemaNode node) {
        JsonNode fragment = newDocument.at(pointer);
        return fragment.isMissingNode() ? JsonSchemaWriter.write(node) : fragment;
    }

    /**
     * Constraint and annotation changes touch single keywords, leaving the rest of the
     * schema object to the steps that own it.
     */
    private static void keywords(MigrationInstruction instruction, RenderContext context, JsonNode oldDocument,
                                 JsonNode newDocument, List<Map<String, Object>> ops) {
        String pointer = pointer(instruction.getTargetLocation(), newDocument);
        JsonNode before = oldDocument.at(pointer(instruction.getLocation(), oldDocument));
        JsonNode after = newDocument.at(pointer);
        if (!before.isObject() || !after.isObject()) {
            ops.add(op("replace", pointer, newValue(newDocument, pointer, instruction.getNewNode())));
            return;
        }

        for (String keyword : keywordsOf(instruction, context, before, after)) {
            JsonNode was = before.get(keyword);
            JsonNode now = after.get(keyword);
            if (Objects.equals(was, now)) {
                continue;
            }
            String target = pointer + "/" + escape(keyword);
            if (now == null) {
                ops.add(op("remove", target, null));
            } else {
                ops.add(op(was == null ? "add" : "replace", target, now));
            }
        }
        if (ops.isEmpty()) {
            ops.add(op("replace", pointer, after));
        }
    }

    private static Set<String> keywordsOf(MigrationInstruction instruction, RenderContext context,
                                          JsonNode before, JsonNode after) {
        Set<String> keywords = new LinkedHashSet<>();
        MigrationOperation operation = instruction.getOperation();
        if (operation == MigrationOperation.UPDATE) {
            before.fieldNames().forEachRemaining(keywords::add);
            after.fieldNames().forEachRemaining(keywords::add);
            keywords.removeAll(STRUCTURAL_KEYWORDS);
            keywords.removeAll(claimedBy(MigrationOperation.TIGHTEN, instruction, context));
            keywords.removeAll(claimedBy(MigrationOperation.LOOSEN, instruction, context));
            return keywords;
        }
        keywords.addAll(constraintKeywords(instruction));
        if (operation == MigrationOperation.LOOSEN) {
            keywords.removeAll(claimedBy(MigrationOperation.TIGHTEN, instruction, context));
        }
        return keywords;
    }

    private static Set<String> claimedBy(MigrationOperation operation, MigrationInstruction current, RenderContext context) {
        Set<String> claimed = new LinkedHashSet<>();
        for (MigrationInstruction step : context.getInstructions()) {
            if (step != current && step.getOperation() == operation
                    && step.getEffectiveLocation().equals(current.getEffectiveLocation())) {
                claimed.addAll(constraintKeywords(step));
            }
        }
        return claimed;
    }

    private static Set<String> constraintKeywords(MigrationInstruction instruction) {
        Set<String> keywords = new LinkedHashSet<>();
        instruction.getChange().detail(Change.CONSTRAINTS).ifPresent(names -> {
            for (String name : names.split(",")) {
                String key = name.trim();
                if (!key.isEmpty()) {
                    keywords.addAll(KEYWORD_ALIASES.getOrDefault(key, List.of(key)));
                }
            }
        });
        return keywords;
    }

    /**
     * Replays the plan up to {@code current} over the container's {@code required} array and
     * emits the array as it stands after this step, if the step changed it.
     */
    private static void required(MigrationInstruction current, RenderContext context, JsonNode oldDocument,
                                 JsonNode newDocument, List<Map<String, Object>> ops) {
        SchemaPath member = current.getEffectiveLocation();
        if (member.segments().isEmpty() || isAlternative(member) || SchemaPath.ELEMENT.equals(member.leaf())) {
            return;
        }
        SchemaPath container = member.parent();
        SchemaPath oldContainer = current.getLocation().parent();

        JsonNode initial = oldDocument.at(pointer(oldContainer, oldDocument)).get("required");
        List<String> names = new ArrayList<>();
        boolean exists;
        if (initial != null && initial.isArray()) {
            initial.forEach(name -> names.add(name.asText()));
            exists = true;
        } else if (oldDocument.isMissingNode()) {
            names.addAll(requiredOf(context.getOldRoot(), oldContainer));
            exists = !names.isEmpty();
        } else {
            exists = false;
        }

        List<MigrationInstruction> plan = context.getInstructions().contains(current)
                ? context.getInstructions()
                : List.of(current);
        for (MigrationInstruction step : plan) {
            boolean sameContainer = step.getEffectiveLocation().parent().equals(container)
                    || step.getLocation().parent().equals(oldContainer);
            boolean changed = sameContainer && apply(step, names);
            if (step == current) {
                if (changed) {
                    JsonNode document = current.getPhase() == MigrationPhase.DROP ? oldDocument : newDocument;
                    String pointer = pointer(container, document) + "/required";
                    if (!names.isEmpty()) {
                        ops.add(op(exists ? "replace" : "add", pointer, List.copyOf(names)));
                    } else if (exists) {
                        ops.add(op("remove", pointer, null));
                    }
                }
                return;
            }
            if (changed) {
                exists = !names.isEmpty();
            }
        }
    }

    private static boolean apply(MigrationInstruction step, List<String> names) {
        SchemaPath location = step.getEffectiveLocation();
        if (location.segments().isEmpty() || isAlternative(location)) {
            return false;
        }
        String target = step.getTargetLocation().leaf();
        switch (step.getOperation()) {
            case DROP, MAKE_OPTIONAL -> {
                return names.remove(location.leaf());
            }
            case RENAME -> {
                int index = names.indexOf(step.getLocation().leaf());
                if (index < 0) {
                    return false;
                }
                names.set(index, target);
                return true;
            }
            case ADD -> {
                return step.getChange().flag(Change.REQUIRED) && addAbsent(names, target);
            }
            case MAKE_REQUIRED -> {
                return addAbsent(names, target);
            }
            default -> {
                return false;
            }
        }
    }

    private static boolean addAbsent(List<String> names, String name) {
        if (names.contains(name)) {
            return false;
        }
        names.add(name);
        return true;
    }

    private static Map<String, Object> op(String name, String path, Object value) {
        Map<String, Object> op = new LinkedHashMap<>();
        op.put("op", name);
        op.put("path", path);
        if (value != null) {
            op.put("value", value);
        }
        return op;
    }

    private static List<String> requiredOf(SchemaNode root, SchemaPath container) {
        Optional<SchemaNode> node = resolve(root, container);
        return node.filter(ObjectNode.class::isInstance)
                .map(n -> List.copyOf(((ObjectNode) n).getRequiredFields()))
                .orElse(List.of());
    }

    private static Optional<SchemaNode> resolve(SchemaNode root, SchemaPath path) {
        SchemaNode current = root;
        for (String segment : path.segments()) {
            if (!(current instanceof ObjectNode object)) {
                return Optional.empty();
            }
            current = object.getFields().get(segment);
        }
        return Optional.ofNullable(current);
    }

    private static boolean isAlternative(SchemaPath path) {
        return !path.segments().isEmpty() && path.leaf().startsWith(SchemaPath.ALTERNATIVE_PREFIX);
    }

    /**
     * Maps a normalized path back to a JSON Pointer, addressing alternatives as {@code oneOf} entries.
     */
    static String pointer(SchemaPath path) {
        return pointer(path, MissingNode.getInstance());
    }

    /**
     * Maps a normalized path back to a JSON Pointer into {@code document}, following the
     * keyword each union actually uses there. Alternatives of a {@code type} array share
     * their schema object, so they address it directly.
     */
    static String pointer(SchemaPath path, JsonNode document) {
        StringBuilder sb = new StringBuilder();
        JsonNode node = document;
        List<String> segments = path.segments();
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (i == 0 && segment.contains(DEFS_SEPARATOR) && (segment.startsWith("$defs") || segment.startsWith("definitions"))) {
                int split = segment.indexOf(DEFS_SEPARATOR);
                String keyword = segment.substring(0, split);
                String name = segment.substring(split + 1);
                sb.append('/').append(keyword).append('/').append(escape(name));
                node = node.path(keyword).path(name);
            } else if (SchemaPath.ELEMENT.equals(segment)) {
                sb.append("/items");
                node = node.path("items");
            } else if (segment.startsWith(SchemaPath.ALTERNATIVE_PREFIX)) {
                int index = Integer.parseInt(segment.substring(SchemaPath.ALTERNATIVE_PREFIX.length()));
                String keyword = unionKeyword(node);
                if (node.isArray()) {
                    sb.append('/').append(index);
                    node = node.path(index);
                } else if (!"type".equals(keyword)) {
                    String union = keyword == null ? "oneOf" : keyword;
                    sb.append('/').append(union).append('/').append(index);
                    node = node.path(union).path(index);
                }
            } else {
                sb.append("/properties/").append(escape(segment));
                node = node.path("properties").path(segment);
            }
        }
        return sb.toString();
    }

    private static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }
}
