package org.schemadiff.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Side channel carried by every node.
 * <p>
 * {@code identity} is a stable key that survives renames (protobuf field numbers,
 * case-folded SQL identifiers). {@code attributes} is opaque to the diff engine and
 * keyed by the format that produced it; only that format's rules read it.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class NodeMetadata {

    public static final String DEPRECATED = "deprecated";

    private static final NodeMetadata EMPTY = new NodeMetadata(null, Collections.emptyMap());

    private final String identity;
    private final Map<SchemaFormat, Map<String, String>> attributes;

    public static NodeMetadata empty() {
        return EMPTY;
    }

    public static NodeMetadata identity(String identity) {
        return EMPTY.withIdentity(identity);
    }

    public NodeMetadata withIdentity(String identity) {
        return new NodeMetadata(identity, attributes);
    }

    public NodeMetadata with(SchemaFormat format, String key, String value) {
        Map<SchemaFormat, Map<String, String>> copy = new EnumMap<>(SchemaFormat.class);
        attributes.forEach((f, m) -> copy.put(f, new TreeMap<>(m)));
        copy.computeIfAbsent(format, f -> new TreeMap<>()).put(key, value);
        copy.replaceAll((f, m) -> Collections.unmodifiableMap(m));
        return new NodeMetadata(identity, Collections.unmodifiableMap(copy));
    }

    public Optional<String> attribute(SchemaFormat format, String key) {
        return Optional.ofNullable(attributes.getOrDefault(format, Map.of()).get(key));
    }

    public boolean flag(SchemaFormat format, String key) {
        return attribute(format, key).map(Boolean::parseBoolean).orElse(false);
    }

    public Map<String, String> attributes(SchemaFormat format) {
        return attributes.getOrDefault(format, Map.of());
    }

    public boolean hasIdentity() {
        return identity != null;
    }

    public boolean isEmpty() {
        return identity == null && attributes.isEmpty();
    }

    @Override
    public String toString() {
        return isEmpty() ? "{}" : "{identity=" + identity + ", attributes=" + attributes + "}";
    }
}
