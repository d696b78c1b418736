package org.schemadiff.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Location of a node inside a normalized schema tree, e.g. {@code /users/email}
 * or {@code /User/tags/[]}. Segments containing {@code /} or {@code ~} are escaped
 * the way JSON Pointer does it.
 */
public record SchemaPath(List<String> segments) implements Comparable<SchemaPath> {

    public static final String ELEMENT = "[]";
    public static final String ALTERNATIVE_PREFIX = "|";

    private static final SchemaPath ROOT = new SchemaPath(List.of());

    public SchemaPath {
        segments = List.copyOf(Objects.requireNonNull(segments, "segments must not be null"));
    }

    public static SchemaPath root() {
        return ROOT;
    }

    public static SchemaPath of(String... segments) {
        return new SchemaPath(Arrays.asList(segments));
    }

    @JsonCreator
    public static SchemaPath parse(String text) {
        if (text == null || text.isEmpty() || "/".equals(text)) {
            return ROOT;
        }
        String body = text.startsWith("/") ? text.substring(1) : text;
        List<String> parts = new ArrayList<>();
        for (String raw : body.split("/", -1)) {
            parts.add(raw.replace("~1", "/").replace("~0", "~"));
        }
        return new SchemaPath(parts);
    }

    public SchemaPath child(String name) {
        List<String> next = new ArrayList<>(segments);
        next.add(Objects.requireNonNull(name, "name must not be null"));
        return new SchemaPath(next);
    }

    public SchemaPath element() {
        return child(ELEMENT);
    }

    public SchemaPath alternative(int index) {
        return child(ALTERNATIVE_PREFIX + index);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public String leaf() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public SchemaPath parent() {
        if (segments.isEmpty()) {
            return this;
        }
        return new SchemaPath(segments.subList(0, segments.size() - 1));
    }

    /**
     * Returns true when this path equals {@code other} or lies underneath it.
     */
    public boolean startsWith(SchemaPath other) {
        return segments.size() >= other.segments.size()
                && segments.subList(0, other.segments.size()).equals(other.segments);
    }

    public boolean contains(String segment) {
        return segments.contains(segment);
    }

    @Override
    public int compareTo(SchemaPath other) {
        return toString().compareTo(other.toString());
    }

    @JsonValue
    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            sb.append('/').append(segment.replace("~", "~0").replace("/", "~1"));
        }
        return sb.toString();
    }
}
