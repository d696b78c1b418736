package org.schemadiff.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.schemadiff.exception.SchemaParseException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version attached to a schema. Build metadata is kept for display but
 * ignored by ordering, as semver prescribes.
 */
public record SchemaVersion(int major, int minor, int patch, String preRelease, String build)
        implements Comparable<SchemaVersion> {

    private static final Pattern SEMVER = Pattern.compile(
            "^v?(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
                    + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");

    public SchemaVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be non-negative");
        }
    }

    public static SchemaVersion of(int major, int minor, int patch) {
        return new SchemaVersion(major, minor, patch, null, null);
    }

    public static SchemaVersion parse(String text) throws SchemaParseException {
        if (text == null) {
            throw new SchemaParseException("Version must not be null");
        }
        Matcher m = SEMVER.matcher(text.trim());
        if (!m.matches()) {
            throw new SchemaParseException("Invalid semantic version: '" + text + "'");
        }
        try {
            return new SchemaVersion(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    m.group(4),
                    m.group(5));
        } catch (NumberFormatException e) {
            throw new SchemaParseException("Version component out of range: '" + text + "'", e);
        }
    }

    public boolean isPreRelease() {
        return preRelease != null;
    }

    @Override
    public int compareTo(SchemaVersion other) {
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        c = Integer.compare(patch, other.patch);
        if (c != 0) return c;
        // 정식 버전이 pre-release보다 높다
        if (preRelease == null) return other.preRelease == null ? 0 : 1;
        if (other.preRelease == null) return -1;
        return comparePreRelease(preRelease, other.preRelease);
    }

    private static int comparePreRelease(String a, String b) {
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.min(left.length, right.length); i++) {
            boolean leftNumeric = left[i].chars().allMatch(Character::isDigit);
            boolean rightNumeric = right[i].chars().allMatch(Character::isDigit);
            int c;
            if (leftNumeric && rightNumeric) {
                c = Long.compare(Long.parseLong(left[i]), Long.parseLong(right[i]));
            } else if (leftNumeric != rightNumeric) {
                c = leftNumeric ? -1 : 1;
            } else {
                c = left[i].compareTo(right[i]);
            }
            if (c != 0) return c;
        }
        return Integer.compare(left.length, right.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaVersion that)) return false;
        return major == that.major && minor == that.minor && patch == that.patch
                && Objects.equals(preRelease, that.preRelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease);
    }

    @JsonValue
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
        if (preRelease != null) sb.append('-').append(preRelease);
        if (build != null) sb.append('+').append(build);
        return sb.toString();
    }
}
