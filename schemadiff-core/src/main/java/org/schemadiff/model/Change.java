package org.schemadiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Optional;

/**
 * One structural delta between two schemas.
 * <p>
 * The diff engine emits changes without a severity; the rule set fills in
 * {@code severity} and {@code breaking}. {@code location} is the old-side path for
 * removals and matched members and the new-side path for additions; {@code newLocation}
 * is the new-side path whenever one exists.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Change {

    public static final String OLD_TYPE = "oldType";
    public static final String NEW_TYPE = "newType";
    public static final String OLD_NAME = "oldName";
    public static final String NEW_NAME = "newName";
    public static final String IDENTITY = "identity";
    public static final String REQUIRED = "required";
    public static final String REQUIRED_BEFORE = "requiredBefore";
    public static final String REQUIRED_AFTER = "requiredAfter";
    public static final String CONSTRAINTS = "constraints";
    public static final String DEPRECATED = "deprecated";

    @NonNull
    SchemaPath location;

    SchemaPath newLocation;

    @NonNull
    ChangeKind kind;

    Severity severity;

    boolean breaking;

    @NonNull
    String description;

    @Singular
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, String> details;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    SchemaNode oldNode;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    SchemaNode newNode;

    @JsonIgnore
    public boolean isClassified() {
        return severity != null;
    }

    public Change withSeverity(Severity severity) {
        return toBuilder().severity(severity).breaking(severity == Severity.BREAKING).build();
    }

    public Optional<String> detail(String key) {
        return Optional.ofNullable(details.get(key));
    }

    public boolean flag(String key) {
        return detail(key).map(Boolean::parseBoolean).orElse(false);
    }

    @JsonIgnore
    public SchemaPath getTargetLocation() {
        return newLocation != null ? newLocation : location;
    }
}
