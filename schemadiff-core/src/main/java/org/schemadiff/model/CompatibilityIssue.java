package org.schemadiff.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A Breaking or Warning change together with what a schema owner can do about it.
 * {@code location} and {@code kind} identify the change within its report.
 */
@Value
@Builder
@Jacksonized
public class CompatibilityIssue {
    Severity severity;
    SchemaPath location;
    ChangeKind kind;
    String description;
    String hint;

    public static CompatibilityIssue of(Change change, String reason, String hint) {
        return CompatibilityIssue.builder()
                .severity(change.getSeverity())
                .location(change.getLocation())
                .kind(change.getKind())
                .description(reason == null ? change.getDescription() : change.getDescription() + ": " + reason)
                .hint(hint)
                .build();
    }
}
