package org.schemadiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

@Value
@Builder
@Jacksonized
public class CompatibilityReport {

    @Singular
    List<Change> changes;

    int compatibilityScore;

    boolean compatible;

    @Singular
    List<CompatibilityIssue> issues;

    @Builder.Default
    SortedMap<String, String> metadata = new TreeMap<>();

    @JsonIgnore
    public List<Change> getBreakingChanges() {
        return changes.stream().filter(Change::isBreaking).toList();
    }

    @JsonIgnore
    public long count(Severity severity) {
        return changes.stream().filter(c -> c.getSeverity() == severity).count();
    }
}
