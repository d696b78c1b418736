package org.schemadiff.migration;

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
public class MigrationPlan {

    @Singular
    List<MigrationStep> steps;

    @Builder.Default
    SortedMap<String, String> metadata = new TreeMap<>();

    @JsonIgnore
    public List<String> getInstructions() {
        return steps.stream().map(MigrationStep::getInstruction).toList();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
