package org.schemadiff.validate;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of {@link ChangeValidator#validate}. {@code context} holds per-kind change counts.
 */
@Value
@Builder
@Jacksonized
public class ValidationResult {

    boolean valid;

    @Singular
    List<ValidationError> errors;

    @Builder.Default
    SortedMap<String, String> context = new TreeMap<>();
}
