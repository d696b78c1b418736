package org.schemadiff.migration;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.Severity;

@Value
@Builder
@Jacksonized
public class MigrationStep {
    int order;
    MigrationPhase phase;
    MigrationOperation operation;
    SchemaPath location;
    Severity severity;
    String instruction;
}
