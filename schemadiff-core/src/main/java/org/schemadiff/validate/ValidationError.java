package org.schemadiff.validate;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaPath;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationError {

    public enum Code {
        UNCLASSIFIED,
        INCONSISTENT_BREAKING_FLAG,
        SEVERITY_UNDERSTATED,
        DUPLICATE_CHANGE
    }

    @NonNull
    Code code;

    @NonNull
    String message;

    SchemaPath location;

    ChangeKind kind;
}
