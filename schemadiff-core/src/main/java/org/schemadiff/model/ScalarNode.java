package org.schemadiff.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ScalarNode implements SchemaNode {

    @NonNull
    PrimitiveKind primitive;

    /**
     * Declared type as the source format spells it ({@code int32}, {@code VARCHAR(10)}).
     */
    @NonNull
    String typeName;

    @Singular
    Map<Constraint, Object> constraints;

    @With
    @Builder.Default
    NodeMetadata metadata = NodeMetadata.empty();

    public static ScalarNode of(PrimitiveKind primitive, String typeName) {
        return builder().primitive(primitive).typeName(typeName).build();
    }

    public static ScalarNode of(PrimitiveKind primitive) {
        return of(primitive, primitive.name().toLowerCase());
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SCALAR;
    }

    @Override
    public String describe() {
        return typeName;
    }
}
