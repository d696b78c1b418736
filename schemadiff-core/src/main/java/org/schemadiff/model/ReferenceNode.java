package org.schemadiff.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Named reference to another part of the schema. Targets are compared by name and
 * never resolved, so recursive schemas stay finite.
 */
@Value
@Builder(toBuilder = true)
public class ReferenceNode implements SchemaNode {

    @NonNull
    String target;

    @With
    @Builder.Default
    NodeMetadata metadata = NodeMetadata.empty();

    public static ReferenceNode of(String target) {
        return builder().target(target).build();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.REFERENCE;
    }

    @Override
    public String describe() {
        return "ref " + target;
    }
}
