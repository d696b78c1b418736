package org.schemadiff.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Map;
import java.util.Set;

/**
 * Named members in declaration order plus the subset that must be present.
 */
@Value
@Builder(toBuilder = true)
public class ObjectNode implements SchemaNode {

    @Singular
    Map<String, SchemaNode> fields;

    @Singular
    Set<String> requiredFields;

    @With
    @Builder.Default
    NodeMetadata metadata = NodeMetadata.empty();

    @Override
    public NodeKind getKind() {
        return NodeKind.OBJECT;
    }

    public boolean isRequired(String field) {
        return requiredFields.contains(field);
    }

    @Override
    public String describe() {
        return "object";
    }
}
