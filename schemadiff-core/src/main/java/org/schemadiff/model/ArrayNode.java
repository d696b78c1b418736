package org.schemadiff.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

@Value
@Builder(toBuilder = true)
public class ArrayNode implements SchemaNode {

    @NonNull
    SchemaNode element;

    Integer minItems;

    Integer maxItems;

    @With
    @Builder.Default
    NodeMetadata metadata = NodeMetadata.empty();

    public static ArrayNode of(SchemaNode element) {
        return builder().element(element).build();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY;
    }

    @Override
    public String describe() {
        return "array<" + element.describe() + ">";
    }
}
