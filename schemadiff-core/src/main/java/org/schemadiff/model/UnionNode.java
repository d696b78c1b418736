package org.schemadiff.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder(toBuilder = true)
public class UnionNode implements SchemaNode {

    @Singular
    List<SchemaNode> alternatives;

    @With
    @Builder.Default
    NodeMetadata metadata = NodeMetadata.empty();

    public static UnionNode of(List<SchemaNode> alternatives) {
        return builder().alternatives(alternatives).build();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNION;
    }

    @Override
    public String describe() {
        return alternatives.stream().map(SchemaNode::describe).collect(Collectors.joining("|"));
    }
}
