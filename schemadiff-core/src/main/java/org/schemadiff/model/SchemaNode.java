package org.schemadiff.model;

/**
 * A node of the normalized schema tree. Implementations are immutable and compare
 * structurally, metadata included.
 * <p>
 * The set of implementations is closed: one per {@link NodeKind}. Code that needs
 * to handle every variant switches on {@link #getKind()}.
 */
public interface SchemaNode {

    NodeKind getKind();

    NodeMetadata getMetadata();

    SchemaNode withMetadata(NodeMetadata metadata);

    /**
     * Short human readable type description, used in change descriptions.
     */
    String describe();
}
