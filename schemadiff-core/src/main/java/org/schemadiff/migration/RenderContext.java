package org.schemadiff.migration;

import lombok.Builder;
import lombok.Value;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaVersion;

import java.util.List;

/**
 * What a renderer may look at besides the instruction itself: both trees, the source
 * documents and the whole plan in execution order.
 */
@Value
@Builder(toBuilder = true)
public class RenderContext {
    SchemaFormat format;
    SchemaVersion sourceVersion;
    SchemaVersion targetVersion;
    SchemaNode oldRoot;
    SchemaNode newRoot;
    String oldContent;
    String newContent;

    @Builder.Default
    List<MigrationInstruction> instructions = List.of();
}
