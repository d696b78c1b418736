package org.schemadiff.rules;

import lombok.Getter;
import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.UnionNode;

import java.util.List;
import java.util.Optional;

/**
 * What a rule may look at besides the change itself. The trees are absent when
 * changes are validated on their own; rules then fall back to change details.
 */
@Getter
public class RuleContext {

    private final SchemaFormat format;
    private final SchemaNode oldRoot;
    private final SchemaNode newRoot;
    private final List<Change> changes;

    public RuleContext(SchemaFormat format, SchemaNode oldRoot, SchemaNode newRoot, List<Change> changes) {
        this.format = format;
        this.oldRoot = oldRoot;
        this.newRoot = newRoot;
        this.changes = List.copyOf(changes);
    }

    public static RuleContext detached(SchemaFormat format, List<Change> changes) {
        return new RuleContext(format, null, null, changes);
    }

    public Optional<SchemaNode> resolveOld(SchemaPath path) {
        return resolve(oldRoot, path);
    }

    public Optional<SchemaNode> resolveNew(SchemaPath path) {
        return resolve(newRoot, path);
    }

    /**
     * True when some Added change in the same change set covers {@code path} from above,
     * i.e. the member at {@code path} did not exist before.
     */
    public boolean isUnderAddedMember(SchemaPath path) {
        return changes.stream()
                .filter(c -> c.getKind() == ChangeKind.ADDED)
                .anyMatch(c -> path.startsWith(c.getLocation()));
    }

    static Optional<SchemaNode> resolve(SchemaNode root, SchemaPath path) {
        SchemaNode current = root;
        for (String segment : path.segments()) {
            if (current == null) {
                return Optional.empty();
            }
            current = step(current, segment);
        }
        return Optional.ofNullable(current);
    }

    private static SchemaNode step(SchemaNode node, String segment) {
        if (segment.startsWith(SchemaPath.ALTERNATIVE_PREFIX)) {
            int index;
            try {
                index = Integer.parseInt(segment.substring(SchemaPath.ALTERNATIVE_PREFIX.length()));
            } catch (NumberFormatException e) {
                return null;
            }
            if (node instanceof UnionNode union) {
                return index < union.getAlternatives().size() ? union.getAlternatives().get(index) : null;
            }
            // union이 아닌 쪽은 단일 대안으로 승격되어 비교된다
            return index == 0 ? node : null;
        }
        if (node instanceof ObjectNode object) {
            return object.getFields().get(segment);
        }
        if (node instanceof ArrayNode array && SchemaPath.ELEMENT.equals(segment)) {
            return array.getElement();
        }
        return null;
    }
}
