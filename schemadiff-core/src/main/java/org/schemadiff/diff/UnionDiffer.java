package org.schemadiff.diff;

import org.schemadiff.exception.ComparisonException;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.model.SchemaPath;
import org.schemadiff.model.UnionNode;

import java.util.Arrays;
import java.util.List;

/**
 * Matches alternatives best-effort: equal alternatives first, then alternatives with
 * the same {@link ShapeKey}. Whatever is left over counts as removed or added.
 */
public class UnionDiffer implements NodeDiffer {

    public static final String ALTERNATIVE = "alternative";

    @Override
    public void diff(NodePair pair, DiffContext context) throws ComparisonException {
        List<SchemaNode> oldAlts = pair.oldAs(UnionNode.class).getAlternatives();
        List<SchemaNode> newAlts = pair.newAs(UnionNode.class).getAlternatives();

        int[] matchOf = new int[oldAlts.size()];
        Arrays.fill(matchOf, -1);
        boolean[] used = new boolean[newAlts.size()];

        for (int i = 0; i < oldAlts.size(); i++) {
            for (int j = 0; j < newAlts.size(); j++) {
                if (!used[j] && oldAlts.get(i).equals(newAlts.get(j))) {
                    matchOf[i] = j;
                    used[j] = true;
                    break;
                }
            }
        }
        for (int i = 0; i < oldAlts.size(); i++) {
            if (matchOf[i] >= 0) continue;
            ShapeKey shape = ShapeKey.of(oldAlts.get(i));
            for (int j = 0; j < newAlts.size(); j++) {
                if (!used[j] && shape.equals(ShapeKey.of(newAlts.get(j)))) {
                    matchOf[i] = j;
                    used[j] = true;
                    break;
                }
            }
        }

        for (int i = 0; i < oldAlts.size(); i++) {
            SchemaPath oldPath = pair.oldPath().alternative(i);
            SchemaNode oldAlt = oldAlts.get(i);
            if (matchOf[i] >= 0) {
                context.compare(NodePair.of(oldAlt, newAlts.get(matchOf[i]), oldPath,
                        pair.newPath().alternative(matchOf[i])));
            } else {
                context.emit(Change.builder()
                        .location(oldPath)
                        .kind(ChangeKind.REMOVED)
                        .description("Removed union alternative " + oldAlt.describe())
                        .detail(ALTERNATIVE, "true")
                        .oldNode(oldAlt)
                        .build());
            }
        }
        for (int j = 0; j < newAlts.size(); j++) {
            if (used[j]) continue;
            SchemaPath newPath = pair.newPath().alternative(j);
            context.emit(Change.builder()
                    .location(newPath)
                    .newLocation(newPath)
                    .kind(ChangeKind.ADDED)
                    .description("Added union alternative " + newAlts.get(j).describe())
                    .detail(ALTERNATIVE, "true")
                    .newNode(newAlts.get(j))
                    .build());
        }
    }
}
