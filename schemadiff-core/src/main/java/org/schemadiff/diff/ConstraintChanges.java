package org.schemadiff.diff;

import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects bound movements for one node so that all tightenings become one change
 * and all loosenings another.
 */
final class ConstraintChanges {

    private final List<String> tightenedNames = new ArrayList<>();
    private final List<String> tightenedNotes = new ArrayList<>();
    private final List<String> loosenedNames = new ArrayList<>();
    private final List<String> loosenedNotes = new ArrayList<>();

    void record(String name, Object oldValue, Object newValue, BoundComparison.Effect effect, NodePair pair) {
        String note = name + " " + SchemaDiffer.display(oldValue) + " -> " + SchemaDiffer.display(newValue);
        switch (effect) {
            case TIGHTENED -> {
                tightenedNames.add(name);
                tightenedNotes.add(note);
            }
            case LOOSENED -> {
                loosenedNames.add(name);
                loosenedNotes.add(note);
            }
            case BOTH -> {
                tightenedNames.add(name);
                tightenedNotes.add(note);
                loosenedNames.add(name);
                loosenedNotes.add(note);
            }
            case ANNOTATION -> pair.note(note);
            case NONE -> {
            }
        }
    }

    void emit(NodePair pair, DiffContext context) {
        if (!tightenedNames.isEmpty()) {
            context.emit(build(pair, ChangeKind.CONSTRAINT_TIGHTENED, "Tightened ", tightenedNames, tightenedNotes));
        }
        if (!loosenedNames.isEmpty()) {
            context.emit(build(pair, ChangeKind.CONSTRAINT_LOOSENED, "Loosened ", loosenedNames, loosenedNotes));
        }
    }

    private static Change build(NodePair pair, ChangeKind kind, String verb, List<String> names, List<String> notes) {
        return Change.builder()
                .location(pair.oldPath())
                .newLocation(pair.newPath())
                .kind(kind)
                .description(verb + String.join("; ", notes))
                .detail(Change.CONSTRAINTS, String.join(",", names))
                .oldNode(pair.oldNode())
                .newNode(pair.newNode())
                .build();
    }
}
