package org.schemadiff.format.openapi;

import org.schemadiff.diff.UnionDiffer;
import org.schemadiff.model.Change;
import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.rules.RuleTable;
import org.schemadiff.rules.TypeLattice;
import org.schemadiff.rules.Verdict;

import java.util.Optional;

/**
 * Responses flow from server to client, so the usual direction of most rules flips
 * there: clients tolerate extra or stricter output but not looser output.
 */
final class OpenApiRules {

    private OpenApiRules() {
    }

    static RuleTable table() {
        return RuleTable.builder(SchemaFormat.OPENAPI)
                .typeLattice(TypeLattice.generic())
                .deprecationAware(true)
                .override(ChangeKind.ADDED, (change, ctx) -> inResponse(change) && !isAlternative(change)
                        ? Optional.of(Verdict.info("Response member added; clients ignore members they do not know"))
                        : Optional.empty())
                .override(ChangeKind.CONSTRAINT_TIGHTENED, (change, ctx) -> inResponse(change)
                        ? Optional.of(Verdict.info("Response constraint tightened; clients receive a subset of the old values"))
                        : Optional.empty())
                .override(ChangeKind.CONSTRAINT_LOOSENED, (change, ctx) -> inResponse(change)
                        ? Optional.of(Verdict.warning("Response constraint loosened; clients may receive values they do not expect",
                        "Check that clients validate or tolerate the wider range"))
                        : Optional.empty())
                .override(ChangeKind.REQUIREDNESS_CHANGED, (change, ctx) -> inResponse(change)
                        && change.detail(Change.REQUIRED_AFTER).map(Boolean::parseBoolean).orElse(false)
                        ? Optional.of(Verdict.info("Response member is now always present"))
                        : Optional.empty())
                .build();
    }

    private static boolean inResponse(Change change) {
        return ApiLocation.direction(change.getTargetLocation()) == ApiLocation.Direction.RESPONSE;
    }

    private static boolean isAlternative(Change change) {
        return change.flag(UnionDiffer.ALTERNATIVE);
    }
}
