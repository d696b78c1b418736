package org.schemadiff.format.jsonschema;

import org.schemadiff.model.ChangeKind;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.rules.RuleTable;
import org.schemadiff.rules.TypeLattice;
import org.schemadiff.rules.Verdict;

import java.util.Optional;

final class JsonSchemaRules {

    private JsonSchemaRules() {
    }

    static RuleTable table() {
        return RuleTable.builder(SchemaFormat.JSON_SCHEMA)
                .typeLattice(TypeLattice.generic())
                .deprecationAware(true)
                // 정의($defs) 추가는 참조하는 곳이 없으므로 영향이 없다
                .override(ChangeKind.ADDED, (change, ctx) -> change.getLocation().depth() == 1
                        && isDefinition(change.getLocation().leaf())
                        ? Optional.of(Verdict.info("Definition added"))
                        : Optional.empty())
                .build();
    }

    static boolean isDefinition(String rootSegment) {
        return rootSegment.startsWith("$defs" + JsonPatchRenderer.DEFS_SEPARATOR)
                || rootSegment.startsWith("definitions" + JsonPatchRenderer.DEFS_SEPARATOR);
    }
}
