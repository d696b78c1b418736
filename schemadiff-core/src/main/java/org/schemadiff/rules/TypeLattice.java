package org.schemadiff.rules;

import java.util.Locale;

/**
 * Orders the declared type names of one format by how many values they accept.
 */
@FunctionalInterface
public interface TypeLattice {

    TypeConversion classify(String oldType, String newType);

    /**
     * Format-neutral lattice: integer widens to number, everything else is unrelated.
     */
    static TypeLattice generic() {
        return (oldType, newType) -> {
            String from = oldType == null ? "" : oldType.toLowerCase(Locale.ROOT);
            String to = newType == null ? "" : newType.toLowerCase(Locale.ROOT);
            if (from.equals(to)) return TypeConversion.WIDENING;
            if (from.equals("integer") && to.equals("number")) return TypeConversion.WIDENING;
            if (from.equals("number") && to.equals("integer")) return TypeConversion.NARROWING;
            if (to.equals("any")) return TypeConversion.WIDENING;
            if (from.equals("any")) return TypeConversion.NARROWING;
            return TypeConversion.INCOMPATIBLE;
        };
    }
}
