package org.schemadiff.rules;

import org.schemadiff.model.Severity;

/**
 * Outcome of a compatibility rule: how severe the change is, why, and what to do about it.
 */
public record Verdict(Severity severity, String reason, String hint) {

    public static Verdict breaking(String reason, String hint) {
        return new Verdict(Severity.BREAKING, reason, hint);
    }

    public static Verdict warning(String reason, String hint) {
        return new Verdict(Severity.WARNING, reason, hint);
    }

    public static Verdict info(String reason) {
        return new Verdict(Severity.INFO, reason, null);
    }
}
