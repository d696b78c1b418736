package org.schemadiff.diff;

import org.schemadiff.model.Constraint;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether moving a constraint from one value to another narrows or widens
 * the set of accepted values.
 */
final class BoundComparison {

    enum Effect {
        NONE,
        TIGHTENED,
        LOOSENED,
        /** value set lost and gained members at once */
        BOTH,
        ANNOTATION
    }

    private BoundComparison() {
    }

    static Effect compare(Constraint.Direction direction, Object oldValue, Object newValue) {
        if (Objects.equals(oldValue, newValue)) {
            return Effect.NONE;
        }
        if (direction == Constraint.Direction.ANNOTATION) {
            return Effect.ANNOTATION;
        }
        if (oldValue == null) {
            return Effect.TIGHTENED;
        }
        if (newValue == null) {
            return Effect.LOOSENED;
        }
        return switch (direction) {
            case LOWER_BOUND -> numeric(oldValue, newValue, true);
            case UPPER_BOUND -> numeric(oldValue, newValue, false);
            case VALUE_SET -> valueSet(oldValue, newValue);
            case MATCH -> Effect.TIGHTENED;
            case DIVISOR -> divisor(oldValue, newValue);
            case ANNOTATION -> Effect.ANNOTATION;
        };
    }

    private static Effect numeric(Object oldValue, Object newValue, boolean lowerBound) {
        int c = toDecimal(newValue).compareTo(toDecimal(oldValue));
        if (c == 0) {
            return Effect.NONE;
        }
        boolean raised = c > 0;
        return raised == lowerBound ? Effect.TIGHTENED : Effect.LOOSENED;
    }

    private static Effect divisor(Object oldValue, Object newValue) {
        BigDecimal before;
        BigDecimal after;
        try {
            before = toDecimal(oldValue);
            after = toDecimal(newValue);
        } catch (NumberFormatException e) {
            return Effect.TIGHTENED;
        }
        if (before.signum() == 0 || after.signum() == 0) {
            return Effect.TIGHTENED;
        }
        // 새 값이 이전 값을 나누면 이전의 배수는 모두 여전히 허용된다
        boolean widens = divides(after, before);
        boolean narrows = divides(before, after);
        if (widens && narrows) return Effect.NONE;
        if (widens) return Effect.LOOSENED;
        if (narrows) return Effect.TIGHTENED;
        return Effect.BOTH;
    }

    private static boolean divides(BigDecimal divisor, BigDecimal value) {
        return value.remainder(divisor).signum() == 0;
    }

    private static Effect valueSet(Object oldValue, Object newValue) {
        Set<String> before = asSet(oldValue);
        Set<String> after = asSet(newValue);
        boolean lost = !after.containsAll(before);
        boolean gained = !before.containsAll(after);
        if (lost && gained) return Effect.BOTH;
        if (lost) return Effect.TIGHTENED;
        if (gained) return Effect.LOOSENED;
        return Effect.NONE;
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }

    private static Set<String> asSet(Object value) {
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof List<?> list) {
            list.forEach(v -> result.add(member(v)));
        } else {
            result.add(member(value));
        }
        return result;
    }

    // 숫자 1과 문자열 "1"은 다른 값이다
    private static String member(Object value) {
        if (value instanceof String text) {
            return "\"" + text;
        }
        if (value instanceof Number number) {
            return toDecimal(number).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
