package org.schemadiff.model;

import lombok.Getter;

/**
 * Scalar constraints that survive normalization. Values are {@link java.math.BigDecimal}
 * for numeric bounds and {@link #MULTIPLE_OF}, a list of literals for {@link #ENUM} and
 * strings for the pattern keywords. Literals keep their source type where the format has one.
 */
@Getter
public enum Constraint {
    MINIMUM("minimum", Direction.LOWER_BOUND),
    EXCLUSIVE_MINIMUM("exclusiveMinimum", Direction.LOWER_BOUND),
    MAXIMUM("maximum", Direction.UPPER_BOUND),
    EXCLUSIVE_MAXIMUM("exclusiveMaximum", Direction.UPPER_BOUND),
    MIN_LENGTH("minLength", Direction.LOWER_BOUND),
    MAX_LENGTH("maxLength", Direction.UPPER_BOUND),
    MULTIPLE_OF("multipleOf", Direction.DIVISOR),
    PATTERN("pattern", Direction.MATCH),
    FORMAT("format", Direction.MATCH),
    ENUM("enum", Direction.VALUE_SET),
    DEFAULT_VALUE("default", Direction.ANNOTATION);

    private final String key;
    private final Direction direction;

    Constraint(String key, Direction direction) {
        this.key = key;
        this.direction = direction;
    }

    /**
     * How a change in the constraint value moves the set of accepted values.
     */
    public enum Direction {
        /** raising the value narrows the accepted range */
        LOWER_BOUND,
        /** lowering the value narrows the accepted range */
        UPPER_BOUND,
        /** removing members narrows the accepted set */
        VALUE_SET,
        /** adding or changing narrows, removing widens */
        MATCH,
        /** accepted values are multiples of it: a multiple of the old value narrows, a divisor widens */
        DIVISOR,
        /** no effect on accepted values */
        ANNOTATION
    }
}
