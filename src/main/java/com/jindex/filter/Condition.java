package com.jindex.filter;

/**
 * Comparison applied by a {@link FieldPredicate}.
 */
public enum Condition {
    EQUALS,
    RANGE,
    CONTAINS,
    GREATER_THAN,
    LESS_THAN
}
