package com.jindex.filter;

import java.util.Locale;
import java.util.Objects;

/**
 * Test applied to one attribute value during a linear scan.
 *
 * <p>Numbers compare numerically regardless of their boxed type, strings
 * compare lexicographically. A value that cannot be compared with the operand
 * (a string against a number, or null) never matches.
 */
public final class FieldPredicate {
    private final Condition condition;
    private final Object value;
    private final Object min;
    private final Object max;

    private FieldPredicate(Condition condition, Object value, Object min, Object max) {
        this.condition = condition;
        this.value = value;
        this.min = min;
        this.max = max;
    }

    public static FieldPredicate equalTo(Object value) {
        return new FieldPredicate(Condition.EQUALS, value, null, null);
    }

    public static FieldPredicate between(Object min, Object max) {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        return new FieldPredicate(Condition.RANGE, null, min, max);
    }

    /**
     * Case-insensitive substring match on the value's string form.
     */
    public static FieldPredicate contains(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            throw new IllegalArgumentException("contains() needs a non-empty fragment");
        }
        return new FieldPredicate(Condition.CONTAINS, fragment, null, null);
    }

    public static FieldPredicate greaterThan(Object value) {
        return new FieldPredicate(Condition.GREATER_THAN, Objects.requireNonNull(value, "value"), null, null);
    }

    public static FieldPredicate lessThan(Object value) {
        return new FieldPredicate(Condition.LESS_THAN, Objects.requireNonNull(value, "value"), null, null);
    }

    public Condition getCondition() {
        return condition;
    }

    public boolean test(Object fieldValue) {
        switch (condition) {
            case EQUALS:
                if (fieldValue instanceof Number && value instanceof Number) {
                    return compare(fieldValue, value) == 0;
                }
                return Objects.equals(fieldValue, value);
            case RANGE: {
                Integer low = compare(min, fieldValue);
                Integer high = compare(fieldValue, max);
                return low != null && high != null && low <= 0 && high <= 0;
            }
            case CONTAINS:
                return fieldValue != null
                    && String.valueOf(fieldValue).toLowerCase(Locale.ROOT)
                        .contains(((String) value).toLowerCase(Locale.ROOT));
            case GREATER_THAN: {
                Integer result = compare(fieldValue, value);
                return result != null && result > 0;
            }
            case LESS_THAN: {
                Integer result = compare(fieldValue, value);
                return result != null && result < 0;
            }
            default:
                throw new IllegalStateException("Unhandled condition " + condition);
        }
    }

    /**
     * @return the sign of {@code a - b}, or null when the two are not comparable
     */
    private static Integer compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof String && b instanceof String) {
            return Integer.signum(((String) a).compareTo((String) b));
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        return null;
    }

    @Override
    public String toString() {
        if (condition == Condition.RANGE) {
            return "RANGE[" + min + ", " + max + "]";
        }
        return condition + "(" + value + ")";
    }
}
