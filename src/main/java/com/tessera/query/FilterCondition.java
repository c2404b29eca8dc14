package com.tessera.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One conjunct of a WHERE clause in column-operator-value form.
 *
 * A condition starts unapplied; the pushdown translator marks it applied once the
 * handler has folded it into its native request. Applied conditions are not
 * re-evaluated locally.
 */
public class FilterCondition {

    private final String column;
    private final FilterOperator operator;
    private final Object value;
    private boolean applied;

    public FilterCondition(String column, FilterOperator operator, Object value) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Filter column must not be blank");
        }
        this.column = column;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = normalizeValue(operator, value);
    }

    public static FilterCondition of(String column, FilterOperator operator, Object value) {
        return new FilterCondition(column, operator, value);
    }

    public static FilterCondition between(String column, Object low, Object high) {
        List<Object> bounds = new ArrayList<>(2);
        bounds.add(low);
        bounds.add(high);
        return new FilterCondition(column, FilterOperator.BETWEEN, bounds);
    }

    public static FilterCondition isNull(String column) {
        return new FilterCondition(column, FilterOperator.IS_NULL, null);
    }

    public static FilterCondition isNotNull(String column) {
        return new FilterCondition(column, FilterOperator.IS_NOT_NULL, null);
    }

    private static Object normalizeValue(FilterOperator operator, Object value) {
        if (!operator.takesList()) {
            return value;
        }
        if (!(value instanceof Collection)) {
            throw new IllegalArgumentException("Operator " + operator + " requires a list value, got " + value);
        }
        List<Object> values = Collections.unmodifiableList(new ArrayList<>((Collection<?>) value));
        if (operator == FilterOperator.BETWEEN && values.size() != 2) {
            throw new IllegalArgumentException("BETWEEN requires exactly two bounds, got " + values.size());
        }
        return values;
    }

    public String getColumn() {
        return column;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    /**
     * List value of IN / NOT IN / BETWEEN conditions
     */
    @SuppressWarnings("unchecked")
    public List<Object> getValues() {
        if (!operator.takesList()) {
            throw new IllegalStateException("Operator " + operator + " has a scalar value");
        }
        return (List<Object>) value;
    }

    public boolean isApplied() {
        return applied;
    }

    public void markApplied() {
        this.applied = true;
    }

    /**
     * Fresh unapplied copy, for reuse of the same condition in another request
     */
    public FilterCondition copy() {
        return new FilterCondition(column, operator, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterCondition)) return false;
        FilterCondition that = (FilterCondition) o;
        return column.equals(that.column) && operator == that.operator && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, value);
    }

    @Override
    public String toString() {
        if (operator.isUnary()) {
            return column + " " + operator;
        }
        return column + " " + operator + " " + value + (applied ? " [pushed]" : "");
    }
}
