package com.tessera.query.ast;

import java.util.Objects;

/**
 * One ORDER BY entry
 */
public final class OrderByItem {

    private final Expression expression;
    private final boolean ascending;

    public OrderByItem(Expression expression, boolean ascending) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.ascending = ascending;
    }

    public static OrderByItem asc(Expression expression) {
        return new OrderByItem(expression, true);
    }

    public static OrderByItem desc(Expression expression) {
        return new OrderByItem(expression, false);
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderByItem)) return false;
        OrderByItem that = (OrderByItem) o;
        return ascending == that.ascending && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, ascending);
    }

    @Override
    public String toString() {
        return expression + (ascending ? " ASC" : " DESC");
    }
}
