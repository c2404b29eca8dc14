package com.tessera.query.ast;

import java.util.Objects;

/**
 * {@code left [type] JOIN right [ON condition]}.
 */
public final class JoinClause implements TableReference {

    private final TableReference left;
    private final TableReference right;
    private final String joinType;
    private final Expression condition;

    public JoinClause(TableReference left, TableReference right, String joinType, Expression condition) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.joinType = joinType != null ? joinType : "JOIN";
        this.condition = condition;
    }

    public static JoinClause of(TableReference left, TableReference right) {
        return new JoinClause(left, right, "JOIN", null);
    }

    public TableReference getLeft() {
        return left;
    }

    public TableReference getRight() {
        return right;
    }

    public String getJoinType() {
        return joinType;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinClause)) return false;
        JoinClause that = (JoinClause) o;
        return left.equals(that.left) && right.equals(that.right)
            && joinType.equals(that.joinType) && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, joinType, condition);
    }

    @Override
    public String toString() {
        return left + " " + joinType + " " + right + (condition != null ? " ON " + condition : "");
    }
}
