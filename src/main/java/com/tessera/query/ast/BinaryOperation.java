package com.tessera.query.ast;

import java.util.Locale;
import java.util.Objects;

/**
 * Binary operator node: {@code and}, {@code or}, comparisons, {@code like},
 * {@code not like}, {@code in}, {@code not in}. The operator is stored lower-case.
 */
public final class BinaryOperation implements Expression {

    private final String op;
    private final Expression left;
    private final Expression right;
    private final String alias;

    public BinaryOperation(String op, Expression left, Expression right) {
        this(op, left, right, null);
    }

    public BinaryOperation(String op, Expression left, Expression right, String alias) {
        this.op = Objects.requireNonNull(op, "op").trim().toLowerCase(Locale.ROOT);
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.alias = alias;
    }

    public static BinaryOperation and(Expression left, Expression right) {
        return new BinaryOperation("and", left, right);
    }

    public String getOp() {
        return op;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    public boolean isConjunction() {
        return "and".equals(op);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryOperation)) return false;
        BinaryOperation that = (BinaryOperation) o;
        return op.equals(that.op) && left.equals(that.left) && right.equals(that.right)
            && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, left, right, alias);
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.toUpperCase(Locale.ROOT) + " " + right + ")";
    }
}
