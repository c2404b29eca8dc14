package com.tessera.query.ast;

import java.util.Objects;

/**
 * {@code operand IS NULL} or, when negated, {@code operand IS NOT NULL}.
 */
public final class NullCheck implements Expression {

    private final Expression operand;
    private final boolean negated;

    public NullCheck(Expression operand, boolean negated) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.negated = negated;
    }

    public static NullCheck isNull(Expression operand) {
        return new NullCheck(operand, false);
    }

    public static NullCheck isNotNull(Expression operand) {
        return new NullCheck(operand, true);
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NullCheck)) return false;
        NullCheck that = (NullCheck) o;
        return negated == that.negated && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, negated);
    }

    @Override
    public String toString() {
        return "(" + operand + (negated ? " IS NOT NULL)" : " IS NULL)");
    }
}
