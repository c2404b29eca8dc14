package com.tessera.query.ast;

import java.util.Objects;

/**
 * {@code operand BETWEEN low AND high}, inclusive on both ends.
 */
public final class BetweenOperation implements Expression {

    private final Expression operand;
    private final Expression low;
    private final Expression high;

    public BetweenOperation(Expression operand, Expression low, Expression high) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.low = Objects.requireNonNull(low, "low");
        this.high = Objects.requireNonNull(high, "high");
    }

    public Expression getOperand() {
        return operand;
    }

    public Expression getLow() {
        return low;
    }

    public Expression getHigh() {
        return high;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BetweenOperation)) return false;
        BetweenOperation that = (BetweenOperation) o;
        return operand.equals(that.operand) && low.equals(that.low) && high.equals(that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, low, high);
    }

    @Override
    public String toString() {
        return "(" + operand + " BETWEEN " + low + " AND " + high + ")";
    }
}
