package com.tessera.query;

import java.util.Locale;

/**
 * Comparison operators a filter condition can carry.
 */
public enum FilterOperator {
    EQUAL("="),
    NOT_EQUAL("!="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN_OR_EQUAL("<="),
    LIKE("like"),
    NOT_LIKE("not like"),
    IN("in"),
    NOT_IN("not in"),
    BETWEEN("between"),
    IS_NULL("is null"),
    IS_NOT_NULL("is not null");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Range comparisons: {@code > < >= <=}
     */
    public boolean isRange() {
        return this == GREATER_THAN || this == LESS_THAN
            || this == GREATER_THAN_OR_EQUAL || this == LESS_THAN_OR_EQUAL;
    }

    /**
     * Operators whose value is a list
     */
    public boolean takesList() {
        return this == IN || this == NOT_IN || this == BETWEEN;
    }

    /**
     * Operators with no right-hand value
     */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * Operator that holds when the operands are swapped, e.g. {@code 5 < x} is {@code x > 5}
     *
     * @throws IllegalArgumentException for operators that are not comparisons
     */
    public FilterOperator mirrored() {
        return switch (this) {
            case EQUAL, NOT_EQUAL -> this;
            case GREATER_THAN -> LESS_THAN;
            case LESS_THAN -> GREATER_THAN;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN_OR_EQUAL;
            default -> throw new IllegalArgumentException("Operator " + symbol + " cannot be mirrored");
        };
    }

    /**
     * Parse a SQL operator symbol, case-insensitively; {@code <>} is accepted for {@code !=}
     */
    public static FilterOperator fromSql(String sql) {
        if (sql == null) {
            throw new IllegalArgumentException("Operator must not be null");
        }
        String normalized = sql.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if ("<>".equals(normalized) || "==".equals(normalized)) {
            return "<>".equals(normalized) ? NOT_EQUAL : EQUAL;
        }
        for (FilterOperator operator : values()) {
            if (operator.symbol.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + sql);
    }

    @Override
    public String toString() {
        return symbol.toUpperCase(Locale.ROOT);
    }
}
