package com.tessera.query.ast;

import java.util.Objects;

/**
 * Literal value; a null value is the SQL NULL literal.
 */
public final class Constant implements Expression {

    private final Object value;
    private final String alias;

    public Constant(Object value) {
        this(value, null);
    }

    public Constant(Object value, String alias) {
        this.value = value;
        this.alias = alias;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant)) return false;
        Constant that = (Constant) o;
        return Objects.equals(value, that.value) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, alias);
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
