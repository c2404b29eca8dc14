package com.tessera.query.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parenthesized value list on the right-hand side of IN / NOT IN.
 */
public final class ConstantList implements Expression {

    private final List<Object> values;

    public ConstantList(List<?> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ConstantList && values.equals(((ConstantList) o).values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
