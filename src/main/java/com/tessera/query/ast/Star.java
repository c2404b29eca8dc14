package com.tessera.query.ast;

import java.util.Objects;

/**
 * {@code *} or {@code alias.*} in a select list.
 */
public final class Star implements Expression {

    private final String qualifier;

    public Star() {
        this(null);
    }

    public Star(String qualifier) {
        this.qualifier = qualifier;
    }

    /**
     * Table alias for {@code alias.*}, or null for a bare {@code *}
     */
    public String getQualifier() {
        return qualifier;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Star && Objects.equals(qualifier, ((Star) o).qualifier));
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(qualifier);
    }

    @Override
    public String toString() {
        return qualifier != null ? qualifier + ".*" : "*";
    }
}
