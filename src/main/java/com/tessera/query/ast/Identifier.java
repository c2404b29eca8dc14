package com.tessera.query.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Possibly qualified column or table name, e.g. {@code t.sqft} or {@code mysql_db.house_sales}.
 */
public final class Identifier implements Expression {

    private final List<String> parts;
    private final String alias;

    public Identifier(List<String> parts, String alias) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("Identifier must have at least one part");
        }
        this.parts = List.copyOf(parts);
        this.alias = alias;
    }

    public static Identifier of(String... parts) {
        return new Identifier(Arrays.asList(parts), null);
    }

    public Identifier as(String alias) {
        return new Identifier(parts, alias);
    }

    public List<String> getParts() {
        return parts;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    /**
     * Last part, i.e. the bare column name
     */
    public String getName() {
        return parts.get(parts.size() - 1);
    }

    /**
     * First part when qualified, otherwise null
     */
    public String getQualifier() {
        return parts.size() > 1 ? parts.get(0) : null;
    }

    public boolean isQualified() {
        return parts.size() > 1;
    }

    /**
     * Same identifier without qualifier and alias
     */
    public Identifier unqualified() {
        return new Identifier(List.of(getName()), null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier)) return false;
        Identifier that = (Identifier) o;
        return parts.equals(that.parts) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parts, alias);
    }

    @Override
    public String toString() {
        String name = String.join(".", parts);
        return alias != null ? name + " AS " + alias : name;
    }
}
