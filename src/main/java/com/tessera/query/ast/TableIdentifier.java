package com.tessera.query.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Table name in a FROM clause, usually {@code integration.table} or
 * {@code models.predictor}, with an optional alias.
 */
public final class TableIdentifier implements TableReference {

    private final List<String> parts;
    private final String alias;

    public TableIdentifier(List<String> parts, String alias) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("Table identifier must have at least one part");
        }
        this.parts = List.copyOf(parts);
        this.alias = alias;
    }

    public static TableIdentifier of(String... parts) {
        return new TableIdentifier(Arrays.asList(parts), null);
    }

    public TableIdentifier as(String alias) {
        return new TableIdentifier(parts, alias);
    }

    public List<String> getParts() {
        return parts;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Alias if given, otherwise the last part
     */
    public String getReferenceName() {
        return alias != null ? alias : getName();
    }

    public String getName() {
        return parts.get(parts.size() - 1);
    }

    /**
     * Leading part of a qualified name, null when unqualified
     */
    public String getQualifier() {
        return parts.size() > 1 ? parts.get(0) : null;
    }

    public boolean isQualified() {
        return parts.size() > 1;
    }

    /**
     * Name relative to its integration: every part after the first
     */
    public String getTablePath() {
        return isQualified() ? String.join(".", parts.subList(1, parts.size())) : getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableIdentifier)) return false;
        TableIdentifier that = (TableIdentifier) o;
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
