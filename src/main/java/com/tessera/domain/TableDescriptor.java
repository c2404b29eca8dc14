package com.tessera.domain;

import java.util.Objects;

/**
 * A table exposed by a handler.
 */
public final class TableDescriptor {

    private final String name;
    private final String type;

    public TableDescriptor(String name, String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type != null ? type : "BASE TABLE";
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableDescriptor)) return false;
        TableDescriptor that = (TableDescriptor) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + " (" + type + ")";
    }
}
