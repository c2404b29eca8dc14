package com.tessera.domain;

import java.util.Objects;

/**
 * A column of a handler table.
 */
public final class ColumnDescriptor {

    private final String name;
    private final String dataType;

    public ColumnDescriptor(String name, String dataType) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = dataType != null ? dataType : "str";
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnDescriptor)) return false;
        ColumnDescriptor that = (ColumnDescriptor) o;
        return name.equals(that.name) && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType);
    }

    @Override
    public String toString() {
        return name + " " + dataType;
    }
}
