package com.tessera.query;

import java.util.Objects;

/**
 * Sort key; in a list, the first key has the highest priority
 */
public class SortColumn {

    private final String column;
    private final boolean ascending;

    public SortColumn(String column, boolean ascending) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Sort column must not be blank");
        }
        this.column = column;
        this.ascending = ascending;
    }

    public static SortColumn asc(String column) {
        return new SortColumn(column, true);
    }

    public static SortColumn desc(String column) {
        return new SortColumn(column, false);
    }

    public String getColumn() {
        return column;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortColumn)) return false;
        SortColumn that = (SortColumn) o;
        return ascending == that.ascending && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, ascending);
    }

    @Override
    public String toString() {
        return column + (ascending ? " ASC" : " DESC");
    }
}
