package com.tessera.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Tabular result exchanged between handlers, predictors and the engine.
 *
 * Every row carries exactly the declared columns, in declared order. Rows handed
 * to {@link #addRow(Map)} are normalized: missing columns become null, unknown
 * columns are rejected.
 */
public class ResultTable {

    @JsonProperty("columns")
    private final List<String> columns;

    @JsonProperty("rows")
    private final List<Map<String, Object>> rows;

    /**
     * Empty table with the given column order
     */
    public ResultTable(List<String> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(columns)));
        this.rows = new ArrayList<>();
    }

    /**
     * Table with the given column order and rows
     */
    @JsonCreator
    public ResultTable(@JsonProperty("columns") List<String> columns,
                       @JsonProperty("rows") List<Map<String, Object>> rows) {
        this(columns != null ? columns : List.of());
        if (rows != null) {
            rows.forEach(this::addRow);
        }
    }

    public static ResultTable empty() {
        return new ResultTable(List.of());
    }

    /**
     * Build a table whose columns are taken from the first-seen keys of the rows
     */
    public static ResultTable fromRows(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        return new ResultTable(new ArrayList<>(columns), rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    @JsonIgnore
    public int size() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Add a row, normalized to the declared columns
     *
     * @throws IllegalArgumentException if the row carries a column that is not declared
     */
    public void addRow(Map<String, Object> row) {
        Objects.requireNonNull(row, "row must not be null");
        for (String key : row.keySet()) {
            if (!columns.contains(key)) {
                throw new IllegalArgumentException("Row column '" + key + "' is not declared in " + columns);
            }
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (String column : columns) {
            normalized.put(column, row.get(column));
        }
        rows.add(normalized);
    }

    /**
     * Values of a single column, in row order
     */
    public List<Object> column(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Unknown column '" + column + "'");
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Append the rows of another table. The resulting columns are the union of both
     * column lists (this table's order first); absent values are null.
     */
    public ResultTable concat(ResultTable other) {
        Set<String> union = new LinkedHashSet<>(columns);
        union.addAll(other.columns);
        ResultTable combined = new ResultTable(new ArrayList<>(union));
        rows.forEach(combined::addRow);
        other.rows.forEach(combined::addRow);
        return combined;
    }

    /**
     * Keep only the given columns, in the given order
     */
    public ResultTable project(List<String> keep) {
        for (String column : keep) {
            if (!hasColumn(column)) {
                throw new IllegalArgumentException("Cannot project unknown column '" + column + "'");
            }
        }
        ResultTable projected = new ResultTable(keep);
        for (Map<String, Object> row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : keep) {
                values.put(column, row.get(column));
            }
            projected.addRow(values);
        }
        return projected;
    }

    /**
     * Rename every column through the given function. Renaming two columns to the
     * same name is rejected.
     */
    public ResultTable renameColumns(UnaryOperator<String> renamer) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            String target = renamer.apply(column);
            if (renamed.contains(target)) {
                throw new IllegalArgumentException("Renaming produces duplicate column '" + target + "'");
            }
            renamed.add(target);
        }
        ResultTable result = new ResultTable(renamed);
        for (Map<String, Object> row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(renamed.get(i), row.get(columns.get(i)));
            }
            result.addRow(values);
        }
        return result;
    }

    /**
     * Stable sort by the given comparator (equal rows keep their relative order)
     */
    public ResultTable sorted(Comparator<Map<String, Object>> comparator) {
        List<Map<String, Object>> ordered = new ArrayList<>(rows);
        ordered.sort(comparator);
        return new ResultTable(columns, ordered);
    }

    /**
     * Stable ascending sort by one column, nulls first
     */
    public ResultTable sortedBy(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Cannot sort by unknown column '" + column + "'");
        }
        return sorted(Values.byColumn(column, true));
    }

    /**
     * Rows {@code [from, to)} as a new table
     */
    public ResultTable slice(int from, int to) {
        int start = Math.min(Math.max(from, 0), rows.size());
        int end = Math.min(Math.max(to, start), rows.size());
        return new ResultTable(columns, rows.subList(start, end));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultTable)) return false;
        ResultTable that = (ResultTable) o;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "ResultTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
