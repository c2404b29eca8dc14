package com.tessera.query;

import com.tessera.query.ast.SelectStatement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One structured query of a plan.
 *
 * - partition: group column values this query is restricted to (empty for ungrouped plans)
 * - label: slice name used in logs, e.g. {@code history} or {@code forecast}
 * - resortColumn: when set, the fetched rows are re-ordered ascending by this column
 */
public class SubQuery {

    private final SelectStatement select;
    private final Map<String, Object> partition;
    private final String label;
    private final String resortColumn;

    public SubQuery(SelectStatement select) {
        this(select, Map.of(), "query", null);
    }

    public SubQuery(SelectStatement select, Map<String, Object> partition, String label, String resortColumn) {
        this.select = Objects.requireNonNull(select, "select must not be null");
        this.partition = Collections.unmodifiableMap(new LinkedHashMap<>(partition));
        this.label = label;
        this.resortColumn = resortColumn;
    }

    public SelectStatement getSelect() {
        return select;
    }

    public Map<String, Object> getPartition() {
        return partition;
    }

    public String getLabel() {
        return label;
    }

    public String getResortColumn() {
        return resortColumn;
    }

    @Override
    public String toString() {
        return "SubQuery{" + label + (partition.isEmpty() ? "" : " " + partition) + ": " + select + "}";
    }
}
