package com.tessera.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of executing one statement: the table plus any persistence warnings.
 */
public class QueryResponse {

    @JsonProperty("table")
    private final ResultTable table;

    @JsonProperty("warnings")
    private final List<PersistenceWarning> warnings;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    public QueryResponse(ResultTable table) {
        this(table, List.of());
    }

    public QueryResponse(ResultTable table, List<PersistenceWarning> warnings) {
        this.table = table != null ? table : ResultTable.empty();
        this.warnings = new ArrayList<>(warnings);
    }

    public static QueryResponse ok() {
        return new QueryResponse(ResultTable.empty());
    }

    public ResultTable getTable() {
        return table;
    }

    public List<PersistenceWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public void addWarning(PersistenceWarning warning) {
        warnings.add(warning);
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    @Override
    public String toString() {
        return "QueryResponse{" +
            "rows=" + table.size() +
            ", columns=" + table.getColumns() +
            ", warnings=" + warnings.size() +
            ", executionTimeMs=" + executionTimeMs +
            '}';
    }
}
