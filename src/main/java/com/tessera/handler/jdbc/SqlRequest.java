package com.tessera.handler.jdbc;

import com.tessera.query.SortColumn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-table SELECT assembled by the JDBC pushdown adapter.
 */
public class SqlRequest {

    private final String table;
    private final List<String> predicates = new ArrayList<>();
    private final List<SortColumn> sort = new ArrayList<>();
    private Integer limit;

    public SqlRequest(String table) {
        this.table = table;
    }

    public String getTable() {
        return table;
    }

    public List<String> getPredicates() {
        return Collections.unmodifiableList(predicates);
    }

    void addPredicate(String predicate) {
        predicates.add(predicate);
    }

    public List<SortColumn> getSort() {
        return Collections.unmodifiableList(sort);
    }

    void setSort(List<SortColumn> sort) {
        this.sort.clear();
        this.sort.addAll(sort);
    }

    public Integer getLimit() {
        return limit;
    }

    void setLimit(Integer limit) {
        this.limit = limit;
    }
}
