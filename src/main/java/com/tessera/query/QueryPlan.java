package com.tessera.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sub-queries against one handler.
 * Results are concatenated in plan order, whatever order they were fetched in.
 */
public class QueryPlan {
    private final List<SubQuery> subQueries;

    public QueryPlan() {
        this.subQueries = new ArrayList<>();
    }

    /**
     * Add a sub-query to the end of the plan
     */
    public void addSubQuery(SubQuery subQuery) {
        if (subQuery != null) {
            subQueries.add(subQuery);
        }
    }

    public List<SubQuery> getSubQueries() {
        return Collections.unmodifiableList(subQueries);
    }

    public boolean isEmpty() {
        return subQueries.isEmpty();
    }

    public int size() {
        return subQueries.size();
    }

    @Override
    public String toString() {
        return "QueryPlan{" + subQueries + "}";
    }
}
