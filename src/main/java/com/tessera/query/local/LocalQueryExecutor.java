package com.tessera.query.local;

import com.tessera.domain.ResultTable;
import com.tessera.domain.Values;
import com.tessera.error.PlanningException;
import com.tessera.query.FilterCondition;
import com.tessera.query.FilterOperator;
import com.tessera.query.SortColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * LocalQueryExecutor applies the residual part of a query to fetched rows.
 *
 * Order of application:
 * 1. Filter: keep rows satisfying every residual condition (SQL null semantics)
 * 2. Sort: stable multi-key sort, ties keep input order
 * 3. Offset and limit: truncation after filter and sort
 * 4. Projection
 *
 * The executor is pure: it never calls a handler and never mutates its input.
 * Conditions already marked applied are skipped.
 */
@Component
public class LocalQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(LocalQueryExecutor.class);

    /**
     * Apply residual conditions, sort, limit and projection
     *
     * @param table fetched rows
     * @param conditions residual conditions; applied ones are ignored
     * @param sort residual sort, may be empty
     * @param limit residual limit, or null for none
     * @param projection output columns, or null to keep all
     * @return a new table
     * @throws PlanningException if a condition, sort key or projected column is unknown
     */
    public ResultTable apply(ResultTable table,
                             List<FilterCondition> conditions,
                             List<SortColumn> sort,
                             Integer limit,
                             List<String> projection) {
        return apply(table, conditions, sort, null, limit, projection);
    }

    /**
     * Same as {@link #apply(ResultTable, List, List, Integer, List)} with an offset
     * skipped before the limit is taken
     */
    public ResultTable apply(ResultTable table,
                             List<FilterCondition> conditions,
                             List<SortColumn> sort,
                             Integer offset,
                             Integer limit,
                             List<String> projection) {
        List<Map<String, Object>> rows = filter(table, conditions);

        if (sort != null && !sort.isEmpty()) {
            for (SortColumn key : sort) {
                requireColumn(table, key.getColumn(), "sort");
            }
            rows.sort(comparator(sort));
        }

        int from = Math.min(offset != null ? Math.max(offset, 0) : 0, rows.size());
        int to = limit != null ? (int) Math.min((long) from + Math.max(limit, 0), rows.size()) : rows.size();
        List<Map<String, Object>> window = rows.subList(from, to);

        ResultTable result = new ResultTable(table.getColumns(), window);
        if (projection != null) {
            for (String column : projection) {
                requireColumn(table, column, "projected");
            }
            result = result.project(projection);
        }

        log.trace("Local execution kept {} of {} rows", result.size(), table.size());
        return result;
    }

    /**
     * Rows satisfying every unapplied condition, in input order
     */
    public List<Map<String, Object>> filter(ResultTable table, List<FilterCondition> conditions) {
        List<CompiledCondition> compiled = new ArrayList<>();
        if (conditions != null) {
            for (FilterCondition condition : conditions) {
                if (condition.isApplied()) {
                    continue;
                }
                requireColumn(table, condition.getColumn(), "filter");
                compiled.add(new CompiledCondition(condition));
            }
        }

        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            if (matchesAll(row, compiled)) {
                kept.add(row);
            }
        }
        return kept;
    }

    /**
     * Evaluate one condition against one row
     */
    public boolean matches(Map<String, Object> row, FilterCondition condition) {
        return new CompiledCondition(condition).test(row);
    }

    private boolean matchesAll(Map<String, Object> row, List<CompiledCondition> conditions) {
        for (CompiledCondition condition : conditions) {
            if (!condition.test(row)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Multi-key comparator: nulls first ascending, last descending
     */
    public static Comparator<Map<String, Object>> comparator(List<SortColumn> sort) {
        Comparator<Map<String, Object>> comparator = null;
        for (SortColumn key : sort) {
            Comparator<Map<String, Object>> next = Values.byColumn(key.getColumn(), key.isAscending());
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator != null ? comparator : (a, b) -> 0;
    }

    private void requireColumn(ResultTable table, String column, String role) {
        if (!table.hasColumn(column)) {
            throw new PlanningException("Unknown " + role + " column '" + column + "', available: " + table.getColumns());
        }
    }

    /**
     * Condition with its LIKE pattern compiled once per execution
     */
    private static final class CompiledCondition {
        private final FilterCondition condition;
        private final LikePattern likePattern;

        private CompiledCondition(FilterCondition condition) {
            this.condition = condition;
            FilterOperator op = condition.getOperator();
            if ((op == FilterOperator.LIKE || op == FilterOperator.NOT_LIKE) && condition.getValue() != null) {
                this.likePattern = LikePattern.compile(String.valueOf(condition.getValue()));
            } else {
                this.likePattern = null;
            }
        }

        boolean test(Map<String, Object> row) {
            Object actual = row.get(condition.getColumn());
            Object expected = condition.getValue();

            switch (condition.getOperator()) {
                case IS_NULL:
                    return actual == null;
                case IS_NOT_NULL:
                    return actual != null;
                default:
                    break;
            }

            if (actual == null) {
                return false;
            }

            switch (condition.getOperator()) {
                case EQUAL:
                    return Values.equal(actual, expected);
                case NOT_EQUAL:
                    return expected != null && !Values.equal(actual, expected);
                case GREATER_THAN:
                    return expected != null && Values.compare(actual, expected) > 0;
                case LESS_THAN:
                    return expected != null && Values.compare(actual, expected) < 0;
                case GREATER_THAN_OR_EQUAL:
                    return expected != null && Values.compare(actual, expected) >= 0;
                case LESS_THAN_OR_EQUAL:
                    return expected != null && Values.compare(actual, expected) <= 0;
                case LIKE:
                    return likePattern != null && likePattern.matches(String.valueOf(actual));
                case NOT_LIKE:
                    return likePattern != null && !likePattern.matches(String.valueOf(actual));
                case IN:
                    return containsValue(condition.getValues(), actual);
                case NOT_IN:
                    return !condition.getValues().contains(null) && !containsValue(condition.getValues(), actual);
                case BETWEEN:
                    Object low = condition.getValues().get(0);
                    Object high = condition.getValues().get(1);
                    return low != null && high != null
                        && Values.compare(actual, low) >= 0
                        && Values.compare(actual, high) <= 0;
                default:
                    throw new IllegalStateException("Unhandled operator " + condition.getOperator());
            }
        }

        private static boolean containsValue(List<Object> candidates, Object actual) {
            for (Object candidate : candidates) {
                if (Values.equal(actual, candidate)) {
                    return true;
                }
            }
            return false;
        }
    }
}
