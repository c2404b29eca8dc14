package com.tessera.query.pushdown;

import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;

import java.util.List;

/**
 * Handler-specific translation of filters, sort and limit into a native request.
 *
 * @param <Q> native request type, e.g. a SQL builder or a search source
 */
public interface PushdownAdapter<Q> {

    /**
     * Start an empty native request against one table
     */
    Q newRequest(String table);

    /**
     * Fold a condition into the request if the back end can evaluate it exactly.
     *
     * @return true if the condition was folded in; false leaves the request unchanged
     */
    boolean tryPushCondition(Q request, FilterCondition condition);

    /**
     * Whether the back end can sort on this column natively
     */
    boolean isNativeField(Q request, String column);

    /**
     * Apply a sort whose every column is native
     */
    void applySort(Q request, List<SortColumn> sort);

    /**
     * Set the maximum number of rows to return; null asks for the whole result
     */
    void applyLimit(Q request, Integer limit);

    /**
     * Native text of the request for logging and error context
     */
    default String describe(Q request) {
        return String.valueOf(request);
    }
}
