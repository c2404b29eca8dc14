package com.tessera.query.pushdown;

import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of translating a query for one handler: the native request plus
 * everything that must still be applied locally.
 *
 * @param <Q> native request type
 */
public class PushdownResult<Q> {

    private final Q request;
    private final List<FilterCondition> pushedConditions;
    private final List<FilterCondition> residualConditions;
    private final List<SortColumn> residualSort;
    private final boolean sortPushed;
    private final Integer nativeLimit;
    private final Integer residualLimit;
    private final Integer residualOffset;
    private final boolean overFetch;

    PushdownResult(Q request,
                   List<FilterCondition> pushedConditions,
                   List<FilterCondition> residualConditions,
                   List<SortColumn> residualSort,
                   boolean sortPushed,
                   Integer nativeLimit,
                   Integer residualLimit,
                   Integer residualOffset,
                   boolean overFetch) {
        this.request = request;
        this.pushedConditions = Collections.unmodifiableList(pushedConditions);
        this.residualConditions = Collections.unmodifiableList(residualConditions);
        this.residualSort = Collections.unmodifiableList(residualSort);
        this.sortPushed = sortPushed;
        this.nativeLimit = nativeLimit;
        this.residualLimit = residualLimit;
        this.residualOffset = residualOffset;
        this.overFetch = overFetch;
    }

    public Q getRequest() {
        return request;
    }

    public List<FilterCondition> getPushedConditions() {
        return pushedConditions;
    }

    public List<FilterCondition> getResidualConditions() {
        return residualConditions;
    }

    public List<SortColumn> getResidualSort() {
        return residualSort;
    }

    public boolean isSortPushed() {
        return sortPushed;
    }

    /**
     * Row count requested from the handler, null for an unbounded fetch
     */
    public Integer getNativeLimit() {
        return nativeLimit;
    }

    /**
     * Limit still to be applied locally, null when the handler enforces it exactly
     */
    public Integer getResidualLimit() {
        return residualLimit;
    }

    public Integer getResidualOffset() {
        return residualOffset;
    }

    /**
     * True when the native limit is a batch size that may have to grow
     */
    public boolean isOverFetch() {
        return overFetch;
    }

    /**
     * Rows that must survive local filtering for the result to be complete
     */
    public int requiredRows() {
        int offset = residualOffset != null ? residualOffset : 0;
        return residualLimit != null ? offset + residualLimit : Integer.MAX_VALUE;
    }

    public boolean isLimitExact() {
        return nativeLimit != null && !overFetch;
    }

    @Override
    public String toString() {
        return "PushdownResult{" +
            "pushed=" + pushedConditions.size() +
            ", residual=" + residualConditions.size() +
            ", sortPushed=" + sortPushed +
            ", nativeLimit=" + nativeLimit +
            ", residualLimit=" + residualLimit +
            ", overFetch=" + overFetch +
            '}';
    }
}
