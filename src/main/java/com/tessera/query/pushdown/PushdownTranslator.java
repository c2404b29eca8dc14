package com.tessera.query.pushdown;

import com.tessera.domain.HandlerDescriptor;
import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * PushdownTranslator decides, per condition, sort and limit, what a handler
 * evaluates natively and what remains for the local executor.
 *
 * Rules:
 * - A condition is offered to the adapter only if the handler declares filter pushdown.
 *   Accepted conditions are marked applied; rejected ones (or ones whose adapter call
 *   throws) stay residual. Every input condition ends up in exactly one of the two lists.
 * - Sort is pushed only if the handler declares sort pushdown and every sort column is
 *   a native field. There is no partial sort pushdown.
 * - The limit is pushed exactly only if the handler declares limit pushdown and nothing
 *   else (filter, sort, offset) remains residual. With residual filters the handler is
 *   asked for an over-fetch batch of {@code max(limit, 1) * K} rows instead. A residual
 *   sort forces an unbounded fetch, since a batch would not contain the true top rows.
 */
@Component
public class PushdownTranslator {

    private static final Logger log = LoggerFactory.getLogger(PushdownTranslator.class);

    private final int overfetchFactor;

    public PushdownTranslator(@Value("${tessera.pushdown.overfetch-factor:4}") int overfetchFactor) {
        if (overfetchFactor < 1) {
            throw new IllegalArgumentException("Over-fetch factor must be at least 1, got " + overfetchFactor);
        }
        this.overfetchFactor = overfetchFactor;
    }

    public int getOverfetchFactor() {
        return overfetchFactor;
    }

    public <Q> PushdownResult<Q> translate(String table,
                                           List<FilterCondition> conditions,
                                           List<SortColumn> sort,
                                           Integer limit,
                                           PushdownAdapter<Q> adapter,
                                           HandlerDescriptor descriptor) {
        return translate(table, conditions, sort, limit, null, adapter, descriptor);
    }

    /**
     * Translate a query into a native request and its residual part
     *
     * @param table handler-relative table name
     * @param conditions conjunctive conditions; accepted ones are marked applied
     * @param sort requested sort, may be empty
     * @param limit requested limit, or null
     * @param offset requested offset, or null
     * @param adapter the handler's native translation
     * @param descriptor the handler's declared capabilities
     */
    public <Q> PushdownResult<Q> translate(String table,
                                           List<FilterCondition> conditions,
                                           List<SortColumn> sort,
                                           Integer limit,
                                           Integer offset,
                                           PushdownAdapter<Q> adapter,
                                           HandlerDescriptor descriptor) {
        Q request = adapter.newRequest(table);

        List<FilterCondition> pushed = new ArrayList<>();
        List<FilterCondition> residual = new ArrayList<>();
        for (FilterCondition condition : conditions) {
            if (descriptor.supportsPushdownFilter() && offer(adapter, request, condition, descriptor)) {
                condition.markApplied();
                pushed.add(condition);
            } else {
                residual.add(condition);
            }
        }

        List<SortColumn> requestedSort = sort != null ? sort : List.of();
        boolean sortPushed = false;
        List<SortColumn> residualSort = requestedSort;
        if (!requestedSort.isEmpty() && descriptor.supportsPushdownSort()
            && requestedSort.stream().allMatch(key -> adapter.isNativeField(request, key.getColumn()))) {
            adapter.applySort(request, requestedSort);
            sortPushed = true;
            residualSort = List.of();
        }

        boolean hasOffset = offset != null && offset > 0;
        Integer nativeLimit = null;
        Integer residualLimit = limit;
        Integer residualOffset = hasOffset ? offset : null;
        boolean overFetch = false;

        if (limit != null && descriptor.supportsPushdownLimit()) {
            if (residual.isEmpty() && residualSort.isEmpty() && !hasOffset) {
                nativeLimit = limit;
                residualLimit = null;
            } else if (residualSort.isEmpty()) {
                int wanted = Math.max(limit + (hasOffset ? offset : 0), 1);
                nativeLimit = (int) Math.min((long) wanted * overfetchFactor, Integer.MAX_VALUE);
                overFetch = true;
            }
        }
        adapter.applyLimit(request, nativeLimit);

        PushdownResult<Q> result = new PushdownResult<>(request, pushed, residual, residualSort, sortPushed,
            nativeLimit, residualLimit, residualOffset, overFetch);
        log.debug("Translated query on {}.{}: {}", descriptor.getName(), table, result);
        return result;
    }

    private <Q> boolean offer(PushdownAdapter<Q> adapter, Q request, FilterCondition condition,
                              HandlerDescriptor descriptor) {
        try {
            return adapter.tryPushCondition(request, condition);
        } catch (RuntimeException e) {
            log.debug("Handler {} rejected condition {} with {}: {}",
                descriptor.getName(), condition, e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }
}
