package com.tessera.query;

import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResponseType;
import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.handler.DataHandler;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Executes the sub-queries of a plan against one handler and concatenates the results.
 *
 * This service:
 * - Runs sub-queries in plan order, or fans them out with bounded parallelism
 *   when {@code tessera.join.parallel-fetch} is enabled
 * - Reassembles results in plan order either way
 * - Re-orders each slice by its resort column before concatenation
 * - Fails the whole fetch on the first ERROR response; nothing fetched so far is returned
 */
@Service
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final QueryMetrics metrics;
    private final boolean parallelFetch;
    private final int maxParallelism;

    public QueryExecutor(QueryMetrics metrics,
                         @Value("${tessera.join.parallel-fetch:false}") boolean parallelFetch,
                         @Value("${tessera.join.max-parallelism:4}") int maxParallelism) {
        this.metrics = metrics;
        this.parallelFetch = parallelFetch;
        this.maxParallelism = Math.max(1, maxParallelism);
        log.info("QueryExecutor initialized (parallelFetch={}, maxParallelism={})", parallelFetch, this.maxParallelism);
    }

    /**
     * Fetch every sub-query of the plan from the handler
     *
     * @param plan ordered sub-queries
     * @param handler handler owning the queried table
     * @return the concatenated results, in plan order
     * @throws QueryExecutionException if any sub-query returns an ERROR response
     * @throws PlanningException if the handler rejected a sub-query as unplannable
     */
    public ResultTable fetch(QueryPlan plan, DataHandler handler) {
        if (plan == null || plan.isEmpty()) {
            log.debug("Empty query plan, returning empty result");
            return ResultTable.empty();
        }
        Timer.Sample sample = metrics.startTimer();
        try {
            ResultTable result = parallelFetch && plan.size() > 1
                ? fetchParallel(plan.getSubQueries(), handler)
                : fetchSequential(plan.getSubQueries(), handler);
            log.debug("Fetched {} rows from {} in {} sub-queries", result.size(), handler.getName(), plan.size());
            return result;
        } finally {
            metrics.recordFetchLatency(sample);
        }
    }

    private ResultTable fetchSequential(List<SubQuery> subQueries, DataHandler handler) {
        ResultTable result = null;
        for (SubQuery subQuery : subQueries) {
            ResultTable part = execute(subQuery, handler);
            result = result == null ? part : result.concat(part);
        }
        return result;
    }

    private ResultTable fetchParallel(List<SubQuery> subQueries, DataHandler handler) {
        return Flux.fromIterable(subQueries)
            .flatMapSequential(subQuery -> Mono.fromCallable(() -> execute(subQuery, handler))
                .subscribeOn(Schedulers.boundedElastic()), maxParallelism)
            .reduce(ResultTable::concat)
            .defaultIfEmpty(ResultTable.empty())
            .block();
    }

    /**
     * Run one sub-query; OK responses contribute no rows
     */
    ResultTable execute(SubQuery subQuery, DataHandler handler) {
        metrics.recordSubQueryExecuted();
        log.debug("Executing {} on {}", subQuery, handler.getName());

        HandlerResponse response = handler.runStructured(subQuery.getSelect());
        if (response.isError()) {
            metrics.recordHandlerError();
            log.error("Sub-query {} failed on {}: {}", subQuery.getLabel(), handler.getName(), response.getErrorMessage());
            throw response.toException(handler.getName(), subQuery.getSelect().toString());
        }
        if (response.getType() == ResponseType.OK || response.getTable() == null) {
            return ResultTable.empty();
        }

        ResultTable table = response.getTable();
        if (subQuery.getResortColumn() != null && table.hasColumn(subQuery.getResortColumn())) {
            table = table.sortedBy(subQuery.getResortColumn());
        }
        return table;
    }
}
