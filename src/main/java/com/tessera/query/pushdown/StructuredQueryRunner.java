package com.tessera.query.pushdown;

import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.query.ConditionExtractor;
import com.tessera.query.FilterCondition;
import com.tessera.query.QueryMetrics;
import com.tessera.query.SortColumn;
import com.tessera.query.ast.Expression;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.Star;
import com.tessera.query.ast.TableIdentifier;
import com.tessera.query.local.LocalQueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * StructuredQueryRunner executes one single-table SELECT against a handler that
 * exposes a {@link PushdownAdapter}.
 *
 * This runner:
 * - Extracts conditions, sort and limit from the statement
 * - Translates them into a native request plus a residual part
 * - Fetches, growing the batch by the over-fetch factor while residual filtering
 *   leaves fewer rows than the limit and the handler still has rows
 * - Applies the residual part and the target projection locally
 *
 * GROUP BY, HAVING, DISTINCT and aggregate targets need the whole input and are
 * rejected here; handlers with native query support render those statements themselves.
 */
@Component
public class StructuredQueryRunner {

    private static final Logger log = LoggerFactory.getLogger(StructuredQueryRunner.class);

    private final PushdownTranslator translator;
    private final LocalQueryExecutor localExecutor;
    private final QueryMetrics metrics;
    private final int maxBatchSize;

    public StructuredQueryRunner(PushdownTranslator translator,
                                 LocalQueryExecutor localExecutor,
                                 QueryMetrics metrics,
                                 @Value("${tessera.pushdown.max-batch-size:100000}") int maxBatchSize) {
        this.translator = translator;
        this.localExecutor = localExecutor;
        this.metrics = metrics;
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Run a statement through the pushdown pipeline
     *
     * @param select statement whose FROM is a handler-relative table
     * @param descriptor capabilities of the target handler
     * @param adapter native translation of the target handler
     * @param fetcher executes native requests
     * @return the fully reconciled result
     * @throws PlanningException if the statement shape cannot be reconciled locally
     * @throws Exception whatever the fetcher raises
     */
    public <Q> ResultTable run(SelectStatement select,
                               HandlerDescriptor descriptor,
                               PushdownAdapter<Q> adapter,
                               RequestFetcher<Q> fetcher) throws Exception {
        if (select.hasAggregation()) {
            throw new PlanningException("GROUP BY, HAVING, DISTINCT and aggregates cannot be evaluated on handler "
                + descriptor.getName() + " without native query support");
        }
        String table = tableName(select);
        List<FilterCondition> conditions = ConditionExtractor.extractConditions(select.getWhere());
        List<SortColumn> sort = ConditionExtractor.extractSort(select.getOrderBy());

        PushdownResult<Q> pushdown = translator.translate(table, conditions, sort,
            select.getLimit(), select.getOffset(), adapter, descriptor);
        metrics.recordConditions(pushdown.getPushedConditions().size(), pushdown.getResidualConditions().size());

        ResultTable fetched = fetcher.fetch(pushdown.getRequest());
        if (pushdown.isOverFetch()) {
            fetched = growUntilSatisfied(pushdown, adapter, fetcher, fetched, descriptor);
        }

        if (fetched.getColumns().isEmpty()) {
            return new ResultTable(projectedNames(select.getTargets()));
        }

        ResultTable reconciled = localExecutor.apply(fetched,
            pushdown.getResidualConditions(),
            pushdown.getResidualSort(),
            pushdown.getResidualOffset(),
            pushdown.getResidualLimit(),
            null);
        return project(reconciled, select.getTargets());
    }

    private <Q> ResultTable growUntilSatisfied(PushdownResult<Q> pushdown,
                                               PushdownAdapter<Q> adapter,
                                               RequestFetcher<Q> fetcher,
                                               ResultTable fetched,
                                               HandlerDescriptor descriptor) throws Exception {
        int batch = pushdown.getNativeLimit();
        int required = pushdown.requiredRows();
        Q request = pushdown.getRequest();

        while (fetched.size() >= batch && countSurviving(fetched, pushdown) < required) {
            long next = (long) batch * translator.getOverfetchFactor();
            metrics.recordOverfetchIteration();
            if (next > maxBatchSize) {
                log.debug("Over-fetch on {} reached the batch cap of {}, fetching the full result",
                    descriptor.getName(), maxBatchSize);
                adapter.applyLimit(request, null);
                return fetcher.fetch(request);
            }
            batch = (int) next;
            log.debug("Over-fetch on {}: growing batch to {} rows", descriptor.getName(), batch);
            adapter.applyLimit(request, batch);
            fetched = fetcher.fetch(request);
        }
        return fetched;
    }

    private int countSurviving(ResultTable fetched, PushdownResult<?> pushdown) {
        if (fetched.getColumns().isEmpty()) {
            return 0;
        }
        return localExecutor.filter(fetched, pushdown.getResidualConditions()).size();
    }

    /**
     * Apply the select list: {@code *} keeps everything, identifiers are selected and aliased
     */
    public static ResultTable project(ResultTable table, List<Expression> targets) {
        if (targets.stream().anyMatch(Star.class::isInstance)) {
            return table;
        }
        List<String> names = new ArrayList<>();
        Map<String, String> aliases = new HashMap<>();
        for (Expression target : targets) {
            Identifier identifier = (Identifier) target;
            if (!table.hasColumn(identifier.getName())) {
                throw new PlanningException("Unknown column '" + identifier.getName() + "', available: "
                    + table.getColumns());
            }
            names.add(identifier.getName());
            if (identifier.getAlias() != null) {
                aliases.put(identifier.getName(), identifier.getAlias());
            }
        }
        ResultTable projected = table.project(names);
        return aliases.isEmpty() ? projected : projected.renameColumns(name -> aliases.getOrDefault(name, name));
    }

    private static List<String> projectedNames(List<Expression> targets) {
        List<String> names = new ArrayList<>();
        for (Expression target : targets) {
            if (target instanceof Star) {
                return List.of();
            }
            if (!(target instanceof Identifier)) {
                throw new PlanningException("Unsupported select target: " + target);
            }
            Identifier identifier = (Identifier) target;
            names.add(identifier.getAlias() != null ? identifier.getAlias() : identifier.getName());
        }
        return names;
    }

    private static String tableName(SelectStatement select) {
        if (!(select.getFrom() instanceof TableIdentifier)) {
            throw new PlanningException("Structured queries must select from a single table: " + select.getFrom());
        }
        for (Expression target : select.getTargets()) {
            if (!(target instanceof Identifier) && !(target instanceof Star)) {
                throw new PlanningException("Unsupported select target: " + target);
            }
        }
        return String.join(".", ((TableIdentifier) select.getFrom()).getParts());
    }
}
