package com.tessera.join;

import com.tessera.domain.HandlerResponse;
import com.tessera.domain.PredictorDescriptor;
import com.tessera.domain.QueryResponse;
import com.tessera.domain.ResultTable;
import com.tessera.domain.Values;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.handler.DataHandler;
import com.tessera.handler.HandlerRegistry;
import com.tessera.predictor.Predictor;
import com.tessera.predictor.PredictorRegistry;
import com.tessera.predictor.WhereClauseInputHandler;
import com.tessera.query.ConditionExtractor;
import com.tessera.query.FilterCondition;
import com.tessera.query.FilterOperator;
import com.tessera.query.QueryExecutor;
import com.tessera.query.QueryMetrics;
import com.tessera.query.QueryPlan;
import com.tessera.query.SubQuery;
import com.tessera.query.ast.Expression;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.JoinClause;
import com.tessera.query.ast.OrderByItem;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.Star;
import com.tessera.query.ast.TableIdentifier;
import com.tessera.query.ast.TableReference;
import com.tessera.query.pushdown.PushdownTranslator;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Plans and runs statements that read from a predictor.
 *
 * Two shapes are handled:
 * - {@code data_table JOIN predictor}: input rows are fetched from the data side,
 *   sent to the predictor and merged row by row with its output
 * - {@code SELECT ... FROM predictor WHERE col = v}: input rows are built from the WHERE clause
 *
 * For time-series predictors the input is fetched per group and per time slice so
 * that every group gets the latest {@code window} rows before the cutoff, in
 * chronological order. Execution walks the states of {@link JoinState}; every
 * transition is logged at debug level.
 */
@Service
public class PredictorJoinPlanner {

    private static final Logger log = LoggerFactory.getLogger(PredictorJoinPlanner.class);

    /**
     * Prediction columns produced next to the targets
     */
    private static final Set<String> STANDARD_OUTPUTS = Set.of("original_index", "confidence", "lower", "upper");

    private final HandlerRegistry handlerRegistry;
    private final PredictorRegistry predictorRegistry;
    private final QueryExecutor queryExecutor;
    private final ResultMerger merger;
    private final ResultPersister persister;
    private final PushdownTranslator translator;
    private final QueryMetrics metrics;
    private final String modelNamespace;

    public PredictorJoinPlanner(HandlerRegistry handlerRegistry,
                                PredictorRegistry predictorRegistry,
                                QueryExecutor queryExecutor,
                                ResultMerger merger,
                                ResultPersister persister,
                                PushdownTranslator translator,
                                QueryMetrics metrics,
                                @Value("${tessera.join.model-namespace:models}") String modelNamespace) {
        this.handlerRegistry = handlerRegistry;
        this.predictorRegistry = predictorRegistry;
        this.queryExecutor = queryExecutor;
        this.merger = merger;
        this.persister = persister;
        this.translator = translator;
        this.metrics = metrics;
        this.modelNamespace = modelNamespace;
    }

    /**
     * Predictor named by a table reference: {@code name} or {@code <model-namespace>.name}
     */
    public Optional<Predictor> resolvePredictor(TableReference reference) {
        if (!(reference instanceof TableIdentifier)) {
            return Optional.empty();
        }
        List<String> parts = ((TableIdentifier) reference).getParts();
        if (parts.size() == 1) {
            return predictorRegistry.get(parts.get(0));
        }
        if (parts.size() == 2 && parts.get(0).equalsIgnoreCase(modelNamespace)) {
            return predictorRegistry.get(parts.get(1));
        }
        return Optional.empty();
    }

    /**
     * Whether the statement joins a table with a predictor
     */
    public boolean isPredictorJoin(SelectStatement select) {
        if (!(select.getFrom() instanceof JoinClause)) {
            return false;
        }
        JoinClause join = (JoinClause) select.getFrom();
        return resolvePredictor(join.getLeft()).isPresent() || resolvePredictor(join.getRight()).isPresent();
    }

    /**
     * Whether the statement selects directly from a predictor
     */
    public boolean isPredictorQuery(SelectStatement select) {
        return resolvePredictor(select.getFrom()).isPresent();
    }

    /**
     * Plan and run a predictor join
     */
    public QueryResponse execute(SelectStatement select) {
        JoinPlan plan;
        try {
            plan = plan(select);
        } catch (RuntimeException e) {
            transition(JoinState.IDENTIFY_SIDES, JoinState.ERROR);
            throw e;
        }
        metrics.recordJoinPlan(plan.isTimeseries());
        return run(plan, plan.isTimeseries() ? JoinState.TS_PLAN : JoinState.NON_TS_PLAN);
    }

    /**
     * Plan and run a direct predictor query
     */
    public QueryResponse executeDirect(SelectStatement select) {
        JoinPlan plan;
        try {
            plan = planDirect(select);
        } catch (RuntimeException e) {
            transition(JoinState.IDENTIFY_SIDES, JoinState.ERROR);
            throw e;
        }
        metrics.recordDirectPredictPlan();
        return run(plan, JoinState.NON_TS_PLAN);
    }

    /**
     * Build the plan of a predictor join without executing it. Partition enumeration
     * for grouped time-series predictors queries the data handler.
     *
     * @throws PlanningException if the statement cannot be planned
     */
    public JoinPlan plan(SelectStatement select) {
        if (!(select.getFrom() instanceof JoinClause)) {
            throw new PlanningException("Expected a join with a predictor: " + select.getFrom());
        }
        JoinClause join = (JoinClause) select.getFrom();
        if (!(join.getLeft() instanceof TableIdentifier) || !(join.getRight() instanceof TableIdentifier)) {
            throw new PlanningException("A predictor join takes exactly one table and one predictor");
        }
        TableIdentifier left = (TableIdentifier) join.getLeft();
        TableIdentifier right = (TableIdentifier) join.getRight();
        Optional<Predictor> leftPredictor = resolvePredictor(left);
        Optional<Predictor> rightPredictor = resolvePredictor(right);
        if (leftPredictor.isPresent() == rightPredictor.isPresent()) {
            throw new PlanningException(leftPredictor.isPresent()
                ? "Joining two predictors is not supported"
                : "Neither side of the join is a predictor");
        }

        Predictor predictor = leftPredictor.orElseGet(rightPredictor::get);
        TableIdentifier predictorTable = leftPredictor.isPresent() ? left : right;
        TableIdentifier dataTable = leftPredictor.isPresent() ? right : left;
        if (!dataTable.isQualified()) {
            throw new PlanningException("Table '" + dataTable.getName() + "' must be qualified with its integration");
        }
        DataHandler handler = handlerRegistry.require(dataTable.getQualifier());

        JoinSide predictorSide = JoinSide.predictor(predictorTable, predictor.getName());
        JoinSide dataSide = JoinSide.data(dataTable);
        if (predictorSide.getAlias().equalsIgnoreCase(dataSide.getAlias())) {
            throw new PlanningException("Both sides of the join are named '" + dataSide.getAlias() + "'; give them aliases");
        }
        log.debug("Join sides: {} and {}", dataSide, predictorSide);

        PredictorDescriptor descriptor = predictor.getDescriptor();
        if (descriptor.isTimeseries()) {
            rejectUnsupportedTimeseriesClauses(select, descriptor);
        }

        List<Expression> dataConjuncts = new ArrayList<>();
        List<Expression> postConjuncts = new ArrayList<>();
        for (Expression conjunct : ConditionExtractor.splitConjuncts(select.getWhere())) {
            if (referencesSide(conjunct, predictorSide, dataSide)) {
                postConjuncts.add(conjunct);
            } else {
                dataConjuncts.add(stripQualifiers(conjunct));
            }
        }

        JoinPlan.Builder builder = JoinPlan.builder()
            .sides(predictorSide, dataSide)
            .dataHandler(handler)
            .predictor(predictor)
            .targets(select.getTargets())
            .into(select.getInto());

        if (descriptor.isTimeseries()) {
            transition(JoinState.IDENTIFY_SIDES, JoinState.TS_PLAN);
            planTimeseries(builder, select, descriptor, dataSide, predictorSide, handler, dataConjuncts);
            builder.postMerge(postConjuncts, List.of(), null, select.getLimit());
        } else {
            transition(JoinState.IDENTIFY_SIDES, JoinState.NON_TS_PLAN);
            boolean sortAfterMerge = select.getOrderBy().stream()
                .anyMatch(item -> referencesSide(item.getExpression(), predictorSide, dataSide));
            boolean afterMerge = !postConjuncts.isEmpty() || sortAfterMerge;

            SelectStatement dataQuery = SelectStatement.builder()
                .targets(dataTargets(select, descriptor, dataSide, predictorSide))
                .from(dataSide.relativeTable())
                .where(ConditionExtractor.joinConjuncts(dataConjuncts))
                .groupBy(strip(select.getGroupBy()))
                .having(select.getHaving() != null ? stripQualifiers(select.getHaving()) : null)
                .orderBy(sortAfterMerge ? List.of() : stripOrder(select.getOrderBy()))
                .limit(afterMerge ? null : select.getLimit())
                .offset(afterMerge ? null : select.getOffset())
                .distinct(select.isDistinct())
                .build();
            QueryPlan queryPlan = new QueryPlan();
            queryPlan.addSubQuery(new SubQuery(dataQuery));
            builder.queryPlan(queryPlan);
            builder.postMerge(postConjuncts,
                sortAfterMerge ? select.getOrderBy() : List.of(),
                afterMerge ? select.getOffset() : null,
                afterMerge ? select.getLimit() : null);
        }

        JoinPlan plan = builder.build();
        log.info("Planned predictor join: {}", plan);
        return plan;
    }

    /**
     * Build the plan of a direct predictor query; input rows come from the WHERE clause
     *
     * @throws PlanningException if a condition is anything but {@code =} or {@code IN}
     */
    public JoinPlan planDirect(SelectStatement select) {
        Predictor predictor = resolvePredictor(select.getFrom())
            .orElseThrow(() -> new PlanningException("Unknown predictor " + select.getFrom()));
        TableIdentifier table = (TableIdentifier) select.getFrom();
        JoinSide predictorSide = JoinSide.predictor(table, predictor.getName());

        List<Expression> conjuncts = new ArrayList<>();
        for (Expression conjunct : ConditionExtractor.splitConjuncts(select.getWhere())) {
            Expression stripped = stripQualifiers(conjunct);
            FilterCondition condition = ConditionExtractor.toCondition(stripped);
            if (condition.getOperator() != FilterOperator.EQUAL && condition.getOperator() != FilterOperator.IN) {
                throw new PlanningException("Only = and IN conditions can supply predictor input, got " + condition);
            }
            conjuncts.add(stripped);
        }
        transition(JoinState.IDENTIFY_SIDES, JoinState.NON_TS_PLAN);

        SelectStatement inputQuery = SelectStatement.builder()
            .target(new Star())
            .from(TableIdentifier.of(predictor.getName()))
            .where(ConditionExtractor.joinConjuncts(conjuncts))
            .build();
        QueryPlan queryPlan = new QueryPlan();
        queryPlan.addSubQuery(new SubQuery(inputQuery, Map.of(), "input", null));

        JoinPlan plan = JoinPlan.builder()
            .sides(predictorSide, predictorSide)
            .dataHandler(new WhereClauseInputHandler(translator))
            .predictor(predictor)
            .queryPlan(queryPlan)
            .postMerge(List.of(), select.getOrderBy(), select.getOffset(), select.getLimit())
            .targets(select.getTargets())
            .into(select.getInto())
            .build();
        log.info("Planned direct predictor query: {}", plan);
        return plan;
    }

    private QueryResponse run(JoinPlan plan, JoinState planState) {
        long startTime = System.currentTimeMillis();
        JoinState state = planState;
        try {
            state = transition(state, JoinState.FETCH);
            ResultTable input = queryExecutor.fetch(plan.getQueryPlan(), plan.getDataHandler());

            state = transition(state, JoinState.INFER);
            ResultTable predictions = infer(plan.getPredictor(), input);

            state = transition(state, JoinState.MERGE);
            MergeResult merged = merger.merge(input, plan.getDataSide().getAlias(),
                predictions, plan.getPredictorSide().getAlias(),
                plan.getTargets(), plan.getPostMergeConditions(), plan.getPostMergeOrder(),
                plan.getFinalOffset(), plan.getFinalLimit());
            QueryResponse response = new QueryResponse(merged.getTable());

            if (plan.getInto() != null) {
                state = transition(state, JoinState.PERSIST);
                persister.persist(response, plan.getInto(),
                    OutputTypeMapper.columnTypes(merged.getTable(), merged.getPredictorColumns(),
                        plan.getPredictor().getDescriptor()),
                    merged.getTable());
            }

            transition(state, JoinState.DONE);
            response.setExecutionTimeMs(System.currentTimeMillis() - startTime);
            metrics.recordResultSize(merged.getTable().size());
            return response;
        } catch (RuntimeException e) {
            transition(state, JoinState.ERROR);
            throw e;
        }
    }

    /**
     * Run the predictor and realign its output on {@code original_index}
     */
    ResultTable infer(Predictor predictor, ResultTable input) {
        if (input.isEmpty()) {
            log.debug("No input rows for predictor {}, skipping inference", predictor.getName());
            return new ResultTable(predictor.getDescriptor().getTargets());
        }
        metrics.recordModelInputSize(input.size());
        Timer.Sample sample = metrics.startTimer();
        ResultTable output;
        try {
            output = predictor.predict(input);
        } finally {
            metrics.recordInferenceLatency(sample);
        }
        if (output.hasColumn("original_index")) {
            output = output.sortedBy("original_index");
        }
        if (output.size() != input.size()) {
            throw new QueryExecutionException("Predictor returned " + output.size() + " rows for "
                + input.size() + " input rows", predictor.getName());
        }
        return output;
    }

    private void planTimeseries(JoinPlan.Builder builder, SelectStatement select, PredictorDescriptor descriptor,
                                JoinSide dataSide, JoinSide predictorSide, DataHandler handler,
                                List<Expression> dataConjuncts) {
        String orderColumn = descriptor.getOrderByColumn();
        List<String> groupColumns = descriptor.getGroupByColumns();

        FilterCondition cutoff = null;
        Map<String, List<FilterCondition>> groupConditions = new LinkedHashMap<>();
        for (Expression conjunct : dataConjuncts) {
            FilterCondition condition = ConditionExtractor.toCondition(conjunct);
            if (condition.getColumn().equalsIgnoreCase(orderColumn)) {
                if (cutoff != null) {
                    throw new PlanningException("Only one condition on time column '" + orderColumn + "' is allowed");
                }
                cutoff = FilterCondition.of(orderColumn, condition.getOperator(), condition.getValue());
                continue;
            }
            String groupColumn = findColumn(groupColumns, condition.getColumn());
            if (groupColumn == null) {
                throw new PlanningException("Time-series predictor '" + descriptor.getName()
                    + "' input can only be filtered on '" + orderColumn + "' and group columns " + groupColumns
                    + ", got " + condition.getColumn());
            }
            groupConditions.computeIfAbsent(groupColumn, key -> new ArrayList<>())
                .add(FilterCondition.of(groupColumn, condition.getOperator(), condition.getValue()));
        }

        List<TimeSlice> slices = TimeSliceBuilder.build(orderColumn, cutoff);
        List<Map<String, Object>> partitions = groupColumns.isEmpty()
            ? List.of(Map.of())
            : enumeratePartitions(handler, dataSide.relativeTable(), groupColumns, groupConditions);
        List<Expression> targets = dataTargets(select, descriptor, dataSide, predictorSide);

        QueryPlan queryPlan = new QueryPlan();
        for (Map<String, Object> partition : partitions) {
            for (TimeSlice slice : slices) {
                List<Expression> where = new ArrayList<>();
                for (Map.Entry<String, Object> group : partition.entrySet()) {
                    where.add(ConditionExtractor.toExpression(group.getValue() == null
                        ? FilterCondition.isNull(group.getKey())
                        : FilterCondition.of(group.getKey(), FilterOperator.EQUAL, group.getValue())));
                }
                where.add(ConditionExtractor.toExpression(FilterCondition.isNotNull(orderColumn)));
                slice.getConditions().forEach(condition -> where.add(ConditionExtractor.toExpression(condition)));

                SelectStatement.Builder query = SelectStatement.builder()
                    .targets(targets)
                    .from(dataSide.relativeTable())
                    .where(ConditionExtractor.joinConjuncts(where));
                if (slice.isWindowed()) {
                    query.orderBy(OrderByItem.desc(Identifier.of(orderColumn))).limit(descriptor.getWindow());
                }
                queryPlan.addSubQuery(new SubQuery(query.build(), partition, slice.getLabel(), orderColumn));
            }
        }
        log.debug("Time-series plan for {}: {} partitions x {} slices", descriptor.getName(), partitions.size(), slices);
        builder.baseTimeFilter(cutoff).queryPlan(queryPlan);
    }

    /**
     * One partition per combination of group values. Values per column come from a
     * distinct query restricted by that column's conditions, sorted with nulls last.
     */
    List<Map<String, Object>> enumeratePartitions(DataHandler handler, TableIdentifier table,
                                                  List<String> groupColumns,
                                                  Map<String, List<FilterCondition>> groupConditions) {
        List<Map<String, Object>> partitions = new ArrayList<>();
        partitions.add(new LinkedHashMap<>());
        for (String column : groupColumns) {
            List<Object> values = distinctValues(handler, table, column, groupConditions.getOrDefault(column, List.of()));
            List<Map<String, Object>> next = new ArrayList<>();
            for (Map<String, Object> partition : partitions) {
                for (Object value : values) {
                    Map<String, Object> extended = new LinkedHashMap<>(partition);
                    extended.put(column, value);
                    next.add(extended);
                }
            }
            partitions = next;
        }
        return partitions;
    }

    private List<Object> distinctValues(DataHandler handler, TableIdentifier table, String column,
                                        List<FilterCondition> conditions) {
        List<Expression> where = new ArrayList<>();
        conditions.forEach(condition -> where.add(ConditionExtractor.toExpression(condition)));
        SelectStatement query = SelectStatement.builder()
            .target(Identifier.of(column))
            .from(table)
            .where(ConditionExtractor.joinConjuncts(where))
            .distinct(handler.getDescriptor().supportsNativeQuery())
            .build();

        HandlerResponse response = handler.runStructured(query);
        if (response.isError()) {
            metrics.recordHandlerError();
            throw response.toException(handler.getName(), query.toString());
        }
        ResultTable result = response.tableOrEmpty();
        String resultColumn = findColumn(result.getColumns(), column);
        if (resultColumn == null) {
            return List.of();
        }

        List<Object> values = new ArrayList<>();
        boolean hasNull = false;
        for (Object value : result.column(resultColumn)) {
            if (value == null) {
                hasNull = true;
            } else if (values.stream().noneMatch(seen -> Values.equal(seen, value))) {
                values.add(value);
            }
        }
        values.sort(Comparator.nullsLast(Values.NATURAL));
        if (hasNull) {
            values.add(null);
        }
        log.debug("Group column {} has {} values", column, values.size());
        return values;
    }

    /**
     * Columns requested from the data side
     */
    private List<Expression> dataTargets(SelectStatement select, PredictorDescriptor descriptor,
                                         JoinSide dataSide, JoinSide predictorSide) {
        if (!select.getGroupBy().isEmpty() || select.getHaving() != null) {
            List<Expression> grouped = new ArrayList<>();
            for (Expression target : select.getTargets()) {
                if (!referencesSide(target, predictorSide, dataSide)) {
                    grouped.add(stripQualifiers(target));
                }
            }
            return grouped;
        }
        for (Expression target : select.getTargets()) {
            if (target instanceof Star
                && (((Star) target).getQualifier() == null || dataSide.matches(((Star) target).getQualifier()))) {
                return List.of(new Star());
            }
        }
        if (descriptor.getInputColumns() == null) {
            return List.of(new Star());
        }

        Set<String> outputs = new LinkedHashSet<>();
        descriptor.getTargets().forEach(target -> outputs.add(target.toLowerCase(Locale.ROOT)));
        descriptor.getOutputTypes().keySet().forEach(column -> outputs.add(column.toLowerCase(Locale.ROOT)));
        outputs.addAll(STANDARD_OUTPUTS);

        Set<String> columns = new LinkedHashSet<>();
        for (Expression target : select.getTargets()) {
            for (Identifier identifier : ConditionExtractor.identifiers(target)) {
                if (identifier.isQualified()
                    ? dataSide.matches(identifier.getQualifier())
                    : !outputs.contains(identifier.getName().toLowerCase(Locale.ROOT))) {
                    columns.add(identifier.getName());
                }
            }
        }
        columns.addAll(descriptor.getInputColumns());
        if (descriptor.isTimeseries()) {
            columns.add(descriptor.getOrderByColumn());
            columns.addAll(descriptor.getGroupByColumns());
        }
        List<Expression> targets = new ArrayList<>();
        columns.forEach(column -> targets.add(Identifier.of(column)));
        return targets;
    }

    private void rejectUnsupportedTimeseriesClauses(SelectStatement select, PredictorDescriptor descriptor) {
        String name = descriptor.getName();
        if (!select.getGroupBy().isEmpty()) {
            throw new PlanningException("GROUP BY is not supported with time-series predictor '" + name + "'");
        }
        if (select.getHaving() != null) {
            throw new PlanningException("HAVING is not supported with time-series predictor '" + name + "'");
        }
        if (select.getOffset() != null) {
            throw new PlanningException("OFFSET is not supported with time-series predictor '" + name + "'");
        }
        if (!select.getOrderBy().isEmpty()) {
            throw new PlanningException("ORDER BY is not supported with time-series predictor '" + name
                + "'; rows are ordered by '" + descriptor.getOrderByColumn() + "'");
        }
    }

    /**
     * True when the expression references the predictor side; a mix of both sides is rejected
     */
    private boolean referencesSide(Expression expression, JoinSide predictorSide, JoinSide dataSide) {
        boolean predictor = false;
        boolean data = false;
        for (Identifier identifier : ConditionExtractor.identifiers(expression)) {
            String qualifier = identifier.getQualifier();
            if (qualifier == null || dataSide.matches(qualifier)) {
                data = true;
            } else if (predictorSide.matches(qualifier) || qualifier.equalsIgnoreCase(modelNamespace)) {
                predictor = true;
            } else {
                throw new PlanningException("Unknown table '" + qualifier + "' in " + expression);
            }
        }
        if (predictor && data) {
            throw new PlanningException("Condition mixes table and predictor columns: " + expression);
        }
        return predictor;
    }

    private static Expression stripQualifiers(Expression expression) {
        return ConditionExtractor.mapIdentifiers(expression,
            identifier -> new Identifier(List.of(identifier.getName()), identifier.getAlias()));
    }

    private static List<Expression> strip(List<Expression> expressions) {
        List<Expression> stripped = new ArrayList<>();
        expressions.forEach(expression -> stripped.add(stripQualifiers(expression)));
        return stripped;
    }

    private static List<OrderByItem> stripOrder(List<OrderByItem> items) {
        List<OrderByItem> stripped = new ArrayList<>();
        items.forEach(item -> stripped.add(new OrderByItem(stripQualifiers(item.getExpression()), item.isAscending())));
        return stripped;
    }

    private static String findColumn(List<String> columns, String name) {
        for (String column : columns) {
            if (column.equalsIgnoreCase(name)) {
                return column;
            }
        }
        return null;
    }

    private JoinState transition(JoinState from, JoinState to) {
        log.debug("Predictor query {} -> {}", from, to);
        return to;
    }
}
