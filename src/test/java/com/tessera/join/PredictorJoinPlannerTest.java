package com.tessera.join;

import com.tessera.domain.PredictorDescriptor;
import com.tessera.domain.QueryResponse;
import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.handler.HandlerRegistry;
import com.tessera.handler.memory.InMemoryDataHandler;
import com.tessera.predictor.Predictor;
import com.tessera.predictor.PredictorRegistry;
import com.tessera.query.ConditionExtractor;
import com.tessera.query.FilterCondition;
import com.tessera.query.FilterOperator;
import com.tessera.query.QueryExecutor;
import com.tessera.query.QueryMetrics;
import com.tessera.query.SubQuery;
import com.tessera.query.ast.BinaryOperation;
import com.tessera.query.ast.Constant;
import com.tessera.query.ast.ConstantList;
import com.tessera.query.ast.Expression;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.JoinClause;
import com.tessera.query.ast.OrderByItem;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.TableIdentifier;
import com.tessera.query.local.LocalQueryExecutor;
import com.tessera.query.pushdown.PushdownTranslator;
import com.tessera.query.pushdown.StructuredQueryRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PredictorJoinPlanner against an in-memory integration and scripted predictors
 */
@DisplayName("PredictorJoinPlanner Tests")
class PredictorJoinPlannerTest {

    private QueryMetrics metrics;
    private PredictorRegistry predictors;
    private PredictorJoinPlanner planner;
    private ScriptedPredictor forecast;
    private ScriptedPredictor home;

    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        PushdownTranslator translator = new PushdownTranslator(4);
        LocalQueryExecutor localExecutor = new LocalQueryExecutor();
        InMemoryDataHandler files = new InMemoryDataHandler("files",
            new StructuredQueryRunner(translator, localExecutor, metrics, 100_000));

        ResultTable sales = new ResultTable(List.of("country", "saledate", "amount"));
        for (int day = 1; day <= 6; day++) {
            sales.addRow(row("country", "US", "saledate", day, "amount", (double) day));
        }
        for (int day = 1; day <= 3; day++) {
            sales.addRow(row("country", "FR", "saledate", day, "amount", (double) day));
        }
        files.registerTable("sales", sales);

        ResultTable homes = new ResultTable(List.of("sqft", "location"));
        homes.addRow(row("sqft", 917, "location", "great"));
        homes.addRow(row("sqft", 194, "location", "good"));
        homes.addRow(row("sqft", 543, "location", "great"));
        files.registerTable("homes", homes);

        HandlerRegistry handlers = new HandlerRegistry();
        handlers.register(files);

        // Output rows come back reversed so that alignment relies on original_index
        forecast = new ScriptedPredictor(
            PredictorDescriptor.builder("forecast").target("amount")
                .timeseries("saledate", 2).groupBy(List.of("country")).build(),
            input -> reversed(input, "amount", row -> ((Number) row.get("saledate")).intValue() * 10.0));
        home = new ScriptedPredictor(
            PredictorDescriptor.builder("home").target("rental_price").build(),
            input -> reversed(input, "rental_price", row -> ((Number) row.get("sqft")).intValue() * 3));
        predictors = new PredictorRegistry();
        predictors.register(forecast);
        predictors.register(home);

        planner = new PredictorJoinPlanner(handlers, predictors, new QueryExecutor(metrics, false, 1),
            new ResultMerger(localExecutor), new ResultPersister(handlers, metrics), translator, metrics, "models");
    }

    @Test
    @DisplayName("Time-series join is planned as one sub-query per group and slice")
    void plansTimeseriesPerGroupAndSlice() {
        // Given
        SelectStatement select = salesJoin(
            new BinaryOperation(">", Identifier.of("ta", "saledate"), new Constant(4)));

        // When
        JoinPlan plan = planner.plan(select);

        // Then
        assertThat(plan.isTimeseries()).isTrue();
        assertThat(plan.getBaseTimeFilter().getOperator()).isEqualTo(FilterOperator.GREATER_THAN);
        List<SubQuery> subQueries = plan.getQueryPlan().getSubQueries();
        assertThat(subQueries).extracting(SubQuery::getLabel)
            .containsExactly("history", "forecast", "history", "forecast");
        assertThat(subQueries).extracting(subQuery -> subQuery.getPartition().get("country"))
            .containsExactly("FR", "FR", "US", "US");
        assertThat(subQueries.get(0).getSelect().getLimit()).isEqualTo(2);
        assertThat(subQueries.get(0).getSelect().getOrderBy())
            .containsExactly(OrderByItem.desc(Identifier.of("saledate")));
        assertThat(subQueries.get(1).getSelect().getLimit()).isNull();
        assertThat(subQueries).allMatch(subQuery -> "saledate".equals(subQuery.getResortColumn()));
    }

    @Test
    @DisplayName("Each group gets its own latest window in chronological order")
    void timeseriesWindowsDoNotLeakAcrossGroups() {
        // Given
        SelectStatement select = salesJoin(
            new BinaryOperation(">", Identifier.of("ta", "saledate"), new Constant(4)));

        // When
        QueryResponse response = planner.execute(select);

        // Then
        ResultTable table = response.getTable();
        assertThat(table.column("country")).containsExactly("FR", "FR", "US", "US", "US", "US");
        assertThat(table.column("saledate")).containsExactly(2, 3, 3, 4, 5, 6);
        assertThat(table.column("amount")).containsExactly(20.0, 30.0, 30.0, 40.0, 50.0, 60.0);
        assertThat(forecast.inputs).hasSize(1);
        assertThat(metrics.getTimeseriesJoinPlans().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Without a time filter only the latest window per group is used")
    void latestWindowWithoutCutoff() {
        ResultTable table = planner.execute(salesJoin(null)).getTable();

        assertThat(table.column("saledate")).containsExactly(2, 3, 5, 6);
        assertThat(table.column("country")).containsExactly("FR", "FR", "US", "US");
    }

    @Test
    @DisplayName("Data filters are pushed to the data side, predictor filters run after merge")
    void splitsConditionsAcrossSides() {
        // Given
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("ta", "sqft"))
            .target(Identifier.of("tb", "rental_price"))
            .from(JoinClause.of(TableIdentifier.of("files", "homes").as("ta"),
                TableIdentifier.of("models", "home").as("tb")))
            .where(BinaryOperation.and(
                new BinaryOperation("=", Identifier.of("ta", "location"), new Constant("great")),
                new BinaryOperation(">", Identifier.of("tb", "rental_price"), new Constant(2000))))
            .orderBy(OrderByItem.desc(Identifier.of("tb", "rental_price")))
            .build();

        // When
        QueryResponse response = planner.execute(select);

        // Then
        assertThat(home.inputs).singleElement()
            .satisfies(input -> assertThat(input.column("sqft")).containsExactly(917, 543));
        assertThat(response.getTable().column("sqft")).containsExactly(917);
        assertThat(response.getTable().column("rental_price")).containsExactly(2751);
    }

    @Test
    @DisplayName("Direct predictor query builds its input from = and IN conditions")
    void directQueryUsesWhereClauseAsInput() {
        // Given
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("sqft"))
            .target(Identifier.of("rental_price"))
            .from(TableIdentifier.of("models", "home"))
            .where(new BinaryOperation("in", Identifier.of("sqft"), new ConstantList(List.of(100, 200))))
            .build();

        // When
        QueryResponse response = planner.executeDirect(select);

        // Then
        assertThat(planner.isPredictorQuery(select)).isTrue();
        assertThat(response.getTable().column("sqft")).containsExactly(100, 200);
        assertThat(response.getTable().column("rental_price")).containsExactly(300, 600);
        assertThat(metrics.getDirectPredictPlans().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Direct predictor query with one equality runs one sub-query and returns only the target")
    void directQuerySingleEquality() {
        // Given
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("rental_price"))
            .from(TableIdentifier.of("models", "home"))
            .where(new BinaryOperation("=", Identifier.of("sqft"), new Constant(100)))
            .build();

        // When
        JoinPlan plan = planner.planDirect(select);
        QueryResponse response = planner.executeDirect(select);

        // Then
        assertThat(plan.getQueryPlan().size()).isEqualTo(1);
        List<FilterCondition> pushed = ConditionExtractor.extractConditions(
            plan.getQueryPlan().getSubQueries().get(0).getSelect().getWhere());
        assertThat(pushed).singleElement().satisfies(condition -> {
            assertThat(condition.getColumn()).isEqualTo("sqft");
            assertThat(condition.getOperator()).isEqualTo(FilterOperator.EQUAL);
            assertThat(condition.getValue()).isEqualTo(100);
        });
        assertThat(response.getTable().getColumns()).containsExactly("rental_price");
        assertThat(response.getTable().column("rental_price")).containsExactly(300);
        assertThat(home.inputs).singleElement()
            .satisfies(input -> assertThat(input.column("sqft")).containsExactly(100));
    }

    @Test
    @DisplayName("Direct predictor query rejects range conditions")
    void directQueryRejectsRanges() {
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("rental_price"))
            .from(TableIdentifier.of("models", "home"))
            .where(new BinaryOperation(">", Identifier.of("sqft"), new Constant(100)))
            .build();

        assertThatThrownBy(() -> planner.executeDirect(select))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("Only = and IN");
        assertThat(home.inputs).isEmpty();
    }

    @Test
    @DisplayName("Unsupported join shapes are planning errors")
    void rejectsUnsupportedShapes() {
        SelectStatement twoPredictors = SelectStatement.builder()
            .target(Identifier.of("a", "amount"))
            .from(JoinClause.of(TableIdentifier.of("models", "forecast").as("a"),
                TableIdentifier.of("models", "home").as("b")))
            .build();
        SelectStatement ordered = salesJoin(null).toBuilder()
            .orderBy(OrderByItem.asc(Identifier.of("ta", "saledate")))
            .build();
        SelectStatement unqualified = SelectStatement.builder()
            .target(Identifier.of("tb", "rental_price"))
            .from(JoinClause.of(TableIdentifier.of("homes").as("ta"), TableIdentifier.of("models", "home").as("tb")))
            .build();

        assertThatThrownBy(() -> planner.plan(twoPredictors))
            .isInstanceOf(PlanningException.class).hasMessageContaining("two predictors");
        assertThatThrownBy(() -> planner.plan(ordered))
            .isInstanceOf(PlanningException.class).hasMessageContaining("ORDER BY");
        assertThatThrownBy(() -> planner.plan(unqualified))
            .isInstanceOf(PlanningException.class).hasMessageContaining("qualified");
    }

    @Test
    @DisplayName("Predictor output is realigned on original_index")
    void realignsOnOriginalIndex() {
        // Given
        Predictor shuffled = new ScriptedPredictor(
            PredictorDescriptor.builder("shuffled").target("rental_price").build(),
            input -> {
                ResultTable output = new ResultTable(List.of("rental_price", "original_index"));
                output.addRow(row("rental_price", "c", "original_index", 2));
                output.addRow(row("rental_price", "a", "original_index", 0));
                output.addRow(row("rental_price", "b", "original_index", 1));
                return output;
            });
        ResultTable input = new ResultTable(List.of("sqft"));
        input.addRow(row("sqft", 917));
        input.addRow(row("sqft", 194));
        input.addRow(row("sqft", 543));

        // When
        ResultTable output = planner.infer(shuffled, input);

        // Then
        assertThat(output.column("rental_price")).containsExactly("a", "b", "c");
        assertThat(output.column("original_index")).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("Predictor output must have one row per input row")
    void rejectsShortPredictorOutput() {
        // Given
        Predictor broken = new ScriptedPredictor(
            PredictorDescriptor.builder("broken").target("rental_price").build(),
            input -> new ResultTable(List.of("rental_price")));
        ResultTable input = new ResultTable(List.of("sqft"));
        input.addRow(row("sqft", 917));

        // When / Then
        assertThatThrownBy(() -> planner.infer(broken, input))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("0 rows for 1 input rows");
    }

    private static SelectStatement salesJoin(Expression where) {
        return SelectStatement.builder()
            .target(Identifier.of("ta", "country"))
            .target(Identifier.of("ta", "saledate"))
            .target(Identifier.of("tb", "amount"))
            .from(JoinClause.of(TableIdentifier.of("files", "sales").as("ta"),
                TableIdentifier.of("models", "forecast").as("tb")))
            .where(where)
            .build();
    }

    private static ResultTable reversed(ResultTable input, String target, Function<Map<String, Object>, Object> model) {
        ResultTable output = new ResultTable(List.of(target, "original_index"));
        for (int i = input.size() - 1; i >= 0; i--) {
            output.addRow(row(target, model.apply(input.getRows().get(i)), "original_index", i));
        }
        return output;
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static final class ScriptedPredictor implements Predictor {
        private final PredictorDescriptor descriptor;
        private final Function<ResultTable, ResultTable> model;
        private final List<ResultTable> inputs = new ArrayList<>();

        private ScriptedPredictor(PredictorDescriptor descriptor, Function<ResultTable, ResultTable> model) {
            this.descriptor = descriptor;
            this.model = model;
        }

        @Override
        public PredictorDescriptor getDescriptor() {
            return descriptor;
        }

        @Override
        public ResultTable predict(ResultTable input) {
            inputs.add(input);
            return model.apply(input);
        }
    }
}
