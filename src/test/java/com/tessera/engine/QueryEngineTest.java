package com.tessera.engine;

import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerKind;
import com.tessera.domain.PredictorDescriptor;
import com.tessera.domain.QueryResponse;
import com.tessera.domain.ResultTable;
import com.tessera.error.ErrorKind;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.error.TesseraException;
import com.tessera.handler.DataHandler;
import com.tessera.handler.HandlerRegistry;
import com.tessera.handler.memory.InMemoryDataHandler;
import com.tessera.join.PredictorJoinPlanner;
import com.tessera.join.ResultMerger;
import com.tessera.join.ResultPersister;
import com.tessera.predictor.ModelEngine;
import com.tessera.predictor.ModelEngineRegistry;
import com.tessera.predictor.Predictor;
import com.tessera.predictor.PredictorRegistry;
import com.tessera.query.QueryExecutor;
import com.tessera.query.QueryMetrics;
import com.tessera.query.ast.BinaryOperation;
import com.tessera.query.ast.Constant;
import com.tessera.query.ast.CreatePredictorStatement;
import com.tessera.query.ast.DropPredictorStatement;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.RetrainPredictorStatement;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.Star;
import com.tessera.query.ast.TableIdentifier;
import com.tessera.query.local.LocalQueryExecutor;
import com.tessera.query.pushdown.PushdownTranslator;
import com.tessera.query.pushdown.StructuredQueryRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for QueryEngine statement dispatch over an in-memory integration
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("QueryEngine Tests")
class QueryEngineTest {

    @Mock
    private ModelEngine modelEngine;

    @Mock
    private DataHandler slowHandler;

    private QueryMetrics metrics;
    private HandlerRegistry handlers;
    private PredictorRegistry predictors;
    private InMemoryDataHandler files;
    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        PushdownTranslator translator = new PushdownTranslator(4);
        LocalQueryExecutor localExecutor = new LocalQueryExecutor();
        files = new InMemoryDataHandler("files", new StructuredQueryRunner(translator, localExecutor, metrics, 100_000));

        ResultTable homes = new ResultTable(List.of("sqft", "location", "rental_price"));
        homes.addRow(home(917, "great", 3901));
        homes.addRow(home(194, "good", 2042));
        homes.addRow(home(543, "great", 1871));
        files.registerTable("homes", homes);

        handlers = new HandlerRegistry();
        handlers.register(files);
        predictors = new PredictorRegistry();
        ResultPersister persister = new ResultPersister(handlers, metrics);
        PredictorJoinPlanner planner = new PredictorJoinPlanner(handlers, predictors,
            new QueryExecutor(metrics, false, 1), new ResultMerger(localExecutor), persister, translator, metrics, "models");

        when(modelEngine.name()).thenReturn("process");
        engine = new QueryEngine(handlers, predictors, new ModelEngineRegistry(List.of(modelEngine), "process"),
            planner, persister, metrics, 300);
    }

    @Test
    @DisplayName("Plain query runs on its integration and persists INTO")
    void plainQueryWithInto() {
        // Given
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("sqft"))
            .from(TableIdentifier.of("files", "homes"))
            .where(new BinaryOperation("=", Identifier.of("location"), new Constant("great")))
            .into(TableIdentifier.of("files", "great_homes"))
            .build();

        // When
        QueryResponse response = engine.execute(select);

        // Then
        assertThat(response.getTable().column("sqft")).containsExactly(917, 543);
        assertThat(response.hasWarnings()).isFalse();
        QueryResponse copy = engine.execute(SelectStatement.builder()
            .target(new Star())
            .from(TableIdentifier.of("files", "great_homes"))
            .build());
        assertThat(copy.getTable().column("sqft")).containsExactly(917, 543);
        assertThat(metrics.getPlainPlans().count()).isEqualTo(2.0);
        assertThat(metrics.getStatementsExecuted().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Asynchronous execution emits the response within the deadline")
    void asyncExecutionCompletes() {
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("location"))
            .from(TableIdentifier.of("files", "homes"))
            .where(new BinaryOperation("<", Identifier.of("sqft"), new Constant(200)))
            .build();

        StepVerifier.create(engine.executeAsync(select, Duration.ofSeconds(10)))
            .assertNext(response -> assertThat(response.getTable().column("location")).containsExactly("good"))
            .verifyComplete();
    }

    @Test
    @DisplayName("Unqualified tables and unknown integrations are planning errors")
    void planningErrors() {
        SelectStatement unqualified = SelectStatement.builder()
            .target(new Star()).from(TableIdentifier.of("homes")).build();
        SelectStatement unknown = SelectStatement.builder()
            .target(new Star()).from(TableIdentifier.of("warehouse", "homes")).build();

        assertThatThrownBy(() -> engine.execute(unqualified))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("must be qualified");
        assertThatThrownBy(() -> engine.execute(unknown))
            .isInstanceOf(PlanningException.class)
            .hasMessage("Unknown integration 'warehouse'");
        assertThat(metrics.getStatementsFailed().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Handler errors surface as execution errors with the handler name")
    void handlerErrorIsExecutionError() {
        SelectStatement select = SelectStatement.builder()
            .target(new Star()).from(TableIdentifier.of("files", "sales")).build();

        assertThatThrownBy(() -> engine.execute(select))
            .isInstanceOf(QueryExecutionException.class)
            .satisfies(e -> assertThat(((QueryExecutionException) e).getHandlerName()).isEqualTo("files"));
        assertThatThrownBy(() -> engine.executeNative("files", "SELECT 1"))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("does not accept native queries");
    }

    @Test
    @DisplayName("Planning failures raised inside a handler keep the PLANNING kind")
    void handlerPlanningErrorKeepsKind() {
        // Given
        predictors.register(predictor("home"));
        SelectStatement unknownColumn = SelectStatement.builder()
            .target(Identifier.of("sqft"))
            .from(TableIdentifier.of("files", "homes"))
            .where(new BinaryOperation("=", Identifier.of("no_such_col"), new Constant(1)))
            .build();
        SelectStatement conflictingInput = SelectStatement.builder()
            .target(Identifier.of("rental_price"))
            .from(TableIdentifier.of("models", "home"))
            .where(BinaryOperation.and(
                new BinaryOperation("=", Identifier.of("sqft"), new Constant(100)),
                new BinaryOperation("=", Identifier.of("sqft"), new Constant(200))))
            .build();

        // When / Then
        assertThatThrownBy(() -> engine.execute(unknownColumn))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("no_such_col")
            .satisfies(e -> assertThat(((TesseraException) e).getKind()).isEqualTo(ErrorKind.PLANNING));
        assertThatThrownBy(() -> engine.execute(conflictingInput))
            .isInstanceOf(PlanningException.class)
            .hasMessageStartingWith("Only = and IN conditions")
            .satisfies(e -> assertThat(((TesseraException) e).getKind()).isEqualTo(ErrorKind.PLANNING));
    }

    @Test
    @DisplayName("Create, retrain and drop go through the model engine")
    void predictorLifecycle() {
        // Given
        CreatePredictorStatement create = CreatePredictorStatement.builder("home_rentals")
            .from("files", SelectStatement.builder().target(new Star()).from(TableIdentifier.of("homes")).build())
            .predict("rental_price")
            .engine("process")
            .build();
        Predictor trained = predictor("home_rentals");
        Predictor retrained = predictor("home_rentals");
        when(modelEngine.create(same(create), any(ResultTable.class))).thenReturn(trained);
        when(modelEngine.retrain(same(trained), same(create), any(ResultTable.class))).thenReturn(retrained);

        // When
        engine.execute(create);
        engine.execute(new RetrainPredictorStatement("home_rentals"));

        // Then
        assertThat(predictors.require("home_rentals")).isSameAs(retrained);
        assertThatThrownBy(() -> engine.execute(create))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("already exists");

        engine.execute(new DropPredictorStatement("home_rentals"));
        assertThat(predictors.contains("home_rentals")).isFalse();
        verify(modelEngine).drop(eq("home_rentals"));
    }

    @Test
    @DisplayName("Training data is gathered from the integration named in FROM")
    void trainingDataComesFromIntegration() {
        // Given
        CreatePredictorStatement create = CreatePredictorStatement.builder("home_rentals")
            .from("files", SelectStatement.builder()
                .target(new Star())
                .from(TableIdentifier.of("homes"))
                .where(new BinaryOperation("=", Identifier.of("location"), new Constant("great")))
                .build())
            .predict("rental_price")
            .build();
        when(modelEngine.create(same(create), any(ResultTable.class))).thenAnswer(invocation -> {
            ResultTable data = invocation.getArgument(1);
            assertThat(data.column("rental_price")).containsExactly(3901, 1871);
            return predictor("home_rentals");
        });

        // When
        QueryResponse response = engine.execute(create);

        // Then
        assertThat(response.getTable().isEmpty()).isTrue();
        assertThat(predictors.getDefinition("home_rentals")).contains(create);
    }

    @Test
    @DisplayName("Timed-out statements disconnect the handlers they touched")
    void timeoutDisconnectsHandlers() {
        // Given
        when(slowHandler.getName()).thenReturn("slow");
        when(slowHandler.getDescriptor()).thenReturn(HandlerDescriptor.builder("slow", HandlerKind.DATABASE).build());
        when(slowHandler.runStructured(any(SelectStatement.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        });
        handlers.register(slowHandler);
        SelectStatement select = SelectStatement.builder()
            .target(new Star()).from(TableIdentifier.of("slow", "events")).build();

        // When / Then
        assertThatThrownBy(() -> engine.execute(select, Duration.ofMillis(200)))
            .isInstanceOf(TesseraException.class)
            .satisfies(e -> assertThat(((TesseraException) e).getKind()).isEqualTo(ErrorKind.TIMEOUT));
        verify(slowHandler).disconnect();
        assertThat(metrics.getStatementsTimedOut().count()).isEqualTo(1.0);
    }

    private static Map<String, Object> home(int sqft, String location, int rentalPrice) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("sqft", sqft);
        row.put("location", location);
        row.put("rental_price", rentalPrice);
        return row;
    }

    private static Predictor predictor(String name) {
        PredictorDescriptor descriptor = PredictorDescriptor.builder(name)
            .engine("process")
            .target("rental_price")
            .build();
        return new Predictor() {
            @Override
            public PredictorDescriptor getDescriptor() {
                return descriptor;
            }

            @Override
            public ResultTable predict(ResultTable input) {
                return input;
            }
        };
    }
}
