package com.tessera.engine;

import com.tessera.domain.HandlerResponse;
import com.tessera.domain.QueryResponse;
import com.tessera.domain.ResultTable;
import com.tessera.error.ErrorKind;
import com.tessera.error.PlanningException;
import com.tessera.error.TesseraException;
import com.tessera.handler.DataHandler;
import com.tessera.handler.HandlerRegistry;
import com.tessera.join.OutputTypeMapper;
import com.tessera.join.PredictorJoinPlanner;
import com.tessera.join.ResultPersister;
import com.tessera.predictor.ModelEngine;
import com.tessera.predictor.ModelEngineRegistry;
import com.tessera.predictor.Predictor;
import com.tessera.predictor.PredictorRegistry;
import com.tessera.query.QueryMetrics;
import com.tessera.query.ast.CreatePredictorStatement;
import com.tessera.query.ast.DropPredictorStatement;
import com.tessera.query.ast.JoinClause;
import com.tessera.query.ast.RetrainPredictorStatement;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.Statement;
import com.tessera.query.ast.TableIdentifier;
import com.tessera.query.ast.TableReference;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for parsed statements.
 *
 * Dispatch by statement kind:
 * - SELECT: predictor join, direct predictor query, or plain query against one integration
 * - CREATE PREDICTOR: gather training data, train through the model engine, register
 * - RETRAIN PREDICTOR: gather data again with the stored definition, swap the predictor
 * - DROP PREDICTOR: unregister and let the engine release the model
 *
 * {@link #execute(Statement, Duration)} bounds the whole execution; on expiry every
 * handler the statement touches is disconnected and a TIMEOUT error is raised.
 */
@Service
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final HandlerRegistry handlerRegistry;
    private final PredictorRegistry predictorRegistry;
    private final ModelEngineRegistry modelEngines;
    private final PredictorJoinPlanner planner;
    private final ResultPersister persister;
    private final QueryMetrics metrics;
    private final Duration defaultTimeout;

    public QueryEngine(HandlerRegistry handlerRegistry,
                       PredictorRegistry predictorRegistry,
                       ModelEngineRegistry modelEngines,
                       PredictorJoinPlanner planner,
                       ResultPersister persister,
                       QueryMetrics metrics,
                       @Value("${tessera.query.timeout-seconds:300}") long timeoutSeconds) {
        this.handlerRegistry = handlerRegistry;
        this.predictorRegistry = predictorRegistry;
        this.modelEngines = modelEngines;
        this.planner = planner;
        this.persister = persister;
        this.metrics = metrics;
        this.defaultTimeout = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Execute a statement synchronously, without a deadline
     */
    public QueryResponse execute(Statement statement) {
        Timer.Sample sample = metrics.startTimer();
        long startTime = System.currentTimeMillis();
        try {
            QueryResponse response = switch (statement.kind()) {
                case SELECT -> executeSelect((SelectStatement) statement);
                case CREATE_PREDICTOR -> createPredictor((CreatePredictorStatement) statement);
                case RETRAIN_PREDICTOR -> retrainPredictor((RetrainPredictorStatement) statement);
                case DROP_PREDICTOR -> dropPredictor((DropPredictorStatement) statement);
            };
            response.setExecutionTimeMs(System.currentTimeMillis() - startTime);
            metrics.recordStatementExecuted();
            log.debug("{} completed in {}ms", statement.kind(), response.getExecutionTimeMs());
            return response;
        } catch (RuntimeException e) {
            metrics.recordStatementFailed();
            log.error("{} failed: {}", statement.kind(), e.getMessage());
            throw e;
        } finally {
            metrics.recordStatementLatency(sample);
        }
    }

    /**
     * Execute a statement within the configured {@code tessera.query.timeout-seconds}
     */
    public QueryResponse executeWithTimeout(Statement statement) {
        return execute(statement, defaultTimeout);
    }

    /**
     * Execute a statement within a deadline
     *
     * @throws TesseraException of kind TIMEOUT when the deadline expires
     */
    public QueryResponse execute(Statement statement, Duration timeout) {
        return executeAsync(statement, timeout).block();
    }

    /**
     * Execute a statement on a worker thread; the returned Mono fails with a TIMEOUT
     * {@link TesseraException} when the deadline expires
     */
    public Mono<QueryResponse> executeAsync(Statement statement, Duration timeout) {
        Set<DataHandler> touched = touchedHandlers(statement);
        return Mono.fromCallable(() -> execute(statement))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> onTimeout(statement, timeout, touched, e));
    }

    /**
     * Run a query in the integration's own dialect
     */
    public QueryResponse executeNative(String integration, String query) {
        DataHandler handler = handlerRegistry.require(integration);
        HandlerResponse response = handler.runNative(query);
        if (response.isError()) {
            metrics.recordHandlerError();
            throw response.toException(handler.getName(), query);
        }
        return new QueryResponse(response.tableOrEmpty());
    }

    private QueryResponse executeSelect(SelectStatement select) {
        if (planner.isPredictorJoin(select)) {
            return planner.execute(select);
        }
        if (planner.isPredictorQuery(select)) {
            return planner.executeDirect(select);
        }
        return executePlain(select);
    }

    /**
     * Single-table query handed to the owning handler
     */
    private QueryResponse executePlain(SelectStatement select) {
        if (select.getFrom() == null) {
            throw new PlanningException("SELECT without FROM is not supported");
        }
        if (select.getFrom() instanceof JoinClause) {
            throw new PlanningException("Joins are only supported between a table and a predictor");
        }
        TableIdentifier table = (TableIdentifier) select.getFrom();
        if (!table.isQualified()) {
            throw new PlanningException("Unknown table '" + table.getName()
                + "'; tables must be qualified with their integration");
        }
        DataHandler handler = handlerRegistry.require(table.getQualifier());
        metrics.recordPlainPlan();

        SelectStatement relative = select.toBuilder()
            .from(new TableIdentifier(table.getParts().subList(1, table.getParts().size()), table.getAlias()))
            .into(null)
            .build();
        log.debug("Plain query on {}: {}", handler.getName(), relative);
        HandlerResponse response = handler.runStructured(relative);
        if (response.isError()) {
            metrics.recordHandlerError();
            throw response.toException(handler.getName(), relative.toString());
        }

        ResultTable result = response.tableOrEmpty();
        QueryResponse queryResponse = new QueryResponse(result);
        if (select.getInto() != null) {
            persister.persist(queryResponse, select.getInto(),
                OutputTypeMapper.columnTypes(result, Map.of(), null), result);
        }
        metrics.recordResultSize(result.size());
        return queryResponse;
    }

    private QueryResponse createPredictor(CreatePredictorStatement statement) {
        if (predictorRegistry.contains(statement.getName())) {
            throw new PlanningException("Predictor '" + statement.getName() + "' already exists");
        }
        ModelEngine engine = modelEngines.require(statement.getEngine());
        ResultTable trainingData = gatherTrainingData(statement);
        Predictor predictor = engine.create(statement, trainingData);
        predictorRegistry.register(predictor, statement);
        return QueryResponse.ok();
    }

    private QueryResponse retrainPredictor(RetrainPredictorStatement statement) {
        Predictor current = predictorRegistry.require(statement.getName());
        CreatePredictorStatement definition = predictorRegistry.getDefinition(statement.getName())
            .orElseThrow(() -> new PlanningException("Predictor '" + statement.getName()
                + "' has no stored definition and cannot be retrained"));
        ModelEngine engine = modelEngines.require(definition.getEngine());
        ResultTable trainingData = gatherTrainingData(definition);
        predictorRegistry.replace(engine.retrain(current, definition, trainingData));
        return QueryResponse.ok();
    }

    private QueryResponse dropPredictor(DropPredictorStatement statement) {
        Predictor current = predictorRegistry.require(statement.getName());
        predictorRegistry.unregister(statement.getName());
        String engineName = current.getDescriptor().getEngine();
        if (engineName != null) {
            try {
                modelEngines.require(engineName).drop(current.getName());
            } catch (RuntimeException e) {
                log.warn("Predictor {} was unregistered but engine {} did not release it: {}",
                    current.getName(), engineName, e.getMessage());
            }
        }
        return QueryResponse.ok();
    }

    private ResultTable gatherTrainingData(CreatePredictorStatement definition) {
        if (definition.getIntegration() == null || definition.getQuery() == null) {
            throw new PlanningException("Predictor '" + definition.getName() + "' needs FROM integration (query)");
        }
        DataHandler handler = handlerRegistry.require(definition.getIntegration());
        HandlerResponse response = handler.runStructured(definition.getQuery());
        if (response.isError()) {
            metrics.recordHandlerError();
            throw response.toException(handler.getName(), definition.getQuery().toString());
        }
        ResultTable data = response.tableOrEmpty();
        log.info("Gathered {} training rows for {} from {}", data.size(), definition.getName(), handler.getName());
        return data;
    }

    /**
     * Registered handlers a statement reads from or writes to
     */
    Set<DataHandler> touchedHandlers(Statement statement) {
        Set<DataHandler> handlers = new LinkedHashSet<>();
        if (statement instanceof SelectStatement) {
            SelectStatement select = (SelectStatement) statement;
            collectHandlers(select.getFrom(), handlers);
            collectHandlers(select.getInto(), handlers);
        } else if (statement instanceof CreatePredictorStatement) {
            handlerRegistry.get(((CreatePredictorStatement) statement).getIntegration()).ifPresent(handlers::add);
        } else if (statement instanceof RetrainPredictorStatement) {
            predictorRegistry.getDefinition(((RetrainPredictorStatement) statement).getName())
                .flatMap(definition -> handlerRegistry.get(definition.getIntegration()))
                .ifPresent(handlers::add);
        }
        return handlers;
    }

    private void collectHandlers(TableReference reference, Set<DataHandler> handlers) {
        if (reference instanceof JoinClause) {
            collectHandlers(((JoinClause) reference).getLeft(), handlers);
            collectHandlers(((JoinClause) reference).getRight(), handlers);
        } else if (reference instanceof TableIdentifier && ((TableIdentifier) reference).isQualified()) {
            handlerRegistry.get(((TableIdentifier) reference).getQualifier()).ifPresent(handlers::add);
        }
    }

    private TesseraException onTimeout(Statement statement, Duration timeout, Set<DataHandler> touched,
                                       TimeoutException cause) {
        metrics.recordStatementTimedOut();
        log.error("{} timed out after {}ms", statement.kind(), timeout.toMillis());
        for (DataHandler handler : touched) {
            log.warn("Disconnecting {} after abandoned execution", handler.getName());
            handler.disconnect();
        }
        return new TesseraException(ErrorKind.TIMEOUT,
            "Statement timed out after " + timeout.toMillis() + "ms", cause);
    }
}
