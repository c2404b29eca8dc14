package com.tessera.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for statement execution
 * Tracks statement outcomes, plan shapes, pushdown effectiveness,
 * fetch and inference latency, and result sizes
 */
@Component
public class QueryMetrics {

    private final MeterRegistry meterRegistry;

    private Counter statementsExecuted;
    private Counter statementsFailed;
    private Counter statementsTimedOut;
    private Counter plainPlans;
    private Counter joinPlans;
    private Counter timeseriesJoinPlans;
    private Counter directPredictPlans;
    private Counter subQueriesExecuted;
    private Counter handlerErrors;
    private Counter conditionsPushed;
    private Counter conditionsResidual;
    private Counter overfetchIterations;
    private Counter persistenceWarnings;
    private Timer statementLatency;
    private Timer fetchLatency;
    private Timer inferenceLatency;
    private DistributionSummary resultSize;
    private DistributionSummary modelInputSize;

    public QueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        statementsExecuted = Counter.builder("tessera.statement.executed")
            .description("Total number of statements executed")
            .register(meterRegistry);

        statementsFailed = Counter.builder("tessera.statement.failed")
            .description("Total number of statements that failed")
            .register(meterRegistry);

        statementsTimedOut = Counter.builder("tessera.statement.timedout")
            .description("Total number of statements that exceeded the caller deadline")
            .register(meterRegistry);

        plainPlans = Counter.builder("tessera.plan.plain")
            .description("Plain federated table queries")
            .register(meterRegistry);

        joinPlans = Counter.builder("tessera.plan.join")
            .description("Non time-series predictor joins")
            .register(meterRegistry);

        timeseriesJoinPlans = Counter.builder("tessera.plan.join.timeseries")
            .description("Time-series predictor joins")
            .register(meterRegistry);

        directPredictPlans = Counter.builder("tessera.plan.predict")
            .description("Direct predictor queries")
            .register(meterRegistry);

        subQueriesExecuted = Counter.builder("tessera.subquery.executed")
            .description("Sub-queries sent to data handlers")
            .register(meterRegistry);

        handlerErrors = Counter.builder("tessera.handler.errors")
            .description("ERROR responses returned by handlers")
            .register(meterRegistry);

        conditionsPushed = Counter.builder("tessera.pushdown.conditions.pushed")
            .description("Filter conditions evaluated natively by a handler")
            .register(meterRegistry);

        conditionsResidual = Counter.builder("tessera.pushdown.conditions.residual")
            .description("Filter conditions evaluated locally")
            .register(meterRegistry);

        overfetchIterations = Counter.builder("tessera.pushdown.overfetch.iterations")
            .description("Additional fetches issued because residual filtering left too few rows")
            .register(meterRegistry);

        persistenceWarnings = Counter.builder("tessera.persistence.warnings")
            .description("Results that could not be written to their INTO destination")
            .register(meterRegistry);

        // Timers with histogram support for percentile calculation
        statementLatency = Timer.builder("tessera.statement.latency")
            .description("Latency of whole statement execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofMinutes(5))
            .register(meterRegistry);

        fetchLatency = Timer.builder("tessera.fetch.latency")
            .description("Latency of fetching a query plan from a data handler")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofMinutes(5))
            .register(meterRegistry);

        inferenceLatency = Timer.builder("tessera.inference.latency")
            .description("Latency of predictor inference")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofMinutes(5))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("tessera.result.size")
            .description("Distribution of statement result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .register(meterRegistry);

        modelInputSize = DistributionSummary.builder("tessera.inference.input.size")
            .description("Distribution of predictor input sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .register(meterRegistry);
    }

    public void recordStatementExecuted() {
        statementsExecuted.increment();
    }

    public void recordStatementFailed() {
        statementsFailed.increment();
    }

    public void recordStatementTimedOut() {
        statementsTimedOut.increment();
    }

    public void recordPlainPlan() {
        plainPlans.increment();
    }

    public void recordJoinPlan(boolean timeseries) {
        if (timeseries) {
            timeseriesJoinPlans.increment();
        } else {
            joinPlans.increment();
        }
    }

    public void recordDirectPredictPlan() {
        directPredictPlans.increment();
    }

    public void recordSubQueryExecuted() {
        subQueriesExecuted.increment();
    }

    public void recordHandlerError() {
        handlerErrors.increment();
    }

    public void recordConditions(int pushed, int residual) {
        conditionsPushed.increment(pushed);
        conditionsResidual.increment(residual);
    }

    public void recordOverfetchIteration() {
        overfetchIterations.increment();
    }

    public void recordPersistenceWarning() {
        persistenceWarnings.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordStatementLatency(Timer.Sample sample) {
        sample.stop(statementLatency);
    }

    public void recordFetchLatency(Timer.Sample sample) {
        sample.stop(fetchLatency);
    }

    public void recordInferenceLatency(Timer.Sample sample) {
        sample.stop(inferenceLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public void recordModelInputSize(long size) {
        modelInputSize.record(size);
    }

    /**
     * Share of filter conditions evaluated natively, as a percentage
     * @return pushdown rate (0-100) or 0 if no conditions were seen
     */
    public double getPushdownRate() {
        double pushed = conditionsPushed.count();
        double total = pushed + conditionsResidual.count();
        if (total == 0) {
            return 0.0;
        }
        return (pushed / total) * 100.0;
    }

    // Getter methods for testing
    public Counter getStatementsExecuted() {
        return statementsExecuted;
    }

    public Counter getStatementsFailed() {
        return statementsFailed;
    }

    public Counter getStatementsTimedOut() {
        return statementsTimedOut;
    }

    public Counter getPlainPlans() {
        return plainPlans;
    }

    public Counter getJoinPlans() {
        return joinPlans;
    }

    public Counter getTimeseriesJoinPlans() {
        return timeseriesJoinPlans;
    }

    public Counter getDirectPredictPlans() {
        return directPredictPlans;
    }

    public Counter getSubQueriesExecuted() {
        return subQueriesExecuted;
    }

    public Counter getHandlerErrors() {
        return handlerErrors;
    }

    public Counter getConditionsPushed() {
        return conditionsPushed;
    }

    public Counter getConditionsResidual() {
        return conditionsResidual;
    }

    public Counter getOverfetchIterations() {
        return overfetchIterations;
    }

    public Counter getPersistenceWarnings() {
        return persistenceWarnings;
    }

    public Timer getStatementLatency() {
        return statementLatency;
    }

    public Timer getFetchLatency() {
        return fetchLatency;
    }

    public Timer getInferenceLatency() {
        return inferenceLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public DistributionSummary getModelInputSize() {
        return modelInputSize;
    }
}
