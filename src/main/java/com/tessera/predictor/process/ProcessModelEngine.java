package com.tessera.predictor.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.domain.PredictorDescriptor;
import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.predictor.ModelEngine;
import com.tessera.predictor.Predictor;
import com.tessera.query.ast.CreatePredictorStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model engine delegating training and inference to an external worker command.
 *
 * The command is configured with {@code tessera.models.process.command}. Each call
 * starts the command, sends one request and reads one response:
 * - {@code create} / {@code retrain}: training rows in, {@code output_types} out
 * - {@code predict}: input rows in, output rows out
 * - {@code drop}: nothing in, nothing out
 */
@Component
public class ProcessModelEngine implements ModelEngine {

    private static final Logger log = LoggerFactory.getLogger(ProcessModelEngine.class);

    public static final String NAME = "process";

    private final WorkerProcess worker;

    @Autowired
    public ProcessModelEngine(@Value("${tessera.models.process.command:}") String command,
                              @Value("${tessera.models.process.timeout-seconds:120}") long timeoutSeconds,
                              ObjectMapper objectMapper) {
        List<String> parts = command == null || command.isBlank()
            ? List.of()
            : Arrays.asList(command.trim().split("\\s+"));
        this.worker = parts.isEmpty() ? null : new WorkerProcess(parts, Duration.ofSeconds(timeoutSeconds), objectMapper);
        log.info("Process model engine initialized (command={})", parts.isEmpty() ? "<none>" : parts);
    }

    ProcessModelEngine(WorkerProcess worker) {
        this.worker = worker;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Predictor create(CreatePredictorStatement definition, ResultTable trainingData) {
        WorkerResponse response = requireWorker().call(trainingRequest("create", definition, trainingData));
        PredictorDescriptor descriptor = describe(definition, trainingData, response.getOutputTypes());
        log.info("Created predictor {} from {} rows", definition.getName(), trainingData.size());
        return new ProcessPredictor(descriptor, worker);
    }

    @Override
    public Predictor retrain(Predictor current, CreatePredictorStatement definition, ResultTable trainingData) {
        WorkerResponse response = requireWorker().call(trainingRequest("retrain", definition, trainingData));
        Map<String, String> outputTypes = response.getOutputTypes().isEmpty()
            ? current.getDescriptor().getOutputTypes()
            : response.getOutputTypes();
        log.info("Retrained predictor {} on {} rows", definition.getName(), trainingData.size());
        return new ProcessPredictor(describe(definition, trainingData, outputTypes), worker);
    }

    @Override
    public void drop(String predictorName) {
        requireWorker().call(new WorkerRequest("drop", predictorName, null, null, null));
    }

    private WorkerRequest trainingRequest(String method, CreatePredictorStatement definition, ResultTable data) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("targets", definition.getTargets());
        if (definition.isTimeseries()) {
            args.put("order_by", definition.getOrderBy());
            args.put("group_by", definition.getGroupBy());
            args.put("window", definition.getWindow());
            args.put("horizon", definition.getHorizon());
        }
        args.put("using", definition.getUsing());
        return new WorkerRequest(method, definition.getName(), data.getColumns(), WorkerProcess.toRows(data), args);
    }

    private PredictorDescriptor describe(CreatePredictorStatement definition, ResultTable data,
                                         Map<String, String> outputTypes) {
        List<String> inputColumns = new ArrayList<>(data.getColumns());
        inputColumns.removeAll(definition.getTargets());
        PredictorDescriptor.Builder builder = PredictorDescriptor.builder(definition.getName())
            .engine(NAME)
            .targets(definition.getTargets())
            .inputColumns(inputColumns)
            .outputTypes(outputTypes);
        if (definition.isTimeseries()) {
            builder.timeseries(definition.getOrderBy(), definition.getWindow())
                .groupBy(definition.getGroupBy())
                .horizon(definition.getHorizon());
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new PlanningException(e.getMessage(), e);
        }
    }

    private WorkerProcess requireWorker() {
        if (worker == null) {
            throw new PlanningException("Model engine '" + NAME + "' has no worker command configured"
                + " (tessera.models.process.command)");
        }
        return worker;
    }
}
