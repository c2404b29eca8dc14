package com.tessera.predictor.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.domain.ResultTable;
import com.tessera.error.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs the worker command once per call: one JSON request line in, one JSON response line out.
 */
public class WorkerProcess {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcess.class);

    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public WorkerProcess(List<String> command, Duration timeout, ObjectMapper objectMapper) {
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws QueryExecutionException if the worker cannot be started, exits non-zero,
     *     times out, prints no parsable response or answers with an error
     */
    public WorkerResponse call(WorkerRequest request) {
        String line;
        try {
            line = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Cannot encode worker request: " + e.getOriginalMessage(), request.getModel(), e);
        }

        log.debug("Calling worker {} for {} on {}", command, request.getMethod(), request.getModel());
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new QueryExecutionException("Cannot start model worker " + command + ": " + e.getMessage(),
                request.getModel(), e);
        }

        try {
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            try (Writer writer = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
                writer.write(line);
                writer.write('\n');
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new QueryExecutionException("Model worker timed out after " + timeout.toSeconds() + "s",
                    request.getModel());
            }
            if (process.exitValue() != 0) {
                throw new QueryExecutionException("Model worker exited with code " + process.exitValue()
                    + ": " + stderr.join().trim(), request.getModel(), command.toString(), process.exitValue());
            }
            return parse(stdout.join(), request.getModel());
        } catch (IOException e) {
            process.destroyForcibly();
            throw new QueryExecutionException("Model worker I/O failed: " + e.getMessage(), request.getModel(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new QueryExecutionException("Interrupted while waiting for model worker", request.getModel(), e);
        }
    }

    WorkerResponse parse(String output, String model) {
        String last = null;
        for (String candidate : output.split("\n")) {
            if (!candidate.isBlank()) {
                last = candidate.trim();
            }
        }
        if (last == null) {
            throw new QueryExecutionException("Model worker printed no response", model);
        }
        WorkerResponse response;
        try {
            response = objectMapper.readValue(last, WorkerResponse.class);
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Malformed model worker response: " + e.getOriginalMessage(), model, e);
        }
        if (!response.isOk()) {
            throw new QueryExecutionException("Model worker failed: "
                + (response.getError() != null ? response.getError() : response.getStatus()), model);
        }
        return response;
    }

    /**
     * Row-major values of a table, temporal values as ISO strings
     */
    static List<List<Object>> toRows(ResultTable table) {
        List<List<Object>> rows = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.getRows()) {
            List<Object> values = new ArrayList<>(table.getColumns().size());
            for (String column : table.getColumns()) {
                values.add(toWire(row.get(column)));
            }
            rows.add(values);
        }
        return rows;
    }

    static ResultTable toTable(WorkerResponse response) {
        ResultTable table = new ResultTable(response.getColumns());
        for (List<Object> values : response.getRows()) {
            if (values.size() != response.getColumns().size()) {
                throw new QueryExecutionException("Model worker returned a row of " + values.size()
                    + " values for " + response.getColumns().size() + " columns");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.size(); i++) {
                row.put(response.getColumns().get(i), values.get(i));
            }
            table.addRow(row);
        }
        return table;
    }

    private static Object toWire(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return value;
    }

    private static String readAll(InputStream stream) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new QueryExecutionException("Cannot read model worker output: " + e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WorkerProcess" + command;
    }
}
