package com.tessera.predictor.process;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One call to a model worker, written as a single JSON line on its stdin
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkerRequest {

    @JsonProperty("method")
    private final String method;

    @JsonProperty("model")
    private final String model;

    @JsonProperty("columns")
    private final List<String> columns;

    @JsonProperty("rows")
    private final List<List<Object>> rows;

    @JsonProperty("args")
    private final Map<String, Object> args;

    public WorkerRequest(String method, String model, List<String> columns, List<List<Object>> rows,
                         Map<String, Object> args) {
        this.method = method;
        this.model = model;
        this.columns = columns;
        this.rows = rows;
        this.args = args;
    }

    public String getMethod() {
        return method;
    }

    public String getModel() {
        return model;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public Map<String, Object> getArgs() {
        return args;
    }
}
