package com.tessera.predictor.process;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answer of a model worker: the last JSON line it prints on stdout.
 * {@code status} is {@code ok} or {@code error}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerResponse {

    public static final String STATUS_OK = "ok";

    @JsonProperty("status")
    private String status;

    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("rows")
    private List<List<Object>> rows = new ArrayList<>();

    @JsonProperty("output_types")
    private Map<String, String> outputTypes = new LinkedHashMap<>();

    @JsonProperty("error")
    private String error;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public void setRows(List<List<Object>> rows) {
        this.rows = rows;
    }

    public Map<String, String> getOutputTypes() {
        return outputTypes;
    }

    public void setOutputTypes(Map<String, String> outputTypes) {
        this.outputTypes = outputTypes;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public boolean isOk() {
        return STATUS_OK.equalsIgnoreCase(status);
    }
}
