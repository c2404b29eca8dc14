package com.tessera.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a trained predictor.
 *
 * A time-series predictor must declare its order column and a positive window;
 * the group columns may be empty, in which case all rows form a single group.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PredictorDescriptor {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("engine")
    private final String engine;

    @JsonProperty("targets")
    private final List<String> targets;

    @JsonProperty("timeseries")
    private final boolean timeseries;

    @JsonProperty("order_by")
    private final String orderByColumn;

    @JsonProperty("group_by")
    private final List<String> groupByColumns;

    @JsonProperty("window")
    private final int window;

    @JsonProperty("horizon")
    private final int horizon;

    @JsonProperty("input_columns")
    private final List<String> inputColumns;

    @JsonProperty("output_types")
    private final Map<String, String> outputTypes;

    private PredictorDescriptor(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Predictor name must not be blank");
        }
        if (builder.targets.isEmpty()) {
            throw new IllegalArgumentException("Predictor '" + builder.name + "' must declare at least one target");
        }
        if (builder.timeseries) {
            if (builder.orderByColumn == null || builder.orderByColumn.isBlank()) {
                throw new IllegalArgumentException(
                    "Time-series predictor '" + builder.name + "' requires an order column");
            }
            if (builder.window <= 0) {
                throw new IllegalArgumentException(
                    "Time-series predictor '" + builder.name + "' requires a positive window, got " + builder.window);
            }
        }
        this.name = builder.name;
        this.engine = builder.engine;
        this.targets = List.copyOf(builder.targets);
        this.timeseries = builder.timeseries;
        this.orderByColumn = builder.orderByColumn;
        this.groupByColumns = List.copyOf(builder.groupByColumns);
        this.window = builder.window;
        this.horizon = builder.horizon;
        this.inputColumns = builder.inputColumns != null ? List.copyOf(builder.inputColumns) : null;
        this.outputTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputTypes));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name)
            .engine(engine)
            .targets(targets)
            .groupBy(groupByColumns)
            .window(window)
            .horizon(horizon)
            .inputColumns(inputColumns)
            .outputTypes(outputTypes);
        builder.timeseries = timeseries;
        builder.orderByColumn = orderByColumn;
        return builder;
    }

    public String getName() {
        return name;
    }

    public String getEngine() {
        return engine;
    }

    public List<String> getTargets() {
        return targets;
    }

    public boolean isTimeseries() {
        return timeseries;
    }

    public String getOrderByColumn() {
        return orderByColumn;
    }

    public List<String> getGroupByColumns() {
        return groupByColumns;
    }

    public int getWindow() {
        return window;
    }

    public int getHorizon() {
        return horizon;
    }

    /**
     * Declared model input columns, or null when the predictor accepts any column
     */
    public List<String> getInputColumns() {
        return inputColumns;
    }

    /**
     * Semantic dtype per output column (integer, float, quantity, date, datetime, categorical...)
     */
    public Map<String, String> getOutputTypes() {
        return outputTypes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PredictorDescriptor)) return false;
        PredictorDescriptor that = (PredictorDescriptor) o;
        return timeseries == that.timeseries
            && window == that.window
            && horizon == that.horizon
            && name.equals(that.name)
            && Objects.equals(engine, that.engine)
            && targets.equals(that.targets)
            && Objects.equals(orderByColumn, that.orderByColumn)
            && groupByColumns.equals(that.groupByColumns)
            && Objects.equals(inputColumns, that.inputColumns)
            && outputTypes.equals(that.outputTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, engine, targets, timeseries, orderByColumn, groupByColumns,
            window, horizon, inputColumns, outputTypes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PredictorDescriptor{").append(name)
            .append(", targets=").append(targets);
        if (timeseries) {
            sb.append(", order_by=").append(orderByColumn)
                .append(", group_by=").append(groupByColumns)
                .append(", window=").append(window)
                .append(", horizon=").append(horizon);
        }
        return sb.append("}").toString();
    }

    public static final class Builder {
        private final String name;
        private String engine;
        private final List<String> targets = new ArrayList<>();
        private boolean timeseries;
        private String orderByColumn;
        private final List<String> groupByColumns = new ArrayList<>();
        private int window;
        private int horizon;
        private List<String> inputColumns;
        private final Map<String, String> outputTypes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder engine(String engine) {
            this.engine = engine;
            return this;
        }

        public Builder target(String target) {
            this.targets.add(target);
            return this;
        }

        public Builder targets(List<String> targets) {
            this.targets.clear();
            this.targets.addAll(targets);
            return this;
        }

        /**
         * Mark the predictor as time-series, ordered by the given column
         */
        public Builder timeseries(String orderByColumn, int window) {
            this.timeseries = true;
            this.orderByColumn = orderByColumn;
            this.window = window;
            return this;
        }

        public Builder groupBy(List<String> columns) {
            this.groupByColumns.clear();
            this.groupByColumns.addAll(columns);
            return this;
        }

        public Builder window(int window) {
            this.window = window;
            return this;
        }

        public Builder horizon(int horizon) {
            this.horizon = horizon;
            return this;
        }

        public Builder inputColumns(List<String> inputColumns) {
            this.inputColumns = inputColumns;
            return this;
        }

        public Builder outputType(String column, String dtype) {
            this.outputTypes.put(column, dtype);
            return this;
        }

        public Builder outputTypes(Map<String, String> outputTypes) {
            this.outputTypes.clear();
            this.outputTypes.putAll(outputTypes);
            return this;
        }

        public PredictorDescriptor build() {
            return new PredictorDescriptor(this);
        }
    }
}
