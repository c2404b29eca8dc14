package com.tessera.query.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code CREATE PREDICTOR name FROM integration (select) PREDICT target
 * [ORDER BY col] [GROUP BY cols] [WINDOW n] [HORIZON n] [USING engine = '...', ...]}.
 */
public final class CreatePredictorStatement implements Statement {

    private final String name;
    private final String integration;
    private final SelectStatement query;
    private final List<String> targets;
    private final String orderBy;
    private final List<String> groupBy;
    private final int window;
    private final int horizon;
    private final String engine;
    private final Map<String, Object> using;

    private CreatePredictorStatement(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("CREATE PREDICTOR requires a name");
        }
        if (builder.targets.isEmpty()) {
            throw new IllegalArgumentException("CREATE PREDICTOR requires a PREDICT target");
        }
        this.name = builder.name;
        this.integration = builder.integration;
        this.query = builder.query;
        this.targets = List.copyOf(builder.targets);
        this.orderBy = builder.orderBy;
        this.groupBy = List.copyOf(builder.groupBy);
        this.window = builder.window;
        this.horizon = builder.horizon;
        this.engine = builder.engine;
        this.using = Collections.unmodifiableMap(new LinkedHashMap<>(builder.using));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.CREATE_PREDICTOR;
    }

    public String getName() {
        return name;
    }

    public String getIntegration() {
        return integration;
    }

    /**
     * Training data query, relative to the integration
     */
    public SelectStatement getQuery() {
        return query;
    }

    public List<String> getTargets() {
        return targets;
    }

    public String getOrderBy() {
        return orderBy;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public int getWindow() {
        return window;
    }

    public int getHorizon() {
        return horizon;
    }

    public String getEngine() {
        return engine;
    }

    public Map<String, Object> getUsing() {
        return using;
    }

    public boolean isTimeseries() {
        return orderBy != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CreatePredictorStatement)) return false;
        CreatePredictorStatement that = (CreatePredictorStatement) o;
        return window == that.window && horizon == that.horizon
            && name.equals(that.name)
            && Objects.equals(integration, that.integration)
            && Objects.equals(query, that.query)
            && targets.equals(that.targets)
            && Objects.equals(orderBy, that.orderBy)
            && groupBy.equals(that.groupBy)
            && Objects.equals(engine, that.engine)
            && using.equals(that.using);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, integration, query, targets, orderBy, groupBy, window, horizon, engine, using);
    }

    @Override
    public String toString() {
        return "CREATE PREDICTOR " + name + " FROM " + integration + " (" + query + ") PREDICT " + targets;
    }

    public static final class Builder {
        private final String name;
        private String integration;
        private SelectStatement query;
        private final List<String> targets = new ArrayList<>();
        private String orderBy;
        private final List<String> groupBy = new ArrayList<>();
        private int window;
        private int horizon;
        private String engine;
        private final Map<String, Object> using = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder from(String integration, SelectStatement query) {
            this.integration = integration;
            this.query = query;
            return this;
        }

        public Builder predict(String... targets) {
            Collections.addAll(this.targets, targets);
            return this;
        }

        public Builder orderBy(String column) {
            this.orderBy = column;
            return this;
        }

        public Builder groupBy(String... columns) {
            Collections.addAll(this.groupBy, columns);
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

        public Builder engine(String engine) {
            this.engine = engine;
            return this;
        }

        public Builder using(String key, Object value) {
            this.using.put(key, value);
            return this;
        }

        public CreatePredictorStatement build() {
            return new CreatePredictorStatement(this);
        }
    }
}
