package com.tessera.join;

import com.tessera.handler.DataHandler;
import com.tessera.predictor.Predictor;
import com.tessera.query.FilterCondition;
import com.tessera.query.QueryPlan;
import com.tessera.query.ast.Expression;
import com.tessera.query.ast.OrderByItem;
import com.tessera.query.ast.TableIdentifier;

import java.util.List;

/**
 * Everything decided before fetching: which handler is asked what, and what is left
 * for after inference. Built once per execution.
 */
public final class JoinPlan {

    private final JoinSide predictorSide;
    private final JoinSide dataSide;
    private final DataHandler dataHandler;
    private final Predictor predictor;
    private final FilterCondition baseTimeFilter;
    private final QueryPlan queryPlan;
    private final List<Expression> postMergeConditions;
    private final List<OrderByItem> postMergeOrder;
    private final Integer finalOffset;
    private final Integer finalLimit;
    private final List<Expression> targets;
    private final TableIdentifier into;

    private JoinPlan(Builder builder) {
        this.predictorSide = builder.predictorSide;
        this.dataSide = builder.dataSide;
        this.dataHandler = builder.dataHandler;
        this.predictor = builder.predictor;
        this.baseTimeFilter = builder.baseTimeFilter;
        this.queryPlan = builder.queryPlan;
        this.postMergeConditions = List.copyOf(builder.postMergeConditions);
        this.postMergeOrder = List.copyOf(builder.postMergeOrder);
        this.finalOffset = builder.finalOffset;
        this.finalLimit = builder.finalLimit;
        this.targets = List.copyOf(builder.targets);
        this.into = builder.into;
    }

    static Builder builder() {
        return new Builder();
    }

    public JoinSide getPredictorSide() {
        return predictorSide;
    }

    /**
     * Side the input rows come from; for direct predictor queries this is the predictor side itself
     */
    public JoinSide getDataSide() {
        return dataSide;
    }

    public DataHandler getDataHandler() {
        return dataHandler;
    }

    public Predictor getPredictor() {
        return predictor;
    }

    public boolean isTimeseries() {
        return predictor.getDescriptor().isTimeseries();
    }

    /**
     * Condition on the order column the time slices were derived from, null when absent
     */
    public FilterCondition getBaseTimeFilter() {
        return baseTimeFilter;
    }

    public QueryPlan getQueryPlan() {
        return queryPlan;
    }

    /**
     * WHERE conjuncts referencing prediction columns, evaluated on the merged rows
     */
    public List<Expression> getPostMergeConditions() {
        return postMergeConditions;
    }

    public List<OrderByItem> getPostMergeOrder() {
        return postMergeOrder;
    }

    public Integer getFinalOffset() {
        return finalOffset;
    }

    public Integer getFinalLimit() {
        return finalLimit;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public TableIdentifier getInto() {
        return into;
    }

    @Override
    public String toString() {
        return "JoinPlan{" + predictorSide + " x " + dataSide
            + ", subQueries=" + queryPlan.size()
            + ", postMerge=" + postMergeConditions
            + ", limit=" + finalLimit + "}";
    }

    static final class Builder {
        private JoinSide predictorSide;
        private JoinSide dataSide;
        private DataHandler dataHandler;
        private Predictor predictor;
        private FilterCondition baseTimeFilter;
        private QueryPlan queryPlan = new QueryPlan();
        private List<Expression> postMergeConditions = List.of();
        private List<OrderByItem> postMergeOrder = List.of();
        private Integer finalOffset;
        private Integer finalLimit;
        private List<Expression> targets = List.of();
        private TableIdentifier into;

        Builder sides(JoinSide predictorSide, JoinSide dataSide) {
            this.predictorSide = predictorSide;
            this.dataSide = dataSide;
            return this;
        }

        Builder dataHandler(DataHandler dataHandler) {
            this.dataHandler = dataHandler;
            return this;
        }

        Builder predictor(Predictor predictor) {
            this.predictor = predictor;
            return this;
        }

        Builder baseTimeFilter(FilterCondition baseTimeFilter) {
            this.baseTimeFilter = baseTimeFilter;
            return this;
        }

        Builder queryPlan(QueryPlan queryPlan) {
            this.queryPlan = queryPlan;
            return this;
        }

        Builder postMerge(List<Expression> conditions, List<OrderByItem> order, Integer offset, Integer limit) {
            this.postMergeConditions = conditions;
            this.postMergeOrder = order;
            this.finalOffset = offset;
            this.finalLimit = limit;
            return this;
        }

        Builder targets(List<Expression> targets) {
            this.targets = targets;
            return this;
        }

        Builder into(TableIdentifier into) {
            this.into = into;
            return this;
        }

        JoinPlan build() {
            return new JoinPlan(this);
        }
    }
}
