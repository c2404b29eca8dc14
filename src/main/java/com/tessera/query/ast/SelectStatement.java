package com.tessera.query.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable SELECT statement. Derived sub-queries are built through {@link #toBuilder()}.
 */
public final class SelectStatement implements Statement {

    private final List<Expression> targets;
    private final TableReference from;
    private final Expression where;
    private final List<Expression> groupBy;
    private final Expression having;
    private final List<OrderByItem> orderBy;
    private final Integer limit;
    private final Integer offset;
    private final boolean distinct;
    private final TableIdentifier into;

    private SelectStatement(Builder builder) {
        if (builder.targets.isEmpty()) {
            throw new IllegalArgumentException("SELECT requires at least one target");
        }
        if (builder.limit != null && builder.limit < 0) {
            throw new IllegalArgumentException("LIMIT must not be negative: " + builder.limit);
        }
        if (builder.offset != null && builder.offset < 0) {
            throw new IllegalArgumentException("OFFSET must not be negative: " + builder.offset);
        }
        this.targets = List.copyOf(builder.targets);
        this.from = builder.from;
        this.where = builder.where;
        this.groupBy = List.copyOf(builder.groupBy);
        this.having = builder.having;
        this.orderBy = List.copyOf(builder.orderBy);
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.distinct = builder.distinct;
        this.into = builder.into;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.targets.addAll(targets);
        builder.from = from;
        builder.where = where;
        builder.groupBy.addAll(groupBy);
        builder.having = having;
        builder.orderBy.addAll(orderBy);
        builder.limit = limit;
        builder.offset = offset;
        builder.distinct = distinct;
        builder.into = into;
        return builder;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.SELECT;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public TableReference getFrom() {
        return from;
    }

    public Expression getWhere() {
        return where;
    }

    public List<Expression> getGroupBy() {
        return groupBy;
    }

    public Expression getHaving() {
        return having;
    }

    public List<OrderByItem> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public TableIdentifier getInto() {
        return into;
    }

    public boolean hasStarTarget() {
        return targets.stream().anyMatch(Star.class::isInstance);
    }

    /**
     * Clauses that need the whole input at once and cannot be reconciled row by row
     */
    public boolean hasAggregation() {
        return !groupBy.isEmpty() || having != null || distinct
            || targets.stream().anyMatch(FunctionCall.class::isInstance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectStatement)) return false;
        SelectStatement that = (SelectStatement) o;
        return distinct == that.distinct
            && targets.equals(that.targets)
            && Objects.equals(from, that.from)
            && Objects.equals(where, that.where)
            && groupBy.equals(that.groupBy)
            && Objects.equals(having, that.having)
            && orderBy.equals(that.orderBy)
            && Objects.equals(limit, that.limit)
            && Objects.equals(offset, that.offset)
            && Objects.equals(into, that.into);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targets, from, where, groupBy, having, orderBy, limit, offset, distinct, into);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (distinct) {
            sb.append("DISTINCT ");
        }
        sb.append(targets.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        if (from != null) {
            sb.append(" FROM ").append(from);
        }
        if (where != null) {
            sb.append(" WHERE ").append(where);
        }
        if (!groupBy.isEmpty()) {
            sb.append(" GROUP BY ").append(groupBy.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
        if (having != null) {
            sb.append(" HAVING ").append(having);
        }
        if (!orderBy.isEmpty()) {
            sb.append(" ORDER BY ").append(orderBy.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final List<Expression> targets = new ArrayList<>();
        private TableReference from;
        private Expression where;
        private final List<Expression> groupBy = new ArrayList<>();
        private Expression having;
        private final List<OrderByItem> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;
        private boolean distinct;
        private TableIdentifier into;

        private Builder() {
        }

        public Builder target(Expression target) {
            this.targets.add(target);
            return this;
        }

        public Builder targets(List<? extends Expression> targets) {
            this.targets.clear();
            this.targets.addAll(targets);
            return this;
        }

        public Builder from(TableReference from) {
            this.from = from;
            return this;
        }

        public Builder where(Expression where) {
            this.where = where;
            return this;
        }

        public Builder groupBy(List<? extends Expression> groupBy) {
            this.groupBy.clear();
            this.groupBy.addAll(groupBy);
            return this;
        }

        public Builder having(Expression having) {
            this.having = having;
            return this;
        }

        public Builder orderBy(OrderByItem item) {
            this.orderBy.add(item);
            return this;
        }

        public Builder orderBy(List<OrderByItem> orderBy) {
            this.orderBy.clear();
            this.orderBy.addAll(orderBy);
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder into(TableIdentifier into) {
            this.into = into;
            return this;
        }

        public SelectStatement build() {
            return new SelectStatement(this);
        }
    }
}
