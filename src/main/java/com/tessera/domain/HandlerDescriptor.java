package com.tessera.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable identity and capability flags of a registered handler.
 *
 * Flags must be declared truthfully: the translator trusts them when deciding
 * what to push down.
 */
public final class HandlerDescriptor {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("kind")
    private final HandlerKind kind;

    @JsonProperty("supports_native_query")
    private final boolean supportsNativeQuery;

    @JsonProperty("supports_pushdown_filter")
    private final boolean supportsPushdownFilter;

    @JsonProperty("supports_pushdown_sort")
    private final boolean supportsPushdownSort;

    @JsonProperty("supports_pushdown_limit")
    private final boolean supportsPushdownLimit;

    private HandlerDescriptor(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Handler name must not be blank");
        }
        this.name = builder.name;
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.supportsNativeQuery = builder.supportsNativeQuery;
        this.supportsPushdownFilter = builder.supportsPushdownFilter;
        this.supportsPushdownSort = builder.supportsPushdownSort;
        this.supportsPushdownLimit = builder.supportsPushdownLimit;
    }

    public static Builder builder(String name, HandlerKind kind) {
        return new Builder(name, kind);
    }

    public String getName() {
        return name;
    }

    public HandlerKind getKind() {
        return kind;
    }

    public boolean supportsNativeQuery() {
        return supportsNativeQuery;
    }

    public boolean supportsPushdownFilter() {
        return supportsPushdownFilter;
    }

    public boolean supportsPushdownSort() {
        return supportsPushdownSort;
    }

    public boolean supportsPushdownLimit() {
        return supportsPushdownLimit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HandlerDescriptor)) return false;
        HandlerDescriptor that = (HandlerDescriptor) o;
        return supportsNativeQuery == that.supportsNativeQuery
            && supportsPushdownFilter == that.supportsPushdownFilter
            && supportsPushdownSort == that.supportsPushdownSort
            && supportsPushdownLimit == that.supportsPushdownLimit
            && name.equals(that.name)
            && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, supportsNativeQuery, supportsPushdownFilter,
            supportsPushdownSort, supportsPushdownLimit);
    }

    @Override
    public String toString() {
        return "HandlerDescriptor{" + name + ", " + kind
            + ", native=" + supportsNativeQuery
            + ", filter=" + supportsPushdownFilter
            + ", sort=" + supportsPushdownSort
            + ", limit=" + supportsPushdownLimit + "}";
    }

    public static final class Builder {
        private final String name;
        private final HandlerKind kind;
        private boolean supportsNativeQuery;
        private boolean supportsPushdownFilter;
        private boolean supportsPushdownSort;
        private boolean supportsPushdownLimit;

        private Builder(String name, HandlerKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder nativeQuery(boolean value) {
            this.supportsNativeQuery = value;
            return this;
        }

        public Builder pushdownFilter(boolean value) {
            this.supportsPushdownFilter = value;
            return this;
        }

        public Builder pushdownSort(boolean value) {
            this.supportsPushdownSort = value;
            return this;
        }

        public Builder pushdownLimit(boolean value) {
            this.supportsPushdownLimit = value;
            return this;
        }

        /**
         * Enable every pushdown capability and native queries
         */
        public Builder fullPushdown() {
            return nativeQuery(true).pushdownFilter(true).pushdownSort(true).pushdownLimit(true);
        }

        public HandlerDescriptor build() {
            return new HandlerDescriptor(this);
        }
    }
}
