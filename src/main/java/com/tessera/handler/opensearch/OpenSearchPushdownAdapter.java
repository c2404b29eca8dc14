package com.tessera.handler.opensearch;

import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;
import com.tessera.query.ast.Latest;
import com.tessera.query.pushdown.PushdownAdapter;
import org.opensearch.index.query.BoolQueryBuilder;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.index.query.QueryBuilders;
import org.opensearch.search.sort.SortBuilders;
import org.opensearch.search.sort.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Translates filter conditions into an OpenSearch bool query.
 *
 * Only conditions with exact semantics are pushed: comparisons on keyword,
 * numeric, date, boolean and ip fields (or the {@code .keyword} sub-field of a
 * text field). Analyzed text is never matched natively. Negations are paired
 * with an {@code exists} filter so that missing fields do not match, as in SQL.
 */
public class OpenSearchPushdownAdapter implements PushdownAdapter<OpenSearchRequest> {

    private static final Logger logger = LoggerFactory.getLogger(OpenSearchPushdownAdapter.class);

    /**
     * Default {@code index.max_result_window}
     */
    static final int MAX_RESULT_WINDOW = 10000;

    private static final Set<String> EXACT_TYPES = Set.of(
        "keyword", "constant_keyword", "long", "integer", "short", "byte", "double", "float",
        "half_float", "scaled_float", "unsigned_long", "date", "date_nanos", "boolean", "ip");

    private final Function<String, OpenSearchRequest> requestFactory;

    public OpenSearchPushdownAdapter(Function<String, OpenSearchRequest> requestFactory) {
        this.requestFactory = requestFactory;
    }

    @Override
    public OpenSearchRequest newRequest(String table) {
        OpenSearchRequest request = requestFactory.apply(table);
        request.getSource().size(MAX_RESULT_WINDOW);
        return request;
    }

    @Override
    public boolean tryPushCondition(OpenSearchRequest request, FilterCondition condition) {
        String field = exactField(request, condition.getColumn());
        if (field == null) {
            return false;
        }
        QueryBuilder filter = buildFilter(request, field, condition);
        if (filter == null) {
            return false;
        }

        BoolQueryBuilder boolQuery = request.getQuery();
        switch (condition.getOperator()) {
            case NOT_EQUAL, NOT_IN, NOT_LIKE -> {
                boolQuery.filter(QueryBuilders.existsQuery(field));
                boolQuery.mustNot(filter);
            }
            case IS_NULL -> boolQuery.mustNot(filter);
            default -> boolQuery.filter(filter);
        }
        logger.trace("Pushed {} into search on {}", condition, request.getIndex());
        return true;
    }

    /**
     * Query matching the positive form of the condition, or null if it cannot be expressed exactly
     */
    private QueryBuilder buildFilter(OpenSearchRequest request, String field, FilterCondition condition) {
        return switch (condition.getOperator()) {
            case EQUAL, NOT_EQUAL -> scalar(condition.getValue()) ? QueryBuilders.termQuery(field, value(condition.getValue())) : null;
            case GREATER_THAN -> scalar(condition.getValue()) ? QueryBuilders.rangeQuery(field).gt(value(condition.getValue())) : null;
            case LESS_THAN -> scalar(condition.getValue()) ? QueryBuilders.rangeQuery(field).lt(value(condition.getValue())) : null;
            case GREATER_THAN_OR_EQUAL -> scalar(condition.getValue()) ? QueryBuilders.rangeQuery(field).gte(value(condition.getValue())) : null;
            case LESS_THAN_OR_EQUAL -> scalar(condition.getValue()) ? QueryBuilders.rangeQuery(field).lte(value(condition.getValue())) : null;
            case IN, NOT_IN -> allScalar(condition.getValues())
                ? QueryBuilders.termsQuery(field, condition.getValues().stream().map(this::value).toArray())
                : null;
            case BETWEEN -> allScalar(condition.getValues())
                ? QueryBuilders.rangeQuery(field)
                    .gte(value(condition.getValues().get(0)))
                    .lte(value(condition.getValues().get(1)))
                : null;
            case LIKE, NOT_LIKE -> condition.getValue() instanceof String && isKeyword(request, field)
                ? QueryBuilders.wildcardQuery(field, toWildcard((String) condition.getValue()))
                : null;
            case IS_NULL, IS_NOT_NULL -> QueryBuilders.existsQuery(field);
        };
    }

    @Override
    public boolean isNativeField(OpenSearchRequest request, String column) {
        return exactField(request, column) != null;
    }

    @Override
    public void applySort(OpenSearchRequest request, List<SortColumn> sort) {
        for (SortColumn key : sort) {
            String field = exactField(request, key.getColumn());
            SortOrder order = key.isAscending() ? SortOrder.ASC : SortOrder.DESC;
            request.getSource().sort(SortBuilders.fieldSort(field)
                .order(order)
                .missing(key.isAscending() ? "_first" : "_last"));
        }
    }

    /**
     * Limits beyond the result window, and no limit at all, are served by scrolling
     */
    @Override
    public void applyLimit(OpenSearchRequest request, Integer limit) {
        request.setLimit(limit);
        request.getSource().size(limit != null ? Math.min(limit, MAX_RESULT_WINDOW) : MAX_RESULT_WINDOW);
    }

    /**
     * Field name usable for exact matching and sorting, or null
     */
    String exactField(OpenSearchRequest request, String column) {
        Map<String, String> types = request.getFieldTypes();
        String type = types.get(column);
        if (type == null) {
            return null;
        }
        if (EXACT_TYPES.contains(type)) {
            return column;
        }
        if ("text".equals(type) && "keyword".equals(types.get(column + ".keyword"))) {
            return column + ".keyword";
        }
        return null;
    }

    /**
     * Wildcard queries only match like SQL LIKE on un-analyzed string fields
     */
    private boolean isKeyword(OpenSearchRequest request, String field) {
        String type = request.getFieldTypes().get(field);
        return "keyword".equals(type) || "constant_keyword".equals(type);
    }

    private boolean scalar(Object value) {
        return value != null && !(value instanceof Latest);
    }

    private boolean allScalar(List<Object> values) {
        return !values.isEmpty() && values.stream().allMatch(this::scalar);
    }

    private Object value(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return value;
    }

    /**
     * SQL LIKE to OpenSearch wildcard: {@code %} to {@code *}, {@code _} to {@code ?},
     * literal wildcard characters escaped
     */
    static String toWildcard(String likePattern) {
        StringBuilder wildcard = new StringBuilder();
        for (char c : likePattern.toCharArray()) {
            switch (c) {
                case '%' -> wildcard.append('*');
                case '_' -> wildcard.append('?');
                case '*', '?', '\\' -> wildcard.append('\\').append(c);
                default -> wildcard.append(c);
            }
        }
        return wildcard.toString();
    }
}
