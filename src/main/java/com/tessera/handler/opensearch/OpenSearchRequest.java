package com.tessera.handler.opensearch;

import org.opensearch.index.query.BoolQueryBuilder;
import org.opensearch.index.query.QueryBuilders;
import org.opensearch.search.builder.SearchSourceBuilder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Search against one index, with the index mapping needed to decide what can be pushed.
 */
public class OpenSearchRequest {

    private final String index;
    private final Map<String, String> fieldTypes;
    private final List<String> columns;
    private final BoolQueryBuilder query;
    private final SearchSourceBuilder source;
    private Integer limit;

    /**
     * @param index index name or pattern
     * @param fieldTypes mapped type per field, sub-fields in dotted form ({@code name.keyword})
     * @param columns top-level fields in mapping order
     */
    public OpenSearchRequest(String index, Map<String, String> fieldTypes, List<String> columns) {
        this.index = index;
        this.fieldTypes = Collections.unmodifiableMap(fieldTypes);
        this.columns = List.copyOf(columns);
        this.query = QueryBuilders.boolQuery();
        this.source = new SearchSourceBuilder().query(query);
    }

    public String getIndex() {
        return index;
    }

    public Map<String, String> getFieldTypes() {
        return fieldTypes;
    }

    public List<String> getColumns() {
        return columns;
    }

    public BoolQueryBuilder getQuery() {
        return query;
    }

    public SearchSourceBuilder getSource() {
        return source;
    }

    /**
     * Maximum number of hits wanted, null for every matching document
     */
    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    @Override
    public String toString() {
        return index + " " + source;
    }
}
