package com.tessera.handler.opensearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.domain.ColumnDescriptor;
import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerKind;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.domain.TableDescriptor;
import com.tessera.error.HandlerConnectionException;
import com.tessera.handler.PushdownDataHandler;
import com.tessera.handler.jdbc.SqlRenderer;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.pushdown.PushdownAdapter;
import com.tessera.query.pushdown.StructuredQueryRunner;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.opensearch.OpenSearchStatusException;
import org.opensearch.action.search.ClearScrollRequest;
import org.opensearch.action.search.SearchRequest;
import org.opensearch.action.search.SearchResponse;
import org.opensearch.action.search.SearchScrollRequest;
import org.opensearch.client.Request;
import org.opensearch.client.RequestOptions;
import org.opensearch.client.Response;
import org.opensearch.client.ResponseException;
import org.opensearch.client.RestHighLevelClient;
import org.opensearch.client.indices.GetIndexRequest;
import org.opensearch.client.indices.GetIndexResponse;
import org.opensearch.client.indices.GetMappingsRequest;
import org.opensearch.client.indices.GetMappingsResponse;
import org.opensearch.cluster.metadata.MappingMetadata;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.search.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Handler exposing OpenSearch indices as tables.
 *
 * Features:
 * - Filters on exactly-matchable fields become a bool query, sort and limit go into the search source
 * - Unbounded fetches and limits beyond {@code index.max_result_window} page through the scroll API
 * - Columns are the top-level fields of the index mapping, in mapping order
 * - Native queries and aggregation statements run through the SQL plugin ({@code _plugins/_sql})
 * - Retry of I/O failures (3 attempts, 200ms apart); HTTP error responses are not retried
 *
 * The client is created on connect and closed on disconnect, so a handler can be reconnected.
 */
public class OpenSearchDataHandler extends PushdownDataHandler<OpenSearchRequest> {

    private static final Logger log = LoggerFactory.getLogger(OpenSearchDataHandler.class);

    private static final int MAX_ATTEMPTS = 3;
    private static final Duration RETRY_WAIT = Duration.ofMillis(200);
    private static final String SQL_ENDPOINT = "/_plugins/_sql";
    private static final int SCROLL_PAGE_SIZE = 1000;
    private static final TimeValue SCROLL_KEEP_ALIVE = TimeValue.timeValueMinutes(5);

    private final Supplier<RestHighLevelClient> clientFactory;
    private final ObjectMapper objectMapper;
    private final SqlRenderer renderer = new SqlRenderer("`");
    private final OpenSearchPushdownAdapter adapter;
    private final Map<String, IndexMapping> mappings = new ConcurrentHashMap<>();
    private final Retry retry;

    private volatile RestHighLevelClient client;

    public OpenSearchDataHandler(String name, Supplier<RestHighLevelClient> clientFactory,
                                 ObjectMapper objectMapper, StructuredQueryRunner runner) {
        super(HandlerDescriptor.builder(name, HandlerKind.API).fullPushdown().build(), runner);
        this.clientFactory = clientFactory;
        this.objectMapper = objectMapper;
        this.adapter = new OpenSearchPushdownAdapter(this::newRequest);

        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(MAX_ATTEMPTS)
            .waitDuration(RETRY_WAIT)
            .retryOnException(e -> e instanceof IOException && !(e instanceof ResponseException))
            .build();
        this.retry = Retry.of("opensearch-" + name, retryConfig);
        this.retry.getEventPublisher().onRetry(event ->
            log.warn("Retrying {} after I/O failure (attempt {}): {}",
                name, event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    @Override
    protected void doConnect() throws Exception {
        RestHighLevelClient created = clientFactory.get();
        if (!created.ping(RequestOptions.DEFAULT)) {
            created.close();
            throw new HandlerConnectionException(getName(), "Cluster did not answer ping");
        }
        client = created;
    }

    @Override
    protected void doDisconnect() throws Exception {
        mappings.clear();
        RestHighLevelClient current = client;
        client = null;
        if (current != null) {
            current.close();
        }
    }

    @Override
    protected void doCheckConnection() throws Exception {
        if (!client.ping(RequestOptions.DEFAULT)) {
            throw new HandlerConnectionException(getName(), "Cluster did not answer ping");
        }
    }

    @Override
    protected List<TableDescriptor> doListTables() throws Exception {
        GetIndexResponse response = retry.executeCallable(() ->
            client.indices().get(new GetIndexRequest("*"), RequestOptions.DEFAULT));
        List<TableDescriptor> tables = new ArrayList<>();
        for (String index : response.getIndices()) {
            // system and hidden indices
            if (!index.startsWith(".")) {
                tables.add(new TableDescriptor(index, "BASE TABLE"));
            }
        }
        return tables;
    }

    @Override
    protected List<ColumnDescriptor> doListColumns(String table) throws Exception {
        IndexMapping mapping = mapping(table);
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (String column : mapping.columns) {
            columns.add(new ColumnDescriptor(column, mapping.fieldTypes.getOrDefault(column, "object")));
        }
        return columns;
    }

    @Override
    protected HandlerResponse doRunNative(String query) throws Exception {
        log.debug("Executing SQL on {}: {}", getName(), query);
        Request request = new Request("POST", SQL_ENDPOINT);
        request.setJsonEntity(objectMapper.writeValueAsString(Map.of("query", query)));
        Response response = retry.executeCallable(() -> client.getLowLevelClient().performRequest(request));
        try (InputStream body = response.getEntity().getContent()) {
            return HandlerResponse.table(parseSqlResponse(objectMapper.readTree(body)));
        }
    }

    /**
     * Read the {@code schema}/{@code datarows} shape returned by the SQL plugin
     */
    ResultTable parseSqlResponse(JsonNode root) {
        List<String> columns = new ArrayList<>();
        for (JsonNode column : root.path("schema")) {
            String alias = column.path("alias").asText(null);
            columns.add(alias != null ? alias : column.path("name").asText());
        }
        ResultTable table = new ResultTable(columns);
        for (JsonNode dataRow : root.path("datarows")) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), objectMapper.convertValue(dataRow.get(i), Object.class));
            }
            table.addRow(row);
        }
        return table;
    }

    @Override
    protected PushdownAdapter<OpenSearchRequest> pushdownAdapter() {
        return adapter;
    }

    @Override
    protected ResultTable fetch(OpenSearchRequest request) throws Exception {
        log.debug("Searching {} on {}", request, getName());
        ResultTable table = new ResultTable(request.getColumns());
        Integer limit = request.getLimit();
        if (limit == null || limit > OpenSearchPushdownAdapter.MAX_RESULT_WINDOW) {
            return scroll(request, table, limit);
        }
        SearchRequest searchRequest = new SearchRequest(request.getIndex()).source(request.getSource());
        SearchResponse response = retry.executeCallable(() -> client.search(searchRequest, RequestOptions.DEFAULT));
        addHits(table, request, response.getHits().getHits(), limit);
        return table;
    }

    /**
     * Page through the matching documents with the scroll API, stopping at the limit if there is one
     */
    private ResultTable scroll(OpenSearchRequest request, ResultTable table, Integer limit) throws Exception {
        request.getSource().size(SCROLL_PAGE_SIZE);
        SearchRequest searchRequest = new SearchRequest(request.getIndex())
            .source(request.getSource())
            .scroll(SCROLL_KEEP_ALIVE);
        SearchResponse response = retry.executeCallable(() -> client.search(searchRequest, RequestOptions.DEFAULT));
        String scrollId = response.getScrollId();
        int pages = 1;
        try {
            SearchHit[] hits = response.getHits().getHits();
            while (hits.length > 0) {
                addHits(table, request, hits, limit);
                if (limit != null && table.size() >= limit) {
                    break;
                }
                SearchScrollRequest scrollRequest = new SearchScrollRequest(scrollId).scroll(SCROLL_KEEP_ALIVE);
                response = retry.executeCallable(() -> client.scroll(scrollRequest, RequestOptions.DEFAULT));
                scrollId = response.getScrollId();
                hits = response.getHits().getHits();
                pages++;
            }
        } finally {
            clearScroll(scrollId);
        }
        log.debug("Scrolled {} hits in {} pages from {}", table.size(), pages, request.getIndex());
        return table;
    }

    private void clearScroll(String scrollId) {
        if (scrollId == null) {
            return;
        }
        ClearScrollRequest clearScrollRequest = new ClearScrollRequest();
        clearScrollRequest.addScrollId(scrollId);
        try {
            client.clearScroll(clearScrollRequest, RequestOptions.DEFAULT);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to clear scroll context on {}: {}", getName(), e.getMessage());
        }
    }

    private static void addHits(ResultTable table, OpenSearchRequest request, SearchHit[] hits, Integer limit) {
        for (SearchHit hit : hits) {
            if (limit != null && table.size() >= limit) {
                return;
            }
            Map<String, Object> source = hit.getSourceAsMap();
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : request.getColumns()) {
                row.put(column, source != null ? source.get(column) : null);
            }
            table.addRow(row);
        }
    }

    @Override
    protected String renderNative(SelectStatement select) {
        return renderer.render(select);
    }

    @Override
    protected Integer errorCodeOf(Exception e) {
        if (e instanceof ResponseException) {
            return ((ResponseException) e).getResponse().getStatusLine().getStatusCode();
        }
        if (e instanceof OpenSearchStatusException) {
            return ((OpenSearchStatusException) e).status().getStatus();
        }
        return super.errorCodeOf(e);
    }

    private OpenSearchRequest newRequest(String index) {
        try {
            IndexMapping mapping = mapping(index);
            return new OpenSearchRequest(index, mapping.fieldTypes, mapping.columns);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read mapping of " + index + ": " + e.getMessage(), e);
        }
    }

    private IndexMapping mapping(String index) throws IOException {
        IndexMapping cached = mappings.get(index);
        if (cached != null) {
            return cached;
        }
        GetMappingsResponse response;
        try {
            response = retry.executeCallable(() ->
                client.indices().getMapping(new GetMappingsRequest().indices(index), RequestOptions.DEFAULT));
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException(e);
        }
        IndexMapping mapping = new IndexMapping();
        for (MappingMetadata metadata : response.mappings().values()) {
            mapping.add(metadata.sourceAsMap());
        }
        mappings.put(index, mapping);
        return mapping;
    }

    /**
     * Field types of one index (or of every index matching a pattern), flattened to dotted names
     */
    static class IndexMapping {
        final Map<String, String> fieldTypes = new LinkedHashMap<>();
        final List<String> columns = new ArrayList<>();
        private final Set<String> seen = new LinkedHashSet<>();

        @SuppressWarnings("unchecked")
        void add(Map<String, Object> source) {
            Object properties = source.get("properties");
            if (!(properties instanceof Map)) {
                return;
            }
            for (String field : ((Map<String, Object>) properties).keySet()) {
                if (seen.add(field)) {
                    columns.add(field);
                }
            }
            flatten("", (Map<String, Object>) properties);
        }

        @SuppressWarnings("unchecked")
        private void flatten(String prefix, Map<String, Object> properties) {
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                if (!(entry.getValue() instanceof Map)) {
                    continue;
                }
                String name = prefix + entry.getKey();
                Map<String, Object> field = (Map<String, Object>) entry.getValue();
                if (field.get("type") != null) {
                    fieldTypes.putIfAbsent(name, String.valueOf(field.get("type")));
                }
                if (field.get("properties") instanceof Map) {
                    flatten(name + ".", (Map<String, Object>) field.get("properties"));
                }
                if (field.get("fields") instanceof Map) {
                    flatten(name + ".", (Map<String, Object>) field.get("fields"));
                }
            }
        }
    }
}
