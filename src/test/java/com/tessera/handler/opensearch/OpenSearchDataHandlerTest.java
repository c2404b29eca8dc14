package com.tessera.handler.opensearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.query.QueryMetrics;
import com.tessera.query.ast.BinaryOperation;
import com.tessera.query.ast.Constant;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.OrderByItem;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.Star;
import com.tessera.query.ast.TableIdentifier;
import com.tessera.query.local.LocalQueryExecutor;
import com.tessera.query.pushdown.PushdownTranslator;
import com.tessera.query.pushdown.StructuredQueryRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.action.search.ClearScrollRequest;
import org.opensearch.action.search.SearchRequest;
import org.opensearch.action.search.SearchResponse;
import org.opensearch.action.search.SearchScrollRequest;
import org.opensearch.client.IndicesClient;
import org.opensearch.client.RequestOptions;
import org.opensearch.client.RestHighLevelClient;
import org.opensearch.client.indices.GetMappingsRequest;
import org.opensearch.client.indices.GetMappingsResponse;
import org.opensearch.cluster.metadata.MappingMetadata;
import org.opensearch.search.SearchHit;
import org.opensearch.search.SearchHits;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for OpenSearchDataHandler
 * Tests mapping discovery, search translation, retries and SQL plugin responses
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OpenSearchDataHandler Tests")
class OpenSearchDataHandlerTest {

    @Mock
    private RestHighLevelClient client;

    @Mock
    private IndicesClient indicesClient;

    @Mock
    private GetMappingsResponse mappingsResponse;

    @Mock
    private MappingMetadata mappingMetadata;

    @Mock
    private SearchResponse searchResponse;

    @Mock
    private SearchHits searchHits;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OpenSearchDataHandler handler;

    @BeforeEach
    void setUp() {
        QueryMetrics metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        StructuredQueryRunner runner = new StructuredQueryRunner(new PushdownTranslator(4), new LocalQueryExecutor(),
            metrics, 100_000);
        handler = new OpenSearchDataHandler("logs", () -> client, objectMapper, runner);
    }

    @Test
    @DisplayName("Exact filters, sort and limit go into the search request")
    void pushesIntoSearch() throws Exception {
        // Given
        givenConnectedWithMapping();
        SearchHit[] hits = {
            hit(Map.of("level", "error", "message", "db timeout", "ts", "2024-03-01T10:00:00Z")),
            hit(Map.of("level", "error", "message", "api timeout", "ts", "2024-03-01T09:00:00Z"))};
        when(client.search(any(SearchRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(searchResponse);
        when(searchResponse.getHits()).thenReturn(searchHits);
        when(searchHits.getHits()).thenReturn(hits);
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("message"))
            .from(TableIdentifier.of("app-logs"))
            .where(BinaryOperation.and(
                new BinaryOperation("=", Identifier.of("level"), new Constant("error")),
                new BinaryOperation("like", Identifier.of("message"), new Constant("%timeout%"))))
            .orderBy(OrderByItem.desc(Identifier.of("ts")))
            .limit(2)
            .build();

        // When
        HandlerResponse response = handler.runStructured(select);

        // Then
        assertThat(response.isError()).isFalse();
        assertThat(response.getTable().column("message")).containsExactly("db timeout", "api timeout");

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(client).search(captor.capture(), eq(RequestOptions.DEFAULT));
        SearchRequest sent = captor.getValue();
        assertThat(sent.indices()).containsExactly("app-logs");
        assertThat(sent.source().size()).isEqualTo(2);
        assertThat(sent.source().query().toString()).contains("\"term\"").contains("message.keyword");
        assertThat(sent.source().sorts()).hasSize(1);
    }

    @Test
    @DisplayName("Analyzed text is filtered locally and missing fields come back as null")
    void residualFilterOnText() throws Exception {
        // Given
        givenConnectedWithMapping();
        SearchHit[] hits = {
            hit(Map.of("level", "info", "body", "started")),
            hit(Map.of("level", "warn", "body", "slow"))};
        when(client.search(any(SearchRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(searchResponse);
        when(searchResponse.getHits()).thenReturn(searchHits);
        when(searchHits.getHits()).thenReturn(hits);
        SelectStatement select = SelectStatement.builder()
            .target(new Star())
            .from(TableIdentifier.of("app-logs"))
            .where(new BinaryOperation("=", Identifier.of("body"), new Constant("slow")))
            .limit(1)
            .build();

        // When
        ResultTable result = handler.runStructured(select).getTable();

        // Then: batch of 4 requested, fewer returned, so no second fetch
        assertThat(result.getColumns()).containsExactly("level", "message", "body", "ts", "http");
        assertThat(result.column("level")).containsExactly("warn");
        assertThat(result.column("ts")).containsExactly((Object) null);
        verify(client, times(1)).search(any(SearchRequest.class), eq(RequestOptions.DEFAULT));
    }

    @Test
    @DisplayName("I/O failures during search are retried")
    void ioFailureRetried() throws Exception {
        givenConnectedWithMapping();
        when(client.search(any(SearchRequest.class), eq(RequestOptions.DEFAULT)))
            .thenThrow(new IOException("connection reset"))
            .thenReturn(searchResponse);
        when(searchResponse.getHits()).thenReturn(searchHits);
        when(searchHits.getHits()).thenReturn(new SearchHit[0]);
        SelectStatement select = SelectStatement.builder()
            .target(new Star())
            .from(TableIdentifier.of("app-logs"))
            .build();

        HandlerResponse response = handler.runStructured(select);

        assertThat(response.isError()).isFalse();
        assertThat(response.getTable().isEmpty()).isTrue();
        verify(client, times(2)).search(any(SearchRequest.class), eq(RequestOptions.DEFAULT));
    }

    @Test
    @DisplayName("Unbounded fetches scroll through every page and clear the scroll context")
    void unboundedFetchScrolls() throws Exception {
        // Given
        givenConnectedWithMapping();
        SearchResponse secondPage = mock(SearchResponse.class);
        SearchHits secondHits = mock(SearchHits.class);
        SearchResponse lastPage = mock(SearchResponse.class);
        SearchHits noHits = mock(SearchHits.class);
        when(client.search(any(SearchRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(searchResponse);
        when(searchResponse.getScrollId()).thenReturn("scroll-1");
        when(searchResponse.getHits()).thenReturn(searchHits);
        SearchHit[] firstPageHits = {
            hit(Map.of("level", "info", "ts", "2024-03-01T08:00:00Z")),
            hit(Map.of("level", "warn", "ts", "2024-03-01T09:00:00Z"))};
        when(searchHits.getHits()).thenReturn(firstPageHits);
        when(secondPage.getScrollId()).thenReturn("scroll-2");
        when(secondPage.getHits()).thenReturn(secondHits);
        SearchHit[] secondPageHits = {
            hit(Map.of("level", "error", "ts", "2024-03-01T10:00:00Z"))};
        when(secondHits.getHits()).thenReturn(secondPageHits);
        when(lastPage.getScrollId()).thenReturn("scroll-3");
        when(lastPage.getHits()).thenReturn(noHits);
        when(noHits.getHits()).thenReturn(new SearchHit[0]);
        when(client.scroll(any(SearchScrollRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(secondPage, lastPage);
        SelectStatement select = SelectStatement.builder()
            .target(Identifier.of("level"))
            .from(TableIdentifier.of("app-logs"))
            .build();

        // When
        HandlerResponse response = handler.runStructured(select);

        // Then
        assertThat(response.isError()).isFalse();
        assertThat(response.getTable().column("level")).containsExactly("info", "warn", "error");
        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(client).search(captor.capture(), eq(RequestOptions.DEFAULT));
        assertThat(captor.getValue().scroll()).isNotNull();
        verify(client, times(2)).scroll(any(SearchScrollRequest.class), eq(RequestOptions.DEFAULT));
        verify(client).clearScroll(argThat((ClearScrollRequest clear) -> clear.getScrollIds().contains("scroll-3")),
            eq(RequestOptions.DEFAULT));
    }

    @Test
    @DisplayName("Failed ping closes the client and reports an ERROR")
    void failedPing() throws Exception {
        when(client.ping(RequestOptions.DEFAULT)).thenReturn(false);

        HandlerResponse response = handler.listTables();

        assertThat(response.isError()).isTrue();
        assertThat(response.getErrorMessage()).contains("ping");
        assertThat(handler.isConnected()).isFalse();
        verify(client).close();
    }

    @Test
    @DisplayName("SQL plugin responses are read by column alias")
    void parsesSqlResponse() throws Exception {
        String json = "{\"schema\":[{\"name\":\"level\",\"type\":\"keyword\"},"
            + "{\"name\":\"COUNT(*)\",\"alias\":\"n\",\"type\":\"integer\"}],"
            + "\"datarows\":[[\"error\",3],[\"warn\",null]],\"total\":2,\"size\":2,\"status\":200}";

        ResultTable table = handler.parseSqlResponse(objectMapper.readTree(json));

        assertThat(table.getColumns()).containsExactly("level", "n");
        assertThat(table.column("n")).containsExactly(3, null);
    }

    @Test
    @DisplayName("Mappings flatten to dotted field names with top-level columns in order")
    void flattensMapping() {
        OpenSearchDataHandler.IndexMapping mapping = new OpenSearchDataHandler.IndexMapping();

        mapping.add(logsMapping());

        assertThat(mapping.columns).containsExactly("level", "message", "body", "ts", "http");
        assertThat(mapping.fieldTypes)
            .containsEntry("message.keyword", "keyword")
            .containsEntry("http.status", "integer")
            .doesNotContainKey("http");
    }

    private void givenConnectedWithMapping() throws Exception {
        when(client.ping(RequestOptions.DEFAULT)).thenReturn(true);
        when(client.indices()).thenReturn(indicesClient);
        when(indicesClient.getMapping(any(GetMappingsRequest.class), eq(RequestOptions.DEFAULT)))
            .thenReturn(mappingsResponse);
        when(mappingsResponse.mappings()).thenReturn(Map.of("app-logs", mappingMetadata));
        when(mappingMetadata.sourceAsMap()).thenReturn(logsMapping());
    }

    private static Map<String, Object> logsMapping() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("level", Map.of("type", "keyword"));
        properties.put("message", Map.of("type", "text", "fields", Map.of("keyword", Map.of("type", "keyword"))));
        properties.put("body", Map.of("type", "text"));
        properties.put("ts", Map.of("type", "date"));
        properties.put("http", Map.of("properties", Map.of("status", Map.of("type", "integer"))));
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("properties", properties);
        return source;
    }

    private static SearchHit hit(Map<String, Object> source) {
        SearchHit hit = mock(SearchHit.class);
        when(hit.getSourceAsMap()).thenReturn(source);
        return hit;
    }
}
