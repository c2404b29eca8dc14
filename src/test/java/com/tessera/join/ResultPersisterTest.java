package com.tessera.join;

import com.tessera.domain.ColumnType;
import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerKind;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.PersistenceWarning;
import com.tessera.domain.QueryResponse;
import com.tessera.domain.ResultTable;
import com.tessera.handler.DataHandler;
import com.tessera.handler.DestinationHandler;
import com.tessera.handler.HandlerRegistry;
import com.tessera.query.QueryMetrics;
import com.tessera.query.ast.TableIdentifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ResultPersister
 * Tests that INTO failures turn into warnings and successful writes reach the destination
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ResultPersister Tests")
class ResultPersisterTest {

    @Mock
    private DestinationHandler destination;

    @Mock
    private DataHandler readOnly;

    private HandlerRegistry registry;
    private QueryMetrics metrics;
    private ResultPersister persister;
    private ResultTable table;
    private Map<String, ColumnType> types;
    private QueryResponse response;

    @BeforeEach
    void setUp() {
        registry = new HandlerRegistry();
        metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        persister = new ResultPersister(registry, metrics);

        table = new ResultTable(List.of("sqft", "rental_price"));
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("sqft", 917);
        row.put("rental_price", 3901.5);
        table.addRow(row);
        types = new LinkedHashMap<>();
        types.put("sqft", ColumnType.INTEGER);
        types.put("rental_price", ColumnType.FLOAT);
        response = new QueryResponse(table);
    }

    @Test
    @DisplayName("Rows are written through the destination handler")
    void writesToDestination() {
        // Given
        register(destination, "pg");
        when(destination.createOrUpsertTable("public.predictions", types, table)).thenReturn(HandlerResponse.ok());

        // When
        persister.persist(response, TableIdentifier.of("pg", "public", "predictions"), types, table);

        // Then
        assertThat(response.hasWarnings()).isFalse();
        verify(destination).createOrUpsertTable(eq("public.predictions"), eq(types), any(ResultTable.class));
    }

    @Test
    @DisplayName("ERROR from the destination becomes a warning")
    void destinationErrorWarns() {
        register(destination, "pg");
        when(destination.createOrUpsertTable("predictions", types, table))
            .thenReturn(HandlerResponse.error("permission denied for schema public"));

        persister.persist(response, TableIdentifier.of("pg", "predictions"), types, table);

        assertThat(response.getWarnings()).containsExactly(
            new PersistenceWarning("pg.predictions", "permission denied for schema public"));
        assertThat(metrics.getPersistenceWarnings().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Read-only integrations cannot be written to")
    void readOnlyIntegrationWarns() {
        register(readOnly, "logs");

        persister.persist(response, TableIdentifier.of("logs", "predictions"), types, table);

        assertThat(response.getWarnings()).singleElement()
            .extracting(PersistenceWarning::getMessage).asString().contains("does not accept writes");
    }

    @Test
    @DisplayName("Unknown or missing integration qualifiers are warnings")
    void invalidTargetsWarn() {
        persister.persist(response, TableIdentifier.of("predictions"), types, table);
        persister.persist(response, TableIdentifier.of("nowhere", "predictions"), types, table);

        assertThat(response.getWarnings()).extracting(PersistenceWarning::getMessage)
            .containsExactly("INTO target must be written as integration.table", "Unknown integration 'nowhere'");
        assertThat(response.getTable()).isSameAs(table);
    }

    private void register(DataHandler handler, String name) {
        when(handler.getName()).thenReturn(name);
        when(handler.getDescriptor()).thenReturn(HandlerDescriptor.builder(name, HandlerKind.DATABASE).build());
        registry.register(handler);
    }
}
