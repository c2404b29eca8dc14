package com.tessera.query;

import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.error.ErrorKind;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.handler.DataHandler;
import com.tessera.query.ast.BinaryOperation;
import com.tessera.query.ast.Constant;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.Star;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for QueryExecutor
 * Tests sequential and parallel fetching, plan-order reassembly and error propagation
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("QueryExecutor Tests")
class QueryExecutorTest {

    @Mock
    private DataHandler handler;

    private QueryMetrics metrics;
    private QueryExecutor queryExecutor;

    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        queryExecutor = new QueryExecutor(metrics, false, 4);
    }

    @Test
    @DisplayName("Null or empty plan returns an empty table without touching the handler")
    void emptyPlan() {
        assertThat(queryExecutor.fetch(null, handler).isEmpty()).isTrue();
        assertThat(queryExecutor.fetch(new QueryPlan(), handler).getColumns()).isEmpty();

        verify(handler, never()).runStructured(any());
    }

    @Test
    @DisplayName("Sub-query results are concatenated in plan order")
    void sequentialConcatenation() {
        // Given
        SelectStatement us = selectCountry("US");
        SelectStatement fr = selectCountry("FR");
        when(handler.getName()).thenReturn("pg");
        when(handler.runStructured(us)).thenReturn(HandlerResponse.table(rows("US", 1, 2)));
        when(handler.runStructured(fr)).thenReturn(HandlerResponse.table(rows("FR", 3)));

        QueryPlan plan = new QueryPlan();
        plan.addSubQuery(new SubQuery(us, Map.of("country", "US"), "history", null));
        plan.addSubQuery(new SubQuery(fr, Map.of("country", "FR"), "history", null));

        // When
        ResultTable result = queryExecutor.fetch(plan, handler);

        // Then
        assertThat(result.column("country")).containsExactly("US", "US", "FR");
        assertThat(result.column("day")).containsExactly(1, 2, 3);
        assertThat(metrics.getSubQueriesExecuted().count()).isEqualTo(2.0);
        assertThat(metrics.getFetchLatency().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Parallel fetch reassembles results in plan order")
    void parallelKeepsPlanOrder() {
        // Given: the first sub-query is the slowest
        queryExecutor = new QueryExecutor(metrics, true, 4);
        SelectStatement us = selectCountry("US");
        SelectStatement fr = selectCountry("FR");
        SelectStatement de = selectCountry("DE");
        when(handler.getName()).thenReturn("pg");
        when(handler.runStructured(us)).thenAnswer(invocation -> {
            Thread.sleep(100);
            return HandlerResponse.table(rows("US", 1));
        });
        when(handler.runStructured(fr)).thenReturn(HandlerResponse.table(rows("FR", 2)));
        when(handler.runStructured(de)).thenReturn(HandlerResponse.table(rows("DE", 3)));

        QueryPlan plan = new QueryPlan();
        plan.addSubQuery(new SubQuery(us));
        plan.addSubQuery(new SubQuery(fr));
        plan.addSubQuery(new SubQuery(de));

        // When
        ResultTable result = queryExecutor.fetch(plan, handler);

        // Then
        assertThat(result.column("country")).containsExactly("US", "FR", "DE");
    }

    @Test
    @DisplayName("ERROR response fails the whole fetch")
    void errorResponseFailsFetch() {
        // Given
        SelectStatement us = selectCountry("US");
        SelectStatement fr = selectCountry("FR");
        when(handler.getName()).thenReturn("pg");
        when(handler.runStructured(us)).thenReturn(HandlerResponse.error("relation \"sales\" does not exist", 42));

        QueryPlan plan = new QueryPlan();
        plan.addSubQuery(new SubQuery(us));
        plan.addSubQuery(new SubQuery(fr));

        // When / Then
        assertThatThrownBy(() -> queryExecutor.fetch(plan, handler))
            .isInstanceOf(QueryExecutionException.class)
            .satisfies(e -> {
                QueryExecutionException qe = (QueryExecutionException) e;
                assertThat(qe.getHandlerName()).isEqualTo("pg");
                assertThat(qe.getErrorCode()).isEqualTo(42);
                assertThat(qe.getMessage()).contains("does not exist");
            });
        verify(handler, never()).runStructured(fr);
        assertThat(metrics.getHandlerErrors().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("ERROR response of kind PLANNING is raised as a planning error")
    void planningErrorResponseKeepsKind() {
        // Given
        SelectStatement us = selectCountry("US");
        when(handler.getName()).thenReturn("pg");
        when(handler.runStructured(us)).thenReturn(
            HandlerResponse.error("Unknown sort column 'revenue'", null, ErrorKind.PLANNING));

        QueryPlan plan = new QueryPlan();
        plan.addSubQuery(new SubQuery(us));

        // When / Then
        assertThatThrownBy(() -> queryExecutor.fetch(plan, handler))
            .isInstanceOf(PlanningException.class)
            .hasMessage("Unknown sort column 'revenue'");
    }

    @Test
    @DisplayName("Slices with a resort column come back ascending")
    void resortsSlice() {
        // Given: handler returned the latest rows first
        SelectStatement us = selectCountry("US");
        when(handler.getName()).thenReturn("pg");
        when(handler.runStructured(us)).thenReturn(HandlerResponse.table(rows("US", 9, 8, 7)));

        QueryPlan plan = new QueryPlan();
        plan.addSubQuery(new SubQuery(us, Map.of("country", "US"), "window", "day"));

        // When
        ResultTable result = queryExecutor.fetch(plan, handler);

        // Then
        assertThat(result.column("day")).containsExactly(7, 8, 9);
    }

    @Test
    @DisplayName("OK responses contribute no rows")
    void okResponseIsEmpty() {
        SelectStatement us = selectCountry("US");
        when(handler.getName()).thenReturn("pg");
        when(handler.runStructured(us)).thenReturn(HandlerResponse.ok());

        QueryPlan plan = new QueryPlan();
        plan.addSubQuery(new SubQuery(us));

        assertThat(queryExecutor.fetch(plan, handler).isEmpty()).isTrue();
    }

    private static SelectStatement selectCountry(String country) {
        return SelectStatement.builder()
            .target(new Star())
            .from(TableIdentifier.of("sales"))
            .where(new BinaryOperation("=", Identifier.of("country"), new Constant(country)))
            .build();
    }

    private static ResultTable rows(String country, int... days) {
        ResultTable table = new ResultTable(List.of("country", "day"));
        for (int day : days) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("country", country);
            row.put("day", day);
            table.addRow(row);
        }
        return table;
    }
}
