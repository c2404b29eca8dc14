package com.tessera.query.local;

import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.query.FilterCondition;
import com.tessera.query.FilterOperator;
import com.tessera.query.SortColumn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for LocalQueryExecutor
 * Covers:
 * - SQL null semantics of every operator
 * - Stable multi-key sort with nulls first ascending, last descending
 * - Offset and limit after filter and sort
 * - Order independence of conjunctive filters
 */
@DisplayName("LocalQueryExecutor Tests")
class LocalQueryExecutorTest {

    private LocalQueryExecutor executor;
    private ResultTable houses;

    @BeforeEach
    void setUp() {
        executor = new LocalQueryExecutor();
        houses = new ResultTable(List.of("id", "location", "sqft", "rental_price"));
        houses.addRow(row(1, "great", 917, 3901));
        houses.addRow(row(2, "good", 194, 2042));
        houses.addRow(row(3, "great", 543, null));
        houses.addRow(row(4, null, 100, 1500));
        houses.addRow(row(5, "poor", 917, 1200));
    }

    @Test
    @DisplayName("Equality never matches null")
    void equalityIgnoresNull() {
        // Given
        List<FilterCondition> conditions = List.of(FilterCondition.of("location", FilterOperator.EQUAL, "great"));

        // When
        ResultTable result = executor.apply(houses, conditions, List.of(), null, null);

        // Then
        assertThat(result.column("id")).containsExactly(1, 3);
    }

    @Test
    @DisplayName("NOT EQUAL and NOT LIKE exclude null rows")
    void negationsExcludeNull() {
        List<FilterCondition> notEqual = List.of(FilterCondition.of("location", FilterOperator.NOT_EQUAL, "great"));
        List<FilterCondition> notLike = List.of(FilterCondition.of("location", FilterOperator.NOT_LIKE, "gr%"));

        assertThat(executor.apply(houses, notEqual, List.of(), null, null).column("id")).containsExactly(2, 5);
        assertThat(executor.apply(houses, notLike, List.of(), null, null).column("id")).containsExactly(2, 5);
    }

    @Test
    @DisplayName("LIKE and NOT LIKE partition the non-null rows")
    void likeComplementsNotLike() {
        FilterCondition like = FilterCondition.of("location", FilterOperator.LIKE, "g%");
        FilterCondition notLike = FilterCondition.of("location", FilterOperator.NOT_LIKE, "g%");

        List<Object> matching = executor.apply(houses, List.of(like), List.of(), null, null).column("id");
        List<Object> rest = executor.apply(houses, List.of(notLike), List.of(), null, null).column("id");

        assertThat(matching).containsExactly(1, 2, 3);
        assertThat(rest).containsExactly(5);
        assertThat(matching).doesNotContainAnyElementsOf(rest);
    }

    @Test
    @DisplayName("NOT IN with a null in the list matches nothing")
    void notInWithNullMatchesNothing() {
        FilterCondition notIn = FilterCondition.of("location", FilterOperator.NOT_IN, Arrays.asList("good", null));

        assertThat(executor.apply(houses, List.of(notIn), List.of(), null, null).getRows()).isEmpty();
    }

    @Test
    @DisplayName("IN compares numbers by value")
    void inComparesNumericValues() {
        FilterCondition in = FilterCondition.of("sqft", FilterOperator.IN, List.of(917.0, 100L));

        assertThat(executor.apply(houses, List.of(in), List.of(), null, null).column("id")).containsExactly(1, 4, 5);
    }

    @Test
    @DisplayName("BETWEEN is inclusive on both bounds")
    void betweenIsInclusive() {
        FilterCondition between = FilterCondition.between("sqft", 194, 543);

        assertThat(executor.apply(houses, List.of(between), List.of(), null, null).column("id")).containsExactly(2, 3);
    }

    @Test
    @DisplayName("IS NULL and IS NOT NULL")
    void nullChecks() {
        assertThat(executor.apply(houses, List.of(FilterCondition.isNull("rental_price")), List.of(), null, null)
            .column("id")).containsExactly(3);
        assertThat(executor.apply(houses, List.of(FilterCondition.isNotNull("location")), List.of(), null, null)
            .column("id")).containsExactly(1, 2, 3, 5);
    }

    @Test
    @DisplayName("Filter result does not depend on condition order")
    void filterIsOrderIndependent() {
        // Given
        List<FilterCondition> conditions = new ArrayList<>(List.of(
            FilterCondition.of("sqft", FilterOperator.GREATER_THAN, 150),
            FilterCondition.of("location", FilterOperator.LIKE, "%r%"),
            FilterCondition.isNotNull("rental_price")));
        List<FilterCondition> reversed = new ArrayList<>(conditions);
        Collections.reverse(reversed);

        // When
        ResultTable forward = executor.apply(houses, conditions, List.of(), null, null);
        ResultTable backward = executor.apply(houses, reversed, List.of(), null, null);

        // Then
        assertThat(forward).isEqualTo(backward);
        assertThat(forward.column("id")).containsExactly(1, 5);
    }

    @Test
    @DisplayName("Applying the same residual twice changes nothing")
    void applyIsIdempotent() {
        List<FilterCondition> conditions = List.of(FilterCondition.of("sqft", FilterOperator.GREATER_THAN_OR_EQUAL, 194));
        List<SortColumn> sort = List.of(SortColumn.desc("sqft"), SortColumn.asc("id"));

        ResultTable once = executor.apply(houses, conditions, sort, 3, null);
        ResultTable twice = executor.apply(once, conditions, sort, 3, null);

        assertThat(twice).isEqualTo(once);
        assertThat(once.column("id")).containsExactly(1, 5, 3);
    }

    @Test
    @DisplayName("Sort is stable and puts nulls first ascending, last descending")
    void sortNullOrdering() {
        ResultTable ascending = executor.apply(houses, List.of(), List.of(SortColumn.asc("rental_price")), null, null);
        ResultTable descending = executor.apply(houses, List.of(), List.of(SortColumn.desc("location")), null, null);

        assertThat(ascending.column("id")).containsExactly(3, 5, 4, 2, 1);
        assertThat(descending.column("id")).containsExactly(5, 1, 3, 2, 4);
    }

    @Test
    @DisplayName("Offset and limit apply after filter and sort")
    void offsetAndLimitAfterSort() {
        ResultTable result = executor.apply(houses, List.of(FilterCondition.isNotNull("location")),
            List.of(SortColumn.asc("sqft")), 1, 2, List.of("id"));

        assertThat(result.getColumns()).containsExactly("id");
        assertThat(result.column("id")).containsExactly(3, 1);
    }

    @Test
    @DisplayName("Applied conditions are skipped")
    void appliedConditionsSkipped() {
        FilterCondition pushed = FilterCondition.of("location", FilterOperator.EQUAL, "nowhere");
        pushed.markApplied();

        assertThat(executor.apply(houses, List.of(pushed), List.of(), null, null).size()).isEqualTo(5);
    }

    @Test
    @DisplayName("Input table is not mutated")
    void inputNotMutated() {
        executor.apply(houses, List.of(FilterCondition.of("id", FilterOperator.LESS_THAN, 3)),
            List.of(SortColumn.desc("id")), 1, null);

        assertThat(houses.column("id")).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    @DisplayName("Unknown filter or sort column is a planning error")
    void unknownColumnRejected() {
        assertThatThrownBy(() -> executor.apply(houses,
            List.of(FilterCondition.of("bedrooms", FilterOperator.EQUAL, 2)), List.of(), null, null))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("bedrooms");
        assertThatThrownBy(() -> executor.apply(houses, List.of(), List.of(SortColumn.asc("bedrooms")), null, null))
            .isInstanceOf(PlanningException.class);
    }

    @Test
    @DisplayName("Numeric strings compare numerically against numbers")
    void numericStringsCoerced() {
        ResultTable table = new ResultTable(List.of("v"));
        table.addRow(Map.of("v", "10"));
        table.addRow(Map.of("v", "9"));

        ResultTable result = executor.apply(table,
            List.of(FilterCondition.of("v", FilterOperator.GREATER_THAN, 9)), List.of(), null, null);

        assertThat(result.column("v")).containsExactly("10");
    }

    private static Map<String, Object> row(Object id, Object location, Object sqft, Object price) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("location", location);
        row.put("sqft", sqft);
        row.put("rental_price", price);
        return row;
    }
}
