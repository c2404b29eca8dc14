package com.tessera.join;

import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.query.ast.BinaryOperation;
import com.tessera.query.ast.Constant;
import com.tessera.query.ast.Expression;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.OrderByItem;
import com.tessera.query.ast.Star;
import com.tessera.query.local.LocalQueryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResultMerger Tests")
class ResultMergerTest {

    private ResultMerger merger;
    private ResultTable input;
    private ResultTable predictions;

    @BeforeEach
    void setUp() {
        merger = new ResultMerger(new LocalQueryExecutor());

        input = new ResultTable(List.of("sqft", "location", "rental_price"));
        input.addRow(row("sqft", 917, "location", "great", "rental_price", 3901));
        input.addRow(row("sqft", 194, "location", "good", "rental_price", 2042));
        input.addRow(row("sqft", 543, "location", "great", "rental_price", 3500));

        predictions = new ResultTable(List.of("rental_price", "confidence"));
        predictions.addRow(row("rental_price", 4000, "confidence", 0.9));
        predictions.addRow(row("rental_price", 2100, "confidence", 0.4));
        predictions.addRow(row("rental_price", 3300, "confidence", 0.7));
    }

    @Test
    @DisplayName("Rows are merged side by side and targets keep their bare names")
    void mergesRowByRow() {
        // Given
        List<Expression> targets = List.of(Identifier.of("ta", "sqft"), Identifier.of("tb", "rental_price"));

        // When
        MergeResult result = merger.merge(input, "ta", predictions, "tb", targets, List.of(), List.of(), null, null);

        // Then
        assertThat(result.getTable().getColumns()).containsExactly("sqft", "rental_price");
        assertThat(result.getTable().column("sqft")).containsExactly(917, 194, 543);
        assertThat(result.getTable().column("rental_price")).containsExactly(4000, 2100, 3300);
        assertThat(result.getPredictorColumns()).containsExactly(Map.entry("rental_price", "rental_price"));
    }

    @Test
    @DisplayName("Bare names resolve to the predictor side first")
    void bareNamePrefersPredictor() {
        MergeResult result = merger.merge(input, "ta", predictions, "tb",
            List.of(Identifier.of("rental_price").as("predicted")), List.of(), List.of(), null, null);

        assertThat(result.getTable().column("predicted")).containsExactly(4000, 2100, 3300);
        assertThat(result.getPredictorColumns()).containsEntry("predicted", "rental_price");
    }

    @Test
    @DisplayName("Star output qualifies names that appear on both sides")
    void starQualifiesClashes() {
        MergeResult result = merger.merge(input, "ta", predictions, "tb",
            List.of(new Star()), List.of(), List.of(), null, null);

        assertThat(result.getTable().getColumns())
            .containsExactly("sqft", "location", "ta.rental_price", "tb.rental_price", "confidence");
    }

    @Test
    @DisplayName("Qualified star keeps only one side")
    void qualifiedStar() {
        MergeResult result = merger.merge(input, "ta", predictions, "tb",
            List.of(new Star("tb")), List.of(), List.of(), null, null);

        assertThat(result.getTable().getColumns()).containsExactly("rental_price", "confidence");
        assertThatThrownBy(() -> merger.merge(input, "ta", predictions, "tb",
            List.of(new Star("tc")), List.of(), List.of(), null, null))
            .isInstanceOf(PlanningException.class);
    }

    @Test
    @DisplayName("One output name for two different columns is rejected")
    void duplicateAliasRejected() {
        List<Expression> clashing = List.of(
            Identifier.of("ta", "sqft").as("x"),
            Identifier.of("tb", "rental_price").as("x"));

        assertThatThrownBy(() -> merger.merge(input, "ta", predictions, "tb",
            clashing, List.of(), List.of(), null, null))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("'x'");

        MergeResult repeated = merger.merge(input, "ta", predictions, "tb",
            List.of(Identifier.of("tb", "rental_price"), Identifier.of("tb", "rental_price")),
            List.of(), List.of(), null, null);
        assertThat(repeated.getTable().getColumns()).containsExactly("rental_price");
        assertThat(repeated.getTable().column("rental_price")).containsExactly(4000, 2100, 3300);
    }

    @Test
    @DisplayName("Filters, order, offset and limit apply to merged rows")
    void shapesMergedRows() {
        // Given
        List<Expression> conditions = List.of(
            new BinaryOperation(">", Identifier.of("tb", "confidence"), new Constant(0.5)));
        List<OrderByItem> order = List.of(OrderByItem.asc(Identifier.of("tb", "rental_price")));

        // When
        MergeResult result = merger.merge(input, "ta", predictions, "tb",
            List.of(Identifier.of("ta", "sqft"), new Constant("v1", "model_version")), conditions, order, 1, 5);

        // Then
        assertThat(result.getTable().getColumns()).containsExactly("sqft", "model_version");
        assertThat(result.getTable().column("sqft")).containsExactly(917);
        assertThat(result.getTable().column("model_version")).containsExactly("v1");
    }

    @Test
    @DisplayName("Row count mismatch between input and predictions fails")
    void lengthMismatch() {
        ResultTable shortPredictions = predictions.slice(0, 2);

        assertThatThrownBy(() -> merger.merge(input, "ta", shortPredictions, "tb",
            List.of(new Star()), List.of(), List.of(), null, null))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("2 rows for 3 input rows");
    }

    @Test
    @DisplayName("Unknown columns are rejected when rows exist")
    void unknownColumn() {
        assertThatThrownBy(() -> merger.merge(input, "ta", predictions, "tb",
            List.of(Identifier.of("ta", "bedrooms")), List.of(), List.of(), null, null))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("ta.bedrooms");
    }

    @Test
    @DisplayName("Empty input still yields the requested column names")
    void emptyInputKeepsColumns() {
        MergeResult result = merger.merge(ResultTable.empty(), "ta", ResultTable.empty(), "tb",
            List.of(Identifier.of("ta", "sqft"), Identifier.of("rental_price")), List.of(), List.of(), null, null);

        assertThat(result.getTable().getColumns()).containsExactly("sqft", "rental_price");
        assertThat(result.getTable().isEmpty()).isTrue();
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
