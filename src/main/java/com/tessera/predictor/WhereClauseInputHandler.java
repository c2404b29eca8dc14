package com.tessera.predictor;

import com.tessera.domain.ColumnDescriptor;
import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerKind;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.domain.TableDescriptor;
import com.tessera.error.PlanningException;
import com.tessera.handler.AbstractDataHandler;
import com.tessera.query.ConditionExtractor;
import com.tessera.query.FilterCondition;
import com.tessera.query.FilterOperator;
import com.tessera.query.SortColumn;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.pushdown.PushdownAdapter;
import com.tessera.query.pushdown.PushdownResult;
import com.tessera.query.pushdown.PushdownTranslator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materializes predictor input from the WHERE clause of a direct predictor query.
 *
 * {@code SELECT price FROM models.home WHERE sqft = 100 AND rooms IN (2, 3)} yields
 * one input row per combination of the given values. Only {@code =} and {@code IN}
 * can supply values; any other condition is a planning error. Without a WHERE
 * clause a single empty row is produced.
 */
public class WhereClauseInputHandler extends AbstractDataHandler {

    static final String NAME = "where_clause_input";

    private final PushdownTranslator translator;
    private final InputAdapter adapter = new InputAdapter();

    public WhereClauseInputHandler(PushdownTranslator translator) {
        super(HandlerDescriptor.builder(NAME, HandlerKind.ML).pushdownFilter(true).build());
        this.translator = translator;
    }

    @Override
    protected void doConnect() {
    }

    @Override
    protected List<TableDescriptor> doListTables() {
        return List.of();
    }

    @Override
    protected List<ColumnDescriptor> doListColumns(String table) {
        return List.of();
    }

    @Override
    protected HandlerResponse doRunNative(String query) {
        return HandlerResponse.error("Predictor input cannot be given as a native query");
    }

    @Override
    protected ResultTable doRunStructured(SelectStatement select) {
        List<FilterCondition> conditions = ConditionExtractor.extractConditions(select.getWhere());
        PushdownResult<InputRequest> result = translator.translate(NAME, conditions, List.of(), null, adapter, descriptor);
        if (!result.getResidualConditions().isEmpty()) {
            throw new PlanningException("Only = and IN conditions can supply predictor input, got "
                + result.getResidualConditions());
        }
        return result.getRequest().materialize();
    }

    /**
     * Column values collected from the pushed conditions
     */
    static final class InputRequest {
        private final Map<String, List<Object>> values = new LinkedHashMap<>();

        /**
         * Cartesian product of the collected values, first column varying slowest
         */
        ResultTable materialize() {
            ResultTable table = new ResultTable(new ArrayList<>(values.keySet()));
            List<Map<String, Object>> rows = new ArrayList<>();
            rows.add(new LinkedHashMap<>());
            for (Map.Entry<String, List<Object>> column : values.entrySet()) {
                List<Map<String, Object>> next = new ArrayList<>();
                for (Map<String, Object> row : rows) {
                    for (Object value : column.getValue()) {
                        Map<String, Object> extended = new LinkedHashMap<>(row);
                        extended.put(column.getKey(), value);
                        next.add(extended);
                    }
                }
                rows = next;
            }
            rows.forEach(table::addRow);
            return table;
        }

        @Override
        public String toString() {
            return "InputRequest" + values;
        }
    }

    private static final class InputAdapter implements PushdownAdapter<InputRequest> {

        @Override
        public InputRequest newRequest(String table) {
            return new InputRequest();
        }

        @Override
        public boolean tryPushCondition(InputRequest request, FilterCondition condition) {
            if (request.values.containsKey(condition.getColumn())) {
                return false;
            }
            if (condition.getOperator() == FilterOperator.EQUAL) {
                List<Object> single = new ArrayList<>(1);
                single.add(condition.getValue());
                request.values.put(condition.getColumn(), single);
                return true;
            }
            if (condition.getOperator() == FilterOperator.IN && !condition.getValues().isEmpty()) {
                request.values.put(condition.getColumn(), new ArrayList<>(condition.getValues()));
                return true;
            }
            return false;
        }

        @Override
        public boolean isNativeField(InputRequest request, String column) {
            return false;
        }

        @Override
        public void applySort(InputRequest request, List<SortColumn> sort) {
        }

        @Override
        public void applyLimit(InputRequest request, Integer limit) {
        }
    }
}
