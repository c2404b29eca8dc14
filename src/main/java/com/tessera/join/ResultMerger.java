package com.tessera.join;

import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.query.ConditionExtractor;
import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;
import com.tessera.query.ast.Constant;
import com.tessera.query.ast.Expression;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.OrderByItem;
import com.tessera.query.ast.Star;
import com.tessera.query.local.LocalQueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Places input rows and prediction rows side by side and shapes the final output.
 *
 * Merged columns are named {@code <alias>.<column>}: input columns under the data
 * alias, prediction columns under the predictor alias. When both aliases are the
 * same (direct predictor queries) a prediction column replaces the input column
 * of the same name. Output naming:
 * - a target alias wins
 * - otherwise the bare column name
 * - when two unaliased outputs share a bare name, both use the qualified form
 */
@Component
public class ResultMerger {

    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    private final LocalQueryExecutor localExecutor;

    public ResultMerger(LocalQueryExecutor localExecutor) {
        this.localExecutor = localExecutor;
    }

    /**
     * @param input rows sent to the predictor
     * @param dataAlias qualifier of input columns
     * @param predictions one row per input row, already realigned
     * @param predictorAlias qualifier of prediction columns
     * @param targets select list
     * @param conditions WHERE conjuncts evaluated on the merged rows
     * @param order ORDER BY applied on the merged rows, may be empty
     * @param offset rows skipped after filtering and sorting, or null
     * @param limit maximum rows kept, or null
     * @throws QueryExecutionException if the two tables differ in length
     * @throws PlanningException if a target or condition names an unknown column
     */
    public MergeResult merge(ResultTable input, String dataAlias,
                             ResultTable predictions, String predictorAlias,
                             List<Expression> targets,
                             List<Expression> conditions,
                             List<OrderByItem> order,
                             Integer offset, Integer limit) {
        if (input.size() != predictions.size()) {
            throw new QueryExecutionException("Predictor returned " + predictions.size()
                + " rows for " + input.size() + " input rows");
        }

        // With no rows there may be no columns to resolve against; unknown names are then accepted
        Layout layout = new Layout(dataAlias, predictorAlias, input.isEmpty());
        input.getColumns().forEach(column -> layout.add(dataAlias, column, false));
        predictions.getColumns().forEach(column -> layout.add(predictorAlias, column, true));

        List<FilterCondition> filters = new ArrayList<>();
        for (Expression condition : conditions) {
            filters.add(ConditionExtractor.toCondition(
                ConditionExtractor.mapIdentifiers(condition, id -> Identifier.of(layout.resolve(id)))));
        }
        List<SortColumn> sort = new ArrayList<>();
        for (OrderByItem item : order) {
            if (!(item.getExpression() instanceof Identifier)) {
                throw new PlanningException("Only column references can be sorted on: " + item);
            }
            sort.add(new SortColumn(layout.resolve((Identifier) item.getExpression()), item.isAscending()));
        }

        ResultTable merged = new ResultTable(new ArrayList<>(layout.columns.keySet()));
        for (int i = 0; i < input.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, Object> value : input.getRows().get(i).entrySet()) {
                row.put(dataAlias + "." + value.getKey(), value.getValue());
            }
            for (Map.Entry<String, Object> value : predictions.getRows().get(i).entrySet()) {
                row.put(predictorAlias + "." + value.getKey(), value.getValue());
            }
            merged.addRow(row);
        }

        ResultTable shaped = localExecutor.apply(merged, filters, sort, offset, limit, null);

        MergeResult result = project(shaped, layout, targets);
        log.debug("Merged {} input rows with predictions into {} rows", input.size(), result.getTable().size());
        return result;
    }

    private MergeResult project(ResultTable merged, Layout layout, List<Expression> targets) {
        List<Output> outputs = new ArrayList<>();
        for (Expression target : targets) {
            if (target instanceof Star) {
                String qualifier = ((Star) target).getQualifier();
                if (qualifier != null && !layout.isAlias(qualifier)) {
                    throw new PlanningException("Unknown table '" + qualifier + "' in " + target);
                }
                for (Column column : layout.columns.values()) {
                    if (qualifier == null || column.alias.equalsIgnoreCase(qualifier)) {
                        outputs.add(Output.column(column, null));
                    }
                }
            } else if (target instanceof Identifier) {
                Identifier identifier = (Identifier) target;
                outputs.add(Output.column(layout.columns.get(layout.resolve(identifier)), identifier.getAlias()));
            } else if (target instanceof Constant) {
                Constant constant = (Constant) target;
                String name = constant.getAlias() != null ? constant.getAlias() : String.valueOf(constant.getValue());
                outputs.add(Output.constant(name, constant.getValue()));
            } else {
                throw new PlanningException("Unsupported select target in a predictor query: " + target);
            }
        }

        Map<String, Set<String>> bareSources = new HashMap<>();
        for (Output output : outputs) {
            if (output.alias == null && output.source != null) {
                bareSources.computeIfAbsent(output.source.name, k -> new HashSet<>()).add(output.source.key);
            }
        }

        List<String> names = new ArrayList<>();
        Map<String, Output> byName = new HashMap<>();
        Map<String, String> predictorColumns = new LinkedHashMap<>();
        for (Output output : outputs) {
            String name;
            if (output.alias != null) {
                name = output.alias;
            } else if (output.source != null && bareSources.get(output.source.name).size() > 1) {
                name = output.source.key;
            } else {
                name = output.source != null ? output.source.name : output.constantName;
            }
            Output previous = byName.putIfAbsent(name, output);
            if (previous != null && !previous.sameValueAs(output)) {
                throw new PlanningException("Output column name '" + name + "' is used for different values");
            }
            output.name = name;
            names.add(name);
            if (output.source != null && output.source.predictor) {
                predictorColumns.put(name, output.source.name);
            }
        }

        ResultTable projected = new ResultTable(new ArrayList<>(new LinkedHashSet<>(names)));
        for (Map<String, Object> row : merged.getRows()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Output output : outputs) {
                values.putIfAbsent(output.name, output.source != null ? row.get(output.source.key) : output.constantValue);
            }
            projected.addRow(values);
        }
        return new MergeResult(projected, predictorColumns);
    }

    /**
     * Merged column bookkeeping and identifier resolution
     */
    private static final class Layout {
        private final String dataAlias;
        private final String predictorAlias;
        private final Map<String, Column> columns = new LinkedHashMap<>();

        private final boolean lenient;

        private Layout(String dataAlias, String predictorAlias, boolean lenient) {
            this.dataAlias = dataAlias;
            this.predictorAlias = predictorAlias;
            this.lenient = lenient;
        }

        private void add(String alias, String name, boolean predictor) {
            String key = alias + "." + name;
            columns.put(key, new Column(key, alias, name, predictor));
        }

        private boolean isAlias(String qualifier) {
            return qualifier.equalsIgnoreCase(dataAlias) || qualifier.equalsIgnoreCase(predictorAlias);
        }

        /**
         * Qualified names select their side; bare names try the predictor side first
         */
        private String resolve(Identifier identifier) {
            String name = identifier.getName();
            List<String> parts = identifier.getParts();
            if (parts.size() > 1) {
                String qualifier = parts.get(parts.size() - 2);
                for (String alias : List.of(predictorAlias, dataAlias)) {
                    if (alias.equalsIgnoreCase(qualifier) && columns.containsKey(alias + "." + name)) {
                        return alias + "." + name;
                    }
                }
                if (lenient && isAlias(qualifier)) {
                    String alias = qualifier.equalsIgnoreCase(predictorAlias) ? predictorAlias : dataAlias;
                    add(alias, name, alias.equals(predictorAlias));
                    return alias + "." + name;
                }
                throw new PlanningException("Unknown column '" + String.join(".", parts) + "'");
            }
            if (columns.containsKey(predictorAlias + "." + name)) {
                return predictorAlias + "." + name;
            }
            if (columns.containsKey(dataAlias + "." + name)) {
                return dataAlias + "." + name;
            }
            if (lenient) {
                add(predictorAlias, name, true);
                return predictorAlias + "." + name;
            }
            throw new PlanningException("Unknown column '" + name + "'");
        }
    }

    private static final class Column {
        private final String key;
        private final String alias;
        private final String name;
        private final boolean predictor;

        private Column(String key, String alias, String name, boolean predictor) {
            this.key = key;
            this.alias = alias;
            this.name = name;
            this.predictor = predictor;
        }
    }

    private static final class Output {
        private Column source;
        private String alias;
        private String constantName;
        private Object constantValue;
        private String name;

        static Output column(Column source, String alias) {
            Output output = new Output();
            output.source = source;
            output.alias = alias;
            return output;
        }

        static Output constant(String name, Object value) {
            Output output = new Output();
            output.constantName = name;
            output.constantValue = value;
            return output;
        }

        boolean sameValueAs(Output other) {
            if (source != null || other.source != null) {
                return source != null && other.source != null && source.key.equals(other.source.key);
            }
            return Objects.equals(constantValue, other.constantValue);
        }
    }
}
