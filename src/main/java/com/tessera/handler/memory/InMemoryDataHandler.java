package com.tessera.handler.memory;

import com.tessera.domain.ColumnDescriptor;
import com.tessera.domain.ColumnType;
import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerKind;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.domain.TableDescriptor;
import com.tessera.error.QueryExecutionException;
import com.tessera.handler.DestinationHandler;
import com.tessera.handler.PushdownDataHandler;
import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;
import com.tessera.query.pushdown.PushdownAdapter;
import com.tessera.query.pushdown.StructuredQueryRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File-style tables held in memory.
 *
 * Nothing is pushed down: every filter, sort and limit is applied by the local
 * executor on the full table. Results written through INTO are appended to the
 * named table, which is created on first write.
 */
public class InMemoryDataHandler extends PushdownDataHandler<String> implements DestinationHandler {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDataHandler.class);

    private final Map<String, ResultTable> tables = new ConcurrentHashMap<>();
    private final Map<String, String> displayNames = new ConcurrentHashMap<>();

    private final PushdownAdapter<String> adapter = new PushdownAdapter<>() {
        @Override
        public String newRequest(String table) {
            return table;
        }

        @Override
        public boolean tryPushCondition(String request, FilterCondition condition) {
            return false;
        }

        @Override
        public boolean isNativeField(String request, String column) {
            return false;
        }

        @Override
        public void applySort(String request, List<SortColumn> sort) {
        }

        @Override
        public void applyLimit(String request, Integer limit) {
        }
    };

    public InMemoryDataHandler(String name, StructuredQueryRunner runner) {
        super(HandlerDescriptor.builder(name, HandlerKind.DATABASE).build(), runner);
    }

    /**
     * Register or replace a table with a copy of the given content
     */
    public void registerTable(String table, ResultTable content) {
        String key = table.toLowerCase(Locale.ROOT);
        tables.put(key, new ResultTable(content.getColumns(), content.getRows()));
        displayNames.put(key, table);
        log.debug("Table {} registered on {} with {} rows", table, getName(), content.size());
    }

    @Override
    protected void doConnect() {
    }

    @Override
    protected List<TableDescriptor> doListTables() {
        List<TableDescriptor> result = new ArrayList<>();
        for (String key : tables.keySet()) {
            result.add(new TableDescriptor(displayNames.get(key), "BASE TABLE"));
        }
        result.sort((a, b) -> a.getName().compareTo(b.getName()));
        return result;
    }

    @Override
    protected List<ColumnDescriptor> doListColumns(String table) {
        ResultTable content = table(table);
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (String column : content.getColumns()) {
            columns.add(new ColumnDescriptor(column, inferType(content, column)));
        }
        return columns;
    }

    @Override
    protected HandlerResponse doRunNative(String query) {
        return HandlerResponse.error("Handler " + getName() + " does not accept native queries");
    }

    @Override
    protected PushdownAdapter<String> pushdownAdapter() {
        return adapter;
    }

    @Override
    protected ResultTable fetch(String table) {
        return table(table);
    }

    @Override
    public HandlerResponse createOrUpsertTable(String table, Map<String, ColumnType> columnTypes, ResultTable rows) {
        return call("createOrUpsertTable", () -> {
            String key = table.toLowerCase(Locale.ROOT);
            ResultTable incoming = rows.project(new ArrayList<>(columnTypes.keySet()));
            tables.merge(key, incoming, ResultTable::concat);
            displayNames.putIfAbsent(key, table);
            log.info("Wrote {} rows into {}.{}", incoming.size(), getName(), table);
            return HandlerResponse.ok();
        });
    }

    private ResultTable table(String table) {
        ResultTable content = tables.get(table.toLowerCase(Locale.ROOT));
        if (content == null) {
            throw new QueryExecutionException("Table '" + table + "' does not exist", getName());
        }
        return content;
    }

    private static String inferType(ResultTable content, String column) {
        for (Object value : content.column(column)) {
            if (value instanceof Integer || value instanceof Long) {
                return "int";
            }
            if (value instanceof Number) {
                return "float";
            }
            if (value instanceof Boolean) {
                return "bool";
            }
            if (value != null) {
                return "str";
            }
        }
        return "str";
    }
}
