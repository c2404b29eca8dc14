package com.tessera.handler.jdbc;

import com.tessera.domain.ColumnDescriptor;
import com.tessera.domain.ColumnType;
import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerKind;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.domain.TableDescriptor;
import com.tessera.handler.DestinationHandler;
import com.tessera.handler.PushdownDataHandler;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.pushdown.PushdownAdapter;
import com.tessera.query.pushdown.StructuredQueryRunner;
import com.zaxxer.hikari.HikariDataSource;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Handler for SQL databases reached through JDBC.
 *
 * Features:
 * - Full pushdown: filters, sort and limit are rendered into the SQL request
 * - Native queries and aggregation statements rendered verbatim
 * - Table and column listings from information_schema
 * - Destination for INTO: CREATE TABLE IF NOT EXISTS followed by a batch insert
 * - Retry of transient data access failures (3 attempts, 200ms apart)
 *
 * The pool is built on connect and closed on disconnect, so a handler can be reconnected
 * after a timed-out statement left its connections in an unknown state.
 */
public class JdbcDataHandler extends PushdownDataHandler<SqlRequest> implements DestinationHandler {

    private static final Logger log = LoggerFactory.getLogger(JdbcDataHandler.class);

    private static final int MAX_ATTEMPTS = 3;
    private static final Duration RETRY_WAIT = Duration.ofMillis(200);

    private final Supplier<JdbcTemplate> templateFactory;
    private final SqlRenderer renderer;
    private final JdbcPushdownAdapter adapter;
    private final Retry retry;

    private volatile JdbcTemplate jdbcTemplate;

    public JdbcDataHandler(String name, Supplier<JdbcTemplate> templateFactory, SqlRenderer renderer,
                           StructuredQueryRunner runner) {
        super(HandlerDescriptor.builder(name, HandlerKind.DATABASE).fullPushdown().build(), runner);
        this.templateFactory = templateFactory;
        this.renderer = renderer;
        this.adapter = new JdbcPushdownAdapter(renderer);

        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(MAX_ATTEMPTS)
            .waitDuration(RETRY_WAIT)
            .retryExceptions(TransientDataAccessException.class, RecoverableDataAccessException.class)
            .build();
        this.retry = Retry.of("jdbc-" + name, retryConfig);
        this.retry.getEventPublisher().onRetry(event ->
            log.warn("Retrying {} after transient failure (attempt {}): {}",
                name, event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    @Override
    protected void doConnect() {
        JdbcTemplate created = templateFactory.get();
        try {
            created.queryForObject("SELECT 1", Integer.class);
        } catch (RuntimeException e) {
            closePool(created);
            throw e;
        }
        jdbcTemplate = created;
    }

    @Override
    protected void doDisconnect() {
        JdbcTemplate current = jdbcTemplate;
        jdbcTemplate = null;
        if (current != null) {
            closePool(current);
        }
    }

    @Override
    protected void doCheckConnection() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    }

    @Override
    protected List<TableDescriptor> doListTables() throws Exception {
        String sql = "SELECT table_name, table_type FROM information_schema.tables"
            + " WHERE table_schema NOT IN ('information_schema', 'pg_catalog', 'mysql', 'performance_schema', 'sys')";
        ResultTable table = query(sql);
        List<TableDescriptor> tables = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            tables.add(new TableDescriptor(String.valueOf(value(row, "table_name")), (String) value(row, "table_type")));
        }
        return tables;
    }

    @Override
    protected List<ColumnDescriptor> doListColumns(String table) throws Exception {
        String sql = "SELECT column_name, data_type FROM information_schema.columns WHERE table_name = "
            + renderer.literal(table) + " ORDER BY ordinal_position";
        ResultTable result = query(sql);
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (Map<String, Object> row : result.getRows()) {
            columns.add(new ColumnDescriptor(String.valueOf(value(row, "column_name")), (String) value(row, "data_type")));
        }
        return columns;
    }

    @Override
    protected HandlerResponse doRunNative(String query) throws Exception {
        log.debug("Executing native query on {}: {}", getName(), query);
        return retry.executeCallable(() -> jdbcTemplate.execute((StatementCallback<HandlerResponse>) statement -> {
            boolean hasResultSet = statement.execute(query);
            if (!hasResultSet) {
                return HandlerResponse.ok();
            }
            return HandlerResponse.table(ResultTableExtractor.INSTANCE.extractData(statement.getResultSet()));
        }));
    }

    @Override
    protected PushdownAdapter<SqlRequest> pushdownAdapter() {
        return adapter;
    }

    @Override
    protected ResultTable fetch(SqlRequest request) throws Exception {
        String sql = renderer.render(request);
        log.debug("Executing pushed-down query on {}: {}", getName(), sql);
        return query(sql);
    }

    @Override
    protected String renderNative(SelectStatement select) {
        return renderer.render(select);
    }

    @Override
    public HandlerResponse createOrUpsertTable(String table, Map<String, ColumnType> columnTypes, ResultTable rows) {
        return call("createOrUpsertTable", () -> {
            jdbcTemplate.execute(renderer.createTable(table, columnTypes));
            List<String> columns = new ArrayList<>(columnTypes.keySet());
            List<Object[]> batch = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows.getRows()) {
                Object[] values = new Object[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    values[i] = row.get(columns.get(i));
                }
                batch.add(values);
            }
            if (!batch.isEmpty()) {
                jdbcTemplate.batchUpdate(renderer.insert(table, columns), batch);
            }
            log.info("Wrote {} rows into {}.{}", batch.size(), getName(), table);
            return HandlerResponse.ok();
        });
    }

    @Override
    protected Integer errorCodeOf(Exception e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException) {
                return ((SQLException) current).getErrorCode();
            }
            current = current.getCause();
        }
        return super.errorCodeOf(e);
    }

    @Override
    protected String describe(Exception e) {
        if (e instanceof DataAccessException && ((DataAccessException) e).getMostSpecificCause() != null) {
            return ((DataAccessException) e).getMostSpecificCause().getMessage();
        }
        return super.describe(e);
    }

    private ResultTable query(String sql) throws Exception {
        return retry.executeCallable(() -> jdbcTemplate.query(sql, ResultTableExtractor.INSTANCE));
    }

    private static void closePool(JdbcTemplate template) {
        if (template.getDataSource() instanceof HikariDataSource) {
            ((HikariDataSource) template.getDataSource()).close();
        }
    }

    /**
     * information_schema column labels are upper-case on some databases
     */
    private static Object value(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value != null ? value : row.get(column.toUpperCase());
    }
}
