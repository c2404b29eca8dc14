package com.tessera.handler;

import com.tessera.domain.ColumnDescriptor;
import com.tessera.domain.ConnectionStatus;
import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.domain.TableDescriptor;
import com.tessera.error.ErrorKind;
import com.tessera.error.HandlerConnectionException;
import com.tessera.error.QueryExecutionException;
import com.tessera.error.TesseraException;
import com.tessera.query.ast.SelectStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class implementing the handler boundary rules once.
 *
 * - connect() is idempotent and serialized
 * - every query call connects lazily and converts any exception into an ERROR response
 *   that keeps the exception's {@link ErrorKind} when it has one
 * - subclasses implement the {@code do*} hooks and may throw freely
 */
public abstract class AbstractDataHandler implements DataHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractDataHandler.class);

    protected final HandlerDescriptor descriptor;
    private volatile boolean connected;

    protected AbstractDataHandler(HandlerDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public HandlerDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public synchronized ConnectionStatus connect() {
        if (connected) {
            return ConnectionStatus.connected();
        }
        try {
            doConnect();
        } catch (HandlerConnectionException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerConnectionException(getName(), "Failed to connect: " + e.getMessage(), e);
        }
        connected = true;
        log.info("Handler {} connected", getName());
        return ConnectionStatus.connected();
    }

    @Override
    public synchronized void disconnect() {
        if (!connected) {
            return;
        }
        connected = false;
        try {
            doDisconnect();
            log.info("Handler {} disconnected", getName());
        } catch (Exception e) {
            log.warn("Handler {} did not disconnect cleanly: {}", getName(), e.getMessage());
        }
    }

    @Override
    public ConnectionStatus checkConnection() {
        try {
            connect();
            doCheckConnection();
            return ConnectionStatus.connected();
        } catch (Exception e) {
            log.debug("Connection check failed for {}: {}", getName(), e.getMessage());
            return ConnectionStatus.failed(e.getMessage());
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public HandlerResponse listTables() {
        return call("listTables", () -> {
            ResultTable table = new ResultTable(List.of("table_name", "table_type"));
            for (TableDescriptor entry : doListTables()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("table_name", entry.getName());
                row.put("table_type", entry.getType());
                table.addRow(row);
            }
            return HandlerResponse.table(table);
        });
    }

    @Override
    public HandlerResponse listColumns(String tableName) {
        return call("listColumns", () -> {
            ResultTable table = new ResultTable(List.of("column_name", "data_type"));
            for (ColumnDescriptor column : doListColumns(tableName)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("column_name", column.getName());
                row.put("data_type", column.getDataType());
                table.addRow(row);
            }
            return HandlerResponse.table(table);
        });
    }

    @Override
    public HandlerResponse runNative(String query) {
        return call("runNative", () -> doRunNative(query));
    }

    @Override
    public HandlerResponse runStructured(SelectStatement select) {
        return call("runStructured", () -> HandlerResponse.table(doRunStructured(select)));
    }

    /**
     * Connect lazily and normalize any failure to an ERROR response
     */
    protected HandlerResponse call(String operation, HandlerCall call) {
        try {
            connect();
            return call.execute();
        } catch (Exception e) {
            log.debug("Handler {} failed in {}: {}", getName(), operation, e.getMessage(), e);
            return HandlerResponse.error(describe(e), errorCodeOf(e), kindOf(e));
        }
    }

    /**
     * Message reported in ERROR responses
     */
    protected String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Provider error code carried by the exception, if any
     */
    protected Integer errorCodeOf(Exception e) {
        if (e instanceof QueryExecutionException) {
            return ((QueryExecutionException) e).getErrorCode();
        }
        return null;
    }

    private static ErrorKind kindOf(Exception e) {
        return e instanceof TesseraException ? ((TesseraException) e).getKind() : ErrorKind.EXECUTION;
    }

    protected abstract void doConnect() throws Exception;

    protected void doDisconnect() throws Exception {
    }

    protected void doCheckConnection() throws Exception {
    }

    protected abstract List<TableDescriptor> doListTables() throws Exception;

    protected abstract List<ColumnDescriptor> doListColumns(String table) throws Exception;

    protected abstract HandlerResponse doRunNative(String query) throws Exception;

    protected abstract ResultTable doRunStructured(SelectStatement select) throws Exception;

    @FunctionalInterface
    protected interface HandlerCall {
        HandlerResponse execute() throws Exception;
    }
}
