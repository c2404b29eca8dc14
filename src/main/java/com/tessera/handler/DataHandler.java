package com.tessera.handler;

import com.tessera.domain.ConnectionStatus;
import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerResponse;
import com.tessera.error.HandlerConnectionException;
import com.tessera.query.ast.SelectStatement;

/**
 * Capability contract every data source adapter implements.
 *
 * Query operations never throw: every failure is reported as a
 * {@link HandlerResponse} of type ERROR. Only {@link #connect()} raises.
 * Statements passed to {@link #runStructured(SelectStatement)} select from a
 * table name relative to this handler (the integration qualifier is already removed).
 */
public interface DataHandler {

    HandlerDescriptor getDescriptor();

    default String getName() {
        return getDescriptor().getName();
    }

    /**
     * Open the connection. Calling it on a connected handler is a no-op.
     *
     * @throws HandlerConnectionException if the back end cannot be reached
     */
    ConnectionStatus connect();

    /**
     * Release the connection; the handler may be connected again later
     */
    void disconnect();

    ConnectionStatus checkConnection();

    boolean isConnected();

    /**
     * TABLE with columns {@code table_name, table_type}
     */
    HandlerResponse listTables();

    /**
     * TABLE with columns {@code column_name, data_type}
     */
    HandlerResponse listColumns(String table);

    /**
     * Execute a query in the back end's own dialect
     */
    HandlerResponse runNative(String query);

    /**
     * Execute a parsed single-table SELECT
     */
    HandlerResponse runStructured(SelectStatement select);
}
