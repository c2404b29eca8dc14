package com.tessera.handler;

import com.tessera.domain.ColumnType;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;

import java.util.Map;

/**
 * Handler that can receive query results through {@code SELECT ... INTO integration.table}
 */
public interface DestinationHandler extends DataHandler {

    /**
     * Create the table when it does not exist, then append the rows
     *
     * @param table handler-relative table name
     * @param columnTypes storage type per column, in column order
     * @param rows rows to write
     * @return OK, or ERROR describing why nothing was written
     */
    HandlerResponse createOrUpsertTable(String table, Map<String, ColumnType> columnTypes, ResultTable rows);
}
