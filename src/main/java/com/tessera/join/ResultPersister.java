package com.tessera.join;

import com.tessera.domain.ColumnType;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.PersistenceWarning;
import com.tessera.domain.QueryResponse;
import com.tessera.domain.ResultTable;
import com.tessera.handler.DataHandler;
import com.tessera.handler.DestinationHandler;
import com.tessera.handler.HandlerRegistry;
import com.tessera.query.QueryMetrics;
import com.tessera.query.ast.TableIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Writes results into {@code INTO integration.table}.
 *
 * A failed write never fails the statement: it is logged, counted and attached
 * to the response as a {@link PersistenceWarning}.
 */
@Component
public class ResultPersister {

    private static final Logger log = LoggerFactory.getLogger(ResultPersister.class);

    private final HandlerRegistry handlerRegistry;
    private final QueryMetrics metrics;

    public ResultPersister(HandlerRegistry handlerRegistry, QueryMetrics metrics) {
        this.handlerRegistry = handlerRegistry;
        this.metrics = metrics;
    }

    public void persist(QueryResponse response, TableIdentifier into, Map<String, ColumnType> columnTypes,
                        ResultTable table) {
        String destination = String.join(".", into.getParts());
        if (!into.isQualified()) {
            warn(response, destination, "INTO target must be written as integration.table");
            return;
        }
        Optional<DataHandler> handler = handlerRegistry.get(into.getQualifier());
        if (handler.isEmpty()) {
            warn(response, destination, "Unknown integration '" + into.getQualifier() + "'");
            return;
        }
        if (!(handler.get() instanceof DestinationHandler)) {
            warn(response, destination, "Integration '" + into.getQualifier() + "' does not accept writes");
            return;
        }

        HandlerResponse written;
        try {
            written = ((DestinationHandler) handler.get()).createOrUpsertTable(into.getTablePath(), columnTypes, table);
        } catch (RuntimeException e) {
            warn(response, destination, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return;
        }
        if (written.isError()) {
            warn(response, destination, written.getErrorMessage());
            return;
        }
        log.info("Persisted {} rows into {}", table.size(), destination);
    }

    private void warn(QueryResponse response, String destination, String message) {
        log.warn("Could not persist result into {}: {}", destination, message);
        metrics.recordPersistenceWarning();
        response.addWarning(new PersistenceWarning(destination, message));
    }
}
