package com.tessera.handler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tessera.domain.ColumnDescriptor;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.domain.TableDescriptor;
import com.tessera.error.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Cached table and column listings of registered handlers.
 *
 * Listings are cached per handler for a configurable TTL; all entries of a handler
 * are evicted when it is unregistered. ERROR responses are never cached.
 */
@Component
public class HandlerCatalog {

    private static final Logger log = LoggerFactory.getLogger(HandlerCatalog.class);

    private final HandlerRegistry registry;

    /**
     * Keys are {@code handler} for table listings and {@code handler/table} for column listings
     */
    private final Cache<String, Object> cache;

    public HandlerCatalog(HandlerRegistry registry,
                          @Value("${tessera.catalog.cache-ttl-minutes:5}") long ttlMinutes,
                          @Value("${tessera.catalog.cache-max-size:1000}") long maxSize) {
        this.registry = registry;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
            .recordStats()
            .build();
        registry.addUnregisterListener(this::invalidate);
        log.info("HandlerCatalog initialized with cache (TTL={}min, maxSize={})", ttlMinutes, maxSize);
    }

    @SuppressWarnings("unchecked")
    public List<TableDescriptor> getTables(String integration) {
        String key = key(integration);
        List<TableDescriptor> cached = (List<TableDescriptor>) cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        DataHandler handler = registry.require(integration);
        ResultTable table = unwrap(handler, handler.listTables(), "list tables");
        List<TableDescriptor> tables = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            tables.add(new TableDescriptor(String.valueOf(row.get("table_name")), (String) row.get("table_type")));
        }
        List<TableDescriptor> result = List.copyOf(tables);
        cache.put(key, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    public List<ColumnDescriptor> getColumns(String integration, String tableName) {
        String key = key(integration) + "/" + tableName;
        List<ColumnDescriptor> cached = (List<ColumnDescriptor>) cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        DataHandler handler = registry.require(integration);
        ResultTable table = unwrap(handler, handler.listColumns(tableName), "list columns of " + tableName);
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            columns.add(new ColumnDescriptor(String.valueOf(row.get("column_name")), (String) row.get("data_type")));
        }
        List<ColumnDescriptor> result = List.copyOf(columns);
        cache.put(key, result);
        return result;
    }

    /**
     * Evict every cached listing of one handler
     */
    public void invalidate(String integration) {
        String prefix = key(integration);
        cache.asMap().keySet().removeIf(key -> key.equals(prefix) || key.startsWith(prefix + "/"));
        log.debug("Invalidated catalog entries for {}", integration);
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private ResultTable unwrap(DataHandler handler, HandlerResponse response, String action) {
        if (response.isError()) {
            throw new QueryExecutionException("Failed to " + action + ": " + response.getErrorMessage(),
                handler.getName(), null, response.getErrorCode());
        }
        return response.tableOrEmpty();
    }

    private static String key(String integration) {
        return integration.toLowerCase(Locale.ROOT);
    }
}
