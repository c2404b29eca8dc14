package com.tessera.config;

import com.tessera.handler.DataHandler;
import com.tessera.handler.HandlerRegistry;
import com.tessera.handler.jdbc.JdbcHandlerFactory;
import com.tessera.handler.memory.InMemoryDataHandler;
import com.tessera.handler.opensearch.OpenSearchHandlerFactory;
import com.tessera.query.pushdown.StructuredQueryRunner;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Registers the integrations declared under {@code tessera.integrations} at startup.
 *
 * Supported engines:
 * - {@code jdbc}: SQL database through a HikariCP pool
 * - {@code opensearch}: OpenSearch cluster through the REST client
 * - {@code memory}: empty in-memory tables, filled through INTO
 *
 * An integration that cannot be built is logged and left unregistered; the others still start.
 * Connections are opened lazily on first use.
 */
@Component
public class IntegrationBootstrap {

    private static final Logger log = LoggerFactory.getLogger(IntegrationBootstrap.class);

    private final IntegrationProperties properties;
    private final HandlerRegistry registry;
    private final JdbcHandlerFactory jdbcFactory;
    private final OpenSearchHandlerFactory openSearchFactory;
    private final StructuredQueryRunner runner;

    public IntegrationBootstrap(IntegrationProperties properties,
                                HandlerRegistry registry,
                                JdbcHandlerFactory jdbcFactory,
                                OpenSearchHandlerFactory openSearchFactory,
                                StructuredQueryRunner runner) {
        this.properties = properties;
        this.registry = registry;
        this.jdbcFactory = jdbcFactory;
        this.openSearchFactory = openSearchFactory;
        this.runner = runner;
    }

    @PostConstruct
    public void registerIntegrations() {
        int registered = 0;
        for (IntegrationProperties.Integration integration : properties.getIntegrations()) {
            try {
                registry.register(create(integration));
                registered++;
            } catch (RuntimeException e) {
                log.error("Integration {} was not registered: {}", integration.getName(), e.getMessage(), e);
            }
        }
        log.info("Registered {} of {} configured integrations", registered, properties.getIntegrations().size());
    }

    DataHandler create(IntegrationProperties.Integration integration) {
        if (integration.getName() == null || integration.getName().isBlank()) {
            throw new IllegalArgumentException("Integration name must not be blank");
        }
        String engine = integration.getEngine() != null ? integration.getEngine().toLowerCase(Locale.ROOT) : "";
        return switch (engine) {
            case "jdbc" -> jdbcFactory.create(integration);
            case "opensearch" -> openSearchFactory.create(integration);
            case "memory" -> new InMemoryDataHandler(integration.getName(), runner);
            default -> throw new IllegalArgumentException("Unknown engine '" + integration.getEngine()
                + "' for integration " + integration.getName());
        };
    }
}
