package com.tessera.handler.jdbc;

import com.tessera.config.IntegrationProperties;
import com.tessera.error.HandlerConnectionException;
import com.tessera.query.pushdown.StructuredQueryRunner;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Builds JDBC handlers with a pooled DataSource per integration connection
 */
@Component
public class JdbcHandlerFactory {
    private static final Logger logger = LoggerFactory.getLogger(JdbcHandlerFactory.class);

    private final StructuredQueryRunner runner;

    public JdbcHandlerFactory(StructuredQueryRunner runner) {
        this.runner = runner;
    }

    /**
     * Create a handler backed by a HikariCP pool for the integration
     */
    public JdbcDataHandler create(IntegrationProperties.Integration integration) {
        if (integration.getUrl() == null || integration.getUrl().isBlank()) {
            throw new IllegalArgumentException("Integration '" + integration.getName() + "' requires a JDBC url");
        }
        try {
            HikariConfig config = new HikariConfig();
            config.setPoolName("tessera-" + integration.getName());
            config.setJdbcUrl(integration.getUrl());
            config.setUsername(integration.getUsername());
            config.setPassword(integration.getPassword());
            if (integration.getDriverClassName() != null) {
                config.setDriverClassName(integration.getDriverClassName());
            }

            // Connection pool settings
            config.setMaximumPoolSize(integration.getPoolSize());
            config.setMinimumIdle(0);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);
            // Connections are opened on first use, not at registration
            config.setInitializationFailTimeout(-1);

            config.validate();
            logger.info("JDBC DataSource configured for integration {}", integration.getName());

            // A fresh pool per connect; disconnect closes it
            return new JdbcDataHandler(integration.getName(), () -> new JdbcTemplate(new HikariDataSource(config)),
                SqlRenderer.forJdbcUrl(integration.getUrl()), runner);

        } catch (RuntimeException e) {
            logger.error("Failed to initialize DataSource for integration {}", integration.getName(), e);
            throw new HandlerConnectionException(integration.getName(), "DataSource initialization failed", e);
        }
    }
}
