package com.tessera;

import com.tessera.config.IntegrationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for Tessera.
 *
 * Tessera executes parsed SQL statements across heterogeneous data sources and
 * machine-learning predictors exposed as virtual tables.
 *
 * Key Features:
 * - Filter, sort and limit pushdown into each data source, with local reconciliation of the rest
 * - JOIN between a data table and a predictor, including windowed time-series input per group
 * - CREATE / RETRAIN / DROP PREDICTOR through pluggable model engines
 * - SELECT ... INTO persistence of results into a writable integration
 *
 * Each JDBC integration owns its pool, so no application-wide DataSource is configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(IntegrationProperties.class)
public class TesseraApplication {

    public static void main(String[] args) {
        SpringApplication.run(TesseraApplication.class, args);
    }
}
