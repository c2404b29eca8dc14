package com.tessera.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Integrations declared under {@code tessera.integrations}, registered at startup.
 */
@ConfigurationProperties(prefix = "tessera")
public class IntegrationProperties {

    private List<Integration> integrations = new ArrayList<>();

    public List<Integration> getIntegrations() {
        return integrations;
    }

    public void setIntegrations(List<Integration> integrations) {
        this.integrations = integrations;
    }

    /**
     * One data source: {@code engine} selects the handler implementation
     * ({@code jdbc}, {@code opensearch} or {@code memory})
     */
    public static class Integration {
        private String name;
        private String engine;
        private String url;
        private String username;
        private String password;
        private String driverClassName;
        private int poolSize = 10;
        private List<String> hosts = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEngine() {
            return engine;
        }

        public void setEngine(String engine) {
            this.engine = engine;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDriverClassName() {
            return driverClassName;
        }

        public void setDriverClassName(String driverClassName) {
            this.driverClassName = driverClassName;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public List<String> getHosts() {
            return hosts;
        }

        public void setHosts(List<String> hosts) {
            this.hosts = hosts;
        }

        @Override
        public String toString() {
            return "Integration{" + name + ", engine=" + engine + "}";
        }
    }
}
