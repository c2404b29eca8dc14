package com.tessera.handler.opensearch;

import com.tessera.config.IntegrationProperties;
import org.apache.http.HttpHost;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenSearchHandlerFactory Tests")
class OpenSearchHandlerFactoryTest {

    @Test
    @DisplayName("Host entries default to port 9200 and take the scheme from the url")
    void parsesHostList() {
        IntegrationProperties.Integration integration = integration("logs");
        integration.setUrl("https://cluster.example");
        integration.setHosts(List.of("node-1:9201", " node-2 "));

        HttpHost[] hosts = OpenSearchHandlerFactory.parseHosts(integration);

        assertThat(hosts).extracting(HttpHost::getHostName).containsExactly("node-1", "node-2");
        assertThat(hosts).extracting(HttpHost::getPort).containsExactly(9201, 9200);
        assertThat(hosts).extracting(HttpHost::getSchemeName).containsOnly("https");
    }

    @Test
    @DisplayName("Url alone yields a single host")
    void parsesUrl() {
        IntegrationProperties.Integration integration = integration("logs");
        integration.setUrl("http://localhost:9250");

        HttpHost[] hosts = OpenSearchHandlerFactory.parseHosts(integration);

        assertThat(hosts).hasSize(1);
        assertThat(hosts[0].toURI()).isEqualTo("http://localhost:9250");
    }

    @Test
    @DisplayName("Integration without hosts or url is rejected")
    void requiresHosts() {
        assertThatThrownBy(() -> OpenSearchHandlerFactory.parseHosts(integration("logs")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("logs");
    }

    private static IntegrationProperties.Integration integration(String name) {
        IntegrationProperties.Integration integration = new IntegrationProperties.Integration();
        integration.setName(name);
        integration.setEngine("opensearch");
        return integration;
    }
}
