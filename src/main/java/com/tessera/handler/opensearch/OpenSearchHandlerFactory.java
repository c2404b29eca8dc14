package com.tessera.handler.opensearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.config.IntegrationProperties;
import com.tessera.query.pushdown.StructuredQueryRunner;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.opensearch.client.RestClient;
import org.opensearch.client.RestClientBuilder;
import org.opensearch.client.RestHighLevelClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;

/**
 * Builds OpenSearch handlers from integration settings
 */
@Component
public class OpenSearchHandlerFactory {
    private static final Logger logger = LoggerFactory.getLogger(OpenSearchHandlerFactory.class);

    private static final int DEFAULT_PORT = 9200;

    private final StructuredQueryRunner runner;
    private final ObjectMapper objectMapper;

    public OpenSearchHandlerFactory(StructuredQueryRunner runner, ObjectMapper objectMapper) {
        this.runner = runner;
        this.objectMapper = objectMapper;
    }

    public OpenSearchDataHandler create(IntegrationProperties.Integration integration) {
        HttpHost[] hosts = parseHosts(integration);
        logger.info("OpenSearch integration {} configured with hosts: {}", integration.getName(), List.of(hosts));
        return new OpenSearchDataHandler(integration.getName(),
            () -> buildClient(hosts, integration.getUsername(), integration.getPassword()),
            objectMapper, runner);
    }

    /**
     * Hosts come from {@code hosts} ("host:port" entries) or, when empty, from {@code url}
     */
    static HttpHost[] parseHosts(IntegrationProperties.Integration integration) {
        String scheme = "http";
        if (integration.getUrl() != null && !integration.getUrl().isBlank()) {
            URI uri = URI.create(integration.getUrl());
            scheme = uri.getScheme() != null ? uri.getScheme() : scheme;
            if (integration.getHosts().isEmpty()) {
                int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
                return new HttpHost[] {new HttpHost(uri.getHost(), port, scheme)};
            }
        }
        if (integration.getHosts().isEmpty()) {
            throw new IllegalArgumentException("Integration '" + integration.getName() + "' requires hosts or url");
        }
        HttpHost[] httpHosts = new HttpHost[integration.getHosts().size()];
        for (int i = 0; i < httpHosts.length; i++) {
            String[] parts = integration.getHosts().get(i).trim().split(":");
            int port = parts.length > 1 ? Integer.parseInt(parts[1]) : DEFAULT_PORT;
            httpHosts[i] = new HttpHost(parts[0], port, scheme);
        }
        return httpHosts;
    }

    private RestHighLevelClient buildClient(HttpHost[] hosts, String username, String password) {
        RestClientBuilder builder = RestClient.builder(hosts)
            .setRequestConfigCallback(requestConfigBuilder ->
                requestConfigBuilder
                    .setConnectTimeout(5000)
                    .setSocketTimeout(60000)
            );

        if (username != null) {
            CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(
                AuthScope.ANY,
                new UsernamePasswordCredentials(username, password)
            );
            builder.setHttpClientConfigCallback(httpClientBuilder ->
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider)
            );
        }
        return new RestHighLevelClient(builder);
    }
}
