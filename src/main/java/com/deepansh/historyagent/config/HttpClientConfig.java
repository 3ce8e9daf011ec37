package com.deepansh.historyagent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * RestClient used by the generation client, backed by a pooled Apache HttpClient.
 *
 * The response timeout equals the configured generation timeout so a hung provider
 * surfaces as a network error (retried) rather than a blocked thread.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    private static final Timeout CONNECT_TIMEOUT = Timeout.ofSeconds(10);

    @Bean
    public RestClient.Builder generationRestClientBuilder(AgentProperties properties) {
        Timeout responseTimeout = Timeout.ofMilliseconds(properties.getGenerationTimeout().toMillis());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(CONNECT_TIMEOUT)
                                        .setSocketTimeout(responseTimeout)
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(responseTimeout)
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}, responseTimeout={}]", CONNECT_TIMEOUT, responseTimeout);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
