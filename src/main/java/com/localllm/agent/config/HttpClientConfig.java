package com.localllm.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HttpClient used for calls to the local inference server.
 *
 * Local models can take well over a minute on CPU for long prompts, so the
 * response timeout is generous. The connect timeout stays short: a backend
 * that is not listening should fail fast and be retried.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${llm.http.response-timeout-ms:120000}")
    private long responseTimeoutMs;

    @Value("${llm.http.max-connections:20}")
    private int maxConnections;

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .setSocketTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .build();

        log.info("LLM HttpClient configured: connectTimeout={}ms responseTimeout={}ms",
                connectTimeoutMs, responseTimeoutMs);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
