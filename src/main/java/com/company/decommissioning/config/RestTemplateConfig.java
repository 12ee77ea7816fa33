package com.company.decommissioning.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for webhook and issue-tracker delivery. Every call carries explicit
 * connect and response timeouts.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RestTemplateConfig {

    private final MeterRegistry meterRegistry;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, DecommissioningProperties properties) {
        Duration connectTimeout = properties.getWebhook().getConnectTimeout();
        Duration readTimeout = properties.getWebhook().getReadTimeout();

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(20);
        connectionManager.setDefaultMaxPerRoute(10);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(connectTimeout))
                .setSocketTimeout(Timeout.of(readTimeout))
                .build());

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.of(connectTimeout))
                .setResponseTimeout(Timeout.of(readTimeout))
                .build();

        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate restTemplate = builder
                .requestFactory(() -> requestFactory)
                .additionalInterceptors(metricsInterceptor())
                .build();

        log.info("RestTemplate configured with connect timeout: {}ms, read timeout: {}ms",
                connectTimeout.toMillis(), readTimeout.toMillis());

        return restTemplate;
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            String host = request.getURI().getHost();

            try {
                ClientHttpResponse response = execution.execute(request, body);

                meterRegistry.counter("http.client.requests.total",
                        "method", request.getMethod().name(),
                        "host", host,
                        "status", String.valueOf(response.getStatusCode().value())
                ).increment();

                log.debug("HTTP {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getURI(), response.getStatusCode(),
                        System.currentTimeMillis() - startTime);

                return response;

            } catch (Exception e) {
                meterRegistry.counter("http.client.requests.errors",
                        "method", request.getMethod().name(),
                        "host", host,
                        "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            }
        };
    }
}
