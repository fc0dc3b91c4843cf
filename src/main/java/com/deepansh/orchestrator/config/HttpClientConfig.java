package com.deepansh.orchestrator.config;

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
 * Shared RestClient.Builder backed by a pooled Apache HttpClient 5.
 *
 * Model providers and the tool server are both called from many threads at
 * once (branches x filter lanes), so a single pool with per-route limits is
 * used instead of the JDK default connection per request. Callers clone the
 * builder before setting a base URL.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(ToolProperties toolProperties) {
        ToolProperties.Http http = toolProperties.getHttp();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(http.getMaxTotal())
                                .setMaxConnPerRoute(http.getMaxPerRoute())
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.of(http.getConnectTimeout()))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(http.getResponseTimeout()))
                        .build())
                .build();

        log.info("HttpClient pool configured [maxTotal={}, maxPerRoute={}, responseTimeout={}]",
                http.getMaxTotal(), http.getMaxPerRoute(), http.getResponseTimeout());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
