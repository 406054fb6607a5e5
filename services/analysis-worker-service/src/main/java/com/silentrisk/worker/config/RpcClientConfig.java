package com.silentrisk.worker.config;

import com.silentrisk.common.config.SilentRiskProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP plumbing for the blockchain JSON-RPC node.
 *
 * Every call is bounded by the configured RPC timeout so a slow node fails the
 * handler instead of stalling the consumer.
 */
@Slf4j
@Configuration
public class RpcClientConfig {

    @Value("${silentrisk.rpc.max-connections:50}")
    private int maxConnections;

    @Value("${silentrisk.rpc.collector-threads:8}")
    private int collectorThreads;

    @Bean
    public RestTemplate rpcRestTemplate(SilentRiskProperties properties) {
        long timeoutMs = properties.getRpc().getTimeout().toMillis();

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnections);

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMs))
                .build();

        HttpClient httpClient = HttpClientBuilder.create()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();

        log.info("RPC client configured: maxConnections={}, timeout={}ms", maxConnections, timeoutMs);
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    /**
     * Runs independent RPC sub-queries of one collection concurrently.
     */
    @Bean
    public ThreadPoolTaskExecutor collectorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(collectorThreads);
        executor.setMaxPoolSize(collectorThreads * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("rpc-collector-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
