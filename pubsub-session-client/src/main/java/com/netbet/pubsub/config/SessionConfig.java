package com.netbet.pubsub.config;

import com.netbet.pubsub.stream.CacheMode;
import com.netbet.pubsub.stream.JdkWebSocketTransport;
import com.netbet.pubsub.stream.SessionLoop;
import com.netbet.pubsub.stream.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SessionConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    @Bean
    public SessionProperties sessionProperties(
            @Value("${pubsub.url:wss://prod.ws.exoquic.com/v3/connect}") String url,
            @Value("${pubsub.reconnect-timeout-ms:1000}") long reconnectTimeoutMs,
            @Value("${pubsub.max-reconnect-timeout-ms:10000}") long maxReconnectTimeoutMs,
            @Value("${pubsub.should-reconnect:true}") boolean shouldReconnect,
            @Value("${pubsub.cache-enabled:true}") boolean cacheEnabled,
            @Value("${pubsub.cache-db-name:exoquic-cache-v3}") String cacheDbName,
            @Value("${pubsub.dedup-window:1000}") int dedupWindow,
            @Value("${pubsub.cache-mode:start}") String cacheMode,
            @Value("${pubsub.subscription-timeout-ms:0}") long subscriptionTimeoutMs) {
        SessionProperties properties = new SessionProperties(URI.create(url), reconnectTimeoutMs, maxReconnectTimeoutMs,
                shouldReconnect, cacheEnabled, cacheDbName, dedupWindow, CacheMode.fromConfig(cacheMode),
                subscriptionTimeoutMs);
        log.info("Session options: url={} reconnect={}..{} ms shouldReconnect={} cacheEnabled={} cacheMode={}",
                properties.url(), properties.reconnectTimeoutMs(), properties.maxReconnectTimeoutMs(),
                properties.shouldReconnect(), properties.cacheEnabled(), properties.cacheMode().wireValue());
        return properties;
    }

    @Bean(destroyMethod = "shutdown")
    public SessionLoop sessionLoop() {
        return new SessionLoop();
    }

    /** Single writer keeps cached batches in delivery order. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService cacheWriter() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pubsub-cache-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /** Token fetches may block on HTTP retries; they run here instead of on the session loop. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService credentialFetcher() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pubsub-credential-fetcher");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Transport transport() {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        return new JdkWebSocketTransport(httpClient);
    }

    @Bean
    public RestClient.Builder restClientBuilder() {
        return RestClient.builder();
    }
}
