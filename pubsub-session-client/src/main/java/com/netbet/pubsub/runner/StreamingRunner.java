package com.netbet.pubsub.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.pubsub.PubSubSession;
import com.netbet.pubsub.config.SessionProperties;
import com.netbet.pubsub.resilience.ReconnectPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Standalone mode: subscribes to the configured destinations and logs every delivered batch until the
 * configured duration elapses or the application shuts down. The first subscribe is retried with backoff;
 * after that the connection reconnects and resumes on its own.
 */
@Component
@ConditionalOnProperty(name = "pubsub.runner.enabled", havingValue = "true")
public class StreamingRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(StreamingRunner.class);

    private final PubSubSession session;
    private final SessionProperties properties;
    private final List<String> destinations;
    private final int durationMinutes;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public StreamingRunner(PubSubSession session,
                           SessionProperties properties,
                           @Value("${pubsub.runner.destinations:}") String destinations,
                           @Value("${pubsub.runner.duration-minutes:0}") int durationMinutes) {
        this.session = session;
        this.properties = properties;
        this.destinations = Arrays.stream(destinations.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        this.durationMinutes = Math.max(0, durationMinutes);
    }

    @Override
    public void run(String... args) {
        if (destinations.isEmpty()) {
            log.warn("pubsub.runner.destinations is empty; nothing to subscribe");
            return;
        }
        log.info("Starting session runner destinations={} duration={}", destinations,
                durationMinutes > 0 ? durationMinutes + " min" : "unlimited");
        session.onError((code, message) -> log.warn("Session reported [{}] {}", code, message));

        if (!subscribeWithRetry()) {
            return;
        }
        try {
            if (durationMinutes > 0) {
                if (!stopped.await(durationMinutes, TimeUnit.MINUTES)) {
                    log.info("Stream duration ({} min) reached. Stopping...", durationMinutes);
                }
            } else {
                stopped.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        session.close();
    }

    private boolean subscribeWithRetry() {
        ReconnectPolicy retryPolicy = new ReconnectPolicy(properties.reconnectTimeoutMs(), properties.maxReconnectTimeoutMs());
        while (!session.isClosed()) {
            try {
                session.subscribe(destinations, this::logBatch).join();
                return true;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Subscribe failed: {}", cause.getMessage());
                if (!properties.shouldReconnect()) {
                    return false;
                }
            }
            try {
                Thread.sleep(retryPolicy.nextDelayMs());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    private void logBatch(List<JsonNode> payloads, String destination) {
        log.info("Batch destination={} events={}", destination, payloads.size());
        if (log.isDebugEnabled()) {
            payloads.forEach(p -> log.debug("  {}", p));
        }
    }

    @PreDestroy
    public void stop() {
        stopped.countDown();
    }
}
