package com.netbet.pubsub;

import com.netbet.pubsub.error.ErrorListener;
import com.netbet.pubsub.error.ErrorReporter;
import com.netbet.pubsub.event.DeliveryListener;
import com.netbet.pubsub.event.EventProcessor;
import com.netbet.pubsub.publish.Publisher;
import com.netbet.pubsub.router.FrameRouter;
import com.netbet.pubsub.stream.Connection;
import com.netbet.pubsub.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for applications: subscribe with resume, publish, and listen for events and errors over one
 * connection. Once closed, every call fails with {@link IllegalStateException}.
 */
@Component
public class PubSubSession {

    private static final Logger log = LoggerFactory.getLogger(PubSubSession.class);

    private final Connection connection;
    private final SubscriptionManager subscriptionManager;
    private final EventProcessor eventProcessor;
    private final Publisher publisher;
    private final ErrorReporter errorReporter;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PubSubSession(Connection connection,
                         FrameRouter frameRouter,
                         SubscriptionManager subscriptionManager,
                         EventProcessor eventProcessor,
                         Publisher publisher,
                         ErrorReporter errorReporter) {
        this.connection = connection;
        this.subscriptionManager = subscriptionManager;
        this.eventProcessor = eventProcessor;
        this.publisher = publisher;
        this.errorReporter = errorReporter;
        connection.addFrameHandler(frameRouter);
        connection.addReconnectListener(subscriptionManager::resubscribeAll);
    }

    public CompletableFuture<Void> subscribe(Collection<String> destinations) {
        return subscribe(destinations, null);
    }

    /**
     * Subscribes to each destination, resuming any stored session. {@code listener}, when given, is registered
     * before the requests go out so replayed batches reach it.
     */
    public CompletableFuture<Void> subscribe(Collection<String> destinations, DeliveryListener listener) {
        ensureOpen();
        if (destinations == null || destinations.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        if (listener != null) {
            eventProcessor.addListener(destinations, listener);
        }
        return subscriptionManager.subscribe(destinations);
    }

    /** Strings are sent as-is; anything else is serialized to JSON. */
    public CompletableFuture<Void> produce(String destination, Object value) {
        ensureOpen();
        if (value instanceof String text) {
            return publisher.publish(destination, text);
        }
        return publisher.publishJson(destination, value);
    }

    public CompletableFuture<Void> publishJson(String destination, Object value) {
        ensureOpen();
        return publisher.publishJson(destination, value);
    }

    public CompletableFuture<Void> publishBatch(String destination, List<String> items) {
        ensureOpen();
        return publisher.publishBatch(destination, items);
    }

    public void onEvent(Collection<String> destinations, DeliveryListener listener) {
        ensureOpen();
        eventProcessor.addListener(destinations, listener);
    }

    public void onError(ErrorListener listener) {
        ensureOpen();
        errorReporter.addListener(listener);
    }

    public boolean isReady() {
        return !closed.get() && publisher.isReady();
    }

    @PreDestroy
    public void close() {
        close(Connection.NORMAL_CLOSURE, Connection.DEFAULT_CLOSE_REASON);
    }

    public void close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing session code={} reason={}", code, reason);
        connection.close(code, reason);
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Session is closed");
        }
    }
}
