package com.netbet.pubsub.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.pubsub.cache.ReplayCache;
import com.netbet.pubsub.session.SessionStore;
import com.netbet.pubsub.source.SourceManager;
import com.netbet.pubsub.stream.Batch;
import com.netbet.pubsub.stream.BatchEvent;
import com.netbet.pubsub.stream.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cursor-gated delivery of event batches: decides whether a batch is delivered, advances the destination's
 * stored cursor, writes delivered batches to the replay cache and fans payloads out to listeners.
 * Gating is per batch: events inside a delivered batch are not compared against the stored cursor.
 */
@Component
public class EventProcessor {

    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);
    static final long FLUSH_TIMEOUT_MS = 5_000;

    private final SourceManager sourceManager;
    private final ReplayCache replayCache;
    private final SessionStore sessionStore;
    private final Executor cacheWriter;
    private final Map<String, Set<DeliveryListener>> listeners = new ConcurrentHashMap<>();

    public EventProcessor(SourceManager sourceManager,
                          ReplayCache replayCache,
                          SessionStore sessionStore,
                          @Qualifier("cacheWriter") Executor cacheWriter) {
        this.sourceManager = sourceManager;
        this.replayCache = replayCache;
        this.sessionStore = sessionStore;
        this.cacheWriter = cacheWriter;
    }

    public void onEventFrame(Frame.EventBatch frame) {
        Batch batch = frame.batch().withSid(frame.sid());
        if (batch.destination() == null || batch.destination().isBlank()) {
            log.warn("Batch destination is undefined, skipping event frame sid={}", frame.sid());
            return;
        }
        if (!sourceManager.onEventFrame(frame.sid(), frame.src(), batch)) {
            return;
        }
        deliver(batch);
    }

    /**
     * Releases batches held during a source failover; each goes through cursor-gated delivery on its own,
     * so one failing batch does not stop the rest.
     */
    public void onSourceChange(Frame.SourceChange frame) {
        List<Batch> released = sourceManager.onSourceChange(frame.sid(), frame.src());
        if (released.isEmpty()) {
            return;
        }
        log.info("Releasing {} buffered batches for sid={}", released.size(), frame.sid());
        for (Batch batch : released) {
            try {
                deliver(batch);
            } catch (Exception e) {
                log.error("Failed to process buffered batch destination={} gid={}: {}",
                        batch.destination(), batch.gid(), e.getMessage(), e);
            }
        }
    }

    private void deliver(Batch batch) {
        String destination = batch.destination();
        Optional<String> cursor = sessionStore.getCursor(destination);
        if (cursor.isEmpty()) {
            // first delivery for this destination: the whole batch goes out as received
            process(batch, false);
            sessionStore.advanceCursor(destination, batch.gid());
            return;
        }
        if (!batch.isEmpty()) {
            process(batch, false);
            sessionStore.advanceCursor(destination, batch.gid());
        }
    }

    /**
     * Caches (unless disabled or {@code skipCache}) and dispatches one batch. Cache writes are asynchronous and
     * never fail delivery.
     */
    public void process(Batch batch, boolean skipCache) {
        if (replayCache.isEnabled() && !skipCache) {
            try {
                CompletableFuture.runAsync(() -> replayCache.put(batch), cacheWriter)
                        .whenComplete((v, e) -> {
                            if (e != null) {
                                log.error("Failed to cache batch destination={}: {}", batch.destination(), e.getMessage());
                            }
                        });
            } catch (RejectedExecutionException e) {
                log.warn("Cache writer stopped; batch for destination={} not cached", batch.destination());
            }
        }
        List<JsonNode> payloads = batch.data().stream().map(BatchEvent::data).toList();
        dispatch(payloads, batch.destination());
    }

    /**
     * Blocks until every cache write queued before this call has finished. The writer is single-threaded, so a
     * marker task completing means all earlier puts have landed. Gives up after {@link #FLUSH_TIMEOUT_MS}.
     */
    public void flushCacheWrites() {
        if (!replayCache.isEnabled()) {
            return;
        }
        try {
            CompletableFuture.runAsync(() -> { }, cacheWriter).get(FLUSH_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Cache writer stopped; nothing to flush");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while flushing cache writes");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Cache writes not flushed within {} ms: {}", FLUSH_TIMEOUT_MS, e.toString());
        }
    }

    private void dispatch(List<JsonNode> payloads, String destination) {
        if (destination == null) {
            log.warn("Batch destination is undefined, skipping dispatch");
            return;
        }
        Set<DeliveryListener> handlers = listeners.get(destination);
        if (handlers == null || handlers.isEmpty()) {
            return;
        }
        for (DeliveryListener listener : handlers) {
            try {
                listener.onEvent(payloads, destination);
            } catch (Exception e) {
                log.error("Event listener failed for destination={}: {}", destination, e.getMessage(), e);
            }
        }
    }

    /** Registers {@code listener} for each destination; registering the same listener twice has no effect. */
    public void addListener(Collection<String> destinations, DeliveryListener listener) {
        for (String destination : destinations) {
            listeners.computeIfAbsent(destination, k -> new CopyOnWriteArraySet<>()).add(listener);
        }
    }

    public int listenerCount(String destination) {
        Set<DeliveryListener> handlers = listeners.get(destination);
        return handlers == null ? 0 : handlers.size();
    }
}
