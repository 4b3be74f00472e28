package com.netbet.pubsub.subscription;

import com.netbet.pubsub.cache.ReplayCache;
import com.netbet.pubsub.config.SessionProperties;
import com.netbet.pubsub.error.ErrorCode;
import com.netbet.pubsub.error.ErrorReporter;
import com.netbet.pubsub.error.StreamException;
import com.netbet.pubsub.event.EventProcessor;
import com.netbet.pubsub.session.SessionRecord;
import com.netbet.pubsub.session.SessionStore;
import com.netbet.pubsub.stream.Batch;
import com.netbet.pubsub.stream.CacheMode;
import com.netbet.pubsub.stream.Connection;
import com.netbet.pubsub.stream.Frame;
import com.netbet.pubsub.stream.SessionLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Subscribe/resume protocol. Each subscribe carries the destination's stored sid and cursor; the
 * acknowledgment's sid is then reconciled with the stored one:
 * <ul>
 *   <li>no stored sid: the acknowledged sid is stored (first subscription);</li>
 *   <li>different sid: the stored session is stale, so cached batches and the record are dropped and the new
 *       sid stored, in one transaction;</li>
 *   <li>same sid: the session is confirmed, cached batches for it are replayed without re-caching.</li>
 * </ul>
 * Subscribed destinations are re-issued with their stored sid/cursor after the connection comes back.
 */
@Component
public class SubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);
    private static final long MAX_CORRELATION_ID = 1_000_000_000L;

    private final Connection connection;
    private final SessionStore sessionStore;
    private final ReplayCache replayCache;
    private final EventProcessor eventProcessor;
    private final ErrorReporter errorReporter;
    private final SessionLoop loop;
    private final TransactionTemplate transactionTemplate;
    private final CacheMode cacheMode;
    private final long subscriptionTimeoutMs;

    /** Insertion order is kept so an acknowledgment without a cid resolves to the oldest request. */
    private final Map<Long, PendingSubscription> pending = new LinkedHashMap<>();
    private final Set<String> subscribedDestinations = new LinkedHashSet<>();

    public SubscriptionManager(Connection connection,
                               SessionStore sessionStore,
                               ReplayCache replayCache,
                               EventProcessor eventProcessor,
                               ErrorReporter errorReporter,
                               SessionLoop loop,
                               TransactionTemplate transactionTemplate,
                               SessionProperties properties) {
        this.connection = connection;
        this.sessionStore = sessionStore;
        this.replayCache = replayCache;
        this.eventProcessor = eventProcessor;
        this.errorReporter = errorReporter;
        this.loop = loop;
        this.transactionTemplate = transactionTemplate;
        this.cacheMode = properties.cacheMode();
        this.subscriptionTimeoutMs = properties.subscriptionTimeoutMs();
    }

    /**
     * Opens the connection if needed and sends one subscribe request per destination. The returned future
     * completes once the requests are sent; acknowledgments are handled as they arrive.
     */
    public CompletableFuture<Void> subscribe(Collection<String> destinations) {
        List<String> targets = List.copyOf(destinations);
        CompletableFuture<Void> ready = connection.isOpen() ? CompletableFuture.completedFuture(null) : connection.open();
        return ready.thenRunAsync(() -> sendAll(targets), loop::execute);
    }

    private void sendAll(List<String> destinations) {
        StreamException firstFailure = null;
        for (String destination : destinations) {
            try {
                sendSubscribe(destination);
            } catch (StreamException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    private void sendSubscribe(String destination) {
        Optional<SessionRecord> record = sessionStore.get(destination);
        String sid = record.map(SessionRecord::sid).orElse(null);
        String gid = record.map(SessionRecord::gid).orElse(null);

        PendingSubscription entry;
        synchronized (this) {
            removePendingFor(destination);
            entry = new PendingSubscription(nextCorrelationId(), destination, sid, gid);
            pending.put(entry.cid(), entry);
            subscribedDestinations.add(destination);
        }
        try {
            connection.sendFrame(new Frame.Subscribe(destination, entry.cid(), sid, gid, cacheMode));
        } catch (StreamException e) {
            synchronized (this) {
                pending.remove(entry.cid());
            }
            errorReporter.report(ErrorCode.SUBSCRIPTION_ERROR, "Failed to subscribe to " + destination, e);
            throw e;
        }
        log.info("Subscribe sent destination={} cid={} sid={} cursor={}",
                destination, entry.cid(), sid, gid != null ? "set" : "null");
        if (subscriptionTimeoutMs > 0) {
            loop.schedule(() -> expire(entry), subscriptionTimeoutMs);
        }
    }

    /**
     * Reconciles an acknowledgment with the pending request it answers. Store failures are reported as
     * {@code sub_error} and re-thrown; the pending entry is removed either way.
     */
    public void handleSubAck(Frame.SubAck ack) {
        PendingSubscription matched;
        synchronized (this) {
            matched = match(ack);
            if (matched != null) {
                pending.remove(matched.cid());
            }
        }
        if (matched == null) {
            log.warn("Received subscription acknowledgment for unknown subscription sid={} cid={}", ack.sid(), ack.cid());
            return;
        }

        String destination = matched.destination();
        String storedSid = matched.sid();
        String newSid = ack.sid();
        try {
            if (storedSid == null) {
                sessionStore.put(newSid, destination);
                log.info("Session established destination={} sid={}", destination, newSid);
            } else if (!storedSid.equals(newSid)) {
                log.info("Session ID changed for destination {}: {} -> {}", destination, storedSid, newSid);
                resetSession(destination, newSid);
            } else {
                replay(destination, newSid);
            }
        } catch (RuntimeException e) {
            errorReporter.report(ErrorCode.SUBSCRIPTION_ERROR, "Failed to store session for " + destination, e);
            throw new StreamException(ErrorCode.SUBSCRIPTION_ERROR, "Failed to store session for " + destination, e);
        }
    }

    private void resetSession(String destination, String newSid) {
        // puts for batches delivered under the old sid may still be queued on the cache writer
        eventProcessor.flushCacheWrites();
        transactionTemplate.executeWithoutResult(status -> {
            replayCache.deleteByDestination(destination);
            sessionStore.delete(destination);
            sessionStore.put(newSid, destination);
        });
        log.info("Cleared stale data for destination {}", destination);
    }

    private void replay(String destination, String sid) {
        List<Batch> batches = replayCache.getBySid(sid);
        log.info("Session confirmed destination={} sid={}; replaying {} cached batches", destination, sid, batches.size());
        for (Batch batch : batches) {
            try {
                eventProcessor.process(batch, true);
            } catch (Exception e) {
                log.error("Failed to replay cached batch destination={} gid={}: {}",
                        batch.destination(), batch.gid(), e.getMessage(), e);
            }
        }
    }

    /** Re-issues every subscribed destination with its stored sid and cursor. Runs on the session loop. */
    public void resubscribeAll() {
        List<String> destinations;
        synchronized (this) {
            pending.clear();
            destinations = new ArrayList<>(subscribedDestinations);
        }
        if (destinations.isEmpty()) {
            return;
        }
        log.info("Resubscribing {} destinations after reconnect", destinations.size());
        for (String destination : destinations) {
            try {
                sendSubscribe(destination);
            } catch (StreamException e) {
                log.warn("Resubscribe failed destination={}: {}", destination, e.getMessage());
            }
        }
    }

    private void expire(PendingSubscription entry) {
        boolean expired;
        synchronized (this) {
            expired = pending.remove(entry.cid(), entry);
        }
        if (expired) {
            errorReporter.report(ErrorCode.SUBSCRIPTION_TIMEOUT,
                    "No acknowledgment within " + subscriptionTimeoutMs + " ms for destination " + entry.destination());
        }
    }

    private PendingSubscription match(Frame.SubAck ack) {
        if (ack.cid() != null) {
            return pending.get(ack.cid());
        }
        Iterator<PendingSubscription> it = pending.values().iterator();
        return it.hasNext() ? it.next() : null;
    }

    private void removePendingFor(String destination) {
        pending.values().removeIf(p -> p.destination().equals(destination));
    }

    private long nextCorrelationId() {
        long cid;
        do {
            cid = ThreadLocalRandom.current().nextLong(1, MAX_CORRELATION_ID);
        } while (pending.containsKey(cid));
        return cid;
    }

    public synchronized Optional<PendingSubscription> pendingFor(String destination) {
        return pending.values().stream().filter(p -> p.destination().equals(destination)).findFirst();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized Set<String> subscribedDestinations() {
        return Set.copyOf(subscribedDestinations);
    }
}
