package com.netbet.pubsub.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff with a ceiling for reconnection: each scheduled attempt waits the current delay,
 * after which the delay grows by 1.5x up to the maximum. Only a successful open resets it.
 */
public class ReconnectPolicy {

    private static final Logger log = LoggerFactory.getLogger(ReconnectPolicy.class);
    static final double MULTIPLIER = 1.5;

    private final long initialDelayMs;
    private final long maxDelayMs;

    private long currentDelayMs;
    private int attempt;

    public ReconnectPolicy(long initialDelayMs, long maxDelayMs) {
        this.initialDelayMs = Math.max(1, initialDelayMs);
        this.maxDelayMs = Math.max(this.initialDelayMs, maxDelayMs);
        this.currentDelayMs = this.initialDelayMs;
    }

    /**
     * Returns the delay for the next reconnect attempt and grows the delay for the one after.
     */
    public synchronized long nextDelayMs() {
        long delay = Math.min(currentDelayMs, maxDelayMs);
        currentDelayMs = Math.min(maxDelayMs, (long) (currentDelayMs * MULTIPLIER));
        attempt++;
        log.info("Reconnect attempt {}: waiting {} ms", attempt, delay);
        return delay;
    }

    public synchronized long currentDelayMs() {
        return currentDelayMs;
    }

    public synchronized void reset() {
        currentDelayMs = initialDelayMs;
        attempt = 0;
    }
}
