package com.netbet.pubsub.config;

import com.netbet.pubsub.stream.CacheMode;

import java.net.URI;

/**
 * Effective session options with defaults applied. Non-positive numeric values fall back to defaults.
 *
 * @param dedupWindow reserved; accepted for compatibility but not consulted by delivery
 */
public record SessionProperties(URI url,
                                long reconnectTimeoutMs,
                                long maxReconnectTimeoutMs,
                                boolean shouldReconnect,
                                boolean cacheEnabled,
                                String cacheDbName,
                                int dedupWindow,
                                CacheMode cacheMode,
                                long subscriptionTimeoutMs) {

    public static final URI DEFAULT_URL = URI.create("wss://prod.ws.exoquic.com/v3/connect");
    public static final long DEFAULT_RECONNECT_TIMEOUT_MS = 1000;
    public static final long DEFAULT_MAX_RECONNECT_TIMEOUT_MS = 10_000;
    public static final String DEFAULT_CACHE_DB_NAME = "exoquic-cache-v3";
    public static final int DEFAULT_DEDUP_WINDOW = 1000;

    public SessionProperties {
        url = url != null ? url : DEFAULT_URL;
        reconnectTimeoutMs = reconnectTimeoutMs > 0 ? reconnectTimeoutMs : DEFAULT_RECONNECT_TIMEOUT_MS;
        maxReconnectTimeoutMs = maxReconnectTimeoutMs > 0 ? maxReconnectTimeoutMs : DEFAULT_MAX_RECONNECT_TIMEOUT_MS;
        maxReconnectTimeoutMs = Math.max(reconnectTimeoutMs, maxReconnectTimeoutMs);
        cacheDbName = cacheDbName != null && !cacheDbName.isBlank() ? cacheDbName : DEFAULT_CACHE_DB_NAME;
        dedupWindow = dedupWindow > 0 ? dedupWindow : DEFAULT_DEDUP_WINDOW;
        cacheMode = cacheMode != null ? cacheMode : CacheMode.START;
        subscriptionTimeoutMs = Math.max(0, subscriptionTimeoutMs);
    }

    public static SessionProperties defaults() {
        return new SessionProperties(null, 0, 0, true, true, null, 0, null, 0);
    }

    public SessionProperties withUrl(URI newUrl) {
        return new SessionProperties(newUrl, reconnectTimeoutMs, maxReconnectTimeoutMs, shouldReconnect,
                cacheEnabled, cacheDbName, dedupWindow, cacheMode, subscriptionTimeoutMs);
    }

    public SessionProperties withReconnect(long initialMs, long maxMs, boolean enabled) {
        return new SessionProperties(url, initialMs, maxMs, enabled,
                cacheEnabled, cacheDbName, dedupWindow, cacheMode, subscriptionTimeoutMs);
    }

    public SessionProperties withCacheEnabled(boolean enabled) {
        return new SessionProperties(url, reconnectTimeoutMs, maxReconnectTimeoutMs, shouldReconnect,
                enabled, cacheDbName, dedupWindow, cacheMode, subscriptionTimeoutMs);
    }

    public SessionProperties withSubscriptionTimeoutMs(long timeoutMs) {
        return new SessionProperties(url, reconnectTimeoutMs, maxReconnectTimeoutMs, shouldReconnect,
                cacheEnabled, cacheDbName, dedupWindow, cacheMode, timeoutMs);
    }
}
