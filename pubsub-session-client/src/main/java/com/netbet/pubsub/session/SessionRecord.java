package com.netbet.pubsub.session;

/**
 * Persisted session identity for one destination. {@code gid} is the delivery cursor and may be null.
 */
public record SessionRecord(String destination, String sid, String gid) {
}
