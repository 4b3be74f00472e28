package com.netbet.pubsub.subscription;

/**
 * A subscribe request awaiting its acknowledgment, with the sid and cursor that were sent.
 */
public record PendingSubscription(long cid, String destination, String sid, String gid) {
}
