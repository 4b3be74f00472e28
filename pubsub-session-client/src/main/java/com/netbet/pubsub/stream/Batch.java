package com.netbet.pubsub.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Ordered events for one destination, stamped with the sid that produced them and the
 * destination's newest gid as of the end of the batch.
 */
public record Batch(String destination, String gid, List<BatchEvent> data, String sid) {

    public Batch {
        data = data != null ? List.copyOf(data) : List.of();
    }

    public Batch withSid(String newSid) {
        return new Batch(destination, gid, data, newSid);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return data.isEmpty();
    }
}
