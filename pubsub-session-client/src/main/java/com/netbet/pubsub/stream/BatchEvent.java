package com.netbet.pubsub.stream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One server-produced event inside a batch. {@code gid} is unique per destination stream.
 */
public record BatchEvent(String gid, JsonNode data) {
}
