package com.netbet.pubsub.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Receives the decoded payloads of each delivered batch for a destination, in batch order.
 * Called on the session loop; implementations must not block. Offload to another thread if needed.
 */
@FunctionalInterface
public interface DeliveryListener {

    void onEvent(List<JsonNode> payloads, String destination);
}
