package com.netbet.pubsub.stream;

/**
 * Receives every decoded inbound frame.
 */
@FunctionalInterface
public interface FrameHandler {

    void handle(Frame frame);
}
