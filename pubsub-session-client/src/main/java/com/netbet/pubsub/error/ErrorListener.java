package com.netbet.pubsub.error;

/**
 * Receives non-fatal session errors. Implementations must not block.
 */
@FunctionalInterface
public interface ErrorListener {

    void onError(ErrorCode code, String message);
}
