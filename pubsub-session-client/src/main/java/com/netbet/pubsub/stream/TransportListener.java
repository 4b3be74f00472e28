package com.netbet.pubsub.stream;

/**
 * Callbacks from an open transport channel. Invoked on transport threads.
 */
public interface TransportListener {

    void onMessage(String text);

    void onClose(int code, String reason);

    void onError(Throwable error);
}
