package com.netbet.pubsub.stream;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Open/send/close contract of the persistent socket. Handshake, TLS and framing belong to implementations.
 */
public interface Transport {

    /**
     * Opens a channel to {@code url} presenting {@code credential}. The returned future completes once the
     * channel is usable; afterwards inbound traffic and closure are reported to {@code listener}.
     */
    CompletableFuture<Channel> connect(URI url, String credential, TransportListener listener);

    /** An open channel. */
    interface Channel {

        /** Sends one text message. Sends are delivered in call order. */
        CompletableFuture<Void> send(String text);

        /** Starts a close handshake. Does not wait for it to finish. */
        void close(int code, String reason);
    }
}
