package com.netbet.pubsub.stream;

/**
 * Inbound message could not be decoded into a {@link Frame}.
 */
public class InvalidFrameException extends Exception {

    public InvalidFrameException(String message) {
        super(message);
    }

    public InvalidFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
