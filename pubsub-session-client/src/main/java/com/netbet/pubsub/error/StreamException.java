package com.netbet.pubsub.error;

/**
 * Failure surfaced to the caller of a critical-path operation (connect, send, session mutation, publish).
 * The same failure is also reported on the {@link ErrorReporter} channel.
 */
public class StreamException extends RuntimeException {

    private final ErrorCode code;

    public StreamException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public StreamException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
