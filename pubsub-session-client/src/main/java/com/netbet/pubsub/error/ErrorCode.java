package com.netbet.pubsub.error;

/**
 * Error codes reported on the central error channel. Wire values match the codes the service documents.
 */
public enum ErrorCode {
    CONNECTION_ERROR("connection_error"),
    /** Declared for credential rejection by the server; not raised by the session engine itself. */
    AUTHENTICATION_ERROR("auth_error"),
    SUBSCRIPTION_ERROR("sub_error"),
    SUBSCRIPTION_TIMEOUT("sub_timeout"),
    PRODUCTION_ERROR("produce_error"),
    INVALID_FRAME("invalid_frame"),
    SERVER_ERROR("server_error");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
