package com.netbet.pubsub.session;

/**
 * Supplies the bearer credential presented on every connection attempt.
 * A fresh credential is requested for each attempt, so implementations may refresh expired tokens here.
 */
public interface CredentialProvider {

    /**
     * Returns a credential for the next connection. Must not return null or blank.
     *
     * @throws CredentialException if no valid credential can be obtained
     */
    String getCredential() throws CredentialException;

    /** Thrown when a credential cannot be obtained. */
    class CredentialException extends Exception {
        public CredentialException(String message) {
            super(message);
        }
        public CredentialException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
