package com.netbet.pubsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches the access token (JWT) that decides which destinations this client may read and write.
 * The token endpoint belongs to the application backend; failed or empty responses are retried a fixed
 * number of times.
 */
@Component
public class TokenClient {

    private static final Logger log = LoggerFactory.getLogger(TokenClient.class);

    private final RestClient restClient;
    private final String tokenUrl;
    private final int maxAttempts;
    private final long retryDelayMs;

    public TokenClient(RestClient.Builder restClientBuilder,
                       @Value("${pubsub.token-url:http://localhost:8080/token}") String tokenUrl,
                       @Value("${pubsub.token.max-attempts:3}") int maxAttempts,
                       @Value("${pubsub.token.retry-delay-ms:2000}") long retryDelayMs) {
        this.restClient = restClientBuilder.build();
        this.tokenUrl = tokenUrl;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    /**
     * @return a non-blank token
     * @throws TokenUnavailableException when every attempt failed; the cause is the last failure
     */
    public String fetchToken() throws TokenUnavailableException {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                TokenResponse response = restClient.get()
                        .uri(tokenUrl)
                        .retrieve()
                        .body(TokenResponse.class);
                if (response != null && response.token() != null && !response.token().isBlank()) {
                    log.debug("Token fetched from {} (attempt {})", tokenUrl, attempt);
                    return response.token();
                }
                lastFailure = new IllegalStateException("Token endpoint returned no token");
            } catch (RestClientException e) {
                lastFailure = e;
            }
            log.warn("Token request {}/{} to {} failed: {}", attempt, maxAttempts, tokenUrl, lastFailure.getMessage());
            if (attempt < maxAttempts && !pauseBeforeRetry()) {
                break;
            }
        }
        throw new TokenUnavailableException("No token from " + tokenUrl + " after " + maxAttempts + " attempts",
                lastFailure);
    }

    private boolean pauseBeforeRetry() {
        try {
            Thread.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(String token) {
    }

    /** Thrown when the token endpoint did not yield a token. */
    public static class TokenUnavailableException extends Exception {
        public TokenUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
