package com.netbet.pubsub.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.pubsub.error.ErrorCode;
import com.netbet.pubsub.error.ErrorReporter;
import com.netbet.pubsub.error.StreamException;
import com.netbet.pubsub.stream.Connection;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Outbound publish path. Opens the connection when needed; failures are reported as produce_error and
 * returned to the caller. Nothing is retried here.
 */
@Component
public class Publisher {

    private final Connection connection;
    private final ErrorReporter errorReporter;
    private final ObjectMapper objectMapper;

    public Publisher(Connection connection, ErrorReporter errorReporter, ObjectMapper objectMapper) {
        this.connection = connection;
        this.errorReporter = errorReporter;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<Void> publish(String destination, String data) {
        CompletableFuture<Void> sent;
        try {
            sent = connection.produce(destination, data);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        return sent.whenComplete((v, e) -> {
            if (e != null) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                errorReporter.report(ErrorCode.PRODUCTION_ERROR,
                        "Failed to publish to " + destination + ": " + cause.getMessage());
            }
        });
    }

    public CompletableFuture<Void> publishJson(String destination, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            errorReporter.report(ErrorCode.PRODUCTION_ERROR,
                    "Failed to serialize JSON data for " + destination + ": " + e.getOriginalMessage());
            return CompletableFuture.failedFuture(
                    new StreamException(ErrorCode.PRODUCTION_ERROR, "Failed to serialize JSON data", e));
        }
        return publish(destination, json);
    }

    public CompletableFuture<Void> publishBatch(String destination, List<String> items) {
        CompletableFuture<?>[] sends = items.stream()
                .map(item -> publish(destination, item))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(sends);
    }

    public boolean isReady() {
        return connection.isOpen();
    }
}
