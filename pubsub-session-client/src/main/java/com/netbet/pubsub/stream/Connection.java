package com.netbet.pubsub.stream;

import com.netbet.pubsub.config.SessionProperties;
import com.netbet.pubsub.error.ErrorCode;
import com.netbet.pubsub.error.ErrorReporter;
import com.netbet.pubsub.error.StreamException;
import com.netbet.pubsub.resilience.ReconnectPolicy;
import com.netbet.pubsub.session.CredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single socket to the service and keeps it alive.
 * State machine: CLOSED -> CONNECTING -> OPEN -> CLOSING -> CLOSED. Every connection attempt takes a fresh
 * credential, fetched on a separate executor so a slow token endpoint never stalls the loop. Abnormal closes schedule a reconnect with exponential backoff (1.5x, capped), reset on a
 * successful open. Inbound frames and timers run on the {@link SessionLoop}.
 * <p>
 * Each attempt gets an epoch number; socket callbacks and timers carrying an older epoch are ignored,
 * which is what makes {@link #close(int, String)} final for the socket it closes.
 */
@Component
public class Connection {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);
    public static final int NORMAL_CLOSURE = 1000;
    public static final String DEFAULT_CLOSE_REASON = "client close";
    static final long CONNECT_TIMEOUT_MS = 10_000;

    private final SessionProperties properties;
    private final CredentialProvider credentialProvider;
    private final Transport transport;
    private final FrameCodec codec;
    private final ErrorReporter errorReporter;
    private final SessionLoop loop;
    private final Executor credentialExecutor;
    private final ReconnectPolicy reconnectPolicy;
    private final Set<FrameHandler> frameHandlers = new CopyOnWriteArraySet<>();
    private final Set<Runnable> reconnectListeners = new CopyOnWriteArraySet<>();

    // guarded by this
    private ConnectionState state = ConnectionState.CLOSED;
    private Transport.Channel channel;
    private CompletableFuture<Void> pendingOpen;
    private ScheduledFuture<?> reconnectTimer;
    private long epoch;
    private boolean dropped;

    public Connection(SessionProperties properties,
                      CredentialProvider credentialProvider,
                      Transport transport,
                      FrameCodec codec,
                      ErrorReporter errorReporter,
                      SessionLoop loop,
                      @Qualifier("credentialFetcher") Executor credentialExecutor) {
        this.properties = properties;
        this.credentialProvider = credentialProvider;
        this.transport = transport;
        this.codec = codec;
        this.errorReporter = errorReporter;
        this.loop = loop;
        this.credentialExecutor = credentialExecutor;
        this.reconnectPolicy = new ReconnectPolicy(properties.reconnectTimeoutMs(), properties.maxReconnectTimeoutMs());
    }

    /**
     * Opens the connection. Returns the in-flight attempt when already connecting and a completed future
     * when already open. Completes exceptionally with a {@link StreamException} on credential, transport or
     * timeout failure.
     */
    public CompletableFuture<Void> open() {
        return open(false);
    }

    private CompletableFuture<Void> open(boolean reconnect) {
        CompletableFuture<Void> result;
        long attemptEpoch;
        synchronized (this) {
            if (state == ConnectionState.OPEN) {
                return CompletableFuture.completedFuture(null);
            }
            if (state == ConnectionState.CONNECTING && pendingOpen != null) {
                return pendingOpen;
            }
            cancelReconnectTimer();
            state = ConnectionState.CONNECTING;
            attemptEpoch = ++epoch;
            result = new CompletableFuture<>();
            pendingOpen = result;
        }
        loop.execute(() -> connect(attemptEpoch, result, reconnect));
        return result;
    }

    private void connect(long attemptEpoch, CompletableFuture<Void> result, boolean reconnect) {
        if (!isCurrent(attemptEpoch)) {
            return;
        }
        CompletableFuture<String> credential;
        try {
            credential = CompletableFuture.supplyAsync(this::fetchCredential, credentialExecutor);
        } catch (RejectedExecutionException e) {
            failOpen(attemptEpoch, result, "Failed to get access token", e, reconnect);
            return;
        }
        credential.whenComplete((token, err) -> loop.execute(() -> {
            if (err != null) {
                Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                failOpen(attemptEpoch, result, "Failed to get access token", cause, reconnect);
            } else {
                openTransport(attemptEpoch, token, result, reconnect);
            }
        }));
    }

    /** Runs on the credential executor; token endpoints may block or retry. */
    private String fetchCredential() {
        try {
            String credential = credentialProvider.getCredential();
            if (credential == null || credential.isBlank()) {
                throw new CredentialProvider.CredentialException("Credential provider returned no token");
            }
            return credential;
        } catch (CredentialProvider.CredentialException e) {
            throw new CompletionException(e);
        }
    }

    private void openTransport(long attemptEpoch, String credential, CompletableFuture<Void> result, boolean reconnect) {
        if (!isCurrent(attemptEpoch)) {
            return;
        }
        CompletableFuture<Transport.Channel> connecting;
        try {
            connecting = transport.connect(properties.url(), credential, new ChannelListener(attemptEpoch));
        } catch (RuntimeException e) {
            failOpen(attemptEpoch, result, "Failed to connect", e, reconnect);
            return;
        }
        connecting.copy()
                .orTimeout(CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .whenComplete((ch, err) -> loop.execute(() -> {
                    if (err != null) {
                        failOpen(attemptEpoch, result, "Failed to connect", err, reconnect);
                        // a late handshake after a timeout must not leak the socket
                        connecting.thenAccept(late -> late.close(NORMAL_CLOSURE, "connect timeout"));
                    } else {
                        onOpened(attemptEpoch, ch, result, reconnect);
                    }
                }));
    }

    private void onOpened(long attemptEpoch, Transport.Channel ch, CompletableFuture<Void> result, boolean reconnect) {
        boolean resumed;
        synchronized (this) {
            if (attemptEpoch != epoch) {
                ch.close(NORMAL_CLOSURE, "superseded");
                return;
            }
            channel = ch;
            state = ConnectionState.OPEN;
            pendingOpen = null;
            resumed = dropped;
            dropped = false;
        }
        reconnectPolicy.reset();
        log.info("Connected to {}{}", properties.url(), reconnect ? " (reconnect)" : "");
        result.complete(null);
        if (resumed) {
            for (Runnable listener : reconnectListeners) {
                try {
                    listener.run();
                } catch (Exception e) {
                    log.error("Reconnect listener failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    /**
     * Settles a failed attempt to CLOSED. While the connection is still down after an unsolicited drop the next
     * reconnect is scheduled, whether this attempt came from the timer or from a manual {@link #open()}.
     */
    private void failOpen(long attemptEpoch, CompletableFuture<Void> result, String message, Throwable cause,
                          boolean reconnect) {
        boolean retry;
        synchronized (this) {
            if (attemptEpoch != epoch) {
                result.completeExceptionally(new StreamException(ErrorCode.CONNECTION_ERROR, message, cause));
                return;
            }
            state = ConnectionState.CLOSED;
            pendingOpen = null;
            retry = reconnect || dropped;
        }
        errorReporter.report(ErrorCode.CONNECTION_ERROR, message, cause);
        result.completeExceptionally(new StreamException(ErrorCode.CONNECTION_ERROR, message, cause));
        if (retry && properties.shouldReconnect()) {
            scheduleReconnect(attemptEpoch);
        }
    }

    private void handleText(long attemptEpoch, String text) {
        if (!isCurrent(attemptEpoch)) {
            return;
        }
        Frame frame;
        try {
            frame = codec.decode(text);
        } catch (InvalidFrameException e) {
            errorReporter.report(ErrorCode.INVALID_FRAME, "Failed to parse frame", e);
            return;
        }
        log.debug("Frame received type={}", frame.type());
        for (FrameHandler handler : frameHandlers) {
            try {
                handler.handle(frame);
            } catch (Exception e) {
                log.error("Frame handler failed for {} frame: {}", frame.type(), e.getMessage(), e);
            }
        }
    }

    private void handleClose(long attemptEpoch, int code, String reason) {
        synchronized (this) {
            if (attemptEpoch != epoch || state != ConnectionState.OPEN) {
                return;
            }
            state = ConnectionState.CLOSED;
            channel = null;
            dropped = true;
        }
        log.info("Connection closed code={} reason={}", code, reason);
        if (code == NORMAL_CLOSURE || !properties.shouldReconnect()) {
            return;
        }
        scheduleReconnect(attemptEpoch);
    }

    /** No-op when a client close has moved the epoch on since {@code expectedEpoch}. */
    private void scheduleReconnect(long expectedEpoch) {
        synchronized (this) {
            if (expectedEpoch != epoch) {
                return;
            }
            cancelReconnectTimer();
            long delayMs = reconnectPolicy.nextDelayMs();
            reconnectTimer = loop.schedule(() -> fireReconnect(expectedEpoch), delayMs);
        }
    }

    private void fireReconnect(long timerEpoch) {
        synchronized (this) {
            if (timerEpoch != epoch || state != ConnectionState.CLOSED) {
                return;
            }
            reconnectTimer = null;
        }
        open(true).exceptionally(e -> {
            log.debug("Reconnect attempt failed: {}", e.getMessage());
            return null;
        });
    }

    private void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    private synchronized boolean isCurrent(long attemptEpoch) {
        return attemptEpoch == epoch;
    }

    /**
     * Sends one frame. Requires OPEN; there is no implicit queuing.
     *
     * @throws StreamException if the connection is not open
     */
    public CompletableFuture<Void> sendFrame(Frame frame) {
        Transport.Channel ch;
        synchronized (this) {
            if (state != ConnectionState.OPEN || channel == null) {
                throw new StreamException(ErrorCode.CONNECTION_ERROR, "WebSocket not open");
            }
            ch = channel;
        }
        return ch.send(codec.encode(frame));
    }

    /** Opens the connection if needed, then sends a publish frame. */
    public CompletableFuture<Void> produce(String destination, String data) {
        CompletableFuture<Void> ready = isOpen() ? CompletableFuture.completedFuture(null) : open();
        return ready.thenCompose(v -> sendFrame(new Frame.Publish(destination, data)));
    }

    public void close() {
        close(NORMAL_CLOSURE, DEFAULT_CLOSE_REASON);
    }

    /**
     * Closes immediately: cancels any reconnect timer, does not wait for in-flight sends, clears frame handlers.
     */
    public void close(int code, String reason) {
        Transport.Channel toClose;
        CompletableFuture<Void> abandoned;
        synchronized (this) {
            state = ConnectionState.CLOSING;
            epoch++;
            cancelReconnectTimer();
            toClose = channel;
            channel = null;
            abandoned = pendingOpen;
            pendingOpen = null;
            dropped = false;
            state = ConnectionState.CLOSED;
        }
        if (toClose != null) {
            try {
                toClose.close(code, reason);
            } catch (RuntimeException e) {
                log.warn("Error closing socket: {}", e.getMessage());
            }
        }
        if (abandoned != null) {
            abandoned.completeExceptionally(
                    new StreamException(ErrorCode.CONNECTION_ERROR, "Connection closed while connecting"));
        }
        frameHandlers.clear();
        log.info("Connection closed by client code={} reason={}", code, reason);
    }

    public void addFrameHandler(FrameHandler handler) {
        frameHandlers.add(handler);
    }

    /** Notified on the session loop when an open succeeds after the server side dropped the connection. */
    public void addReconnectListener(Runnable listener) {
        reconnectListeners.add(listener);
    }

    public synchronized boolean isOpen() {
        return state == ConnectionState.OPEN;
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    /** Delay the next scheduled reconnect would wait. */
    public long currentReconnectDelayMs() {
        return reconnectPolicy.currentDelayMs();
    }

    private final class ChannelListener implements TransportListener {
        private final long attemptEpoch;

        ChannelListener(long attemptEpoch) {
            this.attemptEpoch = attemptEpoch;
        }

        @Override
        public void onMessage(String text) {
            loop.execute(() -> handleText(attemptEpoch, text));
        }

        @Override
        public void onClose(int code, String reason) {
            loop.execute(() -> handleClose(attemptEpoch, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> {
                if (isCurrent(attemptEpoch)) {
                    errorReporter.report(ErrorCode.CONNECTION_ERROR, "WebSocket error", error);
                }
            });
        }
    }
}
