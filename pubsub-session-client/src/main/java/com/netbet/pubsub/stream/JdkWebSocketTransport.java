package com.netbet.pubsub.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * WebSocket transport on {@link java.net.http.WebSocket}. The bearer credential is offered as the
 * subprotocol, which is how the service expects browser-compatible clients to authenticate.
 * Partial text frames are assembled before delivery; sends are chained because the JDK socket
 * allows only one outstanding send.
 */
public class JdkWebSocketTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);
    /** Close code used when the socket fails without a close handshake. */
    public static final int ABNORMAL_CLOSURE = 1006;

    private final HttpClient httpClient;

    public JdkWebSocketTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<Channel> connect(URI url, String credential, TransportListener listener) {
        return httpClient.newWebSocketBuilder()
                .subprotocols(credential)
                .buildAsync(url, new Adapter(listener))
                .<Channel>thenApply(JdkChannel::new);
    }

    private static final class JdkChannel implements Channel {
        private final WebSocket webSocket;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        JdkChannel(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            tail = tail.handle((v, e) -> null)
                    .thenCompose(v -> webSocket.sendText(text, true))
                    .thenApply(ws -> null);
            return tail;
        }

        @Override
        public void close(int code, String reason) {
            webSocket.sendClose(code, reason == null ? "" : reason)
                    .whenComplete((ws, e) -> {
                        if (e != null) {
                            log.debug("Close handshake failed: {}", e.getMessage());
                            webSocket.abort();
                        }
                    });
        }
    }

    private static final class Adapter implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder partial = new StringBuilder();

        Adapter(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                listener.onMessage(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
            listener.onClose(ABNORMAL_CLOSURE, error.getMessage());
        }
    }
}
