package com.netbet.pubsub.runner;

import com.netbet.pubsub.PubSubSession;
import com.netbet.pubsub.config.SessionProperties;
import com.netbet.pubsub.error.ErrorCode;
import com.netbet.pubsub.error.StreamException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamingRunnerTest {

    private final PubSubSession session = mock(PubSubSession.class);
    private final SessionProperties properties = SessionProperties.defaults().withReconnect(10, 20, true);

    @Test
    void noDestinationsMeansNoSubscription() {
        new StreamingRunner(session, properties, " , ", 0).run();

        verify(session, never()).subscribe(any(), any());
    }

    @Test
    void subscribesToConfiguredDestinationsAndClosesOnStop() {
        when(session.subscribe(eq(List.of("orders", "payments")), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
        StreamingRunner runner = new StreamingRunner(session, properties, "orders, payments", 0);

        runner.stop();
        runner.run();

        verify(session).subscribe(eq(List.of("orders", "payments")), any());
        verify(session).close();
    }

    @Test
    void failedFirstSubscribeIsRetried() {
        when(session.subscribe(eq(List.of("orders")), any()))
                .thenReturn(CompletableFuture.failedFuture(new StreamException(ErrorCode.CONNECTION_ERROR, "down")))
                .thenReturn(CompletableFuture.completedFuture(null));
        StreamingRunner runner = new StreamingRunner(session, properties, "orders", 0);

        runner.stop();
        runner.run();

        verify(session, times(2)).subscribe(eq(List.of("orders")), any());
    }
}
