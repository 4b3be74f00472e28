package com.netbet.pubsub.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.netbet.pubsub.cache.ReplayCache;
import com.netbet.pubsub.config.SessionProperties;
import com.netbet.pubsub.error.ErrorCode;
import com.netbet.pubsub.error.ErrorReporter;
import com.netbet.pubsub.event.EventProcessor;
import com.netbet.pubsub.router.FrameRouter;
import com.netbet.pubsub.session.SessionRecord;
import com.netbet.pubsub.session.SessionStore;
import com.netbet.pubsub.source.SourceManager;
import com.netbet.pubsub.stream.Batch;
import com.netbet.pubsub.stream.BatchEvent;
import com.netbet.pubsub.stream.Connection;
import com.netbet.pubsub.stream.FrameCodec;
import com.netbet.pubsub.stream.SessionLoop;
import com.netbet.pubsub.support.DeferredExecutor;
import com.netbet.pubsub.support.FakeTransport;
import com.netbet.pubsub.support.LoopSupport;
import com.netbet.pubsub.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SubscriptionManagerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TestDatabase database = new TestDatabase();
    private final FakeTransport transport = new FakeTransport();
    private final SessionLoop loop = new SessionLoop("test-session-loop");
    private final SessionStore sessionStore = new SessionStore(database.jdbc());
    private final List<ErrorCode> errors = new CopyOnWriteArrayList<>();
    private final List<List<String>> delivered = new CopyOnWriteArrayList<>();

    private ReplayCache replayCache;
    private EventProcessor eventProcessor;
    private SubscriptionManager manager;

    @AfterEach
    void tearDown() {
        loop.shutdown();
        database.close();
    }

    private void start(SessionProperties properties) {
        start(properties, Runnable::run);
    }

    private void start(SessionProperties properties, Executor cacheWriter) {
        ErrorReporter errorReporter = new ErrorReporter();
        errorReporter.addListener((code, message) -> errors.add(code));
        Connection connection = new Connection(properties, () -> "token", transport,
                new FrameCodec(objectMapper), errorReporter, loop, Runnable::run);
        replayCache = new ReplayCache(database.jdbc(), objectMapper, properties);
        eventProcessor = new EventProcessor(new SourceManager(), replayCache, sessionStore, cacheWriter);
        manager = new SubscriptionManager(connection, sessionStore, replayCache, eventProcessor, errorReporter,
                loop, database.transactionTemplate(), properties);
        connection.addFrameHandler(new FrameRouter(manager, eventProcessor, errorReporter));
        connection.addReconnectListener(manager::resubscribeAll);
        eventProcessor.addListener(List.of("orders", "payments"), (payloads, destination) ->
                delivered.add(payloads.stream().map(JsonNode::asText).toList()));
    }

    private void start() {
        start(SessionProperties.defaults().withReconnect(20, 100, true));
    }

    private void subscribe(String... destinations) throws Exception {
        manager.subscribe(List.of(destinations)).get(5, TimeUnit.SECONDS);
    }

    private List<JsonNode> sentFrames(FakeTransport.FakeChannel channel) throws Exception {
        List<JsonNode> frames = new ArrayList<>();
        for (String text : channel.sent()) {
            frames.add(objectMapper.readTree(text));
        }
        return frames;
    }

    private void serverSend(String json) {
        transport.lastChannel().serverSend(json);
        LoopSupport.drain(loop);
    }

    private long cidFor(String destination) {
        return manager.pendingFor(destination).orElseThrow().cid();
    }

    private static Batch cachedBatch(String destination, String sid, String gid) {
        return new Batch(destination, gid, List.of(new BatchEvent(gid, new TextNode(gid))), sid);
    }

    @Test
    void firstSubscriptionSendsNoSessionAndStoresAcknowledgedSid() throws Exception {
        start();

        subscribe("orders");

        JsonNode request = sentFrames(transport.lastChannel()).get(0);
        assertThat(request.get("type").asText()).isEqualTo("subscribe");
        assertThat(request.get("destination").asText()).isEqualTo("orders");
        assertThat(request.get("cache").asText()).isEqualTo("start");
        assertThat(request.has("sid")).isFalse();
        assertThat(request.has("gid")).isFalse();
        assertThat(request.get("cid").asLong()).isEqualTo(cidFor("orders"));

        serverSend("{\"v\":3,\"type\":\"suback\",\"sid\":\"s1\",\"cid\":" + cidFor("orders") + "}");

        assertThat(sessionStore.get("orders")).contains(new SessionRecord("orders", "s1", null));
        assertThat(manager.pendingCount()).isZero();
        assertThat(manager.subscribedDestinations()).containsExactly("orders");
    }

    @Test
    void subscribeCarriesStoredSidAndCursor() throws Exception {
        sessionStore.put("s1", "orders");
        sessionStore.advanceCursor("orders", "g5");
        start();

        subscribe("orders");

        JsonNode request = sentFrames(transport.lastChannel()).get(0);
        assertThat(request.get("sid").asText()).isEqualTo("s1");
        assertThat(request.get("gid").asText()).isEqualTo("g5");
    }

    @Test
    void changedSidResetsCachedEventsAndRecord() throws Exception {
        sessionStore.put("s1", "orders");
        sessionStore.advanceCursor("orders", "g5");
        start();
        replayCache.put(cachedBatch("orders", "s1", "g5"));

        subscribe("orders");
        serverSend("{\"type\":\"suback\",\"sid\":\"s2\",\"cid\":" + cidFor("orders") + "}");

        assertThat(sessionStore.get("orders")).contains(new SessionRecord("orders", "s2", null));
        assertThat(replayCache.getBySid("s1")).isEmpty();
        assertThat(delivered).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void resetWaitsForQueuedCacheWritesOfTheOldSession() throws Exception {
        DeferredExecutor cacheWriter = new DeferredExecutor();
        start(SessionProperties.defaults().withReconnect(20, 100, true), cacheWriter);
        subscribe("orders");
        serverSend("{\"type\":\"suback\",\"sid\":\"s1\",\"cid\":" + cidFor("orders") + "}");
        serverSend("{\"type\":\"event\",\"src\":1,\"sid\":\"s1\",\"batch\":"
                + "{\"destination\":\"orders\",\"gid\":\"g1\",\"data\":[{\"gid\":\"g1\",\"data\":\"g1\"}]}}");
        assertThat(cacheWriter.queued()).isEqualTo(1);

        subscribe("orders");
        transport.lastChannel().serverSend("{\"type\":\"suback\",\"sid\":\"s2\",\"cid\":" + cidFor("orders") + "}");
        await().atMost(5, TimeUnit.SECONDS).until(() -> cacheWriter.queued() == 2);
        cacheWriter.runAll();
        LoopSupport.drain(loop);

        assertThat(sessionStore.get("orders")).contains(new SessionRecord("orders", "s2", null));
        assertThat(replayCache.getBySid("s1")).isEmpty();
        assertThat(database.jdbc().queryForObject(
                "SELECT COUNT(*) FROM replay_cache WHERE destination = ?", Integer.class, "orders")).isZero();
    }

    @Test
    void confirmedSidReplaysCacheInOrderWithoutRecaching() throws Exception {
        sessionStore.put("s1", "orders");
        start();
        replayCache.put(cachedBatch("orders", "s1", "g1"));
        replayCache.put(cachedBatch("orders", "s1", "g2"));

        subscribe("orders");
        serverSend("{\"type\":\"suback\",\"sid\":\"s1\",\"cid\":" + cidFor("orders") + "}");

        assertThat(delivered).containsExactly(List.of("g1"), List.of("g2"));
        assertThat(replayCache.getBySid("s1")).hasSize(2);
        assertThat(manager.pendingCount()).isZero();
    }

    @Test
    void acknowledgmentForUnknownSubscriptionIsDropped() throws Exception {
        start();
        subscribe("orders");
        long cid = cidFor("orders");

        serverSend("{\"type\":\"suback\",\"sid\":\"s1\",\"cid\":" + (cid + 1) + "}");

        assertThat(sessionStore.get("orders")).isEmpty();
        assertThat(manager.pendingFor("orders")).isPresent();
        assertThat(errors).isEmpty();
    }

    @Test
    void acknowledgmentIsMatchedByCid() throws Exception {
        start();
        subscribe("orders", "payments");

        serverSend("{\"type\":\"suback\",\"sid\":\"p1\",\"cid\":" + cidFor("payments") + "}");

        assertThat(sessionStore.get("payments")).contains(new SessionRecord("payments", "p1", null));
        assertThat(sessionStore.get("orders")).isEmpty();
        assertThat(manager.pendingFor("orders")).isPresent();
    }

    @Test
    void acknowledgmentWithoutCidResolvesOldestPending() throws Exception {
        start();
        subscribe("orders", "payments");

        serverSend("{\"type\":\"suback\",\"sid\":\"s1\"}");

        assertThat(sessionStore.get("orders")).contains(new SessionRecord("orders", "s1", null));
        assertThat(manager.pendingFor("payments")).isPresent();
        assertThat(manager.pendingCount()).isEqualTo(1);
    }

    @Test
    void resubscribingReplacesThePendingEntry() throws Exception {
        start();
        subscribe("orders");
        long first = cidFor("orders");

        subscribe("orders");

        assertThat(manager.pendingCount()).isEqualTo(1);
        serverSend("{\"type\":\"suback\",\"sid\":\"s1\",\"cid\":" + first + "}");
        assertThat(sessionStore.get("orders")).isEmpty();
    }

    @Test
    void storeFailureOnAcknowledgmentIsReportedAsSubscriptionError() throws Exception {
        start();
        subscribe("orders");
        long cid = cidFor("orders");
        database.jdbc().execute("DROP TABLE session_record");

        serverSend("{\"type\":\"suback\",\"sid\":\"s1\",\"cid\":" + cid + "}");

        assertThat(errors).containsExactly(ErrorCode.SUBSCRIPTION_ERROR);
        assertThat(manager.pendingCount()).isZero();
    }

    @Test
    void unacknowledgedSubscriptionTimesOut() throws Exception {
        start(SessionProperties.defaults().withSubscriptionTimeoutMs(50));

        subscribe("orders");

        await().atMost(5, TimeUnit.SECONDS).until(() -> errors.contains(ErrorCode.SUBSCRIPTION_TIMEOUT));
        assertThat(manager.pendingCount()).isZero();
    }

    @Test
    void subscribeFailsWhenConnectionCannotOpen() {
        transport.failConnects(true);
        start();

        assertThatThrownBy(() -> subscribe("orders")).isInstanceOf(ExecutionException.class);
        assertThat(manager.pendingCount()).isZero();
    }

    @Test
    void droppedConnectionResubscribesWithStoredSidAndCursor() throws Exception {
        start();
        subscribe("orders");
        serverSend("{\"type\":\"suback\",\"sid\":\"s1\",\"cid\":" + cidFor("orders") + "}");
        serverSend("{\"type\":\"event\",\"src\":1,\"sid\":\"s1\",\"batch\":"
                + "{\"destination\":\"orders\",\"gid\":\"g1\",\"data\":[{\"gid\":\"g1\",\"data\":\"g1\"}]}}");
        assertThat(sessionStore.getCursor("orders")).contains("g1");
        FakeTransport.FakeChannel first = transport.lastChannel();

        first.drop(1006);

        await().atMost(5, TimeUnit.SECONDS).until(() -> transport.lastChannel() != first
                && !transport.lastChannel().sent().isEmpty());
        JsonNode request = sentFrames(transport.lastChannel()).get(0);
        assertThat(request.get("destination").asText()).isEqualTo("orders");
        assertThat(request.get("sid").asText()).isEqualTo("s1");
        assertThat(request.get("gid").asText()).isEqualTo("g1");
        assertThat(delivered).containsExactly(List.of("g1"));
    }
}
