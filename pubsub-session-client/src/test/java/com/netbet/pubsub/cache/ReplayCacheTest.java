package com.netbet.pubsub.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.netbet.pubsub.config.SessionProperties;
import com.netbet.pubsub.stream.Batch;
import com.netbet.pubsub.stream.BatchEvent;
import com.netbet.pubsub.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReplayCacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TestDatabase database = new TestDatabase();
    private final ReplayCache cache = new ReplayCache(database.jdbc(), objectMapper, SessionProperties.defaults());

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static Batch batch(String destination, String sid, String... gids) {
        List<BatchEvent> events = Arrays.stream(gids)
                .map(gid -> new BatchEvent(gid, new TextNode("payload-" + gid)))
                .toList();
        return new Batch(destination, gids.length > 0 ? gids[gids.length - 1] : null, events, sid);
    }

    @Test
    void returnsBatchesForSidInInsertionOrder() {
        Batch first = batch("orders", "s1", "g1", "g2");
        Batch second = batch("orders", "s1", "g3");
        cache.put(first);
        cache.put(batch("payments", "s9", "p1"));
        cache.put(second);

        assertThat(cache.getBySid("s1")).containsExactly(first, second);
    }

    @Test
    void deleteByDestinationLeavesOtherDestinations() {
        cache.put(batch("orders", "s1", "g1"));
        Batch invoices = batch("invoices", "s1", "i1");
        cache.put(invoices);

        cache.deleteByDestination("orders");

        assertThat(cache.getBySid("s1")).containsExactly(invoices);
    }

    @Test
    void clearAllRemovesEverything() {
        cache.put(batch("orders", "s1", "g1"));
        cache.put(batch("payments", "s2", "p1"));

        cache.clearAll();

        assertThat(cache.getBySid("s1")).isEmpty();
        assertThat(cache.getBySid("s2")).isEmpty();
    }

    @Test
    void disabledCacheStoresNothing() {
        ReplayCache disabled = new ReplayCache(database.jdbc(), objectMapper,
                SessionProperties.defaults().withCacheEnabled(false));

        disabled.put(batch("orders", "s1", "g1"));

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(cache.getBySid("s1")).isEmpty();
    }

    @Test
    void unreadableRowsAreSkipped() {
        Batch good = batch("orders", "s1", "g1");
        database.jdbc().update("INSERT INTO replay_cache (destination, sid, batch) VALUES (?, ?, ?)",
                "orders", "s1", "{broken");
        cache.put(good);

        assertThat(cache.getBySid("s1")).containsExactly(good);
    }

    @Test
    void readFailureDegradesToEmpty() {
        cache.put(batch("orders", "s1", "g1"));
        database.jdbc().execute("DROP TABLE replay_cache");

        assertThat(cache.getBySid("s1")).isEmpty();
    }
}
