package com.netbet.pubsub.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.pubsub.config.SessionProperties;
import com.netbet.pubsub.stream.Batch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Delivered batches kept for replay when a subscription's sid is reconfirmed unchanged (table replay_cache).
 * Entries are read back in insertion order. Read failures degrade to an empty list; write failures are
 * logged and re-thrown.
 */
@Component
public class ReplayCache {

    private static final Logger log = LoggerFactory.getLogger(ReplayCache.class);

    private static final String INSERT = "INSERT INTO replay_cache (destination, sid, batch) VALUES (?, ?, ?)";
    private static final String SELECT_BY_SID = "SELECT batch FROM replay_cache WHERE sid = ? ORDER BY id";
    private static final String DELETE_BY_DESTINATION = "DELETE FROM replay_cache WHERE destination = ?";
    private static final String DELETE_ALL = "DELETE FROM replay_cache";

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean cacheEnabled;

    public ReplayCache(JdbcTemplate jdbc, ObjectMapper objectMapper, SessionProperties properties) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.cacheEnabled = properties.cacheEnabled();
    }

    public boolean isEnabled() {
        return cacheEnabled;
    }

    public void put(Batch batch) {
        if (!cacheEnabled) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize batch destination={}: {}", batch.destination(), e.getMessage());
            throw new IllegalArgumentException("Batch is not serializable", e);
        }
        try {
            jdbc.update(INSERT, batch.destination(), batch.sid(), json);
            log.debug("Cached batch destination={} sid={} events={}", batch.destination(), batch.sid(), batch.data().size());
        } catch (DataAccessException e) {
            log.error("Failed to cache batch destination={}: {}", batch.destination(), e.getMessage());
            throw e;
        }
    }

    public List<Batch> getBySid(String sid) {
        if (!cacheEnabled) {
            return Collections.emptyList();
        }
        List<String> rows;
        try {
            rows = jdbc.query(SELECT_BY_SID, (rs, rowNum) -> rs.getString("batch"), sid);
        } catch (DataAccessException e) {
            log.error("Failed to read cached batches sid={}: {}", sid, e.getMessage());
            return Collections.emptyList();
        }
        List<Batch> batches = new ArrayList<>(rows.size());
        for (String row : rows) {
            try {
                batches.add(objectMapper.readValue(row, Batch.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable cached batch sid={}: {}", sid, e.getOriginalMessage());
            }
        }
        return batches;
    }

    public void deleteByDestination(String destination) {
        try {
            int removed = jdbc.update(DELETE_BY_DESTINATION, destination);
            log.debug("Removed {} cached batches for destination={}", removed, destination);
        } catch (DataAccessException e) {
            log.error("Failed to clear cached batches destination={}: {}", destination, e.getMessage());
            throw e;
        }
    }

    public void clearAll() {
        try {
            jdbc.update(DELETE_ALL);
            log.info("Replay cache cleared");
        } catch (DataAccessException e) {
            log.error("Failed to clear replay cache: {}", e.getMessage());
            throw e;
        }
    }
}
