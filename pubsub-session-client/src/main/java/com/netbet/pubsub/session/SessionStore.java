package com.netbet.pubsub.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-destination session identity (sid) and delivery cursor (gid), table session_record.
 * Reads degrade to empty on storage failure; mutations log and re-throw so the protocol step can decide.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private static final String SELECT_BY_DESTINATION =
            "SELECT destination, sid, gid FROM session_record WHERE destination = ?";
    private static final String SELECT_DESTINATIONS_BY_SID =
            "SELECT destination FROM session_record WHERE sid = ? ORDER BY destination";
    private static final String UPDATE_SID = "UPDATE session_record SET sid = ?, gid = NULL WHERE destination = ?";
    private static final String INSERT = "INSERT INTO session_record (destination, sid, gid) VALUES (?, ?, NULL)";
    private static final String UPDATE_GID = "UPDATE session_record SET gid = ? WHERE destination = ?";
    private static final String DELETE = "DELETE FROM session_record WHERE destination = ?";

    private static final RowMapper<SessionRecord> ROW_MAPPER = (rs, rowNum) ->
            new SessionRecord(rs.getString("destination"), rs.getString("sid"), rs.getString("gid"));

    private final JdbcTemplate jdbc;

    public SessionStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<SessionRecord> get(String destination) {
        try {
            List<SessionRecord> rows = jdbc.query(SELECT_BY_DESTINATION, ROW_MAPPER, destination);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to get session record destination={}: {}", destination, e.getMessage());
            return Optional.empty();
        }
    }

    /** Stored cursor for the destination, empty when there is no record or no cursor yet. */
    public Optional<String> getCursor(String destination) {
        return get(destination).map(SessionRecord::gid);
    }

    /** Creates or overwrites the record for {@code destination}; the cursor is cleared. */
    public void put(String sid, String destination) {
        try {
            if (jdbc.update(UPDATE_SID, sid, destination) == 0) {
                jdbc.update(INSERT, destination, sid);
            }
            log.debug("Stored sid={} for destination={}", sid, destination);
        } catch (DataAccessException e) {
            log.error("Failed to store session id destination={}: {}", destination, e.getMessage());
            throw e;
        }
    }

    /** No-op when the destination has no record. */
    public void advanceCursor(String destination, String gid) {
        try {
            int updated = jdbc.update(UPDATE_GID, gid, destination);
            if (updated == 0) {
                log.debug("No session record for destination={}, cursor not stored", destination);
            }
        } catch (DataAccessException e) {
            log.error("Failed to update cursor destination={}: {}", destination, e.getMessage());
            throw e;
        }
    }

    public void delete(String destination) {
        try {
            jdbc.update(DELETE, destination);
        } catch (DataAccessException e) {
            log.error("Failed to remove session record destination={}: {}", destination, e.getMessage());
            throw e;
        }
    }

    public List<String> listDestinations(String sid) {
        try {
            return jdbc.query(SELECT_DESTINATIONS_BY_SID, (rs, rowNum) -> rs.getString("destination"), sid);
        } catch (DataAccessException e) {
            log.error("Failed to list destinations for sid={}: {}", sid, e.getMessage());
            return Collections.emptyList();
        }
    }
}
