package com.netbet.pubsub.source;

import com.netbet.pubsub.stream.Batch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds back batches produced by an upstream source that is not (yet) the active one for a sid, so that a
 * hot/warm failover releases them as one block instead of interleaving them with the switch.
 * Only a PRIMARY -> SECONDARY transition releases the buffer.
 */
@Component
public class SourceManager {

    private static final Logger log = LoggerFactory.getLogger(SourceManager.class);
    public static final int PRIMARY = 1;
    public static final int SECONDARY = 2;

    private final Map<String, Integer> activeSources = new HashMap<>();
    private final Map<String, Deque<Batch>> buffers = new HashMap<>();

    /**
     * Records {@code newSource} as active for {@code sid}. Returns the buffered batches in arrival order when
     * this is a PRIMARY -> SECONDARY transition (the buffer is discarded), otherwise an empty list.
     */
    public synchronized List<Batch> onSourceChange(String sid, int newSource) {
        Integer active = activeSources.get(sid);
        if (active != null && active == newSource) {
            return List.of();
        }
        activeSources.put(sid, newSource);
        log.info("Active source for sid={} changed {} -> {}", sid, active, newSource);
        if (active != null && active == PRIMARY && newSource == SECONDARY) {
            Deque<Batch> buffered = buffers.remove(sid);
            if (buffered == null) {
                log.debug("No buffered batches for sid={}", sid);
                return List.of();
            }
            return new ArrayList<>(buffered);
        }
        return List.of();
    }

    /**
     * Returns true when the batch may be delivered now. A batch from any source other than the active one is
     * buffered and false is returned. With no active source recorded yet there is no switch in progress, so the
     * batch is delivered.
     */
    public synchronized boolean onEventFrame(String sid, int source, Batch batch) {
        Integer active = activeSources.get(sid);
        if (active == null || active == source) {
            return true;
        }
        buffers.computeIfAbsent(sid, k -> new ArrayDeque<>()).addLast(batch);
        log.debug("Buffered batch sid={} source={} active={} (buffered={})", sid, source, active, buffers.get(sid).size());
        return false;
    }

    synchronized Optional<Integer> activeSource(String sid) {
        return Optional.ofNullable(activeSources.get(sid));
    }

    synchronized int bufferedCount(String sid) {
        Deque<Batch> buffered = buffers.get(sid);
        return buffered == null ? 0 : buffered.size();
    }
}
