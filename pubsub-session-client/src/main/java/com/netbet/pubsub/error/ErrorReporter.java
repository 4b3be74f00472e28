package com.netbet.pubsub.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Central error channel: logs every reported error and fans it out to registered listeners.
 * A throwing listener is logged and does not affect the others.
 */
@Component
public class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private final Set<ErrorListener> listeners = new CopyOnWriteArraySet<>();

    public void report(ErrorCode code, String message) {
        report(code, message, null);
    }

    public void report(ErrorCode code, String message, Throwable cause) {
        if (cause != null) {
            log.error("Session error [{}]: {} - {}", code, message, cause.getMessage());
            log.debug("Session error [{}] cause", code, cause);
        } else {
            log.error("Session error [{}]: {}", code, message);
        }
        for (ErrorListener listener : listeners) {
            try {
                listener.onError(code, message);
            } catch (Exception e) {
                log.warn("Error listener failed for [{}]: {}", code, e.getMessage());
            }
        }
    }

    public void addListener(ErrorListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(ErrorListener listener) {
        listeners.remove(listener);
    }
}
