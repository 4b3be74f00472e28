package com.netbet.pubsub.stream;

import java.util.Locale;

/**
 * Server-side replay preference forwarded on subscribe. Not interpreted by the client.
 */
public enum CacheMode {
    NEVER,
    END,
    START;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a configured value; blank or unknown values fall back to {@link #START}. */
    public static CacheMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return START;
        }
        for (CacheMode mode : values()) {
            if (mode.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        return START;
    }
}
