package com.netbet.pubsub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads KEY=VALUE pairs from an optional .env file (pubsub.env-path) into System properties, e.g. the
 * token endpoint on a deployed host. Existing system properties are never overridden.
 */
@Configuration
public class EnvConfig {

    private static final Logger log = LoggerFactory.getLogger(EnvConfig.class);
    private static final Pattern ENV_LINE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_.-]*)=(.*)$");

    @Value("${pubsub.env-path:.env}")
    private String envPath;

    @PostConstruct
    public void loadEnvIfPresent() {
        Path path = Path.of(envPath);
        if (!Files.isRegularFile(path)) {
            log.debug("No .env file at {} (optional)", envPath);
            return;
        }
        try {
            int count = 0;
            for (Map.Entry<String, String> entry : parse(Files.readAllLines(path)).entrySet()) {
                if (System.getProperty(entry.getKey()) == null) {
                    System.setProperty(entry.getKey(), entry.getValue());
                    count++;
                }
            }
            if (count > 0) {
                log.info("Loaded {} keys from {}", count, envPath);
            }
        } catch (IOException e) {
            log.warn("Could not read .env at {}: {}", envPath, e.getMessage());
        }
    }

    /** Parses .env lines; blank lines and # comments are skipped, surrounding quotes removed. */
    static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            Matcher m = ENV_LINE.matcher(trimmed);
            if (!m.matches()) continue;
            String value = m.group(2).trim();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1).replace("\\\"", "\"");
            } else if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
                value = value.substring(1, value.length() - 1);
            }
            values.put(m.group(1), value);
        }
        return values;
    }
}
