package com.netbet.pubsub.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer thread for all session state: inbound frames, subscribe sends and reconnect timers run
 * here one at a time, so cursor and session read-modify-write sequences never interleave.
 */
public class SessionLoop {

    private static final Logger log = LoggerFactory.getLogger(SessionLoop.class);
    public static final String DEFAULT_THREAD_NAME = "pubsub-session-loop";

    private final ScheduledExecutorService executor;

    public SessionLoop() {
        this(DEFAULT_THREAD_NAME);
    }

    public SessionLoop(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public void execute(Runnable task) {
        try {
            executor.execute(() -> runGuarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Session loop stopped; task dropped");
        }
    }

    /** Returns null when the loop has already been shut down. */
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        try {
            return executor.schedule(() -> runGuarded(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Session loop stopped; timer not scheduled");
            return null;
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private static void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Session loop task failed: {}", e.getMessage(), e);
        }
    }
}
