package com.netbet.pubsub.support;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Executor that only queues; the test decides when queued tasks run.
 */
public class DeferredExecutor implements Executor {

    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();

    @Override
    public void execute(Runnable task) {
        queue.add(task);
    }

    public int queued() {
        return queue.size();
    }

    /** Runs queued tasks, including ones queued meanwhile, on the calling thread. */
    public void runAll() {
        Runnable task;
        while ((task = queue.poll()) != null) {
            task.run();
        }
    }
}
