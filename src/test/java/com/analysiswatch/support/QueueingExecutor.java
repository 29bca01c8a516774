package com.analysiswatch.support;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Executor that holds tasks until the test runs them, to simulate in-flight requests.
 */
public class QueueingExecutor implements Executor {

    private final Queue<Runnable> pending = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        pending.add(command);
    }

    public int pendingCount() {
        synchronized (this) {
            return pending.size();
        }
    }

    /** Runs the oldest pending task. */
    public void runNext() {
        Runnable next;
        synchronized (this) {
            next = pending.poll();
        }
        if (next == null) {
            throw new IllegalStateException("No pending task");
        }
        next.run();
    }

    /** Runs pending tasks, including ones they enqueue, until none remain. */
    public void runAll() {
        while (pendingCount() > 0) {
            runNext();
        }
    }
}
