package com.phillippitts.speakstream.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared delegate executor.
 *
 * <p>Many serial executors can share one pool: each holds at most one task on the pool at any
 * moment, so work for the same owner never overlaps while different owners run in parallel.
 *
 * <p>A task that throws is logged and does not stop later tasks. After {@link #shutdown()}
 * new tasks are rejected; tasks already queued still run.
 *
 * <p>Thread-safe.
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    private final Executor delegate;
    private final String name;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private Runnable active;
    private boolean shutdown;

    public SerialExecutor(Executor delegate, String name) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public synchronized void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (shutdown) {
            throw new RejectedExecutionException("Serial executor '" + name + "' is shut down");
        }
        tasks.add(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Task failed on serial executor '{}'", name, e);
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            try {
                delegate.execute(active);
            } catch (RejectedExecutionException e) {
                LOG.error("Delegate rejected task for serial executor '{}'; dropping {} queued task(s)",
                        name, tasks.size() + 1, e);
                tasks.clear();
                active = null;
            }
        }
    }

    /** Stops accepting new tasks. Queued tasks still run. */
    public synchronized void shutdown() {
        shutdown = true;
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    /** Number of tasks waiting behind the running one. */
    public synchronized int pending() {
        return tasks.size();
    }
}
