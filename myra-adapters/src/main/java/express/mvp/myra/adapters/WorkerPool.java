package express.mvp.myra.adapters;

import express.mvp.myra.messaging.NamedThreadFactory;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool of platform threads running blocking message handlers.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────────────┐
 * │                            WorkerPool                               │
 * ├─────────────────────────────────────────────────────────────────────┤
 * │  I/O thread ──submit()──▶ ┌────────────────┐                        │
 * │                           │   Work Queue   │  (unbounded)           │
 * │                           └───────┬────────┘                        │
 * │              ┌────────────────────┼────────────────────┐            │
 * │       ┌──────▼──────┐      ┌──────▼──────┐      ┌──────▼──────┐     │
 * │       │  worker-1   │      │  worker-2   │      │  worker-N   │     │
 * │       └─────────────┘      └─────────────┘      └─────────────┘     │
 * └─────────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Submitting never blocks, so the I/O thread can hand off work without stalling the
 * transport. Blocking inside a handler only occupies its worker.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Tasks can be submitted from any thread concurrently.
 */
public final class WorkerPool implements AutoCloseable {

    /** Default number of workers, as for a thread pool executor sized for blocking work. */
    public static final int DEFAULT_THREADS =
            Math.min(32, Runtime.getRuntime().availableProcessors() + 4);

    private final ExecutorService executor;

    private final NamedThreadFactory threadFactory;

    private final int threads;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final AtomicLong submittedTasks = new AtomicLong(0);

    private final AtomicLong completedTasks = new AtomicLong(0);

    /** Tasks that threw. */
    private final AtomicLong failedTasks = new AtomicLong(0);

    /** Tasks submitted after shutdown. */
    private final AtomicLong rejectedTasks = new AtomicLong(0);

    private WorkerPool(NamedThreadFactory threadFactory, int threads) {
        this.threadFactory = threadFactory;
        this.threads = threads;
        this.executor = Executors.newFixedThreadPool(threads, threadFactory);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a pool with default settings.
     *
     * @return a new pool
     */
    public static WorkerPool create() {
        return builder().build();
    }

    /**
     * Submits a task.
     *
     * @param task the task
     * @return the pending completion, or null if the pool is shut down
     */
    public Future<?> submit(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");

        if (shutdown.get()) {
            rejectedTasks.incrementAndGet();
            return null;
        }

        submittedTasks.incrementAndGet();
        try {
            return executor.submit(() -> {
                try {
                    task.run();
                    completedTasks.incrementAndGet();
                } catch (Throwable t) {
                    failedTasks.incrementAndGet();
                    throw t;
                }
            });
        } catch (RejectedExecutionException e) {
            // lost a race with shutdown
            submittedTasks.decrementAndGet();
            rejectedTasks.incrementAndGet();
            return null;
        }
    }

    /**
     * Stops accepting tasks and waits for queued ones to finish.
     *
     * @param timeout maximum time to wait
     * @return true if all tasks finished in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        executor.shutdown();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Stops accepting tasks and interrupts running ones without waiting. */
    public void shutdownNow() {
        shutdown.set(true);
        executor.shutdownNow();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    public int threads() {
        return threads;
    }

    public long getSubmittedTasks() {
        return submittedTasks.get();
    }

    public long getCompletedTasks() {
        return completedTasks.get();
    }

    public long getFailedTasks() {
        return failedTasks.get();
    }

    public long getRejectedTasks() {
        return rejectedTasks.get();
    }

    /**
     * Returns the approximate number of tasks queued or running.
     *
     * @return the active task count
     */
    public long getActiveTasks() {
        return submittedTasks.get() - completedTasks.get() - failedTasks.get();
    }

    /**
     * Returns a snapshot of the pool's counters.
     *
     * @return the current statistics
     */
    public Stats getStats() {
        return new Stats(
                submittedTasks.get(),
                completedTasks.get(),
                failedTasks.get(),
                rejectedTasks.get(),
                threadFactory.getThreadCount());
    }

    @Override
    public void close() {
        shutdownNow();
    }

    @Override
    public String toString() {
        return "WorkerPool["
                + "threads=" + threads
                + ", submitted=" + submittedTasks.get()
                + ", completed=" + completedTasks.get()
                + ", failed=" + failedTasks.get()
                + ", shutdown=" + shutdown.get()
                + "]";
    }

    // ─── Builder ────────────────────────────────────────────────────────────────

    /** Builder for {@link WorkerPool}. */
    public static final class Builder {

        private String namePrefix = "myra-worker";
        private int threads = DEFAULT_THREADS;
        private boolean daemon = true;

        private Builder() {}

        public Builder namePrefix(String namePrefix) {
            this.namePrefix = Objects.requireNonNull(namePrefix);
            return this;
        }

        /**
         * Sets the number of worker threads.
         *
         * @param threads at least 1
         * @return this builder
         */
        public Builder threads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be at least 1, got " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder daemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        public WorkerPool build() {
            return new WorkerPool(new NamedThreadFactory(namePrefix, daemon), threads);
        }
    }

    // ─── Statistics ─────────────────────────────────────────────────────────────

    /**
     * Immutable snapshot of pool statistics.
     *
     * @param submitted tasks submitted
     * @param completed tasks completed successfully
     * @param failed tasks that threw
     * @param rejected tasks rejected after shutdown
     * @param threads worker threads created
     */
    public record Stats(long submitted, long completed, long failed, long rejected, long threads) {

        /**
         * Returns the success rate as a percentage (0-100).
         *
         * @return the success rate, or 100 if no tasks have finished
         */
        public double successRate() {
            long finished = completed + failed;
            return finished == 0 ? 100.0 : (completed * 100.0) / finished;
        }

        @Override
        public String toString() {
            return String.format(
                    "Stats[submitted=%d, completed=%d, failed=%d, rejected=%d, threads=%d, successRate=%.1f%%]",
                    submitted, completed, failed, rejected, threads, successRate());
        }
    }
}
