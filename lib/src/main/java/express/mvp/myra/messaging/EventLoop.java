package express.mvp.myra.messaging;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.messaging.error.FatalEngineException;
import express.mvp.myra.messaging.error.UsageException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SingleThreadEventLoop;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ScheduledFuture;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the single I/O thread that drives the transport engine.
 *
 * <p>All engine calls and all engine callbacks happen on this thread. Other threads hand work to
 * it with {@link #post(Runnable)}.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────┐
 * │                         EventLoop                           │
 * ├─────────────────────────────────────────────────────────────┤
 * │  Caller Threads            │        I/O Thread              │
 * │  ──────────────            │        ──────────              │
 * │  • post()                  │        • posted tasks (FIFO)   │
 * │  • run() / stop()          │        • channel I/O           │
 * │  • retain() / release()    │        • timers                │
 * │           │                │               ▲                │
 * │           ▼                │               │                │
 * │   ┌───────────────┐        │       ┌─────────────┐          │
 * │   │ Deferred list │───────────────▶│ Netty task  │          │
 * │   │ (before run)  │        │       │   queue     │          │
 * │   └───────────────┘        │       └─────────────┘          │
 * └─────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Lifecycle</h2>
 *
 * <ul>
 *   <li>{@link #run()} starts the thread once; later calls are no-ops, except after
 *       {@link #stop()}, when they throw {@link UsageException}.
 *   <li>Tasks posted before {@link #run()} are kept and executed first, in order.
 *   <li>The loop holds a reference count starting at one. Every open session retains it;
 *       {@link #stop()} drops the owner's reference. The thread shuts down when the count reaches
 *       zero, so the loop outlives {@link #stop()} until the last session stopped.
 *   <li>Shutdown is posted to the I/O thread and the caller then joins it, so no callback can run
 *       once shutdown has returned.
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventLoop loop = new EventLoop();
 * MessagingSession session = MessagingSession.open(loop, config, dispatcher);
 * // ...
 * session.stop();
 * loop.stop();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All public methods are thread-safe. {@link #stop()} and {@link #release()} must not be
 * called from the I/O thread when they end up shutting the loop down.
 */
public final class EventLoop implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(EventLoop.class.getName());

    /** Seconds Netty may spend closing residual channels after shutdown was requested. */
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 15;

    /** Guards lifecycle state and the deferred list. */
    private final Object lock = new Object();

    /** Single-threaded Netty group owning the I/O thread. */
    private final EventLoopGroup group;

    /** The one executor of {@link #group}. */
    private final io.netty.channel.EventLoop io;

    /** Tasks posted before {@link #run()}. */
    private final List<Runnable> deferred = new ArrayList<>();

    private boolean started;

    private boolean stopped;

    private boolean terminated;

    private int refCount = 1;

    /** Creates an event loop and starts it. */
    public EventLoop() {
        this(true);
    }

    /**
     * Creates an event loop.
     *
     * @param run whether to start the I/O thread immediately
     */
    public EventLoop(boolean run) {
        MessagingRuntime.initialize();
        this.group = new NioEventLoopGroup(1, new NamedThreadFactory("myra-io"));
        this.io = group.next();
        if (run) {
            run();
        }
    }

    /**
     * Executes {@code task} on the I/O thread.
     *
     * <p>Tasks run in the order they were posted. A task that throws is logged and does not
     * affect later tasks.
     *
     * @param task the task
     * @throws UsageException if the loop has shut down
     */
    public void post(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        Runnable guarded = guard(task);
        synchronized (lock) {
            if (terminated) {
                throw new UsageException("Event loop is stopped");
            }
            if (!started) {
                deferred.add(guarded);
                return;
            }
            try {
                io.execute(guarded);
            } catch (RejectedExecutionException e) {
                throw new UsageException("Event loop is stopped");
            }
        }
    }

    /**
     * Schedules {@code task} on the I/O thread after {@code delay}.
     *
     * @param task the task
     * @param delay the delay
     * @param unit unit of {@code delay}
     * @return the timer handle; cancel it to disarm
     */
    public ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit) {
        return io.schedule(guard(task), delay, unit);
    }

    /**
     * Starts the I/O thread. Idempotent while running.
     *
     * @throws UsageException if the loop was stopped
     */
    public void run() {
        synchronized (lock) {
            if (!started) {
                started = true;
                io.execute(() -> LOGGER.fine("Event loop started"));
                for (Runnable task : deferred) {
                    io.execute(task);
                }
                deferred.clear();
            } else if (stopped) {
                throw new UsageException("Cannot restart event loop");
            }
        }
    }

    /**
     * Checks whether the loop was started and not yet stopped.
     *
     * @return true while running
     */
    public boolean isRunning() {
        synchronized (lock) {
            return started && !stopped;
        }
    }

    /**
     * Checks whether the calling thread is the I/O thread.
     *
     * @return true on the I/O thread
     */
    public boolean inEventLoop() {
        return io.inEventLoop();
    }

    /**
     * Stops the loop. The I/O thread shuts down once the last session has stopped.
     *
     * <p>Stopping a loop that was never started, or stopping twice, does nothing.
     *
     * @throws UsageException if called on the I/O thread
     * @throws FatalEngineException if the I/O thread could not be shut down
     */
    public void stop() {
        boolean doIt = false;
        synchronized (lock) {
            if (started && !stopped) {
                if (io.inEventLoop()) {
                    throw new UsageException("Event loop cannot be stopped from its own thread");
                }
                stopped = true;
                doIt = true;
            }
        }
        if (doIt) {
            release();
        }
    }

    /** Equivalent to {@link #stop()}. */
    @Override
    public void close() {
        stop();
    }

    /**
     * Adds a reference that keeps the loop alive.
     *
     * @throws UsageException if the loop has shut down
     */
    public void retain() {
        synchronized (lock) {
            if (terminated) {
                throw new UsageException("Event loop is stopped");
            }
            refCount++;
        }
    }

    /**
     * Drops a reference. The last release shuts down the I/O thread and joins it.
     *
     * @throws UsageException if the last reference is released on the I/O thread
     * @throws FatalEngineException if the I/O thread could not be shut down
     */
    public void release() {
        boolean doIt;
        synchronized (lock) {
            if (refCount == 1 && io.inEventLoop()) {
                throw new UsageException("Event loop cannot be stopped from its own thread");
            }
            refCount--;
            doIt = refCount == 0;
        }
        if (doIt) {
            shutdown();
        }
    }

    /**
     * Returns the current reference count.
     *
     * @return the count
     */
    public int refCount() {
        synchronized (lock) {
            return refCount;
        }
    }

    /**
     * Returns the Netty executor backing the I/O thread. Engines register their channels here.
     *
     * @return the I/O executor
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Engines must register channels on the loop's own executor.")
    public io.netty.channel.EventLoop io() {
        return io;
    }

    private void shutdown() {
        synchronized (lock) {
            // Deferred tasks of a loop that never ran are dropped.
            started = true;
            deferred.clear();
            io.execute(this::closeHandles);
            terminated = true;
        }
        Future<?> termination = group.terminationFuture().awaitUninterruptibly();
        if (!termination.isSuccess()) {
            throw new FatalEngineException("Closing event loop failed", termination.cause());
        }
        LOGGER.fine("Event loop stopped");
    }

    /** Runs on the I/O thread as the last posted task. */
    private void closeHandles() {
        if (io instanceof SingleThreadEventLoop) {
            int open = ((SingleThreadEventLoop) io).registeredChannels();
            if (open > 0) {
                LOGGER.warning("Cannot close all handles: " + open + " channel(s) still open");
            }
        }
        group.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable t) {
                LOGGER.log(Level.SEVERE, "Event loop task failed", t);
            }
        };
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "EventLoop[started=" + started + ", stopped=" + stopped + ", refCount="
                    + refCount + "]";
        }
    }
}
