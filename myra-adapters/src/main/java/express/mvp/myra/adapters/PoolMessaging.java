package express.mvp.myra.adapters;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.messaging.EventLoop;
import express.mvp.myra.messaging.MessageEnvelope;
import express.mvp.myra.messaging.MessagingSession;
import express.mvp.myra.messaging.RequestFuture;
import express.mvp.myra.messaging.SessionConfig;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Messaging that runs a blocking {@link MessageHandler} on a {@link WorkerPool}.
 *
 * <p>Use when handlers must call blocking code. With auto-release the envelope is released once
 * the handler returns or throws. Without a handler every envelope is released on arrival.
 *
 * <p>To correlate requests and answers across handlers, key them by
 * {@link MessageEnvelope#identity()}.
 */
public final class PoolMessaging {

    private static final Logger LOGGER = Logger.getLogger(PoolMessaging.class.getName());

    private final MessageHandler handler;

    private final WorkerPool pool;

    private final boolean ownsPool;

    private final boolean autoRelease;

    private final MessagingSession session;

    private PoolMessaging(
            EventLoop loop,
            SessionConfig config,
            MessageHandler handler,
            WorkerPool pool,
            boolean ownsPool) {
        this.handler = handler;
        this.pool = pool;
        this.ownsPool = ownsPool;
        this.autoRelease = config.autoRelease();
        this.session = MessagingSession.open(loop, config, this::dispatch);
    }

    /**
     * Opens a session with its own worker pool of default size.
     *
     * @param loop a running event loop
     * @param config the configuration
     * @param handler the handler, or null to release every envelope
     * @return the messaging surface
     */
    public static PoolMessaging open(EventLoop loop, SessionConfig config, MessageHandler handler) {
        WorkerPool pool = WorkerPool.create();
        try {
            return new PoolMessaging(loop, config, handler, pool, true);
        } catch (RuntimeException e) {
            pool.shutdownNow();
            throw e;
        }
    }

    /**
     * Opens a session on a caller-owned worker pool, which {@link #stop()} leaves running.
     *
     * @param loop a running event loop
     * @param config the configuration
     * @param handler the handler, or null to release every envelope
     * @param pool the worker pool
     * @return the messaging surface
     */
    public static PoolMessaging open(
            EventLoop loop, SessionConfig config, MessageHandler handler, WorkerPool pool) {
        return new PoolMessaging(loop, config, handler, pool, false);
    }

    private void dispatch(MessageEnvelope envelope) {
        if (handler == null) {
            envelope.release();
            return;
        }
        if (pool.submit(() -> handle(envelope)) == null) {
            LOGGER.warning("Worker pool is shut down, releasing " + envelope);
            envelope.release();
        }
    }

    private void handle(MessageEnvelope envelope) {
        try {
            handler.handle(envelope);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Handler failed for " + envelope, e);
            throw e;
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Handler failed for " + envelope, e);
            throw new CompletionException(e);
        } finally {
            if (autoRelease) {
                envelope.release();
            }
        }
    }

    public CompletableFuture<MessageEnvelope> send(MessageEnvelope envelope) {
        return session.send(envelope);
    }

    public RequestFuture request(MessageEnvelope envelope) {
        return session.request(envelope);
    }

    public RequestFuture request(MessageEnvelope envelope, boolean autoRelease) {
        return session.request(envelope, autoRelease);
    }

    /**
     * Stops the session, then shuts the worker pool down if this surface created it.
     *
     * @see MessagingSession#stop()
     */
    public void stop() {
        try {
            session.stop();
        } finally {
            if (ownsPool) {
                shutdownPool();
            }
        }
    }

    private void shutdownPool() {
        try {
            if (!pool.shutdown(session.config().timeout())) {
                LOGGER.warning("Worker pool did not terminate within " + session.config().timeout());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Callers read the pool's counters and may share it.")
    public WorkerPool pool() {
        return pool;
    }

    public EventLoop loop() {
        return session.loop();
    }

    public MessagingSession session() {
        return session;
    }
}
