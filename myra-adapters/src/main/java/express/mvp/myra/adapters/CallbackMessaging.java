package express.mvp.myra.adapters;

import express.mvp.myra.messaging.EventLoop;
import express.mvp.myra.messaging.MessageEnvelope;
import express.mvp.myra.messaging.MessagingSession;
import express.mvp.myra.messaging.RequestFuture;
import express.mvp.myra.messaging.SessionConfig;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Messaging with an asynchronous handler invoked on a caller-supplied {@link Executor}.
 *
 * <p>With auto-release the envelope is released once the handler's stage completes. Without a
 * handler every envelope is released on arrival, whatever the auto-release setting. Sends are
 * {@link CompletableFuture}s, ready for composition.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CallbackMessaging messaging = CallbackMessaging.open(loop, config,
 *         envelope -> store.saveAsync(envelope.payload()),
 *         executor);
 * }</pre>
 */
public final class CallbackMessaging {

    private static final Logger LOGGER = Logger.getLogger(CallbackMessaging.class.getName());

    private final AsyncMessageHandler handler;

    private final Executor executor;

    private final boolean autoRelease;

    private final MessagingSession session;

    private CallbackMessaging(
            EventLoop loop, SessionConfig config, AsyncMessageHandler handler, Executor executor) {
        this.handler = handler;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.autoRelease = config.autoRelease();
        this.session = MessagingSession.open(loop, config, this::dispatch);
    }

    /**
     * Opens a session whose received envelopes go to {@code handler}.
     *
     * @param loop a running event loop
     * @param config the configuration
     * @param handler the handler, or null to release every envelope
     * @param executor runs the handler
     * @return the messaging surface
     */
    public static CallbackMessaging open(
            EventLoop loop, SessionConfig config, AsyncMessageHandler handler, Executor executor) {
        return new CallbackMessaging(loop, config, handler, executor);
    }

    private void dispatch(MessageEnvelope envelope) {
        if (handler == null) {
            envelope.release();
            return;
        }
        try {
            executor.execute(() -> handle(envelope));
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Executor rejected " + envelope + ", releasing it", e);
            envelope.release();
        }
    }

    private void handle(MessageEnvelope envelope) {
        CompletionStage<Void> stage;
        try {
            stage = handler.handle(envelope);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            stage = CompletableFuture.completedFuture(null);
        }
        stage.whenComplete((ignored, failure) -> {
            if (failure != null) {
                LOGGER.log(Level.WARNING, "Handler failed for " + envelope, failure);
            }
            if (autoRelease) {
                envelope.release();
            }
        });
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

    /** Stops the session; see {@link MessagingSession#stop()}. */
    public void stop() {
        session.stop();
    }

    public EventLoop loop() {
        return session.loop();
    }

    public MessagingSession session() {
        return session;
    }
}
