package express.mvp.myra.messaging;

import express.mvp.myra.messaging.util.Futures;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Result of {@link MessagingSession#request}: the send completion and the reply.
 *
 * <p>{@link #get()} and {@link #result()} return the reply. With auto-release, the reply's slot
 * is released the first time it is read through them; {@link #replyFuture()} exposes the raw
 * reply without releasing anything.
 *
 * <p>Requests cannot be cancelled; they end by reply, failure, or timeout.
 */
public final class RequestFuture implements Future<MessageEnvelope> {

    private final CompletableFuture<MessageEnvelope> sendFuture;

    private final CompletableFuture<MessageEnvelope> reply;

    private final boolean autoRelease;

    private final AtomicBoolean released = new AtomicBoolean();

    RequestFuture(
            CompletableFuture<MessageEnvelope> sendFuture,
            CompletableFuture<MessageEnvelope> reply,
            boolean autoRelease) {
        this.sendFuture = sendFuture;
        this.reply = reply;
        this.autoRelease = autoRelease;
    }

    /**
     * Returns the completion of the underlying send.
     *
     * @return completes with the request envelope once sent
     */
    public CompletableFuture<MessageEnvelope> sendFuture() {
        return sendFuture;
    }

    /**
     * Waits for the send to complete.
     *
     * @param timeout the time limit
     * @return the request envelope
     * @throws express.mvp.myra.messaging.error.MessagingException if the send failed or timed out
     */
    public MessageEnvelope sendResult(Duration timeout) {
        return Futures.await(sendFuture, timeout);
    }

    /**
     * Returns the reply future. Reading it does not release the reply's slot.
     *
     * @return the reply future
     */
    public CompletableFuture<MessageEnvelope> replyFuture() {
        return reply;
    }

    /**
     * Waits for the reply.
     *
     * @return the reply
     * @throws express.mvp.myra.messaging.error.MessagingException if the request failed or timed
     *     out
     */
    public MessageEnvelope result() {
        return consume(Futures.await(reply));
    }

    /**
     * Waits for the reply at most {@code timeout}.
     *
     * @param timeout the time limit
     * @return the reply
     * @throws express.mvp.myra.messaging.error.MessagingException if the request failed or did
     *     not complete in time
     */
    public MessageEnvelope result(Duration timeout) {
        return consume(Futures.await(reply, timeout));
    }

    @Override
    public MessageEnvelope get() throws InterruptedException, ExecutionException {
        return consume(reply.get());
    }

    @Override
    public MessageEnvelope get(long timeout, TimeUnit unit)
            throws InterruptedException, ExecutionException, TimeoutException {
        return consume(reply.get(timeout, unit));
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        return false;
    }

    @Override
    public boolean isCancelled() {
        return false;
    }

    @Override
    public boolean isDone() {
        return reply.isDone();
    }

    private MessageEnvelope consume(MessageEnvelope envelope) {
        if (autoRelease && released.compareAndSet(false, true)) {
            envelope.release();
        }
        return envelope;
    }
}
