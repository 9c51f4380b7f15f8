package express.mvp.myra.messaging;

import express.mvp.myra.messaging.error.MessagingTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timer guarding the reply of one request.
 *
 * <p>Three paths can settle a request: the reply arrives ({@link #resolve}), the send fails or
 * the session stops ({@link #fail}), or the timer fires. A single latch decides which one wins;
 * the losers do nothing. Whichever path wins cancels the timer and counts one cleanup, so the
 * timer handle is disposed exactly once.
 *
 * <p>The timer is armed on the I/O thread after the send has been posted. If the request was
 * settled before that, arming is skipped.
 */
final class RequestTimeout {

    private final PendingTable table;

    private final Identity identity;

    private final CompletableFuture<MessageEnvelope> reply;

    private final AtomicBoolean settled = new AtomicBoolean();

    private final AtomicInteger cleanups = new AtomicInteger();

    private volatile ScheduledFuture<?> timer;

    RequestTimeout(PendingTable table, Identity identity, CompletableFuture<MessageEnvelope> reply) {
        this.table = table;
        this.identity = identity;
        this.reply = reply;
    }

    Identity identity() {
        return identity;
    }

    CompletableFuture<MessageEnvelope> reply() {
        return reply;
    }

    /**
     * Starts the timer unless the request is already settled.
     *
     * @param loop the loop to schedule on
     * @param timeout the reply deadline
     */
    void arm(EventLoop loop, Duration timeout) {
        if (settled.get()) {
            return;
        }
        timer = loop.schedule(this::fire, timeout.toNanos(), TimeUnit.NANOSECONDS);
        // a settle racing with the assignment above may have missed the handle
        if (settled.get()) {
            cancelTimer();
        }
    }

    /**
     * Completes the request with its reply.
     *
     * @param envelope the reply
     * @return false if the request was already settled
     */
    boolean resolve(MessageEnvelope envelope) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        cleanup();
        reply.complete(envelope);
        return true;
    }

    /**
     * Fails the request.
     *
     * @param cause the failure
     * @return false if the request was already settled
     */
    boolean fail(Throwable cause) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        cleanup();
        reply.completeExceptionally(cause);
        return true;
    }

    /** Timer callback, runs on the I/O thread. */
    void fire() {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        table.removeRequest(identity, this);
        timer = null;
        cleanups.incrementAndGet();
        reply.completeExceptionally(new MessagingTimeoutException("Request timed out"));
    }

    boolean isSettled() {
        return settled.get();
    }

    /**
     * Returns how often the timer was disposed; 1 once settled.
     *
     * @return cleanup count
     */
    int cleanups() {
        return cleanups.get();
    }

    private void cleanup() {
        cleanups.incrementAndGet();
        cancelTimer();
    }

    private void cancelTimer() {
        ScheduledFuture<?> handle = timer;
        if (handle != null) {
            timer = null;
            handle.cancel(false);
        }
    }
}
