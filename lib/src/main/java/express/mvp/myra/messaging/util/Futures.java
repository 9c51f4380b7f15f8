package express.mvp.myra.messaging.util;

import express.mvp.myra.messaging.error.MessagingException;
import express.mvp.myra.messaging.error.MessagingTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking waits on futures that surface failures as {@link MessagingException}.
 *
 * <p>A failure cause that already is a {@link MessagingException} is rethrown unchanged; other
 * causes are wrapped. Running out of time raises {@link MessagingTimeoutException}; an interrupt
 * restores the interrupt flag and raises {@link MessagingException}.
 */
public final class Futures {

    private Futures() {
        // Utility class
    }

    /**
     * Waits for {@code future} without a time limit.
     *
     * @param future the future
     * @param <T> result type
     * @return the result
     */
    public static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException("Interrupted while waiting", e);
        }
    }

    /**
     * Waits for {@code future} at most {@code timeout}.
     *
     * @param future the future
     * @param timeout the time limit
     * @param <T> result type
     * @return the result
     */
    public static <T> T await(Future<T> future, Duration timeout) {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (TimeoutException e) {
            throw new MessagingTimeoutException("Timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException("Interrupted while waiting", e);
        }
    }

    /**
     * Extracts the messaging failure from an execution exception.
     *
     * @param e the execution exception
     * @return the cause if it is a messaging exception, otherwise a wrapper
     */
    public static MessagingException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof MessagingException) {
            return (MessagingException) cause;
        }
        return new MessagingException(String.valueOf(cause), cause);
    }
}
