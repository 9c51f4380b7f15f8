package express.mvp.myra.adapters;

import express.mvp.myra.messaging.MessageEnvelope;

/**
 * Blocking handler run on a worker thread of {@link PoolMessaging}.
 *
 * <p>Handlers of the same pool run concurrently; share only thread-safe state.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles a received envelope.
     *
     * @param envelope the envelope; released after return when auto-release is on
     * @throws Exception any failure, logged by the pool
     */
    void handle(MessageEnvelope envelope) throws Exception;
}
