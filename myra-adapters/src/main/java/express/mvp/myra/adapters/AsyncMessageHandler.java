package express.mvp.myra.adapters;

import express.mvp.myra.messaging.MessageEnvelope;
import java.util.concurrent.CompletionStage;

/**
 * Non-blocking handler of {@link CallbackMessaging}.
 *
 * <p>The returned stage signals that handling is over; with auto-release the envelope is released
 * then. A null stage counts as already completed.
 */
@FunctionalInterface
public interface AsyncMessageHandler {

    /**
     * Starts handling a received envelope.
     *
     * @param envelope the envelope
     * @return completes when handling is over
     */
    CompletionStage<Void> handle(MessageEnvelope envelope);
}
