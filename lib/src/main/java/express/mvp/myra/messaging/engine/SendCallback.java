package express.mvp.myra.messaging.engine;

import express.mvp.myra.messaging.error.EngineStatus;

/** Invoked on the I/O thread exactly once per accepted send. */
@FunctionalInterface
public interface SendCallback {

    /**
     * Called when a send completed.
     *
     * @param message the message that was sent; ownership returns to the caller
     * @param status {@link EngineStatus#SUCCESS} or the failure status
     */
    void onSendComplete(EngineMessage message, EngineStatus status);
}
