package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.engine.EngineMessage;
import express.mvp.myra.messaging.engine.SendCallback;
import express.mvp.myra.messaging.error.EngineStatus;
import java.util.concurrent.ScheduledFuture;

/** A send accepted by the engine and not yet completed. I/O thread only. */
final class PendingSend {

    final EngineMessage message;

    private final SendCallback callback;

    ScheduledFuture<?> timer;

    private boolean completed;

    PendingSend(EngineMessage message, SendCallback callback) {
        this.message = message;
        this.callback = callback;
    }

    boolean isCompleted() {
        return completed;
    }

    /**
     * Completes the send once; later calls are ignored.
     *
     * @param status the outcome
     */
    void complete(EngineStatus status) {
        if (completed) {
            return;
        }
        completed = true;
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        message.sending(false);
        callback.onSendComplete(message, status);
    }
}
