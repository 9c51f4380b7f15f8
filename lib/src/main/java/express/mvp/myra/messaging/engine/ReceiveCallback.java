package express.mvp.myra.messaging.engine;

/** Invoked on the I/O thread for every received message. The message holds a slot. */
@FunctionalInterface
public interface ReceiveCallback {

    /**
     * Called when a message arrived.
     *
     * @param message the received message; ownership passes to the callee
     */
    void onReceive(EngineMessage message);
}
