package express.mvp.myra.messaging;

/**
 * Delivery strategy for received envelopes.
 *
 * <p>Called on the I/O thread for every received envelope that is not the reply to a pending
 * request. Implementations hand the envelope off (to a queue, a worker pool, an executor) and
 * return quickly. The envelope holds a slot that must eventually be released; if the dispatcher
 * throws, the session logs the failure and releases the slot itself.
 */
@FunctionalInterface
public interface MessageDispatcher {

    /**
     * Hands a received envelope to the application.
     *
     * @param envelope the received envelope
     */
    void dispatch(MessageEnvelope envelope);
}
