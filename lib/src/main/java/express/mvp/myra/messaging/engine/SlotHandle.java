package express.mvp.myra.messaging.engine;

import express.mvp.myra.messaging.SlotKey;

/**
 * Engine-side record of a receive slot held by a message.
 *
 * <p>Engines attach their own implementation to received messages and recover it in
 * {@link TransportEngine#releaseSlot}. Handles are compared by reference: two messages with the
 * same key, for instance a resend that arrived over a new connection, hold distinct handles.
 */
public interface SlotHandle {

    /**
     * Returns the key the release callback will report.
     *
     * @return identity and serial as received
     */
    SlotKey key();
}
