package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.SlotKey;
import express.mvp.myra.messaging.engine.SlotHandle;

/** A receive slot taken by an inbound message. I/O thread only. */
final class Slot implements SlotHandle {

    private final Connection connection;

    private final SlotKey key;

    private final boolean ackRequested;

    private boolean released;

    Slot(Connection connection, SlotKey key, boolean ackRequested) {
        this.connection = connection;
        this.key = key;
        this.ackRequested = ackRequested;
    }

    @Override
    public SlotKey key() {
        return key;
    }

    Connection connection() {
        return connection;
    }

    boolean ackRequested() {
        return ackRequested;
    }

    /** Marks the slot released; false if it already was. */
    boolean markReleased() {
        if (released) {
            return false;
        }
        released = true;
        return true;
    }

    @Override
    public String toString() {
        return "Slot[" + key + " via " + connection + "]";
    }
}
