package express.mvp.myra.messaging.engine;

import express.mvp.myra.messaging.Identity;
import java.net.InetAddress;

/**
 * The engine's wire struct for one message.
 *
 * <p>Sessions copy an envelope into an {@code EngineMessage} before posting a send and copy
 * received messages out of one. While a send is in flight or a received message is being
 * delivered, the I/O thread owns the instance.
 *
 * <p>Not thread-safe.
 */
public final class EngineMessage {

    /** The sender asks for an acknowledgement once the receiver releases the slot. */
    public static final int FLAG_REQ_ACK = 1;

    /** Acknowledgement of a released message. */
    public static final int FLAG_ACK = 1 << 1;

    /** Keep-alive without content. */
    public static final int FLAG_NOOP = 1 << 2;

    private static final byte[] EMPTY = new byte[0];

    private Identity identity = Identity.ZERO;
    private long serial;
    private int flags;
    private byte[] header = EMPTY;
    private byte[] payload = EMPTY;
    private InetAddress address;
    private int port;
    private Identity remoteIdentity = Identity.ZERO;

    /** Continuation token of the session that submitted the send. */
    private long token;

    /** Slot held by a received message, null otherwise. */
    private SlotHandle slot;

    /** Set by the engine while a send is in flight. */
    private boolean sending;

    public Identity identity() {
        return identity;
    }

    public EngineMessage identity(Identity identity) {
        this.identity = identity;
        return this;
    }

    public long serial() {
        return serial;
    }

    public EngineMessage serial(long serial) {
        this.serial = serial;
        return this;
    }

    public int flags() {
        return flags;
    }

    public EngineMessage flags(int flags) {
        this.flags = flags;
        return this;
    }

    public byte[] header() {
        return header;
    }

    public EngineMessage header(byte[] header) {
        this.header = header == null ? EMPTY : header;
        return this;
    }

    public byte[] payload() {
        return payload;
    }

    public EngineMessage payload(byte[] payload) {
        this.payload = payload == null ? EMPTY : payload;
        return this;
    }

    public InetAddress address() {
        return address;
    }

    public EngineMessage address(InetAddress address) {
        this.address = address;
        return this;
    }

    public int port() {
        return port;
    }

    public EngineMessage port(int port) {
        this.port = port;
        return this;
    }

    public Identity remoteIdentity() {
        return remoteIdentity;
    }

    public EngineMessage remoteIdentity(Identity remoteIdentity) {
        this.remoteIdentity = remoteIdentity;
        return this;
    }

    public long token() {
        return token;
    }

    public EngineMessage token(long token) {
        this.token = token;
        return this;
    }

    public SlotHandle slot() {
        return slot;
    }

    public EngineMessage slot(SlotHandle slot) {
        this.slot = slot;
        return this;
    }

    /**
     * Checks whether this message holds a receive slot.
     *
     * @return true until the slot is released
     */
    public boolean hasSlot() {
        return slot != null;
    }

    public boolean isSending() {
        return sending;
    }

    public void sending(boolean sending) {
        this.sending = sending;
    }

    @Override
    public String toString() {
        return "EngineMessage[" + identity + "/" + serial + " to " + address + ":" + port
                + ", flags=" + flags + ", slot=" + (slot != null) + "]";
    }
}
