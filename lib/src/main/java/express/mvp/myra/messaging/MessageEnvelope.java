package express.mvp.myra.messaging;

import express.mvp.myra.messaging.engine.EngineMessage;
import express.mvp.myra.messaging.engine.SlotHandle;
import express.mvp.myra.messaging.util.Addresses;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A message as seen by application code.
 *
 * <p>To answer a received message, replace its header and payload and send it back: the identity
 * stays the same, which is how the sender's {@link MessagingSession#request} matches the reply.
 *
 * <h2>Ownership</h2>
 *
 * <p>An envelope belongs to whichever thread holds it. Once handed to {@link
 * MessagingSession#send} it must not be changed until the returned future completes; sending it
 * again before that is rejected with a {@link express.mvp.myra.messaging.error.UsageException}.
 * A received envelope holds a receive slot until {@link #release()} is called (or an adapter
 * releases it); the remote may stop sending until then.
 *
 * <h2>Fields</h2>
 *
 * <table border="1">
 *   <caption>Envelope fields</caption>
 *   <tr><th>Field</th><th>Default</th><th>Notes</th></tr>
 *   <tr><td>identity</td><td>random</td><td>read-only, survives replies</td></tr>
 *   <tr><td>serial</td><td>0</td><td>read-only, assigned per send by the engine</td></tr>
 *   <tr><td>header</td><td>empty</td><td>at most 65535 bytes</td></tr>
 *   <tr><td>payload</td><td>empty</td><td></td></tr>
 *   <tr><td>address</td><td>0.0.0.0</td><td>destination, or origin when received</td></tr>
 *   <tr><td>port</td><td>0</td><td>destination, or origin's listen port when received</td></tr>
 *   <tr><td>remoteIdentity</td><td>zero</td><td>node identity of the origin</td></tr>
 * </table>
 */
public final class MessageEnvelope {

    private static final byte[] EMPTY = new byte[0];

    private final Identity identity;

    private long serial;

    private byte[] header = EMPTY;

    private byte[] payload = EMPTY;

    private String address = "0.0.0.0";

    private int port;

    private Identity remoteIdentity = Identity.ZERO;

    /** Wire struct; present once sent or when received, dropped on release. */
    private EngineMessage engineMessage;

    /** Session that received this envelope; null for locally created envelopes. */
    private MessagingSession session;

    /** Engine handle of the slot held since receipt. */
    private SlotHandle slot;

    /** Completion of the send in flight, null when idle. Guarded by this. */
    private CompletableFuture<MessageEnvelope> pendingSend;

    /** Creates an empty envelope with a fresh identity. */
    public MessageEnvelope() {
        this(Identity.random());
    }

    private MessageEnvelope(Identity identity) {
        this.identity = identity;
    }

    /**
     * Builds the envelope for a received message. Runs on the I/O thread.
     *
     * @param message the received wire struct, holding a slot
     * @param session the receiving session
     * @return the envelope
     */
    static MessageEnvelope received(EngineMessage message, MessagingSession session) {
        MessageEnvelope envelope = new MessageEnvelope(message.identity());
        envelope.serial = message.serial();
        envelope.header = message.header();
        envelope.payload = message.payload();
        envelope.address = Addresses.canonical(message.address());
        envelope.port = message.port();
        envelope.remoteIdentity = message.remoteIdentity();
        envelope.engineMessage = message;
        envelope.session = session;
        envelope.slot = message.slot();
        return envelope;
    }

    public Identity identity() {
        return identity;
    }

    /**
     * Returns the serial of the last transfer: as received, or as assigned to the last completed
     * send.
     *
     * @return an unsigned 32-bit value
     */
    public long serial() {
        return serial;
    }

    public byte[] header() {
        return header;
    }

    /**
     * Sets the header. The array is used as is, not copied.
     *
     * @param header header bytes
     * @return this envelope
     */
    public MessageEnvelope header(byte[] header) {
        this.header = Objects.requireNonNull(header, "header must not be null");
        return this;
    }

    public byte[] payload() {
        return payload;
    }

    /**
     * Sets the payload. The array is used as is, not copied.
     *
     * @param payload payload bytes
     * @return this envelope
     */
    public MessageEnvelope payload(byte[] payload) {
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        return this;
    }

    /**
     * Returns the address in canonical text form.
     *
     * @return IPv4 dotted quad or compressed IPv6
     */
    public String address() {
        return address;
    }

    /**
     * Sets the destination address.
     *
     * @param address an IPv4 or IPv6 literal
     * @return this envelope
     * @throws IllegalArgumentException if {@code address} is not a valid literal
     */
    public MessageEnvelope address(String address) {
        this.address = Addresses.normalize(address);
        return this;
    }

    public int port() {
        return port;
    }

    /**
     * Sets the destination port.
     *
     * @param port 0..65535
     * @return this envelope
     * @throws IllegalArgumentException if out of range
     */
    public MessageEnvelope port(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0..65535, got " + port);
        }
        this.port = port;
        return this;
    }

    public Identity remoteIdentity() {
        return remoteIdentity;
    }

    /**
     * Checks whether this envelope holds a receive slot.
     *
     * @return true for a received envelope that has not been released
     */
    public boolean hasSlot() {
        MessagingSession owner = session;
        if (owner == null) {
            return false;
        }
        synchronized (owner.lock()) {
            return engineMessage != null && engineMessage.hasSlot();
        }
    }

    /**
     * Checks whether a send of this envelope is in flight.
     *
     * @return true until the send future completes
     */
    public synchronized boolean isSending() {
        return pendingSend != null;
    }

    /**
     * Releases the receive slot. Same as {@link MessagingSession#releaseSlot}.
     *
     * @return a future completing with the released slot key, or empty if there was no slot
     */
    public CompletableFuture<Optional<SlotKey>> release() {
        MessagingSession owner = session;
        if (owner == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return owner.releaseSlot(this);
    }

    // ─── Correlation state, accessed by MessagingSession ────────────────────────

    MessagingSession session() {
        return session;
    }

    SlotHandle slot() {
        return slot;
    }

    boolean holdsSlot() {
        return engineMessage != null && engineMessage.hasSlot();
    }

    /** Marks a send as in flight; false if one already is. */
    synchronized boolean beginSend(CompletableFuture<MessageEnvelope> future) {
        if (pendingSend != null) {
            return false;
        }
        pendingSend = future;
        return true;
    }

    /** Clears and returns the send in flight. */
    synchronized CompletableFuture<MessageEnvelope> endSend() {
        CompletableFuture<MessageEnvelope> future = pendingSend;
        pendingSend = null;
        return future;
    }

    void serial(long serial) {
        this.serial = serial;
    }

    /**
     * Returns the wire struct for a send, creating it if needed, with the current fields copied
     * into it.
     */
    EngineMessage toEngine(long token) {
        EngineMessage message = engineMessage;
        if (message == null) {
            message = new EngineMessage();
            engineMessage = message;
        }
        return message.identity(identity)
                .header(header)
                .payload(payload)
                .address(Addresses.parse(address))
                .port(port)
                .token(token);
    }

    /** Hands the slot-holding wire struct over for release. */
    EngineMessage detachEngineMessage() {
        EngineMessage message = engineMessage;
        engineMessage = null;
        return message;
    }

    @Override
    public String toString() {
        return "MessageEnvelope[" + identity + "/" + serial + " " + address + ":" + port
                + ", header=" + header.length + "B, payload=" + payload.length + "B]";
    }
}
