package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.Identity;
import express.mvp.myra.messaging.SlotKey;
import express.mvp.myra.messaging.engine.EngineMessage;
import express.mvp.myra.messaging.error.EngineStatus;
import express.mvp.myra.messaging.util.Serials;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

/**
 * One TCP connection to a remote node, with its send queue and receive slots.
 *
 * <h2>Phases</h2>
 *
 * <pre>
 * CONNECTING → HANDSHAKING → ESTABLISHED → CLOSED
 * </pre>
 *
 * <p>Both sides send a {@link HandshakeFrame} once the channel is active. Queued messages are
 * written only after the peer's handshake arrived. In synchronous mode at most one written
 * message waits for its acknowledgement; the next one is written when the ack arrives.
 *
 * <p>An inbound message takes a slot. When all slots are taken the channel stops reading;
 * messages already decoded wait in a backlog and are delivered as slots are released.
 *
 * <p>Confined to the I/O thread.
 */
final class Connection {

    private static final Logger LOGGER = Logger.getLogger(Connection.class.getName());

    enum Phase {
        CONNECTING,
        HANDSHAKING,
        ESTABLISHED,
        CLOSED
    }

    private final NettyTransportEngine engine;

    private final boolean outbound;

    private final boolean synchronous;

    private final int maxSlots;

    private final Deque<PendingSend> queue = new ArrayDeque<>();

    private final Deque<MessageFrame> backlog = new ArrayDeque<>();

    private Channel channel;

    private Phase phase = Phase.CONNECTING;

    /** Route key; known upfront for outbound connections, after the handshake otherwise. */
    private RemoteKey key;

    private InetAddress remoteAddress;

    private int remotePort;

    private Identity remoteIdentity = Identity.ZERO;

    private PendingSend awaitingAck;

    private long nextSerial = 1;

    private int heldSlots;

    private long lastActivity = System.nanoTime();

    Connection(NettyTransportEngine engine, boolean outbound, RemoteKey key, InetAddress address) {
        this.engine = engine;
        this.outbound = outbound;
        this.key = key;
        this.remoteAddress = address;
        this.synchronous = engine.config().synchronous();
        this.maxSlots = engine.config().effectiveMaxSlots();
        if (key != null) {
            this.remotePort = key.port();
        }
    }

    void attach(Channel channel) {
        this.channel = channel;
        if (remoteAddress == null && channel.remoteAddress() instanceof InetSocketAddress remote) {
            remoteAddress = remote.getAddress();
        }
    }

    Channel channel() {
        return channel;
    }

    RemoteKey key() {
        return key;
    }

    boolean isClosed() {
        return phase == Phase.CLOSED;
    }

    boolean isEstablished() {
        return phase == Phase.ESTABLISHED;
    }

    boolean hasPendingSends() {
        return awaitingAck != null || !queue.isEmpty();
    }

    int heldSlots() {
        return heldSlots;
    }

    // ─── Channel events ─────────────────────────────────────────────────────────

    void onActive() {
        if (phase != Phase.CONNECTING) {
            return;
        }
        phase = Phase.HANDSHAKING;
        touch();
        channel.writeAndFlush(new HandshakeFrame(engine.port(), engine.identity()))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    void onHandshake(HandshakeFrame handshake) {
        if (phase != Phase.HANDSHAKING) {
            engine.protocolError(this, "Unexpected handshake from " + describeRemote());
            return;
        }
        touch();
        remotePort = handshake.port();
        remoteIdentity = handshake.identity();
        if (key == null) {
            key = RemoteKey.of(remoteAddress, remotePort);
        }
        phase = Phase.ESTABLISHED;
        engine.established(this);
        flush();
    }

    void onMessage(MessageFrame frame) {
        if (phase != Phase.ESTABLISHED) {
            engine.protocolError(this, "Message before handshake from " + describeRemote());
            return;
        }
        touch();
        if (frame.isAck()) {
            onAck(frame);
            return;
        }
        if (frame.isNoop()) {
            return;
        }
        if (heldSlots >= maxSlots || !backlog.isEmpty()) {
            backlog.add(frame);
            channel.config().setAutoRead(false);
            return;
        }
        deliver(frame);
    }

    private void onAck(MessageFrame ack) {
        PendingSend pending = awaitingAck;
        if (pending == null || !pending.message.identity().equals(ack.identity())) {
            LOGGER.fine(() -> "Ignoring unexpected ack " + ack + " on " + this);
            return;
        }
        int order = Serials.compare(ack.serial(), pending.message.serial());
        if (order != 0) {
            LOGGER.fine(() -> "Ignoring " + (order < 0 ? "stale" : "unexpected") + " ack " + ack + " on " + this);
            return;
        }
        awaitingAck = null;
        pending.complete(EngineStatus.SUCCESS);
        flush();
    }

    private void deliver(MessageFrame frame) {
        heldSlots++;
        if (heldSlots >= maxSlots) {
            channel.config().setAutoRead(false);
        }
        Slot slot = new Slot(this, new SlotKey(frame.identity(), frame.serial()), frame.requestsAck());
        EngineMessage message = new EngineMessage()
                .identity(frame.identity())
                .serial(frame.serial())
                .flags(frame.flags())
                .header(frame.header())
                .payload(frame.payload())
                .address(remoteAddress)
                .port(remotePort)
                .remoteIdentity(remoteIdentity)
                .slot(slot);
        engine.deliver(message);
    }

    // ─── Sends ──────────────────────────────────────────────────────────────────

    void enqueue(PendingSend send) {
        if (phase == Phase.CLOSED) {
            send.complete(EngineStatus.CANNOT_CONNECT);
            return;
        }
        queue.add(send);
        flush();
    }

    /** Writes queued messages as far as the handshake and acknowledgement rules allow. */
    private void flush() {
        if (phase != Phase.ESTABLISHED) {
            return;
        }
        while (!queue.isEmpty()) {
            if (synchronous && awaitingAck != null) {
                return;
            }
            PendingSend send = queue.poll();
            if (send.isCompleted()) {
                continue;
            }
            long serial = nextSerial;
            nextSerial = Serials.next(nextSerial);
            int flags = synchronous ? EngineMessage.FLAG_REQ_ACK : 0;
            EngineMessage message = send.message.serial(serial).flags(flags);
            MessageFrame frame = new MessageFrame(
                    message.identity(), serial, flags, message.header(), message.payload());
            touch();
            if (synchronous) {
                awaitingAck = send;
                channel.writeAndFlush(frame).addListener(future -> {
                    if (!future.isSuccess()) {
                        engine.connectionFailed(this, future.cause());
                    }
                });
            } else {
                channel.writeAndFlush(frame).addListener(future -> {
                    if (future.isSuccess()) {
                        send.complete(EngineStatus.SUCCESS);
                    } else {
                        engine.connectionFailed(this, future.cause());
                    }
                });
            }
        }
    }

    // ─── Slots ──────────────────────────────────────────────────────────────────

    /** Frees a slot and acknowledges its message if the sender asked for it. */
    void free(Slot slot) {
        heldSlots--;
        if (phase == Phase.CLOSED) {
            return;
        }
        touch();
        if (slot.ackRequested()) {
            SlotKey acked = slot.key();
            channel.writeAndFlush(MessageFrame.ack(acked.identity(), acked.serial()))
                    .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        }
    }

    /** Delivers backlogged messages into free slots and resumes reading once all are out. */
    void drainBacklog() {
        if (phase == Phase.CLOSED) {
            return;
        }
        while (heldSlots < maxSlots && !backlog.isEmpty()) {
            deliver(backlog.poll());
        }
        if (heldSlots < maxSlots && backlog.isEmpty()) {
            channel.config().setAutoRead(true);
        }
    }

    // ─── Closing ────────────────────────────────────────────────────────────────

    /**
     * Closes the connection, failing every send not yet completed with {@code status}.
     *
     * @param status the completion status of failed sends
     */
    void close(EngineStatus status) {
        if (phase == Phase.CLOSED) {
            return;
        }
        phase = Phase.CLOSED;
        engine.forget(this);
        backlog.clear();
        PendingSend pending = awaitingAck;
        awaitingAck = null;
        if (pending != null) {
            pending.complete(status);
        }
        PendingSend queued;
        while ((queued = queue.poll()) != null) {
            queued.complete(status);
        }
        if (channel != null) {
            channel.close();
        }
    }

    /**
     * Checks whether the connection can be collected.
     *
     * @param now current {@link System#nanoTime()}
     * @param reuseNanos idle time after which connections are closed
     * @return true if idle long enough and nothing is in flight
     */
    boolean isIdle(long now, long reuseNanos) {
        return phase == Phase.ESTABLISHED
                && !hasPendingSends()
                && heldSlots == 0
                && backlog.isEmpty()
                && now - lastActivity > reuseNanos;
    }

    private void touch() {
        lastActivity = System.nanoTime();
    }

    private String describeRemote() {
        return key != null ? key.toString() : String.valueOf(remoteAddress);
    }

    @Override
    public String toString() {
        return "Connection[" + (outbound ? "to " : "from ") + describeRemote() + " " + phase + "]";
    }
}
