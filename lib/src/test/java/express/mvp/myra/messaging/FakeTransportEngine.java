package express.mvp.myra.messaging;

import express.mvp.myra.messaging.engine.DoneCallback;
import express.mvp.myra.messaging.engine.EngineMessage;
import express.mvp.myra.messaging.engine.LogSink;
import express.mvp.myra.messaging.engine.ReceiveCallback;
import express.mvp.myra.messaging.engine.ReleaseCallback;
import express.mvp.myra.messaging.engine.SendCallback;
import express.mvp.myra.messaging.engine.SlotHandle;
import express.mvp.myra.messaging.engine.TransportEngine;
import express.mvp.myra.messaging.error.EngineStatus;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scriptable engine for session tests. Sends complete immediately unless {@link #holdSends} is
 * set; releases complete immediately unless {@link #holdReleases} is set.
 */
final class FakeTransportEngine implements TransportEngine {

    record FakeSlot(SlotKey key) implements SlotHandle {}

    final Identity identity = Identity.random();

    final List<EngineMessage> sent = new CopyOnWriteArrayList<>();

    final List<SlotKey> released = new CopyOnWriteArrayList<>();

    final Map<EngineMessage, SendCallback> heldSends = new ConcurrentHashMap<>();

    volatile EngineStatus initStatus = EngineStatus.SUCCESS;

    volatile EngineStatus sendStatus = EngineStatus.SUCCESS;

    volatile EngineStatus sendResult = EngineStatus.SUCCESS;

    volatile boolean holdSends;

    volatile boolean holdReleases;

    volatile boolean closed;

    private volatile EventLoop loop;

    private volatile ReceiveCallback onReceive;

    private volatile DoneCallback onDone;

    private volatile LogSink log;

    private long nextSerial = 1;

    @Override
    public EngineStatus init(
            SessionConfig config,
            EventLoop loop,
            ReceiveCallback onReceive,
            DoneCallback onDone,
            LogSink log) {
        this.loop = loop;
        this.onReceive = onReceive;
        this.onDone = onDone;
        this.log = log;
        if (initStatus != EngineStatus.SUCCESS) {
            log.log("fake init failed", true);
            if (initStatus != EngineStatus.OUT_OF_MEMORY) {
                loop.io().execute(onDone::onDone);
            }
        }
        return initStatus;
    }

    @Override
    public EngineStatus send(EngineMessage message, SendCallback callback) {
        if (sendStatus != EngineStatus.SUCCESS) {
            return sendStatus;
        }
        message.serial(nextSerial++);
        sent.add(message);
        if (holdSends) {
            heldSends.put(message, callback);
        } else {
            if (sendResult != EngineStatus.SUCCESS) {
                log.log("fake send failed", true);
            }
            callback.onSendComplete(message, sendResult);
        }
        return EngineStatus.SUCCESS;
    }

    @Override
    public void releaseSlot(EngineMessage message, ReleaseCallback callback) {
        SlotHandle slot = message.slot();
        message.slot(null);
        released.add(slot.key());
        if (!holdReleases) {
            callback.onReleased(slot);
        }
    }

    @Override
    public void close() {
        closed = true;
        heldSends.forEach((message, callback) ->
                callback.onSendComplete(message, EngineStatus.SHUTDOWN));
        heldSends.clear();
        loop.io().execute(onDone::onDone);
    }

    @Override
    public Identity identity() {
        return identity;
    }

    @Override
    public int port() {
        return 4242;
    }

    /** Completes every held send with {@code status} on the I/O thread. */
    void completeHeldSends(EngineStatus status) {
        loop.post(() -> {
            heldSends.forEach((message, callback) -> callback.onSendComplete(message, status));
            heldSends.clear();
        });
    }

    /** Simulates an inbound message on the I/O thread. */
    void receive(Identity identity, long serial, byte[] payload) {
        loop.post(() -> onReceive.onReceive(new EngineMessage()
                .identity(identity)
                .serial(serial)
                .payload(payload)
                .address(localhost())
                .port(2998)
                .remoteIdentity(this.identity)
                .slot(new FakeSlot(new SlotKey(identity, serial)))));
    }

    private static InetAddress localhost() {
        try {
            return InetAddress.getByAddress(new byte[] {127, 0, 0, 1});
        } catch (UnknownHostException e) {
            throw new IllegalStateException(e);
        }
    }
}
