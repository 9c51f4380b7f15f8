package express.mvp.myra.adapters;

import express.mvp.myra.messaging.EventLoop;
import express.mvp.myra.messaging.MessageEnvelope;
import express.mvp.myra.messaging.MessagingSession;
import express.mvp.myra.messaging.RequestFuture;
import express.mvp.myra.messaging.SessionConfig;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Messaging with a blocking queue of received envelopes.
 *
 * <p>With auto-release, an envelope's slot is released when it is taken from the queue; otherwise
 * the caller releases it. Envelopes still queued when the session stops are released then if
 * auto-release is on.
 *
 * <p>Releasing on take means a synchronous sender receives its acknowledgement as soon as the
 * envelope leaves the queue, before the application has handled the message. A caller that must
 * acknowledge only after handling should disable auto-release and call
 * {@link MessageEnvelope#release()} itself.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (EventLoop loop = new EventLoop(true)) {
 *     QueueMessaging messaging = QueueMessaging.open(loop, config);
 *     MessageEnvelope envelope = messaging.take();
 *     envelope.payload(answer);
 *     messaging.send(envelope).join();
 *     messaging.stop();
 * }
 * }</pre>
 */
public final class QueueMessaging {

    private static final Logger LOGGER = Logger.getLogger(QueueMessaging.class.getName());

    private final LinkedBlockingQueue<MessageEnvelope> queue = new LinkedBlockingQueue<>();

    private final boolean autoRelease;

    private volatile boolean queueDisabled;

    private final MessagingSession session;

    private QueueMessaging(EventLoop loop, SessionConfig config) {
        this.autoRelease = config.autoRelease();
        this.session = MessagingSession.open(loop, config, this::enqueue);
    }

    /**
     * Opens a session whose received envelopes are queued.
     *
     * @param loop a running event loop
     * @param config the configuration
     * @return the messaging surface
     */
    public static QueueMessaging open(EventLoop loop, SessionConfig config) {
        return new QueueMessaging(loop, config);
    }

    private void enqueue(MessageEnvelope envelope) {
        if (queueDisabled) {
            envelope.release();
            return;
        }
        queue.add(envelope);
    }

    /**
     * Waits for the next envelope.
     *
     * @return the envelope
     * @throws InterruptedException if interrupted while waiting
     */
    public MessageEnvelope take() throws InterruptedException {
        return taken(queue.take());
    }

    /**
     * Returns the next envelope if one is queued.
     *
     * @return the envelope, or null
     */
    public MessageEnvelope poll() {
        return taken(queue.poll());
    }

    /**
     * Waits at most {@code timeout} for the next envelope.
     *
     * @param timeout the time limit
     * @return the envelope, or null if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public MessageEnvelope poll(Duration timeout) throws InterruptedException {
        return taken(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    private MessageEnvelope taken(MessageEnvelope envelope) {
        if (envelope != null && autoRelease) {
            envelope.release();
        }
        return envelope;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    /**
     * Stops queueing. While disabled, received envelopes are released and dropped.
     *
     * @param disabled true to drop received envelopes
     */
    public void setQueueDisabled(boolean disabled) {
        this.queueDisabled = disabled;
    }

    public boolean isQueueDisabled() {
        return queueDisabled;
    }

    public CompletableFuture<MessageEnvelope> send(MessageEnvelope envelope) {
        return session.send(envelope);
    }

    public RequestFuture request(MessageEnvelope envelope) {
        return session.request(envelope);
    }

    public RequestFuture request(MessageEnvelope envelope, boolean autoRelease) {
        return session.request(envelope, autoRelease);
    }

    /** Stops the session; see {@link MessagingSession#stop()}. */
    public void stop() {
        if (autoRelease) {
            MessageEnvelope envelope;
            int dropped = 0;
            while ((envelope = queue.poll()) != null) {
                envelope.release();
                dropped++;
            }
            if (dropped > 0) {
                LOGGER.fine("Released " + dropped + " queued envelope(s) on stop");
            }
        }
        session.stop();
    }

    public EventLoop loop() {
        return session.loop();
    }

    public MessagingSession session() {
        return session;
    }
}
