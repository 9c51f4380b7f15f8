package express.mvp.myra.messaging;

import express.mvp.myra.messaging.PendingTable.PendingRelease;
import express.mvp.myra.messaging.engine.EngineMessage;
import express.mvp.myra.messaging.engine.SlotHandle;
import express.mvp.myra.messaging.engine.TransportEngine;
import express.mvp.myra.messaging.engine.netty.NettyTransportEngine;
import express.mvp.myra.messaging.error.ConnectionFailedException;
import express.mvp.myra.messaging.error.EngineErrors;
import express.mvp.myra.messaging.error.EngineStatus;
import express.mvp.myra.messaging.error.ErrorClassifier;
import express.mvp.myra.messaging.error.MessagingException;
import express.mvp.myra.messaging.error.UsageException;
import express.mvp.myra.messaging.lifecycle.SessionState;
import express.mvp.myra.messaging.lifecycle.SessionStateMachine;
import express.mvp.myra.messaging.util.Futures;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Correlates application calls with transport engine completions.
 *
 * <p>Caller threads register their intent in a {@link PendingTable} and post the engine call to
 * the {@link EventLoop}; the engine completes on the I/O thread and the session resolves the
 * registered future. Every registration is removed exactly once, by its completion, its timeout
 * or the shutdown drain.
 *
 * <h2>Operations</h2>
 *
 * <table border="1">
 *   <caption>Session operations</caption>
 *   <tr><th>Operation</th><th>Completes</th><th>Fails with</th></tr>
 *   <tr><td>{@link #send}</td><td>when the engine reports the send done</td>
 *       <td>the typed error of the engine status</td></tr>
 *   <tr><td>{@link #request}</td><td>when an envelope with the same identity arrives</td>
 *       <td>send failure, {@code MessagingTimeoutException}, or shutdown</td></tr>
 *   <tr><td>{@link #releaseSlot}</td><td>when the engine freed the slot</td>
 *       <td>never; no slot yields an empty result</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventLoop loop = new EventLoop(true);
 * MessagingSession session = MessagingSession.open(loop, config, envelope -> {
 *     handle(envelope);
 *     envelope.release();
 * });
 *
 * MessageEnvelope envelope = new MessageEnvelope()
 *         .address("127.0.0.1")
 *         .port(2998)
 *         .payload(bytes);
 * session.send(envelope).join();
 *
 * session.stop();
 * loop.stop();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All public methods are thread-safe. {@link #open} and {@link #stop()} block and must not be
 * called from the I/O thread.
 */
public final class MessagingSession implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(MessagingSession.class.getName());

    private final EventLoop loop;

    private final SessionConfig config;

    private final MessageDispatcher dispatcher;

    private final TransportEngine engine;

    private final PendingTable table = new PendingTable();

    private final SessionStateMachine state;

    /** Completed by the engine's done callback. */
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    /** Last error diagnostic reported by the engine. */
    private volatile String lastDiagnostic = "";

    private volatile Identity identity = Identity.ZERO;

    private volatile int port;

    private MessagingSession(
            EventLoop loop,
            SessionConfig config,
            MessageDispatcher dispatcher,
            TransportEngine engine) {
        this.loop = Objects.requireNonNull(loop, "loop must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.dispatcher = dispatcher;
        this.state = new SessionStateMachine("session@" + Integer.toHexString(hashCode()));
    }

    /**
     * Opens a session on the built-in Netty engine.
     *
     * @param loop a running event loop
     * @param config the configuration, sealed by this call
     * @param dispatcher receives inbound envelopes; null releases them immediately
     * @return the ready session
     * @throws UsageException if the loop is not running or this is the I/O thread
     * @throws MessagingException if the engine fails to initialize
     */
    public static MessagingSession open(
            EventLoop loop, SessionConfig config, MessageDispatcher dispatcher) {
        return open(loop, config, dispatcher, new NettyTransportEngine());
    }

    /**
     * Opens a session on the given engine.
     *
     * @param loop a running event loop
     * @param config the configuration, sealed by this call
     * @param dispatcher receives inbound envelopes; null releases them immediately
     * @param engine an uninitialized engine
     * @return the ready session
     * @throws UsageException if the loop is not running or this is the I/O thread
     * @throws MessagingException if the engine fails to initialize
     */
    public static MessagingSession open(
            EventLoop loop,
            SessionConfig config,
            MessageDispatcher dispatcher,
            TransportEngine engine) {
        MessagingSession session = new MessagingSession(loop, config, dispatcher, engine);
        session.init();
        return session;
    }

    private void init() {
        if (!loop.isRunning()) {
            throw new UsageException("Event loop is not running");
        }
        if (loop.inEventLoop()) {
            throw new UsageException("Cannot open a session on the I/O thread");
        }
        config.seal();
        loop.retain();
        state.transitionFrom(SessionState.UNINITIALIZED, SessionState.INITIALIZING);

        CompletableFuture<EngineStatus> initResult = new CompletableFuture<>();
        EngineStatus status;
        try {
            loop.post(() -> initOnLoop(initResult));
            status = Futures.await(initResult);
        } catch (RuntimeException e) {
            state.transitionFrom(SessionState.INITIALIZING, SessionState.STOPPED, e);
            loop.release();
            throw e;
        }

        if (!status.isSuccess()) {
            // the engine tears down asynchronously and reports through the done callback
            if (status != EngineStatus.OUT_OF_MEMORY) {
                done.join();
            }
            MessagingException failure = EngineErrors.toException(status, lastDiagnostic);
            state.transitionFrom(SessionState.INITIALIZING, SessionState.STOPPED, failure);
            loop.release();
            throw failure;
        }
        state.transitionFrom(SessionState.INITIALIZING, SessionState.READY);
    }

    private void initOnLoop(CompletableFuture<EngineStatus> result) {
        EngineStatus status;
        try {
            status = engine.init(config, loop, this::onReceive, this::onDone, this::onLog);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        if (status.isSuccess()) {
            identity = engine.identity();
            port = engine.port();
        }
        result.complete(status);
    }

    // ─── Operations ─────────────────────────────────────────────────────────────

    /**
     * Sends an envelope to the address and port it carries.
     *
     * @param envelope the envelope, not mutated until the future completes
     * @return completes with the envelope once the engine reports the send done
     * @throws UsageException if the envelope is already being sent or the session is not ready
     */
    public CompletableFuture<MessageEnvelope> send(MessageEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        checkReady();
        CompletableFuture<MessageEnvelope> future = new CompletableFuture<>();
        if (!envelope.beginSend(future)) {
            throw new UsageException(EngineStatus.USED, "Envelope is already being sent");
        }
        long token = table.registerSend(envelope);
        try {
            EngineMessage message = envelope.toEngine(token);
            loop.post(() -> sendOnLoop(message));
        } catch (RuntimeException e) {
            table.completeSend(token);
            envelope.endSend();
            throw e;
        }
        return future;
    }

    /**
     * Sends a request and waits for the envelope that answers it, releasing the reply's slot
     * once the reply is read.
     *
     * @param envelope the request
     * @return the request future
     * @see #request(MessageEnvelope, boolean)
     */
    public RequestFuture request(MessageEnvelope envelope) {
        return request(envelope, true);
    }

    /**
     * Sends a request. The first received envelope carrying the same identity is the reply; it
     * bypasses the dispatcher. If no reply arrives within the configured timeout the reply future
     * fails with {@link express.mvp.myra.messaging.error.MessagingTimeoutException}; a reply
     * arriving after that is dispatched like any other envelope.
     *
     * @param envelope the request
     * @param autoRelease whether reading the reply through the returned future releases it
     * @return the request future
     * @throws UsageException if a request with this identity is pending, the envelope is already
     *     being sent, or the session is not ready
     */
    public RequestFuture request(MessageEnvelope envelope, boolean autoRelease) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        checkReady();
        Identity id = envelope.identity();
        CompletableFuture<MessageEnvelope> reply = new CompletableFuture<>();
        RequestTimeout timeout = new RequestTimeout(table, id, reply);
        if (!table.registerRequest(id, timeout)) {
            throw new UsageException(EngineStatus.USED, "A request with identity " + id
                    + " is already pending");
        }

        CompletableFuture<MessageEnvelope> sent;
        try {
            sent = send(envelope);
            loop.post(() -> timeout.arm(loop, config.timeout()));
        } catch (RuntimeException e) {
            table.removeRequest(id, timeout);
            timeout.fail(e);
            throw e;
        }
        sent.whenComplete((ignored, failure) -> {
            if (failure != null && table.removeRequest(id, timeout)) {
                timeout.fail(failure);
            }
        });
        return new RequestFuture(sent, reply, autoRelease);
    }

    /**
     * Releases the slot held by a received envelope.
     *
     * <p>Releasing from any thread is safe, and so is releasing again after the first release
     * completed. Releasing the same envelope concurrently from two threads is not supported.
     *
     * @param envelope the envelope
     * @return completes with the released slot key, or immediately with empty if the envelope
     *     holds no slot
     * @throws UsageException if the envelope was received by another session
     */
    public CompletableFuture<Optional<SlotKey>> releaseSlot(MessageEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        MessagingSession owner = envelope.session();
        if (owner == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (owner != this) {
            throw new UsageException("Envelope was received by another session");
        }
        synchronized (table.lock()) {
            if (!envelope.holdsSlot()) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            SlotHandle slot = envelope.slot();
            PendingRelease pending = table.releaseFor(slot, envelope);
            EngineMessage message = envelope.detachEngineMessage();
            try {
                loop.post(() -> engine.releaseSlot(message, this::onReleased));
            } catch (UsageException e) {
                table.completeRelease(slot);
                pending.future().completeExceptionally(e);
            }
            return pending.future();
        }
    }

    /**
     * Stops the session.
     *
     * <p>Waits up to the configured timeout for every received envelope to be released. Slots
     * still held after that are released by force, with a second wait of the same length. The
     * engine is then closed regardless, and this method returns once the engine reported done.
     * Pending requests fail with a {@link ConnectionFailedException}.
     *
     * @throws UsageException after a complete shutdown, if slots had to be released by force
     */
    public void stop() {
        if (loop.inEventLoop()) {
            throw new UsageException("Cannot stop a session on the I/O thread");
        }
        if (!state.transitionFrom(SessionState.READY, SessionState.STOPPING)) {
            return;
        }
        Duration timeout = config.timeout();
        boolean released = awaitReleases(timeout);
        try {
            if (!released) {
                List<PendingRelease> remaining = table.releases();
                LOGGER.warning("Forcing release of " + remaining.size() + " slot(s)");
                for (PendingRelease pending : remaining) {
                    releaseSlot(pending.envelope());
                }
                if (!awaitReleases(timeout)) {
                    LOGGER.warning("Forced release did not complete within " + timeout);
                }
            }
        } finally {
            closeEngine();
            state.transitionFrom(SessionState.STOPPING, SessionState.STOPPED);
            loop.release();
        }
        if (!released) {
            throw new UsageException(
                    "Timeout waiting for released messages, maybe a message was not released.");
        }
    }

    /** Same as {@link #stop()}. */
    @Override
    public void close() {
        stop();
    }

    private boolean awaitReleases(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (PendingRelease pending : table.releases()) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                pending.future().get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                LOGGER.log(Level.FINE, "Release of " + pending.key() + " failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private void closeEngine() {
        ConnectionFailedException shutdown =
                new ConnectionFailedException(EngineStatus.SHUTDOWN, "Session stopped");
        try {
            loop.post(() -> {
                for (RequestTimeout request : table.drainRequests()) {
                    request.fail(shutdown);
                }
                engine.close();
            });
        } catch (UsageException e) {
            LOGGER.log(Level.WARNING, "Event loop gone before the engine was closed", e);
            return;
        }
        done.join();
    }

    // ─── Engine callbacks, I/O thread ───────────────────────────────────────────

    private void sendOnLoop(EngineMessage message) {
        EngineStatus status;
        try {
            status = engine.send(message, this::onSendComplete);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Engine send threw", e);
            status = ErrorClassifier.toStatus(e);
        }
        if (!status.isSuccess()) {
            completeSend(message.token(), status, message.serial());
        }
    }

    private void onSendComplete(EngineMessage message, EngineStatus status) {
        completeSend(message.token(), status, message.serial());
    }

    private void completeSend(long token, EngineStatus status, long serial) {
        MessageEnvelope envelope = table.completeSend(token);
        if (envelope == null) {
            LOGGER.warning("Send completion for unknown token " + token);
            return;
        }
        CompletableFuture<MessageEnvelope> future = envelope.endSend();
        if (future == null) {
            LOGGER.warning("Envelope " + envelope + " completed without a send in flight");
            return;
        }
        if (status.isSuccess()) {
            envelope.serial(serial);
            future.complete(envelope);
        } else {
            future.completeExceptionally(EngineErrors.toException(status, lastDiagnostic));
        }
    }

    private void onReceive(EngineMessage message) {
        MessageEnvelope envelope = MessageEnvelope.received(message, this);
        if (envelope.slot() != null) {
            table.registerRelease(envelope.slot(), envelope);
        }

        RequestTimeout request = table.takeRequest(envelope.identity());
        if (request != null && request.resolve(envelope)) {
            return;
        }
        if (dispatcher == null) {
            envelope.release();
            return;
        }
        try {
            dispatcher.dispatch(envelope);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Dispatcher failed for " + envelope, e);
            envelope.release();
        }
    }

    private void onReleased(SlotHandle slot) {
        PendingRelease pending = table.completeRelease(slot);
        if (pending == null) {
            LOGGER.fine(() -> "Release of untracked slot " + slot.key());
            return;
        }
        pending.future().complete(Optional.of(slot.key()));
    }

    private void onDone() {
        done.complete(null);
    }

    private void onLog(String message, boolean error) {
        if (error) {
            lastDiagnostic = message;
            LOGGER.fine(message);
        } else {
            LOGGER.info(message);
        }
    }

    // ─── Accessors ──────────────────────────────────────────────────────────────

    private void checkReady() {
        SessionState current = state.state();
        if (!current.acceptsSends()) {
            throw new UsageException("Session is " + current);
        }
    }

    /** Mutex guarding the pending table and slot ownership of received envelopes. */
    Object lock() {
        return table.lock();
    }

    /**
     * Returns the node identity of the engine.
     *
     * @return the identity; zero before the session is ready
     */
    public Identity identity() {
        return identity;
    }

    /**
     * Returns the port the engine listens on.
     *
     * @return the bound port
     */
    public int port() {
        return port;
    }

    public EventLoop loop() {
        return loop;
    }

    public SessionConfig config() {
        return config;
    }

    public SessionState state() {
        return state.state();
    }

    /**
     * Returns the last error diagnostic the engine reported.
     *
     * @return the diagnostic, empty if none
     */
    public String lastDiagnostic() {
        return lastDiagnostic;
    }

    public int pendingSends() {
        return table.pendingSends();
    }

    public int pendingReleases() {
        return table.pendingReleases();
    }

    public int pendingRequests() {
        return table.pendingRequests();
    }

    @Override
    public String toString() {
        return "MessagingSession[" + identity + " port=" + port + " " + state.state() + "]";
    }
}
