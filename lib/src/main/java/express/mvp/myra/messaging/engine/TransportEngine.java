package express.mvp.myra.messaging.engine;

import express.mvp.myra.messaging.EventLoop;
import express.mvp.myra.messaging.Identity;
import express.mvp.myra.messaging.SessionConfig;
import express.mvp.myra.messaging.error.EngineStatus;

/**
 * Contract of the transport engine a session drives.
 *
 * <p>The engine owns connections, framing, acknowledgements, TLS and slot accounting. Every method
 * is called on the event loop's I/O thread, and every callback is invoked on that thread.
 *
 * <h2>Callback Guarantees</h2>
 *
 * <table border="1">
 *   <caption>Engine callbacks</caption>
 *   <tr><th>Callback</th><th>When</th><th>Times</th></tr>
 *   <tr><td>{@link ReceiveCallback}</td><td>a message arrived and took a slot</td>
 *       <td>per message</td></tr>
 *   <tr><td>{@link SendCallback}</td><td>a send completed or failed</td>
 *       <td>exactly once per accepted send</td></tr>
 *   <tr><td>{@link ReleaseCallback}</td><td>a slot was released</td>
 *       <td>exactly once per release</td></tr>
 *   <tr><td>{@link DoneCallback}</td><td>after {@link #close()} drained, or after a failed
 *       {@link #init}</td><td>once</td></tr>
 *   <tr><td>{@link LogSink}</td><td>diagnostics</td><td>any</td></tr>
 * </table>
 */
public interface TransportEngine {

    /**
     * Initializes the engine: validates the configuration, binds listeners, starts timers.
     *
     * <p>On failure the engine cleans up asynchronously and invokes {@code onDone}, except for
     * {@link EngineStatus#OUT_OF_MEMORY}, where nothing was set up.
     *
     * @param config the sealed session configuration
     * @param loop the loop whose I/O thread runs the engine
     * @param onReceive receive callback
     * @param onDone done callback
     * @param log diagnostic sink
     * @return {@link EngineStatus#SUCCESS} or the failure status
     */
    EngineStatus init(
            SessionConfig config,
            EventLoop loop,
            ReceiveCallback onReceive,
            DoneCallback onDone,
            LogSink log);

    /**
     * Sends a message to the address and port it carries.
     *
     * <p>If the returned status is a failure the callback is not invoked. Otherwise the callback
     * fires exactly once, on success or failure.
     *
     * @param message the message
     * @param callback completion callback
     * @return {@link EngineStatus#SUCCESS}, {@link EngineStatus#QUEUED}, or an immediate failure
     *     such as {@link EngineStatus#USED} when the message is already being sent
     */
    EngineStatus send(EngineMessage message, SendCallback callback);

    /**
     * Releases the slot held by a received message and acknowledges it if the sender asked for
     * an acknowledgement.
     *
     * @param message a message that holds a slot
     * @param callback invoked once the slot is free
     */
    void releaseSlot(EngineMessage message, ReleaseCallback callback);

    /**
     * Closes listeners and connections and fails queued sends. Invokes the done callback when
     * every channel has closed.
     */
    void close();

    /**
     * Returns the node identity, stable for the lifetime of this engine instance.
     *
     * @return the identity
     */
    Identity identity();

    /**
     * Returns the port the engine listens on; resolves an ephemeral configured port.
     *
     * @return the bound port
     */
    int port();
}
