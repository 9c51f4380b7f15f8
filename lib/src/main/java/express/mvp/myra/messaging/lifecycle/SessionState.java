package express.mvp.myra.messaging.lifecycle;

/**
 * Lifecycle states of a {@link express.mvp.myra.messaging.MessagingSession}.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌───────────────┐  open()  ┌──────────────┐  engine ready  ┌─────────┐
 * │ UNINITIALIZED │─────────▶│ INITIALIZING │───────────────▶│  READY  │
 * └───────────────┘          └──────────────┘                └─────────┘
 *                                   │ init failed                 │ stop()
 *                                   ▼                             ▼
 *                            ┌──────────────┐  engine done  ┌──────────┐
 *                            │   STOPPED    │◀──────────────│ STOPPING │
 *                            └──────────────┘               └──────────┘
 * </pre>
 *
 * @see SessionStateMachine
 */
public enum SessionState {

    /** Created, engine init not yet posted. */
    UNINITIALIZED(false),

    /** Engine init posted to the I/O thread; the opening thread is blocked on it. */
    INITIALIZING(false),

    /** Sends, requests and releases are accepted. */
    READY(true),

    /** Draining releases and closing the engine. Releases are still accepted. */
    STOPPING(false),

    /** Terminal. */
    STOPPED(false);

    private final boolean acceptsSends;

    SessionState(boolean acceptsSends) {
        this.acceptsSends = acceptsSends;
    }

    /**
     * Checks whether new sends and requests are accepted in this state.
     *
     * @return true only for {@link #READY}
     */
    public boolean acceptsSends() {
        return acceptsSends;
    }

    /**
     * Checks whether this is the terminal state.
     *
     * @return true for {@link #STOPPED}
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }
}
