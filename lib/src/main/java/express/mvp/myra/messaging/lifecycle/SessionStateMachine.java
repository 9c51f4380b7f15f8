package express.mvp.myra.messaging.lifecycle;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for the session lifecycle.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * UNINITIALIZED → INITIALIZING, STOPPED
 * INITIALIZING  → READY, STOPPED
 * READY         → STOPPING
 * STOPPING      → STOPPED
 * STOPPED       → (terminal, no transitions)
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Transitions are compare-and-set operations, so of two threads
 * racing for the same transition exactly one wins.
 *
 * @see SessionState
 */
public final class SessionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(SessionStateMachine.class.getName());

    private static final Set<SessionState> FROM_UNINITIALIZED =
            EnumSet.of(SessionState.INITIALIZING, SessionState.STOPPED);

    private static final Set<SessionState> FROM_INITIALIZING =
            EnumSet.of(SessionState.READY, SessionState.STOPPED);

    private static final Set<SessionState> FROM_READY = EnumSet.of(SessionState.STOPPING);

    private static final Set<SessionState> FROM_STOPPING = EnumSet.of(SessionState.STOPPED);

    private final AtomicReference<SessionState> state =
            new AtomicReference<>(SessionState.UNINITIALIZED);

    /** Name used in log messages. */
    private final String name;

    /**
     * Creates a state machine in {@link SessionState#UNINITIALIZED}.
     *
     * @param name name used in log messages
     */
    public SessionStateMachine(String name) {
        this.name = name;
    }

    public SessionState state() {
        return state.get();
    }

    /**
     * Transitions from {@code expectedState} to {@code newState}.
     *
     * @param expectedState the state the caller believes is current
     * @param newState the desired state
     * @return false if the transition is invalid or the current state differs
     */
    public boolean transitionFrom(SessionState expectedState, SessionState newState) {
        return transitionFrom(expectedState, newState, null);
    }

    /**
     * Transitions from {@code expectedState} to {@code newState} with a cause.
     *
     * @param expectedState the state the caller believes is current
     * @param newState the desired state
     * @param cause the reason for the transition, logged with it (may be null)
     * @return false if the transition is invalid or the current state differs
     */
    public boolean transitionFrom(
            SessionState expectedState, SessionState newState, Throwable cause) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            LOGGER.fine(() -> name + ": " + expectedState + " -> " + newState
                    + (cause == null ? "" : " (" + cause.getMessage() + ")"));
            return true;
        }
        return false;
    }

    /**
     * Checks whether a transition is allowed.
     *
     * @param from the source state
     * @param to the target state
     * @return true if allowed
     */
    public static boolean isValidTransition(SessionState from, SessionState to) {
        return switch (from) {
            case UNINITIALIZED -> FROM_UNINITIALIZED.contains(to);
            case INITIALIZING -> FROM_INITIALIZING.contains(to);
            case READY -> FROM_READY.contains(to);
            case STOPPING -> FROM_STOPPING.contains(to);
            case STOPPED -> false;
        };
    }

    @Override
    public String toString() {
        return "SessionStateMachine[" + name + ":" + state.get() + "]";
    }
}
