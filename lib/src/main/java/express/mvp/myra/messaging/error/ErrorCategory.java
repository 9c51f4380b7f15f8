package express.mvp.myra.messaging.error;

/**
 * Categories of messaging errors for handling and recovery decisions.
 *
 * <ul>
 *   <li><b>TRANSIENT:</b> a send or request timed out; retrying may succeed
 *   <li><b>NETWORK:</b> the connection could not be established or broke
 *   <li><b>PROTOCOL:</b> the peer violated the wire protocol
 *   <li><b>RESOURCE:</b> memory or another resource ran out
 *   <li><b>CONFIGURATION:</b> invalid configuration or address
 *   <li><b>USAGE:</b> the caller broke an API contract
 *   <li><b>FATAL:</b> the engine cannot continue
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     session.send(envelope).join();
 * } catch (CompletionException e) {
 *     ErrorCategory category = ErrorClassifier.classify(e.getCause());
 *     if (category.isRetryable()) {
 *         session.send(envelope);
 *     }
 * }
 * }</pre>
 *
 * @see ErrorClassifier
 * @see EngineStatus
 */
public enum ErrorCategory {

    /** Timeouts; the remote may just be slow. */
    TRANSIENT(true, "Transient error - may succeed on retry"),

    /** Connect, write and TLS failures; a new connection is needed. */
    NETWORK(true, "Network error - reconnection required"),

    /** Malformed or oversized frames from the peer. */
    PROTOCOL(false, "Protocol error - invalid communication"),

    /** Allocation failures. */
    RESOURCE(true, "Resource exhaustion - wait for availability"),

    /** Bad configuration, address or message limits. */
    CONFIGURATION(false, "Configuration error - fix the value"),

    /** Double send, restart after stop, forgotten release. */
    USAGE(false, "Usage error - caller bug"),

    /** The engine or event loop is broken. */
    FATAL(false, "Fatal error - shutdown required"),

    /** Unclassified. Treated conservatively as retryable. */
    UNKNOWN(true, "Unknown error - conservative retry");

    private final boolean retryable;
    private final String description;

    ErrorCategory(boolean retryable, String description) {
        this.retryable = retryable;
        this.description = description;
    }

    /**
     * Checks if errors in this category are generally retryable.
     *
     * @return true if retry is generally appropriate
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns a human-readable description of this category.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
