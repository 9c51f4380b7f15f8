package express.mvp.myra.messaging.error;

/**
 * Unchecked exception thrown when messaging operations fail.
 *
 * <p>Root of the messaging error taxonomy. Failures reported by the engine arrive attached to the
 * future of the operation they belong to; contract violations are thrown directly from the call
 * that caused them. Each instance carries the {@link EngineStatus} it was built from.
 *
 * <h2>Subtypes</h2>
 *
 * <ul>
 *   <li>{@link ConfigurationException}: bad configuration, address or message limits
 *   <li>{@link ConnectionFailedException}: connect or write failure, shutdown
 *   <li>{@link MessagingTimeoutException}: send or request timed out
 *   <li>{@link ResourceExhaustedException}: allocation failure
 *   <li>{@link ProtocolViolationException}: peer broke the wire protocol
 *   <li>{@link FatalEngineException}: engine or event loop is unusable
 *   <li>{@link UsageException}: caller broke an API contract
 * </ul>
 *
 * @see EngineErrors
 */
public class MessagingException extends RuntimeException {

    private final EngineStatus status;

    /**
     * Constructs a new messaging exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public MessagingException(String message) {
        this(EngineStatus.FATAL, message);
    }

    /**
     * Constructs a new messaging exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public MessagingException(String message, Throwable cause) {
        this(EngineStatus.FATAL, message, cause);
    }

    /**
     * Constructs a new messaging exception for an engine status.
     *
     * @param status the engine status
     * @param message the detail message describing the failure
     */
    public MessagingException(EngineStatus status, String message) {
        super(message);
        this.status = status;
    }

    /**
     * Constructs a new messaging exception for an engine status with a cause.
     *
     * @param status the engine status
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public MessagingException(EngineStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * Returns the engine status this exception was built from.
     *
     * @return the status
     */
    public EngineStatus status() {
        return status;
    }

    /**
     * Returns the category of the status.
     *
     * @return the error category
     */
    public ErrorCategory category() {
        return status.category();
    }
}
