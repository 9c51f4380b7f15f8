package express.mvp.myra.messaging.error;

/**
 * Thrown when the caller violates an API contract.
 *
 * <p>Examples: sending an envelope whose previous send has not completed, releasing an envelope
 * while it is still sending, restarting a stopped event loop, or stopping a session while slots
 * were never released. The last case is reported after {@code stop()} has cleaned up, so the
 * shutdown itself still completes.
 */
public class UsageException extends MessagingException {

    public UsageException(String message) {
        super(EngineStatus.USED, message);
    }

    public UsageException(EngineStatus status, String message) {
        super(status, message);
    }
}
