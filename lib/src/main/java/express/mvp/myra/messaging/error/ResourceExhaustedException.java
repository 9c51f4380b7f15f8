package express.mvp.myra.messaging.error;

/**
 * The engine could not allocate what an operation needed.
 */
public class ResourceExhaustedException extends MessagingException {

    public ResourceExhaustedException(String message) {
        super(EngineStatus.OUT_OF_MEMORY, message);
    }

    public ResourceExhaustedException(EngineStatus status, String message) {
        super(status, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(EngineStatus.OUT_OF_MEMORY, message, cause);
    }
}
