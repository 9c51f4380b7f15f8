package express.mvp.myra.messaging.error;

/**
 * The engine or event loop reached a state it cannot recover from.
 */
public class FatalEngineException extends MessagingException {

    public FatalEngineException(String message) {
        super(EngineStatus.FATAL, message);
    }

    public FatalEngineException(EngineStatus status, String message) {
        super(status, message);
    }

    public FatalEngineException(String message, Throwable cause) {
        super(EngineStatus.FATAL, message, cause);
    }
}
