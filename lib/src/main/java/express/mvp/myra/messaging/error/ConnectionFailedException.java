package express.mvp.myra.messaging.error;

/**
 * A connection could not be established, broke while writing, or was shut down.
 */
public class ConnectionFailedException extends MessagingException {

    public ConnectionFailedException(String message) {
        super(EngineStatus.CANNOT_CONNECT, message);
    }

    public ConnectionFailedException(EngineStatus status, String message) {
        super(status, message);
    }

    public ConnectionFailedException(String message, Throwable cause) {
        super(EngineStatus.CANNOT_CONNECT, message, cause);
    }
}
