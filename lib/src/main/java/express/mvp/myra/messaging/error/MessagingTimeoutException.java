package express.mvp.myra.messaging.error;

/**
 * A send, request or connect did not complete in time.
 */
public class MessagingTimeoutException extends MessagingException {

    public MessagingTimeoutException(String message) {
        super(EngineStatus.TIMEOUT, message);
    }

    public MessagingTimeoutException(EngineStatus status, String message) {
        super(status, message);
    }

    public MessagingTimeoutException(String message, Throwable cause) {
        super(EngineStatus.TIMEOUT, message, cause);
    }
}
