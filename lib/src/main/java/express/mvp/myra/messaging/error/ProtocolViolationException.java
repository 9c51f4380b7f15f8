package express.mvp.myra.messaging.error;

/**
 * The peer sent frames that violate the wire protocol.
 */
public class ProtocolViolationException extends MessagingException {

    public ProtocolViolationException(String message) {
        super(EngineStatus.PROTOCOL_ERROR, message);
    }

    public ProtocolViolationException(EngineStatus status, String message) {
        super(status, message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(EngineStatus.PROTOCOL_ERROR, message, cause);
    }
}
