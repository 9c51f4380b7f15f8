package express.mvp.myra.messaging.error;

/**
 * Invalid configuration, address, or message size.
 */
public class ConfigurationException extends MessagingException {

    public ConfigurationException(String message) {
        super(EngineStatus.VALUE_ERROR, message);
    }

    public ConfigurationException(EngineStatus status, String message) {
        super(status, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(EngineStatus.VALUE_ERROR, message, cause);
    }
}
