package express.mvp.myra.messaging.error;

/**
 * Converts engine result codes into typed exceptions.
 *
 * <p>The detail message is the engine's last diagnostic when one is available, otherwise the
 * status name.
 */
public final class EngineErrors {

    private EngineErrors() {
        // Utility class
    }

    /**
     * Builds the exception for a failed status.
     *
     * @param status the engine status, must not be a success status
     * @param diagnostic the engine's last diagnostic, may be null or empty
     * @return the typed exception
     */
    public static MessagingException toException(EngineStatus status, String diagnostic) {
        String message = diagnostic == null || diagnostic.isEmpty() ? status.name() : diagnostic;
        return switch (status) {
            case VALUE_ERROR -> new ConfigurationException(status, message);
            case CANNOT_CONNECT, WRITE_ERROR, ADDRESS_IN_USE, SHUTDOWN ->
                    new ConnectionFailedException(status, message);
            case TIMEOUT -> new MessagingTimeoutException(status, message);
            case OUT_OF_MEMORY -> new ResourceExhaustedException(status, message);
            case PROTOCOL_ERROR -> new ProtocolViolationException(status, message);
            case FATAL, IO_ERROR, TLS_ERROR, INIT_FAIL -> new FatalEngineException(status, message);
            case USED, NOT_INITIALIZED, IN_PROGRESS -> new UsageException(status, message);
            default -> new MessagingException(
                    status, diagnostic == null || diagnostic.isEmpty()
                            ? "Unknown error: " + status.code()
                            : diagnostic);
        };
    }
}
