package express.mvp.myra.messaging.error;

/**
 * Result codes reported by the transport engine.
 *
 * <p>Every synchronous engine call and every completion callback carries one of these. Only
 * {@link #SUCCESS} (and the informational {@link #QUEUED}) denote success; the others are
 * converted into typed exceptions by {@link EngineErrors}.
 */
public enum EngineStatus {
    SUCCESS(0, ErrorCategory.UNKNOWN),
    VALUE_ERROR(1, ErrorCategory.CONFIGURATION),
    IO_ERROR(2, ErrorCategory.FATAL),
    PROTOCOL_ERROR(3, ErrorCategory.PROTOCOL),
    ADDRESS_IN_USE(4, ErrorCategory.NETWORK),
    FATAL(5, ErrorCategory.FATAL),
    TLS_ERROR(6, ErrorCategory.FATAL),
    NOT_INITIALIZED(7, ErrorCategory.USAGE),
    IN_PROGRESS(8, ErrorCategory.USAGE),
    TIMEOUT(9, ErrorCategory.TRANSIENT),
    OUT_OF_MEMORY(10, ErrorCategory.RESOURCE),
    SHUTDOWN(11, ErrorCategory.NETWORK),
    CANNOT_CONNECT(12, ErrorCategory.NETWORK),
    QUEUED(13, ErrorCategory.UNKNOWN),
    USED(14, ErrorCategory.USAGE),
    MORE(15, ErrorCategory.UNKNOWN),
    BUSY(16, ErrorCategory.TRANSIENT),
    EMPTY(17, ErrorCategory.UNKNOWN),
    WRITE_ERROR(18, ErrorCategory.NETWORK),
    INIT_FAIL(19, ErrorCategory.FATAL);

    private static final EngineStatus[] BY_CODE = values();

    private final int code;
    private final ErrorCategory category;

    EngineStatus(int code, ErrorCategory category) {
        this.code = code;
        this.category = category;
    }

    /**
     * Returns the numeric code.
     *
     * @return the code
     */
    public int code() {
        return code;
    }

    /**
     * Returns the error category used for recovery decisions.
     *
     * @return the category
     */
    public ErrorCategory category() {
        return category;
    }

    /**
     * Checks whether this status denotes success.
     *
     * @return true for {@link #SUCCESS} and {@link #QUEUED}
     */
    public boolean isSuccess() {
        return this == SUCCESS || this == QUEUED;
    }

    /**
     * Looks up a status by numeric code.
     *
     * @param code the code
     * @return the status
     * @throws IllegalArgumentException for unknown codes
     */
    public static EngineStatus fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown engine status: " + code);
        }
        return BY_CODE[code];
    }
}
