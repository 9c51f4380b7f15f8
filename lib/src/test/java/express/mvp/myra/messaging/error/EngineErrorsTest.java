package express.mvp.myra.messaging.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Unit tests for {@link EngineErrors} and {@link EngineStatus}. */
@DisplayName("EngineErrors")
class EngineErrorsTest {

    @Test
    @DisplayName("Each failure status maps to its typed exception")
    void typedExceptions() {
        assertInstanceOf(ConfigurationException.class,
                EngineErrors.toException(EngineStatus.VALUE_ERROR, ""));
        assertInstanceOf(ConnectionFailedException.class,
                EngineErrors.toException(EngineStatus.CANNOT_CONNECT, ""));
        assertInstanceOf(ConnectionFailedException.class,
                EngineErrors.toException(EngineStatus.ADDRESS_IN_USE, ""));
        assertInstanceOf(MessagingTimeoutException.class,
                EngineErrors.toException(EngineStatus.TIMEOUT, ""));
        assertInstanceOf(ResourceExhaustedException.class,
                EngineErrors.toException(EngineStatus.OUT_OF_MEMORY, ""));
        assertInstanceOf(ProtocolViolationException.class,
                EngineErrors.toException(EngineStatus.PROTOCOL_ERROR, ""));
        assertInstanceOf(FatalEngineException.class,
                EngineErrors.toException(EngineStatus.TLS_ERROR, ""));
        assertInstanceOf(UsageException.class,
                EngineErrors.toException(EngineStatus.USED, ""));
    }

    @Test
    @DisplayName("The diagnostic becomes the message")
    void diagnosticMessage() {
        MessagingException e =
                EngineErrors.toException(EngineStatus.WRITE_ERROR, "Connection reset by peer");

        assertEquals("Connection reset by peer", e.getMessage());
        assertEquals(EngineStatus.WRITE_ERROR, e.status());
        assertEquals(ErrorCategory.NETWORK, e.category());
    }

    @ParameterizedTest
    @EnumSource(
            value = EngineStatus.class,
            names = {"SUCCESS", "QUEUED"},
            mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Without diagnostic the message is never empty")
    void fallbackMessage(EngineStatus status) {
        MessagingException e = EngineErrors.toException(status, null);

        assertNotNull(e.getMessage());
        assertFalse(e.getMessage().isEmpty());
        assertEquals(status, e.status());
    }

    @Test
    @DisplayName("Codes round-trip through fromCode")
    void codes() {
        for (EngineStatus status : EngineStatus.values()) {
            assertEquals(status, EngineStatus.fromCode(status.code()));
        }
        assertThrows(IllegalArgumentException.class, () -> EngineStatus.fromCode(-1));
        assertThrows(IllegalArgumentException.class, () -> EngineStatus.fromCode(99));
        assertTrue(EngineStatus.QUEUED.isSuccess());
        assertFalse(EngineStatus.BUSY.isSuccess());
    }
}
