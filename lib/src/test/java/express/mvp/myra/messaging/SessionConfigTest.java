package express.mvp.myra.messaging;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SessionConfig}. */
@DisplayName("SessionConfig")
class SessionConfigTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Has the documented default values")
        void defaults() {
            SessionConfig config = SessionConfig.defaults();

            assertEquals(Duration.ofSeconds(30), config.reuseTime());
            assertEquals(Duration.ofSeconds(5), config.timeout());
            assertEquals(2998, config.port());
            assertEquals(100, config.backlog());
            assertEquals(0, config.maxSlots());
            assertTrue(config.synchronous());
            assertTrue(config.autoRelease());
            assertEquals("0.0.0.0", config.bindV4());
            assertNull(config.bindV6());
            assertEquals(Identity.ZERO, config.identity());
            assertFalse(config.disableEncryption());
            assertFalse(config.isSealed());
        }

        @Test
        @DisplayName("Slot default depends on the mode")
        void slotDefaults() {
            assertEquals(1, SessionConfig.defaults().effectiveMaxSlots());
            assertEquals(16,
                    SessionConfig.builder().synchronous(false).build().effectiveMaxSlots());
            assertEquals(4, SessionConfig.builder().maxSlots(4).build().effectiveMaxSlots());
        }
    }

    @Nested
    @DisplayName("Derived values")
    class DerivedTests {

        @Test
        @DisplayName("Reuse time is at least three timeouts")
        void reuseTimeFloor() {
            SessionConfig config = SessionConfig.builder()
                    .timeout(Duration.ofSeconds(20))
                    .reuseTime(Duration.ofSeconds(30))
                    .build();

            assertEquals(Duration.ofSeconds(60), config.effectiveReuseTime());
            assertEquals(Duration.ofSeconds(30),
                    SessionConfig.defaults().effectiveReuseTime());
        }

        @Test
        @DisplayName("Connect timeout is twice the timeout, capped at one minute")
        void connectTimeout() {
            assertEquals(Duration.ofSeconds(10), SessionConfig.defaults().connectTimeout());
            assertEquals(Duration.ofSeconds(60),
                    SessionConfig.builder().timeout(Duration.ofMinutes(2)).build()
                            .connectTimeout());
        }

        @Test
        @DisplayName("Buffer size 0 means the engine default")
        void bufferDefault() {
            assertEquals(SessionConfig.DEFAULT_BUFFER_SIZE,
                    SessionConfig.defaults().effectiveBufferSize());
            assertEquals(4096,
                    SessionConfig.builder().bufferSize(4096).build().effectiveBufferSize());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Rejects out-of-range numbers")
        void rangeChecks() {
            SessionConfig.Builder builder = SessionConfig.builder();

            assertThrows(IllegalArgumentException.class, () -> builder.port(-1));
            assertThrows(IllegalArgumentException.class, () -> builder.port(65536));
            assertThrows(IllegalArgumentException.class, () -> builder.backlog(0));
            assertThrows(IllegalArgumentException.class, () -> builder.backlog(256));
            assertThrows(IllegalArgumentException.class, () -> builder.maxSlots(33));
            assertThrows(IllegalArgumentException.class, () -> builder.bufferSize(10));
            assertThrows(IllegalArgumentException.class, () -> builder.maxMessageSize(0));
            assertThrows(IllegalArgumentException.class, () -> builder.timeout(Duration.ZERO));
            assertThrows(IllegalArgumentException.class,
                    () -> builder.reuseTime(Duration.ofSeconds(-1)));
        }

        @Test
        @DisplayName("Bind addresses must match their family")
        void bindFamilies() {
            SessionConfig.Builder builder = SessionConfig.builder();

            assertThrows(IllegalArgumentException.class, () -> builder.bindV4("::1"));
            assertThrows(IllegalArgumentException.class, () -> builder.bindV6("127.0.0.1"));
            assertThrows(IllegalArgumentException.class, () -> builder.bindV4("127.0"));
            assertEquals("::1", builder.bindV6("0:0:0:0:0:0:0:1").build().bindV6());
        }
    }

    @Test
    @DisplayName("toBuilder copies every value")
    void toBuilderCopies() {
        Identity id = Identity.random();
        SessionConfig original = SessionConfig.builder()
                .port(0)
                .synchronous(false)
                .identity(id)
                .certChainPem("cert.pem")
                .build();

        SessionConfig copy = original.toBuilder().build();

        assertEquals(0, copy.port());
        assertFalse(copy.synchronous());
        assertEquals(id, copy.identity());
        assertEquals("cert.pem", copy.certChainPem());
    }
}
