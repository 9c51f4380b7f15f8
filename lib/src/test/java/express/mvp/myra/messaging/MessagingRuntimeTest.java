package express.mvp.myra.messaging;

import static org.junit.jupiter.api.Assertions.*;

import java.security.SecureRandom;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link MessagingRuntime}. */
@DisplayName("MessagingRuntime")
class MessagingRuntimeTest {

    @AfterEach
    void tearDown() {
        MessagingRuntime.initialize();
    }

    @Test
    @DisplayName("Initialize is idempotent")
    void initializeIsIdempotent() {
        SecureRandom first = MessagingRuntime.initialize();
        SecureRandom second = MessagingRuntime.initialize();

        assertSame(first, second);
        assertTrue(MessagingRuntime.isInitialized());
    }

    @Test
    @DisplayName("Cleanup resets and the next initialize runs again")
    void cleanupResets() {
        SecureRandom before = MessagingRuntime.initialize();

        MessagingRuntime.cleanup();
        assertFalse(MessagingRuntime.isInitialized());
        MessagingRuntime.cleanup();

        SecureRandom after = MessagingRuntime.initialize();
        assertNotSame(before, after);
        assertTrue(MessagingRuntime.isInitialized());
    }

    @Test
    @DisplayName("Identities initialize the runtime implicitly")
    void identityInitializes() {
        MessagingRuntime.cleanup();

        assertFalse(Identity.random().isZero());
        assertTrue(MessagingRuntime.isInitialized());
    }

    @Test
    @DisplayName("The JDK provides TLS")
    void tlsAvailable() {
        assertTrue(MessagingRuntime.isTlsAvailable());
    }
}
