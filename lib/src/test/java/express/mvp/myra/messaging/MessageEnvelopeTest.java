package express.mvp.myra.messaging;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link MessageEnvelope}. */
@DisplayName("MessageEnvelope")
class MessageEnvelopeTest {

    @Test
    @DisplayName("A new envelope has a fresh identity and empty fields")
    void defaults() {
        MessageEnvelope envelope = new MessageEnvelope();

        assertFalse(envelope.identity().isZero());
        assertNotEquals(envelope.identity(), new MessageEnvelope().identity());
        assertEquals(0, envelope.serial());
        assertEquals(0, envelope.header().length);
        assertEquals(0, envelope.payload().length);
        assertEquals("0.0.0.0", envelope.address());
        assertEquals(0, envelope.port());
        assertEquals(Identity.ZERO, envelope.remoteIdentity());
        assertFalse(envelope.hasSlot());
        assertFalse(envelope.isSending());
    }

    @Test
    @DisplayName("Setters chain and normalize the address")
    void setters() {
        byte[] header = {1, 2};
        byte[] payload = {3};
        MessageEnvelope envelope = new MessageEnvelope()
                .header(header)
                .payload(payload)
                .address("0:0:0:0:0:0:0:1")
                .port(2998);

        assertSame(header, envelope.header());
        assertSame(payload, envelope.payload());
        assertEquals("::1", envelope.address());
        assertEquals(2998, envelope.port());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void validation() {
        MessageEnvelope envelope = new MessageEnvelope();

        assertThrows(IllegalArgumentException.class, () -> envelope.address("127.0"));
        assertThrows(IllegalArgumentException.class, () -> envelope.port(70000));
        assertThrows(NullPointerException.class, () -> envelope.payload(null));
        assertThrows(NullPointerException.class, () -> envelope.header(null));
    }

    @Test
    @DisplayName("Releasing an envelope that never held a slot yields empty")
    void releaseWithoutSlot() {
        CompletableFuture<Optional<SlotKey>> released = new MessageEnvelope().release();

        assertTrue(released.isDone());
        assertEquals(Optional.empty(), released.join());
    }

    @Test
    @DisplayName("Only one send can be in flight")
    void sendLatch() {
        MessageEnvelope envelope = new MessageEnvelope();
        CompletableFuture<MessageEnvelope> first = new CompletableFuture<>();

        assertTrue(envelope.beginSend(first));
        assertTrue(envelope.isSending());
        assertFalse(envelope.beginSend(new CompletableFuture<>()));
        assertSame(first, envelope.endSend());
        assertFalse(envelope.isSending());
        assertNull(envelope.endSend());
    }
}
