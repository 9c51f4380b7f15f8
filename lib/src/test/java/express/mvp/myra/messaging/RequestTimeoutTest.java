package express.mvp.myra.messaging;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.messaging.error.MessagingTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Unit tests for {@link RequestTimeout}. */
@DisplayName("RequestTimeout")
@Timeout(30)
class RequestTimeoutTest {

    private EventLoop loop;

    private PendingTable table;

    private Identity id;

    private CompletableFuture<MessageEnvelope> reply;

    private RequestTimeout timeout;

    @BeforeEach
    void setUp() {
        loop = new EventLoop();
        table = new PendingTable();
        id = Identity.random();
        reply = new CompletableFuture<>();
        timeout = new RequestTimeout(table, id, reply);
        table.registerRequest(id, timeout);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    @DisplayName("Firing fails the reply, unregisters it and cleans up once")
    void fires() {
        loop.post(() -> timeout.arm(loop, Duration.ofMillis(50)));

        ExecutionException e =
                assertThrows(ExecutionException.class, () -> reply.get(5, TimeUnit.SECONDS));

        assertInstanceOf(MessagingTimeoutException.class, e.getCause());
        assertEquals(0, table.pendingRequests());
        assertEquals(1, timeout.cleanups());
    }

    @Test
    @DisplayName("Resolving before the deadline disarms the timer")
    void resolveWins() throws Exception {
        loop.post(() -> timeout.arm(loop, Duration.ofMillis(100)));
        MessageEnvelope envelope = new MessageEnvelope();

        assertTrue(timeout.resolve(envelope));
        Thread.sleep(300);

        assertSame(envelope, reply.get());
        assertEquals(1, timeout.cleanups());
        assertFalse(timeout.fail(new IllegalStateException("late")));
    }

    @Test
    @DisplayName("Arming a settled request does nothing")
    void armAfterSettle() throws Exception {
        IllegalStateException failure = new IllegalStateException("send failed");
        assertTrue(timeout.fail(failure));

        loop.post(() -> timeout.arm(loop, Duration.ofMillis(10)));
        Thread.sleep(200);

        ExecutionException e = assertThrows(ExecutionException.class, reply::get);
        assertSame(failure, e.getCause());
        assertEquals(1, timeout.cleanups());
    }

    @Test
    @DisplayName("Only the first settlement counts")
    void singleSettlement() {
        assertTrue(timeout.resolve(new MessageEnvelope()));
        assertFalse(timeout.resolve(new MessageEnvelope()));
        assertFalse(timeout.fail(new IllegalStateException()));

        timeout.fire();

        assertTrue(timeout.isSettled());
        assertEquals(1, timeout.cleanups());
        assertFalse(reply.isCompletedExceptionally());
    }
}
