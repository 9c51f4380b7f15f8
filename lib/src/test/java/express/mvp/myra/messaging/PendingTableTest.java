package express.mvp.myra.messaging;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.messaging.PendingTable.PendingRelease;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link PendingTable}. */
@DisplayName("PendingTable")
class PendingTableTest {

    private PendingTable table;

    @BeforeEach
    void setUp() {
        table = new PendingTable();
    }

    @Nested
    @DisplayName("Sends")
    class SendTests {

        @Test
        @DisplayName("Tokens are unique and each completes once")
        void tokensCompleteOnce() {
            MessageEnvelope envelope = new MessageEnvelope();
            Set<Long> tokens = new HashSet<>();
            for (int i = 0; i < 100; i++) {
                assertTrue(tokens.add(table.registerSend(envelope)));
            }
            assertEquals(100, table.pendingSends());

            long token = tokens.iterator().next();
            assertSame(envelope, table.completeSend(token));
            assertNull(table.completeSend(token));
            assertEquals(99, table.pendingSends());
        }
    }

    @Nested
    @DisplayName("Releases")
    class ReleaseTests {

        private FakeTransportEngine.FakeSlot slot(Identity identity, long serial) {
            return new FakeTransportEngine.FakeSlot(new SlotKey(identity, serial));
        }

        @Test
        @DisplayName("A slot handle registers once")
        void duplicateHandle() {
            FakeTransportEngine.FakeSlot slot = slot(Identity.random(), 1);
            MessageEnvelope envelope = new MessageEnvelope();

            assertNotNull(table.registerRelease(slot, envelope));
            assertNull(table.registerRelease(slot, envelope));
            assertEquals(1, table.pendingReleases());
        }

        @Test
        @DisplayName("releaseFor returns the existing registration")
        void releaseForExisting() {
            FakeTransportEngine.FakeSlot slot = slot(Identity.random(), 1);
            MessageEnvelope envelope = new MessageEnvelope();
            PendingRelease registered = table.registerRelease(slot, envelope);

            assertSame(registered, table.releaseFor(slot, envelope));
            assertSame(registered, table.completeRelease(slot));
            assertNull(table.completeRelease(slot));
        }

        @Test
        @DisplayName("releaseFor registers a missing handle")
        void releaseForMissing() {
            FakeTransportEngine.FakeSlot slot = slot(Identity.random(), 2);

            PendingRelease created = table.releaseFor(slot, new MessageEnvelope());

            assertEquals(slot.key(), created.key());
            assertFalse(created.future().isDone());
            assertEquals(List.of(created), table.releases());
        }

        @Test
        @DisplayName("Same identity with different serials are different slots")
        void serialsDistinguishSlots() {
            Identity id = Identity.random();
            table.registerRelease(slot(id, 1), new MessageEnvelope());

            assertNotNull(table.registerRelease(slot(id, 2), new MessageEnvelope()));
            assertEquals(2, table.pendingReleases());
        }

        @Test
        @DisplayName("Handles with equal keys are tracked and completed separately")
        void equalKeysStaySeparate() {
            Identity id = Identity.random();
            FakeTransportEngine.FakeSlot first = slot(id, 1);
            FakeTransportEngine.FakeSlot resent = slot(id, 1);
            PendingRelease firstRelease = table.registerRelease(first, new MessageEnvelope());
            PendingRelease resentRelease = table.registerRelease(resent, new MessageEnvelope());

            assertNotNull(firstRelease);
            assertNotNull(resentRelease);
            assertEquals(2, table.pendingReleases());

            assertSame(resentRelease, table.completeRelease(resent));
            assertEquals(List.of(firstRelease), table.releases());
        }
    }

    @Nested
    @DisplayName("Requests")
    class RequestTests {

        private RequestTimeout request(Identity id) {
            return new RequestTimeout(table, id, new CompletableFuture<>());
        }

        @Test
        @DisplayName("One live request per identity")
        void onePerIdentity() {
            Identity id = Identity.random();

            assertTrue(table.registerRequest(id, request(id)));
            assertFalse(table.registerRequest(id, request(id)));
            assertEquals(1, table.pendingRequests());
        }

        @Test
        @DisplayName("takeRequest removes the registration")
        void take() {
            Identity id = Identity.random();
            RequestTimeout timeout = request(id);
            table.registerRequest(id, timeout);

            assertSame(timeout, table.takeRequest(id));
            assertNull(table.takeRequest(id));
        }

        @Test
        @DisplayName("removeRequest only removes the matching registration")
        void conditionalRemove() {
            Identity id = Identity.random();
            RequestTimeout current = request(id);
            table.registerRequest(id, current);

            assertFalse(table.removeRequest(id, request(id)));
            assertTrue(table.removeRequest(id, current));
            assertEquals(0, table.pendingRequests());
        }

        @Test
        @DisplayName("drainRequests empties the table")
        void drain() {
            Identity a = Identity.random();
            Identity b = Identity.random();
            table.registerRequest(a, request(a));
            table.registerRequest(b, request(b));

            assertEquals(2, table.drainRequests().size());
            assertEquals(0, table.pendingRequests());
            assertTrue(table.drainRequests().isEmpty());
        }
    }
}
