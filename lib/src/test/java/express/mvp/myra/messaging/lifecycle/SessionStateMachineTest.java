package express.mvp.myra.messaging.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Unit tests for {@link SessionStateMachine}. */
@DisplayName("SessionStateMachine")
class SessionStateMachineTest {

    private SessionStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new SessionStateMachine("test");
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("Follows the normal lifecycle")
        void normalLifecycle() {
            assertEquals(SessionState.UNINITIALIZED, machine.state());
            assertTrue(machine.transitionFrom(SessionState.UNINITIALIZED, SessionState.INITIALIZING));
            assertTrue(machine.transitionFrom(SessionState.INITIALIZING, SessionState.READY));
            assertTrue(machine.state().acceptsSends());
            assertTrue(machine.transitionFrom(SessionState.READY, SessionState.STOPPING));
            assertFalse(machine.state().acceptsSends());
            assertTrue(machine.transitionFrom(SessionState.STOPPING, SessionState.STOPPED));
            assertTrue(machine.state().isTerminal());
        }

        @Test
        @DisplayName("Failed init goes straight to STOPPED")
        void failedInit() {
            machine.transitionFrom(SessionState.UNINITIALIZED, SessionState.INITIALIZING);

            assertTrue(machine.transitionFrom(SessionState.INITIALIZING, SessionState.STOPPED));
        }

        @Test
        @DisplayName("Rejects a stale expected state")
        void staleExpectedState() {
            assertFalse(machine.transitionFrom(SessionState.READY, SessionState.STOPPING));
            assertEquals(SessionState.UNINITIALIZED, machine.state());
        }

        @ParameterizedTest
        @EnumSource(SessionState.class)
        @DisplayName("STOPPED is final")
        void stoppedIsFinal(SessionState target) {
            assertFalse(SessionStateMachine.isValidTransition(SessionState.STOPPED, target));
        }

        @Test
        @DisplayName("READY cannot skip STOPPING")
        void noSkip() {
            assertFalse(SessionStateMachine.isValidTransition(
                    SessionState.READY, SessionState.STOPPED));
        }

        @Test
        @DisplayName("Only one of two racing stops wins")
        void racingStops() throws Exception {
            machine.transitionFrom(SessionState.UNINITIALIZED, SessionState.INITIALIZING);
            machine.transitionFrom(SessionState.INITIALIZING, SessionState.READY);
            ExecutorService executor = Executors.newFixedThreadPool(8);
            AtomicInteger winners = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int i = 0; i < 8; i++) {
                    executor.execute(() -> {
                        try {
                            start.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return;
                        }
                        if (machine.transitionFrom(SessionState.READY, SessionState.STOPPING)) {
                            winners.incrementAndGet();
                        }
                    });
                }
                start.countDown();
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            }
            assertEquals(1, winners.get());
        }
    }
}
