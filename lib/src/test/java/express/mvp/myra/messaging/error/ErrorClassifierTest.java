package express.mvp.myra.messaging.error;

import static org.junit.jupiter.api.Assertions.*;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.DecoderException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.RejectedExecutionException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorClassifier}. */
@DisplayName("ErrorClassifier")
class ErrorClassifierTest {

    @Nested
    @DisplayName("Engine status mapping")
    class ToStatusTests {

        @Test
        @DisplayName("Refused connect is CANNOT_CONNECT")
        void connectRefused() {
            assertEquals(EngineStatus.CANNOT_CONNECT,
                    ErrorClassifier.toStatus(new ConnectException("Connection refused")));
        }

        @Test
        @DisplayName("Netty connect timeout is TIMEOUT, not CANNOT_CONNECT")
        void connectTimeout() {
            assertEquals(EngineStatus.TIMEOUT,
                    ErrorClassifier.toStatus(new ConnectTimeoutException("timed out")));
        }

        @Test
        @DisplayName("Closed channel and socket errors are WRITE_ERROR")
        void writeErrors() {
            assertEquals(EngineStatus.WRITE_ERROR,
                    ErrorClassifier.toStatus(new ClosedChannelException()));
            assertEquals(EngineStatus.WRITE_ERROR,
                    ErrorClassifier.toStatus(new SocketException("Broken pipe")));
        }

        @Test
        @DisplayName("TLS failures are TLS_ERROR, even wrapped by the decoder")
        void tlsErrors() {
            SSLHandshakeException handshake = new SSLHandshakeException("bad certificate");

            assertEquals(EngineStatus.TLS_ERROR, ErrorClassifier.toStatus(handshake));
            assertEquals(EngineStatus.TLS_ERROR,
                    ErrorClassifier.toStatus(new DecoderException(handshake)));
        }

        @Test
        @DisplayName("Corrupted frames are PROTOCOL_ERROR")
        void corruptedFrame() {
            assertEquals(EngineStatus.PROTOCOL_ERROR,
                    ErrorClassifier.toStatus(new CorruptedFrameException("unknown kind")));
        }

        @Test
        @DisplayName("Messaging exceptions keep their own status")
        void messagingException() {
            assertEquals(EngineStatus.SHUTDOWN, ErrorClassifier.toStatus(
                    new ConnectionFailedException(EngineStatus.SHUTDOWN, "stopped")));
        }

        @Test
        @DisplayName("The cause chain is searched")
        void causeChain() {
            RuntimeException wrapped =
                    new RuntimeException("outer", new SocketTimeoutException("read"));

            assertEquals(EngineStatus.TIMEOUT, ErrorClassifier.toStatus(wrapped));
        }

        @Test
        @DisplayName("Unrecognized failures are FATAL")
        void unknownIsFatal() {
            assertEquals(EngineStatus.FATAL,
                    ErrorClassifier.toStatus(new IllegalStateException("?")));
            assertEquals(EngineStatus.FATAL, ErrorClassifier.toStatus(null));
        }
    }

    @Nested
    @DisplayName("Categories")
    class ClassifyTests {

        @Test
        @DisplayName("Network failures are retryable")
        void network() {
            ErrorCategory category = ErrorClassifier.classify(new ConnectException("refused"));

            assertEquals(ErrorCategory.NETWORK, category);
            assertTrue(category.isRetryable());
        }

        @Test
        @DisplayName("Timeouts are TRANSIENT")
        void timeouts() {
            assertEquals(ErrorCategory.TRANSIENT,
                    ErrorClassifier.classify(new MessagingTimeoutException("Request timed out")));
            assertEquals(ErrorCategory.TRANSIENT,
                    ErrorClassifier.classify(new SocketTimeoutException("read")));
        }

        @Test
        @DisplayName("Usage errors are not retryable")
        void usage() {
            ErrorCategory category = ErrorClassifier.classify(new UsageException("twice"));

            assertEquals(ErrorCategory.USAGE, category);
            assertFalse(category.isRetryable());
        }

        @Test
        @DisplayName("Bad arguments are CONFIGURATION")
        void configuration() {
            assertEquals(ErrorCategory.CONFIGURATION,
                    ErrorClassifier.classify(new IllegalArgumentException("port")));
        }

        @Test
        @DisplayName("Rejected executions are RESOURCE")
        void resource() {
            assertEquals(ErrorCategory.RESOURCE,
                    ErrorClassifier.classify(new RejectedExecutionException("full")));
        }

        @Test
        @DisplayName("JVM errors are FATAL")
        void jvmErrors() {
            ErrorCategory category = ErrorClassifier.classify(new OutOfMemoryError());

            assertEquals(ErrorCategory.FATAL, category);
            assertFalse(category.isRetryable());
        }

        @Test
        @DisplayName("Generic I/O failures are FATAL")
        void genericIo() {
            assertEquals(ErrorCategory.FATAL, ErrorClassifier.classify(new IOException("disk")));
        }

        @Test
        @DisplayName("Unknown exceptions are UNKNOWN")
        void unknown() {
            assertEquals(ErrorCategory.UNKNOWN,
                    ErrorClassifier.classify(new IllegalStateException("?")));
            assertEquals(ErrorCategory.UNKNOWN, ErrorClassifier.classify(null));
        }
    }

    @Test
    @DisplayName("summarize() describes the failure on one line")
    void summarize() {
        String summary = ErrorClassifier.summarize(
                new RuntimeException(null, new ConnectException("refused\nby peer")));

        assertEquals("RuntimeException: refused by peer [NETWORK, retryable]", summary);
        assertFalse(summary.contains("\n"));
        assertEquals("ConnectException: refused [NETWORK, retryable]",
                ErrorClassifier.summarize(new ConnectException("refused")));
        assertEquals("UsageException: twice [USAGE]",
                ErrorClassifier.summarize(new UsageException("twice")));
    }
}
