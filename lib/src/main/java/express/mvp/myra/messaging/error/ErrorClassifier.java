package express.mvp.myra.messaging.error;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.DecoderException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Classifies exceptions into error categories and engine statuses.
 *
 * <p>The engine uses {@link #toStatus(Throwable)} to turn the raw failures Netty reports for a
 * connect, write or read into the status its completion callbacks carry. Applications use
 * {@link #classify(Throwable)} on whatever failed their futures.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>{@link MessagingException}: category of its status
 *   <li>JVM errors: FATAL
 *   <li>Exception type (timeouts, TLS, sockets, decoding)
 *   <li>Cause chain
 *   <li>Default to UNKNOWN
 * </ol>
 *
 * @see ErrorCategory
 * @see EngineStatus
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies an exception into an error category.
     *
     * @param throwable the exception to classify
     * @return the error category
     */
    public static ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.UNKNOWN;
        }
        if (throwable instanceof MessagingException) {
            return ((MessagingException) throwable).category();
        }
        if (throwable instanceof VirtualMachineError || throwable instanceof LinkageError) {
            return ErrorCategory.FATAL;
        }
        if (throwable instanceof RejectedExecutionException) {
            return ErrorCategory.RESOURCE;
        }
        if (throwable instanceof IllegalArgumentException) {
            return ErrorCategory.CONFIGURATION;
        }
        EngineStatus status = statusOf(throwable);
        if (status != null) {
            return status.category();
        }
        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return classify(cause);
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * Maps a raw failure to the engine status a completion should carry.
     *
     * @param throwable the failure, typically from a Netty future
     * @return the status; {@link EngineStatus#FATAL} if nothing more specific applies
     */
    public static EngineStatus toStatus(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof MessagingException) {
                return ((MessagingException) current).status();
            }
            EngineStatus status = statusOf(current);
            if (status != null) {
                return status;
            }
            Throwable cause = current.getCause();
            current = cause == current ? null : cause;
        }
        return EngineStatus.FATAL;
    }

    private static EngineStatus statusOf(Throwable t) {
        if (t instanceof ConnectTimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof TimeoutException) {
            return EngineStatus.TIMEOUT;
        }
        if (t instanceof SSLException) {
            return EngineStatus.TLS_ERROR;
        }
        if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof PortUnreachableException
                || t instanceof UnknownHostException) {
            return EngineStatus.CANNOT_CONNECT;
        }
        if (t instanceof DecoderException) {
            // SslHandler reports handshake failures wrapped in a DecoderException
            return t.getCause() instanceof SSLException
                    ? EngineStatus.TLS_ERROR
                    : EngineStatus.PROTOCOL_ERROR;
        }
        if (t instanceof ClosedChannelException || t instanceof SocketException) {
            return EngineStatus.WRITE_ERROR;
        }
        if (t instanceof OutOfMemoryError) {
            return EngineStatus.OUT_OF_MEMORY;
        }
        if (t instanceof IOException) {
            return EngineStatus.IO_ERROR;
        }
        return null;
    }

    /**
     * Describes an exception in one line, for engine diagnostics.
     *
     * <p>Example: {@code ConnectException: Connection refused [NETWORK, retryable]}. The message
     * of the cause is used when the exception has none.
     *
     * @param throwable the exception to describe
     * @return simple type name, message and category
     */
    public static String summarize(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        String message = throwable.getMessage();
        if ((message == null || message.isEmpty()) && throwable.getCause() != null) {
            message = throwable.getCause().getMessage();
        }
        ErrorCategory category = classify(throwable);
        StringBuilder sb = new StringBuilder(throwable.getClass().getSimpleName());
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message.replace('\n', ' ').replace('\r', ' '));
        }
        sb.append(" [").append(category.name());
        if (category.isRetryable()) {
            sb.append(", retryable");
        }
        return sb.append(']').toString();
    }
}
