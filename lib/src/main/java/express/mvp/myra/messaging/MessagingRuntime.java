package express.mvp.myra.messaging;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.net.ssl.SSLContext;

/**
 * Process-wide setup shared by every event loop and session.
 *
 * <p>{@link #initialize()} runs once per process (until {@link #cleanup()}), creating the random
 * source used for identities and probing the JDK TLS provider. It is invoked implicitly by
 * {@link EventLoop} and {@link Identity#random()}; explicit calls are allowed and idempotent.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. The first caller performs the setup while concurrent callers
 * wait for it.
 */
public final class MessagingRuntime {

    private static final Logger LOGGER = Logger.getLogger(MessagingRuntime.class.getName());

    private static final Object LOCK = new Object();

    private static volatile SecureRandom random;

    private static volatile boolean tlsAvailable;

    private MessagingRuntime() {
        // Utility class
    }

    /**
     * Performs process-wide initialization if it has not happened yet.
     *
     * @return the shared random source
     */
    public static SecureRandom initialize() {
        SecureRandom current = random;
        if (current != null) {
            return current;
        }
        synchronized (LOCK) {
            if (random == null) {
                tlsAvailable = detectTls();
                random = new SecureRandom();
                LOGGER.fine("Messaging runtime initialized (tls=" + tlsAvailable + ")");
            }
            return random;
        }
    }

    /**
     * Releases process-wide state. The next {@link #initialize()} sets it up again.
     */
    public static void cleanup() {
        synchronized (LOCK) {
            if (random != null) {
                random = null;
                tlsAvailable = false;
                LOGGER.fine("Messaging runtime cleaned up");
            }
        }
    }

    /**
     * Checks whether {@link #initialize()} has run.
     *
     * @return true once initialized and not cleaned up
     */
    public static boolean isInitialized() {
        return random != null;
    }

    /**
     * Checks whether the JDK provides a TLS implementation.
     *
     * @return true if {@code SSLContext.getInstance("TLS")} succeeded during initialization
     */
    public static boolean isTlsAvailable() {
        initialize();
        return tlsAvailable;
    }

    private static boolean detectTls() {
        try {
            SSLContext.getInstance("TLS");
            return true;
        } catch (NoSuchAlgorithmException e) {
            LOGGER.log(Level.WARNING, "No TLS provider available, encryption disabled", e);
            return false;
        }
    }
}
