package express.mvp.myra.messaging.engine;

/** Receives engine diagnostics on the I/O thread. */
@FunctionalInterface
public interface LogSink {

    /**
     * Called for every engine diagnostic.
     *
     * @param message the diagnostic text
     * @param error true if the diagnostic describes an error
     */
    void log(String message, boolean error);
}
