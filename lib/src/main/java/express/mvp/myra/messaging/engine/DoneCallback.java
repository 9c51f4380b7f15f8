package express.mvp.myra.messaging.engine;

/** Invoked on the I/O thread once the engine has fully shut down. */
@FunctionalInterface
public interface DoneCallback {

    /** Called when every engine resource is released. */
    void onDone();
}
