package express.mvp.myra.messaging.engine;

/** Invoked on the I/O thread once a slot has been released. */
@FunctionalInterface
public interface ReleaseCallback {

    /**
     * Called when the slot is free.
     *
     * @param slot the handle the released message carried; its key is identity and serial as
     *     received
     */
    void onReleased(SlotHandle slot);
}
