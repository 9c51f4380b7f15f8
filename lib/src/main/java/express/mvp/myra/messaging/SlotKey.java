package express.mvp.myra.messaging;

import java.util.Objects;

/**
 * Key of a received message slot: the message identity and the serial it arrived with.
 *
 * <p>Completed release futures carry the key of the slot they released.
 *
 * @param identity the message identity
 * @param serial the serial as received, an unsigned 32-bit value
 */
public record SlotKey(Identity identity, long serial) {

    public SlotKey {
        Objects.requireNonNull(identity, "identity must not be null");
    }

    @Override
    public String toString() {
        return identity + "/" + serial;
    }
}
