package express.mvp.myra.messaging;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 16-byte correlation token.
 *
 * <p>Identities name a logical exchange (a message and every reply that reuses it) and a node
 * instance (the engine identity a remote reports in its handshake). Equality is by content.
 *
 * <p>Fresh identities are drawn from the process-wide {@link java.security.SecureRandom} owned by
 * {@link MessagingRuntime}.
 */
public final class Identity {

    /** Number of bytes in an identity. */
    public static final int SIZE = 16;

    /** The all-zero identity, used for "unset". */
    public static final Identity ZERO = new Identity(new byte[SIZE]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    private Identity(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Generates a new random identity.
     *
     * @return a fresh identity, never {@link #ZERO} in practice
     */
    public static Identity random() {
        byte[] bytes = new byte[SIZE];
        MessagingRuntime.initialize().nextBytes(bytes);
        return new Identity(bytes);
    }

    /**
     * Creates an identity from a copy of the given bytes.
     *
     * @param bytes exactly {@link #SIZE} bytes
     * @return the identity
     * @throws IllegalArgumentException if the length is wrong
     */
    public static Identity of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException(
                    "Identity must be " + SIZE + " bytes, got " + bytes.length);
        }
        return new Identity(bytes.clone());
    }

    /**
     * Returns a copy of the identity bytes.
     *
     * @return 16 bytes
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * Copies the identity into {@code target} at {@code offset}.
     *
     * @param target destination array
     * @param offset destination offset
     */
    public void copyTo(byte[] target, int offset) {
        System.arraycopy(bytes, 0, target, offset, SIZE);
    }

    /**
     * Checks whether every byte is zero.
     *
     * @return true for the unset identity
     */
    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Identity && Arrays.equals(bytes, ((Identity) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        char[] out = new char[SIZE * 2];
        for (int i = 0; i < SIZE; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0F];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0F];
        }
        return new String(out);
    }
}
