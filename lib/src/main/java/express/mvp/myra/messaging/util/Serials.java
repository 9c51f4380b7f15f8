package express.mvp.myra.messaging.util;

/**
 * Arithmetic on unsigned 32-bit message serials.
 *
 * <p>Serials wrap around, so ordering must use the sign of the 32-bit difference rather than a
 * direct comparison: {@code 0} follows {@code 0xFFFFFFFF}.
 */
public final class Serials {

    /** Largest serial value. */
    public static final long MAX = 0xFFFF_FFFFL;

    private Serials() {
        // Utility class
    }

    /**
     * Returns the serial following {@code serial}, wrapping to zero.
     *
     * @param serial current serial
     * @return next serial
     */
    public static long next(long serial) {
        return (serial + 1) & MAX;
    }

    /**
     * Compares two serials with wraparound.
     *
     * @param a first serial
     * @param b second serial
     * @return negative if {@code a} precedes {@code b}, zero if equal, positive otherwise
     */
    public static int compare(long a, long b) {
        return Integer.signum((int) (a - b));
    }
}
