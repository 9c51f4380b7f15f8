package express.mvp.myra.messaging.util;

import io.netty.util.NetUtil;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Parsing and canonical formatting of IP address literals, on top of Netty's {@link NetUtil}.
 *
 * <p>Only literals are accepted; no name resolution ever happens. IPv4 must be a full dotted quad
 * ({@code "127.0"} is rejected even though {@link InetAddress#getByName(String)} would accept
 * it). Bracketed and scoped IPv6 literals are rejected. IPv6 output follows RFC 5952.
 */
public final class Addresses {

    private Addresses() {
        // Utility class
    }

    /**
     * Parses an IPv4 or IPv6 literal.
     *
     * @param text the literal
     * @return the address
     * @throws IllegalArgumentException if {@code text} is not a valid literal
     */
    public static InetAddress parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Address must not be empty");
        }
        if (text.indexOf('%') >= 0 || text.indexOf('[') >= 0) {
            throw new IllegalArgumentException("Invalid address: " + text);
        }
        byte[] raw = NetUtil.createByteArrayFromIpAddressString(text);
        if (raw == null) {
            throw new IllegalArgumentException("Invalid address: " + text);
        }
        try {
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid address: " + text, e);
        }
    }

    /**
     * Normalizes an address literal to its canonical text.
     *
     * @param text the literal
     * @return canonical text
     * @throws IllegalArgumentException if {@code text} is not a valid literal
     */
    public static String normalize(String text) {
        return canonical(parse(text));
    }

    /**
     * Formats an address in canonical text form.
     *
     * @param address the address
     * @return dotted quad for IPv4, RFC 5952 text for IPv6
     */
    public static String canonical(InetAddress address) {
        return NetUtil.toAddressString(address);
    }

    /**
     * Checks whether an address is a loopback address ({@code 127.0.0.0/8} or {@code ::1}).
     *
     * @param address the address
     * @return true for loopback
     */
    public static boolean isLoopback(InetAddress address) {
        return address.isLoopbackAddress();
    }
}
