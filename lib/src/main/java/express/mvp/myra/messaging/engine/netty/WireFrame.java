package express.mvp.myra.messaging.engine.netty;

/**
 * A decoded unit of the wire protocol.
 *
 * <p>Every frame starts with a one-byte kind; all integers are big-endian.
 *
 * <pre>
 * HANDSHAKE  kind(1) port(2) identity(16)
 * MESSAGE    kind(1) identity(16) serial(4) flags(1) headerLength(2) payloadLength(4)
 *            header(headerLength) payload(payloadLength)
 * </pre>
 *
 * @see HandshakeFrame
 * @see MessageFrame
 */
public interface WireFrame {

    /** Kind byte of a {@link HandshakeFrame}. */
    byte KIND_HANDSHAKE = 1;

    /** Kind byte of a {@link MessageFrame}. */
    byte KIND_MESSAGE = 2;

    /** Handshake size after the kind byte. */
    int HANDSHAKE_SIZE = 2 + 16;

    /** Message preamble size after the kind byte. */
    int MESSAGE_PREAMBLE_SIZE = 16 + 4 + 1 + 2 + 4;

    /** Largest header a message frame can carry. */
    int MAX_HEADER_SIZE = 0xFFFF;

    /**
     * Returns the kind byte written before the frame.
     *
     * @return the kind
     */
    byte kind();
}
