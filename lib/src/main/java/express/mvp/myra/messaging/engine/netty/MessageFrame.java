package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.Identity;
import express.mvp.myra.messaging.engine.EngineMessage;
import java.util.Objects;

/**
 * A message, an acknowledgement, or a keep-alive.
 *
 * @param identity identity of the message
 * @param serial serial assigned by the sending connection, unsigned 32-bit
 * @param flags combination of {@link EngineMessage#FLAG_REQ_ACK}, {@link EngineMessage#FLAG_ACK}
 *     and {@link EngineMessage#FLAG_NOOP}
 * @param header header bytes, at most {@link WireFrame#MAX_HEADER_SIZE}
 * @param payload payload bytes
 */
public record MessageFrame(Identity identity, long serial, int flags, byte[] header, byte[] payload)
        implements WireFrame {

    private static final byte[] EMPTY = new byte[0];

    public MessageFrame {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (header.length > MAX_HEADER_SIZE) {
            throw new IllegalArgumentException("header too large: " + header.length);
        }
    }

    /**
     * Builds the acknowledgement of a received message.
     *
     * @param identity identity of the acknowledged message
     * @param serial serial of the acknowledged message
     * @return the ack frame
     */
    public static MessageFrame ack(Identity identity, long serial) {
        return new MessageFrame(identity, serial, EngineMessage.FLAG_ACK, EMPTY, EMPTY);
    }

    public boolean isAck() {
        return (flags & EngineMessage.FLAG_ACK) != 0;
    }

    public boolean isNoop() {
        return (flags & EngineMessage.FLAG_NOOP) != 0;
    }

    public boolean requestsAck() {
        return (flags & EngineMessage.FLAG_REQ_ACK) != 0;
    }

    @Override
    public byte kind() {
        return KIND_MESSAGE;
    }

    @Override
    public String toString() {
        return "MessageFrame[" + identity + "/" + serial + " flags=" + flags
                + " header=" + header.length + "B payload=" + payload.length + "B]";
    }
}
