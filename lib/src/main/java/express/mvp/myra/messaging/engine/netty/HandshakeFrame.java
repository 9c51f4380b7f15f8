package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.Identity;
import java.util.Objects;

/**
 * First frame each side sends on a new connection.
 *
 * @param port the sender's public listen port, used to route replies back to it
 * @param identity the sender's node identity
 */
public record HandshakeFrame(int port, Identity identity) implements WireFrame {

    public HandshakeFrame {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port must be 0..65535, got " + port);
        }
        Objects.requireNonNull(identity, "identity must not be null");
    }

    @Override
    public byte kind() {
        return KIND_HANDSHAKE;
    }
}
