package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.Identity;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import java.util.List;

/**
 * Cuts the inbound byte stream into {@link WireFrame}s.
 *
 * <p>Frames with an unknown kind, or whose header and payload together exceed the size limit, are
 * protocol violations: the decoder raises a {@link io.netty.handler.codec.DecoderException} and
 * discards everything that follows, leaving it to the connection handler to close the channel.
 */
public final class WireFrameDecoder extends ByteToMessageDecoder {

    private final int maxMessageSize;

    private boolean failed;

    /**
     * Creates a decoder.
     *
     * @param maxMessageSize largest accepted header plus payload, in bytes
     */
    public WireFrameDecoder(int maxMessageSize) {
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be positive: " + maxMessageSize);
        }
        this.maxMessageSize = maxMessageSize;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        if (!in.isReadable()) {
            return;
        }
        byte kind = in.getByte(in.readerIndex());
        switch (kind) {
            case WireFrame.KIND_HANDSHAKE -> decodeHandshake(in, out);
            case WireFrame.KIND_MESSAGE -> decodeMessage(in, out);
            default -> throw fail(new CorruptedFrameException("Unknown frame kind " + kind));
        }
    }

    private void decodeHandshake(ByteBuf in, List<Object> out) {
        if (in.readableBytes() < 1 + WireFrame.HANDSHAKE_SIZE) {
            return;
        }
        in.skipBytes(1);
        int port = in.readUnsignedShort();
        out.add(new HandshakeFrame(port, readIdentity(in)));
    }

    private void decodeMessage(ByteBuf in, List<Object> out) {
        if (in.readableBytes() < 1 + WireFrame.MESSAGE_PREAMBLE_SIZE) {
            return;
        }
        int start = in.readerIndex();
        int headerLength = in.getUnsignedShort(start + 1 + 16 + 4 + 1);
        long payloadLength = in.getUnsignedInt(start + 1 + 16 + 4 + 1 + 2);
        long bodyLength = headerLength + payloadLength;
        if (bodyLength > maxMessageSize) {
            throw fail(new TooLongFrameException(
                    "Message of " + bodyLength + " bytes exceeds limit " + maxMessageSize));
        }
        if (in.readableBytes() < 1 + WireFrame.MESSAGE_PREAMBLE_SIZE + bodyLength) {
            return;
        }
        in.skipBytes(1);
        Identity identity = readIdentity(in);
        long serial = in.readUnsignedInt();
        int flags = in.readUnsignedByte();
        in.skipBytes(2 + 4);
        byte[] header = new byte[headerLength];
        in.readBytes(header);
        byte[] payload = new byte[(int) payloadLength];
        in.readBytes(payload);
        out.add(new MessageFrame(identity, serial, flags, header, payload));
    }

    private static Identity readIdentity(ByteBuf in) {
        byte[] bytes = new byte[Identity.SIZE];
        in.readBytes(bytes);
        return Identity.of(bytes);
    }

    private RuntimeException fail(RuntimeException e) {
        failed = true;
        return e;
    }
}
