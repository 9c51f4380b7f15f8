package express.mvp.myra.messaging.engine.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/** Writes {@link WireFrame}s in the wire layout described there. */
public final class WireFrameEncoder extends MessageToByteEncoder<WireFrame> {

    public WireFrameEncoder() {
        super(WireFrame.class);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, WireFrame frame, ByteBuf out) {
        out.writeByte(frame.kind());
        if (frame instanceof HandshakeFrame handshake) {
            out.writeShort(handshake.port());
            out.writeBytes(handshake.identity().toBytes());
        } else if (frame instanceof MessageFrame message) {
            out.ensureWritable(WireFrame.MESSAGE_PREAMBLE_SIZE
                    + message.header().length + message.payload().length);
            out.writeBytes(message.identity().toBytes());
            out.writeInt((int) message.serial());
            out.writeByte(message.flags());
            out.writeShort(message.header().length);
            out.writeInt(message.payload().length);
            out.writeBytes(message.header());
            out.writeBytes(message.payload());
        } else {
            throw new IllegalArgumentException("Unknown frame " + frame);
        }
    }
}
