package express.mvp.myra.messaging.engine.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

/** Last handler of every connection pipeline; forwards channel events to the engine. */
final class ConnectionHandler extends SimpleChannelInboundHandler<WireFrame> {

    private final NettyTransportEngine engine;

    private final Connection connection;

    ConnectionHandler(NettyTransportEngine engine, Connection connection) {
        super(WireFrame.class);
        this.engine = engine;
        this.connection = connection;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        connection.onActive();
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WireFrame frame) {
        if (frame instanceof HandshakeFrame handshake) {
            connection.onHandshake(handshake);
        } else {
            connection.onMessage((MessageFrame) frame);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        engine.connectionClosed(connection);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        engine.connectionFailed(connection, cause);
    }
}
