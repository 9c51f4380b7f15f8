package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.EventLoop;
import express.mvp.myra.messaging.Identity;
import express.mvp.myra.messaging.MessagingRuntime;
import express.mvp.myra.messaging.SessionConfig;
import express.mvp.myra.messaging.engine.DoneCallback;
import express.mvp.myra.messaging.engine.EngineMessage;
import express.mvp.myra.messaging.engine.LogSink;
import express.mvp.myra.messaging.engine.ReceiveCallback;
import express.mvp.myra.messaging.engine.ReleaseCallback;
import express.mvp.myra.messaging.engine.SendCallback;
import express.mvp.myra.messaging.engine.SlotHandle;
import express.mvp.myra.messaging.engine.TransportEngine;
import express.mvp.myra.messaging.error.EngineStatus;
import express.mvp.myra.messaging.error.ErrorClassifier;
import express.mvp.myra.messaging.util.Addresses;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFactory;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import java.io.File;
import java.io.IOException;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.spi.SelectorProvider;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.net.ssl.SSLException;

/**
 * Transport engine on Netty NIO channels, driven by the {@link EventLoop}'s I/O thread.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │                    NettyTransportEngine                      │
 * ├──────────────────────────────────────────────────────────────┤
 * │  listeners (IPv4, optional IPv6)                             │
 * │      │ accept                                                │
 * │      ▼                                                       │
 * │  Connection ◀──── routes: (address, public port) ──── send() │
 * │      │                                                       │
 * │      ▼ pipeline                                              │
 * │  [SslHandler] → WireFrameDecoder → WireFrameEncoder          │
 * │                → ConnectionHandler                           │
 * └──────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Connections are created on the first send to a remote and shared by both directions: an
 * accepted connection becomes the route to its peer once the peer's handshake names its public
 * port. Idle connections are closed by a periodic sweep.
 *
 * <p>Listeners are bound synchronously during {@link #init} so that an occupied port is reported
 * as {@link EngineStatus#ADDRESS_IN_USE} right away.
 *
 * <p>Every method must be called on the I/O thread.
 */
public final class NettyTransportEngine implements TransportEngine {

    private static final Logger LOGGER = Logger.getLogger(NettyTransportEngine.class.getName());

    private SessionConfig config;

    private io.netty.channel.EventLoop io;

    private ReceiveCallback onReceive;

    private DoneCallback onDone;

    private LogSink log;

    private SslContext serverTls;

    private SslContext clientTls;

    private final List<Channel> listeners = new ArrayList<>();

    private final Map<RemoteKey, Connection> routes = new HashMap<>();

    private final Set<Connection> connections = new LinkedHashSet<>();

    private ScheduledFuture<?> sweeper;

    private volatile Identity identity = Identity.ZERO;

    private volatile int port;

    private boolean initialized;

    private boolean closing;

    private int openChannels;

    private boolean doneSignalled;

    @Override
    public EngineStatus init(
            SessionConfig config,
            EventLoop loop,
            ReceiveCallback onReceive,
            DoneCallback onDone,
            LogSink log) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(loop, "loop must not be null");
        if (this.config != null) {
            log.log("Engine is already initialized", true);
            loop.io().execute(onDone::onDone);
            return EngineStatus.USED;
        }
        this.config = config;
        this.io = loop.io();
        this.onReceive = Objects.requireNonNull(onReceive, "onReceive must not be null");
        this.onDone = Objects.requireNonNull(onDone, "onDone must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");

        EngineStatus status = configureTls();
        if (!status.isSuccess()) {
            return fail(status);
        }
        identity = config.identity().isZero() ? Identity.random() : config.identity();

        try {
            port = listen(new InetSocketAddress(Addresses.parse(config.bindV4()), config.port()));
            if (config.bindV6() != null) {
                listen(new InetSocketAddress(Addresses.parse(config.bindV6()), port));
            }
        } catch (BindException e) {
            error("Cannot bind port " + config.port() + ": " + e.getMessage());
            return fail(EngineStatus.ADDRESS_IN_USE);
        } catch (IOException e) {
            error("Cannot listen: " + ErrorClassifier.summarize(e));
            return fail(EngineStatus.IO_ERROR);
        }

        long period = Math.max(
                TimeUnit.SECONDS.toNanos(1), config.effectiveReuseTime().toNanos() / 2);
        sweeper = io.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.NANOSECONDS);
        initialized = true;
        log.log("Listening on port " + port + " as node " + identity
                + (config.disableEncryption() ? " (encryption disabled)" : ""), false);
        return EngineStatus.SUCCESS;
    }

    private EngineStatus configureTls() {
        if (config.dhParamsPem() != null && !Files.isReadable(Path.of(config.dhParamsPem()))) {
            error("Cannot read DH parameters " + config.dhParamsPem());
            return EngineStatus.VALUE_ERROR;
        }
        if (config.disableEncryption()) {
            return EngineStatus.SUCCESS;
        }
        String certChain = config.certChainPem();
        if (certChain == null) {
            error("A certificate chain is required unless encryption is disabled");
            return EngineStatus.VALUE_ERROR;
        }
        if (!Files.isReadable(Path.of(certChain))) {
            error("Cannot read certificate chain " + certChain);
            return EngineStatus.VALUE_ERROR;
        }
        if (!MessagingRuntime.isTlsAvailable()) {
            error("No TLS provider available");
            return EngineStatus.TLS_ERROR;
        }
        try {
            serverTls = TlsContexts.server(new File(certChain));
            clientTls = TlsContexts.client(new File(certChain));
        } catch (SSLException | IllegalArgumentException e) {
            error("Invalid certificate chain " + certChain + ": " + e.getMessage());
            return EngineStatus.TLS_ERROR;
        }
        return EngineStatus.SUCCESS;
    }

    /** Binds a listener and returns its port. */
    private int listen(InetSocketAddress address) throws IOException {
        ServerSocketChannel socket = SelectorProvider.provider().openServerSocketChannel();
        try {
            socket.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            socket.bind(address, config.backlog());
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        int boundPort = ((InetSocketAddress) socket.getLocalAddress()).getPort();

        NioServerSocketChannel channel = new NioServerSocketChannel(socket);
        int bufferSize = config.effectiveBufferSize();
        ChannelFuture registration = new ServerBootstrap()
                .group(io)
                .channelFactory((ChannelFactory<NioServerSocketChannel>) () -> channel)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, bufferSize)
                .childOption(ChannelOption.SO_SNDBUF, bufferSize)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        accepted(ch);
                    }
                })
                .register();
        if (registration.cause() != null) {
            channel.close();
            throw new IOException("Cannot register listener on " + address, registration.cause());
        }
        listeners.add(channel);
        LOGGER.fine(() -> "Listening on " + address.getAddress() + ":" + boundPort);
        return boundPort;
    }

    // ─── TransportEngine ────────────────────────────────────────────────────────

    @Override
    public EngineStatus send(EngineMessage message, SendCallback callback) {
        if (!initialized) {
            return EngineStatus.NOT_INITIALIZED;
        }
        if (closing) {
            return EngineStatus.SHUTDOWN;
        }
        if (message.isSending()) {
            return EngineStatus.USED;
        }
        long size = (long) message.header().length + message.payload().length;
        if (message.header().length > WireFrame.MAX_HEADER_SIZE || size > config.maxMessageSize()) {
            error("Message of " + size + " bytes exceeds the size limit");
            return EngineStatus.VALUE_ERROR;
        }

        InetAddress address = message.address();
        RemoteKey key = RemoteKey.of(address, message.port());
        Connection connection = routes.get(key);
        if (connection == null || connection.isClosed()) {
            connection = connect(key, address);
        }

        PendingSend send = new PendingSend(message, callback);
        message.sending(true);
        Connection target = connection;
        send.timer = io.schedule(
                () -> sendTimedOut(target, send),
                config.timeout().toNanos(),
                TimeUnit.NANOSECONDS);
        connection.enqueue(send);
        return EngineStatus.SUCCESS;
    }

    @Override
    public void releaseSlot(EngineMessage message, ReleaseCallback callback) {
        SlotHandle handle = message.slot();
        if (handle == null) {
            LOGGER.warning("Release of a message without slot: " + message);
            return;
        }
        if (!(handle instanceof Slot slot)) {
            throw new IllegalArgumentException("Slot was not issued by this engine: " + handle);
        }
        message.slot(null);
        if (!slot.markReleased()) {
            return;
        }
        Connection connection = slot.connection();
        connection.free(slot);
        callback.onReleased(slot);
        connection.drainBacklog();
    }

    @Override
    public void close() {
        if (onDone == null || closing) {
            return;
        }
        closing = true;
        initialized = false;
        if (sweeper != null) {
            sweeper.cancel(false);
            sweeper = null;
        }
        List<Channel> channels = new ArrayList<>(listeners);
        for (Connection connection : new ArrayList<>(connections)) {
            if (connection.channel() != null) {
                channels.add(connection.channel());
            }
            connection.close(EngineStatus.SHUTDOWN);
        }
        for (Channel listener : listeners) {
            listener.close();
        }
        listeners.clear();

        openChannels = channels.size();
        if (openChannels == 0) {
            io.execute(this::signalDone);
            return;
        }
        for (Channel channel : channels) {
            channel.closeFuture().addListener(future -> {
                if (--openChannels == 0) {
                    signalDone();
                }
            });
        }
    }

    @Override
    public Identity identity() {
        return identity;
    }

    @Override
    public int port() {
        return port;
    }

    // ─── Connections ────────────────────────────────────────────────────────────

    SessionConfig config() {
        return config;
    }

    private Connection connect(RemoteKey key, InetAddress address) {
        Connection connection = new Connection(this, true, key, address);
        routes.put(key, connection);
        connections.add(connection);
        int bufferSize = config.effectiveBufferSize();
        boolean encrypt = useTls(address);
        new Bootstrap()
                .group(io)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_RCVBUF, bufferSize)
                .option(ChannelOption.SO_SNDBUF, bufferSize)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        SslHandler tls = encrypt
                                ? clientTls.newHandler(ch.alloc(), key.address(), key.port())
                                : null;
                        configure(ch, connection, tls);
                    }
                })
                .connect(new InetSocketAddress(address, key.port()))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        connectionFailed(connection, future.cause());
                    }
                });
        LOGGER.fine(() -> "Connecting to " + key);
        return connection;
    }

    private void accepted(SocketChannel ch) {
        if (closing) {
            ch.close();
            return;
        }
        Connection connection = new Connection(this, false, null, null);
        connections.add(connection);
        SslHandler tls = useTls(ch.remoteAddress().getAddress())
                ? serverTls.newHandler(ch.alloc())
                : null;
        configure(ch, connection, tls);
        LOGGER.fine(() -> "Accepted connection from " + ch.remoteAddress());
    }

    private void configure(SocketChannel ch, Connection connection, SslHandler tls) {
        ChannelPipeline pipeline = ch.pipeline();
        if (tls != null) {
            pipeline.addLast("tls", tls);
        }
        pipeline.addLast("decoder", new WireFrameDecoder(config.maxMessageSize()));
        pipeline.addLast("encoder", new WireFrameEncoder());
        pipeline.addLast("connection", new ConnectionHandler(this, connection));
        connection.attach(ch);
    }

    private boolean useTls(InetAddress remote) {
        return clientTls != null && !Addresses.isLoopback(remote);
    }

    /** Registers an accepted connection as route to its peer unless one exists. */
    void established(Connection connection) {
        Connection existing = routes.get(connection.key());
        if (existing == null || existing.isClosed()) {
            routes.put(connection.key(), connection);
        }
        LOGGER.fine(() -> "Established " + connection);
    }

    void deliver(EngineMessage message) {
        try {
            onReceive.onReceive(message);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Receive callback failed for " + message, e);
        }
    }

    void forget(Connection connection) {
        connections.remove(connection);
        if (connection.key() != null) {
            routes.remove(connection.key(), connection);
        }
    }

    void connectionFailed(Connection connection, Throwable cause) {
        if (connection.isClosed()) {
            return;
        }
        EngineStatus status = closing ? EngineStatus.SHUTDOWN : ErrorClassifier.toStatus(cause);
        error(connection + " failed: " + ErrorClassifier.summarize(cause));
        connection.close(status);
    }

    void connectionClosed(Connection connection) {
        if (connection.isClosed()) {
            return;
        }
        EngineStatus status;
        if (closing) {
            status = EngineStatus.SHUTDOWN;
        } else if (connection.isEstablished()) {
            status = EngineStatus.WRITE_ERROR;
        } else {
            status = EngineStatus.CANNOT_CONNECT;
        }
        if (connection.hasPendingSends()) {
            error(connection + " closed by remote");
        } else {
            LOGGER.fine(() -> connection + " closed by remote");
        }
        connection.close(status);
    }

    void protocolError(Connection connection, String message) {
        error(message);
        connection.close(EngineStatus.PROTOCOL_ERROR);
    }

    private void sendTimedOut(Connection connection, PendingSend send) {
        if (send.isCompleted()) {
            return;
        }
        error("Send of " + send.message + " via " + connection + " timed out");
        send.complete(EngineStatus.TIMEOUT);
        connection.close(EngineStatus.TIMEOUT);
    }

    /** Closes connections that have been idle for the reuse time. */
    private void sweep() {
        long now = System.nanoTime();
        long reuse = config.effectiveReuseTime().toNanos();
        for (Connection connection : new ArrayList<>(connections)) {
            if (connection.isIdle(now, reuse)) {
                LOGGER.fine(() -> "Closing idle " + connection);
                connection.close(EngineStatus.SHUTDOWN);
            }
        }
    }

    // ─── Failure and teardown ───────────────────────────────────────────────────

    /** Tears down whatever init set up and reports done asynchronously. */
    private EngineStatus fail(EngineStatus status) {
        close();
        return status;
    }

    private void signalDone() {
        if (doneSignalled) {
            return;
        }
        doneSignalled = true;
        LOGGER.fine("Engine closed");
        onDone.onDone();
    }

    private void error(String message) {
        log.log(message, true);
    }

    @Override
    public String toString() {
        return "NettyTransportEngine[" + identity + " port=" + port
                + " connections=" + connections.size() + "]";
    }
}
