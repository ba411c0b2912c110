package com.github.zzf.relay.server;

import com.github.zzf.relay.protocol.ConnectFailureException;
import com.github.zzf.relay.protocol.codec.RelayCodec;
import io.micrometer.core.instrument.Metrics;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import java.net.InetSocketAddress;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * <pre>
 * the listener / acceptor
 *
 * boss group (1 thread) accepts, the worker group runs the sessions.
 * every accepted channel gets: [ReadTimeoutHandler] -> RelayCodec -> DefaultServerSessionHandler
 * </pre>
 */
@Slf4j
public class RelayServer {

    public static final int DEFAULT_PORT = 54000;
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final String READ_IDLE_TIMEOUT_HANDLER = "readIdleTimeoutHandler";
    public static final String METRIC_SESSION_ACTIVE = "relay.session.active";

    private final String host;
    private final int port;
    private final int workerThreadNum;
    private final int maxFrameLength;
    private final int readIdleTimeoutSecond;

    private final SessionRegistry registry = new SessionRegistry();
    private final BroadcastDispatcher dispatcher = new BroadcastDispatcher(registry);

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    @Builder
    private RelayServer(String host,
            Integer port,
            Integer workerThreadNum,
            Integer maxFrameLength,
            int readIdleTimeoutSecond) {
        this.host = host == null ? DEFAULT_HOST : host;
        this.port = port == null ? DEFAULT_PORT : port;
        this.workerThreadNum = workerThreadNum == null ? Runtime.getRuntime().availableProcessors() * 2 : workerThreadNum;
        this.maxFrameLength = maxFrameLength == null ? RelayCodec.DEFAULT_MAX_FRAME_LENGTH : maxFrameLength;
        this.readIdleTimeoutSecond = readIdleTimeoutSecond;
    }

    /**
     * bind and start accepting
     *
     * @return this
     * @throws ConnectFailureException if the endpoint can not be bound
     */
    public synchronized RelayServer start() {
        if (serverChannel != null) {
            throw new IllegalStateException("RelayServer already started");
        }
        InetSocketAddress address = new InetSocketAddress(host, port);
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("relay-boss", false, Thread.MAX_PRIORITY));
        workerGroup = new NioEventLoopGroup(workerThreadNum, new DefaultThreadFactory("relay-worker"));
        try {
            serverChannel = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (readIdleTimeoutSecond > 0) {
                            ch.pipeline().addLast(READ_IDLE_TIMEOUT_HANDLER, new ReadTimeoutHandler(readIdleTimeoutSecond));
                        }
                        ch.pipeline()
                            .addLast(new RelayCodec(maxFrameLength))
                            .addLast(DefaultServerSessionHandler.HANDLER_NAME,
                                new DefaultServerSessionHandler(registry, dispatcher))
                        ;
                    }
                })
                .bind(address).sync()
                .channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownEventLoops();
            throw new ConnectFailureException("Relay server bind interrupted: " + address, e);
        } catch (Exception e) {
            shutdownEventLoops();
            throw new ConnectFailureException("Relay server bind failed: " + address, e);
        }
        log.info("Relay server listened at {}", serverChannel.localAddress());
        Metrics.gauge(METRIC_SESSION_ACTIVE, registry, SessionRegistry::size);
        // stop signal: no new sessions, the active ones keep running
        serverChannel.closeFuture().addListener(f -> {
            log.info("Relay server stopped accepting -> {}", address);
            bossGroup.shutdownGracefully();
        });
        return this;
    }

    /**
     * stop admitting new sessions. active sessions are not touched.
     */
    public void closeListenedPort() {
        Channel channel = serverChannel;
        if (channel == null) {
            return;
        }
        log.info("Shutdown listened port... -> {}", channel.localAddress());
        channel.close().syncUninterruptibly();
    }

    /**
     * stop admitting, close every active session and release the event loops
     */
    public void shutdown() {
        closeListenedPort();
        int closed = registry.closeAll(CloseReason.SERVER_SHUTDOWN);
        log.info("Relay server closed {} active sessions", closed);
        shutdownEventLoops();
    }

    private void shutdownEventLoops() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
    }

    /**
     * completes when the worker event loops terminated, after {@link #shutdown()}
     */
    public Future<?> terminationFuture() {
        if (workerGroup == null) {
            throw new IllegalStateException("RelayServer not started");
        }
        return workerGroup.terminationFuture();
    }

    public InetSocketAddress localAddress() {
        Channel channel = serverChannel;
        return channel == null ? null : (InetSocketAddress) channel.localAddress();
    }

    public boolean isAccepting() {
        Channel channel = serverChannel;
        return channel != null && channel.isActive();
    }

    public SessionRegistry registry() {
        return registry;
    }

    public BroadcastDispatcher dispatcher() {
        return dispatcher;
    }

}
