package com.github.zzf.relay.client;

import static com.google.common.base.Preconditions.checkNotNull;

import com.github.zzf.relay.protocol.ConnectFailureException;
import com.github.zzf.relay.protocol.codec.RelayCodec;
import com.github.zzf.relay.protocol.model.Message;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import lombok.extern.slf4j.Slf4j;

/**
 * one connection to the relay
 */
@Slf4j
public class DefaultRelayClient implements RelayClient {

    private final InetSocketAddress remoteAddress;
    private final MessageHandler handler;
    private final EventLoopGroup eventLoopGroup;
    private final boolean exclusiveEventLoop;
    private final int maxFrameLength;
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    private volatile Channel channel;

    public DefaultRelayClient(String host, int port, MessageHandler handler) {
        this(host, port, handler, null);
    }

    /**
     * @param eventLoopGroup group to use, null to create an exclusive one released by {@link #close()}
     */
    public DefaultRelayClient(String host, int port, MessageHandler handler, EventLoopGroup eventLoopGroup) {
        this(host, port, handler, eventLoopGroup, RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    public DefaultRelayClient(String host, int port, MessageHandler handler,
            EventLoopGroup eventLoopGroup, int maxFrameLength) {
        this.remoteAddress = InetSocketAddress.createUnresolved(checkNotNull(host, "host"), port);
        this.handler = checkNotNull(handler, "handler");
        this.maxFrameLength = maxFrameLength;
        if (eventLoopGroup == null) {
            this.eventLoopGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("relay-client"));
            this.exclusiveEventLoop = true;
        }
        else {
            this.eventLoopGroup = eventLoopGroup;
            this.exclusiveEventLoop = false;
        }
    }

    @Override
    public synchronized void connect() {
        if (channel != null) {
            throw new IllegalStateException("Client already connected");
        }
        InetSocketAddress address = new InetSocketAddress(remoteAddress.getHostString(), remoteAddress.getPort());
        ChannelFuture future = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NioSocketChannel.class)
            .handler(new ChannelInitializer<NioSocketChannel>() {
                @Override
                protected void initChannel(NioSocketChannel ch) {
                    ch.pipeline()
                        .addLast(new RelayCodec(maxFrameLength))
                        .addLast(ClientSessionHandler.HANDLER_NAME, new ClientSessionHandler(handler))
                    ;
                }
            })
            .connect(address)
            .addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
        try {
            future.sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectFailureException("Connect to relay interrupted: " + address, e);
        } catch (Exception e) {
            throw new ConnectFailureException("Cannot connect to relay: " + address, e);
        }
        this.channel = future.channel();
        this.channel.closeFuture().addListener(f -> {
            log.info("Client channel was closed -> {}", address);
            handler.clientClosed();
            closeFuture.complete(null);
        });
        log.info("Client connected to relay -> {}", address);
    }

    @Override
    public CompletionStage<Void> send(Message message) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Channel ch = this.channel;
        if (ch == null || !ch.isActive()) {
            log.info("Client send failed, not connected -> {}", message);
            future.completeExceptionally(new IllegalStateException("Client is not connected."));
            return future;
        }
        ch.writeAndFlush(message.withSenderId(Message.NO_SENDER)).addListener((ChannelFuture cf) -> {
            if (cf.isSuccess()) {
                future.complete(null);
            }
            else {
                future.completeExceptionally(cf.cause());
            }
        });
        return future;
    }

    @Override
    public boolean isConnected() {
        Channel ch = this.channel;
        return ch != null && ch.isActive();
    }

    @Override
    public void disconnect() {
        Channel ch = this.channel;
        if (ch == null) {
            return;
        }
        ch.close().syncUninterruptibly();
    }

    @Override
    public CompletionStage<Void> closeFuture() {
        return closeFuture;
    }

    @Override
    public void close() {
        disconnect();
        if (exclusiveEventLoop) {
            eventLoopGroup.shutdownGracefully();
        }
    }

}
