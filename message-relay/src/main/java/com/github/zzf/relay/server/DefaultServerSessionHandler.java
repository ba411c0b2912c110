package com.github.zzf.relay.server;

import com.github.zzf.relay.protocol.MalformedFrameException;
import com.github.zzf.relay.protocol.model.Message;
import io.micrometer.core.instrument.Metrics;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <pre>
 * the read / dispatch loop of one connection
 *
 * RelayCodec -> this -> BroadcastDispatcher
 *
 * registers the channel when it becomes active, stamps every decoded message with the session id
 * and closes the session on EOF, I/O error or a malformed frame.
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultServerSessionHandler extends ChannelInboundHandlerAdapter {

    public static final String HANDLER_NAME = DefaultServerSessionHandler.class.getSimpleName();
    public static final String METRIC_MESSAGE_IN = "relay.message.in";

    private final SessionRegistry registry;
    private final BroadcastDispatcher dispatcher;

    private ServerSession session;

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        // added to a channel that is already active, channelActive will not come
        if (ctx.channel().isActive()) {
            registerSession(ctx);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        registerSession(ctx);
        super.channelActive(ctx);
    }

    private void registerSession(ChannelHandlerContext ctx) {
        if (session != null) {
            return;
        }
        try {
            session = registry.register(ctx.channel());
            log.info("Client({}) connected -> {}", session.id(), ctx.channel().remoteAddress());
        } catch (RegistryFullException e) {
            log.warn("Client rejected, now close channel -> {}: {}", ctx.channel(), e.getMessage());
            Metrics.counter(DefaultServerSession.METRIC_SESSION_CLOSED, "reason", CloseReason.REGISTRY_FULL.name())
                .increment();
            ctx.close();
        }
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof Message m)) {
            log.error("channelRead msg is not Message, now close the Session and channel");
            ReferenceCountUtil.release(msg);
            closeSession(ctx, CloseReason.MALFORMED_FRAME);
            return;
        }
        if (session == null || !session.isActive()) {
            log.debug("channelRead Message on a closed session, discard it -> {}", m);
            return;
        }
        // the id the client put on the wire is ignored
        Message stamped = m.withSenderId(session.id());
        Metrics.counter(METRIC_MESSAGE_IN, "kind", stamped.kind().name()).increment();
        log.debug("Client({}) receive Message -> {}", session.id(), stamped);
        dispatcher.broadcast(stamped, session.id());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        CloseReason reason = closeReason(cause);
        if (reason == CloseReason.MALFORMED_FRAME) {
            log.warn("Client({}) sent a malformed frame, now close the session: {}", sid(), rootMessage(cause));
        }
        else {
            log.error("Client({}) exceptionCaught, now close the session", sid(), cause);
        }
        closeSession(ctx, reason);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Client({}) channelInactive", sid());
        closeSession(ctx, CloseReason.PEER_CLOSED);
        super.channelInactive(ctx);
    }

    private void closeSession(ChannelHandlerContext ctx, CloseReason reason) {
        if (session == null) {
            ctx.close();
            return;
        }
        if (session.close(reason)) {
            log.info("Client({}) disconnected -> reason: {}", session.id(), reason);
        }
    }

    static CloseReason closeReason(Throwable cause) {
        Throwable c = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        return c instanceof MalformedFrameException ? CloseReason.MALFORMED_FRAME : CloseReason.IO_FAILURE;
    }

    private static String rootMessage(Throwable cause) {
        Throwable c = cause.getCause() != null ? cause.getCause() : cause;
        return c.getMessage();
    }

    private Integer sid() {
        return Optional.ofNullable(session).map(ServerSession::id).orElse(null);
    }

    ServerSession session() {
        return session;
    }

}
