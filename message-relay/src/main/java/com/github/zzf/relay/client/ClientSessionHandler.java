package com.github.zzf.relay.client;

import com.github.zzf.relay.protocol.model.Message;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * route inbound messages by kind
 */
@Slf4j
@RequiredArgsConstructor
public class ClientSessionHandler extends ChannelInboundHandlerAdapter {

    public static final String HANDLER_NAME = ClientSessionHandler.class.getSimpleName();

    private final MessageHandler handler;

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof Message m)) {
            super.channelRead(ctx, msg);
            return;
        }
        log.debug("Client receive Message -> {}", m);
        switch (m.kind()) {
            case TEXT:
                handler.onText(m);
                break;
            case EVENT:
                handler.onEvent(m);
                break;
            case SNAPSHOT:
                handler.onSnapshot(m);
                break;
            default:
                throw new IllegalStateException("unexpected kind: " + m.kind());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Client exceptionCaught, now close the channel -> {}", ctx.channel(), cause);
        ctx.close();
    }

}
