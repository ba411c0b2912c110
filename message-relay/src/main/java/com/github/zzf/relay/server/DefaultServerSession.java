package com.github.zzf.relay.server;

import static com.github.zzf.relay.server.SessionState.ACTIVE;
import static com.github.zzf.relay.server.SessionState.CLOSED;
import static com.github.zzf.relay.server.SessionState.CLOSING;
import static com.google.common.base.Preconditions.checkNotNull;

import io.micrometer.core.instrument.Metrics;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.util.ReferenceCountUtil;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DefaultServerSession implements ServerSession {

    public static final String METRIC_SESSION_CLOSED = "relay.session.closed";

    private final int id;
    private final Channel channel;
    private final SessionRegistry registry;
    private final AtomicReference<SessionState> state = new AtomicReference<>(ACTIVE);

    DefaultServerSession(int id, Channel channel, SessionRegistry registry) {
        this.id = id;
        this.channel = checkNotNull(channel, "channel");
        this.registry = checkNotNull(registry, "registry");
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public Channel channel() {
        return channel;
    }

    @Override
    public SessionState state() {
        return state.get();
    }

    @Override
    public ChannelFuture send(ByteBuf frame) {
        if (!isActive()) {
            ReferenceCountUtil.release(frame);
            log.debug("Session({}) send frame -> DISCARDED, session is {}", id, state());
            return channel.newFailedFuture(new IllegalStateException("Session(" + id + ") is not active"));
        }
        // netty serializes writes to one channel on its event loop
        return channel.writeAndFlush(frame);
    }

    @Override
    public boolean close(CloseReason reason) {
        if (!state.compareAndSet(ACTIVE, CLOSING)) {
            return false;
        }
        log.info("Session({}) closing -> reason: {}, channel: {}", id, reason, channel);
        registry.remove(this);
        channel.close();
        state.set(CLOSED);
        Metrics.counter(METRIC_SESSION_CLOSED, "reason", reason.name()).increment();
        return true;
    }

    @Override
    public String toString() {
        return "{\"id\":" + id + ",\"state\":\"" + state() + "\"}";
    }

}
