package com.github.zzf.relay.server;

import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;

import com.github.zzf.relay.protocol.codec.FrameCodec;
import com.github.zzf.relay.protocol.model.Message;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.BDDMockito;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultServerSessionTest {

    @Mock
    Channel channel;

    @Test
    void givenActiveSession_whenCloseTwice_thenChannelClosedOnceAndRemovedOnce() {
        SessionRegistry registry = spy(new SessionRegistry());
        ServerSession session = registry.register(channel);
        // when
        boolean first = session.close(CloseReason.PEER_CLOSED);
        boolean second = session.close(CloseReason.IO_FAILURE);
        // then
        then(first).isTrue();
        then(second).isFalse();
        then(session.state()).isEqualTo(SessionState.CLOSED);
        then(registry.get(session.id())).isNull();
        BDDMockito.then(channel).should(times(1)).close();
        BDDMockito.then(registry).should(times(1)).remove(session);
    }

    @Test
    void givenNewSession_whenRegistered_thenActive() {
        ServerSession session = new SessionRegistry().register(channel);
        then(session.state()).isEqualTo(SessionState.ACTIVE);
        then(session.isActive()).isTrue();
        then(session.channel()).isSameAs(channel);
    }

    @Test
    void givenClosedSession_whenSend_thenFailedAndFrameReleased() {
        EmbeddedChannel c = new EmbeddedChannel();
        ServerSession session = new SessionRegistry().register(c);
        session.close(CloseReason.PEER_CLOSED);
        ByteBuf frame = FrameCodec.encodeFrame(Message.text("late"));
        // when
        ChannelFuture future = session.send(frame);
        // then
        then(future.isDone()).isTrue();
        then(future.isSuccess()).isFalse();
        then(future.cause()).isInstanceOf(IllegalStateException.class);
        then(frame.refCnt()).isZero();
    }

    @Test
    void givenActiveSession_whenSend_thenFrameFlushedToChannel() {
        EmbeddedChannel c = new EmbeddedChannel();
        ServerSession session = new SessionRegistry().register(c);
        ByteBuf frame = FrameCodec.encodeFrame(Message.text("now"));
        then(session.send(frame).isSuccess()).isTrue();
        then(c.<ByteBuf>readOutbound()).isSameAs(frame);
    }

}
