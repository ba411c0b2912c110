package com.github.zzf.relay.server;

import com.github.zzf.relay.protocol.codec.FrameCodec;
import com.github.zzf.relay.protocol.model.Message;
import io.micrometer.core.instrument.Metrics;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * fan a message out to every active session but its originator
 */
@Slf4j
@RequiredArgsConstructor
public class BroadcastDispatcher {

    public static final String METRIC_MESSAGE_OUT = "relay.message.out";

    private final SessionRegistry registry;

    /**
     * encode once, then write the same frame to every peer.
     * <p>a failed write closes that peer and does not stop the others</p>
     *
     * @param message   message already attributed to its sender
     * @param excludeId the originator, {@link SessionRegistry#NO_EXCLUSION} to send to everyone
     * @return number of peers the frame was handed to
     */
    public int broadcast(Message message, int excludeId) {
        List<ServerSession> peers = registry.lookupAllExcept(excludeId);
        if (peers.isEmpty()) {
            log.debug("Message from Session({}) has no peer -> {}", excludeId, message);
            return 0;
        }
        ByteBuf frame = FrameCodec.encodeFrame(message);
        int times = 0;
        try {
            for (ServerSession peer : peers) {
                // shadow copy, every peer owns one reference of the frame
                ChannelFuture future = peer.send(frame.retainedDuplicate())
                    .addListener(writeFailureListener(peer));
                if (future.isDone() && !future.isSuccess()) {
                    continue;
                }
                times += 1;
            }
        } finally {
            frame.release();
        }
        if (log.isDebugEnabled()) {
            log.debug("Message from Session({}) broadcast -> peers: {}, delivered: {}, message: {}",
                excludeId, peers.size(), times, message);
        }
        Metrics.counter(METRIC_MESSAGE_OUT, "kind", message.kind().name()).increment(times);
        return times;
    }

    private static ChannelFutureListener writeFailureListener(ServerSession peer) {
        return future -> {
            if (future.isSuccess()) {
                return;
            }
            if (!peer.isActive()) {
                // closed after the snapshot was taken
                log.debug("Session({}) closed before broadcast write -> {}", peer.id(), peer.state());
                return;
            }
            log.warn("Session({}) broadcast write failed, now close it", peer.id(), future.cause());
            peer.close(CloseReason.WRITE_FAILURE);
        };
    }

}
