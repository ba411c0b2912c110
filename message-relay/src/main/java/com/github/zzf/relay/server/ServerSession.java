package com.github.zzf.relay.server;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

/**
 * server side state of one connected client
 */
public interface ServerSession {

    /**
     * identifier assigned by the registry, 1..255
     *
     * @return id
     */
    int id();

    /**
     * the channel that the session exclusively owns
     *
     * @return Channel
     */
    Channel channel();

    SessionState state();

    default boolean isActive() {
        return state() == SessionState.ACTIVE;
    }

    /**
     * write an already encoded frame to the peer.
     * <p>the session takes the ownership of the frame</p>
     *
     * @param frame outer frame
     * @return future completed when the frame was flushed or the write failed
     */
    ChannelFuture send(ByteBuf frame);

    /**
     * tear the session down: leave the registry and close the channel.
     * <p>only the first call has any effect</p>
     *
     * @param reason why
     * @return true if this call performed the teardown
     */
    boolean close(CloseReason reason);

}
