package com.github.zzf.relay.protocol.codec;

import static com.github.zzf.relay.protocol.codec.FrameCodec.LENGTH_FIELD_LENGTH;

import com.github.zzf.relay.protocol.MalformedFrameException;
import com.github.zzf.relay.protocol.model.Message;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.ByteToMessageCodec;
import java.util.List;

/**
 * <pre>
 * per channel framing
 *
 * inbound:  bytes -> accumulate one whole outer frame -> {@link FrameCodec#decode(ByteBuf)} -> Message
 * outbound: Message -> {@link FrameCodec#encodeFrame(Message)};
 *           ByteBuf (a frame encoded once for a broadcast) passes through
 * </pre>
 */
public class RelayCodec extends ByteToMessageCodec<Message> {

    public static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private final int maxFrameLength;

    public RelayCodec() {
        this(DEFAULT_MAX_FRAME_LENGTH);
    }

    public RelayCodec(int maxFrameLength) {
        super(Message.class);
        if (maxFrameLength < FrameCodec.ENVELOPE_LENGTH) {
            throw new IllegalArgumentException("maxFrameLength too small: " + maxFrameLength);
        }
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    public void write(ChannelHandlerContext ctx,
            Object msg,
            ChannelPromise promise) {
        if (msg instanceof Message m) {
            // the owner of the buf transfers to netty, netty releases it after flush
            ctx.write(FrameCodec.encodeFrame(m), promise);
        }
        else {
            ctx.write(msg, promise);
        }
    }

    @Override
    protected void encode(ChannelHandlerContext ctx,
            Message msg,
            ByteBuf out) {
        // code should not go here.
        throw new UnsupportedOperationException();
    }

    @Override
    protected void decode(ChannelHandlerContext ctx,
            ByteBuf in,
            List<Object> out) {
        int frameLength = tryPickupFrame(in);
        if (frameLength == -1) {// not a whole frame yet
            return;
        }
        in.skipBytes(LENGTH_FIELD_LENGTH);
        ByteBuf frame = in.readSlice(frameLength);
        out.add(FrameCodec.decode(frame));
    }

    /**
     * @return length of the next inner frame if it is fully buffered, otherwise -1
     */
    int tryPickupFrame(ByteBuf in) {
        if (in.readableBytes() < LENGTH_FIELD_LENGTH) {
            return -1;
        }
        long frameLength = in.getUnsignedInt(in.readerIndex());
        if (frameLength > maxFrameLength) {
            // the stream can not be resynchronized after a bad length prefix
            in.skipBytes(in.readableBytes());
            throw new MalformedFrameException("frame length " + frameLength + " exceeds max " + maxFrameLength);
        }
        if (in.readableBytes() < LENGTH_FIELD_LENGTH + frameLength) {
            return -1;
        }
        return (int) frameLength;
    }

}
