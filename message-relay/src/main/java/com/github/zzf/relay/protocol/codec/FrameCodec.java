package com.github.zzf.relay.protocol.codec;

import com.github.zzf.relay.protocol.MalformedFrameException;
import com.github.zzf.relay.protocol.model.Message;
import com.github.zzf.relay.protocol.model.MessageKind;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * <pre>
 * wire layout
 *
 * outer frame:  u32 totalLength | totalLength bytes
 * inner frame:  u8 kind | u8 senderId | u32 bodyLength | body
 *
 * all integers are big-endian. totalLength does not count itself.
 * </pre>
 */
public final class FrameCodec {

    public static final int LENGTH_FIELD_LENGTH = 4;
    /**
     * kind + senderId + bodyLength
     */
    public static final int ENVELOPE_LENGTH = 6;

    private FrameCodec() {
    }

    /**
     * encode the inner frame (envelope + body)
     */
    public static ByteBuf encode(Message message) {
        ByteBuf buf = Unpooled.buffer(ENVELOPE_LENGTH + message.payloadLength());
        writeInnerFrame(message, buf);
        return buf;
    }

    /**
     * encode the outer frame, ready to be written to the wire
     */
    public static ByteBuf encodeFrame(Message message) {
        int innerLength = ENVELOPE_LENGTH + message.payloadLength();
        ByteBuf buf = Unpooled.buffer(LENGTH_FIELD_LENGTH + innerLength);
        buf.writeInt(innerLength);
        writeInnerFrame(message, buf);
        return buf;
    }

    private static void writeInnerFrame(Message message, ByteBuf out) {
        out.writeByte(message.kind().tag());
        out.writeByte(message.senderId());
        out.writeInt(message.payloadLength());
        out.writeBytes(message.payloadBuf());
    }

    /**
     * decode one complete inner frame. bytes after the declared body are left unread.
     *
     * @param in a buffer that holds exactly one already delimited frame
     * @return the decoded message
     * @throws MalformedFrameException if the frame is too short, the kind is unknown or the
     *                                 declared body length exceeds the buffer
     */
    public static Message decode(ByteBuf in) {
        if (in.readableBytes() < ENVELOPE_LENGTH) {
            throw new MalformedFrameException("frame too short: " + in.readableBytes() + " bytes");
        }
        int tag = in.getUnsignedByte(in.readerIndex());
        MessageKind kind = MessageKind.fromTag(tag);
        if (kind == null) {
            throw new MalformedFrameException("unknown message kind: " + tag);
        }
        int senderId = in.getUnsignedByte(in.readerIndex() + 1);
        long bodyLength = in.getUnsignedInt(in.readerIndex() + 2);
        if (bodyLength > in.readableBytes() - ENVELOPE_LENGTH) {
            throw new MalformedFrameException("body length " + bodyLength + " exceeds frame, only "
                + (in.readableBytes() - ENVELOPE_LENGTH) + " bytes left");
        }
        // validated, now consume
        in.skipBytes(ENVELOPE_LENGTH);
        ByteBuf body = in.readSlice((int) bodyLength);
        return Message.of(kind, senderId, body);
    }

}
