package com.github.zzf.relay.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import java.util.Arrays;
import java.util.Objects;

/**
 * <pre>
 * one relayed message: kind + senderId + opaque payload.
 *
 * instances are immutable. the payload is copied in and copied out,
 * {@link #withSenderId(int)} returns a new instance.
 * </pre>
 */
public final class Message {

    /**
     * senderId a client puts on the wire, the relay overwrites it on receipt
     */
    public static final int NO_SENDER = 0;
    public static final int MAX_SENDER_ID = 0xFF;

    private final MessageKind kind;
    private final int senderId;
    private final byte[] payload;

    private Message(MessageKind kind, int senderId, byte[] payload) {
        this.kind = checkNotNull(kind, "kind");
        checkArgument(senderId >= 0 && senderId <= MAX_SENDER_ID, "senderId out of range: %s", senderId);
        this.senderId = senderId;
        this.payload = payload;
    }

    public static Message of(MessageKind kind, int senderId, byte[] payload) {
        checkNotNull(payload, "payload");
        return new Message(kind, senderId, payload.clone());
    }

    /**
     * copy the readable bytes of the buf as payload, the readerIndex of the buf is not touched
     */
    public static Message of(MessageKind kind, int senderId, ByteBuf payload) {
        checkNotNull(payload, "payload");
        return new Message(kind, senderId, ByteBufUtil.getBytes(payload));
    }

    public static Message text(String text) {
        return of(MessageKind.TEXT, NO_SENDER, text.getBytes(UTF_8));
    }

    public static Message event(String data) {
        return event(data.getBytes(UTF_8));
    }

    public static Message event(byte[] data) {
        return of(MessageKind.EVENT, NO_SENDER, data);
    }

    public static Message snapshot(String data) {
        return snapshot(data.getBytes(UTF_8));
    }

    public static Message snapshot(byte[] data) {
        return of(MessageKind.SNAPSHOT, NO_SENDER, data);
    }

    /**
     * the same message attributed to another sender
     */
    public Message withSenderId(int senderId) {
        if (senderId == this.senderId) {
            return this;
        }
        // payload is never mutated, share it
        return new Message(kind, senderId, payload);
    }

    public MessageKind kind() {
        return kind;
    }

    public int senderId() {
        return senderId;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    /**
     * read-only view of the payload, no copy
     */
    public ByteBuf payloadBuf() {
        return Unpooled.wrappedBuffer(payload).asReadOnly();
    }

    public String payloadAsString() {
        return new String(payload, UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Message message = (Message) o;
        return senderId == message.senderId
            && kind == message.kind
            && Arrays.equals(payload, message.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(kind, senderId);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"kind\":\"").append(kind).append("\",");
        sb.append("\"senderId\":").append(senderId).append(",");
        sb.append("\"payloadLength\":").append(payload.length).append(",");
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
