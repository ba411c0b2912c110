package com.github.zzf.relay.protocol.model;

/**
 * the closed set of message kinds carried by the relay
 */
public enum MessageKind {

    TEXT(0),
    EVENT(1),
    SNAPSHOT(2),
    ;

    private final int tag;

    MessageKind(int tag) {
        this.tag = tag;
    }

    /**
     * the tag byte on the wire
     */
    public int tag() {
        return tag;
    }

    /**
     * @param tag the unsigned kind byte read from a frame
     * @return the kind, or null if the tag is unknown
     */
    public static MessageKind fromTag(int tag) {
        switch (tag) {
            case 0:
                return TEXT;
            case 1:
                return EVENT;
            case 2:
                return SNAPSHOT;
            default:
                return null;
        }
    }

}
