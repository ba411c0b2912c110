package com.github.zzf.relay.protocol;

/**
 * a frame violates the wire format. fatal to the connection that sent it.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

}
