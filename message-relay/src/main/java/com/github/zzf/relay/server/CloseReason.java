package com.github.zzf.relay.server;

/**
 * why a session left the relay
 */
public enum CloseReason {

    /**
     * orderly EOF from the peer
     */
    PEER_CLOSED,
    /**
     * reset, broken pipe, read timeout or a frame cut short
     */
    IO_FAILURE,
    MALFORMED_FRAME,
    /**
     * a broadcast write to this peer failed
     */
    WRITE_FAILURE,
    SERVER_SHUTDOWN,
    /**
     * the registry had no free id for the connection
     */
    REGISTRY_FULL,
    /**
     * removed from the registry by id
     */
    EVICTED,

}
