package com.github.zzf.relay.server;

/**
 * ACTIVE -> CLOSING -> CLOSED, never back
 */
public enum SessionState {

    ACTIVE,
    CLOSING,
    CLOSED,

}
