package com.github.zzf.relay.server;

/**
 * every session id is in use
 */
public class RegistryFullException extends RuntimeException {

    public RegistryFullException(String message) {
        super(message);
    }

}
