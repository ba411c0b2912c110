package com.github.zzf.relay.protocol;

/**
 * bind / listen / connect setup failed
 */
public class ConnectFailureException extends RuntimeException {

    public ConnectFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
