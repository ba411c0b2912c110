package com.github.zzf.relay.client;

import com.github.zzf.relay.protocol.model.Message;

/**
 * sink for messages the relay forwards to this client
 */
public interface MessageHandler {

    void onText(Message message);

    void onEvent(Message message);

    void onSnapshot(Message message);

    /**
     * the connection to the relay is gone
     */
    default void clientClosed() {
    }

}
