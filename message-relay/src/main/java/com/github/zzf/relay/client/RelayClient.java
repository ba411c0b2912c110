package com.github.zzf.relay.client;

import com.github.zzf.relay.protocol.model.Message;
import java.util.concurrent.CompletionStage;

public interface RelayClient {

    /**
     * open the connection to the relay
     *
     * @throws com.github.zzf.relay.protocol.ConnectFailureException if the relay can not be reached
     */
    void connect();

    /**
     * send a message to the relay. the senderId is always sent as {@link Message#NO_SENDER}
     *
     * @return a future that will be completed when the frame was written
     */
    CompletionStage<Void> send(Message message);

    boolean isConnected();

    /**
     * close the connection. calling it more than once has no effect.
     */
    void disconnect();

    /**
     * completed once the connection went away, for whatever reason
     */
    CompletionStage<Void> closeFuture();

    /**
     * disconnect and release the resources the client owns
     */
    void close();

}
