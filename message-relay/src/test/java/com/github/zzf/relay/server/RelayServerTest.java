package com.github.zzf.relay.server;

import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.BDDAssertions.then;

import com.github.zzf.relay.client.DefaultRelayClient;
import com.github.zzf.relay.client.MessageHandler;
import com.github.zzf.relay.protocol.ConnectFailureException;
import com.github.zzf.relay.protocol.codec.RelayCodec;
import com.github.zzf.relay.protocol.model.Message;
import com.github.zzf.relay.protocol.model.MessageKind;
import io.netty.channel.nio.NioEventLoopGroup;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * real server and clients over loopback
 */
class RelayServerTest {

    static final String HOST = "127.0.0.1";

    RelayServer server;
    NioEventLoopGroup clientGroup;

    @BeforeEach
    void beforeEach() {
        server = RelayServer.builder()
            .host(HOST)
            .port(0)
            .workerThreadNum(2)
            .build()
            .start();
        clientGroup = new NioEventLoopGroup(2);
    }

    @AfterEach
    void afterEach() {
        server.shutdown();
        clientGroup.shutdownGracefully();
    }

    @Test
    void givenAB_whenASends_thenOnlyBReceivesItWithSenderIdOfA() throws InterruptedException {
        QueueHandler ha = new QueueHandler();
        QueueHandler hb = new QueueHandler();
        DefaultRelayClient a = connect(ha, 1);
        DefaultRelayClient b = connect(hb, 2);
        // when
        a.send(Message.text("hi")).toCompletableFuture().join();
        // then
        Message received = hb.queue.poll(5, TimeUnit.SECONDS);
        then(received).isNotNull();
        then(received.kind()).isEqualTo(MessageKind.TEXT);
        then(received.senderId()).isEqualTo(1);
        then(received.payloadAsString()).isEqualTo("hi");
        then(ha.queue.poll(200, TimeUnit.MILLISECONDS)).isNull();
        a.close();
        b.close();
    }

    @Test
    void givenBDisconnected_whenASends_thenASucceedsAndStaysConnected() {
        DefaultRelayClient a = connect(new QueueHandler(), 1);
        DefaultRelayClient b = connect(new QueueHandler(), 2);
        // when
        b.disconnect();
        awaitTrue(() -> server.registry().size() == 1);
        a.send(Message.event("still here")).toCompletableFuture().join();
        // then
        then(a.isConnected()).isTrue();
        then(server.registry().get(1)).isNotNull();
        a.close();
        b.close();
    }

    @Test
    void givenPortInUse_whenStart_thenConnectFailure() {
        RelayServer other = RelayServer.builder()
            .host(HOST)
            .port(server.localAddress().getPort())
            .workerThreadNum(1)
            .build();
        Throwable t = catchThrowable(other::start);
        then(t).isInstanceOf(ConnectFailureException.class);
    }

    @Test
    void givenStopSignal_whenCloseListenedPort_thenActiveSessionsKeepRunning() throws InterruptedException {
        QueueHandler hb = new QueueHandler();
        DefaultRelayClient a = connect(new QueueHandler(), 1);
        DefaultRelayClient b = connect(hb, 2);
        // when
        server.closeListenedPort();
        // then
        then(server.isAccepting()).isFalse();
        a.send(Message.snapshot(new byte[]{9})).toCompletableFuture().join();
        Message received = hb.queue.poll(5, TimeUnit.SECONDS);
        then(received).isNotNull();
        then(received.kind()).isEqualTo(MessageKind.SNAPSHOT);
        a.close();
        b.close();
    }

    @Test
    void givenClients_whenShutdown_thenClientsObserveClose() {
        QueueHandler ha = new QueueHandler();
        DefaultRelayClient a = connect(ha, 1);
        // when
        server.shutdown();
        // then
        a.closeFuture().toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).join();
        then(ha.closed).isTrue();
        then(a.isConnected()).isFalse();
        then(server.isAccepting()).isFalse();
        then(server.registry().size()).isZero();
        then(server.terminationFuture().awaitUninterruptibly(10, TimeUnit.SECONDS)).isTrue();
        a.close();
    }

    @Test
    void givenNotConnected_whenSend_thenFails() {
        DefaultRelayClient c = new DefaultRelayClient(HOST, server.localAddress().getPort(), new QueueHandler(), clientGroup);
        Throwable t = catchThrowable(() -> c.send(Message.text("x")).toCompletableFuture().join());
        then(t).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void givenReadIdleTimeout_whenClientStaysSilent_thenSessionClosedAndRemoved() {
        RelayServer idle = RelayServer.builder()
            .host(HOST)
            .port(0)
            .workerThreadNum(1)
            .readIdleTimeoutSecond(1)
            .build()
            .start();
        try {
            QueueHandler h = new QueueHandler();
            DefaultRelayClient silent = connect(idle, h, 1, RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
            ServerSession session = idle.registry().get(1);
            then(session).isNotNull();
            // when: nothing is sent
            silent.closeFuture().toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).join();
            // then
            then(h.closed).isTrue();
            awaitTrue(() -> idle.registry().size() == 0);
            then(session.state()).isEqualTo(SessionState.CLOSED);
            silent.close();
        } finally {
            idle.shutdown();
        }
    }

    @Test
    void givenServerMaxFrameLength_whenClientSendsLargerFrame_thenOnlyThatClientClosed() throws InterruptedException {
        RelayServer small = RelayServer.builder()
            .host(HOST)
            .port(0)
            .workerThreadNum(1)
            .maxFrameLength(64)
            .build()
            .start();
        try {
            QueueHandler ha = new QueueHandler();
            QueueHandler hb = new QueueHandler();
            DefaultRelayClient a = connect(small, ha, 1, RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
            DefaultRelayClient b = connect(small, hb, 2, RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
            // when: 6 bytes envelope + 100 bytes body > 64
            a.send(Message.snapshot(new byte[100])).toCompletableFuture().join();
            // then
            a.closeFuture().toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).join();
            awaitTrue(() -> small.registry().size() == 1);
            then(small.registry().get(2)).isNotNull();
            then(b.isConnected()).isTrue();
            then(hb.queue.poll(200, TimeUnit.MILLISECONDS)).isNull();
            // frames within the limit still pass
            DefaultRelayClient c = connect(small, new QueueHandler(), 2, RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
            c.send(Message.text("small")).toCompletableFuture().join();
            Message received = hb.queue.poll(5, TimeUnit.SECONDS);
            then(received).isNotNull();
            then(received.payloadAsString()).isEqualTo("small");
            a.close();
            b.close();
            c.close();
        } finally {
            small.shutdown();
        }
    }

    @Test
    void givenClientMaxFrameLength_whenRelayForwardsLargerFrame_thenThatClientClosed() {
        QueueHandler ha = new QueueHandler();
        QueueHandler hb = new QueueHandler();
        DefaultRelayClient a = connect(server, ha, 1, RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
        DefaultRelayClient b = connect(server, hb, 2, 64);
        // when
        a.send(Message.snapshot(new byte[100])).toCompletableFuture().join();
        // then
        b.closeFuture().toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).join();
        then(hb.queue).isEmpty();
        awaitTrue(() -> server.registry().size() == 1);
        then(a.isConnected()).isTrue();
        a.close();
        b.close();
    }

    DefaultRelayClient connect(MessageHandler handler, int expectedSessions) {
        return connect(server, handler, expectedSessions, RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    DefaultRelayClient connect(RelayServer target, MessageHandler handler, int expectedSessions, int maxFrameLength) {
        DefaultRelayClient client = new DefaultRelayClient(HOST, target.localAddress().getPort(), handler,
            clientGroup, maxFrameLength);
        client.connect();
        // ids are assigned in accept order
        awaitTrue(() -> target.registry().size() == expectedSessions);
        return client;
    }

    static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met in 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError(e);
            }
        }
    }

    static class QueueHandler implements MessageHandler {

        final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();
        volatile boolean closed;

        @Override
        public void onText(Message message) {
            queue.add(message);
        }

        @Override
        public void onEvent(Message message) {
            queue.add(message);
        }

        @Override
        public void onSnapshot(Message message) {
            queue.add(message);
        }

        @Override
        public void clientClosed() {
            closed = true;
        }

    }

}
