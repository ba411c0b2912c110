package com.github.zzf.relay;

import com.github.zzf.relay.protocol.ConnectFailureException;
import com.github.zzf.relay.protocol.codec.RelayCodec;
import com.github.zzf.relay.server.RelayServer;
import com.github.zzf.relay.server.metric.MicroMeterMetrics;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Application {

    public static void main(String[] args) {
        String host = System.getProperty("relay.server.host", RelayServer.DEFAULT_HOST);
        int port = Integer.getInteger("relay.server.port", RelayServer.DEFAULT_PORT);
        log.info("relay.server.listened: {}:{}", host, port);
        //
        int workerThreadNum = Integer.getInteger("relay.server.thread.num",
            Runtime.getRuntime().availableProcessors() * 2);
        log.info("RELAY_SERVER_WORKER_THREAD_NUM-> {}", workerThreadNum);
        //
        int maxFrameLength = Integer.getInteger("relay.server.max.frame.length", RelayCodec.DEFAULT_MAX_FRAME_LENGTH);
        int readIdleTimeoutSecond = Integer.getInteger("relay.server.read.idle.timeout.second", 0);
        log.info("relay.server.max.frame.length: {}, relay.server.read.idle.timeout.second: {}",
            maxFrameLength, readIdleTimeoutSecond);
        // metric
        String appName = System.getProperty("appName", "message-relay");
        MicroMeterMetrics.builder()
            .appName(appName)
            .prometheusExportAddress(System.getProperty("relay.metrics.prometheus.export.address"))
            .build()
            .init();
        //
        RelayServer server;
        try {
            server = RelayServer.builder()
                .host(host)
                .port(port)
                .workerThreadNum(workerThreadNum)
                .maxFrameLength(maxFrameLength)
                .readIdleTimeoutSecond(readIdleTimeoutSecond)
                .build()
                .start();
        } catch (ConnectFailureException e) {
            log.error("Relay server start failed, now exit.", e);
            System.exit(1);
            return;
        }
        // ShutdownHook
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "relay-shutdown"));
        server.terminationFuture().syncUninterruptibly();
        log.info("Relay server terminated.");
    }

}
