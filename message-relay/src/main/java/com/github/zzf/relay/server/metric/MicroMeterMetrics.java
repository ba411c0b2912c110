package com.github.zzf.relay.server.metric;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * common tags, JVM binders and an optional prometheus scrape endpoint.
 * <p>binds to the global registry unless another one is given</p>
 */
@Slf4j
@Builder
public class MicroMeterMetrics {

    final String appName;
    @Builder.Default
    final CompositeMeterRegistry registry = Metrics.globalRegistry;
    /* 0.0.0.0:9100, null disables the exporter */
    final String prometheusExportAddress;

    public InetSocketAddress init() {
        log.info("MicroMeterMetrics appName: {}", appName);
        registry.config().commonTags("application", appName);
        InetSocketAddress listened = null;
        if (prometheusExportAddress != null) {
            log.info("MicroMeterMetrics prometheusExport: {}", prometheusExportAddress);
            listened = initPrometheusExporter(prometheusExportAddress);
        }
        initMetrics();
        return listened;
    }

    private InetSocketAddress initPrometheusExporter(String exportAddress) {
        String[] hostAndPort = exportAddress.split(":");
        InetSocketAddress address = new InetSocketAddress(hostAndPort[0], Integer.parseInt(hostAndPort[1]));
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        registry.add(prometheus);
        try {
            HttpServer server = HttpServer.create(address, 0);
            server.createContext("/metrics", httpExchange -> {
                byte[] response = prometheus.scrape().getBytes();
                httpExchange.sendResponseHeaders(200, response.length);
                try (OutputStream os = httpExchange.getResponseBody()) {
                    os.write(response);
                }
            });
            Thread thread = new Thread(server::start, "prometheus-http-server");
            thread.setDaemon(true);
            thread.start();
            InetSocketAddress listenedAddress = server.getAddress();
            log.info("prometheus exporter start success, bound: {}", listenedAddress);
            return listenedAddress;
        } catch (IOException e) {
            throw new IllegalStateException("prometheus exporter start failed: " + exportAddress, e);
        }
    }

    private void initMetrics() {
        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
    }

}
