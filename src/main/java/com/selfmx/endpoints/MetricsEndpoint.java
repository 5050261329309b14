package com.selfmx.endpoints;

import com.selfmx.config.server.EndpointConfig;
import com.selfmx.metrics.GatewayMetrics;
import com.selfmx.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Monitoring endpoint.
 *
 * <p>Exposes the Prometheus scrape at <b>/metrics</b> (guarded by {@link HttpAuth}) and a
 * liveness check at <b>/health</b>. JVM memory, GC, thread and processor binders are registered
 * alongside the gateway counters.
 */
public class MetricsEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(MetricsEndpoint.class);

    private PrometheusMeterRegistry prometheusRegistry;
    private JvmGcMetrics jvmGcMetrics;

    /**
     * Creates the registry and binds the gateway and JVM metrics without serving them.
     *
     * @return Registry.
     */
    public PrometheusMeterRegistry initRegistry() {
        if (prometheusRegistry == null) {
            prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
            MetricsRegistry.register(prometheusRegistry);
            new JvmMemoryMetrics().bindTo(prometheusRegistry);
            jvmGcMetrics = new JvmGcMetrics();
            jvmGcMetrics.bindTo(prometheusRegistry);
            new JvmThreadMetrics().bindTo(prometheusRegistry);
            new ProcessorMetrics().bindTo(prometheusRegistry);
            GatewayMetrics.initialize();
        }
        return prometheusRegistry;
    }

    /**
     * Starts the metrics endpoint.
     *
     * @param config EndpointConfig with port and scrape credentials.
     * @throws IOException If an I/O error occurs during server startup.
     */
    @Override
    public void start(EndpointConfig config) throws IOException {
        this.auth = new HttpAuth(config, "Metrics");
        initRegistry();

        int port = config.getPort(8081);
        server = HttpServer.create(new InetSocketAddress(port), 10);
        server.createContext("/metrics", this::handlePrometheus);
        server.createContext("/health", exchange -> sendJson(exchange, 200, "{\"status\":\"UP\"}"));
        server.start();

        log.info("Prometheus data available at http://localhost:{}/metrics", getPort());
        if (auth.isAuthEnabled()) {
            log.info("Authentication is enabled for metrics endpoint");
        }
    }

    private void handlePrometheus(HttpExchange exchange) throws IOException {
        log.trace("Handling /metrics: method={}, remote={}", exchange.getRequestMethod(), exchange.getRemoteAddress());
        if (!auth.isAuthenticated(exchange)) {
            auth.sendAuthRequired(exchange);
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendText(exchange, 405, "Method Not Allowed");
            return;
        }
        sendResponse(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", prometheusRegistry.scrape());
    }

    @Override
    public void stop(int delaySeconds) {
        super.stop(delaySeconds);
        if (jvmGcMetrics != null) {
            jvmGcMetrics.close();
            jvmGcMetrics = null;
        }
    }
}
