package com.selfmx.endpoints;

import com.selfmx.config.server.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public API endpoint.
 *
 * <p>Hosts every registered {@link ApiHandler} on one {@link HttpServer} backed by a fixed
 * worker pool, plus:
 * <ul>
 *   <li><b>GET /health</b>: liveness, returns <code>{"status":"UP","timestamp":...}</code>.</li>
 *   <li><b>/</b>: anything unmatched answers 404 <code>not_found</code>.</li>
 * </ul>
 */
public class ApiEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(ApiEndpoint.class);

    private static final String NOT_FOUND_BODY =
            "{\"error\":{\"code\":\"not_found\",\"message\":\"Resource not found\"}}";

    private final String bind;
    private final List<ApiHandler> handlers = new ArrayList<>();
    private ExecutorService executor;

    /**
     * Constructs a new ApiEndpoint.
     *
     * @param bind     Address to bind, empty for all interfaces.
     * @param handlers Handlers to register.
     */
    public ApiEndpoint(String bind, List<ApiHandler> handlers) {
        this.bind = bind;
        this.handlers.addAll(handlers);
    }

    /**
     * Registers handlers built after the endpoint, since handlers send through it.
     * Must be called before {@link #start(EndpointConfig)}.
     *
     * @param more Handlers.
     */
    public void addHandlers(List<ApiHandler> more) {
        if (server != null) {
            throw new IllegalStateException("Endpoint already started");
        }
        handlers.addAll(more);
    }

    /**
     * Starts the API endpoint.
     *
     * @param config EndpointConfig with port and worker count.
     * @throws IOException If an I/O error occurs during server startup.
     */
    @Override
    public void start(EndpointConfig config) throws IOException {
        int port = config.getPort(8080);
        InetSocketAddress address = bind == null || bind.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(bind, port);
        server = HttpServer.create(address, 50);

        server.createContext("/", this::handleNotFound);
        server.createContext("/health", this::handleHealth);
        for (ApiHandler handler : handlers) {
            server.createContext(handler.getPath(), handler);
            log.debug("Registered handler {} at {}", handler.getClass().getSimpleName(), handler.getPath());
        }

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(Math.max(1, config.getWorkers()), r -> {
            Thread t = new Thread(r, "api-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();

        log.info("API available at http://{}:{}/ with {} workers",
                bind == null || bind.isBlank() ? "localhost" : bind, getPort(), config.getWorkers());
        log.info("Health available at http://localhost:{}/health", getPort());
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendJson(exchange, 405, "{\"error\":{\"code\":\"method_not_allowed\",\"message\":\"Method not allowed\"}}");
            return;
        }
        sendJson(exchange, 200, "{\"status\":\"UP\",\"timestamp\":\"" + Instant.now() + "\"}");
    }

    private void handleNotFound(HttpExchange exchange) throws IOException {
        log.debug("No handler for {} {}", exchange.getRequestMethod(), exchange.getRequestURI().getPath());
        sendJson(exchange, 404, NOT_FOUND_BODY);
    }

    @Override
    public void stop(int delaySeconds) {
        super.stop(delaySeconds);
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(delaySeconds + 1L, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
            executor = null;
        }
    }
}
