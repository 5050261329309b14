package com.selfmx.endpoints;

import com.selfmx.config.server.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Embedded {@link HttpServer} listener with the response writers the handlers share.
 *
 * <p>Every writer closes the exchange, so a handler writes exactly one response.
 */
public abstract class HttpEndpoint {
    private static final Logger log = LogManager.getLogger(HttpEndpoint.class);

    static final String JSON = "application/json; charset=utf-8";
    static final String TEXT = "text/plain; charset=utf-8";

    /**
     * Listener credentials check, null when the endpoint does not authenticate.
     */
    protected HttpAuth auth;

    protected HttpServer server;

    /**
     * Binds and starts the listener.
     *
     * @param config Port, workers and credentials.
     * @throws IOException If the port cannot be bound.
     */
    public abstract void start(EndpointConfig config) throws IOException;

    /**
     * Stops accepting requests and waits for in-flight exchanges.
     *
     * @param delaySeconds Upper bound on the wait.
     */
    public void stop(int delaySeconds) {
        if (server == null) {
            return;
        }
        server.stop(delaySeconds);
        server = null;
        log.info("{} stopped", getClass().getSimpleName());
    }

    /**
     * Bound port, useful when started on port 0.
     *
     * @return Port, or -1 when stopped.
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    public void sendJson(HttpExchange exchange, int code, String json) throws IOException {
        sendResponse(exchange, code, JSON, json);
    }

    public void sendText(HttpExchange exchange, int code, String text) throws IOException {
        sendResponse(exchange, code, TEXT, text);
    }

    /**
     * Writes headers only, as for 204.
     *
     * @param exchange Exchange.
     * @param code     Status.
     * @throws IOException If the client went away.
     */
    public void sendNoContent(HttpExchange exchange, int code) throws IOException {
        exchange.sendResponseHeaders(code, -1);
        exchange.close();
        log.debug("{} {} -> {}", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), code);
    }

    /**
     * Writes a UTF-8 body with a fixed length.
     *
     * @param exchange    Exchange.
     * @param code        Status.
     * @param contentType Content-Type header.
     * @param body        Body text.
     * @throws IOException If the client went away.
     */
    public void sendResponse(HttpExchange exchange, int code, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.debug("{} {} -> {} ({} bytes)", exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
                code, bytes.length);
    }
}
