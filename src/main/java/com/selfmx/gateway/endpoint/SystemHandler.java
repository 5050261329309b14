package com.selfmx.gateway.endpoint;

import com.selfmx.auth.AuthorizationGate;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.gateway.service.SystemStatusService;
import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Handler for the unauthenticated /system endpoints.
 *
 * <ul>
 *   <li><b>GET /system/status</b>: database, SES account and configuration checks.</li>
 *   <li><b>GET /system/version</b>: build version from {@code version.properties}.</li>
 * </ul>
 */
public class SystemHandler extends ApiRouter {
    private static final Logger log = LogManager.getLogger(SystemHandler.class);

    private final SystemStatusService status;
    private final Map<String, String> version;

    public SystemHandler(HttpEndpoint endpoint, AuthorizationGate gate, SystemStatusService status) {
        super("/system", endpoint, gate, null);
        this.status = status;
        this.version = loadVersion();
    }

    @Override
    protected void route(HttpExchange exchange, String method, String tail) throws IOException {
        if (!"GET".equals(method)) {
            throw methodNotAllowed();
        }
        switch (tail) {
            case "/status" -> {
                SystemStatusService.SystemStatus result = status.check();
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("healthy", result.healthy());
                body.put("issues", result.issues());
                body.put("timestamp", toIso(result.timestamp()));
                sendJson(exchange, 200, body);
            }
            case "/version" -> sendJson(exchange, 200, version);
            default -> throw notFound();
        }
    }

    static Map<String, String> loadVersion() {
        Map<String, String> out = new LinkedHashMap<>();
        Properties props = new Properties();
        try (InputStream is = SystemHandler.class.getClassLoader().getResourceAsStream("version.properties")) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            log.warn("Could not read version.properties: {}", e.getMessage());
        }
        out.put("version", props.getProperty("version", "unknown"));
        out.put("buildDate", props.getProperty("buildDate", "unknown"));
        return out;
    }
}
