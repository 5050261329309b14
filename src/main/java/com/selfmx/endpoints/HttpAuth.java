package com.selfmx.endpoints;

import com.selfmx.config.server.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Static credential check for operational endpoints such as {@code /metrics}.
 *
 * <p>Accepts HTTP Basic ({@code user:password}) or Bearer credentials compared against the
 * configured {@code authValue}. Addresses matching the allow list (single IPs or CIDR blocks)
 * skip the credential check.
 * <pre>{@code
 * HttpAuth auth = new HttpAuth(endpointConfig, "Metrics");
 * if (!auth.isAuthenticated(exchange)) {
 *     auth.sendAuthRequired(exchange);
 *     return;
 * }
 * }</pre>
 */
public class HttpAuth {
    private static final Logger log = LogManager.getLogger(HttpAuth.class);

    private final String authType;
    private final byte[] expected;
    private final boolean authEnabled;
    private final List<AddressBlock> allowList = new ArrayList<>();
    private final String realm;

    /**
     * Constructs an HttpAuth instance with the specified endpoint configuration.
     *
     * @param config EndpointConfig containing authentication settings.
     * @param realm  The authentication realm name.
     */
    public HttpAuth(EndpointConfig config, String realm) {
        this.authType = config.getAuthType();
        this.expected = config.getAuthValue().getBytes(StandardCharsets.UTF_8);
        this.authEnabled = config.isAuthEnabled();
        this.realm = realm != null ? realm : "Restricted";
        for (String entry : config.getAllowList()) {
            try {
                allowList.add(AddressBlock.parse(entry));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring allow list entry '{}' for {}: {}", entry, this.realm, e.getMessage());
            }
        }
    }

    public boolean isAuthEnabled() {
        return authEnabled;
    }

    /**
     * Checks if the request is from an allowed address or carries valid credentials.
     *
     * @param exchange The HTTP exchange object.
     * @return True if authentication is disabled, IP is allowed, or credentials are valid.
     */
    public boolean isAuthenticated(HttpExchange exchange) {
        if (isIpAllowed(exchange.getRemoteAddress())) {
            log.trace("Authentication bypassed for allowed IP: {}", exchange.getRemoteAddress());
            return true;
        }
        if (!authEnabled) {
            return true;
        }

        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null) {
            log.debug("Authentication failed: missing Authorization header from {}", exchange.getRemoteAddress());
            return false;
        }

        String presented;
        if ("basic".equalsIgnoreCase(authType) && header.startsWith("Basic ")) {
            try {
                presented = new String(Base64.getDecoder().decode(header.substring(6).trim()), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                log.debug("Authentication failed: malformed Basic credentials from {}", exchange.getRemoteAddress());
                return false;
            }
        } else if ("bearer".equalsIgnoreCase(authType) && header.startsWith("Bearer ")) {
            presented = header.substring(7).trim();
        } else {
            log.debug("Authentication failed: expected {} credentials from {}", authType, exchange.getRemoteAddress());
            return false;
        }

        boolean valid = MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), expected);
        if (!valid) {
            log.debug("Authentication failed: invalid {} credentials from {}", authType, exchange.getRemoteAddress());
        }
        return valid;
    }

    boolean isIpAllowed(InetSocketAddress remote) {
        if (allowList.isEmpty() || remote == null || remote.getAddress() == null) {
            return false;
        }
        byte[] ip = remote.getAddress().getAddress();
        for (AddressBlock block : allowList) {
            if (block.contains(ip)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sends an HTTP 401 response with a challenge for the configured scheme.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    public void sendAuthRequired(HttpExchange exchange) throws IOException {
        String scheme = "bearer".equalsIgnoreCase(authType) ? "Bearer" : "Basic";
        exchange.getResponseHeaders().set("WWW-Authenticate", scheme + " realm=\"" + realm + "\"");
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        byte[] body = "{\"error\":{\"code\":\"unauthorized\",\"message\":\"Unauthorized\"}}"
                .getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(401, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    /**
     * Network block parsed from an IP or CIDR allow list entry.
     */
    static final class AddressBlock {
        private final byte[] network;
        private final int prefixLength;

        private AddressBlock(byte[] network, int prefixLength) {
            this.network = network;
            this.prefixLength = prefixLength;
        }

        static AddressBlock parse(String entry) {
            String value = entry.trim();
            int slash = value.indexOf('/');
            String host = slash >= 0 ? value.substring(0, slash) : value;
            byte[] address;
            try {
                address = InetAddress.getByName(host).getAddress();
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("unknown host " + host, e);
            }
            int prefix = address.length * 8;
            if (slash >= 0) {
                try {
                    prefix = Integer.parseInt(value.substring(slash + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid prefix length", e);
                }
                if (prefix < 0 || prefix > address.length * 8) {
                    throw new IllegalArgumentException("prefix length out of range");
                }
            }
            return new AddressBlock(address, prefix);
        }

        boolean contains(byte[] ip) {
            if (ip.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (ip[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits > 0) {
                int mask = (0xFF << (8 - remainingBits)) & 0xFF;
                return (ip[fullBytes] & mask) == (network[fullBytes] & mask);
            }
            return true;
        }
    }
}
