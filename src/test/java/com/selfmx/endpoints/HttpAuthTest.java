package com.selfmx.endpoints;

import com.selfmx.config.server.EndpointConfig;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpAuthTest {

    private static EndpointConfig config(String type, String value, List<String> allowList) {
        Map<String, Object> map = new HashMap<>();
        map.put("authType", type);
        map.put("authValue", value);
        map.put("allowList", allowList);
        return new EndpointConfig(map);
    }

    private static HttpExchange exchange(String ip, String authorization) {
        HttpExchange exchange = mock(HttpExchange.class);
        Headers headers = new Headers();
        if (authorization != null) {
            headers.add("Authorization", authorization);
        }
        when(exchange.getRequestHeaders()).thenReturn(headers);
        when(exchange.getResponseHeaders()).thenReturn(new Headers());
        when(exchange.getRemoteAddress()).thenReturn(new InetSocketAddress(ip, 40000));
        return exchange;
    }

    private static String basic(String credentials) {
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void disabledAuthAllowsEveryone() {
        HttpAuth auth = new HttpAuth(config("none", "", List.of()), "Metrics");

        assertFalse(auth.isAuthEnabled());
        assertTrue(auth.isAuthenticated(exchange("203.0.113.5", null)));
    }

    @Test
    void basicCredentialsAreCompared() {
        HttpAuth auth = new HttpAuth(config("basic", "ops:pass", List.of()), "Metrics");

        assertTrue(auth.isAuthenticated(exchange("203.0.113.5", basic("ops:pass"))));
        assertFalse(auth.isAuthenticated(exchange("203.0.113.5", basic("ops:wrong"))));
        assertFalse(auth.isAuthenticated(exchange("203.0.113.5", "Basic !!notbase64")));
        assertFalse(auth.isAuthenticated(exchange("203.0.113.5", "Bearer ops:pass")));
        assertFalse(auth.isAuthenticated(exchange("203.0.113.5", null)));
    }

    @Test
    void bearerTokenIsCompared() {
        HttpAuth auth = new HttpAuth(config("bearer", "tok-123", List.of()), "Metrics");

        assertTrue(auth.isAuthenticated(exchange("203.0.113.5", "Bearer tok-123")));
        assertFalse(auth.isAuthenticated(exchange("203.0.113.5", "Bearer tok-124")));
        assertFalse(auth.isAuthenticated(exchange("203.0.113.5", basic("tok-123"))));
    }

    @Test
    void allowListBypassesCredentials() {
        HttpAuth auth = new HttpAuth(config("bearer", "tok-123", List.of("10.0.0.0/8", "192.168.1.7", "10.0.0.0/99")), "Metrics");

        assertTrue(auth.isAuthenticated(exchange("10.20.30.40", null)));
        assertTrue(auth.isAuthenticated(exchange("192.168.1.7", null)));
        assertFalse(auth.isAuthenticated(exchange("192.168.1.8", null)));
        assertFalse(auth.isAuthenticated(exchange("11.0.0.1", null)));
    }

    @Test
    void addressBlocksMatchPrefixBits() {
        HttpAuth.AddressBlock block = HttpAuth.AddressBlock.parse("172.16.0.0/12");

        assertTrue(block.contains(new byte[]{(byte) 172, 31, (byte) 255, 1}));
        assertFalse(block.contains(new byte[]{(byte) 172, 32, 0, 1}));
        assertFalse(block.contains(new byte[16]));
        assertTrue(HttpAuth.AddressBlock.parse("0.0.0.0/0").contains(new byte[]{8, 8, 8, 8}));
        assertTrue(HttpAuth.AddressBlock.parse("::1").contains(new byte[]{0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1}));
        assertThrows(IllegalArgumentException.class, () -> HttpAuth.AddressBlock.parse("10.0.0.0/33"));
        assertThrows(IllegalArgumentException.class, () -> HttpAuth.AddressBlock.parse("10.0.0.0/x"));
    }

    @Test
    void challengeUsesConfiguredScheme() throws Exception {
        HttpAuth auth = new HttpAuth(config("bearer", "tok-123", List.of()), "Metrics");
        HttpExchange exchange = exchange("203.0.113.5", null);
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        when(exchange.getResponseBody()).thenReturn(body);

        auth.sendAuthRequired(exchange);

        assertEquals("Bearer realm=\"Metrics\"", exchange.getResponseHeaders().getFirst("WWW-Authenticate"));
        verify(exchange).sendResponseHeaders(401, body.size());
        assertTrue(body.toString(StandardCharsets.UTF_8).contains("unauthorized"));
    }
}
