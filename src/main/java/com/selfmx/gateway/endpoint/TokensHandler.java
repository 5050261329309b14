package com.selfmx.gateway.endpoint;

import com.selfmx.auth.Actor;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.gateway.endpoint.dto.TokenInfoDto;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Handler for <b>GET /tokens/me</b>, describing the presented credential.
 */
public class TokensHandler extends ApiRouter {

    public TokensHandler(HttpEndpoint endpoint, AuthorizationGate gate, RateLimiter apiLimiter) {
        super("/tokens", endpoint, gate, apiLimiter);
    }

    @Override
    protected void route(HttpExchange exchange, String method, String tail) throws IOException {
        if (!"/me".equals(tail)) {
            throw notFound();
        }
        if (!"GET".equals(method)) {
            throw methodNotAllowed();
        }
        Actor actor = authenticate(exchange);
        List<String> domains = actor.isAdmin() ? List.of() : new ArrayList<>(actor.getAllowedDomainIds());
        sendJson(exchange, 200, new TokenInfoDto(actor.getType().apiName(), actor.getActorId(), actor.isAdmin(), domains));
    }
}
