package com.selfmx.endpoints;

import com.sun.net.httpserver.HttpHandler;

/**
 * An {@link HttpHandler} that owns one path prefix of the public API.
 *
 * <p>{@link ApiEndpoint} creates one server context per handler, so a handler sees every
 * request under its prefix, including sub-resources such as {@code /domains/{id}/verify}.
 */
public interface ApiHandler extends HttpHandler {

    /**
     * Path prefix, e.g. {@code /domains}.
     *
     * @return Context path.
     */
    String getPath();
}
