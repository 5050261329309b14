/**
 * Caller authentication and authorization.
 *
 * <p>Requests carry either a bearer API key or an admin session cookie. Keys are scoped to
 * a set of domains unless they are admin keys.
 */
package com.selfmx.auth;
