package com.selfmx.auth;

import com.selfmx.gateway.domain.ApiKey;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Authenticated caller.
 *
 * <p>Admins may access every domain. Other callers are limited to their key's allow-list.
 */
public final class Actor {
    private final ActorType type;
    private final String actorId;
    private final String keyId;
    private final boolean admin;
    private final Set<String> allowedDomainIds;

    private Actor(ActorType type, String actorId, String keyId, boolean admin, Set<String> allowedDomainIds) {
        this.type = type;
        this.actorId = actorId;
        this.keyId = keyId;
        this.admin = admin;
        this.allowedDomainIds = allowedDomainIds;
    }

    /**
     * Actor for a validated API key. The key prefix is the public actor id.
     *
     * @param key Key.
     * @return Actor.
     */
    public static Actor forApiKey(ApiKey key) {
        return new Actor(ActorType.API_KEY, key.getKeyPrefix(), key.getId(), key.isAdmin(),
                Collections.unmodifiableSet(new LinkedHashSet<>(key.getAllowedDomainIds())));
    }

    /**
     * Actor for a valid admin session cookie.
     *
     * @return Actor.
     */
    public static Actor adminSession() {
        return new Actor(ActorType.ADMIN, null, null, true, Collections.emptySet());
    }

    /**
     * Actor for background jobs.
     *
     * @return Actor.
     */
    public static Actor system() {
        return new Actor(ActorType.SYSTEM, null, null, true, Collections.emptySet());
    }

    public ActorType getType() {
        return type;
    }

    public String getActorId() {
        return actorId;
    }

    /**
     * Gets the API key id, null for sessions and jobs.
     *
     * @return Key id.
     */
    public String getKeyId() {
        return keyId;
    }

    public boolean isAdmin() {
        return admin;
    }

    public Set<String> getAllowedDomainIds() {
        return allowedDomainIds;
    }

    /**
     * Checks domain scope.
     *
     * @param domainId Domain id.
     * @return True for admins or when the domain is on the allow-list.
     */
    public boolean canAccessDomain(String domainId) {
        return admin || (domainId != null && allowedDomainIds.contains(domainId));
    }

    /**
     * Gets the domain ids this actor is limited to.
     *
     * @return Null when unrestricted.
     */
    public Set<String> getDomainScope() {
        return admin ? null : allowedDomainIds;
    }

    @Override
    public String toString() {
        return "Actor{type=" + type + ", actorId=" + actorId + ", admin=" + admin + "}";
    }
}
