package com.selfmx.gateway.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Scoped API credential stored in {@code api_keys}.
 *
 * <p>Only the salted hash of the secret is persisted.
 */
public class ApiKey {

    private String id;
    private String name;
    private String keyHash;
    private String keySalt;
    private String keyPrefix;
    private boolean admin;
    private OffsetDateTime createdAt;
    private OffsetDateTime revokedAt;
    private OffsetDateTime lastUsedAt;
    private String lastUsedIp;
    private List<String> allowedDomainIds = new ArrayList<>();

    /**
     * Gets the live lifecycle state derived from {@code revokedAt}.
     *
     * @return ACTIVE or REVOKED.
     */
    public ApiKeyState getState() {
        return revokedAt == null ? ApiKeyState.ACTIVE : ApiKeyState.REVOKED;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getKeyHash() {
        return keyHash;
    }

    public void setKeyHash(String keyHash) {
        this.keyHash = keyHash;
    }

    public String getKeySalt() {
        return keySalt;
    }

    public void setKeySalt(String keySalt) {
        this.keySalt = keySalt;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public boolean isAdmin() {
        return admin;
    }

    public void setAdmin(boolean admin) {
        this.admin = admin;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public void setRevokedAt(OffsetDateTime revokedAt) {
        this.revokedAt = revokedAt;
    }

    public OffsetDateTime getLastUsedAt() {
        return lastUsedAt;
    }

    public void setLastUsedAt(OffsetDateTime lastUsedAt) {
        this.lastUsedAt = lastUsedAt;
    }

    public String getLastUsedIp() {
        return lastUsedIp;
    }

    public void setLastUsedIp(String lastUsedIp) {
        this.lastUsedIp = lastUsedIp;
    }

    public List<String> getAllowedDomainIds() {
        return allowedDomainIds;
    }

    public void setAllowedDomainIds(List<String> allowedDomainIds) {
        this.allowedDomainIds = allowedDomainIds != null ? allowedDomainIds : new ArrayList<>();
    }
}
