package com.selfmx.gateway.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Archived API key retained in {@code revoked_api_keys} after the live row is purged.
 */
public class RevokedApiKey {

    private String id;
    private String name;
    private String keyPrefix;
    private boolean admin;
    private OffsetDateTime createdAt;
    private OffsetDateTime revokedAt;
    private OffsetDateTime archivedAt;
    private OffsetDateTime lastUsedAt;
    private String lastUsedIp;
    private List<String> allowedDomainIds = new ArrayList<>();

    /**
     * Builds the archive record for a revoked key.
     *
     * @param key        Revoked key.
     * @param archivedAt Archive time.
     * @return RevokedApiKey.
     */
    public static RevokedApiKey from(ApiKey key, OffsetDateTime archivedAt) {
        RevokedApiKey archived = new RevokedApiKey();
        archived.setId(key.getId());
        archived.setName(key.getName());
        archived.setKeyPrefix(key.getKeyPrefix());
        archived.setAdmin(key.isAdmin());
        archived.setCreatedAt(key.getCreatedAt());
        archived.setRevokedAt(key.getRevokedAt());
        archived.setArchivedAt(archivedAt);
        archived.setLastUsedAt(key.getLastUsedAt());
        archived.setLastUsedIp(key.getLastUsedIp());
        archived.setAllowedDomainIds(new ArrayList<>(key.getAllowedDomainIds()));
        return archived;
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

    public OffsetDateTime getArchivedAt() {
        return archivedAt;
    }

    public void setArchivedAt(OffsetDateTime archivedAt) {
        this.archivedAt = archivedAt;
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
