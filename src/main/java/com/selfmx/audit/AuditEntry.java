package com.selfmx.audit;

import java.time.OffsetDateTime;

/**
 * One audit log row.
 *
 * <p>{@code details} holds a JSON document or null.
 */
public class AuditEntry {
    private long id;
    private OffsetDateTime timestamp;
    private String action;
    private String actorType;
    private String actorId;
    private String resourceType;
    private String resourceId;
    private int statusCode;
    private String errorMessage;
    private String details;
    private String ipAddress;
    private String userAgent;

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public AuditEntry setTimestamp(OffsetDateTime timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public String getAction() {
        return action;
    }

    public AuditEntry setAction(String action) {
        this.action = action;
        return this;
    }

    public String getActorType() {
        return actorType;
    }

    public AuditEntry setActorType(String actorType) {
        this.actorType = actorType;
        return this;
    }

    public String getActorId() {
        return actorId;
    }

    public AuditEntry setActorId(String actorId) {
        this.actorId = actorId;
        return this;
    }

    public String getResourceType() {
        return resourceType;
    }

    public AuditEntry setResourceType(String resourceType) {
        this.resourceType = resourceType;
        return this;
    }

    public String getResourceId() {
        return resourceId;
    }

    public AuditEntry setResourceId(String resourceId) {
        this.resourceId = resourceId;
        return this;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public AuditEntry setStatusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public AuditEntry setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
        return this;
    }

    public String getDetails() {
        return details;
    }

    public AuditEntry setDetails(String details) {
        this.details = details;
        return this;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public AuditEntry setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
        return this;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public AuditEntry setUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }
}
