package com.selfmx.audit;

import java.time.OffsetDateTime;

/**
 * Filters for listing audit entries. Null fields are not applied.
 */
public class AuditQuery {
    private String action;
    private String actorId;
    private OffsetDateTime from;
    private OffsetDateTime to;
    private int page = 1;
    private int limit = 50;

    public String getAction() {
        return action;
    }

    public AuditQuery setAction(String action) {
        this.action = action;
        return this;
    }

    public String getActorId() {
        return actorId;
    }

    public AuditQuery setActorId(String actorId) {
        this.actorId = actorId;
        return this;
    }

    public OffsetDateTime getFrom() {
        return from;
    }

    public AuditQuery setFrom(OffsetDateTime from) {
        this.from = from;
        return this;
    }

    public OffsetDateTime getTo() {
        return to;
    }

    public AuditQuery setTo(OffsetDateTime to) {
        this.to = to;
        return this;
    }

    public int getPage() {
        return page;
    }

    public AuditQuery setPage(int page) {
        this.page = page;
        return this;
    }

    public int getLimit() {
        return limit;
    }

    public AuditQuery setLimit(int limit) {
        this.limit = limit;
        return this;
    }

    public long getOffset() {
        return (long) (Math.max(page, 1) - 1) * limit;
    }
}
