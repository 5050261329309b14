package com.selfmx.gateway.domain;

import java.util.Objects;

/**
 * DNS record required to prove ownership of a domain.
 *
 * <p>{@code verified} is an advisory annotation from the last direct DNS check.
 */
public class DnsRecord {

    private String type;
    private String name;
    private String value;
    private int priority;
    private boolean verified;

    public DnsRecord() {
    }

    public DnsRecord(String type, String name, String value, int priority) {
        this.type = type;
        this.name = name;
        this.value = value;
        this.priority = priority;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isVerified() {
        return verified;
    }

    public void setVerified(boolean verified) {
        this.verified = verified;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DnsRecord that)) return false;
        return priority == that.priority
                && verified == that.verified
                && Objects.equals(type, that.type)
                && Objects.equals(name, that.name)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, value, priority, verified);
    }

    @Override
    public String toString() {
        return type + " " + name + " -> " + value;
    }
}
