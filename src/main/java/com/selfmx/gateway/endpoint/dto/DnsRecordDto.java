package com.selfmx.gateway.endpoint.dto;

public record DnsRecordDto(String type, String name, String value, int priority, boolean verified) {
}
