package com.selfmx.gateway.endpoint.dto;

public record IdDto(String id) {
}
