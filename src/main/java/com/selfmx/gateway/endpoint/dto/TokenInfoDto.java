package com.selfmx.gateway.endpoint.dto;

import java.util.List;

/**
 * Identity of the presented credential.
 */
public record TokenInfoDto(String actorType, String keyPrefix, boolean isAdmin, List<String> allowedDomainIds) {
}
