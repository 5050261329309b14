package com.selfmx.gateway.endpoint.dto;

import java.util.List;

/**
 * Offset paginated list.
 */
public record PageDto<T>(List<T> data, int page, int limit, int total) {
}
