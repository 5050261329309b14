package com.selfmx.gateway.endpoint.dto;

import java.util.List;

/**
 * Keyset paginated list.
 */
public record CursorPageDto<T>(List<T> data, String nextCursor, boolean hasMore) {
}
