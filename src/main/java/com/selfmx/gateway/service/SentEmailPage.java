package com.selfmx.gateway.service;

import com.selfmx.gateway.domain.SentEmail;

import java.util.List;

/**
 * One keyset page of sent emails.
 *
 * @param items      Emails, newest first.
 * @param nextCursor Cursor for the following page, null on the last page.
 * @param hasMore    Whether more emails follow.
 */
public record SentEmailPage(List<SentEmail> items, String nextCursor, boolean hasMore) {
}
