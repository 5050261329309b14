package com.selfmx.provider.dns;

/**
 * Direct DNS lookup used to show which records are already live.
 */
public interface DnsRecordResolver {

    /**
     * Looks up a record and compares it with the expected value.
     *
     * @param type          CNAME, TXT or MX.
     * @param name          Record name.
     * @param expectedValue Expected target or text.
     * @return Check result, never null.
     */
    DnsCheckResult checkRecord(String type, String name, String expectedValue);
}
