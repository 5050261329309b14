package com.selfmx.provider.dns;

/**
 * Outcome of a direct DNS check of one record.
 */
public class DnsCheckResult {
    private final boolean found;
    private final String actualValue;
    private final boolean verified;
    private final String resolver;

    public DnsCheckResult(boolean found, String actualValue, boolean verified, String resolver) {
        this.found = found;
        this.actualValue = actualValue;
        this.verified = verified;
        this.resolver = resolver;
    }

    /**
     * Not found anywhere.
     */
    public static DnsCheckResult notFound() {
        return new DnsCheckResult(false, null, false, null);
    }

    public boolean isFound() {
        return found;
    }

    /**
     * First value returned for the name, or null when nothing was found.
     */
    public String getActualValue() {
        return actualValue;
    }

    public boolean isVerified() {
        return verified;
    }

    /**
     * Resolver that answered: {@code primary} or {@code fallback}.
     */
    public String getResolver() {
        return resolver;
    }

    @Override
    public String toString() {
        return "DnsCheckResult{found=" + found + ", actualValue=" + actualValue
                + ", verified=" + verified + ", resolver=" + resolver + "}";
    }
}
