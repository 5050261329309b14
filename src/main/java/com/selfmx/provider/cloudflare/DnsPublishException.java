package com.selfmx.provider.cloudflare;

/**
 * DNS record could not be published or removed.
 */
public class DnsPublishException extends Exception {

    public DnsPublishException(String message) {
        super(message);
    }

    public DnsPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
