package com.selfmx.provider.dns;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * XBill DNS record resolver.
 * <p>Queries the system resolver first and falls back to a public resolver when the
 * primary returns nothing for the name.
 * <p>Comparison is case-insensitive and ignores trailing dots. Lookups bypass the dnsjava
 * cache so every poll sees current data.
 *
 * @see Lookup
 */
public class XBillDnsRecordResolver implements DnsRecordResolver {
    private static final Logger log = LogManager.getLogger(XBillDnsRecordResolver.class);

    static final String PRIMARY = "primary";
    static final String FALLBACK = "fallback";

    private final Resolver primary;
    private final Resolver fallback;

    /**
     * Constructs a resolver using the system configuration and a public fallback.
     *
     * @param fallbackAddress Fallback resolver address.
     * @param timeout         Per query timeout.
     * @throws UnknownHostException When the fallback address is invalid.
     */
    public XBillDnsRecordResolver(String fallbackAddress, Duration timeout) throws UnknownHostException {
        this(new ExtendedResolver(), new SimpleResolver(fallbackAddress), timeout);
    }

    /**
     * Constructs a resolver with explicit resolvers.
     *
     * @param primary  Primary resolver.
     * @param fallback Fallback resolver, may be null.
     * @param timeout  Per query timeout.
     */
    public XBillDnsRecordResolver(Resolver primary, Resolver fallback, Duration timeout) {
        this.primary = primary;
        this.fallback = fallback;
        this.primary.setTimeout(timeout);
        if (this.fallback != null) {
            this.fallback.setTimeout(timeout);
        }
    }

    @Override
    public DnsCheckResult checkRecord(String type, String name, String expectedValue) {
        int qtype = Type.value(type != null ? type.toUpperCase(Locale.ROOT) : "");
        if (qtype != Type.CNAME && qtype != Type.TXT && qtype != Type.MX) {
            log.debug("Unsupported record type for direct check: {}", type);
            return DnsCheckResult.notFound();
        }

        String expected = normalize(expectedValue);
        List<String> values = query(primary, name, qtype);
        String answeredBy = PRIMARY;
        if (values.isEmpty() && fallback != null) {
            values = query(fallback, name, qtype);
            answeredBy = FALLBACK;
        }
        if (values.isEmpty()) {
            log.debug("{} record not found: {}", type, name);
            return DnsCheckResult.notFound();
        }

        boolean verified = false;
        for (String value : values) {
            if (normalize(value).equals(expected)) {
                verified = true;
                break;
            }
        }
        log.debug("{} record {} via {}: values={}, verified={}", type, name, answeredBy, values, verified);
        return new DnsCheckResult(true, values.get(0), verified, answeredBy);
    }

    /**
     * Lowercases and trims trailing dots.
     */
    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String out = value.trim().toLowerCase(Locale.ROOT);
        while (out.endsWith(".")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private List<String> query(Resolver resolver, String name, int qtype) {
        List<String> values = new ArrayList<>();
        try {
            Lookup lookup = new Lookup(name, qtype);
            lookup.setResolver(resolver);
            lookup.setCache(null);
            Record[] records = lookup.run();
            if (records == null) {
                return values;
            }
            for (Record record : records) {
                if (record instanceof CNAMERecord cname) {
                    values.add(cname.getTarget().toString(true));
                } else if (record instanceof MXRecord mx) {
                    values.add(mx.getTarget().toString(true));
                } else if (record instanceof TXTRecord txt) {
                    values.add(String.join("", txt.getStrings()));
                }
            }
        } catch (TextParseException e) {
            log.warn("Invalid DNS name {}: {}", name, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("DNS query failed for {}: {}", name, e.getMessage());
        }
        return values;
    }
}
