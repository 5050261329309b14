package com.selfmx.gateway.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DnsRecordCodecTest {

    @Test
    void preservesOrderAndVerifiedAnnotation() {
        DnsRecord first = new DnsRecord("CNAME", "b._domainkey.example.com", "b.dkim.amazonses.com", 0);
        DnsRecord second = new DnsRecord("MX", "mail.example.com", "feedback-smtp.eu-west-1.amazonses.com", 10);
        second.setVerified(true);

        List<DnsRecord> decoded = DnsRecordCodec.decode(DnsRecordCodec.encode(List.of(first, second)));

        assertEquals(List.of(first, second), decoded);
        assertTrue(decoded.get(1).isVerified());
        assertEquals(10, decoded.get(1).getPriority());
    }

    @Test
    void nullAndBlankMeanNoRecords() {
        assertNull(DnsRecordCodec.encode(null));
        assertNull(DnsRecordCodec.decode(null));
        assertNull(DnsRecordCodec.decode("  "));
        assertTrue(DnsRecordCodec.decode("[]").isEmpty());
    }

    @Test
    void corruptValueIsReported() {
        assertThrows(IllegalStateException.class, () -> DnsRecordCodec.decode("{not json"));
    }
}
