package com.selfmx.provider.dns;

import org.junit.jupiter.api.Test;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.EDNSOption;
import org.xbill.DNS.Flags;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.ResolverListener;
import org.xbill.DNS.Section;
import org.xbill.DNS.TSIG;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XBillDnsRecordResolverTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Test
    void cnameMatchIgnoresCaseAndTrailingDot() throws Exception {
        StubResolver primary = new StubResolver();
        primary.add(new CNAMERecord(name("abc._domainkey.example.com."), DClass.IN, 300, name("ABC.dkim.amazonses.com.")));
        XBillDnsRecordResolver resolver = new XBillDnsRecordResolver(primary, null, TIMEOUT);

        DnsCheckResult result = resolver.checkRecord("CNAME", "abc._domainkey.example.com", "abc.dkim.amazonses.com.");

        assertTrue(result.isFound());
        assertTrue(result.isVerified());
        assertEquals("ABC.dkim.amazonses.com", result.getActualValue());
        assertEquals(XBillDnsRecordResolver.PRIMARY, result.getResolver());
    }

    @Test
    void wrongValueIsFoundButNotVerified() throws Exception {
        StubResolver primary = new StubResolver();
        primary.add(new CNAMERecord(name("abc._domainkey.example.com."), DClass.IN, 300, name("other.example.net.")));
        XBillDnsRecordResolver resolver = new XBillDnsRecordResolver(primary, null, TIMEOUT);

        DnsCheckResult result = resolver.checkRecord("cname", "abc._domainkey.example.com", "abc.dkim.amazonses.com");

        assertTrue(result.isFound());
        assertFalse(result.isVerified());
        assertEquals("other.example.net", result.getActualValue());
    }

    @Test
    void fallbackAnswersWhenPrimaryHasNothing() throws Exception {
        StubResolver primary = new StubResolver();
        StubResolver fallback = new StubResolver();
        fallback.add(new TXTRecord(name("_amazonses.example.com."), DClass.IN, 300, "token-123"));
        XBillDnsRecordResolver resolver = new XBillDnsRecordResolver(primary, fallback, TIMEOUT);

        DnsCheckResult result = resolver.checkRecord("TXT", "_amazonses.example.com", "token-123");

        assertTrue(result.isVerified());
        assertEquals(XBillDnsRecordResolver.FALLBACK, result.getResolver());
        assertTrue(primary.queries > 0);
        assertTrue(fallback.queries > 0);
    }

    @Test
    void mxComparesTargetHost() throws Exception {
        StubResolver primary = new StubResolver();
        primary.add(new MXRecord(name("mail.example.com."), DClass.IN, 300, 10, name("feedback-smtp.us-east-1.amazonses.com.")));
        XBillDnsRecordResolver resolver = new XBillDnsRecordResolver(primary, null, TIMEOUT);

        assertTrue(resolver.checkRecord("MX", "mail.example.com", "feedback-smtp.us-east-1.amazonses.com").isVerified());
    }

    @Test
    void missingRecordIsNotFound() {
        XBillDnsRecordResolver resolver = new XBillDnsRecordResolver(new StubResolver(), new StubResolver(), TIMEOUT);

        DnsCheckResult result = resolver.checkRecord("CNAME", "nothing.example.com", "x");

        assertFalse(result.isFound());
        assertFalse(result.isVerified());
        assertNull(result.getActualValue());
    }

    @Test
    void unsupportedTypeIsNotQueried() {
        StubResolver primary = new StubResolver();
        XBillDnsRecordResolver resolver = new XBillDnsRecordResolver(primary, null, TIMEOUT);

        assertFalse(resolver.checkRecord("AAAA", "example.com", "::1").isFound());
        assertEquals(0, primary.queries);
    }

    @Test
    void normalizeTrimsDotsAndCase() {
        assertEquals("a.example.com", XBillDnsRecordResolver.normalize(" A.Example.com.. "));
        assertEquals("", XBillDnsRecordResolver.normalize(null));
    }

    private static Name name(String value) throws TextParseException {
        return Name.fromString(value);
    }

    /**
     * Resolver answering from a fixed record list.
     */
    private static class StubResolver implements Resolver {
        private final Map<String, List<Record>> records = new HashMap<>();
        private int queries;

        void add(Record record) {
            records.computeIfAbsent(key(record.getName(), record.getType()), k -> new ArrayList<>()).add(record);
        }

        private static String key(Name name, int type) {
            return name.toString().toLowerCase() + "/" + type;
        }

        @Override
        public Message send(Message query) {
            queries++;
            Record question = query.getQuestion();
            Message response = new Message(query.getHeader().getID());
            response.getHeader().setFlag(Flags.QR);
            response.addRecord(question, Section.QUESTION);

            List<Record> answers = records.get(key(question.getName(), question.getType()));
            if (answers == null) {
                response.getHeader().setRcode(question.getType() == Type.ANY ? Rcode.SERVFAIL : Rcode.NXDOMAIN);
            } else {
                answers.forEach(r -> response.addRecord(r, Section.ANSWER));
            }
            return response;
        }

        @Override
        public Object sendAsync(Message query, ResolverListener listener) {
            listener.receiveMessage(this, send(query));
            return null;
        }

        @Override
        public void setPort(int port) {}
        @Override
        public void setTCP(boolean flag) {}
        @Override
        public void setIgnoreTruncation(boolean flag) {}
        @Override
        public void setEDNS(int level) {}
        @Override
        public void setEDNS(int level, int payloadSize, int flags, List<EDNSOption> options) {}
        @Override
        public void setTSIGKey(TSIG key) {}
        @Override
        public void setTimeout(Duration timeout) {}
    }
}
