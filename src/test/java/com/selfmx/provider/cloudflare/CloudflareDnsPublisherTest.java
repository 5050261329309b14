package com.selfmx.provider.cloudflare;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.selfmx.gateway.domain.DnsRecord;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CloudflareDnsPublisherTest {

    private MockWebServer server;
    private CloudflareDnsPublisher publisher;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        publisher = new CloudflareDnsPublisher.Builder()
                .withBaseUrl(server.url("/client/v4/").toString())
                .withApiToken("cf-token")
                .withZoneId("zone-1")
                .withTimeout(5)
                .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Test
    void createRecordPostsCnameWithAutoTtl() throws Exception {
        server.enqueue(json(200, "{\"success\":true,\"errors\":[],\"result\":{\"id\":\"rec-1\"}}"));

        String id = publisher.createRecord(new DnsRecord("CNAME", "a._domainkey.example.com", "a.dkim.amazonses.com", 0));

        assertEquals("rec-1", id);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals("/client/v4/zones/zone-1/dns_records", request.getPath());
        assertEquals("Bearer cf-token", request.getHeader("Authorization"));

        JsonObject body = new Gson().fromJson(request.getBody().readUtf8(), JsonObject.class);
        assertEquals("CNAME", body.get("type").getAsString());
        assertEquals("a._domainkey.example.com", body.get("name").getAsString());
        assertEquals("a.dkim.amazonses.com", body.get("content").getAsString());
        assertEquals(1, body.get("ttl").getAsInt());
        assertFalse(body.get("proxied").getAsBoolean());
        assertFalse(body.has("priority"));
    }

    @Test
    void mxRecordCarriesPriority() throws Exception {
        server.enqueue(json(200, "{\"success\":true,\"result\":{\"id\":\"rec-mx\"}}"));

        publisher.createRecord(new DnsRecord("MX", "mail.example.com", "feedback-smtp.us-east-1.amazonses.com", 10));

        JsonObject body = new Gson().fromJson(server.takeRequest().getBody().readUtf8(), JsonObject.class);
        assertEquals(10, body.get("priority").getAsInt());
    }

    @Test
    void createFailureCarriesProviderErrors() {
        server.enqueue(json(400, "{\"success\":false,\"errors\":[{\"code\":81057,\"message\":\"Record already exists.\"}]}"));

        DnsPublishException e = assertThrows(DnsPublishException.class,
                () -> publisher.createRecord(new DnsRecord("CNAME", "x.example.com", "y", 0)));
        assertTrue(e.getMessage().contains("Record already exists."));
    }

    @Test
    void unsuccessfulEnvelopeOn200IsAFailure() {
        server.enqueue(json(200, "{\"success\":false,\"errors\":[]}"));

        DnsPublishException e = assertThrows(DnsPublishException.class,
                () -> publisher.createRecord(new DnsRecord("CNAME", "x.example.com", "y", 0)));
        assertTrue(e.getMessage().contains("Unknown error"));
    }

    @Test
    void malformedEnvelopesAreFailures() {
        server.enqueue(json(200, "{\"success\":null,\"result\":{}}"));
        server.enqueue(json(200, "{\"success\":\"yes\",\"result\":{\"id\":\"rec-1\"}}"));
        server.enqueue(json(200, "{\"success\":true,\"result\":{\"id\":null}}"));
        server.enqueue(json(200, "{\"success\":true,\"result\":{\"id\":{\"nested\":1}}}"));
        server.enqueue(json(400, "{\"success\":false,\"errors\":[{\"message\":null},\"oops\"]}"));
        server.enqueue(json(200, "[true]"));

        DnsRecord record = new DnsRecord("CNAME", "x.example.com", "y", 0);
        for (int i = 0; i < 6; i++) {
            assertThrows(DnsPublishException.class, () -> publisher.createRecord(record));
        }
    }

    @Test
    void deleteSkipsListedRecordsWithoutUsableId() throws Exception {
        server.enqueue(json(200, "{\"success\":true,\"result\":["
                + "{\"id\":null,\"name\":\"example.com\"},"
                + "{\"id\":\"r2\",\"name\":null},"
                + "{\"id\":\"r3\",\"name\":\"example.com\"}]}"));
        server.enqueue(json(200, "{\"success\":true,\"result\":{\"id\":\"r3\"}}"));

        assertEquals(1, publisher.deleteRecordsForDomain("example.com"));
        server.takeRequest();
        assertEquals("/client/v4/zones/zone-1/dns_records/r3", server.takeRequest().getPath());
    }

    @Test
    void deleteRemovesOnlyRecordsOfTheDomain() throws Exception {
        server.enqueue(json(200, "{\"success\":true,\"result\":["
                + "{\"id\":\"r1\",\"name\":\"a._domainkey.Example.com\"},"
                + "{\"id\":\"r2\",\"name\":\"example.com\"},"
                + "{\"id\":\"r3\",\"name\":\"notexample.com\"},"
                + "{\"id\":\"r4\",\"name\":\"mail.example.com\"}]}"));
        server.enqueue(json(200, "{\"success\":true,\"result\":{\"id\":\"r1\"}}"));
        server.enqueue(json(200, "{\"success\":true,\"result\":{\"id\":\"r2\"}}"));
        server.enqueue(json(500, "{\"success\":false}"));

        int deleted = publisher.deleteRecordsForDomain("example.com");

        assertEquals(2, deleted);
        assertEquals("/client/v4/zones/zone-1/dns_records?per_page=100", server.takeRequest().getPath());
        RecordedRequest first = server.takeRequest();
        assertEquals("DELETE", first.getMethod());
        assertEquals("/client/v4/zones/zone-1/dns_records/r1", first.getPath());
        assertEquals("/client/v4/zones/zone-1/dns_records/r2", server.takeRequest().getPath());
        assertEquals("/client/v4/zones/zone-1/dns_records/r4", server.takeRequest().getPath());
        assertEquals(4, server.getRequestCount());
    }

    @Test
    void deleteFailsWhenListingFails() {
        server.enqueue(json(403, "{\"success\":false,\"errors\":[{\"message\":\"Authentication error\"}]}"));

        assertThrows(DnsPublishException.class, () -> publisher.deleteRecordsForDomain("example.com"));
    }

    @Test
    void belongsToMatchesDomainAndSubdomains() {
        assertTrue(CloudflareDnsPublisher.belongsTo("example.com", "example.com"));
        assertTrue(CloudflareDnsPublisher.belongsTo("sel._domainkey.example.com", "example.com"));
        assertTrue(CloudflareDnsPublisher.belongsTo("mail.example.com", "example.com"));
        assertFalse(CloudflareDnsPublisher.belongsTo("badexample.com", "example.com"));
        assertFalse(CloudflareDnsPublisher.belongsTo("example.com.evil.net", "example.com"));
    }
}
