package com.selfmx.provider.cloudflare;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.selfmx.gateway.domain.DnsRecord;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Cloudflare DNS API client.
 *
 * <p>Records are created with automatic TTL and without proxying. Responses use the
 * {@code {success, errors[], result}} envelope.
 *
 * <p>Example usage:
 * <pre>
 * CloudflareDnsPublisher publisher = new CloudflareDnsPublisher.Builder()
 *     .withApiToken("token")
 *     .withZoneId("zone")
 *     .build();
 *
 * String id = publisher.createRecord(new DnsRecord("CNAME", "a._domainkey.example.com", "a.dkim.amazonses.com", 0));
 * </pre>
 */
public class CloudflareDnsPublisher implements DnsPublisher {
    private static final Logger log = LogManager.getLogger(CloudflareDnsPublisher.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    public static final String DEFAULT_BASE_URL = "https://api.cloudflare.com/client/v4/";
    private static final int DEFAULT_TIMEOUT = 30;
    private static final int PAGE_SIZE = 100;

    private final HttpUrl baseUrl;
    private final String apiToken;
    private final String zoneId;
    private final OkHttpClient httpClient;
    private final Gson gson;

    private CloudflareDnsPublisher(Builder builder) {
        this.baseUrl = Objects.requireNonNull(HttpUrl.parse(builder.baseUrl), "invalid base url");
        this.apiToken = Objects.requireNonNull(builder.apiToken, "apiToken must not be null");
        this.zoneId = Objects.requireNonNull(builder.zoneId, "zoneId must not be null");
        this.gson = new Gson();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(builder.timeout, TimeUnit.SECONDS)
                .readTimeout(builder.timeout, TimeUnit.SECONDS)
                .writeTimeout(builder.timeout, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String createRecord(DnsRecord record) throws DnsPublishException {
        log.info("Creating DNS record: {} {} -> {}", record.getType(), record.getName(), record.getValue());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", record.getType());
        payload.put("name", record.getName());
        payload.put("content", record.getValue());
        payload.put("ttl", 1);
        payload.put("proxied", false);
        if ("MX".equalsIgnoreCase(record.getType())) {
            payload.put("priority", record.getPriority());
        }

        Request request = authorized(recordsUrl().build())
                .post(RequestBody.create(gson.toJson(payload), JSON))
                .build();

        JsonObject envelope = execute(request, "create DNS record");
        JsonElement result = envelope.get("result");
        String id = result != null && result.isJsonObject() ? stringField(result.getAsJsonObject(), "id") : null;
        if (id == null || id.isEmpty()) {
            throw new DnsPublishException("Failed to create DNS record: response carries no record id");
        }
        log.info("DNS record created with id: {}", id);
        return id;
    }

    @Override
    public int deleteRecordsForDomain(String domain) throws DnsPublishException {
        log.info("Deleting all DNS records for domain: {}", domain);
        String name = domain.toLowerCase(Locale.ROOT);
        int deleted = 0;
        for (JsonObject record : listRecords()) {
            String recordName = Objects.toString(stringField(record, "name"), "").toLowerCase(Locale.ROOT);
            if (belongsTo(recordName, name)) {
                if (deleteRecord(stringField(record, "id"))) {
                    deleted++;
                }
            }
        }
        log.info("Deleted {} DNS records for {}", deleted, domain);
        return deleted;
    }

    /**
     * Checks whether a record name is the domain itself or one of its subdomains
     * (DKIM selectors included).
     */
    static boolean belongsTo(String recordName, String domain) {
        return recordName.equals(domain)
                || recordName.endsWith("._domainkey." + domain)
                || recordName.endsWith("." + domain);
    }

    /**
     * Lists the first page of zone records.
     *
     * @return Raw record objects.
     * @throws DnsPublishException on failure.
     */
    List<JsonObject> listRecords() throws DnsPublishException {
        Request request = authorized(recordsUrl()
                .addQueryParameter("per_page", String.valueOf(PAGE_SIZE))
                .build())
                .get()
                .build();

        JsonObject envelope = execute(request, "list DNS records");
        List<JsonObject> records = new ArrayList<>();
        JsonElement result = envelope.get("result");
        if (result != null && result.isJsonArray()) {
            for (JsonElement element : result.getAsJsonArray()) {
                if (element.isJsonObject() && stringField(element.getAsJsonObject(), "id") != null) {
                    records.add(element.getAsJsonObject());
                }
            }
        }
        return records;
    }

    private boolean deleteRecord(String recordId) {
        Request request = authorized(recordsUrl().addPathSegment(recordId).build()).delete().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String body = response.body() != null ? response.body().string() : "";
                log.warn("Failed to delete DNS record {}: {} {}", recordId, response.code(), body);
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to delete DNS record {}: {}", recordId, e.getMessage());
            return false;
        }
    }

    private JsonObject execute(Request request, String operation) throws DnsPublishException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            JsonObject envelope = parse(body);
            JsonElement flag = envelope != null ? envelope.get("success") : null;
            boolean success = flag != null && flag.isJsonPrimitive()
                    && flag.getAsJsonPrimitive().isBoolean() && flag.getAsBoolean();
            if (!response.isSuccessful() || !success) {
                String errors = errors(envelope);
                log.error("Failed to {}: status={}, errors={}", operation, response.code(), errors);
                throw new DnsPublishException("Failed to " + operation + ": " + errors);
            }
            return envelope;
        } catch (IOException e) {
            throw new DnsPublishException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private JsonObject parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonElement element = gson.fromJson(body, JsonElement.class);
            return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            log.debug("Unparseable Cloudflare response: {}", e.getMessage());
            return null;
        }
    }

    private static String errors(JsonObject envelope) {
        if (envelope == null || !envelope.has("errors") || !envelope.get("errors").isJsonArray()) {
            return "Unknown error";
        }
        JsonArray array = envelope.getAsJsonArray("errors");
        List<String> messages = new ArrayList<>();
        for (JsonElement element : array) {
            String message = element.isJsonObject() ? stringField(element.getAsJsonObject(), "message") : null;
            if (message != null) {
                messages.add(message);
            }
        }
        return messages.isEmpty() ? "Unknown error" : String.join(", ", messages);
    }

    /**
     * Reads a scalar member, null when it is missing, JSON null or not a primitive.
     */
    private static String stringField(JsonObject object, String name) {
        JsonElement value = object.get(name);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private HttpUrl.Builder recordsUrl() {
        return baseUrl.newBuilder()
                .addPathSegment("zones")
                .addPathSegment(zoneId)
                .addPathSegment("dns_records");
    }

    private Request.Builder authorized(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + apiToken);
    }

    /**
     * Builder for CloudflareDnsPublisher.
     */
    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String apiToken;
        private String zoneId;
        private int timeout = DEFAULT_TIMEOUT;

        /**
         * Sets the API base URL, ending with a slash.
         *
         * @param baseUrl Base URL.
         * @return Builder instance.
         */
        public Builder withBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder withApiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder withZoneId(String zoneId) {
            this.zoneId = zoneId;
            return this;
        }

        /**
         * Sets connect, read and write timeouts.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withTimeout(int timeout) {
            this.timeout = timeout;
            return this;
        }

        public CloudflareDnsPublisher build() {
            return new CloudflareDnsPublisher(this);
        }
    }
}
