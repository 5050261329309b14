package com.selfmx.gateway.domain;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes the ordered DNS record set stored in {@code domains.dns_records}.
 */
public final class DnsRecordCodec {

    private static final Gson GSON = new Gson();
    private static final Type LIST_TYPE = new TypeToken<List<DnsRecord>>() {}.getType();

    private DnsRecordCodec() {
        // Utility class.
    }

    /**
     * Encodes records as a JSON array.
     *
     * @param records Records, may be null.
     * @return JSON or null.
     */
    public static String encode(List<DnsRecord> records) {
        return records == null ? null : GSON.toJson(records, LIST_TYPE);
    }

    /**
     * Decodes a JSON array into records, preserving order.
     *
     * @param json JSON, may be null.
     * @return Records or null.
     */
    public static List<DnsRecord> decode(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            List<DnsRecord> records = GSON.fromJson(json, LIST_TYPE);
            return records != null ? new ArrayList<>(records) : new ArrayList<>();
        } catch (JsonParseException e) {
            throw new IllegalStateException("Stored DNS records are not valid JSON", e);
        }
    }
}
