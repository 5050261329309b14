package com.selfmx.endpoints;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Request parsing and JSON helpers shared by the API handlers.
 *
 * <p>Bodies are decoded into plain maps (numbers become {@code Double}, as Gson does) and
 * read field by field with the converters below, so a missing or mistyped field surfaces
 * as null or a fallback rather than an exception.
 */
public final class ApiEndpointUtils {
    private static final Logger log = LogManager.getLogger(ApiEndpointUtils.class);

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();
    private static final Type OBJECT_TYPE = new TypeToken<LinkedHashMap<String, Object>>() { }.getType();

    private ApiEndpointUtils() {
    }

    /**
     * Gson used for responses; null fields are written so clients see every key.
     *
     * @return Gson.
     */
    public static Gson getGson() {
        return GSON;
    }

    static String readBody(InputStream is) throws IOException {
        try (InputStream in = is) {
            byte[] bytes = in.readAllBytes();
            log.debug("Read request body ({} bytes)", bytes.length);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * Decodes the query string. A repeated name keeps its first value.
     *
     * @param uri Request URI.
     * @return Parameters in request order.
     */
    public static Map<String, String> parseQuery(URI uri) {
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty() || pair.startsWith("=")) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = urlDecode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : urlDecode(pair.substring(eq + 1));
            params.putIfAbsent(name, value);
        }
        return params;
    }

    public static String urlDecode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    /**
     * Reads a JSON object body.
     *
     * @param is Body stream, closed afterwards.
     * @return Fields, empty for a blank body.
     * @throws IOException If the body is not a JSON object.
     */
    public static Map<String, Object> parseJsonBody(InputStream is) throws IOException {
        JsonElement root = parse(readBody(is));
        if (root.isJsonNull()) {
            return new LinkedHashMap<>();
        }
        if (!root.isJsonObject()) {
            throw new IOException("Invalid JSON body");
        }
        return GSON.fromJson(root, OBJECT_TYPE);
    }

    /**
     * Reads a JSON array of objects, as sent to batch routes.
     *
     * @param is Body stream, closed afterwards.
     * @return One map per element, empty for a blank body.
     * @throws IOException If the body is not an array or an element is not an object.
     */
    public static List<Map<String, Object>> parseJsonArrayBody(InputStream is) throws IOException {
        JsonElement root = parse(readBody(is));
        List<Map<String, Object>> items = new ArrayList<>();
        if (root.isJsonNull()) {
            return items;
        }
        if (!root.isJsonArray()) {
            throw new IOException("Invalid JSON body");
        }
        for (JsonElement element : root.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new IOException("Invalid JSON body");
            }
            items.add(GSON.fromJson(element, OBJECT_TYPE));
        }
        return items;
    }

    private static JsonElement parse(String body) throws IOException {
        if (body.isBlank()) {
            return JsonNull.INSTANCE;
        }
        try {
            return JsonParser.parseString(body);
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON body", e);
        }
    }

    /**
     * Accepts either a JSON array or a single string, as Resend does for address fields.
     *
     * @param value Field value.
     * @return Non-null items, empty for anything else.
     */
    public static List<String> toStringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(String::valueOf).collect(Collectors.toList());
        }
        if (value instanceof String s && !s.isBlank()) {
            return new ArrayList<>(List.of(s));
        }
        return new ArrayList<>();
    }

    public static Map<String, String> toStringMap(Object value) {
        Map<String, String> out = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    out.put(entry.getKey().toString(), entry.getValue().toString());
                }
            }
        }
        return out;
    }

    public static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * Integer view of a query or body value.
     *
     * @param value    Number, numeric string or null.
     * @param fallback Returned when the value is missing or not numeric.
     * @return Integer.
     */
    public static int toInt(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
