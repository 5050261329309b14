package com.selfmx.config;

import com.google.gson.Gson;
import com.google.gson.Strictness;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Configuration file loader.
 *
 * <p>Reads JSON5 files with Gson in lenient mode so comments and unquoted keys are accepted.
 * <p>String values may reference environment variables as <code>{$NAME}</code>.
 * Unresolved references are left untouched.
 */
public class ConfigFoundation extends BasicConfig {

    private static final Pattern ENV_PATTERN = Pattern.compile("\\{\\$([A-Za-z0-9_]+)}");
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Constructs a new ConfigFoundation instance with an empty map.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance from a file.
     *
     * @param path Path to JSON5 file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(parse(Files.readString(Path.of(path), StandardCharsets.UTF_8), System::getenv));
    }

    /**
     * Parses JSON5 text into a map resolving environment references.
     *
     * @param json     JSON5 text.
     * @param resolver Environment lookup.
     * @return Map.
     * @throws IOException Invalid syntax.
     */
    public static Map<String, Object> parse(String json, Function<String, String> resolver) throws IOException {
        try {
            JsonReader reader = new JsonReader(new StringReader(json));
            reader.setStrictness(Strictness.LENIENT);
            Map<String, Object> map = new Gson().fromJson(reader, MAP_TYPE);
            return map != null ? resolve(map, resolver) : new HashMap<>();
        } catch (RuntimeException e) {
            throw new IOException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T resolve(T value, Function<String, String> resolver) {
        if (value instanceof String s) {
            Matcher matcher = ENV_PATTERN.matcher(s);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                String env = resolver.apply(matcher.group(1));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(env != null ? env : matcher.group()));
            }
            matcher.appendTail(sb);
            return (T) sb.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new HashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), resolve(entry.getValue(), resolver));
            }
            return (T) out;
        }
        if (value instanceof List<?> list) {
            return (T) list.stream().map(item -> resolve(item, resolver)).toList();
        }
        return value;
    }
}
