package com.phillippitts.mediametric.identity;

import com.phillippitts.mediametric.domain.FrameCallback;
import com.phillippitts.mediametric.exception.ConfigurationException;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Canonical identity of a computation configuration.
 *
 * <p>The id has the form {@code type_version} followed by {@code _key_value} for every
 * result-affecting optional parameter, keys sorted. It is the cache-key prefix and the label
 * written as the first line of every score log, so it must be stable across processes.
 *
 * @param type             computation type, e.g. {@code PSNR}
 * @param version          computation version string
 * @param normalizedParams sorted, rendered optional parameters
 */
public record ExecutorIdentity(String type, String version, Map<String, String> normalizedParams) {

    public ExecutorIdentity {
        requireToken(type, "type");
        requireToken(version, "version");
        normalizedParams = Map.copyOf(normalizedParams);
    }

    /**
     * Builds an identity from raw optional parameters. Key order is irrelevant.
     *
     * @param type    computation type
     * @param version computation version
     * @param params  optional parameters that affect the result; may be null or empty
     * @throws ConfigurationException if two parameter names render to the same key
     */
    public static ExecutorIdentity of(String type, String version, Map<String, ?> params) {
        Map<String, String> rendered = new TreeMap<>();
        if (params != null) {
            Map<String, String> sourceKeys = new HashMap<>();
            params.forEach((k, v) -> {
                String key = sanitize(k);
                String clash = sourceKeys.putIfAbsent(key, k);
                if (clash != null) {
                    throw new ConfigurationException("Optional parameters '" + clash + "' and '" + k
                            + "' both render as '" + key + "' in the executor id");
                }
                rendered.put(key, sanitize(render(v)));
            });
        }
        return new ExecutorIdentity(type, version, rendered);
    }

    /**
     * Canonical id string.
     */
    public String id() {
        StringBuilder sb = new StringBuilder(type).append('_').append(version);
        new TreeMap<>(normalizedParams).forEach((k, v) -> sb.append('_').append(k).append('_').append(v));
        return sb.toString();
    }

    @Override
    public String toString() {
        return id();
    }

    static String render(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof FrameCallback cb) {
            return cb.name();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, String> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), render(v)));
            return sorted.entrySet().stream()
                    .map(e -> e.getKey() + "_" + e.getValue())
                    .collect(Collectors.joining("_"));
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(ExecutorIdentity::render).collect(Collectors.joining("_"));
        }
        return String.valueOf(value);
    }

    /**
     * Replaces characters that would collide with path separators or quoting.
     */
    static String sanitize(String s) {
        return s.replace('\'', '_').replace(' ', '_').replace('/', '_').replace('\\', '_');
    }

    private static void requireToken(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
