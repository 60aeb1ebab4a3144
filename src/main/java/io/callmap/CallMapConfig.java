package io.callmap;

import io.callmap.analysis.OriginFilter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration loaded from YAML.
 * <p>
 * Defaults ship as {@code /callmap-defaults.yaml} on the classpath. Project files
 * are merged over them: list values are combined, scalar values replace the default.
 */
public class CallMapConfig {

    private static final String DEFAULT_CONFIG = "/callmap-defaults.yaml";

    private static final List<String> LIST_KEYS = List.of("systemPrefixes", "systemFragments", "includes", "flags");
    private static final List<String> SCALAR_KEYS = List.of("clang", "parseTimeoutSeconds", "compiler");

    private final Map<String, Object> values;

    private CallMapConfig(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static CallMapConfig loadDefault() {
        try (InputStream is = CallMapConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static CallMapConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads configuration from an input stream. Unknown keys are ignored.
     *
     * @throws IllegalArgumentException If a known key has a value of the wrong shape
     */
    public static CallMapConfig load(InputStream is) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(is);
        if (document == null) {
            return new CallMapConfig(Map.of());
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Configuration must be a YAML mapping");
        }

        Map<String, Object> values = new HashMap<>();
        for (String key : LIST_KEYS) {
            if (map.containsKey(key)) {
                values.put(key, toStringList(key, map.get(key)));
            }
        }
        for (String key : SCALAR_KEYS) {
            Object value = map.get(key);
            if (value != null) {
                values.put(key, value);
            }
        }
        return new CallMapConfig(values);
    }

    private static List<String> toStringList(String key, Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return List.copyOf(result);
    }

    /**
     * Merges this configuration with another, with the other taking precedence.
     */
    public CallMapConfig merge(CallMapConfig other) {
        Map<String, Object> merged = new HashMap<>(values);
        for (String key : LIST_KEYS) {
            Set<String> combined = new LinkedHashSet<>(getList(key));
            combined.addAll(other.getList(key));
            merged.put(key, List.copyOf(combined));
        }
        for (String key : SCALAR_KEYS) {
            if (other.values.containsKey(key)) {
                merged.put(key, other.values.get(key));
            }
        }
        return new CallMapConfig(merged);
    }

    @SuppressWarnings("unchecked")
    private List<String> getList(String key) {
        Object value = values.get(key);
        return value instanceof List<?> ? (List<String>) value : List.of();
    }

    private String getString(String key, String fallback) {
        Object value = values.get(key);
        return value != null ? value.toString() : fallback;
    }

    public List<String> getSystemPrefixes() {
        return getList("systemPrefixes");
    }

    public List<String> getSystemFragments() {
        return getList("systemFragments");
    }

    public List<String> getIncludes() {
        return getList("includes");
    }

    public List<String> getFlags() {
        return getList("flags");
    }

    public String getClang() {
        return getString("clang", "clang");
    }

    public String getCompiler() {
        return getString("compiler", "clang++");
    }

    /**
     * @throws IllegalArgumentException If the configured value is not a positive whole number
     */
    public long getParseTimeoutSeconds() {
        Object value = values.get("parseTimeoutSeconds");
        if (value == null) {
            return 120;
        }
        long seconds;
        if (value instanceof Number n) {
            seconds = n.longValue();
        } else {
            try {
                seconds = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'parseTimeoutSeconds' must be a number: " + value, e);
            }
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("'parseTimeoutSeconds' must be positive: " + value);
        }
        return seconds;
    }

    /**
     * Origin filter built from the system prefixes and fragments.
     */
    public OriginFilter originFilter() {
        return new OriginFilter(getSystemPrefixes(), getSystemFragments());
    }
}
