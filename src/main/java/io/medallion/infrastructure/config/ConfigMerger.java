package io.medallion.infrastructure.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recursive merge of configuration mappings.
 *
 * Neither argument is modified; nested mappings are copied into the result so the
 * caller can mutate it freely.
 */
public final class ConfigMerger {

    private ConfigMerger() {
        // Utility class
    }

    /**
     * Merges {@code override} onto {@code base}.
     *
     * When both sides hold a mapping under the same key, the two are merged recursively.
     * Otherwise the override value replaces the base value. Keys present on only one side
     * are kept.
     *
     * @param base     lower-precedence mapping
     * @param override higher-precedence mapping
     * @return a new mapping
     */
    public static Map<String, Object> deepMerge(Map<String, ?> base, Map<String, ?> override) {
        Map<String, Object> merged = copy(base);
        for (Map.Entry<String, ?> entry : override.entrySet()) {
            Object current = merged.get(entry.getKey());
            Object incoming = entry.getValue();
            if (current instanceof Map && incoming instanceof Map) {
                merged.put(entry.getKey(), deepMerge(
                        asConfigMap((Map<?, ?>) current),
                        asConfigMap((Map<?, ?>) incoming)
                ));
            } else {
                merged.put(entry.getKey(), copyValue(incoming));
            }
        }
        return merged;
    }

    /**
     * Deep copy of the mapping structure. Leaf values are shared.
     */
    public static Map<String, Object> copy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return copy(asConfigMap((Map<?, ?>) value));
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asConfigMap(Map<?, ?> map) {
        // Config mappings are only ever built from JSON objects and the env table
        return (Map<String, Object>) map;
    }
}
