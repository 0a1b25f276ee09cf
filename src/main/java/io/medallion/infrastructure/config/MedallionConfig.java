package io.medallion.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Configuration collected from {@code MEDALLION_*} environment variables.
 *
 * <p>Building happens in two phases. {@link #fromEnviron(Map)} stages every recognized
 * variable into a nested mapping, with backend settings keyed by backend class name:
 * <pre>{@code
 * {"backend": {"module_class": "MemoryBackend", "MemoryBackend": {"filename": "/data.json"}}}
 * }</pre>
 * {@link #flattenBackend(Map)} then lifts the settings of the selected backend into the
 * {@code backend} section itself.
 */
public final class MedallionConfig {

    private static final Logger log = LoggerFactory.getLogger(MedallionConfig.class);

    static final String BACKEND_SECTION = "backend";
    static final String MODULE_CLASS = "module_class";

    private final Map<String, Object> staged;

    private MedallionConfig(Map<String, Object> staged) {
        this.staged = staged;
    }

    /**
     * Builds the configuration from an environment snapshot.
     * Variables that are not part of {@link EnvVar} are ignored.
     *
     * @param env variable name to value, typically {@code System.getenv()}
     * @throws ConfigurationException if a value cannot be converted to its type
     */
    public static MedallionConfig fromEnviron(Map<String, String> env) {
        Map<String, Object> staged = new LinkedHashMap<>();
        // Sorted so that the result does not depend on the map's iteration order
        for (Map.Entry<String, String> entry : new TreeMap<>(env).entrySet()) {
            String name = entry.getKey();
            if (!name.startsWith(EnvVar.PREFIX)) {
                continue;
            }
            EnvVar.forName(name).ifPresentOrElse(
                    envVar -> {
                        log.debug("Applying environment variable {}", name);
                        put(staged, envVar.getPath(), envVar.convert(entry.getValue()));
                    },
                    () -> log.debug("Ignoring unrecognized environment variable {}", name)
            );
        }
        return new MedallionConfig(staged);
    }

    /**
     * Returns the staged mapping, backend settings still nested by backend class name.
     */
    public Map<String, Object> asDict() {
        return ConfigMerger.copy(staged);
    }

    /**
     * Moves the settings of the selected backend up into the {@code backend} section.
     *
     * <p>If {@code backend.module_class} is {@code V} and {@code backend.V} is a mapping,
     * the entries of {@code backend.V} are copied into {@code backend}, replacing any
     * sibling with the same key, and {@code backend.V} is removed. Settings staged for
     * other backend classes are left in place.
     *
     * @param config merged configuration, not modified
     * @return a new mapping
     */
    public static Map<String, Object> flattenBackend(Map<String, ?> config) {
        Map<String, Object> result = ConfigMerger.copy(config);
        if (!(result.get(BACKEND_SECTION) instanceof Map)) {
            return result;
        }
        Map<String, Object> backend = ConfigMerger.asConfigMap((Map<?, ?>) result.get(BACKEND_SECTION));
        Object moduleClass = backend.get(MODULE_CLASS);
        if (!(moduleClass instanceof String) || !(backend.get(moduleClass) instanceof Map)) {
            return result;
        }

        Map<String, Object> selected = ConfigMerger.asConfigMap((Map<?, ?>) backend.get(moduleClass));
        Map<String, Object> flattened = new LinkedHashMap<>();
        backend.forEach((key, value) -> {
            if (!key.equals(moduleClass)) {
                flattened.put(key, value);
            }
        });
        flattened.putAll(selected);
        result.put(BACKEND_SECTION, flattened);
        log.debug("Flattened settings of backend {}", moduleClass);
        return result;
    }

    private static void put(Map<String, Object> root, List<String> path, Object value) {
        Map<String, Object> current = root;
        for (String key : path.subList(0, path.size() - 1)) {
            Object child = current.get(key);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                current.put(key, child);
            }
            current = ConfigMerger.asConfigMap((Map<?, ?>) child);
        }
        current.put(path.get(path.size() - 1), value);
    }

    @Override
    public String toString() {
        // Keys only, values may hold credentials
        return "MedallionConfig{sections=" + staged.keySet() + "}";
    }
}
