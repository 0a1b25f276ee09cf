package io.medallion.infrastructure.config;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Environment variables recognized by the configuration layer.
 *
 * The constant name is the variable name without the {@code MEDALLION_} prefix.
 * Backend settings are staged under the backend class name they apply to and are
 * flattened into {@code backend} once {@code module_class} is known.
 */
public enum EnvVar {
    TAXII_MAX_PAGE_SIZE(ValueType.INTEGER, "taxii", "max_page_size"),
    TAXII_INTEROP_REQUIREMENTS(ValueType.BOOLEAN, "taxii", "interop_requirements"),

    BACKEND_MODULE_CLASS(ValueType.STRING, "backend", "module_class"),
    BACKEND_MEMORY_FILENAME(ValueType.STRING, "backend", Backends.MEMORY, "filename"),
    BACKEND_MEMORY_INTEROP_REQUIREMENTS(ValueType.BOOLEAN, "backend", Backends.MEMORY, "interop_requirements"),
    BACKEND_MONGO_URI(ValueType.STRING, "backend", Backends.MONGO, "uri");

    public static final String PREFIX = "MEDALLION_";

    private static final Map<String, EnvVar> BY_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(EnvVar::variableName, Function.identity()));

    private final ValueType type;
    private final List<String> path;

    EnvVar(ValueType type, String... path) {
        this.type = type;
        this.path = List.of(path);
    }

    /**
     * Full variable name, e.g. {@code MEDALLION_TAXII_MAX_PAGE_SIZE}.
     */
    public String variableName() {
        return PREFIX + name();
    }

    public ValueType getType() {
        return type;
    }

    /**
     * Key path of the value inside the staged configuration mapping.
     */
    public List<String> getPath() {
        return path;
    }

    /**
     * Looks up a variable by its full name.
     */
    public static Optional<EnvVar> forName(String variableName) {
        return Optional.ofNullable(BY_NAME.get(variableName));
    }

    /**
     * Converts the raw environment string to the variable's declared type.
     *
     * @throws ConfigurationException if the value cannot be converted
     */
    public Object convert(String raw) {
        return switch (type) {
            case STRING -> raw;
            case INTEGER -> parseInteger(raw);
            case BOOLEAN -> parseBoolean(raw);
        };
    }

    private Object parseInteger(String raw) {
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(ConfigurationException.Reason.INVALID_VALUE,
                    variableName() + " must be an integer, got '" + raw + "'", e);
        }
    }

    private Object parseBoolean(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "y", "1" -> Boolean.TRUE;
            case "false", "no", "n", "0" -> Boolean.FALSE;
            default -> throw new ConfigurationException(ConfigurationException.Reason.INVALID_VALUE,
                    variableName() + " must be a boolean, got '" + raw + "'");
        };
    }

    public enum ValueType {
        STRING,
        INTEGER,
        BOOLEAN
    }

    /**
     * Backend class names used as staging keys.
     */
    static final class Backends {
        static final String MEMORY = "MemoryBackend";
        static final String MONGO = "MongoBackend";

        private Backends() {
        }
    }
}
