package io.medallion.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolves the server configuration.
 *
 * Sources, lowest precedence first:
 * - The configuration file ({@link #DEFAULT_CONFFILE} unless specified)
 * - The {@code *.conf} files of the configuration directory ({@link #DEFAULT_CONFDIR} unless specified)
 * - {@code MEDALLION_*} environment variables
 *
 * Instances hold no mutable state and can be shared between threads.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final Path DEFAULT_CONFFILE = Paths.get("/etc/medallion.conf");
    public static final Path DEFAULT_CONFDIR = Paths.get("/etc/medallion.d/");

    private final FileConfigLoader fileLoader;
    private final Supplier<Map<String, String>> environment;

    public ConfigLoader() {
        this(DEFAULT_CONFFILE, DEFAULT_CONFDIR, System::getenv);
    }

    /**
     * @param defaultConfFile file location whose absence is tolerated
     * @param defaultConfDir  directory location whose absence is tolerated
     * @param environment     supplies the environment snapshot for each resolution
     */
    public ConfigLoader(Path defaultConfFile, Path defaultConfDir, Supplier<Map<String, String>> environment) {
        this.fileLoader = new FileConfigLoader(defaultConfFile, defaultConfDir);
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Loads configuration from the default file and directory plus the environment.
     */
    public Map<String, Object> load() {
        return load(fileLoader.getDefaultConfFile(), fileLoader.getDefaultConfDir());
    }

    /**
     * Loads configuration from the given sources plus the environment.
     *
     * @param confFile configuration file, or null to skip file loading
     * @param confDir  configuration directory, or null to skip directory loading
     * @return a new mapping owned by the caller
     * @throws ConfigurationException if any source is missing or malformed
     */
    public Map<String, Object> load(Path confFile, Path confDir) {
        Map<String, Object> fileConfig = fileLoader.load(confFile, confDir);
        Map<String, Object> envConfig = MedallionConfig.fromEnviron(Map.copyOf(environment.get())).asDict();

        Map<String, Object> config = MedallionConfig.flattenBackend(
                ConfigMerger.deepMerge(fileConfig, envConfig)
        );
        log.info("Configuration resolved with sections: {}", config.keySet());
        return config;
    }

    /**
     * Loads configuration from an explicit file, keeping the default directory.
     */
    public Map<String, Object> loadFile(Path confFile) {
        return load(confFile, fileLoader.getDefaultConfDir());
    }

    /**
     * Loads configuration from an explicit directory, keeping the default file.
     */
    public Map<String, Object> loadDirectory(Path confDir) {
        return load(fileLoader.getDefaultConfFile(), confDir);
    }

    public Path getDefaultConfFile() {
        return fileLoader.getDefaultConfFile();
    }

    public Path getDefaultConfDir() {
        return fileLoader.getDefaultConfDir();
    }

    /**
     * Resolves configuration from the default locations and the process environment.
     */
    public static Map<String, Object> loadConfig() {
        return new ConfigLoader().load();
    }

    /**
     * Resolves configuration from the given locations and the process environment.
     */
    public static Map<String, Object> loadConfig(Path confFile, Path confDir) {
        return new ConfigLoader().load(confFile, confDir);
    }
}
