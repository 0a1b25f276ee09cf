package io.medallion.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads configuration from JSON files on disk.
 *
 * Supports:
 * - A single configuration file
 * - A directory of {@code *.conf} files, merged in file name order
 * - Silently skipping the default locations when they do not exist
 *
 * Every file must hold a JSON object at the top level so that sources can be merged.
 */
public final class FileConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(FileConfigLoader.class);

    static final String CONF_FILE_GLOB = "*.conf";

    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_MAP_TYPE =
            new TypeReference<>() {
            };

    private final Path defaultConfFile;
    private final Path defaultConfDir;
    private final ObjectMapper objectMapper;

    public FileConfigLoader(Path defaultConfFile, Path defaultConfDir) {
        this.defaultConfFile = defaultConfFile;
        this.defaultConfDir = defaultConfDir;
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Loads and merges the file and directory sources.
     *
     * Directory content overrides the single file on key collision.
     *
     * @param confFile configuration file, or null to skip it
     * @param confDir  configuration directory, or null to skip it
     * @return the merged configuration, empty when no source contributes
     * @throws ConfigurationException if a source is missing, unreadable or malformed
     */
    public Map<String, Object> load(Path confFile, Path confDir) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (confFile != null && isPresent(confFile, defaultConfFile)) {
            config = ConfigMerger.deepMerge(config, loadFile(confFile));
        }
        if (confDir != null && isPresent(confDir, defaultConfDir)) {
            config = ConfigMerger.deepMerge(config, loadDirectory(confDir));
        }
        return config;
    }

    /**
     * Parses a single configuration file.
     *
     * @throws ConfigurationException if the file is not a JSON object
     */
    public Map<String, Object> loadFile(Path file) {
        log.info("Loading configuration from file: {}", file);
        JsonNode root;
        // Jackson decodes the bytes itself so bad encodings surface as parse errors
        try (InputStream in = Files.newInputStream(file)) {
            root = objectMapper.readValue(in, JsonNode.class);
        } catch (JsonProcessingException e) {
            throw ConfigurationException.invalidJson(file, e);
        } catch (IOException e) {
            throw ConfigurationException.readFailed(file, e);
        }

        if (root == null || !root.isObject()) {
            JsonNodeType actual = root == null ? JsonNodeType.NULL : root.getNodeType();
            throw ConfigurationException.notAnObject(file, actual);
        }
        return objectMapper.convertValue(root, CONFIG_MAP_TYPE);
    }

    /**
     * Parses every {@code *.conf} file in a directory and merges them.
     * Later file names override earlier ones.
     */
    public Map<String, Object> loadDirectory(Path dir) {
        log.info("Loading configuration from directory: {}", dir);
        Map<String, Object> config = new LinkedHashMap<>();
        for (Path file : listConfigFiles(dir)) {
            config = ConfigMerger.deepMerge(config, loadFile(file));
        }
        return config;
    }

    private List<Path> listConfigFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, CONF_FILE_GLOB)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    files.add(entry);
                } else {
                    log.debug("Skipping non-file entry in config directory: {}", entry);
                }
            }
        } catch (IOException e) {
            throw ConfigurationException.readFailed(dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    /**
     * Returns true if the source should be read. A missing default location is skipped,
     * any other missing location is an error.
     */
    private boolean isPresent(Path source, Path defaultSource) {
        if (Files.exists(source)) {
            return true;
        }
        if (isSamePath(source, defaultSource)) {
            log.debug("Default configuration source not present, skipping: {}", source);
            return false;
        }
        throw ConfigurationException.notFound(source);
    }

    private static boolean isSamePath(Path a, Path b) {
        return b != null && a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }

    public Path getDefaultConfFile() {
        return defaultConfFile;
    }

    public Path getDefaultConfDir() {
        return defaultConfDir;
    }
}
