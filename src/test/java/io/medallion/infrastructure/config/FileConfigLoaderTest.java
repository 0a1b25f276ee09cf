package io.medallion.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path confDir;
    private Path confFile;
    private FileConfigLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        confDir = Files.createDirectory(tempDir.resolve("medallion.d"));
        confFile = confDir.resolve("medallion.conf");
        // Defaults point at locations that never exist
        loader = new FileConfigLoader(tempDir.resolve("default.conf"), tempDir.resolve("default.d"));
    }

    @Nested
    @DisplayName("JSON objects")
    class JsonObjects {

        @Test
        @DisplayName("should load nested object from file and from directory")
        void shouldLoadNestedObject() throws IOException {
            write(confFile, "{\"foo\": {\"bar\": [\"baz\"]}, \"count\": 3, \"enabled\": true}");
            Map<String, Object> expected = Map.of(
                    "foo", Map.of("bar", List.of("baz")),
                    "count", 3,
                    "enabled", true
            );

            assertThat(loader.load(confFile, null)).isEqualTo(expected);
            assertThat(loader.load(null, confDir)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should load empty object as empty mapping")
        void shouldLoadEmptyObject() throws IOException {
            write(confFile, "{}");

            assertThat(loader.load(confFile, null)).isEmpty();
            assertThat(loader.load(null, confDir)).isEmpty();
        }

        @Test
        @DisplayName("should keep JSON null values inside an object")
        void shouldKeepNullValues() throws IOException {
            write(confFile, "{\"foo\": null}");

            assertThat(loader.loadFile(confFile)).containsEntry("foo", null);
        }
    }

    @Nested
    @DisplayName("Rejected content")
    class RejectedContent {

        @ParameterizedTest
        @ValueSource(strings = {"[]", "[\"foo\", \"bar\"]", "\"\"", "42", "true", "null"})
        @DisplayName("should reject top-level values other than objects")
        void shouldRejectNonObjects(String content) throws IOException {
            write(confFile, content);

            assertTypeMismatch(() -> loader.load(confFile, null));
            assertTypeMismatch(() -> loader.load(null, confDir));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "", "[,]", "{,}", "'wrong quotes'", "{missing: quotes}",
                "{\"trailing\": \"comma\",}", "\u007FELFverywrong", "{} {}"
        })
        @DisplayName("should reject invalid JSON with parse error as cause")
        void shouldRejectInvalidJson(String content) throws IOException {
            write(confFile, content);

            assertInvalidFormat(() -> loader.load(confFile, null));
            assertInvalidFormat(() -> loader.load(null, confDir));
        }

        @Test
        @DisplayName("should reject bytes that are not valid UTF-8")
        void shouldRejectInvalidEncoding() throws IOException {
            Files.write(confFile, new byte[]{'{', '"', (byte) 0xC3, (byte) 0x28, '"', ':', '1', '}'});

            assertInvalidFormat(() -> loader.loadFile(confFile));
        }

        private void assertTypeMismatch(Runnable load) {
            assertThatThrownBy(load::run)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("must contain a JSON object")
                    .extracting(e -> ((ConfigurationException) e).getReason())
                    .isEqualTo(ConfigurationException.Reason.TYPE_MISMATCH);
        }

        private void assertInvalidFormat(Runnable load) {
            assertThatThrownBy(load::run)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Invalid JSON")
                    .hasCauseInstanceOf(JsonProcessingException.class)
                    .extracting(e -> ((ConfigurationException) e).getReason())
                    .isEqualTo(ConfigurationException.Reason.INVALID_FORMAT);
        }
    }

    @Nested
    @DisplayName("Missing sources")
    class MissingSources {

        @Test
        @DisplayName("should skip missing default file and directory")
        void shouldSkipMissingDefaults() {
            assertThat(loader.load(loader.getDefaultConfFile(), loader.getDefaultConfDir())).isEmpty();
        }

        @Test
        @DisplayName("should treat equivalent spelling of default path as default")
        void shouldNormalizeDefaultPath() {
            Path spelled = tempDir.resolve("medallion.d").resolve("..").resolve("default.conf");

            assertThat(loader.load(spelled, null)).isEmpty();
        }

        @Test
        @DisplayName("should fail on missing non-default file with path in message")
        void shouldFailOnMissingFile() {
            Path missing = tempDir.resolve("missing.conf");

            assertThatThrownBy(() -> loader.load(missing, null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("'" + missing + "'")
                    .extracting(e -> ((ConfigurationException) e).getReason())
                    .isEqualTo(ConfigurationException.Reason.NOT_FOUND);
        }

        @Test
        @DisplayName("should fail on missing non-default directory with path in message")
        void shouldFailOnMissingDirectory() {
            Path missing = tempDir.resolve("missing.d");

            assertThatThrownBy(() -> loader.load(null, missing))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("'" + missing + "'")
                    .extracting(e -> ((ConfigurationException) e).getReason())
                    .isEqualTo(ConfigurationException.Reason.NOT_FOUND);
        }

        @Test
        @DisplayName("should skip both sources when null")
        void shouldSkipNullSources() {
            assertThat(loader.load(null, null)).isEmpty();
        }

        @Test
        @DisplayName("should report read failure when file path is a directory")
        void shouldFailWhenFileIsDirectory() {
            assertThatThrownBy(() -> loader.load(confDir, null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasCauseInstanceOf(IOException.class)
                    .extracting(e -> ((ConfigurationException) e).getReason())
                    .isEqualTo(ConfigurationException.Reason.READ_FAILED);
        }
    }

    @Nested
    @DisplayName("Directory merging")
    class DirectoryMerging {

        @Test
        @DisplayName("should merge files in file name order")
        void shouldMergeInNameOrder() throws IOException {
            write(confDir.resolve("20-override.conf"),
                    "{\"taxii\": {\"max_page_size\": 50}, \"backend\": {\"module_class\": \"MongoBackend\"}}");
            write(confDir.resolve("10-base.conf"),
                    "{\"taxii\": {\"max_page_size\": 10, \"interop_requirements\": true}}");

            Map<String, Object> config = loader.loadDirectory(confDir);

            assertThat(config).isEqualTo(Map.of(
                    "taxii", Map.of("max_page_size", 50, "interop_requirements", true),
                    "backend", Map.of("module_class", "MongoBackend")
            ));
        }

        @Test
        @DisplayName("should ignore files without .conf extension and subdirectories")
        void shouldIgnoreOtherEntries() throws IOException {
            write(confDir.resolve("app.conf"), "{\"foo\": \"bar\"}");
            write(confDir.resolve("notes.txt"), "not json at all");
            write(confDir.resolve("app.conf.bak"), "[]");
            Files.createDirectory(confDir.resolve("nested.conf"));

            assertThat(loader.loadDirectory(confDir)).isEqualTo(Map.of("foo", "bar"));
        }

        @Test
        @DisplayName("should fail whole directory when one file is invalid")
        void shouldFailOnSingleBadFile() throws IOException {
            write(confDir.resolve("a.conf"), "{\"foo\": \"bar\"}");
            write(confDir.resolve("b.conf"), "{,}");

            assertThatThrownBy(() -> loader.loadDirectory(confDir))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("b.conf");
        }

        @Test
        @DisplayName("should let directory override file")
        void shouldLetDirectoryOverrideFile() throws IOException {
            Path standalone = tempDir.resolve("standalone.conf");
            write(standalone, "{\"backend\": {\"module_class\": \"MemoryBackend\", \"filename\": \"/a.json\"}}");
            write(confFile, "{\"backend\": {\"filename\": \"/b.json\"}}");

            Map<String, Object> config = loader.load(standalone, confDir);

            assertThat(config).isEqualTo(Map.of(
                    "backend", Map.of("module_class", "MemoryBackend", "filename", "/b.json")
            ));
        }
    }

    private static void write(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}
