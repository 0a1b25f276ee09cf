package io.medallion.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exception thrown when configuration cannot be resolved.
 *
 * Any failure aborts the whole resolution:
 * - An explicitly requested file or directory does not exist
 * - A file is not valid JSON, or its top level is not an object
 * - An environment variable cannot be converted to its declared type
 */
public final class ConfigurationException extends RuntimeException {

    private final Reason reason;

    public ConfigurationException(Reason reason, String details) {
        super(reason.getMessage() + ": " + details);
        this.reason = reason;
    }

    public ConfigurationException(Reason reason, String details, Throwable cause) {
        super(reason.getMessage() + ": " + details, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    static ConfigurationException notFound(Path path) {
        return new ConfigurationException(Reason.NOT_FOUND, quote(path));
    }

    static ConfigurationException invalidJson(Path path, JsonProcessingException cause) {
        return new ConfigurationException(Reason.INVALID_FORMAT,
                "Invalid JSON in " + quote(path) + " (" + cause.getOriginalMessage() + ")", cause);
    }

    static ConfigurationException notAnObject(Path path, JsonNodeType actual) {
        return new ConfigurationException(Reason.TYPE_MISMATCH,
                quote(path) + " must contain a JSON object, found " + actual);
    }

    static ConfigurationException readFailed(Path path, IOException cause) {
        return new ConfigurationException(Reason.READ_FAILED, quote(path), cause);
    }

    private static String quote(Path path) {
        return "'" + path + "'";
    }

    public enum Reason {
        NOT_FOUND("Configuration source not found"),
        INVALID_FORMAT("Malformed configuration file"),
        TYPE_MISMATCH("Unexpected configuration type"),
        INVALID_VALUE("Invalid configuration value"),
        READ_FAILED("Failed to read configuration");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
