/**
 * Medallion - configuration layer of the Medallion TAXII server.
 *
 * <p>Resolves the server configuration from a JSON configuration file, a directory of
 * JSON configuration files and {@code MEDALLION_*} environment variables into a single
 * nested mapping consumed by the HTTP server and the persistence backends.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Map<String, Object> config = ConfigLoader.loadConfig();
 *
 * Map<String, Object> backend = (Map<String, Object>) config.get("backend");
 * String moduleClass = (String) backend.get("module_class");
 * }</pre>
 *
 * @see io.medallion.infrastructure.config.ConfigLoader
 */
package io.medallion;
