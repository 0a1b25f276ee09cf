/**
 * Configuration resolution for the Medallion TAXII server.
 *
 * <p>Configuration is a nested JSON-style mapping assembled from files on disk and
 * environment variables. Nothing in this package writes to disk or caches results.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.medallion.infrastructure.config.ConfigLoader} - Entry point, merges all sources</li>
 *   <li>{@link io.medallion.infrastructure.config.FileConfigLoader} - JSON file and directory loading</li>
 *   <li>{@link io.medallion.infrastructure.config.MedallionConfig} - {@code MEDALLION_*} environment variables</li>
 *   <li>{@link io.medallion.infrastructure.config.EnvVar} - Table of recognized variables and their types</li>
 *   <li>{@link io.medallion.infrastructure.config.ConfigMerger} - Recursive merge with override</li>
 * </ul>
 *
 * <h2>Precedence</h2>
 * <p>Environment variables override the configuration directory, which overrides the
 * configuration file. Merging is recursive, so a source only replaces the keys it sets.
 *
 * <h2>Backend Settings</h2>
 * <p>Backend-specific variables such as {@code MEDALLION_BACKEND_MONGO_URI} are collected
 * under the backend class name and moved into the {@code backend} section when that class
 * is the selected {@code module_class}:
 * <pre>{@code
 * MEDALLION_BACKEND_MODULE_CLASS=MongoBackend
 * MEDALLION_BACKEND_MONGO_URI=mongodb://localhost:27017/
 *
 * {"backend": {"module_class": "MongoBackend", "uri": "mongodb://localhost:27017/"}}
 * }</pre>
 *
 * <h2>Errors</h2>
 * <p>All failures are reported as {@link io.medallion.infrastructure.config.ConfigurationException}
 * and abort resolution. Only the default file and directory may be absent.
 */
package io.medallion.infrastructure.config;
