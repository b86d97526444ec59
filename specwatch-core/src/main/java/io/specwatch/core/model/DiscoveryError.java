package io.specwatch.core.model;

import java.nio.file.Path;

/**
 * A module-level problem reported by discovery. The module's specs may still be present
 * in the result (static fallback), this only records why they are degraded or missing.
 */
public record DiscoveryError(Path sourceFile, String relativePath, String message) {
}
