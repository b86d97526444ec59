package io.specwatch.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A spec module as seen by one discovery pass.
 *
 * @param path         absolute, normalized module path
 * @param contentHash  SHA-256 hex of the module's bytes
 * @param lastModified file modification time when the module was read
 * @param dependencies direct {@code //SOURCES} dependencies in declaration order
 */
public record SpecModule(Path path, String contentHash, Instant lastModified, List<Path> dependencies) {

    public SpecModule {
        path = path.toAbsolutePath().normalize();
        dependencies = List.copyOf(dependencies);
    }
}
