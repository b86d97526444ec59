package io.specwatch.core.cache;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Collection;
import java.util.List;

/**
 * Identifies one compilation of a module: the module path, its content hash and the
 * sorted content hashes of its transitive dependencies. Any byte change anywhere in the
 * closure yields a different key.
 */
public record CacheKey(Path modulePath, String contentHash, List<String> dependencyHashes) {

    public CacheKey {
        modulePath = modulePath.toAbsolutePath().normalize();
        dependencyHashes = List.copyOf(dependencyHashes);
    }

    /** Builds a key with the dependency hashes sorted, so traversal order never matters. */
    public static CacheKey of(Path modulePath, String contentHash, Collection<String> dependencyHashes) {
        List<String> sorted = new ArrayList<>(dependencyHashes);
        Collections.sort(sorted);
        return new CacheKey(modulePath, contentHash, sorted);
    }
}
