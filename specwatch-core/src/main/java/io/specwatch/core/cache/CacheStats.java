package io.specwatch.core.cache;

/**
 * Snapshot of the compilation cache for the cache-management surface.
 *
 * @param entryCount     number of completed entries, failed compilations included
 * @param totalSizeBytes summed size of the compiled forms
 */
public record CacheStats(int entryCount, long totalSizeBytes) {
}
