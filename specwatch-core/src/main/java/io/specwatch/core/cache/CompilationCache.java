package io.specwatch.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * In-memory store of compiled modules keyed by {@link CacheKey}.
 *
 * <p>Entries are futures so that concurrent callers asking for the same key share a single
 * compilation. Inserting a key evicts every other key for the same module path, since a
 * module can only have one current compilation. There is no size or age based eviction;
 * entries live until {@link #clear()} or the end of the process.
 */
public final class CompilationCache {

    private static final Logger log = LoggerFactory.getLogger(CompilationCache.class);

    private final ConcurrentMap<CacheKey, CompletableFuture<CompiledArtifact>> entries = new ConcurrentHashMap<>();

    /**
     * Returns the completed, intact artifact for {@code key}. A corrupt entry is dropped and
     * reported as a miss. In-flight compilations are not waited for.
     */
    public Optional<CompiledArtifact> get(CacheKey key) {
        CompletableFuture<CompiledArtifact> future = entries.get(key);
        if (future == null || !future.isDone()) {
            return Optional.empty();
        }
        if (future.isCompletedExceptionally()) {
            dropCorrupt(key, future, "failed future");
            return Optional.empty();
        }
        CompiledArtifact artifact = future.join();
        if (!artifact.isIntact()) {
            dropCorrupt(key, future, "artifact not intact");
            return Optional.empty();
        }
        return Optional.of(artifact);
    }

    public void put(CacheKey key, CompiledArtifact artifact) {
        entries.put(key, CompletableFuture.completedFuture(artifact));
        evictSuperseded(key);
    }

    /**
     * Returns the artifact for {@code key}, compiling it with {@code compiler} on a miss.
     * At most one compilation per key is in flight: other callers block on its result.
     * Failed compilations are cached like successful ones.
     *
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public CompiledArtifact getOrCompile(CacheKey key, Function<CacheKey, CompiledArtifact> compiler) {
        while (true) {
            CompletableFuture<CompiledArtifact> existing = entries.get(key);
            if (existing == null) {
                CompletableFuture<CompiledArtifact> mine = new CompletableFuture<>();
                existing = entries.putIfAbsent(key, mine);
                if (existing == null) {
                    return compileInto(key, mine, compiler);
                }
            }

            CompiledArtifact artifact = await(key, existing);
            if (artifact != null && artifact.isIntact()) {
                log.debug("Cache hit for {}", key.modulePath());
                return artifact;
            }
            dropCorrupt(key, existing, artifact == null ? "failed future" : "artifact not intact");
        }
    }

    private CompiledArtifact compileInto(CacheKey key, CompletableFuture<CompiledArtifact> slot,
                                         Function<CacheKey, CompiledArtifact> compiler) {
        evictSuperseded(key);
        log.debug("Cache miss for {}, compiling", key.modulePath());
        try {
            CompiledArtifact artifact = compiler.apply(key);
            slot.complete(artifact);
            return artifact;
        } catch (RuntimeException | Error e) {
            entries.remove(key, slot);
            slot.completeExceptionally(e);
            throw e;
        }
    }

    private static CompiledArtifact await(CacheKey key, CompletableFuture<CompiledArtifact> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for compilation of " + key.modulePath());
        } catch (ExecutionException | CancellationException e) {
            return null;
        }
    }

    private void dropCorrupt(CacheKey key, CompletableFuture<CompiledArtifact> future, String reason) {
        if (entries.remove(key, future)) {
            log.debug("Dropped corrupt cache entry for {} ({}), will recompile", key.modulePath(), reason);
        }
    }

    private void evictSuperseded(CacheKey current) {
        entries.keySet().removeIf(k -> !k.equals(current) && k.modulePath().equals(current.modulePath()));
    }

    /** Drops every entry for the module, e.g. after it was deleted. */
    public int invalidate(Path modulePath) {
        Path canonical = modulePath.toAbsolutePath().normalize();
        int before = entries.size();
        entries.keySet().removeIf(k -> k.modulePath().equals(canonical));
        return before - entries.size();
    }

    /** Removes every entry and returns how many there were. */
    public int clear() {
        int removed = entries.size();
        entries.clear();
        log.info("Cleared {} compilation cache entries", removed);
        return removed;
    }

    public CacheStats stats() {
        int count = 0;
        long size = 0;
        for (CompletableFuture<CompiledArtifact> future : entries.values()) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                count++;
                size += future.join().sizeBytes();
            }
        }
        return new CacheStats(count, size);
    }
}
