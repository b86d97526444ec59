package io.specwatch.core.cache;

import java.time.Duration;
import java.util.List;

/**
 * Result of compiling one module, successful or not.
 *
 * <p>The compiled form is opaque to the cache; only the compiler that produced it knows how
 * to execute it. A failed artifact carries the compiler diagnostics instead.
 *
 * @param key          cache key the artifact was compiled for
 * @param compiledForm compiler-specific output, {@code null} on failure
 * @param succeeded    whether compilation produced an executable form
 * @param diagnostics  compiler messages, in emission order
 * @param sizeBytes    size of the compiled form
 * @param compileTime  wall time spent compiling
 */
public record CompiledArtifact(
        CacheKey key,
        Object compiledForm,
        boolean succeeded,
        List<String> diagnostics,
        long sizeBytes,
        Duration compileTime
) {

    public CompiledArtifact {
        diagnostics = List.copyOf(diagnostics);
    }

    public static CompiledArtifact success(CacheKey key, Object compiledForm, long sizeBytes,
                                           Duration compileTime, List<String> warnings) {
        return new CompiledArtifact(key, compiledForm, true, warnings, sizeBytes, compileTime);
    }

    public static CompiledArtifact failure(CacheKey key, List<String> diagnostics, Duration compileTime) {
        return new CompiledArtifact(key, null, false, diagnostics, 0L, compileTime);
    }

    /** Diagnostics joined into one message. */
    public String diagnostic() {
        return String.join(System.lineSeparator(), diagnostics);
    }

    /**
     * Whether the entry is usable as-is. A successful artifact without a compiled form, or a
     * failed one without a diagnostic, is considered corrupt and recompiled.
     */
    public boolean isIntact() {
        if (key == null || sizeBytes < 0) {
            return false;
        }
        return succeeded ? compiledForm != null : !diagnostics.isEmpty();
    }
}
