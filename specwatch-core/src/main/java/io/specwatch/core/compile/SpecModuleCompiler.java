package io.specwatch.core.compile;

import io.specwatch.core.cache.CacheKey;
import io.specwatch.core.cache.CompiledArtifact;
import io.specwatch.core.dsl.DiscoveryContext;
import io.specwatch.core.model.SpecModule;

import java.nio.file.Path;
import java.util.List;

/**
 * Compiles spec modules and executes the result to collect declarations.
 */
public interface SpecModuleCompiler {

    /**
     * Compiles the module together with its dependency sources. Compilation errors are
     * reported through a failed {@link CompiledArtifact}, never thrown.
     *
     * @param key     cache key the artifact will be stored under
     * @param module  the module to compile
     * @param sources the module followed by its transitive dependency sources
     */
    CompiledArtifact compile(CacheKey key, SpecModule module, List<Path> sources);

    /**
     * Runs a successfully compiled module so its declarations land in {@code context}. The
     * caller has already bound the context with a
     * {@link io.specwatch.core.dsl.DiscoveryScope}.
     *
     * @throws ModuleExecutionException if module code throws or cannot be loaded
     */
    void execute(CompiledArtifact artifact, DiscoveryContext context);
}
