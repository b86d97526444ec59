package io.specwatch.core.compile;

import io.specwatch.core.cache.CacheKey;
import io.specwatch.core.cache.CompiledArtifact;
import io.specwatch.core.dsl.DiscoveryContext;
import io.specwatch.core.model.SpecModule;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Real in-process compiler that counts how often it is asked to compile and execute.
 */
public class CountingCompiler implements SpecModuleCompiler {

    private final SpecModuleCompiler delegate = new JavacModuleCompiler();
    private final AtomicInteger compilations = new AtomicInteger();
    private final AtomicInteger executions = new AtomicInteger();

    @Override
    public CompiledArtifact compile(CacheKey key, SpecModule module, List<Path> sources) {
        compilations.incrementAndGet();
        return delegate.compile(key, module, sources);
    }

    @Override
    public void execute(CompiledArtifact artifact, DiscoveryContext context) {
        executions.incrementAndGet();
        delegate.execute(artifact, context);
    }

    public int compilations() {
        return compilations.get();
    }

    public int executions() {
        return executions.get();
    }
}
