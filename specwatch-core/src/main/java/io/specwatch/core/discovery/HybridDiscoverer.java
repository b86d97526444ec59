package io.specwatch.core.discovery;

import io.specwatch.core.cache.CacheKey;
import io.specwatch.core.cache.CompilationCache;
import io.specwatch.core.cache.CompiledArtifact;
import io.specwatch.core.cache.ContentHasher;
import io.specwatch.core.compile.ModuleExecutionException;
import io.specwatch.core.compile.SpecModuleCompiler;
import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.dsl.DiscoveryContext;
import io.specwatch.core.dsl.DiscoveryScope;
import io.specwatch.core.graph.DependencyResolver;
import io.specwatch.core.model.DiscoveredSpec;
import io.specwatch.core.model.ModulePaths;
import io.specwatch.core.model.SpecModule;
import io.specwatch.core.model.TestCaseIdentity;
import io.specwatch.core.model.TestTree;
import io.specwatch.core.parse.StaticSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Discovers a module's test cases by compiling and running it, falling back to static
 * analysis when that fails.
 * <p>
 * Per module: read and hash the source, resolve its transitive {@code //SOURCES}, build the
 * {@link CacheKey}, get the compiled artifact from the cache (compiling on a miss), run it
 * inside a fresh {@link DiscoveryScope}. A compile error or a throwing module yields the
 * static tree instead, with every case flagged {@code hasCompilationError}.
 * <p>
 * Discoveries of the same module are serialized; distinct modules may run concurrently. The
 * calling thread's interrupt flag is checked between phases.
 */
public final class HybridDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(HybridDiscoverer.class);

    private final SpecWatchConfig config;
    private final Path projectDir;
    private final CompilationCache cache;
    private final DependencyResolver resolver;
    private final SpecModuleCompiler compiler;
    private final StaticSpecParser parser;

    private final ConcurrentMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<Path, DiscoveryState> states = new ConcurrentHashMap<>();

    public HybridDiscoverer(SpecWatchConfig config, Path projectDir, CompilationCache cache,
                            DependencyResolver resolver, SpecModuleCompiler compiler,
                            StaticSpecParser parser) {
        this.config = config;
        this.projectDir = ModulePaths.canonical(projectDir);
        this.cache = cache;
        this.resolver = resolver;
        this.compiler = compiler;
        this.parser = parser;
    }

    /**
     * Discovers one module.
     *
     * @throws UncheckedIOException  if the module cannot be read
     * @throws CancellationException if the calling thread is interrupted
     */
    public ModuleDiscovery discover(Path modulePath) {
        Path module = ModulePaths.canonical(modulePath);
        ReentrantLock lock = locks.computeIfAbsent(module, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting to discover " + module);
        }
        try {
            return discoverLocked(module);
        } finally {
            lock.unlock();
        }
    }

    /** Last state reached by the module, {@link DiscoveryState#NOT_STARTED} if never seen. */
    public DiscoveryState state(Path modulePath) {
        return states.getOrDefault(ModulePaths.canonical(modulePath), DiscoveryState.NOT_STARTED);
    }

    /** Forgets per-module bookkeeping, e.g. after the module was deleted. */
    public void forget(Path modulePath) {
        Path module = ModulePaths.canonical(modulePath);
        states.remove(module);
        locks.remove(module);
    }

    private ModuleDiscovery discoverLocked(Path module) {
        states.put(module, DiscoveryState.NOT_STARTED);
        checkCancelled(module);

        String source;
        Instant lastModified;
        try {
            source = Files.readString(module, StandardCharsets.UTF_8);
            lastModified = Files.getLastModifiedTime(module).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read spec module " + module, e);
        }

        String contentHash = ContentHasher.sha256(source);
        List<Path> transitive = resolver.transitiveDependencies(module);
        SpecModule specModule = new SpecModule(module, contentHash, lastModified,
                resolver.directDependencies(module, source));
        CacheKey key = CacheKey.of(module, contentHash, dependencyHashes(transitive));
        String relativePath = ModulePaths.relativize(projectDir, module);

        checkCancelled(module);
        states.put(module, DiscoveryState.COMPILING);
        List<Path> sources = new ArrayList<>();
        sources.add(module);
        sources.addAll(transitive);
        CompiledArtifact artifact = config.useCache()
                ? cache.getOrCompile(key, k -> compiler.compile(k, specModule, sources))
                : compiler.compile(key, specModule, sources);
        checkCancelled(module);

        TestTree staticTree = parser.parse(module, source);
        DiscoveryOutcome outcome;
        List<DiscoveredSpec> executedSpecs = List.of();
        if (artifact.succeeded()) {
            try {
                Execution execution = execute(artifact, relativePath, module);
                executedSpecs = execution.specs();
                outcome = new DiscoveryOutcome.Executed(execution.tree());
            } catch (ModuleExecutionException e) {
                log.warn("Executing {} failed, falling back to static analysis: {}", relativePath, e.getMessage());
                outcome = new DiscoveryOutcome.StaticFallback(staticTree, e.getMessage());
            }
        } else {
            log.warn("Compiling {} failed, falling back to static analysis", relativePath);
            log.debug("Diagnostics for {}:{}{}", relativePath, System.lineSeparator(), artifact.diagnostic());
            outcome = new DiscoveryOutcome.StaticFallback(staticTree, artifact.diagnostic());
        }
        states.put(module, outcome.state());

        List<DiscoveredSpec> specs;
        List<String> warnings;
        if (outcome instanceof DiscoveryOutcome.Executed) {
            specs = enrich(executedSpecs,
                    staticTree.complete() ? staticTree.flatten(relativePath, module) : List.of(), contentHash);
            warnings = List.of();
        } else if (outcome instanceof DiscoveryOutcome.StaticFallback fallback) {
            specs = new ArrayList<>();
            for (DiscoveredSpec spec : fallback.tree().flatten(relativePath, module)) {
                specs.add(spec.withCompilationError(fallback.diagnostic()));
            }
            warnings = fallback.tree().warnings();
        } else {
            throw new IllegalStateException("Unknown discovery outcome " + outcome);
        }

        log.debug("Discovered {} specs in {} ({})", specs.size(), relativePath, outcome.state());
        return new ModuleDiscovery(specModule, relativePath, outcome, specs, warnings);
    }

    private record Execution(TestTree tree, List<DiscoveredSpec> specs) {}

    /** Runs the module and flattens what it registered; any failure becomes a {@link ModuleExecutionException}. */
    private Execution execute(CompiledArtifact artifact, String relativePath, Path module) {
        DiscoveryContext context = new DiscoveryContext();
        try (DiscoveryScope scope = DiscoveryScope.open(context)) {
            compiler.execute(artifact, context);
            TestTree tree = context.tree();
            return new Execution(tree, tree.flatten(relativePath, module));
        } catch (RuntimeException e) {
            if (e instanceof ModuleExecutionException) {
                throw e;
            }
            throw new ModuleExecutionException(e.toString(), e);
        }
    }

    /**
     * Copies the static line span and body hash onto executed cases with the same identity.
     * Cases the static parser cannot vouch for (generated in loops, declared from helpers, or
     * any case of a module it could not fully read) take the module hash instead, so any
     * edit to the module marks them modified.
     */
    private static List<DiscoveredSpec> enrich(List<DiscoveredSpec> executed, List<DiscoveredSpec> declared,
                                               String contentHash) {
        Map<TestCaseIdentity, DiscoveredSpec> byIdentity = new HashMap<>();
        for (DiscoveredSpec spec : declared) {
            if (!spec.dynamic()) {
                byIdentity.putIfAbsent(spec.identity(), spec);
            }
        }

        String moduleHash = "module:" + contentHash;
        List<DiscoveredSpec> result = new ArrayList<>(executed.size());
        for (DiscoveredSpec spec : executed) {
            DiscoveredSpec match = byIdentity.get(spec.identity());
            if (match != null) {
                int line = spec.lineNumber() > 0 ? spec.lineNumber() : match.lineNumber();
                result.add(spec.withProvenance(line, match.endLine(), match.bodyHash()));
            } else {
                result.add(spec.withProvenance(spec.lineNumber(), spec.endLine(), moduleHash));
            }
        }
        return result;
    }

    private List<String> dependencyHashes(List<Path> dependencies) {
        List<String> hashes = new ArrayList<>();
        for (Path dep : dependencies) {
            try {
                hashes.add(ContentHasher.sha256(dep));
            } catch (IOException e) {
                // a missing file still takes part so that creating it changes the key
                hashes.add("missing:" + dep);
            }
        }
        return hashes;
    }

    private static void checkCancelled(Path module) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Discovery of " + module + " cancelled");
        }
    }
}
