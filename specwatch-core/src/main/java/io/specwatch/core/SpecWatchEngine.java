package io.specwatch.core;

import io.specwatch.core.cache.CacheStats;
import io.specwatch.core.cache.CompilationCache;
import io.specwatch.core.compile.JavacModuleCompiler;
import io.specwatch.core.compile.SpecModuleCompiler;
import io.specwatch.core.config.ConfigLoader;
import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.discovery.HybridDiscoverer;
import io.specwatch.core.discovery.SpecDiscoverer;
import io.specwatch.core.graph.DependencyGraph;
import io.specwatch.core.graph.DependencyGraphBuilder;
import io.specwatch.core.graph.DependencyResolver;
import io.specwatch.core.impact.GitChangeDetector;
import io.specwatch.core.impact.ImpactAnalyzer;
import io.specwatch.core.model.ModulePaths;
import io.specwatch.core.model.TestCaseIdentity;
import io.specwatch.core.parse.LineLocator;
import io.specwatch.core.parse.StaticSpecParser;
import io.specwatch.core.watch.FilterPatternBuilder;
import io.specwatch.core.watch.SpecChangeTracker;
import io.specwatch.core.watch.SpecRunner;
import io.specwatch.core.watch.WatchEventProcessor;
import io.specwatch.core.watch.WatchListener;
import io.specwatch.core.watch.WatchOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point wiring discovery, caching, change tracking and watch mode for one project.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SpecWatchEngine engine = SpecWatchEngine.open(projectDir)) {
 *     DiscoveryResult result = engine.discoverer().discoverAsync(projectDir).join();
 *     try (WatchOrchestrator watch = engine.newOrchestrator(runner, listener)) {
 *         watch.start();
 *         // feed watch.submit(new FileChangeEvent(path, isSpec)) from a file watcher
 *     }
 * }
 * }</pre>
 */
public final class SpecWatchEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SpecWatchEngine.class);

    private final SpecWatchConfig config;
    private final Path projectDir;
    private final CompilationCache cache = new CompilationCache();
    private final DependencyResolver resolver = new DependencyResolver();
    private final StaticSpecParser parser = new StaticSpecParser();
    private final SpecChangeTracker tracker = new SpecChangeTracker();
    private final HybridDiscoverer hybridDiscoverer;
    private final SpecDiscoverer discoverer;
    private final ExecutorService discoveryPool;

    public SpecWatchEngine(SpecWatchConfig config, Path projectDir) {
        this(config, projectDir, new JavacModuleCompiler());
    }

    public SpecWatchEngine(SpecWatchConfig config, Path projectDir, SpecModuleCompiler compiler) {
        this.config = config;
        this.projectDir = ModulePaths.canonical(projectDir);
        AtomicInteger threads = new AtomicInteger();
        this.discoveryPool = Executors.newFixedThreadPool(config.discoveryParallelism(), r -> {
            Thread t = new Thread(r, "specwatch-discovery-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.hybridDiscoverer = new HybridDiscoverer(config, this.projectDir, cache, resolver, compiler, parser);
        this.discoverer = new SpecDiscoverer(hybridDiscoverer, config, discoveryPool);

        log.info("=== SpecWatch ===");
        log.info("Project dir: {}", this.projectDir);
        log.info("Spec suffix: {}", config.specSuffix());
        log.info("Incremental: {}, cache: {}, parallelism: {}",
                config.incremental(), config.useCache(), config.discoveryParallelism());
    }

    /** Creates an engine configured from the project's {@code specwatch.properties}. */
    public static SpecWatchEngine open(Path projectDir) {
        return new SpecWatchEngine(ConfigLoader.load(projectDir), projectDir);
    }

    public SpecWatchConfig config() {
        return config;
    }

    public SpecDiscoverer discoverer() {
        return discoverer;
    }

    public HybridDiscoverer hybridDiscoverer() {
        return hybridDiscoverer;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    /** Drops every compiled module; returns how many entries were removed. */
    public int clearCache() {
        return cache.clear();
    }

    public DependencyGraph buildGraph() {
        return new DependencyGraphBuilder(config, resolver).build(projectDir);
    }

    /** Spec modules affected by the changes git reports against the configured base ref. */
    public Set<Path> affectedModules() {
        DependencyGraph graph = buildGraph();
        return new ImpactAnalyzer(new GitChangeDetector(projectDir, config)).affectedModules(graph);
    }

    /**
     * Test cases declared at {@code line} of {@code module}.
     *
     * @throws io.specwatch.core.parse.NoSpecsAtLineException if nothing is declared there
     */
    public Set<TestCaseIdentity> locate(Path module, int line) {
        return new LineLocator(parser, projectDir).locate(module, line);
    }

    /** Filter pattern selecting the cases declared at the given lines. */
    public String lineFilter(Path module, Set<Integer> lines) {
        List<String> names = new ArrayList<>();
        for (TestCaseIdentity identity : new LineLocator(parser, projectDir).locate(module, lines)) {
            names.add(identity.displayName());
        }
        return FilterPatternBuilder.build(names);
    }

    public WatchEventProcessor newWatchProcessor() {
        return new WatchEventProcessor(config, projectDir, buildGraph(), resolver, hybridDiscoverer, tracker, cache);
    }

    public WatchOrchestrator newOrchestrator(SpecRunner runner, WatchListener listener) {
        return new WatchOrchestrator(newWatchProcessor(), tracker, runner, listener, config.debounce());
    }

    public SpecChangeTracker tracker() {
        return tracker;
    }

    @Override
    public void close() {
        discoveryPool.shutdownNow();
        try {
            if (!discoveryPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Discovery threads did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
