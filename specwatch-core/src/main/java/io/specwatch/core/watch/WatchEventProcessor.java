package io.specwatch.core.watch;

import io.specwatch.core.cache.CompilationCache;
import io.specwatch.core.cache.ContentHasher;
import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.discovery.HybridDiscoverer;
import io.specwatch.core.discovery.ModuleDiscovery;
import io.specwatch.core.graph.DependencyGraph;
import io.specwatch.core.graph.DependencyResolver;
import io.specwatch.core.model.ModulePaths;
import io.specwatch.core.model.TestCaseIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Decides the {@link WatchAction} for a single file change.
 * <ul>
 *   <li>A path that is neither a known module, a dependency, nor classified as a module by the
 *       watcher reruns everything.</li>
 *   <li>A deleted module is dropped from the graph, the cache and the tracker.</li>
 *   <li>A dependency whose content hash changed rediscovers every dependent and reruns them
 *       in full.</li>
 *   <li>A changed module is rediscovered and diffed; only added and modified cases rerun.</li>
 *   <li>A change that fails to process reruns its module, or everything if it is not one.</li>
 * </ul>
 * Snapshots and dependency hashes are returned with the action instead of recorded, so the
 * caller can record them once the rerun succeeded.
 */
public final class WatchEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(WatchEventProcessor.class);

    static final String OUTSIDE_GRAPH = "Source change outside the spec graph";
    static final String DYNAMIC_FULL_RUN = "Full run required: dynamic specs detected";
    static final String DEPENDENCY_FULL_RUN = "Full run required: dependency changed";
    static final String NO_CHANGES = "No spec changes detected";
    static final String PROCESSING_FAILED = "Full run required: change could not be processed";

    private final SpecWatchConfig config;
    private final Path projectDir;
    private final DependencyGraph graph;
    private final DependencyResolver resolver;
    private final HybridDiscoverer discoverer;
    private final SpecChangeTracker tracker;
    private final CompilationCache cache;

    public WatchEventProcessor(SpecWatchConfig config, Path projectDir, DependencyGraph graph,
                               DependencyResolver resolver, HybridDiscoverer discoverer,
                               SpecChangeTracker tracker, CompilationCache cache) {
        this.config = config;
        this.projectDir = ModulePaths.canonical(projectDir);
        this.graph = graph;
        this.resolver = resolver;
        this.discoverer = discoverer;
        this.tracker = tracker;
        this.cache = cache;
    }

    /**
     * Records a baseline snapshot for every known module and a content hash for every
     * dependency that has none yet. Run before the first change is processed; running it
     * again leaves existing baselines untouched.
     */
    public void prime() {
        int primed = 0;
        for (Path module : graph.modules()) {
            checkCancelled();
            if (!tracker.hasState(module)) {
                try {
                    tracker.recordState(module, SpecSnapshot.from(discoverer.discover(module)));
                    primed++;
                } catch (CancellationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Cannot prime {}: {}", module, e.getMessage());
                }
            }
            for (Path dependency : graph.dependenciesOf(module)) {
                if (!tracker.hasDependency(dependency)) {
                    contentHash(dependency).ifPresent(h -> tracker.recordDependency(dependency, h));
                }
            }
        }
        log.info("Primed change tracking for {} modules", primed);
    }

    public WatchAction process(FileChangeEvent event) {
        Path path = event.path();
        try {
            return classify(event);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            String relativePath = ModulePaths.relativize(projectDir, path);
            log.warn("Processing change to {} failed", relativePath, e);
            boolean module = graph.isModule(path) || event.isTestModule()
                    || ModulePaths.isSpecModule(path, config.specSuffix());
            if (module && Files.exists(path)) {
                return WatchAction.runFiles(List.of(path),
                        "Discovery failed for " + relativePath + ", rerunning module", Map.of());
            }
            return WatchAction.runAll(PROCESSING_FAILED);
        }
    }

    private WatchAction classify(FileChangeEvent event) {
        Path path = event.path();
        boolean knownModule = graph.isModule(path);
        boolean dependency = graph.isDependency(path);
        String relativePath = ModulePaths.relativize(projectDir, path);

        if (dependency) {
            return dependencyChanged(path, relativePath, knownModule);
        }

        if (!Files.exists(path)) {
            if (knownModule) {
                return moduleDeleted(path, relativePath);
            }
            log.debug("Deleted file {} is not part of the spec graph", relativePath);
            return WatchAction.runAll(OUTSIDE_GRAPH);
        }

        boolean module = knownModule || event.isTestModule() || ModulePaths.isSpecModule(path, config.specSuffix());
        if (!module) {
            log.info("{} is outside the spec graph, rerunning everything", relativePath);
            return WatchAction.runAll(OUTSIDE_GRAPH);
        }
        return moduleChanged(path, relativePath);
    }

    private WatchAction moduleDeleted(Path module, String relativePath) {
        graph.remove(module);
        tracker.remove(module);
        cache.invalidate(module);
        discoverer.forget(module);
        log.info("Spec module {} deleted", relativePath);
        return WatchAction.skip("Spec module deleted: " + relativePath);
    }

    private WatchAction moduleChanged(Path module, String relativePath) {
        graph.register(module, resolver.transitiveDependencies(module));

        if (!config.incremental()) {
            return WatchAction.runFiles(List.of(module), "Running " + relativePath, Map.of());
        }

        ModuleDiscovery discovery;
        try {
            discovery = discoverer.discover(module);
        } catch (UncheckedIOException e) {
            log.warn("Cannot read {}: {}", relativePath, e.getMessage());
            return WatchAction.skip("Cannot read " + relativePath);
        }
        SpecSnapshot snapshot = SpecSnapshot.from(discovery);
        SpecChangeSet changes = tracker.getChanges(module, snapshot, false);
        Map<Path, SpecSnapshot> toRecord = Map.of(module, snapshot);

        if (!changes.hasChanges()) {
            return WatchAction.skip(NO_CHANGES, toRecord);
        }
        if (changes.dynamicSpecsDetected()) {
            log.info("{}: dynamic specs detected, full run required", relativePath);
            return WatchAction.runAll(DYNAMIC_FULL_RUN, toRecord);
        }

        List<String> names = new ArrayList<>();
        for (TestCaseIdentity identity : changes.specsToRun()) {
            names.add(identity.displayName());
        }
        if (names.isEmpty()) {
            return WatchAction.skip(changes.removed().size() + " spec(s) removed, nothing to rerun", toRecord);
        }
        String message = "Incremental: " + names.size() + " spec(s) changed";
        log.info("{}: {}", relativePath, message);
        return WatchAction.runFiltered(module, FilterPatternBuilder.build(names), message, toRecord);
    }

    private WatchAction dependencyChanged(Path dependency, String relativePath, boolean alsoModule) {
        Optional<String> hash = contentHash(dependency);
        Map<Path, String> stamp = Map.of();
        if (hash.isPresent()) {
            if (!tracker.hasDependencyChanged(dependency, hash.get())) {
                log.debug("Dependency {} content unchanged", relativePath);
                return WatchAction.skip("Dependency unchanged: " + relativePath);
            }
            stamp = Map.of(dependency, hash.get());
        } else {
            tracker.removeDependency(dependency);
        }

        List<Path> targets = new ArrayList<>(graph.dependentsOf(dependency));
        if (alsoModule && !targets.contains(dependency)) {
            targets.add(0, dependency);
        }
        log.info("Dependency {} changed, {} dependent module(s)", relativePath, targets.size());

        Map<Path, SpecSnapshot> toRecord = new LinkedHashMap<>();
        boolean dynamic = false;
        List<Path> runnable = new ArrayList<>();
        for (Path target : targets) {
            checkCancelled();
            if (!Files.exists(target)) {
                moduleDeleted(target, ModulePaths.relativize(projectDir, target));
                continue;
            }
            graph.register(target, resolver.transitiveDependencies(target));
            runnable.add(target);
            if (!config.incremental()) {
                continue;
            }
            try {
                SpecSnapshot snapshot = SpecSnapshot.from(discoverer.discover(target));
                dynamic |= tracker.getChanges(target, snapshot, true).dynamicSpecsDetected();
                toRecord.put(target, snapshot);
            } catch (UncheckedIOException e) {
                log.warn("Cannot read {}: {}", target, e.getMessage());
            }
        }

        if (runnable.isEmpty()) {
            return WatchAction.skip("No spec module depends on " + relativePath).withDependencyStamps(stamp);
        }
        if (dynamic) {
            return WatchAction.runAll(DYNAMIC_FULL_RUN, toRecord).withDependencyStamps(stamp);
        }
        return WatchAction.runFiles(runnable, DEPENDENCY_FULL_RUN, toRecord).withDependencyStamps(stamp);
    }

    private static Optional<String> contentHash(Path path) {
        try {
            return Optional.of(ContentHasher.sha256(path));
        } catch (IOException e) {
            log.debug("Cannot hash {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Watch iteration cancelled");
        }
    }
}
