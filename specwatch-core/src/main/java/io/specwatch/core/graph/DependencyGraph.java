package io.specwatch.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Module to dependency mapping in both directions.
 * <p>
 * The forward map holds each registered module's transitive dependencies; the reverse map
 * answers "which modules must be rediscovered when this file changes". Paths are stored
 * absolute and normalized. All methods are synchronized: the watch worker updates the graph
 * while other threads query it.
 */
public final class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final Map<Path, Set<Path>> forward = new LinkedHashMap<>();
    private final Map<Path, Set<Path>> reverse = new HashMap<>();

    /** Registers (or re-registers) a module with its transitive dependencies. */
    public synchronized void register(Path module, Collection<Path> transitiveDependencies) {
        Path key = canonical(module);
        removeEdges(key);
        Set<Path> deps = new LinkedHashSet<>();
        for (Path dep : transitiveDependencies) {
            deps.add(canonical(dep));
        }
        forward.put(key, deps);
        for (Path dep : deps) {
            reverse.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(key);
        }
        log.debug("Registered {} with {} dependencies", key, deps.size());
    }

    /** Drops the module and its outgoing edges. Returns whether it was registered. */
    public synchronized boolean remove(Path module) {
        Path key = canonical(module);
        removeEdges(key);
        return forward.remove(key) != null;
    }

    private void removeEdges(Path key) {
        Set<Path> old = forward.get(key);
        if (old == null) return;
        for (Path dep : old) {
            Set<Path> dependents = reverse.get(dep);
            if (dependents != null) {
                dependents.remove(key);
                if (dependents.isEmpty()) {
                    reverse.remove(dep);
                }
            }
        }
    }

    public synchronized boolean isModule(Path path) {
        return forward.containsKey(canonical(path));
    }

    public synchronized boolean isDependency(Path path) {
        return reverse.containsKey(canonical(path));
    }

    public synchronized Set<Path> modules() {
        return Set.copyOf(forward.keySet());
    }

    public synchronized List<Path> dependenciesOf(Path module) {
        return List.copyOf(forward.getOrDefault(canonical(module), Set.of()));
    }

    /** Modules that (transitively) depend on {@code dependency}, in registration order. */
    public synchronized List<Path> dependentsOf(Path dependency) {
        return List.copyOf(reverse.getOrDefault(canonical(dependency), Set.of()));
    }

    /**
     * Modules affected by the changed paths: changed modules themselves plus every module
     * depending on a changed file.
     */
    public synchronized Set<Path> affectedModules(Collection<Path> changedPaths) {
        Set<Path> affected = new LinkedHashSet<>();
        for (Path changed : changedPaths) {
            Path key = canonical(changed);
            if (forward.containsKey(key)) {
                affected.add(key);
            }
            affected.addAll(reverse.getOrDefault(key, Set.of()));
        }
        return affected;
    }

    public synchronized int size() {
        return forward.size();
    }

    private static Path canonical(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
