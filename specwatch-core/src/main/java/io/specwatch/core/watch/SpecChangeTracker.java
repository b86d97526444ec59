package io.specwatch.core.watch;

import io.specwatch.core.model.TestCaseIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the last recorded snapshot of every module and the last seen content hash of
 * every dependency, and diffs new snapshots against them.
 * <p>
 * Snapshots are overwritten, never merged. State is in memory only.
 */
public final class SpecChangeTracker {

    private static final Logger log = LoggerFactory.getLogger(SpecChangeTracker.class);

    private final Map<Path, SpecSnapshot> states = new HashMap<>();
    private final Map<Path, String> dependencyHashes = new HashMap<>();

    public synchronized void recordState(Path module, SpecSnapshot snapshot) {
        states.put(canonical(module), snapshot);
        log.debug("Recorded {} specs for {}", snapshot.size(), module);
    }

    public synchronized boolean hasState(Path module) {
        return states.containsKey(canonical(module));
    }

    public synchronized Optional<SpecSnapshot> state(Path module) {
        return Optional.ofNullable(states.get(canonical(module)));
    }

    /** Drops the module's snapshot, e.g. after it was deleted. */
    public synchronized void remove(Path module) {
        states.remove(canonical(module));
    }

    public synchronized void clear() {
        states.clear();
        dependencyHashes.clear();
    }

    /**
     * Diffs {@code snapshot} against the recorded state without recording it.
     * <p>
     * Without a recorded state every identity is added. If either snapshot is dynamic the
     * lists are left empty and {@link SpecChangeSet#dynamicSpecsDetected()} is set.
     */
    public synchronized SpecChangeSet getChanges(Path module, SpecSnapshot snapshot, boolean dependencyChanged) {
        Path key = canonical(module);
        SpecSnapshot previous = states.get(key);

        if (snapshot.dynamic() || (previous != null && previous.dynamic())) {
            return new SpecChangeSet(key, List.of(), List.of(), List.of(), true, dependencyChanged);
        }

        Map<TestCaseIdentity, SpecFingerprint> old = previous != null ? previous.fingerprints() : Map.of();
        List<TestCaseIdentity> added = new ArrayList<>();
        List<TestCaseIdentity> modified = new ArrayList<>();
        List<TestCaseIdentity> removed = new ArrayList<>();

        for (Map.Entry<TestCaseIdentity, SpecFingerprint> entry : snapshot.fingerprints().entrySet()) {
            SpecFingerprint before = old.get(entry.getKey());
            if (before == null) {
                added.add(entry.getKey());
            } else if (!before.equals(entry.getValue())) {
                modified.add(entry.getKey());
            }
        }
        for (TestCaseIdentity identity : old.keySet()) {
            if (!snapshot.fingerprints().containsKey(identity)) {
                removed.add(identity);
            }
        }

        log.debug("{}: {} added, {} modified, {} removed", module, added.size(), modified.size(), removed.size());
        return new SpecChangeSet(key, added, modified, removed, false, dependencyChanged);
    }

    public synchronized void recordDependency(Path dependency, String contentHash) {
        dependencyHashes.put(canonical(dependency), contentHash);
    }

    public synchronized boolean hasDependency(Path dependency) {
        return dependencyHashes.containsKey(canonical(dependency));
    }

    public synchronized void removeDependency(Path dependency) {
        dependencyHashes.remove(canonical(dependency));
    }

    /** True when the dependency was never recorded or its content differs from the recorded one. */
    public synchronized boolean hasDependencyChanged(Path dependency, String contentHash) {
        return !contentHash.equals(dependencyHashes.get(canonical(dependency)));
    }

    private static Path canonical(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
