package io.specwatch.core.watch;

import io.specwatch.core.model.TestCaseIdentity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Difference between two snapshots of one module. Lives for a single watch iteration.
 */
public record SpecChangeSet(
        Path modulePath,
        List<TestCaseIdentity> added,
        List<TestCaseIdentity> modified,
        List<TestCaseIdentity> removed,
        boolean dynamicSpecsDetected,
        boolean dependencyChanged
) {

    public SpecChangeSet {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        removed = List.copyOf(removed);
    }

    public boolean hasChanges() {
        return dynamicSpecsDetected || dependencyChanged
                || !added.isEmpty() || !modified.isEmpty() || !removed.isEmpty();
    }

    /** The whole module (or project, when dynamic) must rerun instead of a filtered subset. */
    public boolean requiresFullRun() {
        return dynamicSpecsDetected || dependencyChanged;
    }

    /** Added then modified identities. */
    public List<TestCaseIdentity> specsToRun() {
        List<TestCaseIdentity> toRun = new ArrayList<>(added);
        toRun.addAll(modified);
        return toRun;
    }
}
