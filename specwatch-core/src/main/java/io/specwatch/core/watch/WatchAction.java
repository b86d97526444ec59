package io.specwatch.core.watch;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Collections;

/**
 * What to rerun in response to a change, and the module snapshots and dependency content
 * hashes to record once that rerun succeeded.
 *
 * @param type              kind of rerun
 * @param files             modules to run, empty for {@link WatchActionType#SKIP} and
 *                          {@link WatchActionType#RUN_ALL}
 * @param filterPattern     anchored display-name regex for {@link WatchActionType#RUN_FILTERED},
 *                          otherwise {@code null}
 * @param message           user-facing explanation
 * @param snapshotsToRecord module snapshots that become current after a successful run
 * @param dependencyStampsToRecord dependency content hashes that become current after a
 *                          successful run
 */
public record WatchAction(
        WatchActionType type,
        List<Path> files,
        String filterPattern,
        String message,
        Map<Path, SpecSnapshot> snapshotsToRecord,
        Map<Path, String> dependencyStampsToRecord
) {

    public WatchAction {
        files = List.copyOf(files);
        snapshotsToRecord = Collections.unmodifiableMap(new LinkedHashMap<>(snapshotsToRecord));
        dependencyStampsToRecord = Collections.unmodifiableMap(new LinkedHashMap<>(dependencyStampsToRecord));
    }

    public static WatchAction skip(String message) {
        return skip(message, Map.of());
    }

    public static WatchAction skip(String message, Map<Path, SpecSnapshot> snapshots) {
        return new WatchAction(WatchActionType.SKIP, List.of(), null, message, snapshots, Map.of());
    }

    public static WatchAction runAll(String message) {
        return runAll(message, Map.of());
    }

    public static WatchAction runAll(String message, Map<Path, SpecSnapshot> snapshots) {
        return new WatchAction(WatchActionType.RUN_ALL, List.of(), null, message, snapshots, Map.of());
    }

    public static WatchAction runFiles(List<Path> files, String message, Map<Path, SpecSnapshot> snapshots) {
        return new WatchAction(WatchActionType.RUN_FILES, files, null, message, snapshots, Map.of());
    }

    public static WatchAction runFiltered(Path file, String filterPattern, String message,
                                          Map<Path, SpecSnapshot> snapshots) {
        return new WatchAction(WatchActionType.RUN_FILTERED, List.of(file), filterPattern, message, snapshots, Map.of());
    }

    public WatchAction withDependencyStamps(Map<Path, String> stamps) {
        Map<Path, String> merged = new LinkedHashMap<>(dependencyStampsToRecord);
        merged.putAll(stamps);
        return new WatchAction(type, files, filterPattern, message, snapshotsToRecord, merged);
    }

    public boolean isSkip() {
        return type == WatchActionType.SKIP;
    }
}
