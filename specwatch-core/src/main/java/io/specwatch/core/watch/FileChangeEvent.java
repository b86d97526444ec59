package io.specwatch.core.watch;

import java.nio.file.Path;

/**
 * A debounced file-system change delivered by the file watcher.
 *
 * @param path         changed, created or deleted file
 * @param isTestModule whether the watcher classified the file as a spec module
 */
public record FileChangeEvent(Path path, boolean isTestModule) {

    public FileChangeEvent {
        path = path.toAbsolutePath().normalize();
    }

    /** Combines two events for the same path. */
    FileChangeEvent merge(FileChangeEvent other) {
        return new FileChangeEvent(path, isTestModule || other.isTestModule);
    }
}
