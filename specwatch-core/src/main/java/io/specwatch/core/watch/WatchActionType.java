package io.specwatch.core.watch;

public enum WatchActionType {
    /** Nothing to rerun. */
    SKIP,
    /** Rerun the whole project. */
    RUN_ALL,
    /** Rerun every case of the listed modules. */
    RUN_FILES,
    /** Rerun the cases of one module whose display names match the filter. */
    RUN_FILTERED
}
