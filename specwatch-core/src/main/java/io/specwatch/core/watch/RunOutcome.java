package io.specwatch.core.watch;

/** How a triggered rerun ended. */
public enum RunOutcome {
    SUCCEEDED,
    FAILED,
    /** Superseded by a newer change before it finished. */
    CANCELLED
}
