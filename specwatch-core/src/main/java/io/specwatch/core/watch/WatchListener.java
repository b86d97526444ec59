package io.specwatch.core.watch;

/**
 * Receives watch-mode progress. All callbacks run on the watch worker thread.
 */
public interface WatchListener {

    /** A rerun is about to start. */
    default void onAction(WatchAction action) {
    }

    /** A rerun started by {@link #onAction} has ended. */
    default void onOutcome(WatchAction action, RunOutcome outcome) {
    }

    /** Informational message, e.g. why nothing was rerun. */
    default void onNotice(String message) {
    }
}
