package io.specwatch.core.watch;

/**
 * Executes a rerun. Implementations should return {@link RunOutcome#CANCELLED} when the
 * calling thread is interrupted.
 */
@FunctionalInterface
public interface SpecRunner {

    RunOutcome run(WatchAction action);
}
