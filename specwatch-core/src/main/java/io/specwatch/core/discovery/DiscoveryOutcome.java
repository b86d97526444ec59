package io.specwatch.core.discovery;

import io.specwatch.core.model.TestTree;

/**
 * How a module's tree was obtained.
 */
public sealed interface DiscoveryOutcome permits DiscoveryOutcome.Executed, DiscoveryOutcome.StaticFallback {

    TestTree tree();

    DiscoveryState state();

    /** The module ran; descriptions are exactly what the runner will see. */
    record Executed(TestTree tree) implements DiscoveryOutcome {
        @Override
        public DiscoveryState state() {
            return DiscoveryState.EXECUTED;
        }
    }

    /**
     * The module could not run, the tree comes from the static parser.
     *
     * @param diagnostic compiler or execution error explaining the fallback
     */
    record StaticFallback(TestTree tree, String diagnostic) implements DiscoveryOutcome {
        @Override
        public DiscoveryState state() {
            return DiscoveryState.COMPILE_FAILED;
        }
    }
}
