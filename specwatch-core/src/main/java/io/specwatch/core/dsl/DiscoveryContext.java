package io.specwatch.core.dsl;

import io.specwatch.core.model.SpecTreeBuilder;
import io.specwatch.core.model.TestTree;

/**
 * Collects the declarations made through {@link Dsl} while a module executes. Bound to the
 * executing thread by {@link DiscoveryScope}.
 */
public final class DiscoveryContext {

    private final SpecTreeBuilder builder = new SpecTreeBuilder();

    SpecTreeBuilder builder() {
        return builder;
    }

    void reset() {
        builder.reset();
    }

    /** The tree declared so far. */
    public TestTree tree() {
        return builder.build();
    }
}
