package io.specwatch.core.dsl;

/**
 * Body of a group or test case. May throw anything; discovery only runs group bodies.
 */
@FunctionalInterface
public interface SpecBody {

    void run() throws Exception;
}
