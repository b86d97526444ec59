package io.specwatch.core.discovery;

/**
 * Progress of one module through hybrid discovery.
 */
public enum DiscoveryState {
    NOT_STARTED,
    COMPILING,
    /** Module compiled and ran; its tree is ground truth. */
    EXECUTED,
    /** Module failed to compile or run; its tree comes from static analysis. */
    COMPILE_FAILED
}
