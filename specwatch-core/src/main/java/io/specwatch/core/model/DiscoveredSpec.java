package io.specwatch.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Flattened view of one test case, as handed to listing, filtering and change tracking.
 *
 * @param identity            stable identity of the case
 * @param sourceFile          absolute path of the spec module
 * @param lineNumber          1-based declaration line, 0 when unknown
 * @param endLine             1-based last line, 0 when unknown
 * @param focused             focused via {@code fit} / {@code fdescribe}
 * @param skipped             skipped via {@code xit} / {@code xdescribe}
 * @param pending             declared without a body
 * @param tags                tags in effect
 * @param dynamic             identity is a placeholder that cannot be trusted for diffing
 * @param hasCompilationError discovered by static fallback because the module could not run
 * @param diagnostic          compiler or execution diagnostic, {@code null} when none
 * @param bodyHash            hash of the statically parsed body, {@code null} when unknown
 */
public record DiscoveredSpec(
        TestCaseIdentity identity,
        Path sourceFile,
        int lineNumber,
        int endLine,
        boolean focused,
        boolean skipped,
        boolean pending,
        List<String> tags,
        boolean dynamic,
        boolean hasCompilationError,
        String diagnostic,
        String bodyHash
) {

    public DiscoveredSpec {
        tags = List.copyOf(tags);
    }

    public String id() {
        return identity.stableId();
    }

    public String displayName() {
        return identity.displayName();
    }

    public String description() {
        return identity.description();
    }

    public List<String> contextPath() {
        return identity.contextPath();
    }

    /** Returns a copy flagged as discovered from a module that failed to compile or run. */
    public DiscoveredSpec withCompilationError(String diagnostic) {
        return new DiscoveredSpec(identity, sourceFile, lineNumber, endLine, focused, skipped, pending,
                tags, dynamic, true, diagnostic, bodyHash);
    }

    /** Returns a copy carrying the static line span and body hash. */
    public DiscoveredSpec withProvenance(int lineNumber, int endLine, String bodyHash) {
        return new DiscoveredSpec(identity, sourceFile, lineNumber, endLine, focused, skipped, pending,
                tags, dynamic, hasCompilationError, diagnostic, bodyHash);
    }
}
