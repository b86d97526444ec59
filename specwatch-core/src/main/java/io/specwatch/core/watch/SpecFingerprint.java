package io.specwatch.core.watch;

import io.specwatch.core.model.DiscoveredSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parts of a discovered case whose change means the case must rerun.
 * <p>
 * The body hash stands in for the source of the case. When no hash is known the
 * declaration line is used instead, so edits that move the case still count as changes.
 */
public record SpecFingerprint(
        List<String> tags,
        boolean focused,
        boolean skipped,
        boolean pending,
        boolean hasCompilationError,
        String bodyHash,
        int lineNumber
) {

    public SpecFingerprint {
        tags = List.copyOf(tags);
    }

    public static SpecFingerprint of(DiscoveredSpec spec) {
        List<String> tags = new ArrayList<>(spec.tags());
        Collections.sort(tags);
        int line = spec.bodyHash() == null ? spec.lineNumber() : 0;
        return new SpecFingerprint(tags, spec.focused(), spec.skipped(), spec.pending(),
                spec.hasCompilationError(), spec.bodyHash(), line);
    }
}
