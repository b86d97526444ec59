package io.specwatch.core.model;

import java.util.List;

/**
 * A single declared test case inside a {@link SpecGroup}.
 *
 * @param description the description, or a {@code <dynamic at line N>} placeholder
 * @param lineNumber  1-based line of the declaration, 0 when unknown
 * @param endLine     1-based last line of the declaration, 0 when unknown
 * @param focused     declared with {@code fit} or inside {@code fdescribe}
 * @param skipped     declared with {@code xit} or inside {@code xdescribe}
 * @param pending     declared without a body
 * @param tags        tags in effect for this case, outermost first
 * @param dynamic     the identity could not be determined without execution
 * @param bodyHash    hash of the statically parsed body, {@code null} when unknown
 */
public record SpecCase(
        String description,
        int lineNumber,
        int endLine,
        boolean focused,
        boolean skipped,
        boolean pending,
        List<String> tags,
        boolean dynamic,
        String bodyHash
) {

    public SpecCase {
        tags = List.copyOf(tags);
    }

    /** Returns a copy carrying the given static provenance. */
    public SpecCase withProvenance(int endLine, String bodyHash) {
        return new SpecCase(description, lineNumber, endLine, focused, skipped, pending, tags, dynamic, bodyHash);
    }

    boolean covers(int line) {
        return lineNumber > 0 && line >= lineNumber && line <= Math.max(lineNumber, endLine);
    }
}
