package io.specwatch.core.model;

import java.util.List;

/**
 * A named nesting scope ({@code describe} / {@code context}) grouping cases and child groups.
 * The root group of a {@link TestTree} has an empty description and is not part of any
 * context path.
 */
public record SpecGroup(
        String description,
        int lineNumber,
        int endLine,
        List<SpecGroup> children,
        List<SpecCase> cases
) {

    public SpecGroup {
        children = List.copyOf(children);
        cases = List.copyOf(cases);
    }

    boolean covers(int line) {
        return lineNumber > 0 && line >= lineNumber && line <= Math.max(lineNumber, endLine);
    }
}
