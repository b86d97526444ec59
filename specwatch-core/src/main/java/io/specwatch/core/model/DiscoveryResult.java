package io.specwatch.core.model;

import java.util.List;

/**
 * Outcome of discovering every spec module under a project root.
 */
public record DiscoveryResult(List<DiscoveredSpec> specs, List<DiscoveryError> errors) {

    public DiscoveryResult {
        specs = List.copyOf(specs);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Whether any discovered spec is focused, in which case runners only run focused specs. */
    public boolean hasFocused() {
        return specs.stream().anyMatch(DiscoveredSpec::focused);
    }
}
