package io.specwatch.core.discovery;

import io.specwatch.core.model.DiscoveredSpec;
import io.specwatch.core.model.SpecModule;

import java.util.List;
import java.util.Optional;

/**
 * Discovery result for a single module.
 *
 * @param module       the module as read for this pass
 * @param relativePath module path relative to the project root
 * @param outcome      execution result or static fallback
 * @param specs        flattened cases in declaration order
 * @param warnings     static analysis warnings, reported for fallbacks only
 */
public record ModuleDiscovery(
        SpecModule module,
        String relativePath,
        DiscoveryOutcome outcome,
        List<DiscoveredSpec> specs,
        List<String> warnings
) {

    public ModuleDiscovery {
        specs = List.copyOf(specs);
        warnings = List.copyOf(warnings);
    }

    public boolean compilationFailed() {
        return outcome instanceof DiscoveryOutcome.StaticFallback;
    }

    public Optional<String> diagnostic() {
        if (outcome instanceof DiscoveryOutcome.StaticFallback fallback) {
            return Optional.of(fallback.diagnostic());
        }
        return Optional.empty();
    }

    /**
     * Whether identities can be diffed: no placeholder identity and, for fallbacks, a
     * static parse that saw every declaration.
     */
    public boolean identitiesTrusted() {
        boolean anyDynamic = specs.stream().anyMatch(DiscoveredSpec::dynamic);
        return !anyDynamic && outcome.tree().complete();
    }
}
