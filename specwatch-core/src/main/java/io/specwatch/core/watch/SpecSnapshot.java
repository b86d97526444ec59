package io.specwatch.core.watch;

import io.specwatch.core.discovery.ModuleDiscovery;
import io.specwatch.core.model.DiscoveredSpec;
import io.specwatch.core.model.TestCaseIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identities and fingerprints of one module at one point in time.
 *
 * @param fingerprints identity to fingerprint, in declaration order
 * @param dynamic      identities cannot be trusted for diffing
 */
public record SpecSnapshot(Map<TestCaseIdentity, SpecFingerprint> fingerprints, boolean dynamic) {

    private static final Logger log = LoggerFactory.getLogger(SpecSnapshot.class);

    public SpecSnapshot {
        fingerprints = Collections.unmodifiableMap(new LinkedHashMap<>(fingerprints));
    }

    public static SpecSnapshot from(ModuleDiscovery discovery) {
        return of(discovery.specs(), !discovery.identitiesTrusted());
    }

    /**
     * Builds a snapshot; duplicate identities keep their first occurrence.
     */
    public static SpecSnapshot of(List<DiscoveredSpec> specs, boolean dynamic) {
        Map<TestCaseIdentity, SpecFingerprint> fingerprints = new LinkedHashMap<>();
        boolean anyDynamic = dynamic;
        for (DiscoveredSpec spec : specs) {
            anyDynamic |= spec.dynamic();
            if (fingerprints.putIfAbsent(spec.identity(), SpecFingerprint.of(spec)) != null) {
                log.warn("Duplicate spec identity {}; only the first declaration is tracked", spec.id());
            }
        }
        return new SpecSnapshot(fingerprints, anyDynamic);
    }

    public int size() {
        return fingerprints.size();
    }
}
