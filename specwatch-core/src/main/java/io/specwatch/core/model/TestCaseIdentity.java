package io.specwatch.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stable composite key of a test case: module-relative path, ordered context path and
 * description.
 *
 * <p>The relative path always uses {@code /} separators so ids are identical on every host
 * platform. Uniqueness is only guaranteed within one module, and only as long as the
 * module does not declare the same description twice under the same context path.
 */
public record TestCaseIdentity(String relativePath, List<String> contextPath, String description) {

    public TestCaseIdentity {
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(description, "description");
        relativePath = relativePath.replace('\\', '/');
        contextPath = List.copyOf(contextPath);
    }

    /**
     * Stable id used by "run by id" tooling.
     * Format: {@code relative/path/Foo.spec.java:Context/Nested/description}.
     */
    public String stableId() {
        if (contextPath.isEmpty()) {
            return relativePath + ":" + description;
        }
        return relativePath + ":" + String.join("/", contextPath) + "/" + description;
    }

    /**
     * Human-readable name matched by rerun filters.
     * Format: {@code Context > Nested > description}.
     */
    public String displayName() {
        List<String> parts = new ArrayList<>(contextPath);
        parts.add(description);
        return String.join(" > ", parts);
    }

    @Override
    public String toString() {
        return stableId();
    }
}
