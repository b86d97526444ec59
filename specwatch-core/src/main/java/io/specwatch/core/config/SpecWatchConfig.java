package io.specwatch.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for spec discovery and watch mode.
 * Immutable value object; use the {@link Builder} to construct.
 */
public final class SpecWatchConfig {

    /** Upper bound for the debounce window. */
    static final Duration MAX_DEBOUNCE = Duration.ofSeconds(10);

    /** Upper bound for parallel module discovery. */
    static final int MAX_PARALLELISM = 64;

    private final String specSuffix;
    private final List<String> excludePaths;
    private final Duration debounce;
    private final boolean incremental;
    private final boolean useCache;
    private final int discoveryParallelism;
    private final String baseRef;
    private final boolean includeUncommitted;
    private final boolean includeStaged;

    private SpecWatchConfig(Builder builder) {
        this.specSuffix = builder.specSuffix;
        this.excludePaths = List.copyOf(builder.excludePaths);
        this.debounce = builder.debounce;
        this.incremental = builder.incremental;
        this.useCache = builder.useCache;
        this.discoveryParallelism = builder.discoveryParallelism;
        this.baseRef = builder.baseRef;
        this.includeUncommitted = builder.includeUncommitted;
        this.includeStaged = builder.includeStaged;
    }

    public String specSuffix() { return specSuffix; }
    public List<String> excludePaths() { return excludePaths; }
    public Duration debounce() { return debounce; }
    public boolean incremental() { return incremental; }
    public boolean useCache() { return useCache; }
    public int discoveryParallelism() { return discoveryParallelism; }
    public String baseRef() { return baseRef; }
    public boolean includeUncommitted() { return includeUncommitted; }
    public boolean includeStaged() { return includeStaged; }

    /** Creates a builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String specSuffix = ".spec.java";
        private List<String> excludePaths = List.of("**/generated/**");
        private Duration debounce = Duration.ofMillis(200);
        private boolean incremental = true;
        private boolean useCache = true;
        private int discoveryParallelism = clampParallelism(Runtime.getRuntime().availableProcessors());
        private String baseRef = "origin/main";
        private boolean includeUncommitted = true;
        private boolean includeStaged = true;

        public Builder specSuffix(String specSuffix) {
            if (specSuffix == null || specSuffix.isBlank()) {
                throw new IllegalArgumentException("specSuffix must not be null or blank");
            }
            this.specSuffix = specSuffix;
            return this;
        }

        public Builder baseRef(String baseRef) {
            if (baseRef == null || baseRef.isBlank()) {
                throw new IllegalArgumentException("baseRef must not be null or blank");
            }
            if (baseRef.replace("\\", "/").contains("../")) {
                throw new IllegalArgumentException("baseRef contains suspicious path traversal: " + baseRef);
            }
            this.baseRef = baseRef;
            return this;
        }

        public Builder debounce(Duration v) {
            if (v == null || v.isNegative()) {
                this.debounce = Duration.ZERO;
            } else {
                this.debounce = v.compareTo(MAX_DEBOUNCE) > 0 ? MAX_DEBOUNCE : v;
            }
            return this;
        }

        public Builder excludePaths(List<String> v) { this.excludePaths = v; return this; }
        public Builder incremental(boolean v) { this.incremental = v; return this; }
        public Builder useCache(boolean v) { this.useCache = v; return this; }
        public Builder discoveryParallelism(int v) { this.discoveryParallelism = clampParallelism(v); return this; }
        public Builder includeUncommitted(boolean v) { this.includeUncommitted = v; return this; }
        public Builder includeStaged(boolean v) { this.includeStaged = v; return this; }

        public SpecWatchConfig build() {
            return new SpecWatchConfig(this);
        }

        private static int clampParallelism(int v) {
            return Math.max(1, Math.min(v, MAX_PARALLELISM));
        }
    }
}
