package io.specwatch.core.discovery;

import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.model.DiscoveredSpec;
import io.specwatch.core.model.DiscoveryError;
import io.specwatch.core.model.DiscoveryResult;
import io.specwatch.core.model.ModulePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Asynchronous discovery surface: every module under a root, or a single module.
 * Modules are discovered in parallel on the supplied executor.
 */
public final class SpecDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(SpecDiscoverer.class);

    private final HybridDiscoverer discoverer;
    private final SpecWatchConfig config;
    private final Executor executor;

    public SpecDiscoverer(HybridDiscoverer discoverer, SpecWatchConfig config, Executor executor) {
        this.discoverer = discoverer;
        this.config = config;
        this.executor = executor;
    }

    /**
     * Discovers every spec module under {@code root}. Modules that fail to compile still
     * contribute their statically discovered specs, plus a {@link DiscoveryError}; modules
     * that cannot be read contribute only the error.
     */
    public CompletableFuture<DiscoveryResult> discoverAsync(Path root) {
        return CompletableFuture
                .supplyAsync(() -> SpecModuleScanner.collectSpecModules(root, config), executor)
                .thenCompose(modules -> {
                    List<CompletableFuture<ModuleResult>> futures = new ArrayList<>();
                    for (Path module : modules) {
                        futures.add(CompletableFuture
                                .supplyAsync(() -> discoverer.discover(module), executor)
                                .handle((discovery, error) -> toResult(root, module, discovery, error)));
                    }
                    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                            .thenApply(ignored -> combine(futures));
                });
    }

    /** Discovers a single module. */
    public CompletableFuture<List<DiscoveredSpec>> discoverFileAsync(Path module) {
        return CompletableFuture.supplyAsync(() -> discoverer.discover(module).specs(), executor);
    }

    private record ModuleResult(List<DiscoveredSpec> specs, DiscoveryError error) {}

    private static ModuleResult toResult(Path root, Path module, ModuleDiscovery discovery, Throwable error) {
        String relativePath = ModulePaths.relativize(root, module);
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CancellationException cancelled) {
                throw cancelled;
            }
            log.warn("Discovery of {} failed: {}", relativePath, cause.getMessage());
            return new ModuleResult(List.of(), new DiscoveryError(module, relativePath, cause.getMessage()));
        }
        DiscoveryError moduleError = discovery.diagnostic()
                .map(d -> new DiscoveryError(module, relativePath, d))
                .orElse(null);
        return new ModuleResult(discovery.specs(), moduleError);
    }

    private static DiscoveryResult combine(List<CompletableFuture<ModuleResult>> futures) {
        List<DiscoveredSpec> specs = new ArrayList<>();
        List<DiscoveryError> errors = new ArrayList<>();
        for (CompletableFuture<ModuleResult> future : futures) {
            ModuleResult result = future.join();
            specs.addAll(result.specs());
            if (result.error() != null) {
                errors.add(result.error());
            }
        }
        log.info("Discovered {} specs in {} modules ({} with errors)", specs.size(), futures.size(), errors.size());
        return new DiscoveryResult(specs, errors);
    }
}
