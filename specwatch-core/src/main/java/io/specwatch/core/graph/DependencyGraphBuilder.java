package io.specwatch.core.graph;

import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.discovery.SpecModuleScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds a {@link DependencyGraph} for every spec module under a project root.
 */
public final class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final SpecWatchConfig config;
    private final DependencyResolver resolver;

    public DependencyGraphBuilder(SpecWatchConfig config, DependencyResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    public DependencyGraph build(Path projectDir) {
        DependencyGraph graph = new DependencyGraph();
        List<Path> modules = SpecModuleScanner.collectSpecModules(projectDir, config);
        for (Path module : modules) {
            graph.register(module, resolver.transitiveDependencies(module));
        }
        log.info("Built dependency graph for {} spec modules under {}", graph.size(), projectDir);
        return graph;
    }
}
