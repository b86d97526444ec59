package io.specwatch.core.impact;

import io.specwatch.core.graph.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps changed files to the spec modules that must run: changed modules themselves plus
 * every module depending on a changed file.
 */
public final class ImpactAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ImpactAnalyzer.class);

    private final Supplier<Set<Path>> changedFiles;

    public ImpactAnalyzer(GitChangeDetector detector) {
        this(detector::detectChangedFiles);
    }

    ImpactAnalyzer(Supplier<Set<Path>> changedFiles) {
        this.changedFiles = changedFiles;
    }

    public Set<Path> affectedModules(DependencyGraph graph) {
        return affectedModules(graph, changedFiles.get());
    }

    public static Set<Path> affectedModules(DependencyGraph graph, Collection<Path> changed) {
        Set<Path> affected = graph.affectedModules(changed);
        log.info("{} changed files affect {} of {} spec modules", changed.size(), affected.size(), graph.size());
        return affected;
    }
}
