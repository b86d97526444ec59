package io.specwatch.core.discovery;

import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.model.ModulePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds spec modules under a project root.
 *
 * <p>Modules are files whose name ends with the configured suffix. Build output, VCS
 * metadata and IDE directories are pruned during the walk; paths matching the configured
 * exclusion globs (relative to the root) are dropped.
 */
public final class SpecModuleScanner {

    private static final Logger log = LoggerFactory.getLogger(SpecModuleScanner.class);

    /** Directories that are never descended into. */
    private static final Set<String> SKIP_DIRS = Set.of(
            ".git", ".gradle", ".idea", "build", "out", "target", "node_modules"
    );

    private SpecModuleScanner() {
        // utility class
    }

    /**
     * Collects every spec module under {@code projectDir}, sorted by path so discovery
     * output is stable across runs.
     *
     * @param projectDir root directory to walk
     * @param config     supplies the module suffix and exclusion globs
     * @return absolute, normalized module paths
     */
    public static List<Path> collectSpecModules(Path projectDir, SpecWatchConfig config) {
        Path root = ModulePaths.canonical(projectDir);
        List<Path> modules = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            log.warn("Spec root {} is not a directory", root);
            return modules;
        }

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String dirName = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (!dir.equals(root) && SKIP_DIRS.contains(dirName)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!ModulePaths.isSpecModule(file, config.specSuffix())) {
                        return FileVisitResult.CONTINUE;
                    }
                    String relative = ModulePaths.relativize(root, file);
                    if (ModulePaths.isExcluded(relative, config.excludePaths())) {
                        log.debug("Excluded by pattern: {}", relative);
                    } else {
                        modules.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Cannot visit {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Error scanning spec modules under {}: {}", root, e.getMessage());
        }

        modules.sort(null);
        log.debug("Found {} spec modules under {}", modules.size(), root);
        return modules;
    }
}
