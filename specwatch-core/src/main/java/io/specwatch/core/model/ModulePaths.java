package io.specwatch.core.model;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Path helpers shared by scanning, identity building and impact analysis.
 * Relative paths handed out here always use {@code /} separators.
 */
public final class ModulePaths {

    private ModulePaths() {
        // utility class
    }

    /** Absolute, normalized form used as the key for every per-module map. */
    public static Path canonical(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * Returns {@code file} relative to {@code root} with {@code /} separators, or the
     * file's own normalized path when it lies outside the root.
     */
    public static String relativize(Path root, Path file) {
        Path canonicalRoot = canonical(root);
        Path canonicalFile = canonical(file);
        Path relative = canonicalFile.startsWith(canonicalRoot)
                ? canonicalRoot.relativize(canonicalFile)
                : canonicalFile;
        return relative.toString().replace('\\', '/');
    }

    public static boolean isSpecModule(Path file, String specSuffix) {
        Path name = file.getFileName();
        return name != null && name.toString().endsWith(specSuffix);
    }

    /**
     * Whether the relative path matches any of the exclusion globs. A glob starting with
     * {@code **}{@code /} also matches at the root.
     */
    public static boolean isExcluded(String relativePath, List<String> excludeGlobs) {
        Path candidate = Path.of(relativePath);
        for (String pattern : excludeGlobs) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            if (matcher.matches(candidate)) {
                return true;
            }
            if (pattern.startsWith("**/")) {
                PathMatcher rootMatcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3));
                if (rootMatcher.matches(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }
}
