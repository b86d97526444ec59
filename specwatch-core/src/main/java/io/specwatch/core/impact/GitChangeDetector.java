package io.specwatch.core.impact;

import io.specwatch.core.config.SpecWatchConfig;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists files changed relative to a base ref with JGit: commits between the base ref and
 * HEAD, plus optionally staged and unstaged working-tree changes.
 */
public final class GitChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(GitChangeDetector.class);

    private static final String DEV_NULL = "/dev/null";

    private final Path projectDir;
    private final SpecWatchConfig config;

    public GitChangeDetector(Path projectDir, SpecWatchConfig config) {
        this.projectDir = projectDir;
        this.config = config;
    }

    /**
     * Returns absolute paths of every changed file, resolved against the work tree.
     *
     * @throws IllegalStateException if the repository or the base ref cannot be read
     */
    public Set<Path> detectChangedFiles() {
        Set<Path> changed = new LinkedHashSet<>();

        try (Repository repository = new FileRepositoryBuilder()
                    .findGitDir(projectDir.toFile())
                    .build();
             Git git = new Git(repository)) {

            if (repository.isBare() || repository.getDirectory() == null) {
                throw new IllegalStateException("No git work tree found from " + projectDir);
            }
            Path workTree = repository.getWorkTree().toPath().toAbsolutePath().normalize();

            Set<String> relative = new LinkedHashSet<>(committedChanges(repository, git));
            if (config.includeUncommitted()) {
                relative.addAll(entryPaths(git.diff().call()));
            }
            if (config.includeStaged()) {
                relative.addAll(entryPaths(git.diff().setCached(true).call()));
            }
            for (String path : relative) {
                changed.add(workTree.resolve(path).normalize());
            }
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to detect git changes: {}", e.getMessage());
            throw new IllegalStateException(
                    "Unable to detect git changes. Verify the repository exists and the base ref '"
                    + config.baseRef() + "' is valid.", e);
        }

        log.info("Detected {} changed files against {}", changed.size(), config.baseRef());
        changed.forEach(f -> log.debug("  Changed: {}", f));
        return changed;
    }

    private Set<String> committedChanges(Repository repository, Git git) throws Exception {
        Set<String> files = new LinkedHashSet<>();

        ObjectId headId = repository.resolve("HEAD");
        if (headId == null) {
            log.warn("HEAD not found, is this an empty repository?");
            return files;
        }

        ObjectId baseId = resolveBaseRef(repository);
        if (baseId == null) {
            throw new IllegalStateException(
                    "Base ref '" + config.baseRef() + "' could not be resolved. "
                    + "Ensure the ref exists (e.g. run 'git fetch origin').");
        }

        List<DiffEntry> diffs = git.diff()
                .setOldTree(prepareTreeParser(repository, baseId))
                .setNewTree(prepareTreeParser(repository, headId))
                .call();

        for (DiffEntry entry : diffs) {
            switch (entry.getChangeType()) {
                case ADD, COPY, MODIFY -> files.add(entry.getNewPath());
                case DELETE -> files.add(entry.getOldPath());
                case RENAME -> {
                    files.add(entry.getOldPath());
                    files.add(entry.getNewPath());
                }
            }
        }
        return files;
    }

    private static Set<String> entryPaths(List<DiffEntry> diffs) {
        Set<String> files = new LinkedHashSet<>();
        for (DiffEntry entry : diffs) {
            if (entry.getNewPath() != null && !entry.getNewPath().equals(DEV_NULL)) {
                files.add(entry.getNewPath());
            }
            if (entry.getOldPath() != null && !entry.getOldPath().equals(DEV_NULL)) {
                files.add(entry.getOldPath());
            }
        }
        return files;
    }

    private ObjectId resolveBaseRef(Repository repository) throws IOException {
        ObjectId id = repository.resolve(config.baseRef());
        if (id != null) return id;
        return repository.resolve("refs/remotes/" + config.baseRef());
    }

    private static AbstractTreeIterator prepareTreeParser(Repository repository, ObjectId objectId) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(objectId);
            try (ObjectReader reader = repository.newObjectReader()) {
                CanonicalTreeParser parser = new CanonicalTreeParser();
                parser.reset(reader, commit.getTree().getId());
                return parser;
            }
        }
    }
}
