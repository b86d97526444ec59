package io.specwatch.core.parse;

import io.specwatch.core.model.ModulePaths;
import io.specwatch.core.model.TestCaseIdentity;
import io.specwatch.core.model.TestTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves editor locations ({@code file:line}) to the test cases declared there.
 * <p>
 * Matching, in order: cases whose source span covers the line; every case of the innermost
 * group covering the line; declarations starting at most one line before it.
 */
public final class LineLocator {

    private static final Logger log = LoggerFactory.getLogger(LineLocator.class);

    /** How far above a declaration a requested line may be and still select it. */
    static final int PROXIMITY = 1;

    private final StaticSpecParser parser;
    private final Path projectDir;

    public LineLocator(StaticSpecParser parser, Path projectDir) {
        this.parser = parser;
        this.projectDir = projectDir;
    }

    /**
     * @throws NoSpecsAtLineException if nothing is declared at or near {@code line}
     */
    public Set<TestCaseIdentity> locate(Path module, int line) {
        return locate(module, Set.of(line));
    }

    /**
     * Union of the cases found at each of the lines.
     *
     * @throws NoSpecsAtLineException if none of the lines selects anything
     */
    public Set<TestCaseIdentity> locate(Path module, Set<Integer> lines) {
        TestTree tree = parser.parse(module);
        String relativePath = ModulePaths.relativize(projectDir, module);

        Set<TestCaseIdentity> selected = new LinkedHashSet<>();
        int firstLine = 0;
        for (int line : lines) {
            if (firstLine == 0) firstLine = line;
            selected.addAll(tree.selectAtLine(relativePath, line, PROXIMITY));
        }
        if (selected.isEmpty()) {
            throw new NoSpecsAtLineException(module, firstLine);
        }
        log.debug("Lines {} of {} select {} cases", lines, relativePath, selected.size());
        return selected;
    }
}
