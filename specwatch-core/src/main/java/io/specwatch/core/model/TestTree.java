package io.specwatch.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Hierarchy of declared groups and cases for one spec module.
 *
 * @param root     unnamed root group
 * @param complete {@code false} when the producer could not see every declaration
 *                 (unparsable regions, method-reference bodies)
 * @param warnings diagnostics collected while building the tree
 */
public record TestTree(SpecGroup root, boolean complete, List<String> warnings) {

    public TestTree {
        warnings = List.copyOf(warnings);
    }

    /** An empty, incomplete tree carrying a single warning. */
    public static TestTree incomplete(String warning) {
        return new TestTree(new SpecGroup("", 0, 0, List.of(), List.of()), false, List.of(warning));
    }

    /**
     * Flattens the tree in declaration order: a group's own cases first, then its children.
     */
    public List<DiscoveredSpec> flatten(String relativePath, Path sourceFile) {
        List<DiscoveredSpec> result = new ArrayList<>();
        flatten(root, new ArrayList<>(), relativePath, sourceFile, result);
        return result;
    }

    private static void flatten(SpecGroup group, List<String> contextPath, String relativePath,
                                Path sourceFile, List<DiscoveredSpec> result) {
        for (SpecCase c : group.cases()) {
            result.add(new DiscoveredSpec(
                    new TestCaseIdentity(relativePath, contextPath, c.description()),
                    sourceFile, c.lineNumber(), c.endLine(),
                    c.focused(), c.skipped(), c.pending(), c.tags(), c.dynamic(),
                    false, null, c.bodyHash()));
        }
        for (SpecGroup child : group.children()) {
            contextPath.add(child.description());
            flatten(child, contextPath, relativePath, sourceFile, result);
            contextPath.remove(contextPath.size() - 1);
        }
    }

    /** Number of cases in the tree. */
    public int caseCount() {
        return countCases(root);
    }

    private static int countCases(SpecGroup group) {
        int count = group.cases().size();
        for (SpecGroup child : group.children()) {
            count += countCases(child);
        }
        return count;
    }

    /** Whether any case carries a placeholder identity. */
    public boolean hasDynamicSpecs() {
        return hasDynamic(root);
    }

    private static boolean hasDynamic(SpecGroup group) {
        for (SpecCase c : group.cases()) {
            if (c.dynamic()) return true;
        }
        for (SpecGroup child : group.children()) {
            if (hasDynamic(child)) return true;
        }
        return false;
    }

    /**
     * Selects the cases declared at {@code line}: cases whose span covers the line, else every
     * case of the innermost group covering it, else cases or groups starting within
     * {@code proximity} lines before it. Returns an empty set when nothing matches.
     */
    public Set<TestCaseIdentity> selectAtLine(String relativePath, int line, int proximity) {
        Set<TestCaseIdentity> covering = new LinkedHashSet<>();
        collectCovering(root, new ArrayList<>(), relativePath, line, covering);
        if (!covering.isEmpty()) {
            return covering;
        }

        Set<TestCaseIdentity> nearby = new LinkedHashSet<>();
        collectNearby(root, new ArrayList<>(), relativePath, line, proximity, nearby);
        return nearby;
    }

    /**
     * Depth-first: the innermost covering declaration wins. Returns true once something
     * at or below {@code group} covered the line.
     */
    private static boolean collectCovering(SpecGroup group, List<String> contextPath, String relativePath,
                                           int line, Set<TestCaseIdentity> out) {
        for (SpecGroup child : group.children()) {
            if (child.covers(line)) {
                contextPath.add(child.description());
                boolean found = collectCovering(child, contextPath, relativePath, line, out);
                if (!found) {
                    collectAll(child, contextPath, relativePath, out);
                }
                contextPath.remove(contextPath.size() - 1);
                return true;
            }
        }
        for (SpecCase c : group.cases()) {
            if (c.covers(line)) {
                out.add(new TestCaseIdentity(relativePath, contextPath, c.description()));
            }
        }
        return !out.isEmpty();
    }

    private static void collectNearby(SpecGroup group, List<String> contextPath, String relativePath,
                                      int line, int proximity, Set<TestCaseIdentity> out) {
        for (SpecCase c : group.cases()) {
            int distance = line - c.lineNumber();
            if (c.lineNumber() > 0 && distance > 0 && distance <= proximity) {
                out.add(new TestCaseIdentity(relativePath, contextPath, c.description()));
            }
        }
        for (SpecGroup child : group.children()) {
            contextPath.add(child.description());
            int distance = line - child.lineNumber();
            if (child.lineNumber() > 0 && distance > 0 && distance <= proximity) {
                collectAll(child, contextPath, relativePath, out);
            } else {
                collectNearby(child, contextPath, relativePath, line, proximity, out);
            }
            contextPath.remove(contextPath.size() - 1);
        }
    }

    private static void collectAll(SpecGroup group, List<String> contextPath, String relativePath,
                                   Set<TestCaseIdentity> out) {
        for (SpecCase c : group.cases()) {
            out.add(new TestCaseIdentity(relativePath, contextPath, c.description()));
        }
        for (SpecGroup child : group.children()) {
            contextPath.add(child.description());
            collectAll(child, contextPath, relativePath, out);
            contextPath.remove(contextPath.size() - 1);
        }
    }
}
