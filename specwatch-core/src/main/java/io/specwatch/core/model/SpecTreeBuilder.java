package io.specwatch.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable builder for a {@link TestTree}. Shared by the DSL runtime and the static parser so
 * both produce trees with the same inheritance rules: focus, skip, dynamic markers and tags
 * of an enclosing group apply to every case declared inside it.
 *
 * <p>Not thread-safe; one builder belongs to one discovery at a time.
 */
public final class SpecTreeBuilder {

    private static final class GroupFrame {
        final String description;
        final int lineNumber;
        int endLine;
        final boolean focused;
        final boolean skipped;
        final boolean dynamic;
        final List<GroupFrame> children = new ArrayList<>();
        final List<SpecCase> cases = new ArrayList<>();

        GroupFrame(String description, int lineNumber, int endLine,
                   boolean focused, boolean skipped, boolean dynamic) {
            this.description = description;
            this.lineNumber = lineNumber;
            this.endLine = endLine;
            this.focused = focused;
            this.skipped = skipped;
            this.dynamic = dynamic;
        }

        SpecGroup freeze() {
            List<SpecGroup> frozen = new ArrayList<>(children.size());
            for (GroupFrame child : children) {
                frozen.add(child.freeze());
            }
            return new SpecGroup(description, lineNumber, endLine, frozen, cases);
        }
    }

    private GroupFrame root;
    private final Deque<GroupFrame> stack = new ArrayDeque<>();
    private final Deque<String> tags = new ArrayDeque<>();
    private final List<String> warnings = new ArrayList<>();
    private boolean complete;

    public SpecTreeBuilder() {
        reset();
    }

    /** Discards everything recorded so far. */
    public void reset() {
        root = new GroupFrame("", 0, 0, false, false, false);
        stack.clear();
        stack.push(root);
        tags.clear();
        warnings.clear();
        complete = true;
    }

    public void enterGroup(String description, int lineNumber, int endLine,
                           boolean focused, boolean skipped, boolean dynamic) {
        GroupFrame parent = stack.peek();
        GroupFrame group = new GroupFrame(description, lineNumber, endLine,
                focused || parent.focused,
                skipped || parent.skipped,
                dynamic || parent.dynamic);
        parent.children.add(group);
        stack.push(group);
    }

    public void exitGroup() {
        if (stack.size() <= 1) {
            throw new IllegalStateException("exitGroup() without a matching enterGroup()");
        }
        stack.pop();
    }

    /** Records the last line of the innermost open group once it is known. */
    public void closeGroupAt(int endLine) {
        stack.peek().endLine = endLine;
    }

    public void pushTag(String tag) {
        tags.addLast(tag);
    }

    public void popTag() {
        if (tags.isEmpty()) {
            throw new IllegalStateException("popTag() without a matching pushTag()");
        }
        tags.removeLast();
    }

    public void addCase(String description, int lineNumber, int endLine,
                        boolean focused, boolean skipped, boolean pending,
                        boolean dynamic, String bodyHash) {
        GroupFrame group = stack.peek();
        group.cases.add(new SpecCase(description, lineNumber, endLine,
                focused || group.focused,
                skipped || group.skipped,
                pending,
                List.copyOf(tags),
                dynamic || group.dynamic,
                bodyHash));
    }

    /** Marks the tree as possibly missing declarations. */
    public void markIncomplete() {
        complete = false;
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    /** Depth of open groups, 0 at the root. */
    public int depth() {
        return stack.size() - 1;
    }

    public TestTree build() {
        return new TestTree(root.freeze(), complete, warnings);
    }
}
