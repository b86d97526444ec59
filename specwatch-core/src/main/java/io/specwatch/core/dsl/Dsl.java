package io.specwatch.core.dsl;

import io.specwatch.core.model.SpecTreeBuilder;

import java.util.Optional;

/**
 * Declaration DSL used by spec modules:
 * <pre>{@code
 * import static io.specwatch.core.dsl.Dsl.*;
 *
 * class CalculatorSpec {{
 *     describe("Calculator", () -> {
 *         it("adds", () -> assertEquals(4, 2 + 2));
 *         xit("divides by zero");
 *     });
 * }}
 * }</pre>
 * Group bodies run immediately to register nested declarations; case bodies are recorded but
 * never run during discovery. Line numbers come from the caller's stack frame. A null
 * description or tag is rejected with an {@link IllegalArgumentException}, which fails the
 * module's execution.
 */
public final class Dsl {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private Dsl() {
        // static DSL
    }

    public static void describe(String description, SpecBody body) {
        group(description, false, false, body);
    }

    public static void context(String description, SpecBody body) {
        group(description, false, false, body);
    }

    public static void fdescribe(String description, SpecBody body) {
        group(description, true, false, body);
    }

    public static void xdescribe(String description, SpecBody body) {
        group(description, false, true, body);
    }

    public static void it(String description, SpecBody body) {
        testCase(description, false, false, body == null);
    }

    /** Pending case: declared without a body. */
    public static void it(String description) {
        testCase(description, false, false, true);
    }

    public static void fit(String description, SpecBody body) {
        testCase(description, true, false, body == null);
    }

    public static void xit(String description, SpecBody body) {
        testCase(description, false, true, body == null);
    }

    public static void xit(String description) {
        testCase(description, false, true, true);
    }

    /** Applies {@code tag} to every case declared inside {@code body}. */
    public static void tag(String tag, SpecBody body) {
        requireText(tag, "Tag");
        SpecTreeBuilder builder = DiscoveryScope.current().builder();
        builder.pushTag(tag);
        try {
            runGroupBody(body, "tag('" + tag + "')");
        } finally {
            builder.popTag();
        }
    }

    private static void group(String description, boolean focused, boolean skipped, SpecBody body) {
        requireText(description, "Group description");
        SpecTreeBuilder builder = DiscoveryScope.current().builder();
        builder.enterGroup(description, callerLine(), 0, focused, skipped, false);
        try {
            runGroupBody(body, "'" + description + "'");
        } finally {
            builder.exitGroup();
        }
    }

    private static void testCase(String description, boolean focused, boolean skipped, boolean pending) {
        requireText(description, "Case description");
        DiscoveryScope.current().builder()
                .addCase(description, callerLine(), 0, focused, skipped, pending, false, null);
    }

    private static void requireText(String value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " must not be null");
        }
    }

    private static void runGroupBody(SpecBody body, String what) {
        if (body == null) return;
        try {
            body.run();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Body of " + what + " failed during discovery", e);
        }
    }

    private static int callerLine() {
        Optional<Integer> line = WALKER.walk(frames -> frames
                .filter(f -> !f.getClassName().equals(Dsl.class.getName()))
                .findFirst()
                .map(StackWalker.StackFrame::getLineNumber));
        return line.filter(n -> n > 0).orElse(0);
    }
}
