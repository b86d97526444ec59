package io.specwatch.core.parse;

import com.github.javaparser.StaticJavaParser;
import io.specwatch.core.model.DiscoveredSpec;
import io.specwatch.core.model.TestTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StaticSpecParserTest {

    @TempDir
    Path tempDir;

    private final StaticSpecParser parser = new StaticSpecParser();

    private List<DiscoveredSpec> specs(TestTree tree) {
        return tree.flatten("m.spec.java", Path.of("/p/m.spec.java"));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void parsesNestedGroupsWithLineSpans() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class MSpec {{",
                "    describe(\"Stack\", () -> {",
                "        it(\"starts empty\", () -> {",
                "            check();",
                "        });",
                "        context(\"after push\", () -> {",
                "            fit(\"is not empty\", () -> {});",
                "        });",
                "    });",
                "}}"));

        assertTrue(tree.complete());
        List<DiscoveredSpec> specs = specs(tree);
        assertEquals(2, specs.size());

        DiscoveredSpec first = specs.get(0);
        assertEquals("Stack > starts empty", first.displayName());
        assertEquals(4, first.lineNumber());
        assertEquals(6, first.endLine());
        assertNotNull(first.bodyHash());

        DiscoveredSpec second = specs.get(1);
        assertEquals(List.of("Stack", "after push"), second.contextPath());
        assertTrue(second.focused());
        assertEquals(8, second.lineNumber());
    }

    @Test
    void recognizesPendingSkippedAndTags() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{",
                "    xdescribe(\"Off\", () -> {",
                "        tag(\"slow\", () -> {",
                "            it(\"later\");",
                "        });",
                "    });",
                "}}"));

        DiscoveredSpec spec = specs(tree).get(0);
        assertTrue(spec.skipped());
        assertTrue(spec.pending());
        assertEquals(List.of("slow"), spec.tags());
    }

    @Test
    void concatenatedLiteralsAreStatic() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{",
                "    it(\"adds \" + \"numbers\", () -> {});",
                "}}"));

        DiscoveredSpec spec = specs(tree).get(0);
        assertEquals("adds numbers", spec.description());
        assertFalse(spec.dynamic());
    }

    @Test
    void dynamicDescriptionBecomesPlaceholder() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{",
                "    String name = \"x\";",
                "    it(name, () -> {});",
                "}}"));

        DiscoveredSpec spec = specs(tree).get(0);
        assertEquals("<dynamic at line 3>", spec.description());
        assertTrue(spec.dynamic());
        assertTrue(tree.hasDynamicSpecs());
        assertTrue(tree.warnings().contains(
                "Line 3: 'it' has dynamic description - cannot analyze statically"));
    }

    @Test
    void dynamicGroupMarksNestedCasesDynamic() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{",
                "    for (String s : java.util.List.of(\"a\")) {",
                "        describe(s, () -> it(\"works\", () -> {}));",
                "    }",
                "}}"));

        DiscoveredSpec spec = specs(tree).get(0);
        assertEquals("works", spec.description());
        assertTrue(spec.dynamic());
    }

    @Test
    void bodyHashChangesOnlyWithBody() {
        String before = lines("class MSpec {{", "    it(\"a\", () -> { int x = 1; });", "}}");
        String moved = lines("class MSpec {{", "", "", "    it(\"a\", () -> { int x = 1; });", "}}");
        String edited = lines("class MSpec {{", "    it(\"a\", () -> { int x = 2; });", "}}");

        String original = specs(parser.parse(Path.of("m.spec.java"), before)).get(0).bodyHash();
        assertEquals(original, specs(parser.parse(Path.of("m.spec.java"), moved)).get(0).bodyHash());
        assertNotEquals(original, specs(parser.parse(Path.of("m.spec.java"), edited)).get(0).bodyHash());
    }

    @Test
    void methodReferenceBodyMarksTreeIncomplete() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{",
                "    it(\"runs\", MSpec::check);",
                "}",
                "static void check() {}",
                "}"));

        assertFalse(tree.complete());
        assertEquals(1, tree.caseCount());
    }

    @Test
    void helperMethodDeclarationsAreReported() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {",
                "    MSpec() { shared(); }",
                "    void shared() { it(\"hidden\", () -> {}); }",
                "}"));

        assertFalse(tree.complete());
        assertEquals(0, tree.caseCount());
        assertTrue(tree.warnings().stream().anyMatch(w -> w.contains("method 'shared'")));
    }

    @Test
    void onlyFirstTopLevelTypeIsWalked() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{ it(\"kept\", () -> {}); }}",
                "class Other {{ it(\"ignored\", () -> {}); }}"));

        assertEquals(List.of("kept"), specs(tree).stream().map(DiscoveredSpec::description).toList());
        assertTrue(tree.complete());
        assertFalse(tree.warnings().isEmpty());
    }

    @Test
    void syntaxErrorsBecomeWarnings() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{",
                "    it(\"a\", () -> {});",
                "    it(\"b\" () -> {});",
                "}}"));

        assertFalse(tree.complete());
        assertFalse(tree.warnings().isEmpty());
    }

    @Test
    void unreadableFileYieldsIncompleteTree() {
        TestTree tree = parser.parse(tempDir.resolve("missing.spec.java"));

        assertFalse(tree.complete());
        assertEquals(0, tree.caseCount());
        assertEquals(1, tree.warnings().size());
    }

    @Test
    void qualifiedDslCallsAreRecognized() {
        TestTree tree = parser.parse(Path.of("m.spec.java"), lines(
                "class MSpec {{",
                "    io.specwatch.core.dsl.Dsl.it(\"qualified\", () -> {});",
                "    other.it(\"not ours\", () -> {});",
                "}}"));

        assertEquals(List.of("qualified"), specs(tree).stream().map(DiscoveredSpec::description).toList());
    }

    @Test
    void literalValueHandlesParenthesesAndConcatenation() {
        assertEquals(Optional.of("ab"),
                StaticSpecParser.literalValue(StaticJavaParser.parseExpression("(\"a\" + \"b\")")));
        assertEquals(Optional.empty(),
                StaticSpecParser.literalValue(StaticJavaParser.parseExpression("\"a\" + x")));
    }
}
