package io.specwatch.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpecTreeBuilderTest {

    private static final Path FILE = Path.of("/p/a.spec.java");

    @Test
    void groupModifiersAndTagsApplyToNestedCases() {
        SpecTreeBuilder builder = new SpecTreeBuilder();
        builder.enterGroup("Outer", 1, 10, false, true, false);
        builder.pushTag("slow");
        builder.enterGroup("Inner", 2, 9, true, false, false);
        builder.addCase("works", 3, 3, false, false, false, false, null);
        builder.exitGroup();
        builder.popTag();
        builder.addCase("untagged", 8, 8, false, false, false, false, null);
        builder.exitGroup();

        List<DiscoveredSpec> specs = builder.build().flatten("a.spec.java", FILE);

        assertEquals(2, specs.size());
        DiscoveredSpec nested = specs.stream().filter(s -> s.description().equals("works")).findFirst().orElseThrow();
        assertTrue(nested.focused());
        assertTrue(nested.skipped());
        assertEquals(List.of("slow"), nested.tags());
        assertEquals(List.of("Outer", "Inner"), nested.contextPath());

        DiscoveredSpec sibling = specs.stream().filter(s -> s.description().equals("untagged")).findFirst().orElseThrow();
        assertFalse(sibling.focused());
        assertTrue(sibling.skipped());
        assertTrue(sibling.tags().isEmpty());
    }

    @Test
    void dynamicGroupMakesCasesDynamic() {
        SpecTreeBuilder builder = new SpecTreeBuilder();
        builder.enterGroup("<dynamic at line 1>", 1, 3, false, false, true);
        builder.addCase("literal", 2, 2, false, false, false, false, "h");
        builder.exitGroup();

        TestTree tree = builder.build();

        assertTrue(tree.hasDynamicSpecs());
        assertTrue(tree.flatten("a.spec.java", FILE).get(0).dynamic());
    }

    @Test
    void resetDiscardsDeclarationsAndIncompleteness() {
        SpecTreeBuilder builder = new SpecTreeBuilder();
        builder.enterGroup("G", 1, 1, false, false, false);
        builder.addCase("c", 1, 1, false, false, false, false, null);
        builder.markIncomplete();
        builder.warn("something");

        builder.reset();
        TestTree tree = builder.build();

        assertEquals(0, tree.caseCount());
        assertTrue(tree.complete());
        assertTrue(tree.warnings().isEmpty());
        assertEquals(0, builder.depth());
    }

    @Test
    void unbalancedExitIsRejected() {
        SpecTreeBuilder builder = new SpecTreeBuilder();
        assertThrows(IllegalStateException.class, builder::exitGroup);
        assertThrows(IllegalStateException.class, builder::popTag);
    }
}
