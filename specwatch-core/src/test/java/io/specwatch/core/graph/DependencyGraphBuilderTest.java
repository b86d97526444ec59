package io.specwatch.core.graph;

import io.specwatch.core.config.SpecWatchConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    @TempDir
    Path tempDir;

    @Test
    void registersEveryModuleWithTransitiveDependencies() throws Exception {
        Files.createDirectories(tempDir.resolve("specs"));
        Files.writeString(tempDir.resolve("specs/a.spec.java"), "//SOURCES Helper.java\nclass A {}");
        Files.writeString(tempDir.resolve("specs/b.spec.java"), "class B {}");
        Files.writeString(tempDir.resolve("specs/Helper.java"), "//SOURCES Util.java\nclass Helper {}");
        Files.writeString(tempDir.resolve("specs/Util.java"), "class Util {}");

        DependencyGraph graph = new DependencyGraphBuilder(SpecWatchConfig.builder().build(), new DependencyResolver())
                .build(tempDir);

        assertEquals(2, graph.size());
        assertEquals(List.of(tempDir.resolve("specs/a.spec.java")),
                graph.dependentsOf(tempDir.resolve("specs/Util.java")));
        assertFalse(graph.isModule(tempDir.resolve("specs/Helper.java")));
    }
}
