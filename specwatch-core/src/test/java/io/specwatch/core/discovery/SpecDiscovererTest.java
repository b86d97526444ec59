package io.specwatch.core.discovery;

import io.specwatch.core.cache.CompilationCache;
import io.specwatch.core.compile.CountingCompiler;
import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.graph.DependencyResolver;
import io.specwatch.core.model.DiscoveredSpec;
import io.specwatch.core.model.DiscoveryError;
import io.specwatch.core.model.DiscoveryResult;
import io.specwatch.core.parse.StaticSpecParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SpecDiscovererTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private SpecDiscoverer discoverer;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        SpecWatchConfig config = SpecWatchConfig.builder().build();
        HybridDiscoverer hybrid = new HybridDiscoverer(config, tempDir, new CompilationCache(),
                new DependencyResolver(), new CountingCompiler(), new StaticSpecParser());
        discoverer = new SpecDiscoverer(hybrid, config, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n");
        return file;
    }

    @Test
    void combinesModulesAndReportsFallbacks() throws IOException {
        write("a/ok.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class OkSpec {{ fit(\"works\", () -> {}); }}");
        write("b/broken.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class BrokenSpec {{ it(\"listed anyway\", () -> { int x = \"s\"; }); }}");

        DiscoveryResult result = discoverer.discoverAsync(tempDir).join();

        assertEquals(List.of("works", "listed anyway"),
                result.specs().stream().map(DiscoveredSpec::description).toList());
        assertTrue(result.hasFocused());
        assertTrue(result.hasErrors());

        DiscoveryError error = result.errors().get(0);
        assertEquals("b/broken.spec.java", error.relativePath());
        assertTrue(error.message().contains("error"));
        assertTrue(result.specs().get(1).hasCompilationError());
    }

    @Test
    void emptyRootYieldsEmptyResult() {
        DiscoveryResult result = discoverer.discoverAsync(tempDir).join();

        assertTrue(result.specs().isEmpty());
        assertFalse(result.hasErrors());
    }

    @Test
    void discoversSingleModule() throws IOException {
        Path module = write("one.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class OneSpec {{ describe(\"One\", () -> it(\"a\", () -> {})); }}");

        List<DiscoveredSpec> specs = discoverer.discoverFileAsync(module).join();

        assertEquals(1, specs.size());
        assertEquals("one.spec.java:One/a", specs.get(0).id());
    }
}
