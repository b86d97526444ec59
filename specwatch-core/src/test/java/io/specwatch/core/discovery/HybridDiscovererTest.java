package io.specwatch.core.discovery;

import io.specwatch.core.cache.CacheKey;
import io.specwatch.core.cache.CompilationCache;
import io.specwatch.core.cache.CompiledArtifact;
import io.specwatch.core.cache.ContentHasher;
import io.specwatch.core.compile.CountingCompiler;
import io.specwatch.core.compile.ModuleExecutionException;
import io.specwatch.core.compile.SpecModuleCompiler;
import io.specwatch.core.config.SpecWatchConfig;
import io.specwatch.core.dsl.DiscoveryContext;
import io.specwatch.core.graph.DependencyResolver;
import io.specwatch.core.model.DiscoveredSpec;
import io.specwatch.core.model.SpecModule;
import io.specwatch.core.parse.StaticSpecParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HybridDiscovererTest {

    @TempDir
    Path tempDir;

    private CountingCompiler compiler;
    private CompilationCache cache;

    @BeforeEach
    void setUp() {
        compiler = new CountingCompiler();
        cache = new CompilationCache();
    }

    private HybridDiscoverer discoverer(SpecWatchConfig config) {
        return new HybridDiscoverer(config, tempDir, cache, new DependencyResolver(),
                compiler, new StaticSpecParser());
    }

    private HybridDiscoverer discoverer() {
        return discoverer(SpecWatchConfig.builder().build());
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n");
        return file;
    }

    /**
     * Holds every compilation of one module until released and tracks how many of them
     * overlap. All compilations fail, so discovery falls back to static analysis.
     */
    private static final class GatedCompiler implements SpecModuleCompiler {

        private final String gatedFile;
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger gatedCompilations = new AtomicInteger();
        private final AtomicInteger active = new AtomicInteger();
        private final AtomicInteger maxActive = new AtomicInteger();

        GatedCompiler(String gatedFile) {
            this.gatedFile = gatedFile;
        }

        @Override
        public CompiledArtifact compile(CacheKey key, SpecModule module, List<Path> sources) {
            if (module.path().getFileName().toString().equals(gatedFile)) {
                gatedCompilations.incrementAndGet();
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                entered.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    active.decrementAndGet();
                }
            }
            return CompiledArtifact.failure(key, List.of("gated"), Duration.ZERO);
        }

        @Override
        public void execute(CompiledArtifact artifact, DiscoveryContext context) {
            throw new ModuleExecutionException("gated modules never execute");
        }
    }

    @Test
    void executedModuleCarriesStaticProvenance() throws IOException {
        Path module = write("calc.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class CalcSpec {{",
                "    describe(\"Calculator\", () -> {",
                "        it(\"adds\", () -> {",
                "            int sum = 2 + 2;",
                "        });",
                "    });",
                "}}");

        HybridDiscoverer discoverer = discoverer();
        ModuleDiscovery discovery = discoverer.discover(module);

        assertEquals(DiscoveryState.EXECUTED, discoverer.state(module));
        assertFalse(discovery.compilationFailed());
        assertTrue(discovery.identitiesTrusted());
        assertEquals("calc.spec.java", discovery.relativePath());

        DiscoveredSpec spec = discovery.specs().get(0);
        assertEquals("calc.spec.java:Calculator/adds", spec.id());
        assertEquals(4, spec.lineNumber());
        assertEquals(6, spec.endLine());
        assertFalse(spec.hasCompilationError());
        assertNotNull(spec.bodyHash());
        assertFalse(spec.bodyHash().startsWith("module:"));
    }

    @Test
    void compileErrorFallsBackToStaticAnalysis() throws IOException {
        Path module = write("broken.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class BrokenSpec {{",
                "    describe(\"Broken\", () -> {",
                "        it(\"still listed\", () -> {",
                "            int x = \"oops\";",
                "        });",
                "    });",
                "}}");

        HybridDiscoverer discoverer = discoverer();
        ModuleDiscovery discovery = discoverer.discover(module);

        assertEquals(DiscoveryState.COMPILE_FAILED, discoverer.state(module));
        assertTrue(discovery.compilationFailed());
        assertTrue(discovery.diagnostic().orElseThrow().contains("error"));
        assertEquals(1, discovery.specs().size());

        DiscoveredSpec spec = discovery.specs().get(0);
        assertEquals("Broken > still listed", spec.displayName());
        assertTrue(spec.hasCompilationError());
        assertEquals(discovery.diagnostic().orElseThrow(), spec.diagnostic());
        assertEquals(0, compiler.executions());
    }

    @Test
    void throwingModuleFallsBackToStaticAnalysis() throws IOException {
        Path module = write("throws.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class ThrowsSpec {{",
                "    it(\"declared\", () -> {});",
                "    if (true) throw new IllegalStateException(\"setup exploded\");",
                "}}");

        ModuleDiscovery discovery = discoverer().discover(module);

        assertTrue(discovery.compilationFailed());
        assertTrue(discovery.diagnostic().orElseThrow().contains("setup exploded"));
        assertEquals("declared", discovery.specs().get(0).description());
        assertTrue(discovery.specs().get(0).hasCompilationError());
    }

    @Test
    void nullDescriptionFallsBackToStaticAnalysis() throws IOException {
        Path module = write("nulls.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class NullsSpec {{",
                "    String d = System.getProperty(\"specwatch.absent.property\");",
                "    it(d, () -> {});",
                "}}");

        ModuleDiscovery discovery = discoverer().discover(module);

        assertTrue(discovery.compilationFailed());
        assertTrue(discovery.diagnostic().orElseThrow().contains("Case description must not be null"));
        assertTrue(discovery.specs().get(0).dynamic());
        assertFalse(discovery.identitiesTrusted());
    }

    @Test
    void unchangedModuleIsCompiledOnce() throws IOException {
        Path module = write("a.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class ASpec {{ it(\"a\", () -> {}); }}");

        HybridDiscoverer discoverer = discoverer();
        ModuleDiscovery first = discoverer.discover(module);
        ModuleDiscovery second = discoverer.discover(module);

        assertEquals(1, compiler.compilations());
        assertEquals(2, compiler.executions());
        assertEquals(first.specs(), second.specs());
    }

    @Test
    void dependencyEditRecompiles() throws IOException {
        Path helper = write("Names.java", "class Names { static final String A = \"a\"; }");
        Path module = write("dep.spec.java",
                "//SOURCES Names.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class DepSpec {{ it(Names.A, () -> {}); }}");

        HybridDiscoverer discoverer = discoverer();
        assertEquals("a", discoverer.discover(module).specs().get(0).description());

        Files.writeString(helper, "class Names { static final String A = \"renamed\"; }\n");
        ModuleDiscovery discovery = discoverer.discover(module);

        assertEquals(2, compiler.compilations());
        assertEquals("renamed", discovery.specs().get(0).description());
        assertEquals(List.of(helper.toAbsolutePath().normalize()), discovery.module().dependencies());
    }

    @Test
    void cacheCanBeBypassed() throws IOException {
        Path module = write("a.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class ASpec {{ it(\"a\", () -> {}); }}");

        HybridDiscoverer discoverer = discoverer(SpecWatchConfig.builder().useCache(false).build());
        discoverer.discover(module);
        discoverer.discover(module);

        assertEquals(2, compiler.compilations());
        assertEquals(0, cache.stats().entryCount());
    }

    @Test
    void generatedCasesTakeModuleHash() throws IOException {
        Path module = write("gen.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class GenSpec {{",
                "    for (String n : java.util.List.of(\"one\", \"two\")) {",
                "        it(n, () -> {});",
                "    }",
                "}}");

        ModuleDiscovery discovery = discoverer().discover(module);

        String moduleHash = "module:" + ContentHasher.sha256(Files.readString(module));
        assertEquals(List.of("one", "two"),
                discovery.specs().stream().map(DiscoveredSpec::description).toList());
        for (DiscoveredSpec spec : discovery.specs()) {
            assertEquals(moduleHash, spec.bodyHash());
            assertFalse(spec.dynamic());
        }
    }

    @Test
    void dynamicFallbackIsNotTrusted() throws IOException {
        Path module = write("dyn.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class DynSpec {{",
                "    for (String n : java.util.List.of(\"one\")) {",
                "        it(n, () -> { int x = \"broken\"; });",
                "    }",
                "}}");

        ModuleDiscovery discovery = discoverer().discover(module);

        assertTrue(discovery.compilationFailed());
        assertTrue(discovery.specs().get(0).dynamic());
        assertFalse(discovery.identitiesTrusted());
    }

    @Test
    void missingModuleIsAnIoError() {
        assertThrows(UncheckedIOException.class,
                () -> discoverer().discover(tempDir.resolve("gone.spec.java")));
    }

    @Test
    void interruptedCallerIsCancelled() throws IOException {
        Path module = write("a.spec.java", "class ASpec {}");

        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> discoverer().discover(module));
        } finally {
            Thread.interrupted();
        }
        assertEquals(0, compiler.compilations());
    }

    @Test
    void sameModuleIsDiscoveredOneAtATime() throws Exception {
        Path a = write("a.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class ASpec {{ it(\"a\", () -> {}); }}");
        Path b = write("b.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class BSpec {{ it(\"b\", () -> {}); }}");
        GatedCompiler gated = new GatedCompiler("a.spec.java");
        HybridDiscoverer discoverer = new HybridDiscoverer(SpecWatchConfig.builder().useCache(false).build(),
                tempDir, cache, new DependencyResolver(), gated, new StaticSpecParser());

        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<ModuleDiscovery> first = pool.submit(() -> discoverer.discover(a));
            assertTrue(gated.entered.await(30, TimeUnit.SECONDS));
            assertEquals(DiscoveryState.COMPILING, discoverer.state(a));

            Future<ModuleDiscovery> second = pool.submit(() -> discoverer.discover(a));
            assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
            assertEquals(1, gated.gatedCompilations.get());

            ModuleDiscovery other = pool.submit(() -> discoverer.discover(b)).get(30, TimeUnit.SECONDS);
            assertEquals("b", other.specs().get(0).description());

            gated.release.countDown();
            assertEquals("a", first.get(30, TimeUnit.SECONDS).specs().get(0).description());
            assertEquals("a", second.get(30, TimeUnit.SECONDS).specs().get(0).description());
            assertEquals(2, gated.gatedCompilations.get());
            assertEquals(1, gated.maxActive.get());
        } finally {
            gated.release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void forgetResetsState() throws IOException {
        Path module = write("a.spec.java",
                "import static io.specwatch.core.dsl.Dsl.*;",
                "class ASpec {{ it(\"a\", () -> {}); }}");

        HybridDiscoverer discoverer = discoverer();
        discoverer.discover(module);
        discoverer.forget(module);

        assertEquals(DiscoveryState.NOT_STARTED, discoverer.state(module));
    }
}
