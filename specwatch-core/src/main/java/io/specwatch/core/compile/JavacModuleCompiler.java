package io.specwatch.core.compile;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import io.specwatch.core.cache.CacheKey;
import io.specwatch.core.cache.CompiledArtifact;
import io.specwatch.core.dsl.DiscoveryContext;
import io.specwatch.core.dsl.Dsl;
import io.specwatch.core.model.SpecModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compiles spec modules in process with the JDK compiler and keeps the class files in
 * memory.
 * <p>
 * The module and its {@code //SOURCES} dependencies are compiled as one unit against the
 * DSL and the current class path. Executing the result instantiates the module's first
 * top-level type, whose initializers run the {@link Dsl} declarations.
 */
public final class JavacModuleCompiler implements SpecModuleCompiler {

    private static final Logger log = LoggerFactory.getLogger(JavacModuleCompiler.class);

    private final JavaCompiler javac;
    private final String classPath;

    public JavacModuleCompiler() {
        this(ToolProvider.getSystemJavaCompiler());
    }

    JavacModuleCompiler(JavaCompiler javac) {
        this.javac = javac;
        this.classPath = buildClassPath();
    }

    @Override
    public CompiledArtifact compile(CacheKey key, SpecModule module, List<Path> sources) {
        long start = System.nanoTime();
        if (javac == null) {
            return CompiledArtifact.failure(key,
                    List.of("No system Java compiler available; run on a JDK, not a JRE"), elapsed(start));
        }

        String mainClassName;
        try {
            mainClassName = mainClassName(module.path());
        } catch (IOException e) {
            return CompiledArtifact.failure(key,
                    List.of(module.path() + ": cannot read module: " + e.getMessage()), elapsed(start));
        }
        if (mainClassName == null) {
            return CompiledArtifact.failure(key,
                    List.of(module.path() + ": no top-level type declared"), elapsed(start));
        }

        List<JavaFileObject> units = new ArrayList<>();
        for (Path source : sources) {
            if (Files.isRegularFile(source) && source.getFileName().toString().endsWith(".java")) {
                units.add(new SourceFile(source));
            } else {
                log.debug("Skipping non-Java or missing source {}", source);
            }
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        Map<String, byte[]> classes = new LinkedHashMap<>();
        List<String> options = List.of("-proc:none", "-classpath", classPath);

        boolean ok;
        try (StandardJavaFileManager standard = javac.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);
             InMemoryFileManager fileManager = new InMemoryFileManager(standard, classes)) {
            ok = Boolean.TRUE.equals(javac.getTask(null, fileManager, diagnostics, options, null, units).call());
        } catch (IOException | RuntimeException e) {
            log.debug("Compiler crashed on {}: {}", module.path(), e.toString());
            return CompiledArtifact.failure(key,
                    List.of(module.path() + ": compiler failure: " + e), elapsed(start));
        }

        List<String> messages = format(diagnostics.getDiagnostics());
        if (!ok) {
            log.debug("Compilation of {} failed with {} diagnostics", module.path(), messages.size());
            return CompiledArtifact.failure(key,
                    messages.isEmpty() ? List.of(module.path() + ": compilation failed") : messages,
                    elapsed(start));
        }
        if (!classes.containsKey(mainClassName)) {
            return CompiledArtifact.failure(key,
                    List.of(module.path() + ": compiled output has no class " + mainClassName), elapsed(start));
        }

        CompiledClasses compiled = new CompiledClasses(mainClassName, classes);
        Duration took = elapsed(start);
        log.debug("Compiled {} ({} classes, {} bytes) in {} ms",
                module.path(), classes.size(), compiled.sizeBytes(), took.toMillis());
        return CompiledArtifact.success(key, compiled, compiled.sizeBytes(), took, messages);
    }

    @Override
    public void execute(CompiledArtifact artifact, DiscoveryContext context) {
        if (!artifact.succeeded() || !(artifact.compiledForm() instanceof CompiledClasses compiled)) {
            throw new IllegalArgumentException("Not an executable artifact for " + artifact.key().modulePath());
        }

        ClassLoader loader = new ModuleClassLoader(compiled.classes(), Dsl.class.getClassLoader());
        try {
            Class<?> type = Class.forName(compiled.mainClassName(), true, loader);
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            constructor.newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ModuleExecutionException(compiled.mainClassName() + " threw during discovery: " + cause, cause);
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new ModuleExecutionException("Cannot instantiate " + compiled.mainClassName() + ": " + e, e);
        }
    }

    /**
     * Binary name of the first top-level type, or {@code null} when the module declares none.
     */
    static String mainClassName(Path module) throws IOException {
        String source = Files.readString(module, StandardCharsets.UTF_8);
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (result.getResult().isEmpty()) {
            return null;
        }
        CompilationUnit cu = result.getResult().get();
        if (cu.getTypes().isEmpty()) {
            return null;
        }
        if (cu.getTypes().size() > 1) {
            log.warn("{} declares {} top-level types; only {} is executed",
                    module, cu.getTypes().size(), cu.getType(0).getNameAsString());
        }
        TypeDeclaration<?> first = cu.getType(0);
        String pkg = cu.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        return pkg.isEmpty() ? first.getNameAsString() : pkg + "." + first.getNameAsString();
    }

    private static List<String> format(List<Diagnostic<? extends JavaFileObject>> diagnostics) {
        List<String> messages = new ArrayList<>();
        for (Diagnostic<? extends JavaFileObject> d : diagnostics) {
            if (d.getKind() == Diagnostic.Kind.NOTE) continue;
            String where = d.getSource() != null ? d.getSource().getName() + ":" + d.getLineNumber() + ": " : "";
            String kind = d.getKind() == Diagnostic.Kind.ERROR ? "error" : "warning";
            messages.add(where + kind + ": " + d.getMessage(Locale.ROOT));
        }
        return messages;
    }

    private static String buildClassPath() {
        List<String> entries = new ArrayList<>();
        try {
            entries.add(Path.of(Dsl.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
        } catch (URISyntaxException | RuntimeException e) {
            log.debug("Cannot locate DSL classes: {}", e.getMessage());
        }
        String javaClassPath = System.getProperty("java.class.path", "");
        if (!javaClassPath.isEmpty()) {
            entries.add(javaClassPath);
        }
        return String.join(File.pathSeparator, entries);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /** A source file read from disk. Module names carry a suffix javac would reject. */
    private static final class SourceFile extends SimpleJavaFileObject {
        private final Path path;

        SourceFile(Path path) {
            super(path.toUri(), Kind.SOURCE);
            this.path = path;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) throws IOException {
            return Files.readString(path, StandardCharsets.UTF_8);
        }

        @Override
        public boolean isNameCompatible(String simpleName, Kind kind) {
            return kind == Kind.SOURCE;
        }

        @Override
        public String getName() {
            return path.toString();
        }
    }

    private static final class ClassOutput extends SimpleJavaFileObject {
        private final String className;
        private final Map<String, byte[]> sink;

        ClassOutput(String className, Map<String, byte[]> sink) {
            super(URI.create("mem:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
            this.className = className;
            this.sink = sink;
        }

        @Override
        public OutputStream openOutputStream() {
            return new ByteArrayOutputStream() {
                @Override
                public void close() throws IOException {
                    super.close();
                    sink.put(className, toByteArray());
                }
            };
        }
    }

    private static final class InMemoryFileManager extends ForwardingJavaFileManager<JavaFileManager> {
        private final Map<String, byte[]> sink;

        InMemoryFileManager(JavaFileManager delegate, Map<String, byte[]> sink) {
            super(delegate);
            this.sink = sink;
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) throws IOException {
            if (kind == JavaFileObject.Kind.CLASS) {
                return new ClassOutput(className, sink);
            }
            return super.getJavaFileForOutput(location, className, kind, sibling);
        }
    }
}
