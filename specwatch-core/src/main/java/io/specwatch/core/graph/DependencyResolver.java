package io.specwatch.core.graph;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code //SOURCES} edges from spec modules and resolves them transitively.
 * <p>
 * A directive line lists one or more paths separated by whitespace; each path is resolved
 * against the directory of the file that declares it:
 * <pre>{@code
 * //SOURCES ../support/Fixtures.java Money.java
 * }</pre>
 * Only the first top-level type of a module is canonical: when more types follow, directives
 * placed after the end of the first one are ignored with a warning.
 * <p>
 * Transitive resolution is an iterative breadth-first walk with a visited set: self and
 * mutual cycles terminate on the second visit and never raise. Edges to missing files are
 * kept so their creation still invalidates dependents, but they are not expanded.
 */
public final class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private static final Pattern SOURCES_DIRECTIVE = Pattern.compile("^\\s*//SOURCES\\s+(.+?)\\s*$");

    /**
     * Direct dependencies of the module on disk. An unreadable module has none.
     */
    public List<Path> directDependencies(Path modulePath) {
        Path module = modulePath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(module)) {
            return List.of();
        }
        try {
            return directDependencies(module, Files.readString(module, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Cannot read {} for dependency extraction: {}", module, e.getMessage());
            return List.of();
        }
    }

    /**
     * Direct dependencies declared in {@code source}, resolved against the module's
     * directory, de-duplicated in first-occurrence order.
     */
    public List<Path> directDependencies(Path modulePath, String source) {
        Path module = modulePath.toAbsolutePath().normalize();
        Path baseDir = module.getParent();
        int lastCanonicalLine = firstTypeEndLineIfMore(source);

        Set<Path> deps = new LinkedHashSet<>();
        String[] lines = source.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            Matcher m = SOURCES_DIRECTIVE.matcher(lines[i]);
            if (!m.matches()) {
                continue;
            }
            int lineNumber = i + 1;
            if (lastCanonicalLine > 0 && lineNumber > lastCanonicalLine) {
                log.warn("{}:{}: //SOURCES after the first top-level type is ignored", module, lineNumber);
                continue;
            }
            for (String entry : m.group(1).split("\\s+")) {
                if (entry.isEmpty()) continue;
                Path dep = baseDir.resolve(entry).normalize();
                if (!dep.equals(module)) {
                    deps.add(dep);
                }
            }
        }
        return new ArrayList<>(deps);
    }

    /**
     * Every module reachable from {@code modulePath} through {@code //SOURCES} edges, in
     * breadth-first order, excluding the module itself.
     */
    public List<Path> transitiveDependencies(Path modulePath) {
        Path module = modulePath.toAbsolutePath().normalize();
        Set<Path> visited = new LinkedHashSet<>();
        visited.add(module);
        Deque<Path> queue = new ArrayDeque<>();
        queue.add(module);

        while (!queue.isEmpty()) {
            Path current = queue.poll();
            for (Path dep : directDependencies(current)) {
                if (visited.add(dep)) {
                    if (Files.isRegularFile(dep)) {
                        queue.add(dep);
                    } else {
                        log.debug("Dependency {} of {} does not exist, not expanding", dep, current);
                    }
                }
            }
        }

        visited.remove(module);
        log.debug("Resolved {} transitive dependencies for {}", visited.size(), module);
        return new ArrayList<>(visited);
    }

    /**
     * End line of the first top-level type when the module declares more than one, otherwise
     * 0 (also when the source cannot be parsed): all directives are then honoured.
     */
    private static int firstTypeEndLineIfMore(String source) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            return 0;
        }
        List<TypeDeclaration<?>> types = result.getResult().get().getTypes();
        if (types.size() < 2) {
            return 0;
        }
        return types.get(0).getEnd().map(p -> p.line).orElse(0);
    }
}
