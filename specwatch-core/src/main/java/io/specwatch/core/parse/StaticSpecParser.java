package io.specwatch.core.parse;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import io.specwatch.core.cache.ContentHasher;
import io.specwatch.core.model.SpecTreeBuilder;
import io.specwatch.core.model.TestTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enumerates spec declarations by reading a module's syntax tree, without compiling or
 * running anything.
 *
 * <p>Only DSL calls in the initializers and constructors of the module's first top-level
 * type are considered. Group bodies written as lambdas are walked; case bodies are only
 * hashed. What the parser cannot resolve is reported rather than guessed:
 * <ul>
 *   <li>a description that is not a string literal (or a {@code +} concatenation of
 *       literals) becomes a {@code <dynamic at line N>} placeholder marked dynamic;</li>
 *   <li>a group body that is not a lambda, a case body given as a method reference, or
 *       declarations made from helper methods mark the tree incomplete;</li>
 *   <li>syntax errors are turned into warnings and mark the tree incomplete, keeping
 *       whatever the parser recovered.</li>
 * </ul>
 */
public final class StaticSpecParser {

    private static final Logger log = LoggerFactory.getLogger(StaticSpecParser.class);

    private static final Set<String> GROUP_CALLS = Set.of("describe", "context", "fdescribe", "xdescribe");
    private static final Set<String> CASE_CALLS = Set.of("it", "fit", "xit");
    private static final String TAG_CALL = "tag";

    public TestTree parse(Path module) {
        String source;
        try {
            source = Files.readString(module, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read {} for static analysis: {}", module, e.getMessage());
            return TestTree.incomplete("Cannot read " + module + ": " + e.getMessage());
        }
        return parse(module, source);
    }

    public TestTree parse(Path module, String source) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);

        SpecTreeBuilder builder = new SpecTreeBuilder();
        for (Problem problem : result.getProblems()) {
            String where = problem.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> "Line " + r.begin.line + ": ")
                    .orElse("");
            builder.warn(where + problem.getMessage());
            builder.markIncomplete();
        }

        if (result.getResult().isEmpty()) {
            log.debug("Static parse of {} produced no syntax tree", module);
            builder.markIncomplete();
            return builder.build();
        }

        CompilationUnit cu = result.getResult().get();
        List<TypeDeclaration<?>> types = cu.getTypes();
        if (types.isEmpty()) {
            return builder.build();
        }
        if (types.size() > 1) {
            String message = "Only the first top-level type '" + types.get(0).getNameAsString()
                    + "' declares specs; " + (types.size() - 1) + " other type(s) ignored";
            log.warn("{}: {}", module, message);
            builder.warn(message);
        }

        new Walker(builder).walkType(types.get(0));
        TestTree tree = builder.build();
        log.debug("Statically parsed {}: {} cases, complete={}", module, tree.caseCount(), tree.complete());
        return tree;
    }

    /** Returns the statically known value of a description expression, if any. */
    static Optional<String> literalValue(Expression expression) {
        if (expression instanceof StringLiteralExpr literal) {
            return Optional.of(literal.asString());
        }
        if (expression instanceof TextBlockLiteralExpr textBlock) {
            return Optional.of(textBlock.asString());
        }
        if (expression instanceof EnclosedExpr enclosed) {
            return literalValue(enclosed.getInner());
        }
        if (expression instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.PLUS) {
            Optional<String> left = literalValue(binary.getLeft());
            Optional<String> right = literalValue(binary.getRight());
            if (left.isPresent() && right.isPresent()) {
                return Optional.of(left.get() + right.get());
            }
        }
        return Optional.empty();
    }

    private static final class Walker {

        private final SpecTreeBuilder builder;

        Walker(SpecTreeBuilder builder) {
            this.builder = builder;
        }

        void walkType(TypeDeclaration<?> type) {
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof InitializerDeclaration initializer) {
                    walk(initializer.getBody());
                } else if (member instanceof ConstructorDeclaration constructor) {
                    walk(constructor.getBody());
                } else if (member instanceof MethodDeclaration method) {
                    reportHelperDeclarations(method);
                }
            }
        }

        private void reportHelperDeclarations(MethodDeclaration method) {
            boolean declares = method.findAll(MethodCallExpr.class).stream().anyMatch(Walker::isDslCall);
            if (declares) {
                int line = line(method);
                builder.warn("Line " + line + ": method '" + method.getNameAsString()
                        + "' declares specs - their position cannot be analyzed statically");
                builder.markIncomplete();
            }
        }

        private void walk(Node node) {
            List<Node> children = new ArrayList<>(node.getChildNodes());
            children.sort(Node.NODE_BY_BEGIN_POSITION);
            for (Node child : children) {
                if (child instanceof MethodCallExpr call && isDslCall(call)) {
                    declaration(call);
                } else {
                    walk(child);
                }
            }
        }

        private void declaration(MethodCallExpr call) {
            String name = call.getNameAsString();
            if (call.getArguments().isEmpty()) {
                builder.warn("Line " + line(call) + ": '" + name + "' without arguments is ignored");
                builder.markIncomplete();
                return;
            }
            Expression first = call.getArgument(0);
            Expression body = call.getArguments().size() > 1 ? call.getArgument(1) : null;

            if (TAG_CALL.equals(name)) {
                tag(call, first, body);
            } else if (GROUP_CALLS.contains(name)) {
                group(call, name, first, body);
            } else {
                testCase(call, name, first, body);
            }
        }

        private void tag(MethodCallExpr call, Expression tagExpr, Expression body) {
            Optional<String> tag = literalValue(tagExpr);
            if (tag.isEmpty()) {
                builder.warn("Line " + line(call) + ": 'tag' has dynamic name - cannot analyze statically");
                builder.markIncomplete();
            }
            builder.pushTag(tag.orElse("<dynamic>"));
            try {
                groupBody(call, body);
            } finally {
                builder.popTag();
            }
        }

        private void group(MethodCallExpr call, String name, Expression descriptionExpr, Expression body) {
            int line = line(call);
            Optional<String> description = literalValue(descriptionExpr);
            if (description.isEmpty()) {
                builder.warn(dynamicWarning(line, name));
            }
            builder.enterGroup(description.orElse(placeholder(line)), line, endLine(call),
                    "fdescribe".equals(name), "xdescribe".equals(name), description.isEmpty());
            try {
                groupBody(call, body);
            } finally {
                builder.exitGroup();
            }
        }

        private void groupBody(MethodCallExpr call, Expression body) {
            if (body == null || body instanceof NullLiteralExpr) {
                return;
            }
            if (body instanceof LambdaExpr lambda) {
                walk(lambda.getBody());
                return;
            }
            builder.warn("Line " + line(call) + ": '" + call.getNameAsString()
                    + "' body is not a lambda - nested specs cannot be analyzed statically");
            builder.markIncomplete();
        }

        private void testCase(MethodCallExpr call, String name, Expression descriptionExpr, Expression body) {
            int line = line(call);
            Optional<String> description = literalValue(descriptionExpr);
            if (description.isEmpty()) {
                builder.warn(dynamicWarning(line, name));
            }
            boolean pending = body == null || body instanceof NullLiteralExpr;
            if (body instanceof MethodReferenceExpr) {
                builder.warn("Line " + line + ": '" + name
                        + "' body is a method reference - changes to it cannot be tracked statically");
                builder.markIncomplete();
            }
            String bodyHash = ContentHasher.sha256(pending ? "" : body.toString());
            builder.addCase(description.orElse(placeholder(line)), line, endLine(call),
                    "fit".equals(name), "xit".equals(name), pending, description.isEmpty(), bodyHash);
        }

        private static boolean isDslCall(MethodCallExpr call) {
            String name = call.getNameAsString();
            if (!GROUP_CALLS.contains(name) && !CASE_CALLS.contains(name) && !TAG_CALL.equals(name)) {
                return false;
            }
            return call.getScope()
                    .map(scope -> scope.toString().equals("Dsl") || scope.toString().endsWith(".Dsl"))
                    .orElse(true);
        }

        private static String dynamicWarning(int line, String name) {
            return "Line " + line + ": '" + name + "' has dynamic description - cannot analyze statically";
        }

        private static String placeholder(int line) {
            return "<dynamic at line " + line + ">";
        }

        private static int line(Node node) {
            return node.getBegin().map(p -> p.line).orElse(0);
        }

        private static int endLine(Node node) {
            return node.getEnd().map(p -> p.line).orElse(0);
        }
    }
}
