package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.directive.TransformationDirective.Inject;
import com.codeadapt.core.model.InjectionPoint;
import com.codeadapt.core.model.InjectionPosition;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splices code at an injection point.
 *
 * <p>The point's location is resolved against the current tree:
 * <ul>
 *   <li>{@code function:NAME} - function declarations, functions and arrows assigned to a
 *       variable or property, class and object methods, named default-exported functions</li>
 *   <li>{@code method:NAME} - class and object methods, and functions assigned to a property</li>
 *   <li>{@code comment:MARKER} - statement-level comments containing the marker</li>
 * </ul>
 *
 * <p>For functions, {@code before} prepends to the body, {@code after} appends,
 * {@code replace} replaces the body and {@code wrap} puts the code first and delimits the
 * existing body with {@code // <pointId>:begin} and {@code // <pointId>:end} comments. For
 * comments the code goes before, after or in place of the comment; {@code wrap} keeps the
 * comment between the markers. Every match is spliced. Bodies are rewritten bottom-up, so
 * injected code is never matched again.
 */
final class InjectPass extends AstRewriter implements TransformationPass {

    private static final Logger log = LoggerFactory.getLogger(InjectPass.class);

    private final Inject directive;
    private InjectionLocation location;
    private InjectionPosition position;
    private int spliced;

    InjectPass(Inject directive) {
        this.directive = directive;
    }

    @Override
    public Program apply(Program program, TransformContext context) {
        Optional<InjectionPoint> point = context.metadata().findInjectionPoint(directive.pointId());
        if (point.isEmpty()) {
            context.warn(WarningType.UNRESOLVED_INJECTION_POINT,
                "Unknown injection point '" + directive.pointId() + "'");
            return program;
        }
        Optional<InjectionLocation> parsed = InjectionLocation.parse(point.get().location());
        if (parsed.isEmpty()) {
            context.warn(WarningType.UNRESOLVED_INJECTION_POINT,
                "Malformed location '" + point.get().location() + "' of injection point '" + directive.pointId() + "'");
            return program;
        }
        this.location = parsed.get();
        this.position = directive.position() != null ? directive.position() : point.get().kind();
        Program result = rewriteProgram(program);
        if (spliced == 0) {
            context.warn(WarningType.UNRESOLVED_INJECTION_POINT,
                "Location '" + point.get().location() + "' of injection point '" + directive.pointId() + "' matches nothing");
            return program;
        }
        log.debug("Injected code at {} location(s) for point '{}'", spliced, directive.pointId());
        return result;
    }

    // ---------------------------------------------------------------- function locations

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
        FunctionDeclaration rewritten = (FunctionDeclaration) super.visitFunctionDeclaration(functionDeclaration);
        if (matchesFunction(rewritten.id().name())) {
            return rewritten.withBody(splice(rewritten.body()));
        }
        return rewritten;
    }

    @Override
    public Node visitVariableDeclarator(VariableDeclarator variableDeclarator) {
        VariableDeclarator rewritten = (VariableDeclarator) super.visitVariableDeclarator(variableDeclarator);
        if (rewritten.id().untyped() instanceof Identifier id && matchesFunction(id.name()) && isFunction(rewritten.init())) {
            return rewritten.withInit(spliceFunction(rewritten.init()));
        }
        return rewritten;
    }

    @Override
    public Node visitExportDefaultDeclaration(ExportDefaultDeclaration exportDefaultDeclaration) {
        ExportDefaultDeclaration rewritten = (ExportDefaultDeclaration) super.visitExportDefaultDeclaration(exportDefaultDeclaration);
        if (rewritten.expression() instanceof FunctionExpression function
            && function.id() != null
            && matchesFunction(function.id().name())) {
            return new ExportDefaultDeclaration(function.withBody(splice(function.body())));
        }
        return rewritten;
    }

    @Override
    public Node visitMethodDefinition(MethodDefinition methodDefinition) {
        MethodDefinition rewritten = (MethodDefinition) super.visitMethodDefinition(methodDefinition);
        if (matchesMethod(rewritten.key().name())) {
            return rewritten.withValue(rewritten.value().withBody(splice(rewritten.value().body())));
        }
        return rewritten;
    }

    @Override
    public Node visitMethodProperty(MethodProperty methodProperty) {
        MethodProperty rewritten = (MethodProperty) super.visitMethodProperty(methodProperty);
        if (matchesMethod(rewritten.key().name())) {
            return rewritten.withValue(rewritten.value().withBody(splice(rewritten.value().body())));
        }
        return rewritten;
    }

    @Override
    public Node visitProperty(Property property) {
        Property rewritten = (Property) super.visitProperty(property);
        if (matchesMethod(rewritten.key().name()) && isFunction(rewritten.value())) {
            return rewritten.withValue(spliceFunction(rewritten.value()));
        }
        return rewritten;
    }

    private boolean matchesFunction(String name) {
        return location.kind() == InjectionLocation.Kind.FUNCTION && location.name().equals(name);
    }

    private boolean matchesMethod(String name) {
        return location.kind() != InjectionLocation.Kind.COMMENT && location.name().equals(name);
    }

    private static boolean isFunction(Expression expression) {
        return expression instanceof FunctionExpression || expression instanceof ArrowFunctionExpression;
    }

    private Expression spliceFunction(Expression function) {
        if (function instanceof FunctionExpression functionExpression) {
            return functionExpression.withBody(splice(functionExpression.body()));
        }
        ArrowFunctionExpression arrow = (ArrowFunctionExpression) function;
        BlockStatement body = arrow.body() instanceof BlockStatement block
            ? block
            : new BlockStatement(List.of(new ReturnStatement((Expression) arrow.body())));
        return arrow.withBody(splice(body));
    }

    private BlockStatement splice(BlockStatement body) {
        spliced++;
        List<Statement> code = JavaScriptAstParser.parseStatements(directive.code());
        List<Statement> result = new ArrayList<>();
        switch (position) {
            case BEFORE -> {
                result.addAll(code);
                result.addAll(body.body());
            }
            case AFTER -> {
                result.addAll(body.body());
                result.addAll(code);
            }
            case REPLACE -> result.addAll(code);
            case WRAP -> {
                result.addAll(code);
                result.add(beginMarker());
                result.addAll(body.body());
                result.add(endMarker());
            }
        }
        return new BlockStatement(result);
    }

    // ---------------------------------------------------------------- comment locations

    @Override
    protected List<Statement> rewriteStatements(List<Statement> statements) {
        List<Statement> rewritten = super.rewriteStatements(statements);
        if (location.kind() != InjectionLocation.Kind.COMMENT) {
            return rewritten;
        }
        List<Statement> result = new ArrayList<>(rewritten.size());
        for (Statement statement : rewritten) {
            if (statement instanceof Comment comment && comment.text().contains(location.name())) {
                spliced++;
                List<Statement> code = JavaScriptAstParser.parseStatements(directive.code());
                Comment standalone = new Comment(comment.text(), false);
                switch (position) {
                    case BEFORE -> {
                        result.addAll(code);
                        result.add(standalone);
                    }
                    case AFTER -> {
                        result.add(comment);
                        result.addAll(code);
                    }
                    case REPLACE -> result.addAll(code);
                    case WRAP -> {
                        result.addAll(code);
                        result.add(beginMarker());
                        result.add(standalone);
                        result.add(endMarker());
                    }
                }
            } else {
                result.add(statement);
            }
        }
        return result;
    }

    private Comment beginMarker() {
        return new Comment("// " + directive.pointId() + ":begin", false);
    }

    private Comment endMarker() {
        return new Comment("// " + directive.pointId() + ":end", false);
    }
}
