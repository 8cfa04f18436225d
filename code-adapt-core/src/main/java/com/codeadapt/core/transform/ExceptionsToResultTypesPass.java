package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.WarningType;

import java.util.ArrayList;
import java.util.List;

import static com.codeadapt.core.transform.OwnScopeRewriter.containsExit;
import static com.codeadapt.core.transform.OwnScopeRewriter.mapReturns;
import static com.codeadapt.core.transform.OwnScopeRewriter.throwsToReturns;

/**
 * Rewrites try/catch statements inside functions to return result objects.
 *
 * <pre>{@code
 * try { return load(); } catch (e) { throw new LoadError(e); }
 * // becomes
 * try { return { ok: true, value: load() }; } catch (e) { return { ok: false, error: new LoadError(e) }; }
 * }</pre>
 *
 * <p>A catch block that neither returns nor throws gets {@code return { ok: false, error: e }}
 * appended; a catch without a parameter gets one named {@code error}. Try statements outside
 * functions are skipped with a warning, since there is nothing to return from. Callers of
 * the converted functions are not updated.
 */
final class ExceptionsToResultTypesPass extends AstRewriter implements TransformationPass {

    private int functionDepth;
    private int converted;
    private int skipped;

    @Override
    public Program apply(Program program, TransformContext context) {
        Program result = rewriteProgram(program);
        if (skipped > 0) {
            context.warn(WarningType.UNSUPPORTED_PATTERN_CONVERSION,
                skipped + " top-level try statement(s) left unchanged; result types need an enclosing function");
        }
        if (converted == 0 && skipped == 0) {
            context.warn(WarningType.NO_MATCH, "No try/catch statements to convert to result types");
        }
        return result;
    }

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
        functionDepth++;
        try {
            return super.visitFunctionDeclaration(functionDeclaration);
        } finally {
            functionDepth--;
        }
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression functionExpression) {
        functionDepth++;
        try {
            return super.visitFunctionExpression(functionExpression);
        } finally {
            functionDepth--;
        }
    }

    @Override
    public Node visitArrowFunctionExpression(ArrowFunctionExpression arrowFunctionExpression) {
        functionDepth++;
        try {
            return super.visitArrowFunctionExpression(arrowFunctionExpression);
        } finally {
            functionDepth--;
        }
    }

    @Override
    public Node visitTryStatement(TryStatement tryStatement) {
        TryStatement rewritten = (TryStatement) super.visitTryStatement(tryStatement);
        if (rewritten.handler() == null) {
            return rewritten;
        }
        if (functionDepth == 0) {
            skipped++;
            return rewritten;
        }
        converted++;
        BlockStatement block = mapReturns(rewritten.block(), true, ExceptionsToResultTypesPass::success);
        return new TryStatement(block, convertHandler(rewritten.handler()), rewritten.finalizer());
    }

    private static CatchClause convertHandler(CatchClause handler) {
        BindingTarget param = handler.param() != null ? handler.param() : new Identifier("error");
        BlockStatement body = throwsToReturns(handler.body(), ExceptionsToResultTypesPass::failure);
        if (!containsExit(handler.body())) {
            Expression error = param.untyped() instanceof Identifier id ? id : new Identifier("undefined");
            List<Statement> statements = new ArrayList<>(body.body());
            statements.add(new ReturnStatement(failure(error)));
            body = new BlockStatement(statements);
        }
        return new CatchClause(param, body);
    }

    static Expression success(Expression value) {
        return result(true, "value", value != null ? value : new Identifier("undefined"));
    }

    static Expression failure(Expression error) {
        return result(false, "error", error);
    }

    private static Expression result(boolean ok, String key, Expression value) {
        return new ObjectExpression(List.of(
            new Property(PropertyKey.named("ok"), Literal.bool(ok), false),
            new Property(PropertyKey.named(key), value, false)));
    }
}
