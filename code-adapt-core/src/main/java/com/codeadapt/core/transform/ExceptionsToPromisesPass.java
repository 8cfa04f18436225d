package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.WarningType;

import java.util.List;

import static com.codeadapt.core.transform.OwnScopeRewriter.call;
import static com.codeadapt.core.transform.OwnScopeRewriter.containsAwait;

/**
 * Rewrites try/catch statements into promise chains.
 *
 * <pre>{@code
 * try { B } catch (e) { H } finally { F }
 * // becomes
 * Promise.resolve().then(() => { B }).catch((e) => { H }).finally(() => { F });
 * }</pre>
 *
 * <p>A callback is async when its block awaits. Try statements without a catch clause are
 * left alone. {@code return} inside the try block now returns from the callback, so the
 * enclosing function no longer sees that value.
 */
final class ExceptionsToPromisesPass extends AstRewriter implements TransformationPass {

    private int converted;

    @Override
    public Program apply(Program program, TransformContext context) {
        Program result = rewriteProgram(program);
        if (converted == 0) {
            context.warn(WarningType.NO_MATCH, "No try/catch statements to convert to promises");
        }
        return result;
    }

    @Override
    public Node visitTryStatement(TryStatement tryStatement) {
        TryStatement rewritten = (TryStatement) super.visitTryStatement(tryStatement);
        CatchClause handler = rewritten.handler();
        if (handler == null) {
            return rewritten;
        }
        converted++;
        Expression chain = call(
            MemberExpression.dot(OwnScopeRewriter.promiseResolve(null), "then"),
            List.of(callback(List.of(), rewritten.block())));
        List<BindingTarget> params = handler.param() != null ? List.of(handler.param()) : List.of();
        chain = call(MemberExpression.dot(chain, "catch"), List.of(callback(params, handler.body())));
        if (rewritten.finalizer() != null) {
            chain = call(MemberExpression.dot(chain, "finally"), List.of(callback(List.of(), rewritten.finalizer())));
        }
        return new ExpressionStatement(chain);
    }

    private static ArrowFunctionExpression callback(List<BindingTarget> params, BlockStatement body) {
        return new ArrowFunctionExpression(params, body, containsAwait(body));
    }
}
