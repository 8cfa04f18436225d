package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.WarningType;

import static com.codeadapt.core.transform.OwnScopeRewriter.containsAwait;
import static com.codeadapt.core.transform.OwnScopeRewriter.mapReturns;
import static com.codeadapt.core.transform.OwnScopeRewriter.promiseResolve;

/**
 * Drops {@code async} from functions that never await.
 *
 * <p>Such functions lose the keyword and their returns become
 * {@code return Promise.resolve(x)}. A function that falls off its end now returns
 * {@code undefined} instead of a promise. Functions
 * that await are left unchanged; rewriting {@code await} into {@code .then} chains is not
 * implemented, and the pass always reports that limitation.
 */
final class AsyncAwaitToPromisesPass extends AstRewriter implements TransformationPass {

    private int asyncFunctions;

    @Override
    public Program apply(Program program, TransformContext context) {
        Program result = rewriteProgram(program);
        context.warn(WarningType.UNSUPPORTED_PATTERN_CONVERSION,
            "async-await -> promises only converts async functions without await; functions that await are unchanged");
        if (asyncFunctions == 0) {
            context.warn(WarningType.NO_MATCH, "No async functions to convert to promises");
        }
        return result;
    }

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
        FunctionDeclaration rewritten = (FunctionDeclaration) super.visitFunctionDeclaration(functionDeclaration);
        if (!isConvertible(rewritten.async(), rewritten.generator(), rewritten.body())) {
            return rewritten;
        }
        return rewritten.withBody(mapReturns(rewritten.body(), false, OwnScopeRewriter::promiseResolve)).withAsync(false);
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression functionExpression) {
        FunctionExpression rewritten = (FunctionExpression) super.visitFunctionExpression(functionExpression);
        if (!isConvertible(rewritten.async(), rewritten.generator(), rewritten.body())) {
            return rewritten;
        }
        return rewritten.withBody(mapReturns(rewritten.body(), false, OwnScopeRewriter::promiseResolve)).withAsync(false);
    }

    @Override
    public Node visitArrowFunctionExpression(ArrowFunctionExpression arrowFunctionExpression) {
        ArrowFunctionExpression rewritten = (ArrowFunctionExpression) super.visitArrowFunctionExpression(arrowFunctionExpression);
        if (!isConvertible(rewritten.async(), false, rewritten.body())) {
            return rewritten;
        }
        Node body = rewritten.body() instanceof BlockStatement block
            ? mapReturns(block, false, OwnScopeRewriter::promiseResolve)
            : promiseResolve((Expression) rewritten.body());
        return rewritten.withBody(body).withAsync(false);
    }

    private boolean isConvertible(boolean async, boolean generator, Node body) {
        if (!async) {
            return false;
        }
        asyncFunctions++;
        return !generator && !containsAwait(body);
    }
}
