package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.WarningType;

import static com.codeadapt.core.transform.OwnScopeRewriter.containsPromiseChain;

/**
 * Marks functions that use promise chains as {@code async}.
 *
 * <p>Only the marking is done. Turning {@code .then} callbacks into sequential
 * {@code await} statements needs control-flow restructuring that is not implemented; the
 * pass always reports that limitation.
 */
final class PromisesToAsyncAwaitPass extends AstRewriter implements TransformationPass {

    private int marked;

    @Override
    public Program apply(Program program, TransformContext context) {
        Program result = rewriteProgram(program);
        context.warn(WarningType.UNSUPPORTED_PATTERN_CONVERSION,
            "promises -> async-await only marks functions async; rewriting .then chains into sequential await is not supported");
        if (marked == 0) {
            context.warn(WarningType.NO_MATCH, "No functions with promise chains to mark async");
        }
        return result;
    }

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
        FunctionDeclaration rewritten = (FunctionDeclaration) super.visitFunctionDeclaration(functionDeclaration);
        if (shouldMark(rewritten.async(), rewritten.generator(), rewritten.body())) {
            marked++;
            return rewritten.withAsync(true);
        }
        return rewritten;
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression functionExpression) {
        FunctionExpression rewritten = (FunctionExpression) super.visitFunctionExpression(functionExpression);
        if (shouldMark(rewritten.async(), rewritten.generator(), rewritten.body())) {
            marked++;
            return rewritten.withAsync(true);
        }
        return rewritten;
    }

    @Override
    public Node visitArrowFunctionExpression(ArrowFunctionExpression arrowFunctionExpression) {
        ArrowFunctionExpression rewritten = (ArrowFunctionExpression) super.visitArrowFunctionExpression(arrowFunctionExpression);
        if (shouldMark(rewritten.async(), false, rewritten.body())) {
            marked++;
            return rewritten.withAsync(true);
        }
        return rewritten;
    }

    private static boolean shouldMark(boolean async, boolean generator, Node body) {
        return !async && !generator && containsPromiseChain(body);
    }
}
