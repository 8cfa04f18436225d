package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;

import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Rewriter that stays in the current function: nested functions and classes are returned
 * as they are, so {@code return}, {@code throw} and {@code await} seen by a subclass belong
 * to the function being inspected.
 */
abstract class OwnScopeRewriter extends AstRewriter {

    private static final Set<String> CHAIN_METHODS = Set.of("then", "catch", "finally");

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
        return functionDeclaration;
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression functionExpression) {
        return functionExpression;
    }

    @Override
    public Node visitArrowFunctionExpression(ArrowFunctionExpression arrowFunctionExpression) {
        return arrowFunctionExpression;
    }

    @Override
    public Node visitClassDeclaration(ClassDeclaration classDeclaration) {
        return classDeclaration;
    }

    @Override
    public Node visitClassExpression(ClassExpression classExpression) {
        return classExpression;
    }

    /**
     * Returns true if the node awaits outside of nested functions.
     */
    static boolean containsAwait(Node node) {
        boolean[] found = {false};
        new OwnScopeRewriter() {
            @Override
            public Node visitAwaitExpression(AwaitExpression awaitExpression) {
                found[0] = true;
                return awaitExpression;
            }
        }.rewrite(node);
        return found[0];
    }

    /**
     * Returns true if the node calls {@code .then}, {@code .catch} or {@code .finally}
     * outside of nested functions.
     */
    static boolean containsPromiseChain(Node node) {
        boolean[] found = {false};
        new OwnScopeRewriter() {
            @Override
            public Node visitCallExpression(CallExpression callExpression) {
                if (callExpression.callee() instanceof MemberExpression member
                    && CHAIN_METHODS.contains(member.property())) {
                    found[0] = true;
                }
                return super.visitCallExpression(callExpression);
            }
        }.rewrite(node);
        return found[0];
    }

    /**
     * Returns true if the node returns or throws outside of nested functions.
     */
    static boolean containsExit(Node node) {
        boolean[] found = {false};
        new OwnScopeRewriter() {
            @Override
            public Node visitReturnStatement(ReturnStatement returnStatement) {
                found[0] = true;
                return returnStatement;
            }

            @Override
            public Node visitThrowStatement(ThrowStatement throwStatement) {
                found[0] = true;
                return throwStatement;
            }
        }.rewrite(node);
        return found[0];
    }

    /**
     * Maps the argument of every own-scope return. The mapper receives null for a bare
     * {@code return;}.
     *
     * @param skipNestedTry whether returns inside nested try statements are left alone
     */
    static <T extends Node> T mapReturns(T node, boolean skipNestedTry, UnaryOperator<Expression> mapper) {
        return new OwnScopeRewriter() {
            @Override
            public Node visitReturnStatement(ReturnStatement returnStatement) {
                return new ReturnStatement(mapper.apply(returnStatement.argument()));
            }

            @Override
            public Node visitTryStatement(TryStatement tryStatement) {
                return skipNestedTry ? tryStatement : super.visitTryStatement(tryStatement);
            }
        }.rewrite(node);
    }

    /**
     * Replaces every own-scope {@code throw x} with {@code return mapper(x)}. Throws inside
     * nested try statements are left alone.
     */
    static <T extends Node> T throwsToReturns(T node, UnaryOperator<Expression> mapper) {
        return new OwnScopeRewriter() {
            @Override
            public Node visitThrowStatement(ThrowStatement throwStatement) {
                return new ReturnStatement(mapper.apply(throwStatement.argument()));
            }

            @Override
            public Node visitTryStatement(TryStatement tryStatement) {
                return tryStatement;
            }
        }.rewrite(node);
    }

    static Expression promiseResolve(Expression value) {
        return call(MemberExpression.dot(new Identifier("Promise"), "resolve"), value == null ? List.of() : List.of(value));
    }

    static CallExpression call(Expression callee, List<Expression> arguments) {
        return new CallExpression(callee, arguments, false);
    }
}
