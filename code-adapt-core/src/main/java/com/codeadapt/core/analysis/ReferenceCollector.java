package com.codeadapt.core.analysis;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the names of identifiers in reference position.
 *
 * <p>Declared names are skipped: variable declarators, function and class names,
 * parameters, import bindings and catch parameters. Initializers, default values and
 * bodies are still visited.
 */
class ReferenceCollector extends AstRewriter {

    private final List<String> references = new ArrayList<>();

    static List<String> collect(Program program) {
        ReferenceCollector collector = new ReferenceCollector();
        collector.rewriteProgram(program);
        return List.copyOf(collector.references);
    }

    @Override
    public Node visitIdentifier(Identifier identifier) {
        references.add(identifier.name());
        return identifier;
    }

    @Override
    public Node visitImportDeclaration(ImportDeclaration importDeclaration) {
        return importDeclaration;
    }

    @Override
    public Node visitVariableDeclarator(VariableDeclarator variableDeclarator) {
        defaults(variableDeclarator.id());
        rewrite(variableDeclarator.init());
        return variableDeclarator;
    }

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
        functionDeclaration.params().forEach(this::defaults);
        rewrite(functionDeclaration.body());
        return functionDeclaration;
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression functionExpression) {
        functionExpression.params().forEach(this::defaults);
        rewrite(functionExpression.body());
        return functionExpression;
    }

    @Override
    public Node visitArrowFunctionExpression(ArrowFunctionExpression arrowFunctionExpression) {
        arrowFunctionExpression.params().forEach(this::defaults);
        rewrite(arrowFunctionExpression.body());
        return arrowFunctionExpression;
    }

    @Override
    public Node visitClassDeclaration(ClassDeclaration classDeclaration) {
        rewrite(classDeclaration.superClass());
        rewriteAll(classDeclaration.members());
        return classDeclaration;
    }

    @Override
    public Node visitCatchClause(CatchClause catchClause) {
        defaults(catchClause.param());
        rewrite(catchClause.body());
        return catchClause;
    }

    /**
     * Visits the default values inside a binding target but not the names it binds.
     */
    private void defaults(BindingTarget target) {
        if (target instanceof AssignmentPattern assignment) {
            defaults(assignment.left());
            rewrite(assignment.right());
        } else if (target instanceof ObjectPattern objectPattern) {
            for (PatternMember member : objectPattern.properties()) {
                if (member instanceof PatternProperty property) {
                    defaults(property.value());
                } else if (member instanceof RestElement rest) {
                    defaults(rest.argument());
                }
            }
        } else if (target instanceof ArrayPattern arrayPattern) {
            arrayPattern.elements().forEach(this::defaults);
        } else if (target instanceof RestElement rest) {
            defaults(rest.argument());
        } else if (target instanceof TypedBinding typed) {
            defaults(typed.target());
        }
    }
}
