package com.codeadapt.core.ast;

import com.codeadapt.core.ast.JavaScriptAst.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity tree rewriter.
 *
 * <p>Every {@code visit} method rewrites the children of a node and rebuilds it. Subclasses
 * override the methods for the node kinds they change and call {@code super} to keep
 * descending. Read-only analyses extend it as well and simply return the node.
 *
 * <p>Names that are not bindings are not visited as identifiers: module names, imported
 * names, exported names of re-exports and member names are strings in the tree, so a
 * rewriter overriding {@link #visitIdentifier} only sees bindings and references.
 * TypeScript types and JSX tag names are text as well.
 */
public class AstRewriter implements AstVisitor<Node> {

    /**
     * Rewrites a single node; null stays null.
     */
    @SuppressWarnings("unchecked")
    protected <T extends Node> T rewrite(T node) {
        return node == null ? null : (T) node.accept(this);
    }

    protected <T extends Node> List<T> rewriteAll(List<T> nodes) {
        List<T> result = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            result.add(rewrite(node));
        }
        return result;
    }

    /**
     * Rewrites a statement list. Override to insert, remove or replace statements.
     */
    protected List<Statement> rewriteStatements(List<Statement> statements) {
        return rewriteAll(statements);
    }

    public Program rewriteProgram(Program program) {
        return (Program) program.accept(this);
    }

    @Override
    public Node visitProgram(Program program) {
        return new Program(rewriteStatements(program.body()));
    }

    @Override
    public Node visitComment(Comment comment) {
        return comment;
    }

    @Override
    public Node visitImportDeclaration(ImportDeclaration importDeclaration) {
        return new ImportDeclaration(
            rewrite(importDeclaration.defaultBinding()),
            rewrite(importDeclaration.namespaceBinding()),
            rewriteAll(importDeclaration.specifiers()),
            importDeclaration.source(),
            importDeclaration.typeOnly());
    }

    @Override
    public Node visitImportSpecifier(ImportSpecifier importSpecifier) {
        return new ImportSpecifier(importSpecifier.imported(), rewrite(importSpecifier.local()));
    }

    @Override
    public Node visitExportDefaultDeclaration(ExportDefaultDeclaration exportDefaultDeclaration) {
        return new ExportDefaultDeclaration(rewrite(exportDefaultDeclaration.expression()));
    }

    @Override
    public Node visitExportNamedDeclaration(ExportNamedDeclaration exportNamedDeclaration) {
        return new ExportNamedDeclaration(rewrite(exportNamedDeclaration.declaration()));
    }

    @Override
    public Node visitExportListDeclaration(ExportListDeclaration exportListDeclaration) {
        if (exportListDeclaration.source() != null) {
            // Re-exported names belong to the other module.
            return exportListDeclaration;
        }
        return new ExportListDeclaration(rewriteAll(exportListDeclaration.specifiers()), null);
    }

    @Override
    public Node visitExportSpecifier(ExportSpecifier exportSpecifier) {
        return new ExportSpecifier(rewrite(exportSpecifier.local()), exportSpecifier.exported());
    }

    @Override
    public Node visitExportAllDeclaration(ExportAllDeclaration exportAllDeclaration) {
        return exportAllDeclaration;
    }

    @Override
    public Node visitVariableDeclaration(VariableDeclaration variableDeclaration) {
        return new VariableDeclaration(variableDeclaration.kind(), rewriteAll(variableDeclaration.declarations()));
    }

    @Override
    public Node visitVariableDeclarator(VariableDeclarator variableDeclarator) {
        return new VariableDeclarator(rewrite(variableDeclarator.id()), rewrite(variableDeclarator.init()));
    }

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
        return new FunctionDeclaration(
            rewrite(functionDeclaration.id()),
            rewriteAll(functionDeclaration.params()),
            rewrite(functionDeclaration.body()),
            functionDeclaration.async(),
            functionDeclaration.generator(),
            functionDeclaration.types());
    }

    @Override
    public Node visitClassDeclaration(ClassDeclaration classDeclaration) {
        return new ClassDeclaration(
            rewrite(classDeclaration.id()),
            rewrite(classDeclaration.superClass()),
            rewriteAll(classDeclaration.members()),
            classDeclaration.types());
    }

    @Override
    public Node visitMethodDefinition(MethodDefinition methodDefinition) {
        return new MethodDefinition(
            rewrite(methodDefinition.key()),
            methodDefinition.kind(),
            methodDefinition.isStatic(),
            rewrite(methodDefinition.value()),
            methodDefinition.modifiers());
    }

    @Override
    public Node visitClassField(ClassField classField) {
        return new ClassField(
            rewrite(classField.key()),
            rewrite(classField.value()),
            classField.isStatic(),
            classField.modifiers(),
            classField.optional(),
            classField.type());
    }

    @Override
    public Node visitPropertyKey(PropertyKey propertyKey) {
        if (!propertyKey.isComputed()) {
            return propertyKey;
        }
        return new PropertyKey(null, rewrite(propertyKey.computed()));
    }

    @Override
    public Node visitBlockStatement(BlockStatement blockStatement) {
        return new BlockStatement(rewriteStatements(blockStatement.body()));
    }

    @Override
    public Node visitExpressionStatement(ExpressionStatement expressionStatement) {
        return new ExpressionStatement(rewrite(expressionStatement.expression()));
    }

    @Override
    public Node visitIfStatement(IfStatement ifStatement) {
        return new IfStatement(
            rewrite(ifStatement.test()),
            rewrite(ifStatement.consequent()),
            rewrite(ifStatement.alternate()));
    }

    @Override
    public Node visitForStatement(ForStatement forStatement) {
        return new ForStatement(
            rewrite(forStatement.init()),
            rewrite(forStatement.test()),
            rewrite(forStatement.update()),
            rewrite(forStatement.body()));
    }

    @Override
    public Node visitForInStatement(ForInStatement forInStatement) {
        return new ForInStatement(
            rewrite(forInStatement.left()),
            rewrite(forInStatement.right()),
            rewrite(forInStatement.body()),
            forInStatement.of(),
            forInStatement.isAwait());
    }

    @Override
    public Node visitWhileStatement(WhileStatement whileStatement) {
        return new WhileStatement(rewrite(whileStatement.test()), rewrite(whileStatement.body()));
    }

    @Override
    public Node visitDoWhileStatement(DoWhileStatement doWhileStatement) {
        return new DoWhileStatement(rewrite(doWhileStatement.body()), rewrite(doWhileStatement.test()));
    }

    @Override
    public Node visitReturnStatement(ReturnStatement returnStatement) {
        return new ReturnStatement(rewrite(returnStatement.argument()));
    }

    @Override
    public Node visitThrowStatement(ThrowStatement throwStatement) {
        return new ThrowStatement(rewrite(throwStatement.argument()));
    }

    @Override
    public Node visitTryStatement(TryStatement tryStatement) {
        return new TryStatement(
            rewrite(tryStatement.block()),
            rewrite(tryStatement.handler()),
            rewrite(tryStatement.finalizer()));
    }

    @Override
    public Node visitCatchClause(CatchClause catchClause) {
        return new CatchClause(rewrite(catchClause.param()), rewrite(catchClause.body()));
    }

    @Override
    public Node visitBreakStatement(BreakStatement breakStatement) {
        return breakStatement;
    }

    @Override
    public Node visitContinueStatement(ContinueStatement continueStatement) {
        return continueStatement;
    }

    @Override
    public Node visitSwitchStatement(SwitchStatement switchStatement) {
        return new SwitchStatement(rewrite(switchStatement.discriminant()), rewriteAll(switchStatement.cases()));
    }

    @Override
    public Node visitSwitchCase(SwitchCase switchCase) {
        return new SwitchCase(rewrite(switchCase.test()), rewriteStatements(switchCase.consequent()));
    }

    @Override
    public Node visitEmptyStatement(EmptyStatement emptyStatement) {
        return emptyStatement;
    }

    @Override
    public Node visitLabeledStatement(LabeledStatement labeledStatement) {
        return new LabeledStatement(labeledStatement.label(), rewrite(labeledStatement.body()));
    }

    @Override
    public Node visitDebuggerStatement(DebuggerStatement debuggerStatement) {
        return debuggerStatement;
    }

    @Override
    public Node visitTypeDeclaration(TypeDeclaration typeDeclaration) {
        return typeDeclaration;
    }

    @Override
    public Node visitIdentifier(Identifier identifier) {
        return identifier;
    }

    @Override
    public Node visitLiteral(Literal literal) {
        return literal;
    }

    @Override
    public Node visitTemplateLiteral(TemplateLiteral templateLiteral) {
        return new TemplateLiteral(templateLiteral.quasis(), rewriteAll(templateLiteral.expressions()));
    }

    @Override
    public Node visitTaggedTemplateExpression(TaggedTemplateExpression taggedTemplateExpression) {
        return new TaggedTemplateExpression(
            rewrite(taggedTemplateExpression.tag()),
            rewrite(taggedTemplateExpression.quasi()));
    }

    @Override
    public Node visitArrayExpression(ArrayExpression arrayExpression) {
        return new ArrayExpression(rewriteAll(arrayExpression.elements()));
    }

    @Override
    public Node visitObjectExpression(ObjectExpression objectExpression) {
        return new ObjectExpression(rewriteAll(objectExpression.properties()));
    }

    @Override
    public Node visitProperty(Property property) {
        return new Property(rewrite(property.key()), rewrite(property.value()), property.shorthand());
    }

    @Override
    public Node visitMethodProperty(MethodProperty methodProperty) {
        return new MethodProperty(rewrite(methodProperty.key()), methodProperty.kind(), rewrite(methodProperty.value()));
    }

    @Override
    public Node visitSpreadElement(SpreadElement spreadElement) {
        return new SpreadElement(rewrite(spreadElement.argument()));
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression functionExpression) {
        return new FunctionExpression(
            rewrite(functionExpression.id()),
            rewriteAll(functionExpression.params()),
            rewrite(functionExpression.body()),
            functionExpression.async(),
            functionExpression.generator(),
            functionExpression.types());
    }

    @Override
    public Node visitArrowFunctionExpression(ArrowFunctionExpression arrowFunctionExpression) {
        return new ArrowFunctionExpression(
            rewriteAll(arrowFunctionExpression.params()),
            rewrite(arrowFunctionExpression.body()),
            arrowFunctionExpression.async(),
            arrowFunctionExpression.types());
    }

    @Override
    public Node visitClassExpression(ClassExpression classExpression) {
        return new ClassExpression(
            rewrite(classExpression.id()),
            rewrite(classExpression.superClass()),
            rewriteAll(classExpression.members()),
            classExpression.types());
    }

    @Override
    public Node visitUnaryExpression(UnaryExpression unaryExpression) {
        return new UnaryExpression(unaryExpression.operator(), rewrite(unaryExpression.argument()));
    }

    @Override
    public Node visitUpdateExpression(UpdateExpression updateExpression) {
        return new UpdateExpression(updateExpression.operator(), updateExpression.prefix(), rewrite(updateExpression.argument()));
    }

    @Override
    public Node visitBinaryExpression(BinaryExpression binaryExpression) {
        return new BinaryExpression(
            binaryExpression.operator(),
            rewrite(binaryExpression.left()),
            rewrite(binaryExpression.right()));
    }

    @Override
    public Node visitAssignmentExpression(AssignmentExpression assignmentExpression) {
        return new AssignmentExpression(
            assignmentExpression.operator(),
            rewrite(assignmentExpression.left()),
            rewrite(assignmentExpression.right()));
    }

    @Override
    public Node visitConditionalExpression(ConditionalExpression conditionalExpression) {
        return new ConditionalExpression(
            rewrite(conditionalExpression.test()),
            rewrite(conditionalExpression.consequent()),
            rewrite(conditionalExpression.alternate()));
    }

    @Override
    public Node visitCallExpression(CallExpression callExpression) {
        return new CallExpression(
            rewrite(callExpression.callee()),
            rewriteAll(callExpression.arguments()),
            callExpression.optional(),
            callExpression.typeArguments());
    }

    @Override
    public Node visitNewExpression(NewExpression newExpression) {
        return new NewExpression(
            rewrite(newExpression.callee()),
            rewriteAll(newExpression.arguments()),
            newExpression.typeArguments());
    }

    @Override
    public Node visitMemberExpression(MemberExpression memberExpression) {
        return new MemberExpression(
            rewrite(memberExpression.object()),
            memberExpression.property(),
            rewrite(memberExpression.index()),
            memberExpression.optional());
    }

    @Override
    public Node visitSequenceExpression(SequenceExpression sequenceExpression) {
        return new SequenceExpression(rewriteAll(sequenceExpression.expressions()));
    }

    @Override
    public Node visitAwaitExpression(AwaitExpression awaitExpression) {
        return new AwaitExpression(rewrite(awaitExpression.argument()));
    }

    @Override
    public Node visitYieldExpression(YieldExpression yieldExpression) {
        return new YieldExpression(rewrite(yieldExpression.argument()), yieldExpression.delegate());
    }

    @Override
    public Node visitThisExpression(ThisExpression thisExpression) {
        return thisExpression;
    }

    @Override
    public Node visitSuperExpression(SuperExpression superExpression) {
        return superExpression;
    }

    @Override
    public Node visitParenthesizedExpression(ParenthesizedExpression parenthesizedExpression) {
        return new ParenthesizedExpression(rewrite(parenthesizedExpression.expression()));
    }

    @Override
    public Node visitImportCall(ImportCall importCall) {
        return new ImportCall(rewrite(importCall.source()));
    }

    @Override
    public Node visitMetaProperty(MetaProperty metaProperty) {
        return metaProperty;
    }

    @Override
    public Node visitCommentedExpression(CommentedExpression commentedExpression) {
        return commentedExpression.withExpression(rewrite(commentedExpression.expression()));
    }

    @Override
    public Node visitTypeAssertion(TypeAssertion typeAssertion) {
        return new TypeAssertion(rewrite(typeAssertion.expression()), typeAssertion.operator(), typeAssertion.type());
    }

    @Override
    public Node visitNonNullExpression(NonNullExpression nonNullExpression) {
        return new NonNullExpression(rewrite(nonNullExpression.expression()));
    }

    @Override
    public Node visitJsxElement(JsxElement jsxElement) {
        return new JsxElement(
            jsxElement.name(),
            rewriteAll(jsxElement.attributes()),
            rewriteAll(jsxElement.children()),
            jsxElement.selfClosing());
    }

    @Override
    public Node visitJsxAttribute(JsxAttribute jsxAttribute) {
        return new JsxAttribute(jsxAttribute.name(), rewrite(jsxAttribute.value()));
    }

    @Override
    public Node visitJsxSpreadAttribute(JsxSpreadAttribute jsxSpreadAttribute) {
        return new JsxSpreadAttribute(rewrite(jsxSpreadAttribute.argument()));
    }

    @Override
    public Node visitJsxText(JsxText jsxText) {
        return jsxText;
    }

    @Override
    public Node visitJsxExpressionContainer(JsxExpressionContainer jsxExpressionContainer) {
        return new JsxExpressionContainer(
            rewrite(jsxExpressionContainer.expression()),
            jsxExpressionContainer.spread(),
            jsxExpressionContainer.comments());
    }

    @Override
    public Node visitObjectPattern(ObjectPattern objectPattern) {
        return new ObjectPattern(rewriteAll(objectPattern.properties()));
    }

    @Override
    public Node visitPatternProperty(PatternProperty patternProperty) {
        return new PatternProperty(
            rewrite(patternProperty.key()),
            rewrite(patternProperty.value()),
            patternProperty.shorthand());
    }

    @Override
    public Node visitArrayPattern(ArrayPattern arrayPattern) {
        return new ArrayPattern(rewriteAll(arrayPattern.elements()));
    }

    @Override
    public Node visitAssignmentPattern(AssignmentPattern assignmentPattern) {
        return new AssignmentPattern(rewrite(assignmentPattern.left()), rewrite(assignmentPattern.right()));
    }

    @Override
    public Node visitRestElement(RestElement restElement) {
        return new RestElement(rewrite(restElement.argument()));
    }

    @Override
    public Node visitTypedBinding(TypedBinding typedBinding) {
        return typedBinding.withTarget(rewrite(typedBinding.target()));
    }
}
