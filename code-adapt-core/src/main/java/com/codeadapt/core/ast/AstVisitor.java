package com.codeadapt.core.ast;

import com.codeadapt.core.ast.JavaScriptAst.*;

/**
 * Visitor over every {@link JavaScriptAst} node kind.
 *
 * <p>Adding a node kind adds a method here, so every visitor implementation has to decide
 * how to handle it.
 *
 * @param <R> result type
 */
public interface AstVisitor<R> {

    R visitProgram(Program program);

    R visitComment(Comment comment);

    R visitImportDeclaration(ImportDeclaration importDeclaration);

    R visitImportSpecifier(ImportSpecifier importSpecifier);

    R visitExportDefaultDeclaration(ExportDefaultDeclaration exportDefaultDeclaration);

    R visitExportNamedDeclaration(ExportNamedDeclaration exportNamedDeclaration);

    R visitExportListDeclaration(ExportListDeclaration exportListDeclaration);

    R visitExportSpecifier(ExportSpecifier exportSpecifier);

    R visitExportAllDeclaration(ExportAllDeclaration exportAllDeclaration);

    R visitVariableDeclaration(VariableDeclaration variableDeclaration);

    R visitVariableDeclarator(VariableDeclarator variableDeclarator);

    R visitFunctionDeclaration(FunctionDeclaration functionDeclaration);

    R visitClassDeclaration(ClassDeclaration classDeclaration);

    R visitMethodDefinition(MethodDefinition methodDefinition);

    R visitClassField(ClassField classField);

    R visitPropertyKey(PropertyKey propertyKey);

    R visitBlockStatement(BlockStatement blockStatement);

    R visitExpressionStatement(ExpressionStatement expressionStatement);

    R visitIfStatement(IfStatement ifStatement);

    R visitForStatement(ForStatement forStatement);

    R visitForInStatement(ForInStatement forInStatement);

    R visitWhileStatement(WhileStatement whileStatement);

    R visitDoWhileStatement(DoWhileStatement doWhileStatement);

    R visitReturnStatement(ReturnStatement returnStatement);

    R visitThrowStatement(ThrowStatement throwStatement);

    R visitTryStatement(TryStatement tryStatement);

    R visitCatchClause(CatchClause catchClause);

    R visitBreakStatement(BreakStatement breakStatement);

    R visitContinueStatement(ContinueStatement continueStatement);

    R visitSwitchStatement(SwitchStatement switchStatement);

    R visitSwitchCase(SwitchCase switchCase);

    R visitEmptyStatement(EmptyStatement emptyStatement);

    R visitLabeledStatement(LabeledStatement labeledStatement);

    R visitDebuggerStatement(DebuggerStatement debuggerStatement);

    R visitTypeDeclaration(TypeDeclaration typeDeclaration);

    R visitIdentifier(Identifier identifier);

    R visitLiteral(Literal literal);

    R visitTemplateLiteral(TemplateLiteral templateLiteral);

    R visitTaggedTemplateExpression(TaggedTemplateExpression taggedTemplateExpression);

    R visitArrayExpression(ArrayExpression arrayExpression);

    R visitObjectExpression(ObjectExpression objectExpression);

    R visitProperty(Property property);

    R visitMethodProperty(MethodProperty methodProperty);

    R visitSpreadElement(SpreadElement spreadElement);

    R visitFunctionExpression(FunctionExpression functionExpression);

    R visitArrowFunctionExpression(ArrowFunctionExpression arrowFunctionExpression);

    R visitClassExpression(ClassExpression classExpression);

    R visitUnaryExpression(UnaryExpression unaryExpression);

    R visitUpdateExpression(UpdateExpression updateExpression);

    R visitBinaryExpression(BinaryExpression binaryExpression);

    R visitAssignmentExpression(AssignmentExpression assignmentExpression);

    R visitConditionalExpression(ConditionalExpression conditionalExpression);

    R visitCallExpression(CallExpression callExpression);

    R visitNewExpression(NewExpression newExpression);

    R visitMemberExpression(MemberExpression memberExpression);

    R visitSequenceExpression(SequenceExpression sequenceExpression);

    R visitAwaitExpression(AwaitExpression awaitExpression);

    R visitYieldExpression(YieldExpression yieldExpression);

    R visitThisExpression(ThisExpression thisExpression);

    R visitSuperExpression(SuperExpression superExpression);

    R visitParenthesizedExpression(ParenthesizedExpression parenthesizedExpression);

    R visitImportCall(ImportCall importCall);

    R visitMetaProperty(MetaProperty metaProperty);

    R visitCommentedExpression(CommentedExpression commentedExpression);

    R visitTypeAssertion(TypeAssertion typeAssertion);

    R visitNonNullExpression(NonNullExpression nonNullExpression);

    R visitJsxElement(JsxElement jsxElement);

    R visitJsxAttribute(JsxAttribute jsxAttribute);

    R visitJsxSpreadAttribute(JsxSpreadAttribute jsxSpreadAttribute);

    R visitJsxText(JsxText jsxText);

    R visitJsxExpressionContainer(JsxExpressionContainer jsxExpressionContainer);

    R visitObjectPattern(ObjectPattern objectPattern);

    R visitPatternProperty(PatternProperty patternProperty);

    R visitArrayPattern(ArrayPattern arrayPattern);

    R visitAssignmentPattern(AssignmentPattern assignmentPattern);

    R visitRestElement(RestElement restElement);

    R visitTypedBinding(TypedBinding typedBinding);
}
