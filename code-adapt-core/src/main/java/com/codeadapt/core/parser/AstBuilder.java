package com.codeadapt.core.parser;

import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.parser.JavaScriptParser;
import com.codeadapt.parser.JavaScriptParser.*;
import com.codeadapt.parser.JavaScriptParserBaseVisitor;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts an ANTLR parse tree into {@link com.codeadapt.core.ast.JavaScriptAst} nodes.
 *
 * <p>Statements are built by explicit dispatch on the statement rule; expressions through the
 * generated visitor, one method per labeled alternative of {@code singleExpression}.
 * Comments are read from the hidden channel of the token stream and attached to the
 * statement list, object literal, class body, argument list or array they appear in.
 *
 * <p>TypeScript types are kept as source text. Lines after the first are stored relative to
 * the indentation of the line the type starts on, so the generator can re-indent them.
 */
final class AstBuilder extends JavaScriptParserBaseVisitor<Expression> {

    private final CommonTokenStream tokens;

    AstBuilder(CommonTokenStream tokens) {
        this.tokens = tokens;
    }

    Program program(ProgramContext ctx) {
        return new Program(statementList(ctx.statementList(), ctx.EOF().getSymbol()));
    }

    Expression expression(SingleExpressionContext ctx) {
        return ctx == null ? null : ctx.accept(this);
    }

    // ---------------------------------------------------------------- statement lists and comments

    private List<Statement> statementList(StatementListContext ctx, Token closing) {
        List<Statement> result = new ArrayList<>();
        Token previousStop = null;
        if (ctx != null) {
            for (StatementContext statement : ctx.statement()) {
                addComments(result, statement.getStart(), previousStop);
                result.add(statement(statement));
                previousStop = statement.getStop();
            }
        }
        addComments(result, closing, previousStop);
        return result;
    }

    /**
     * Adds the comments written before a token. A comment is trailing when it starts on the
     * line the previous statement or member ends on.
     */
    private void addComments(List<? super Comment> target, Token before, Token previousStop) {
        List<Token> hidden = tokens.getHiddenTokensToLeft(before.getTokenIndex(), Token.HIDDEN_CHANNEL);
        if (hidden == null) {
            return;
        }
        boolean sameLine = previousStop != null;
        for (Token comment : hidden) {
            sameLine = sameLine && comment.getLine() == previousStop.getLine();
            target.add(new Comment(comment.getText(), sameLine));
        }
    }

    private static List<Comment> comments(List<Token> hidden) {
        List<Comment> comments = new ArrayList<>();
        if (hidden != null) {
            for (Token comment : hidden) {
                comments.add(new Comment(comment.getText(), false));
            }
        }
        return comments;
    }

    /**
     * Wraps an argument or array element with the comments between it and its separators.
     */
    private Expression commented(ParserRuleContext ctx, Expression expression) {
        List<Comment> leading = comments(tokens.getHiddenTokensToLeft(ctx.getStart().getTokenIndex(), Token.HIDDEN_CHANNEL));
        List<Comment> trailing = comments(tokens.getHiddenTokensToRight(ctx.getStop().getTokenIndex(), Token.HIDDEN_CHANNEL));
        if (leading.isEmpty() && trailing.isEmpty()) {
            return expression;
        }
        return new CommentedExpression(leading, expression, trailing);
    }

    private BlockStatement block(BlockContext ctx) {
        return new BlockStatement(statementList(ctx.statementList(), ctx.CloseBrace().getSymbol()));
    }

    private BlockStatement functionBody(FunctionBodyContext ctx) {
        return new BlockStatement(statementList(ctx.statementList(), ctx.CloseBrace().getSymbol()));
    }

    // ---------------------------------------------------------------- statements

    private Statement statement(StatementContext ctx) {
        ParseTree child = ctx.getChild(0);
        if (child instanceof BlockContext block) {
            return block(block);
        } else if (child instanceof ImportStatementContext importStatement) {
            return importStatement(importStatement);
        } else if (child instanceof ExportStatementContext exportStatement) {
            return exportStatement(exportStatement);
        } else if (child instanceof VariableStatementContext variableStatement) {
            return variableDeclarationList(variableStatement.variableDeclarationList());
        } else if (child instanceof ClassDeclarationContext classDeclaration) {
            return classDeclaration(classDeclaration);
        } else if (child instanceof FunctionDeclarationContext functionDeclaration) {
            return functionDeclaration(functionDeclaration);
        } else if (child instanceof EmptyStatementContext) {
            return new EmptyStatement();
        } else if (child instanceof IfStatementContext ifStatement) {
            return ifStatement(ifStatement);
        } else if (child instanceof IterationStatementContext iteration) {
            return iterationStatement(iteration);
        } else if (child instanceof ContinueStatementContext continueStatement) {
            return new ContinueStatement(continueStatement.identifier() != null ? continueStatement.identifier().getText() : null);
        } else if (child instanceof BreakStatementContext breakStatement) {
            return new BreakStatement(breakStatement.identifier() != null ? breakStatement.identifier().getText() : null);
        } else if (child instanceof ReturnStatementContext returnStatement) {
            return new ReturnStatement(expressionSequence(returnStatement.expressionSequence()));
        } else if (child instanceof SwitchStatementContext switchStatement) {
            return switchStatement(switchStatement);
        } else if (child instanceof ThrowStatementContext throwStatement) {
            return new ThrowStatement(expressionSequence(throwStatement.expressionSequence()));
        } else if (child instanceof TryStatementContext tryStatement) {
            return tryStatement(tryStatement);
        } else if (child instanceof DebuggerStatementContext) {
            return new DebuggerStatement();
        } else if (child instanceof TypeAliasDeclarationContext
            || child instanceof InterfaceDeclarationContext
            || child instanceof EnumDeclarationContext) {
            return typeDeclaration((ParserRuleContext) child);
        } else if (child instanceof LabelledStatementContext labelled) {
            return new LabeledStatement(labelled.identifier().getText(), statement(labelled.statement()));
        } else if (child instanceof ExpressionStatementContext expressionStatement) {
            return new ExpressionStatement(expressionSequence(expressionStatement.expressionSequence()));
        }
        throw unsupported(ctx);
    }

    private Statement importStatement(ImportStatementContext ctx) {
        String source = unquote(ctx.StringLiteral().getText());
        ImportClauseContext clause = ctx.importClause();
        if (clause == null) {
            return new ImportDeclaration(null, null, List.of(), source);
        }
        Identifier defaultBinding = clause.importedDefaultBinding() != null
            ? identifier(clause.importedDefaultBinding().identifier())
            : null;
        Identifier namespaceBinding = clause.namespaceImport() != null
            ? identifier(clause.namespaceImport().identifier())
            : null;
        List<ImportSpecifier> specifiers = new ArrayList<>();
        if (clause.namedImports() != null) {
            for (ImportSpecifierContext specifier : clause.namedImports().importSpecifier()) {
                String imported = specifier.identifierName().getText();
                Identifier local = specifier.identifier() != null
                    ? identifier(specifier.identifier())
                    : new Identifier(imported);
                specifiers.add(new ImportSpecifier(imported, local));
            }
        }
        return new ImportDeclaration(defaultBinding, namespaceBinding, specifiers, source, ctx.Type_() != null);
    }

    private Statement exportStatement(ExportStatementContext ctx) {
        if (ctx instanceof ExportDefaultDeclarationContext exportDefault) {
            return new ExportDefaultDeclaration(expression(exportDefault.singleExpression()));
        } else if (ctx instanceof ExportListDeclarationContext exportList) {
            List<ExportSpecifier> specifiers = new ArrayList<>();
            for (ExportSpecifierContext specifier : exportList.exportClause().exportSpecifier()) {
                String local = specifier.identifierName(0).getText();
                String exported = specifier.identifierName().size() > 1 ? specifier.identifierName(1).getText() : local;
                specifiers.add(new ExportSpecifier(new Identifier(local), exported));
            }
            String source = exportList.StringLiteral() != null ? unquote(exportList.StringLiteral().getText()) : null;
            return new ExportListDeclaration(specifiers, source);
        } else if (ctx instanceof ExportAllDeclarationContext exportAll) {
            String exported = exportAll.identifierName() != null ? exportAll.identifierName().getText() : null;
            return new ExportAllDeclaration(exported, unquote(exportAll.StringLiteral().getText()));
        } else if (ctx instanceof ExportNamedDeclarationContext exportNamed) {
            DeclarationContext declaration = exportNamed.declaration();
            Statement exported;
            if (declaration.variableStatement() != null) {
                exported = variableDeclarationList(declaration.variableStatement().variableDeclarationList());
            } else if (declaration.classDeclaration() != null) {
                exported = classDeclaration(declaration.classDeclaration());
            } else if (declaration.functionDeclaration() != null) {
                exported = functionDeclaration(declaration.functionDeclaration());
            } else {
                exported = typeDeclaration((ParserRuleContext) declaration.getChild(0));
            }
            return new ExportNamedDeclaration(exported);
        }
        throw unsupported(ctx);
    }

    private VariableDeclaration variableDeclarationList(VariableDeclarationListContext ctx) {
        List<VariableDeclarator> declarators = new ArrayList<>();
        for (VariableDeclarationContext declaration : ctx.variableDeclaration()) {
            declarators.add(new VariableDeclarator(
                typed(bindingTarget(declaration.bindingTarget()), List.of(), false, declaration.typeAnnotation()),
                expression(declaration.singleExpression())));
        }
        return new VariableDeclaration(ctx.varModifier().getText(), declarators);
    }

    private FunctionDeclaration functionDeclaration(FunctionDeclarationContext ctx) {
        return new FunctionDeclaration(
            identifier(ctx.identifier()),
            formalParameters(ctx.formalParameterList()),
            functionBody(ctx.functionBody()),
            ctx.Async() != null,
            ctx.Multiply() != null,
            functionTypes(ctx.typeParameters(), ctx.typeAnnotation()));
    }

    private ClassDeclaration classDeclaration(ClassDeclarationContext ctx) {
        ClassTailContext tail = ctx.classTail();
        return new ClassDeclaration(
            identifier(ctx.identifier()),
            expression(tail.singleExpression()),
            classMembers(tail),
            classTypes(ctx.Abstract() != null, ctx.typeParameters(), tail));
    }

    private ClassTypes classTypes(boolean isAbstract, TypeParametersContext typeParameters, ClassTailContext tail) {
        List<TypeReferenceContext> implemented = tail.typeReference();
        String implementsClause = implemented.isEmpty()
            ? null
            : sourceText(implemented.get(0).getStart(), implemented.get(implemented.size() - 1).getStop());
        if (!isAbstract && typeParameters == null && tail.typeArguments() == null && implementsClause == null) {
            return null;
        }
        return new ClassTypes(isAbstract, angleContent(typeParameters), angleContent(tail.typeArguments()), implementsClause);
    }

    private List<ClassMember> classMembers(ClassTailContext tail) {
        List<ClassMember> members = new ArrayList<>();
        Token previousStop = null;
        for (ClassElementContext element : tail.classElement()) {
            addComments(members, element.getStart(), previousStop);
            previousStop = element.getStop();
            if (element instanceof MethodElementContext method) {
                String kind = method.Get() != null ? "get" : method.Set() != null ? "set" : "method";
                FunctionExpression value = new FunctionExpression(
                    null,
                    formalParameters(method.formalParameterList()),
                    functionBody(method.functionBody()),
                    method.Async() != null,
                    method.Multiply() != null,
                    functionTypes(method.typeParameters(), method.typeAnnotation()));
                List<String> modifiers = modifiers(method.classModifier());
                members.add(new MethodDefinition(
                    classElementName(method.classElementName()),
                    kind,
                    modifiers.remove("static"),
                    value,
                    modifiers));
            } else if (element instanceof FieldElementContext field) {
                List<String> modifiers = modifiers(field.classModifier());
                boolean isStatic = modifiers.remove("static");
                members.add(new ClassField(
                    classElementName(field.classElementName()),
                    expression(field.singleExpression()),
                    isStatic,
                    modifiers,
                    field.QuestionMark() != null,
                    field.typeAnnotation() != null ? typeText(field.typeAnnotation()) : null));
            }
        }
        addComments(members, tail.CloseBrace().getSymbol(), previousStop);
        return members;
    }

    private static List<String> modifiers(List<? extends ParserRuleContext> modifiers) {
        List<String> result = new ArrayList<>();
        for (ParserRuleContext modifier : modifiers) {
            result.add(modifier.getText());
        }
        return result;
    }

    private PropertyKey classElementName(ClassElementNameContext ctx) {
        if (ctx.PrivateIdentifier() != null) {
            return PropertyKey.named(ctx.PrivateIdentifier().getText());
        }
        return propertyName(ctx.propertyName());
    }

    private Statement ifStatement(IfStatementContext ctx) {
        List<StatementContext> branches = ctx.statement();
        return new IfStatement(
            expressionSequence(ctx.expressionSequence()),
            statement(branches.get(0)),
            branches.size() > 1 ? statement(branches.get(1)) : null);
    }

    private Statement iterationStatement(IterationStatementContext ctx) {
        if (ctx instanceof DoStatementContext doStatement) {
            return new DoWhileStatement(statement(doStatement.statement()), expressionSequence(doStatement.expressionSequence()));
        } else if (ctx instanceof WhileStatementContext whileStatement) {
            return new WhileStatement(expressionSequence(whileStatement.expressionSequence()), statement(whileStatement.statement()));
        } else if (ctx instanceof ForStatementContext forStatement) {
            return forStatement(forStatement);
        } else if (ctx instanceof ForInOfStatementContext forInOf) {
            if (forInOf.Await() != null && forInOf.Of() == null) {
                throw new JavaScriptParseException("for await requires an of loop",
                    forInOf.getStart().getLine(), forInOf.getStart().getCharPositionInLine());
            }
            Node left = forInOf.variableDeclarationList() != null
                ? variableDeclarationList(forInOf.variableDeclarationList())
                : identifier(forInOf.identifier());
            return new ForInStatement(
                left,
                expressionSequence(forInOf.expressionSequence()),
                statement(forInOf.statement()),
                forInOf.Of() != null,
                forInOf.Await() != null);
        }
        throw unsupported(ctx);
    }

    private Statement forStatement(ForStatementContext ctx) {
        Node init = null;
        Expression test = null;
        Expression update = null;
        int section = 0;
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode terminal && terminal.getSymbol().getType() == JavaScriptParser.SemiColon) {
                section++;
            } else if (child instanceof VariableDeclarationListContext declarations) {
                init = variableDeclarationList(declarations);
            } else if (child instanceof ExpressionSequenceContext sequence) {
                Expression expression = expressionSequence(sequence);
                switch (section) {
                    case 0 -> init = expression;
                    case 1 -> test = expression;
                    default -> update = expression;
                }
            }
        }
        return new ForStatement(init, test, update, statement(ctx.statement()));
    }

    private Statement switchStatement(SwitchStatementContext ctx) {
        List<SwitchCase> cases = new ArrayList<>();
        List<SwitchClauseContext> clauses = ctx.switchClause();
        for (int i = 0; i < clauses.size(); i++) {
            SwitchClauseContext clause = clauses.get(i);
            Token closing = i + 1 < clauses.size() ? clauses.get(i + 1).getStart() : ctx.CloseBrace().getSymbol();
            Expression test = clause.Case() != null ? expressionSequence(clause.expressionSequence()) : null;
            cases.add(new SwitchCase(test, statementList(clause.statementList(), closing)));
        }
        return new SwitchStatement(expressionSequence(ctx.expressionSequence()), cases);
    }

    private Statement tryStatement(TryStatementContext ctx) {
        CatchClause handler = null;
        if (ctx.catchProduction() != null) {
            CatchProductionContext catchProduction = ctx.catchProduction();
            BindingTarget param = catchProduction.bindingTarget() != null
                ? typed(bindingTarget(catchProduction.bindingTarget()), List.of(), false, catchProduction.typeAnnotation())
                : null;
            handler = new CatchClause(param, block(catchProduction.block()));
        }
        BlockStatement finalizer = ctx.finallyProduction() != null ? block(ctx.finallyProduction().block()) : null;
        return new TryStatement(block(ctx.block()), handler, finalizer);
    }

    // ---------------------------------------------------------------- bindings

    private BindingTarget bindingTarget(BindingTargetContext ctx) {
        if (ctx.identifier() != null) {
            return identifier(ctx.identifier());
        } else if (ctx.objectBindingPattern() != null) {
            List<PatternMember> members = new ArrayList<>();
            for (BindingPropertyContext property : ctx.objectBindingPattern().bindingProperty()) {
                members.add(bindingProperty(property));
            }
            return new ObjectPattern(members);
        }
        List<BindingTarget> elements = new ArrayList<>();
        for (ArrayBindingElementContext element : ctx.arrayBindingPattern().arrayBindingElement()) {
            if (element.Ellipsis() != null) {
                elements.add(new RestElement(bindingTarget(element.bindingTarget())));
            } else {
                elements.add(bindingElement(element.bindingElement()));
            }
        }
        return new ArrayPattern(elements);
    }

    private PatternMember bindingProperty(BindingPropertyContext ctx) {
        if (ctx instanceof RestBindingPropertyContext rest) {
            return new RestElement(identifier(rest.identifier()));
        } else if (ctx instanceof KeyedBindingPropertyContext keyed) {
            return new PatternProperty(propertyName(keyed.propertyName()), bindingElement(keyed.bindingElement()), false);
        } else if (ctx instanceof ShorthandBindingPropertyContext shorthand) {
            Identifier name = identifier(shorthand.identifier());
            BindingTarget value = shorthand.singleExpression() != null
                ? new AssignmentPattern(name, expression(shorthand.singleExpression()))
                : name;
            return new PatternProperty(PropertyKey.named(name.name()), value, true);
        }
        throw unsupported(ctx);
    }

    private BindingTarget bindingElement(BindingElementContext ctx) {
        BindingTarget target = bindingTarget(ctx.bindingTarget());
        if (ctx.singleExpression() != null) {
            return new AssignmentPattern(target, expression(ctx.singleExpression()));
        }
        return target;
    }

    private List<BindingTarget> formalParameters(FormalParameterListContext ctx) {
        List<BindingTarget> params = new ArrayList<>();
        if (ctx == null) {
            return params;
        }
        for (FormalParameterContext parameter : ctx.formalParameter()) {
            BindingTarget target = bindingTarget(parameter.bindingTarget());
            if (parameter.Ellipsis() != null) {
                params.add(new RestElement(typed(target, List.of(), false, parameter.typeAnnotation())));
                continue;
            }
            BindingTarget param = typed(
                target,
                modifiers(parameter.parameterModifier()),
                parameter.QuestionMark() != null,
                parameter.typeAnnotation());
            params.add(parameter.singleExpression() != null
                ? new AssignmentPattern(param, expression(parameter.singleExpression()))
                : param);
        }
        return params;
    }

    private BindingTarget typed(BindingTarget target, List<String> modifiers, boolean optional, TypeAnnotationContext annotation) {
        if (modifiers.isEmpty() && !optional && annotation == null) {
            return target;
        }
        return new TypedBinding(target, optional, annotation != null ? typeText(annotation) : null, modifiers);
    }

    // ---------------------------------------------------------------- expressions

    private Expression expressionSequence(ExpressionSequenceContext ctx) {
        if (ctx == null) {
            return null;
        }
        List<SingleExpressionContext> expressions = ctx.singleExpression();
        if (expressions.size() == 1) {
            return expression(expressions.get(0));
        }
        List<Expression> items = new ArrayList<>();
        for (SingleExpressionContext expression : expressions) {
            items.add(expression(expression));
        }
        return new SequenceExpression(items);
    }

    @Override
    public Expression visitFunctionExpression(FunctionExpressionContext ctx) {
        AnonymousFunctionContext function = ctx.anonymousFunction();
        if (function instanceof FunctionLiteralContext literal) {
            return new FunctionExpression(
                literal.identifier() != null ? identifier(literal.identifier()) : null,
                formalParameters(literal.formalParameterList()),
                functionBody(literal.functionBody()),
                literal.Async() != null,
                literal.Multiply() != null,
                functionTypes(literal.typeParameters(), literal.typeAnnotation()));
        }
        ArrowFunctionContext arrow = (ArrowFunctionContext) function;
        ArrowFunctionParametersContext parameters = arrow.arrowFunctionParameters();
        List<BindingTarget> params = parameters.identifier() != null
            ? List.of(identifier(parameters.identifier()))
            : formalParameters(parameters.formalParameterList());
        ArrowFunctionBodyContext body = arrow.arrowFunctionBody();
        Node bodyNode = body.functionBody() != null
            ? functionBody(body.functionBody())
            : expression(body.singleExpression());
        return new ArrowFunctionExpression(params, bodyNode, arrow.Async() != null,
            functionTypes(null, parameters.typeAnnotation()));
    }

    @Override
    public Expression visitClassExpression(ClassExpressionContext ctx) {
        return new ClassExpression(
            ctx.identifier() != null ? identifier(ctx.identifier()) : null,
            expression(ctx.classTail().singleExpression()),
            classMembers(ctx.classTail()),
            classTypes(false, null, ctx.classTail()));
    }

    @Override
    public Expression visitMemberIndexExpression(MemberIndexExpressionContext ctx) {
        return new MemberExpression(expression(ctx.singleExpression()), null, expressionSequence(ctx.expressionSequence()), false);
    }

    @Override
    public Expression visitOptionalIndexExpression(OptionalIndexExpressionContext ctx) {
        return new MemberExpression(expression(ctx.singleExpression()), null, expressionSequence(ctx.expressionSequence()), true);
    }

    @Override
    public Expression visitMemberDotExpression(MemberDotExpressionContext ctx) {
        String property = ctx.identifierName() != null ? ctx.identifierName().getText() : ctx.PrivateIdentifier().getText();
        return new MemberExpression(expression(ctx.singleExpression()), property, null, ctx.QuestionMarkDot() != null);
    }

    @Override
    public Expression visitCallExpression(CallExpressionContext ctx) {
        return new CallExpression(
            expression(ctx.singleExpression()),
            arguments(ctx.arguments()),
            ctx.QuestionMarkDot() != null,
            angleContent(ctx.typeArguments()));
    }

    @Override
    public Expression visitTaggedTemplateExpression(TaggedTemplateExpressionContext ctx) {
        return new TaggedTemplateExpression(expression(ctx.singleExpression()), template(ctx.templateStringLiteral()));
    }

    @Override
    public Expression visitTemplateStringExpression(TemplateStringExpressionContext ctx) {
        return template(ctx.templateStringLiteral());
    }

    @Override
    public Expression visitMetaPropertyExpression(MetaPropertyExpressionContext ctx) {
        return new MetaProperty(ctx.getStart().getText(), ctx.identifierName().getText());
    }

    @Override
    public Expression visitNonNullExpression(NonNullExpressionContext ctx) {
        return new NonNullExpression(expression(ctx.singleExpression()));
    }

    @Override
    public Expression visitTypeAssertionExpression(TypeAssertionExpressionContext ctx) {
        return new TypeAssertion(expression(ctx.singleExpression()), ctx.getChild(1).getText(), typeText(ctx.type_()));
    }

    @Override
    public Expression visitJsxElementExpression(JsxElementExpressionContext ctx) {
        return jsxElement(ctx.jsxElement());
    }

    @Override
    public Expression visitNewExpression(NewExpressionContext ctx) {
        NewCalleeContext callee = ctx.newCallee();
        Expression target = callee.This() != null ? new ThisExpression() : identifier(callee.identifier());
        for (IdentifierNameContext name : callee.identifierName()) {
            target = MemberExpression.dot(target, name.getText());
        }
        List<Expression> arguments = ctx.arguments() != null ? arguments(ctx.arguments()) : List.of();
        return new NewExpression(target, arguments, angleContent(callee.typeArguments()));
    }

    @Override
    public Expression visitPostfixExpression(PostfixExpressionContext ctx) {
        return new UpdateExpression(ctx.getStop().getText(), false, expression(ctx.singleExpression()));
    }

    @Override
    public Expression visitUnaryExpression(UnaryExpressionContext ctx) {
        String operator = ctx.getChild(0).getText();
        Expression argument = expression(ctx.singleExpression());
        if ("++".equals(operator) || "--".equals(operator)) {
            return new UpdateExpression(operator, true, argument);
        }
        return new UnaryExpression(operator, argument);
    }

    @Override
    public Expression visitAwaitExpression(AwaitExpressionContext ctx) {
        return new AwaitExpression(expression(ctx.singleExpression()));
    }

    @Override
    public Expression visitPowerExpression(PowerExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitMultiplicativeExpression(MultiplicativeExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitAdditiveExpression(AdditiveExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitBitShiftExpression(BitShiftExpressionContext ctx) {
        requireAdjacent(ctx.shiftOperator());
        return binary(ctx);
    }

    @Override
    public Expression visitRelationalExpression(RelationalExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitEqualityExpression(EqualityExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitBitAndExpression(BitAndExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitBitXOrExpression(BitXOrExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitBitOrExpression(BitOrExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitLogicalAndExpression(LogicalAndExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitLogicalOrExpression(LogicalOrExpressionContext ctx) {
        return binary(ctx);
    }

    @Override
    public Expression visitCoalesceExpression(CoalesceExpressionContext ctx) {
        return binary(ctx);
    }

    /**
     * Binary alternatives all have the shape {@code left operator right}.
     */
    private Expression binary(ParserRuleContext ctx) {
        return new BinaryExpression(
            ctx.getChild(1).getText(),
            expression((SingleExpressionContext) ctx.getChild(0)),
            expression((SingleExpressionContext) ctx.getChild(2)));
    }

    @Override
    public Expression visitTernaryExpression(TernaryExpressionContext ctx) {
        return new ConditionalExpression(
            expression(ctx.singleExpression(0)),
            expression(ctx.singleExpression(1)),
            expression(ctx.singleExpression(2)));
    }

    /**
     * {@code >>}, {@code >>>} and their assignment forms are lexed as separate {@code >}
     * tokens, which must not be separated by whitespace.
     */
    private static void requireAdjacent(ParserRuleContext operator) {
        if (operator == null) {
            return;
        }
        int span = operator.getStop().getStopIndex() - operator.getStart().getStartIndex() + 1;
        if (span != operator.getText().length()) {
            throw new JavaScriptParseException("unexpected whitespace in operator '" + operator.getText() + "'",
                operator.getStart().getLine(), operator.getStart().getCharPositionInLine());
        }
    }

    @Override
    public Expression visitAssignmentExpression(AssignmentExpressionContext ctx) {
        requireAdjacent(ctx.assignmentOperator());
        return new AssignmentExpression(
            ctx.getChild(1).getText(),
            expression(ctx.singleExpression(0)),
            expression(ctx.singleExpression(1)));
    }

    @Override
    public Expression visitYieldExpression(YieldExpressionContext ctx) {
        return new YieldExpression(expression(ctx.singleExpression()), ctx.Multiply() != null);
    }

    @Override
    public Expression visitImportCallExpression(ImportCallExpressionContext ctx) {
        return new ImportCall(expression(ctx.singleExpression()));
    }

    @Override
    public Expression visitThisExpression(ThisExpressionContext ctx) {
        return new ThisExpression();
    }

    @Override
    public Expression visitSuperExpression(SuperExpressionContext ctx) {
        return new SuperExpression();
    }

    @Override
    public Expression visitIdentifierExpression(IdentifierExpressionContext ctx) {
        return identifier(ctx.identifier());
    }

    @Override
    public Expression visitLiteralExpression(LiteralExpressionContext ctx) {
        Token token = ctx.literal().getStart();
        return switch (token.getType()) {
            case JavaScriptParser.StringLiteral -> new Literal(LiteralKind.STRING, token.getText());
            case JavaScriptParser.BooleanLiteral -> new Literal(LiteralKind.BOOLEAN, token.getText());
            case JavaScriptParser.NullLiteral -> new Literal(LiteralKind.NULL, token.getText());
            case JavaScriptParser.RegularExpressionLiteral -> new Literal(LiteralKind.REGEX, token.getText());
            default -> new Literal(LiteralKind.NUMBER, token.getText());
        };
    }

    @Override
    public Expression visitArrayLiteralExpression(ArrayLiteralExpressionContext ctx) {
        List<Expression> elements = new ArrayList<>();
        for (ArrayElementContext element : ctx.arrayLiteral().arrayElement()) {
            Expression value = expression(element.singleExpression());
            elements.add(commented(element, element.Ellipsis() != null ? new SpreadElement(value) : value));
        }
        return new ArrayExpression(elements);
    }

    @Override
    public Expression visitObjectLiteralExpression(ObjectLiteralExpressionContext ctx) {
        List<ObjectMember> members = new ArrayList<>();
        Token previousStop = null;
        for (PropertyAssignmentContext property : ctx.objectLiteral().propertyAssignment()) {
            addComments(members, property.getStart(), previousStop);
            members.add(propertyAssignment(property));
            previousStop = property.getStop();
        }
        addComments(members, ctx.objectLiteral().CloseBrace().getSymbol(), previousStop);
        return new ObjectExpression(members);
    }

    @Override
    public Expression visitParenthesizedExpression(ParenthesizedExpressionContext ctx) {
        return new ParenthesizedExpression(expressionSequence(ctx.expressionSequence()));
    }

    private ObjectMember propertyAssignment(PropertyAssignmentContext ctx) {
        if (ctx instanceof PropertyExpressionAssignmentContext property) {
            return new Property(propertyName(property.propertyName()), expression(property.singleExpression()), false);
        } else if (ctx instanceof MethodPropertyContext method) {
            FunctionExpression value = new FunctionExpression(
                null,
                formalParameters(method.formalParameterList()),
                functionBody(method.functionBody()),
                method.Async() != null,
                method.Multiply() != null,
                functionTypes(method.typeParameters(), method.typeAnnotation()));
            return new MethodProperty(propertyName(method.propertyName()), "method", value);
        } else if (ctx instanceof AccessorPropertyContext accessor) {
            FunctionExpression value = new FunctionExpression(
                null,
                formalParameters(accessor.formalParameterList()),
                functionBody(accessor.functionBody()),
                false,
                false,
                functionTypes(null, accessor.typeAnnotation()));
            return new MethodProperty(propertyName(accessor.propertyName()), accessor.Get() != null ? "get" : "set", value);
        } else if (ctx instanceof SpreadPropertyContext spread) {
            return new SpreadElement(expression(spread.singleExpression()));
        } else if (ctx instanceof ShorthandPropertyContext shorthand) {
            Identifier name = identifier(shorthand.identifier());
            return new Property(PropertyKey.named(name.name()), name, true);
        }
        throw unsupported(ctx);
    }

    private PropertyKey propertyName(PropertyNameContext ctx) {
        if (ctx.singleExpression() != null) {
            return new PropertyKey(null, expression(ctx.singleExpression()));
        }
        return PropertyKey.named(ctx.getText());
    }

    private List<Expression> arguments(ArgumentsContext ctx) {
        List<Expression> arguments = new ArrayList<>();
        for (ArgumentContext argument : ctx.argument()) {
            Expression value = expression(argument.singleExpression());
            arguments.add(commented(argument, argument.Ellipsis() != null ? new SpreadElement(value) : value));
        }
        return arguments;
    }

    private Identifier identifier(IdentifierContext ctx) {
        return new Identifier(ctx.getText());
    }

    // ---------------------------------------------------------------- template literals and JSX

    private TemplateLiteral template(TemplateStringLiteralContext ctx) {
        List<String> quasis = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();
        StringBuilder segment = new StringBuilder();
        for (TemplateStringAtomContext atom : ctx.templateStringAtom()) {
            if (atom.TemplateStringAtom() != null) {
                segment.append(atom.TemplateStringAtom().getText());
            } else {
                quasis.add(segment.toString());
                segment.setLength(0);
                expressions.add(expressionSequence(atom.expressionSequence()));
            }
        }
        quasis.add(segment.toString());
        return new TemplateLiteral(quasis, expressions);
    }

    private JsxElement jsxElement(JsxElementContext ctx) {
        TerminalNode closingSlash = ctx.JsxSlash();
        String openingName = null;
        String closingName = null;
        for (TerminalNode name : ctx.JsxName()) {
            if (closingSlash == null || name.getSymbol().getTokenIndex() < closingSlash.getSymbol().getTokenIndex()) {
                openingName = name.getText();
            } else {
                closingName = name.getText();
            }
        }
        boolean selfClosing = ctx.JsxSelfClose() != null;
        if (!selfClosing && !Objects.equals(openingName, closingName)) {
            Token closing = closingSlash.getSymbol();
            throw new JavaScriptParseException(
                "expected closing tag for <" + (openingName != null ? openingName : "") + ">",
                closing.getLine(), closing.getCharPositionInLine());
        }
        List<JsxAttributeItem> attributes = new ArrayList<>();
        for (JsxAttributeContext attribute : ctx.jsxAttribute()) {
            if (attribute instanceof JsxNamedAttributeContext named) {
                Expression value = null;
                if (named.JsxString() != null) {
                    value = new Literal(LiteralKind.STRING, named.JsxString().getText());
                } else if (named.singleExpression() != null) {
                    value = expression(named.singleExpression());
                }
                attributes.add(new JsxAttribute(named.JsxName().getText(), value));
            } else {
                attributes.add(new JsxSpreadAttribute(expression(((JsxSpreadAttributeContext) attribute).singleExpression())));
            }
        }
        List<JsxChild> children = new ArrayList<>();
        for (JsxChildContext child : ctx.jsxChild()) {
            if (child.JsxText() != null) {
                children.add(new JsxText(child.JsxText().getText()));
            } else if (child.jsxElement() != null) {
                children.add(jsxElement(child.jsxElement()));
            } else {
                List<Comment> comments = new ArrayList<>();
                if (child.singleExpression() != null) {
                    comments.addAll(comments(tokens.getHiddenTokensToLeft(
                        child.singleExpression().getStart().getTokenIndex(), Token.HIDDEN_CHANNEL)));
                }
                comments.addAll(comments(tokens.getHiddenTokensToLeft(
                    child.SubstitutionClose().getSymbol().getTokenIndex(), Token.HIDDEN_CHANNEL)));
                children.add(new JsxExpressionContainer(expression(child.singleExpression()), child.Ellipsis() != null, comments));
            }
        }
        return new JsxElement(openingName, attributes, children, selfClosing);
    }

    // ---------------------------------------------------------------- TypeScript

    private TypeDeclaration typeDeclaration(ParserRuleContext ctx) {
        if (ctx instanceof TypeAliasDeclarationContext alias) {
            return new TypeDeclaration("type", alias.identifier().getText(),
                sourceText(alias.getStart(), alias.type_().getStop()));
        } else if (ctx instanceof InterfaceDeclarationContext declaration) {
            return new TypeDeclaration("interface", declaration.identifier().getText(), sourceText(declaration));
        } else if (ctx instanceof EnumDeclarationContext declaration) {
            return new TypeDeclaration("enum", declaration.identifier().getText(), sourceText(declaration));
        }
        throw unsupported(ctx);
    }

    private FunctionTypes functionTypes(TypeParametersContext typeParameters, TypeAnnotationContext returnType) {
        if (typeParameters == null && returnType == null) {
            return null;
        }
        return new FunctionTypes(angleContent(typeParameters), returnType != null ? typeText(returnType) : null);
    }

    private String typeText(TypeAnnotationContext annotation) {
        return typeText(annotation.type_());
    }

    private String typeText(Type_Context type) {
        return sourceText(type);
    }

    /**
     * Text between the angle brackets of type parameters or type arguments, or null.
     */
    private String angleContent(ParserRuleContext ctx) {
        if (ctx == null) {
            return null;
        }
        String text = sourceText(ctx);
        return text.substring(1, text.length() - 1);
    }

    private String sourceText(ParserRuleContext ctx) {
        return sourceText(ctx.getStart(), ctx.getStop());
    }

    private String sourceText(Token start, Token stop) {
        String text = start.getInputStream()
            .getText(Interval.of(start.getStartIndex(), stop.getStopIndex()))
            .replace("\r\n", "\n");
        if (text.indexOf('\n') < 0) {
            return text;
        }
        int indent = lineIndent(start);
        String[] lines = text.split("\n", -1);
        StringBuilder result = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            int strip = 0;
            while (strip < indent && strip < line.length() && Character.isWhitespace(line.charAt(strip))) {
                strip++;
            }
            result.append('\n').append(line, strip, line.length());
        }
        return result.toString();
    }

    /**
     * Column of the first token on the line a token starts on.
     */
    private int lineIndent(Token token) {
        Token first = token;
        for (int i = token.getTokenIndex() - 1; i >= 0; i--) {
            Token previous = tokens.get(i);
            if (previous.getLine() != token.getLine()) {
                break;
            }
            first = previous;
        }
        return first.getCharPositionInLine();
    }

    private static String unquote(String literal) {
        return literal.substring(1, literal.length() - 1);
    }

    private static JavaScriptParseException unsupported(ParserRuleContext ctx) {
        return new JavaScriptParseException("unsupported construct '" + ctx.getText() + "'",
            ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine());
    }
}
