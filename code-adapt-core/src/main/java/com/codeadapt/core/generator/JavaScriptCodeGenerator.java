package com.codeadapt.core.generator;

import com.codeadapt.core.ast.AstVisitor;
import com.codeadapt.core.ast.JavaScriptAst.*;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Prints a {@link Program} back to JavaScript source text.
 *
 * <p>The output always re-parses: statements are terminated with semicolons, and
 * parentheses are inserted where a node created by a transformation would otherwise bind
 * differently (for example an arrow function used as a callee). Trees produced by the
 * parser already carry their parentheses as {@link ParenthesizedExpression} nodes and are
 * printed without additions, so {@code parse(generate(parse(s)))} equals {@code parse(s)}.
 *
 * <p>Comments are printed where they were attached; trailing comments stay on the line of
 * the statement or member they follow. TypeScript types and JSX text are printed as written,
 * with the continuation lines of multi-line types re-indented to the current line.
 *
 * <p>Instances are immutable and thread-safe; each call uses its own printer.
 */
public final class JavaScriptCodeGenerator {

    private final StyleConfig style;

    /**
     * Creates a generator that keeps string literals as written.
     */
    public JavaScriptCodeGenerator() {
        this(StyleConfig.preserving());
    }

    public JavaScriptCodeGenerator(StyleConfig style) {
        this.style = Objects.requireNonNull(style, "style must not be null");
    }

    /**
     * Generates source text for a program.
     *
     * @param program program to print
     * @return source text, terminated by a newline unless the program is empty
     */
    public String generate(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        Printer printer = new Printer(style);
        program.accept(printer);
        return printer.out.toString();
    }

    /**
     * Generates source text for a single expression.
     */
    public String generateExpression(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        Printer printer = new Printer(style);
        printer.expression(expression, Precedence.ASSIGNMENT);
        return printer.out.toString();
    }

    /**
     * Operator precedence levels, higher binds tighter.
     */
    static final class Precedence {
        static final int SEQUENCE = 1;
        static final int ASSIGNMENT = 2;
        static final int CONDITIONAL = 3;
        static final int UNARY = 16;
        static final int POSTFIX = 17;
        static final int CALL = 18;
        static final int PRIMARY = 19;

        private Precedence() {
            // Utility class - no instantiation
        }

        static int of(Expression expression) {
            if (expression instanceof SequenceExpression) {
                return SEQUENCE;
            } else if (expression instanceof AssignmentExpression
                || expression instanceof ArrowFunctionExpression
                || expression instanceof YieldExpression) {
                return ASSIGNMENT;
            } else if (expression instanceof ConditionalExpression) {
                return CONDITIONAL;
            } else if (expression instanceof BinaryExpression binary) {
                return binary(binary.operator());
            } else if (expression instanceof TypeAssertion) {
                return binary("<");
            } else if (expression instanceof CommentedExpression commented) {
                return of(commented.expression());
            } else if (expression instanceof UnaryExpression || expression instanceof AwaitExpression) {
                return UNARY;
            } else if (expression instanceof UpdateExpression update) {
                return update.prefix() ? UNARY : POSTFIX;
            } else if (expression instanceof CallExpression
                || expression instanceof MemberExpression
                || expression instanceof NewExpression
                || expression instanceof NonNullExpression
                || expression instanceof TaggedTemplateExpression) {
                return CALL;
            }
            return PRIMARY;
        }

        static int binary(String operator) {
            return switch (operator) {
                case "??" -> 4;
                case "||" -> 5;
                case "&&" -> 6;
                case "|" -> 7;
                case "^" -> 8;
                case "&" -> 9;
                case "==", "!=", "===", "!==" -> 10;
                case "<", ">", "<=", ">=", "instanceof", "in" -> 11;
                case "<<", ">>", ">>>" -> 12;
                case "+", "-" -> 13;
                case "*", "/", "%" -> 14;
                case "**" -> 15;
                default -> throw new IllegalArgumentException("Unknown binary operator: " + operator);
            };
        }
    }

    private static final class Printer implements AstVisitor<Void> {

        private static final Set<String> WORD_OPERATORS = Set.of("typeof", "void", "delete");
        private static final Set<String> ACCESSIBILITY = Set.of("public", "private", "protected");

        private final StyleConfig style;
        private final StringBuilder out = new StringBuilder();
        private int depth;

        Printer(StyleConfig style) {
            this.style = style;
        }

        // ------------------------------------------------------------ layout helpers

        private Printer print(String text) {
            out.append(text);
            return this;
        }

        private void newline() {
            out.append('\n');
        }

        private void indent() {
            out.append(" ".repeat(depth * style.indentWidth()));
        }

        /**
         * Prints source text kept verbatim, indenting its continuation lines like the
         * current output line.
         */
        private Printer printVerbatim(String text) {
            if (text.indexOf('\n') < 0) {
                return print(text);
            }
            int lineStart = out.lastIndexOf("\n") + 1;
            int end = lineStart;
            while (end < out.length() && out.charAt(end) == ' ') {
                end++;
            }
            return print(text.replace("\n", "\n" + out.substring(lineStart, end)));
        }

        /**
         * Prints object or class members one per line. Commas separate object members only,
         * so comments never take one.
         */
        private void members(List<? extends Node> members, boolean commas) {
            print("{");
            newline();
            depth++;
            boolean first = true;
            for (int i = 0; i < members.size(); i++) {
                Node member = members.get(i);
                if (member instanceof Comment comment && comment.trailing() && !first) {
                    out.setLength(out.length() - 1);
                    print(" ").print(comment.text());
                    newline();
                    continue;
                }
                indent();
                member.accept(this);
                if (commas && !(member instanceof Comment) && hasMemberAfter(members, i)) {
                    print(",");
                }
                newline();
                first = false;
            }
            depth--;
            indent();
            print("}");
        }

        private static boolean hasMemberAfter(List<? extends Node> members, int index) {
            for (int i = index + 1; i < members.size(); i++) {
                if (!(members.get(i) instanceof Comment)) {
                    return true;
                }
            }
            return false;
        }

        private void typeAnnotation(String type) {
            if (type != null) {
                print(": ").printVerbatim(type);
            }
        }

        private void typeArguments(String typeArguments) {
            if (typeArguments != null) {
                print("<").printVerbatim(typeArguments).print(">");
            }
        }

        private void modifiers(boolean isStatic, List<String> modifiers) {
            for (String modifier : modifiers) {
                if (ACCESSIBILITY.contains(modifier)) {
                    print(modifier).print(" ");
                }
            }
            if (isStatic) {
                print("static ");
            }
            for (String modifier : modifiers) {
                if (!ACCESSIBILITY.contains(modifier)) {
                    print(modifier).print(" ");
                }
            }
        }

        /**
         * Prints statements one per line at the current depth. Trailing comments are
         * appended to the line before them.
         */
        private void statements(List<Statement> statements, boolean topLevel) {
            Statement previous = null;
            boolean first = true;
            for (Statement statement : statements) {
                if (statement instanceof Comment comment && comment.trailing() && !first) {
                    out.setLength(out.length() - 1);
                    print(" ").print(comment.text());
                    newline();
                    continue;
                }
                if (topLevel && style.blankLineBetweenDeclarations() && previous != null
                    && (isDeclaration(statement) || isDeclaration(previous))) {
                    newline();
                }
                indent();
                statement.accept(this);
                newline();
                first = false;
                if (!(statement instanceof Comment)) {
                    previous = statement;
                }
            }
        }

        private static boolean isDeclaration(Statement statement) {
            if (statement instanceof ExportNamedDeclaration exported) {
                return isDeclaration(exported.declaration());
            }
            if (statement instanceof ExportDefaultDeclaration exported) {
                return exported.expression() instanceof FunctionExpression
                    || exported.expression() instanceof ClassExpression;
            }
            return statement instanceof FunctionDeclaration
                || statement instanceof ClassDeclaration
                || statement instanceof TypeDeclaration;
        }

        private void block(List<Statement> statements) {
            if (statements.isEmpty()) {
                print("{}");
                return;
            }
            print("{");
            newline();
            depth++;
            statements(statements, false);
            depth--;
            indent();
            print("}");
        }

        /**
         * Prints an expression, parenthesized when it binds looser than {@code minPrecedence}.
         */
        void expression(Expression expression, int minPrecedence) {
            if (Precedence.of(expression) < minPrecedence) {
                print("(");
                expression.accept(this);
                print(")");
            } else {
                expression.accept(this);
            }
        }

        private void expressions(List<? extends Expression> expressions) {
            for (int i = 0; i < expressions.size(); i++) {
                if (i > 0) {
                    print(", ");
                }
                expression(expressions.get(i), Precedence.ASSIGNMENT);
            }
        }

        private void bindings(List<? extends Node> targets) {
            for (int i = 0; i < targets.size(); i++) {
                if (i > 0) {
                    print(", ");
                }
                targets.get(i).accept(this);
            }
        }

        private String quoted(String raw) {
            if (style.quoteStyle() == StyleConfig.QuoteStyle.PRESERVE || raw.length() < 2
                || (raw.charAt(0) != '\'' && raw.charAt(0) != '"')) {
                return raw;
            }
            char target = style.quoteStyle().quote();
            String inner = raw.substring(1, raw.length() - 1);
            if (raw.charAt(0) == target || inner.indexOf('\'') >= 0 || inner.indexOf('"') >= 0) {
                return raw;
            }
            return target + inner + target;
        }

        private String moduleName(String source) {
            char quote = style.quoteStyle().quote();
            if (source.indexOf(quote) >= 0) {
                quote = quote == '\'' ? '"' : '\'';
            }
            return quote + source + quote;
        }

        /**
         * Returns the expression that would be printed first.
         */
        private static Expression leftmost(Expression expression) {
            if (expression instanceof CallExpression call) {
                return leftmost(call.callee());
            } else if (expression instanceof MemberExpression member) {
                return leftmost(member.object());
            } else if (expression instanceof BinaryExpression binary) {
                return leftmost(binary.left());
            } else if (expression instanceof AssignmentExpression assignment) {
                return leftmost(assignment.left());
            } else if (expression instanceof ConditionalExpression conditional) {
                return leftmost(conditional.test());
            } else if (expression instanceof SequenceExpression sequence) {
                return leftmost(sequence.expressions().get(0));
            } else if (expression instanceof UpdateExpression update && !update.prefix()) {
                return leftmost(update.argument());
            } else if (expression instanceof TaggedTemplateExpression tagged) {
                return leftmost(tagged.tag());
            } else if (expression instanceof TypeAssertion assertion) {
                return leftmost(assertion.expression());
            } else if (expression instanceof NonNullExpression nonNull) {
                return leftmost(nonNull.expression());
            }
            return expression;
        }

        // ------------------------------------------------------------ program and modules

        @Override
        public Void visitProgram(Program program) {
            statements(program.body(), true);
            return null;
        }

        @Override
        public Void visitComment(Comment comment) {
            print(comment.text());
            return null;
        }

        @Override
        public Void visitImportDeclaration(ImportDeclaration declaration) {
            print(declaration.typeOnly() ? "import type " : "import ");
            boolean clause = false;
            if (declaration.defaultBinding() != null) {
                declaration.defaultBinding().accept(this);
                clause = true;
            }
            if (declaration.namespaceBinding() != null) {
                print(clause ? ", * as " : "* as ");
                declaration.namespaceBinding().accept(this);
                clause = true;
            }
            if (!declaration.specifiers().isEmpty()) {
                print(clause ? ", { " : "{ ");
                bindings(declaration.specifiers());
                print(" }");
                clause = true;
            }
            if (clause) {
                print(" from ");
            }
            print(moduleName(declaration.source())).print(";");
            return null;
        }

        @Override
        public Void visitImportSpecifier(ImportSpecifier specifier) {
            print(specifier.imported());
            if (!specifier.imported().equals(specifier.local().name())) {
                print(" as ").print(specifier.local().name());
            }
            return null;
        }

        @Override
        public Void visitExportDefaultDeclaration(ExportDefaultDeclaration declaration) {
            print("export default ");
            Expression expression = declaration.expression();
            if (expression instanceof FunctionExpression || expression instanceof ClassExpression) {
                expression.accept(this);
            } else {
                expression(expression, Precedence.ASSIGNMENT);
                print(";");
            }
            return null;
        }

        @Override
        public Void visitExportNamedDeclaration(ExportNamedDeclaration declaration) {
            print("export ");
            declaration.declaration().accept(this);
            return null;
        }

        @Override
        public Void visitExportListDeclaration(ExportListDeclaration declaration) {
            print("export ");
            if (declaration.specifiers().isEmpty()) {
                print("{}");
            } else {
                print("{ ");
                bindings(declaration.specifiers());
                print(" }");
            }
            if (declaration.source() != null) {
                print(" from ").print(moduleName(declaration.source()));
            }
            print(";");
            return null;
        }

        @Override
        public Void visitExportSpecifier(ExportSpecifier specifier) {
            print(specifier.local().name());
            if (!specifier.exported().equals(specifier.local().name())) {
                print(" as ").print(specifier.exported());
            }
            return null;
        }

        @Override
        public Void visitExportAllDeclaration(ExportAllDeclaration declaration) {
            print("export *");
            if (declaration.exported() != null) {
                print(" as ").print(declaration.exported());
            }
            print(" from ").print(moduleName(declaration.source())).print(";");
            return null;
        }

        // ------------------------------------------------------------ declarations

        @Override
        public Void visitVariableDeclaration(VariableDeclaration declaration) {
            variableDeclaration(declaration);
            print(";");
            return null;
        }

        private void variableDeclaration(VariableDeclaration declaration) {
            print(declaration.kind()).print(" ");
            bindings(declaration.declarations());
        }

        @Override
        public Void visitVariableDeclarator(VariableDeclarator declarator) {
            declarator.id().accept(this);
            if (declarator.init() != null) {
                print(" = ");
                expression(declarator.init(), Precedence.ASSIGNMENT);
            }
            return null;
        }

        @Override
        public Void visitFunctionDeclaration(FunctionDeclaration declaration) {
            function(declaration.async(), declaration.generator(), declaration.id(), declaration.params(),
                declaration.body(), declaration.types());
            return null;
        }

        private void function(boolean async, boolean generator, Identifier id, List<BindingTarget> params,
                              BlockStatement body, FunctionTypes types) {
            if (async) {
                print("async ");
            }
            print(generator ? "function* " : "function ");
            if (id != null) {
                id.accept(this);
            }
            signature(params, types);
            print(" ");
            block(body.body());
        }

        /**
         * Prints type parameters, parameters and return type.
         */
        private void signature(List<BindingTarget> params, FunctionTypes types) {
            if (types != null) {
                typeArguments(types.typeParameters());
            }
            print("(");
            bindings(params);
            print(")");
            if (types != null) {
                typeAnnotation(types.returnType());
            }
        }

        @Override
        public Void visitClassDeclaration(ClassDeclaration declaration) {
            classBody(declaration.id(), declaration.superClass(), declaration.members(), declaration.types());
            return null;
        }

        private void classBody(Identifier id, Expression superClass, List<ClassMember> members, ClassTypes types) {
            print(types != null && types.isAbstract() ? "abstract class " : "class ");
            if (id != null) {
                id.accept(this);
                if (types != null) {
                    typeArguments(types.typeParameters());
                }
                print(" ");
            }
            if (superClass != null) {
                print("extends ");
                expression(superClass, Precedence.ASSIGNMENT);
                if (types != null) {
                    typeArguments(types.superTypeArguments());
                }
                print(" ");
            }
            if (types != null && types.implementsClause() != null) {
                print("implements ").printVerbatim(types.implementsClause()).print(" ");
            }
            if (members.isEmpty()) {
                print("{}");
                return;
            }
            members(members, false);
        }

        @Override
        public Void visitMethodDefinition(MethodDefinition method) {
            modifiers(method.isStatic(), method.modifiers());
            method(method.key(), method.kind(), method.value());
            return null;
        }

        private void method(PropertyKey key, String kind, FunctionExpression value) {
            if (value.async()) {
                print("async ");
            }
            if (value.generator()) {
                print("*");
            }
            if ("get".equals(kind) || "set".equals(kind)) {
                print(kind).print(" ");
            }
            key.accept(this);
            signature(value.params(), value.types());
            print(" ");
            block(value.body().body());
        }

        @Override
        public Void visitClassField(ClassField field) {
            modifiers(field.isStatic(), field.modifiers());
            field.key().accept(this);
            if (field.optional()) {
                print("?");
            }
            typeAnnotation(field.type());
            if (field.value() != null) {
                print(" = ");
                expression(field.value(), Precedence.ASSIGNMENT);
            }
            print(";");
            return null;
        }

        @Override
        public Void visitPropertyKey(PropertyKey key) {
            if (key.isComputed()) {
                print("[");
                expression(key.computed(), Precedence.ASSIGNMENT);
                print("]");
            } else {
                print(quoted(key.text()));
            }
            return null;
        }

        // ------------------------------------------------------------ statements

        @Override
        public Void visitBlockStatement(BlockStatement block) {
            block(block.body());
            return null;
        }

        @Override
        public Void visitExpressionStatement(ExpressionStatement statement) {
            Expression expression = statement.expression();
            Expression first = leftmost(expression);
            if (first instanceof FunctionExpression || first instanceof ObjectExpression || first instanceof ClassExpression) {
                print("(");
                expression(expression, Precedence.SEQUENCE);
                print(")");
            } else {
                expression(expression, Precedence.SEQUENCE);
            }
            print(";");
            return null;
        }

        @Override
        public Void visitIfStatement(IfStatement statement) {
            print("if (");
            expression(statement.test(), Precedence.SEQUENCE);
            print(") ");
            statement.consequent().accept(this);
            if (statement.alternate() != null) {
                print(" else ");
                statement.alternate().accept(this);
            }
            return null;
        }

        @Override
        public Void visitForStatement(ForStatement statement) {
            print("for (");
            if (statement.init() instanceof VariableDeclaration declaration) {
                variableDeclaration(declaration);
            } else if (statement.init() instanceof Expression init) {
                expression(init, Precedence.SEQUENCE);
            }
            print(";");
            if (statement.test() != null) {
                print(" ");
                expression(statement.test(), Precedence.SEQUENCE);
            }
            print(";");
            if (statement.update() != null) {
                print(" ");
                expression(statement.update(), Precedence.SEQUENCE);
            }
            print(") ");
            statement.body().accept(this);
            return null;
        }

        @Override
        public Void visitForInStatement(ForInStatement statement) {
            print(statement.isAwait() ? "for await (" : "for (");
            if (statement.left() instanceof VariableDeclaration declaration) {
                variableDeclaration(declaration);
            } else {
                statement.left().accept(this);
            }
            print(statement.of() ? " of " : " in ");
            expression(statement.right(), Precedence.SEQUENCE);
            print(") ");
            statement.body().accept(this);
            return null;
        }

        @Override
        public Void visitWhileStatement(WhileStatement statement) {
            print("while (");
            expression(statement.test(), Precedence.SEQUENCE);
            print(") ");
            statement.body().accept(this);
            return null;
        }

        @Override
        public Void visitDoWhileStatement(DoWhileStatement statement) {
            print("do ");
            statement.body().accept(this);
            print(" while (");
            expression(statement.test(), Precedence.SEQUENCE);
            print(");");
            return null;
        }

        @Override
        public Void visitReturnStatement(ReturnStatement statement) {
            print("return");
            if (statement.argument() != null) {
                print(" ");
                expression(statement.argument(), Precedence.SEQUENCE);
            }
            print(";");
            return null;
        }

        @Override
        public Void visitThrowStatement(ThrowStatement statement) {
            print("throw ");
            expression(statement.argument(), Precedence.SEQUENCE);
            print(";");
            return null;
        }

        @Override
        public Void visitTryStatement(TryStatement statement) {
            print("try ");
            statement.block().accept(this);
            if (statement.handler() != null) {
                print(" ");
                statement.handler().accept(this);
            }
            if (statement.finalizer() != null) {
                print(" finally ");
                statement.finalizer().accept(this);
            }
            return null;
        }

        @Override
        public Void visitCatchClause(CatchClause clause) {
            print("catch ");
            if (clause.param() != null) {
                print("(");
                clause.param().accept(this);
                print(") ");
            }
            clause.body().accept(this);
            return null;
        }

        @Override
        public Void visitBreakStatement(BreakStatement statement) {
            print(statement.label() != null ? "break " + statement.label() + ";" : "break;");
            return null;
        }

        @Override
        public Void visitContinueStatement(ContinueStatement statement) {
            print(statement.label() != null ? "continue " + statement.label() + ";" : "continue;");
            return null;
        }

        @Override
        public Void visitSwitchStatement(SwitchStatement statement) {
            print("switch (");
            expression(statement.discriminant(), Precedence.SEQUENCE);
            print(") {");
            newline();
            depth++;
            for (SwitchCase switchCase : statement.cases()) {
                indent();
                switchCase.accept(this);
            }
            depth--;
            indent();
            print("}");
            return null;
        }

        @Override
        public Void visitSwitchCase(SwitchCase switchCase) {
            if (switchCase.test() != null) {
                print("case ");
                expression(switchCase.test(), Precedence.SEQUENCE);
                print(":");
            } else {
                print("default:");
            }
            newline();
            depth++;
            statements(switchCase.consequent(), false);
            depth--;
            return null;
        }

        @Override
        public Void visitEmptyStatement(EmptyStatement statement) {
            print(";");
            return null;
        }

        @Override
        public Void visitLabeledStatement(LabeledStatement statement) {
            print(statement.label()).print(": ");
            statement.body().accept(this);
            return null;
        }

        @Override
        public Void visitDebuggerStatement(DebuggerStatement statement) {
            print("debugger;");
            return null;
        }

        @Override
        public Void visitTypeDeclaration(TypeDeclaration declaration) {
            printVerbatim(declaration.text());
            if ("type".equals(declaration.kind())) {
                print(";");
            }
            return null;
        }

        // ------------------------------------------------------------ expressions

        @Override
        public Void visitIdentifier(Identifier identifier) {
            print(identifier.name());
            return null;
        }

        @Override
        public Void visitLiteral(Literal literal) {
            print(literal.kind() == LiteralKind.STRING ? quoted(literal.raw()) : literal.raw());
            return null;
        }

        @Override
        public Void visitTemplateLiteral(TemplateLiteral template) {
            print("`");
            for (int i = 0; i < template.expressions().size(); i++) {
                print(template.quasis().get(i)).print("${");
                expression(template.expressions().get(i), Precedence.SEQUENCE);
                print("}");
            }
            print(template.quasis().get(template.quasis().size() - 1)).print("`");
            return null;
        }

        @Override
        public Void visitTaggedTemplateExpression(TaggedTemplateExpression expression) {
            expression(expression.tag(), Precedence.CALL);
            expression.quasi().accept(this);
            return null;
        }

        @Override
        public Void visitArrayExpression(ArrayExpression array) {
            print("[");
            expressions(array.elements());
            print("]");
            return null;
        }

        @Override
        public Void visitObjectExpression(ObjectExpression object) {
            if (object.properties().isEmpty()) {
                print("{}");
                return null;
            }
            members(object.properties(), true);
            return null;
        }

        @Override
        public Void visitProperty(Property property) {
            if (property.shorthand()
                && property.value() instanceof Identifier value
                && value.name().equals(property.key().name())) {
                print(value.name());
                return null;
            }
            property.key().accept(this);
            print(": ");
            expression(property.value(), Precedence.ASSIGNMENT);
            return null;
        }

        @Override
        public Void visitMethodProperty(MethodProperty property) {
            method(property.key(), property.kind(), property.value());
            return null;
        }

        @Override
        public Void visitSpreadElement(SpreadElement spread) {
            print("...");
            expression(spread.argument(), Precedence.ASSIGNMENT);
            return null;
        }

        @Override
        public Void visitFunctionExpression(FunctionExpression function) {
            function(function.async(), function.generator(), function.id(), function.params(), function.body(),
                function.types());
            return null;
        }

        @Override
        public Void visitArrowFunctionExpression(ArrowFunctionExpression arrow) {
            if (arrow.async()) {
                print("async ");
            }
            signature(arrow.params(), arrow.types());
            print(" => ");
            if (arrow.body() instanceof BlockStatement body) {
                block(body.body());
            } else {
                Expression body = (Expression) arrow.body();
                if (leftmost(body) instanceof ObjectExpression) {
                    print("(");
                    expression(body, Precedence.SEQUENCE);
                    print(")");
                } else {
                    expression(body, Precedence.ASSIGNMENT);
                }
            }
            return null;
        }

        @Override
        public Void visitClassExpression(ClassExpression expression) {
            classBody(expression.id(), expression.superClass(), expression.members(), expression.types());
            return null;
        }

        @Override
        public Void visitUnaryExpression(UnaryExpression unary) {
            String operator = unary.operator();
            print(operator);
            if (WORD_OPERATORS.contains(operator) || startsWithSameSign(operator, unary.argument())) {
                print(" ");
            }
            expression(unary.argument(), Precedence.UNARY);
            return null;
        }

        private static boolean startsWithSameSign(String operator, Expression argument) {
            String next = null;
            if (argument instanceof UnaryExpression unary) {
                next = unary.operator();
            } else if (argument instanceof UpdateExpression update && update.prefix()) {
                next = update.operator();
            }
            return next != null && (operator.equals("+") || operator.equals("-")) && next.charAt(0) == operator.charAt(0);
        }

        @Override
        public Void visitUpdateExpression(UpdateExpression update) {
            if (update.prefix()) {
                print(update.operator());
                expression(update.argument(), Precedence.UNARY);
            } else {
                expression(update.argument(), Precedence.CALL);
                print(update.operator());
            }
            return null;
        }

        @Override
        public Void visitBinaryExpression(BinaryExpression binary) {
            int precedence = Precedence.binary(binary.operator());
            boolean rightAssociative = "**".equals(binary.operator());
            Expression left = binary.left();
            if (rightAssociative && (left instanceof UnaryExpression || left instanceof AwaitExpression)) {
                print("(");
                left.accept(this);
                print(")");
            } else {
                expression(left, rightAssociative ? precedence + 1 : precedence);
            }
            print(" ").print(binary.operator()).print(" ");
            expression(binary.right(), rightAssociative ? precedence : precedence + 1);
            return null;
        }

        @Override
        public Void visitAssignmentExpression(AssignmentExpression assignment) {
            expression(assignment.left(), Precedence.CONDITIONAL);
            print(" ").print(assignment.operator()).print(" ");
            expression(assignment.right(), Precedence.ASSIGNMENT);
            return null;
        }

        @Override
        public Void visitConditionalExpression(ConditionalExpression conditional) {
            expression(conditional.test(), Precedence.CONDITIONAL + 1);
            print(" ? ");
            expression(conditional.consequent(), Precedence.ASSIGNMENT);
            print(" : ");
            expression(conditional.alternate(), Precedence.ASSIGNMENT);
            return null;
        }

        @Override
        public Void visitCallExpression(CallExpression call) {
            expression(call.callee(), Precedence.CALL);
            if (call.optional()) {
                print("?.");
            }
            typeArguments(call.typeArguments());
            print("(");
            expressions(call.arguments());
            print(")");
            return null;
        }

        @Override
        public Void visitNewExpression(NewExpression expression) {
            print("new ");
            expression(expression.callee(), Precedence.CALL);
            typeArguments(expression.typeArguments());
            print("(");
            expressions(expression.arguments());
            print(")");
            return null;
        }

        @Override
        public Void visitMemberExpression(MemberExpression member) {
            expression(member.object(), Precedence.CALL);
            if (member.isComputed()) {
                print(member.optional() ? "?.[" : "[");
                expression(member.index(), Precedence.SEQUENCE);
                print("]");
            } else {
                print(member.optional() ? "?." : ".").print(member.property());
            }
            return null;
        }

        @Override
        public Void visitSequenceExpression(SequenceExpression sequence) {
            expressions(sequence.expressions());
            return null;
        }

        @Override
        public Void visitAwaitExpression(AwaitExpression await) {
            print("await ");
            expression(await.argument(), Precedence.UNARY);
            return null;
        }

        @Override
        public Void visitYieldExpression(YieldExpression yield) {
            print(yield.delegate() ? "yield*" : "yield");
            if (yield.argument() != null) {
                print(" ");
                expression(yield.argument(), Precedence.ASSIGNMENT);
            }
            return null;
        }

        @Override
        public Void visitThisExpression(ThisExpression expression) {
            print("this");
            return null;
        }

        @Override
        public Void visitSuperExpression(SuperExpression expression) {
            print("super");
            return null;
        }

        @Override
        public Void visitParenthesizedExpression(ParenthesizedExpression expression) {
            print("(");
            expression(expression.expression(), Precedence.SEQUENCE);
            print(")");
            return null;
        }

        @Override
        public Void visitImportCall(ImportCall importCall) {
            print("import(");
            expression(importCall.source(), Precedence.ASSIGNMENT);
            print(")");
            return null;
        }

        @Override
        public Void visitMetaProperty(MetaProperty metaProperty) {
            print(metaProperty.meta()).print(".").print(metaProperty.property());
            return null;
        }

        /**
         * Block comments stay inline; a line comment ends the line and the argument list
         * continues on the next one.
         */
        @Override
        public Void visitCommentedExpression(CommentedExpression commented) {
            for (Comment comment : commented.leading()) {
                print(comment.text());
                if (comment.text().startsWith("//")) {
                    newline();
                    out.append(" ".repeat((depth + 1) * style.indentWidth()));
                } else {
                    print(" ");
                }
            }
            commented.expression().accept(this);
            for (Comment comment : commented.trailing()) {
                print(" ").print(comment.text());
                if (comment.text().startsWith("//")) {
                    newline();
                    indent();
                }
            }
            return null;
        }

        @Override
        public Void visitTypeAssertion(TypeAssertion assertion) {
            expression(assertion.expression(), Precedence.binary("<"));
            print(" ").print(assertion.operator()).print(" ").printVerbatim(assertion.type());
            return null;
        }

        @Override
        public Void visitNonNullExpression(NonNullExpression nonNull) {
            expression(nonNull.expression(), Precedence.CALL);
            print("!");
            return null;
        }

        // ------------------------------------------------------------ JSX

        @Override
        public Void visitJsxElement(JsxElement element) {
            String name = element.isFragment() ? "" : element.name();
            print("<").print(name);
            for (JsxAttributeItem attribute : element.attributes()) {
                print(" ");
                attribute.accept(this);
            }
            if (element.selfClosing()) {
                print(" />");
                return null;
            }
            print(">");
            for (JsxChild child : element.children()) {
                child.accept(this);
            }
            print("</").print(name).print(">");
            return null;
        }

        @Override
        public Void visitJsxAttribute(JsxAttribute attribute) {
            print(attribute.name());
            Expression value = attribute.value();
            if (value == null) {
                return null;
            }
            print("=");
            if (value instanceof Literal literal && literal.kind() == LiteralKind.STRING && literal.raw().indexOf('\\') < 0) {
                print(literal.raw());
            } else {
                print("{");
                expression(value, Precedence.ASSIGNMENT);
                print("}");
            }
            return null;
        }

        @Override
        public Void visitJsxSpreadAttribute(JsxSpreadAttribute attribute) {
            print("{...");
            expression(attribute.argument(), Precedence.ASSIGNMENT);
            print("}");
            return null;
        }

        @Override
        public Void visitJsxText(JsxText text) {
            print(text.raw());
            return null;
        }

        @Override
        public Void visitJsxExpressionContainer(JsxExpressionContainer container) {
            print("{");
            for (Comment comment : container.comments()) {
                print(comment.text());
                if (comment.text().startsWith("//")) {
                    newline();
                    indent();
                } else if (container.expression() != null) {
                    print(" ");
                }
            }
            if (container.spread()) {
                print("...");
            }
            if (container.expression() != null) {
                expression(container.expression(), Precedence.ASSIGNMENT);
            }
            print("}");
            return null;
        }

        // ------------------------------------------------------------ binding patterns

        @Override
        public Void visitObjectPattern(ObjectPattern pattern) {
            if (pattern.properties().isEmpty()) {
                print("{}");
                return null;
            }
            print("{ ");
            bindings(pattern.properties());
            print(" }");
            return null;
        }

        @Override
        public Void visitPatternProperty(PatternProperty property) {
            String key = property.key().name();
            if (property.shorthand() && key != null) {
                if (property.value() instanceof Identifier value && value.name().equals(key)) {
                    print(key);
                    return null;
                }
                if (property.value() instanceof AssignmentPattern assignment
                    && assignment.left() instanceof Identifier left
                    && left.name().equals(key)) {
                    assignment.accept(this);
                    return null;
                }
            }
            property.key().accept(this);
            print(": ");
            property.value().accept(this);
            return null;
        }

        @Override
        public Void visitArrayPattern(ArrayPattern pattern) {
            print("[");
            bindings(pattern.elements());
            print("]");
            return null;
        }

        @Override
        public Void visitAssignmentPattern(AssignmentPattern pattern) {
            pattern.left().accept(this);
            print(" = ");
            expression(pattern.right(), Precedence.ASSIGNMENT);
            return null;
        }

        @Override
        public Void visitRestElement(RestElement rest) {
            print("...");
            rest.argument().accept(this);
            return null;
        }

        @Override
        public Void visitTypedBinding(TypedBinding binding) {
            modifiers(false, binding.modifiers());
            binding.target().accept(this);
            if (binding.optional()) {
                print("?");
            }
            typeAnnotation(binding.type());
            return null;
        }
    }
}
