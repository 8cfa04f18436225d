package com.codeadapt.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Syntax tree node types for JavaScript component source code.
 *
 * <p>This class contains record types representing the parsed ES2020 module subset
 * accepted by {@link com.codeadapt.core.parser.JavaScriptAstParser}, including TypeScript
 * annotations and JSX elements. All nodes are
 * immutable; transformations build new trees through {@link AstRewriter}. Structural
 * equality of two trees is plain {@code equals}.
 *
 * <p><b>Node families:</b></p>
 * <ul>
 *   <li>{@link Statement} - module items and statements, including statement-level {@link Comment}s</li>
 *   <li>{@link Expression} - expressions</li>
 *   <li>{@link BindingTarget} - declaration targets (identifiers and destructuring patterns)</li>
 *   <li>{@link ObjectMember}, {@link ClassMember}, {@link PatternMember} - members of literals and patterns</li>
 *   <li>{@link JsxChild}, {@link JsxAttributeItem} - JSX children and attributes</li>
 * </ul>
 *
 * <p>TypeScript types are not modeled as nodes. They are kept as source text (see
 * {@link TypedBinding}, {@link FunctionTypes}, {@link TypeDeclaration}); lines after the
 * first are stored relative to the indentation of the line the type starts on.
 *
 * <p>Names that are not references to bindings are kept as plain strings or as
 * {@link PropertyKey}s (member names, object keys, module names, imported and exported
 * names). Every {@link Identifier} in a tree is therefore a binding or a reference.
 *
 * @see AstVisitor
 * @since 1.0.0
 */
public final class JavaScriptAst {

    private JavaScriptAst() {
        // Utility class - no instantiation
    }

    /**
     * Common supertype of all nodes.
     */
    public interface Node {
        <R> R accept(AstVisitor<R> visitor);
    }

    public interface Statement extends Node {
    }

    public interface Expression extends Node {
    }

    /**
     * Left-hand side of a declaration, parameter or catch clause.
     */
    public interface BindingTarget extends Node {

        /**
         * Returns this target without a type annotation.
         */
        default BindingTarget untyped() {
            return this;
        }
    }

    public interface ObjectMember extends Node {
    }

    public interface ClassMember extends Node {
    }

    public interface PatternMember extends Node {
    }

    public interface JsxChild extends Node {
    }

    public interface JsxAttributeItem extends Node {
    }

    // ---------------------------------------------------------------- program and modules

    /**
     * Root of a parsed snippet.
     *
     * @param body top-level statements in source order
     */
    public record Program(List<Statement> body) implements Node {
        public Program {
            body = body != null ? List.copyOf(body) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    /**
     * A comment kept between statements, object members or class members.
     *
     * @param text raw comment text including its delimiters
     * @param trailing true if the comment follows the previous statement or member on the same line
     */
    public record Comment(String text, boolean trailing) implements Statement, ObjectMember, ClassMember {
        public Comment {
            Objects.requireNonNull(text, "text must not be null");
        }

        public boolean isLineComment() {
            return text.startsWith("//");
        }

        /**
         * Returns the comment text without its delimiters.
         */
        public String content() {
            if (isLineComment()) {
                return text.substring(2).trim();
            }
            return text.substring(2, Math.max(2, text.length() - 2)).trim();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    /**
     * An import declaration.
     *
     * <p>Examples:
     * <pre>{@code
     * import Foo from 'pkg';
     * import { a, b as c } from 'pkg';
     * import Foo, * as ns from 'pkg';
     * import 'polyfill';
     * import type { User } from './types';
     * }</pre>
     *
     * @param defaultBinding default import binding, or null
     * @param namespaceBinding namespace import binding, or null
     * @param specifiers named import specifiers
     * @param source module name without quotes
     * @param typeOnly true for {@code import type}
     */
    public record ImportDeclaration(
        Identifier defaultBinding,
        Identifier namespaceBinding,
        List<ImportSpecifier> specifiers,
        String source,
        boolean typeOnly
    ) implements Statement {
        public ImportDeclaration {
            specifiers = specifiers != null ? List.copyOf(specifiers) : List.of();
            Objects.requireNonNull(source, "source must not be null");
        }

        public ImportDeclaration(Identifier defaultBinding, Identifier namespaceBinding,
                                 List<ImportSpecifier> specifiers, String source) {
            this(defaultBinding, namespaceBinding, specifiers, source, false);
        }

        public boolean isSideEffectOnly() {
            return defaultBinding == null && namespaceBinding == null && specifiers.isEmpty();
        }

        public boolean isDefaultOnly() {
            return defaultBinding != null && namespaceBinding == null && specifiers.isEmpty();
        }

        public boolean isNamedOnly() {
            return defaultBinding == null && namespaceBinding == null && !specifiers.isEmpty();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitImportDeclaration(this);
        }
    }

    /**
     * A named import specifier.
     *
     * @param imported exported name in the source module
     * @param local local binding
     */
    public record ImportSpecifier(String imported, Identifier local) implements Node {
        public ImportSpecifier {
            Objects.requireNonNull(imported, "imported must not be null");
            Objects.requireNonNull(local, "local must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitImportSpecifier(this);
        }
    }

    public record ExportDefaultDeclaration(Expression expression) implements Statement {
        public ExportDefaultDeclaration {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitExportDefaultDeclaration(this);
        }
    }

    /**
     * An exported declaration such as {@code export const x = 1;}.
     */
    public record ExportNamedDeclaration(Statement declaration) implements Statement {
        public ExportNamedDeclaration {
            Objects.requireNonNull(declaration, "declaration must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitExportNamedDeclaration(this);
        }
    }

    /**
     * An export list, optionally re-exporting from another module.
     *
     * @param specifiers exported names
     * @param source module name for re-exports, or null
     */
    public record ExportListDeclaration(List<ExportSpecifier> specifiers, String source) implements Statement {
        public ExportListDeclaration {
            specifiers = specifiers != null ? List.copyOf(specifiers) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitExportListDeclaration(this);
        }
    }

    /**
     * @param local local binding (or the source module's name for re-exports)
     * @param exported exported name
     */
    public record ExportSpecifier(Identifier local, String exported) implements Node {
        public ExportSpecifier {
            Objects.requireNonNull(local, "local must not be null");
            Objects.requireNonNull(exported, "exported must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitExportSpecifier(this);
        }
    }

    /**
     * {@code export * from 'pkg';} or {@code export * as name from 'pkg';}
     */
    public record ExportAllDeclaration(String exported, String source) implements Statement {
        public ExportAllDeclaration {
            Objects.requireNonNull(source, "source must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitExportAllDeclaration(this);
        }
    }

    // ---------------------------------------------------------------- declarations

    /**
     * @param kind {@code var}, {@code let} or {@code const}
     * @param declarations declarators in source order
     */
    public record VariableDeclaration(String kind, List<VariableDeclarator> declarations) implements Statement {
        public VariableDeclaration {
            Objects.requireNonNull(kind, "kind must not be null");
            declarations = declarations != null ? List.copyOf(declarations) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitVariableDeclaration(this);
        }
    }

    /**
     * @param id declared target, a {@link TypedBinding} when annotated
     * @param init initializer, or null
     */
    public record VariableDeclarator(BindingTarget id, Expression init) implements Node {
        public VariableDeclarator {
            Objects.requireNonNull(id, "id must not be null");
        }

        public VariableDeclarator withInit(Expression newInit) {
            return new VariableDeclarator(id, newInit);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitVariableDeclarator(this);
        }
    }

    /**
     * @param types type parameters and return type, or null when the function has neither
     */
    public record FunctionDeclaration(
        Identifier id,
        List<BindingTarget> params,
        BlockStatement body,
        boolean async,
        boolean generator,
        FunctionTypes types
    ) implements Statement {
        public FunctionDeclaration {
            Objects.requireNonNull(id, "id must not be null");
            params = params != null ? List.copyOf(params) : List.of();
            Objects.requireNonNull(body, "body must not be null");
        }

        public FunctionDeclaration(Identifier id, List<BindingTarget> params, BlockStatement body,
                                   boolean async, boolean generator) {
            this(id, params, body, async, generator, null);
        }

        public FunctionDeclaration withBody(BlockStatement newBody) {
            return new FunctionDeclaration(id, params, newBody, async, generator, types);
        }

        public FunctionDeclaration withAsync(boolean newAsync) {
            return new FunctionDeclaration(id, params, body, newAsync, generator, types);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFunctionDeclaration(this);
        }
    }

    /**
     * @param types TypeScript class header details, or null
     */
    public record ClassDeclaration(
        Identifier id,
        Expression superClass,
        List<ClassMember> members,
        ClassTypes types
    ) implements Statement {
        public ClassDeclaration {
            Objects.requireNonNull(id, "id must not be null");
            members = members != null ? List.copyOf(members) : List.of();
        }

        public ClassDeclaration(Identifier id, Expression superClass, List<ClassMember> members) {
            this(id, superClass, members, null);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitClassDeclaration(this);
        }
    }

    /**
     * A class method, getter, setter or constructor.
     *
     * @param key method name
     * @param kind {@code method}, {@code get} or {@code set}
     * @param isStatic true for static methods
     * @param value function holding parameters, body and async/generator flags
     * @param modifiers TypeScript modifiers other than {@code static}, e.g. {@code private}
     */
    public record MethodDefinition(
        PropertyKey key,
        String kind,
        boolean isStatic,
        FunctionExpression value,
        List<String> modifiers
    ) implements ClassMember {
        public MethodDefinition {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(value, "value must not be null");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        }

        public MethodDefinition(PropertyKey key, String kind, boolean isStatic, FunctionExpression value) {
            this(key, kind, isStatic, value, List.of());
        }

        public MethodDefinition withValue(FunctionExpression newValue) {
            return new MethodDefinition(key, kind, isStatic, newValue, modifiers);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitMethodDefinition(this);
        }
    }

    /**
     * A class field.
     *
     * @param value initializer, or null
     * @param modifiers TypeScript modifiers other than {@code static}
     * @param optional true for {@code name?: T}
     * @param type type annotation text, or null
     */
    public record ClassField(
        PropertyKey key,
        Expression value,
        boolean isStatic,
        List<String> modifiers,
        boolean optional,
        String type
    ) implements ClassMember {
        public ClassField {
            Objects.requireNonNull(key, "key must not be null");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        }

        public ClassField(PropertyKey key, Expression value, boolean isStatic) {
            this(key, value, isStatic, List.of(), false, null);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitClassField(this);
        }
    }

    /**
     * Name of an object property, class member or destructured property.
     *
     * @param text source text of a non-computed key: identifier name, quoted string,
     *             number or private name
     * @param computed expression of a computed key {@code [expr]}, or null
     */
    public record PropertyKey(String text, Expression computed) implements Node {
        public PropertyKey {
            if (text == null && computed == null) {
                throw new IllegalArgumentException("Either text or computed must be set");
            }
        }

        public static PropertyKey named(String name) {
            return new PropertyKey(name, null);
        }

        public boolean isComputed() {
            return computed != null;
        }

        /**
         * Returns the key as a property name, with quotes of string keys removed.
         * Returns null for computed keys.
         */
        public String name() {
            if (computed != null) {
                return null;
            }
            if (text.length() >= 2 && (text.charAt(0) == '\'' || text.charAt(0) == '"')) {
                return text.substring(1, text.length() - 1);
            }
            return text;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitPropertyKey(this);
        }
    }

    // ---------------------------------------------------------------- statements

    public record BlockStatement(List<Statement> body) implements Statement {
        public BlockStatement {
            body = body != null ? List.copyOf(body) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBlockStatement(this);
        }
    }

    public record ExpressionStatement(Expression expression) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitExpressionStatement(this);
        }
    }

    public record IfStatement(Expression test, Statement consequent, Statement alternate) implements Statement {
        public IfStatement {
            Objects.requireNonNull(test, "test must not be null");
            Objects.requireNonNull(consequent, "consequent must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIfStatement(this);
        }
    }

    /**
     * Classic {@code for} loop.
     *
     * @param init a {@link VariableDeclaration} or an {@link Expression}, or null
     */
    public record ForStatement(Node init, Expression test, Expression update, Statement body) implements Statement {
        public ForStatement {
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitForStatement(this);
        }
    }

    /**
     * {@code for..in} or {@code for..of} loop.
     *
     * @param left a {@link VariableDeclaration} without initializer or an {@link Identifier}
     * @param of true for {@code for..of}
     * @param isAwait true for {@code for await..of}
     */
    public record ForInStatement(Node left, Expression right, Statement body, boolean of, boolean isAwait) implements Statement {
        public ForInStatement {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
            Objects.requireNonNull(body, "body must not be null");
            if (isAwait && !of) {
                throw new IllegalArgumentException("Only for..of loops can await");
            }
        }

        public ForInStatement(Node left, Expression right, Statement body, boolean of) {
            this(left, right, body, of, false);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitForInStatement(this);
        }
    }

    public record WhileStatement(Expression test, Statement body) implements Statement {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitWhileStatement(this);
        }
    }

    public record DoWhileStatement(Statement body, Expression test) implements Statement {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitDoWhileStatement(this);
        }
    }

    public record ReturnStatement(Expression argument) implements Statement {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitReturnStatement(this);
        }
    }

    public record ThrowStatement(Expression argument) implements Statement {
        public ThrowStatement {
            Objects.requireNonNull(argument, "argument must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitThrowStatement(this);
        }
    }

    /**
     * @param block protected block
     * @param handler catch clause, or null
     * @param finalizer finally block, or null
     */
    public record TryStatement(BlockStatement block, CatchClause handler, BlockStatement finalizer) implements Statement {
        public TryStatement {
            Objects.requireNonNull(block, "block must not be null");
            if (handler == null && finalizer == null) {
                throw new IllegalArgumentException("A try statement needs a catch clause or a finally block");
            }
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTryStatement(this);
        }
    }

    /**
     * @param param caught value binding, or null for {@code catch { ... }}
     */
    public record CatchClause(BindingTarget param, BlockStatement body) implements Node {
        public CatchClause {
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitCatchClause(this);
        }
    }

    public record BreakStatement(String label) implements Statement {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBreakStatement(this);
        }
    }

    public record ContinueStatement(String label) implements Statement {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitContinueStatement(this);
        }
    }

    public record SwitchStatement(Expression discriminant, List<SwitchCase> cases) implements Statement {
        public SwitchStatement {
            Objects.requireNonNull(discriminant, "discriminant must not be null");
            cases = cases != null ? List.copyOf(cases) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSwitchStatement(this);
        }
    }

    /**
     * @param test case expression, or null for {@code default}
     */
    public record SwitchCase(Expression test, List<Statement> consequent) implements Node {
        public SwitchCase {
            consequent = consequent != null ? List.copyOf(consequent) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSwitchCase(this);
        }
    }

    public record EmptyStatement() implements Statement {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitEmptyStatement(this);
        }
    }

    public record LabeledStatement(String label, Statement body) implements Statement {
        public LabeledStatement {
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitLabeledStatement(this);
        }
    }

    public record DebuggerStatement() implements Statement {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitDebuggerStatement(this);
        }
    }

    // ---------------------------------------------------------------- TypeScript

    /**
     * Type parameters and return type of a function, both as source text.
     *
     * @param typeParameters text between the angle brackets, or null
     * @param returnType return type annotation without the colon, or null
     */
    public record FunctionTypes(String typeParameters, String returnType) {
    }

    /**
     * TypeScript parts of a class header.
     *
     * @param isAbstract true for {@code abstract class}
     * @param typeParameters text between the angle brackets, or null
     * @param superTypeArguments type arguments of the superclass, or null
     * @param implementsClause implemented types as written, or null
     */
    public record ClassTypes(boolean isAbstract, String typeParameters, String superTypeArguments, String implementsClause) {
    }

    /**
     * A binding with a type annotation, an optional marker or parameter property modifiers,
     * e.g. {@code id: string}, {@code name?} or {@code private readonly client: Client}.
     *
     * @param type annotation text without the colon, or null
     * @param modifiers parameter property modifiers
     */
    public record TypedBinding(BindingTarget target, boolean optional, String type, List<String> modifiers)
        implements BindingTarget {
        public TypedBinding {
            Objects.requireNonNull(target, "target must not be null");
            if (target instanceof TypedBinding) {
                throw new IllegalArgumentException("Type annotations cannot be nested");
            }
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        }

        public TypedBinding(BindingTarget target, String type) {
            this(target, false, type, List.of());
        }

        public TypedBinding withTarget(BindingTarget newTarget) {
            return new TypedBinding(newTarget, optional, type, modifiers);
        }

        @Override
        public BindingTarget untyped() {
            return target;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTypedBinding(this);
        }
    }

    /**
     * An interface, type alias or enum, kept as source text. The text starts at the keyword
     * and has no trailing semicolon.
     *
     * @param kind {@code interface}, {@code type} or {@code enum}
     * @param name declared name
     */
    public record TypeDeclaration(String kind, String name, String text) implements Statement {
        public TypeDeclaration {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTypeDeclaration(this);
        }
    }

    /**
     * {@code expression as Type} or {@code expression satisfies Type}.
     */
    public record TypeAssertion(Expression expression, String operator, String type) implements Expression {
        public TypeAssertion {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTypeAssertion(this);
        }
    }

    /**
     * A non-null assertion {@code expression!}.
     */
    public record NonNullExpression(Expression expression) implements Expression {
        public NonNullExpression {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitNonNullExpression(this);
        }
    }

    // ---------------------------------------------------------------- expressions

    /**
     * A binding or a reference to one.
     */
    public record Identifier(String name) implements Expression, BindingTarget {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    public enum LiteralKind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        REGEX
    }

    /**
     * A primitive or regular expression literal kept as source text.
     *
     * @param kind literal kind
     * @param raw source text, including quotes for strings
     */
    public record Literal(LiteralKind kind, String raw) implements Expression {
        public Literal {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(raw, "raw must not be null");
        }

        /**
         * Creates a single-quoted string literal for the given value.
         */
        public static Literal string(String value) {
            StringBuilder escaped = new StringBuilder("'");
            for (char c : value.toCharArray()) {
                switch (c) {
                    case '\'' -> escaped.append("\\'");
                    case '\\' -> escaped.append("\\\\");
                    case '\n' -> escaped.append("\\n");
                    case '\r' -> escaped.append("\\r");
                    case '\t' -> escaped.append("\\t");
                    default -> escaped.append(c);
                }
            }
            return new Literal(LiteralKind.STRING, escaped.append('\'').toString());
        }

        public static Literal bool(boolean value) {
            return new Literal(LiteralKind.BOOLEAN, String.valueOf(value));
        }

        /**
         * Returns the content of a string literal without quotes, escapes left as written.
         */
        public String stringContent() {
            if (kind != LiteralKind.STRING || raw.length() < 2) {
                return raw;
            }
            return raw.substring(1, raw.length() - 1);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * A template literal. {@code quasis} has one more element than {@code expressions}.
     *
     * @param quasis raw text segments between substitutions
     * @param expressions substitution expressions
     */
    public record TemplateLiteral(List<String> quasis, List<Expression> expressions) implements Expression {
        public TemplateLiteral {
            quasis = quasis != null ? List.copyOf(quasis) : List.of("");
            expressions = expressions != null ? List.copyOf(expressions) : List.of();
            if (quasis.size() != expressions.size() + 1) {
                throw new IllegalArgumentException("Template literal needs exactly one more quasi than expressions");
            }
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTemplateLiteral(this);
        }
    }

    public record TaggedTemplateExpression(Expression tag, TemplateLiteral quasi) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTaggedTemplateExpression(this);
        }
    }

    public record ArrayExpression(List<Expression> elements) implements Expression {
        public ArrayExpression {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitArrayExpression(this);
        }
    }

    public record ObjectExpression(List<ObjectMember> properties) implements Expression {
        public ObjectExpression {
            properties = properties != null ? List.copyOf(properties) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitObjectExpression(this);
        }
    }

    /**
     * A {@code key: value} property. Written in shorthand form when {@code shorthand} is
     * set and the value is still an identifier named like the key.
     */
    public record Property(PropertyKey key, Expression value, boolean shorthand) implements ObjectMember {
        public Property {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        public Property withValue(Expression newValue) {
            return new Property(key, newValue, shorthand);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitProperty(this);
        }
    }

    /**
     * An object literal method or accessor.
     *
     * @param kind {@code method}, {@code get} or {@code set}
     */
    public record MethodProperty(PropertyKey key, String kind, FunctionExpression value) implements ObjectMember {
        public MethodProperty {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        public MethodProperty withValue(FunctionExpression newValue) {
            return new MethodProperty(key, kind, newValue);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitMethodProperty(this);
        }
    }

    /**
     * Spread in array literals, call arguments and object literals.
     */
    public record SpreadElement(Expression argument) implements Expression, ObjectMember {
        public SpreadElement {
            Objects.requireNonNull(argument, "argument must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSpreadElement(this);
        }
    }

    /**
     * A function expression, also used as the value of methods.
     *
     * @param id function name, or null
     * @param types type parameters and return type, or null
     */
    public record FunctionExpression(
        Identifier id,
        List<BindingTarget> params,
        BlockStatement body,
        boolean async,
        boolean generator,
        FunctionTypes types
    ) implements Expression {
        public FunctionExpression {
            params = params != null ? List.copyOf(params) : List.of();
            Objects.requireNonNull(body, "body must not be null");
        }

        public FunctionExpression(Identifier id, List<BindingTarget> params, BlockStatement body,
                                  boolean async, boolean generator) {
            this(id, params, body, async, generator, null);
        }

        public FunctionExpression withBody(BlockStatement newBody) {
            return new FunctionExpression(id, params, newBody, async, generator, types);
        }

        public FunctionExpression withAsync(boolean newAsync) {
            return new FunctionExpression(id, params, body, newAsync, generator, types);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFunctionExpression(this);
        }
    }

    /**
     * An arrow function.
     *
     * @param body a {@link BlockStatement} or an {@link Expression}
     * @param types return type, or null
     */
    public record ArrowFunctionExpression(List<BindingTarget> params, Node body, boolean async, FunctionTypes types)
        implements Expression {
        public ArrowFunctionExpression {
            params = params != null ? List.copyOf(params) : List.of();
            if (!(body instanceof BlockStatement) && !(body instanceof Expression)) {
                throw new IllegalArgumentException("Arrow function body must be a block or an expression");
            }
        }

        public ArrowFunctionExpression(List<BindingTarget> params, Node body, boolean async) {
            this(params, body, async, null);
        }

        public boolean hasExpressionBody() {
            return body instanceof Expression;
        }

        public ArrowFunctionExpression withBody(Node newBody) {
            return new ArrowFunctionExpression(params, newBody, async, types);
        }

        public ArrowFunctionExpression withAsync(boolean newAsync) {
            return new ArrowFunctionExpression(params, body, newAsync, types);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitArrowFunctionExpression(this);
        }
    }

    public record ClassExpression(Identifier id, Expression superClass, List<ClassMember> members, ClassTypes types)
        implements Expression {
        public ClassExpression {
            members = members != null ? List.copyOf(members) : List.of();
        }

        public ClassExpression(Identifier id, Expression superClass, List<ClassMember> members) {
            this(id, superClass, members, null);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitClassExpression(this);
        }
    }

    /**
     * Prefix operators: {@code ! - + ~ typeof void delete}.
     */
    public record UnaryExpression(String operator, Expression argument) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitUnaryExpression(this);
        }
    }

    public record UpdateExpression(String operator, boolean prefix, Expression argument) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitUpdateExpression(this);
        }
    }

    /**
     * Arithmetic, relational, equality, bitwise and logical operators.
     */
    public record BinaryExpression(String operator, Expression left, Expression right) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBinaryExpression(this);
        }
    }

    public record AssignmentExpression(String operator, Expression left, Expression right) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitAssignmentExpression(this);
        }
    }

    public record ConditionalExpression(Expression test, Expression consequent, Expression alternate) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitConditionalExpression(this);
        }
    }

    /**
     * @param optional true for {@code callee?.(args)}
     * @param typeArguments text between the angle brackets of {@code callee<T>(args)}, or null
     */
    public record CallExpression(Expression callee, List<Expression> arguments, boolean optional, String typeArguments)
        implements Expression {
        public CallExpression {
            Objects.requireNonNull(callee, "callee must not be null");
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
        }

        public CallExpression(Expression callee, List<Expression> arguments, boolean optional) {
            this(callee, arguments, optional, null);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitCallExpression(this);
        }
    }

    /**
     * @param typeArguments text between the angle brackets of {@code new Foo<T>()}, or null
     */
    public record NewExpression(Expression callee, List<Expression> arguments, String typeArguments) implements Expression {
        public NewExpression {
            Objects.requireNonNull(callee, "callee must not be null");
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
        }

        public NewExpression(Expression callee, List<Expression> arguments) {
            this(callee, arguments, null);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitNewExpression(this);
        }
    }

    /**
     * Member access. Exactly one of {@code property} and {@code index} is set.
     *
     * @param object accessed object
     * @param property member name for {@code object.property}
     * @param index index expression for {@code object[index]}
     * @param optional true for {@code ?.} access
     */
    public record MemberExpression(Expression object, String property, Expression index, boolean optional) implements Expression {
        public MemberExpression {
            Objects.requireNonNull(object, "object must not be null");
            if ((property == null) == (index == null)) {
                throw new IllegalArgumentException("Exactly one of property and index must be set");
            }
        }

        public static MemberExpression dot(Expression object, String property) {
            return new MemberExpression(object, property, null, false);
        }

        public boolean isComputed() {
            return index != null;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitMemberExpression(this);
        }
    }

    public record SequenceExpression(List<Expression> expressions) implements Expression {
        public SequenceExpression {
            expressions = expressions != null ? List.copyOf(expressions) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSequenceExpression(this);
        }
    }

    public record AwaitExpression(Expression argument) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitAwaitExpression(this);
        }
    }

    /**
     * @param argument yielded value, or null
     * @param delegate true for {@code yield*}
     */
    public record YieldExpression(Expression argument, boolean delegate) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitYieldExpression(this);
        }
    }

    public record ThisExpression() implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitThisExpression(this);
        }
    }

    public record SuperExpression() implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSuperExpression(this);
        }
    }

    /**
     * Parentheses written in the source, kept so that regenerated text matches the input.
     */
    public record ParenthesizedExpression(Expression expression) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitParenthesizedExpression(this);
        }
    }

    /**
     * Dynamic {@code import(source)}.
     */
    public record ImportCall(Expression source) implements Expression {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitImportCall(this);
        }
    }

    /**
     * {@code new.target} or {@code import.meta}.
     */
    public record MetaProperty(String meta, String property) implements Expression {
        public MetaProperty {
            Objects.requireNonNull(meta, "meta must not be null");
            Objects.requireNonNull(property, "property must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitMetaProperty(this);
        }
    }

    /**
     * An argument or array element with the comments written around it.
     */
    public record CommentedExpression(List<Comment> leading, Expression expression, List<Comment> trailing)
        implements Expression {
        public CommentedExpression {
            leading = leading != null ? List.copyOf(leading) : List.of();
            Objects.requireNonNull(expression, "expression must not be null");
            trailing = trailing != null ? List.copyOf(trailing) : List.of();
        }

        public CommentedExpression withExpression(Expression newExpression) {
            return new CommentedExpression(leading, newExpression, trailing);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitCommentedExpression(this);
        }
    }

    // ---------------------------------------------------------------- JSX

    /**
     * A JSX element. Fragments ({@code <>...</>}) have a null name.
     *
     * @param name tag name as written, e.g. {@code div}, {@code Form.Input} or {@code svg:path}
     * @param selfClosing true for {@code <Tag />}; such elements have no children
     */
    public record JsxElement(String name, List<JsxAttributeItem> attributes, List<JsxChild> children, boolean selfClosing)
        implements Expression, JsxChild {
        public JsxElement {
            attributes = attributes != null ? List.copyOf(attributes) : List.of();
            children = children != null ? List.copyOf(children) : List.of();
            if (selfClosing && !children.isEmpty()) {
                throw new IllegalArgumentException("Self-closing elements cannot have children");
            }
            if (name == null && (selfClosing || !attributes.isEmpty())) {
                throw new IllegalArgumentException("Fragments cannot have attributes or close themselves");
            }
        }

        public boolean isFragment() {
            return name == null;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitJsxElement(this);
        }
    }

    /**
     * {@code name}, {@code name="text"} or {@code name={expression}}.
     *
     * @param value null, a string {@link Literal} or an expression
     */
    public record JsxAttribute(String name, Expression value) implements JsxAttributeItem {
        public JsxAttribute {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitJsxAttribute(this);
        }
    }

    public record JsxSpreadAttribute(Expression argument) implements JsxAttributeItem {
        public JsxSpreadAttribute {
            Objects.requireNonNull(argument, "argument must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitJsxSpreadAttribute(this);
        }
    }

    /**
     * Text between JSX tags, whitespace included.
     */
    public record JsxText(String raw) implements JsxChild {
        public JsxText {
            Objects.requireNonNull(raw, "raw must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitJsxText(this);
        }
    }

    /**
     * {@code {expression}} or {@code {...expression}} between JSX tags. A container holding
     * only comments has a null expression.
     */
    public record JsxExpressionContainer(Expression expression, boolean spread, List<Comment> comments) implements JsxChild {
        public JsxExpressionContainer {
            comments = comments != null ? List.copyOf(comments) : List.of();
            if (spread && expression == null) {
                throw new IllegalArgumentException("Spread children need an expression");
            }
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitJsxExpressionContainer(this);
        }
    }

    // ---------------------------------------------------------------- patterns

    public record ObjectPattern(List<PatternMember> properties) implements BindingTarget {
        public ObjectPattern {
            properties = properties != null ? List.copyOf(properties) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitObjectPattern(this);
        }
    }

    /**
     * A destructured property {@code key: value}. Written in shorthand form when
     * {@code shorthand} is set and the value still binds a name equal to the key.
     */
    public record PatternProperty(PropertyKey key, BindingTarget value, boolean shorthand) implements PatternMember {
        public PatternProperty {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitPatternProperty(this);
        }
    }

    public record ArrayPattern(List<BindingTarget> elements) implements BindingTarget {
        public ArrayPattern {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitArrayPattern(this);
        }
    }

    /**
     * A binding with a default value, {@code target = defaultValue}.
     */
    public record AssignmentPattern(BindingTarget left, Expression right) implements BindingTarget {
        public AssignmentPattern {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitAssignmentPattern(this);
        }
    }

    public record RestElement(BindingTarget argument) implements BindingTarget, PatternMember {
        public RestElement {
            Objects.requireNonNull(argument, "argument must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitRestElement(this);
        }
    }
}
