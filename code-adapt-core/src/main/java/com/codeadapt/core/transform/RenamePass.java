package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.directive.TransformationDirective.Rename;
import com.codeadapt.core.model.WarningType;

/**
 * Renames every binding and reference of a name.
 *
 * <p>No scope resolution is done: all identifiers with the name are renamed, including
 * unrelated bindings in other scopes that share it. Member names, non-computed keys, module
 * names and imported or exported names are strings in the tree and are never touched. An
 * import specifier keeps its imported name ({@code import { a as b }}) and an export
 * specifier keeps its exported name.
 *
 * <p>A JSX tag whose name refers to a binding (a capitalized name, or the root of a dotted
 * name such as {@code Form.Field}) is renamed with it. Lowercase tags are intrinsic elements.
 */
final class RenamePass extends AstRewriter implements TransformationPass {

    private final Rename directive;
    private TransformContext context;
    private int renamed;

    RenamePass(Rename directive) {
        this.directive = directive;
    }

    @Override
    public Program apply(Program program, TransformContext context) {
        if (directive.from().equals(directive.to())) {
            return program;
        }
        this.context = context;
        Program result = rewriteProgram(program);
        if (renamed == 0) {
            context.warn(WarningType.NO_MATCH, "No identifier named '" + directive.from() + "' to rename");
        }
        return result;
    }

    @Override
    public Node visitIdentifier(Identifier identifier) {
        if (identifier.name().equals(directive.from()) && !context.isBuiltin(identifier.name())) {
            renamed++;
            return new Identifier(directive.to());
        }
        return identifier;
    }

    @Override
    public Node visitJsxElement(JsxElement jsxElement) {
        JsxElement rewritten = (JsxElement) super.visitJsxElement(jsxElement);
        String name = rewritten.name();
        if (name == null) {
            return rewritten;
        }
        int dot = name.indexOf('.');
        String root = dot < 0 ? name : name.substring(0, dot);
        boolean reference = dot >= 0 || Character.isUpperCase(root.charAt(0));
        if (!reference || !root.equals(directive.from())) {
            return rewritten;
        }
        renamed++;
        return new JsxElement(directive.to() + name.substring(root.length()),
            rewritten.attributes(), rewritten.children(), rewritten.selfClosing());
    }
}
