package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.directive.TransformationDirective.ReplaceImport;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.WarningType;

import java.util.List;

/**
 * Points imports, re-exports, dynamic imports and {@code require} calls of one module at
 * another.
 *
 * <p>With import style {@code named}, a default-only import {@code import Foo from 'x'}
 * becomes {@code import { Foo } from 'y'}. Other styles leave the import clause as it is.
 */
final class ReplaceImportPass extends AstRewriter implements TransformationPass {

    private final ReplaceImport directive;
    private int replaced;

    ReplaceImportPass(ReplaceImport directive) {
        this.directive = directive;
    }

    @Override
    public Program apply(Program program, TransformContext context) {
        if (directive.from().equals(directive.to()) && directive.importStyle() == null) {
            return program;
        }
        Program result = rewriteProgram(program);
        if (replaced == 0) {
            context.warn(WarningType.NO_MATCH, "No import of '" + directive.from() + "' to replace");
        }
        return result;
    }

    @Override
    public Node visitImportDeclaration(ImportDeclaration importDeclaration) {
        if (!importDeclaration.source().equals(directive.from())) {
            return importDeclaration;
        }
        replaced++;
        if (directive.importStyle() == ImportStyle.NAMED && importDeclaration.isDefaultOnly()) {
            return ImportStylePass.toNamed(importDeclaration, directive.to());
        }
        return new ImportDeclaration(
            importDeclaration.defaultBinding(),
            importDeclaration.namespaceBinding(),
            importDeclaration.specifiers(),
            directive.to(),
            importDeclaration.typeOnly());
    }

    @Override
    public Node visitExportListDeclaration(ExportListDeclaration exportListDeclaration) {
        if (directive.from().equals(exportListDeclaration.source())) {
            replaced++;
            return new ExportListDeclaration(exportListDeclaration.specifiers(), directive.to());
        }
        return super.visitExportListDeclaration(exportListDeclaration);
    }

    @Override
    public Node visitExportAllDeclaration(ExportAllDeclaration exportAllDeclaration) {
        if (directive.from().equals(exportAllDeclaration.source())) {
            replaced++;
            return new ExportAllDeclaration(exportAllDeclaration.exported(), directive.to());
        }
        return exportAllDeclaration;
    }

    @Override
    public Node visitImportCall(ImportCall importCall) {
        if (isModuleName(importCall.source())) {
            replaced++;
            return new ImportCall(Literal.string(directive.to()));
        }
        return super.visitImportCall(importCall);
    }

    @Override
    public Node visitCallExpression(CallExpression callExpression) {
        if (callExpression.callee() instanceof Identifier callee
            && "require".equals(callee.name())
            && callExpression.arguments().size() == 1
            && isModuleName(callExpression.arguments().get(0))) {
            replaced++;
            return new CallExpression(callee, List.of(Literal.string(directive.to())), callExpression.optional(),
                callExpression.typeArguments());
        }
        return super.visitCallExpression(callExpression);
    }

    private boolean isModuleName(Expression expression) {
        return expression instanceof Literal literal
            && literal.kind() == LiteralKind.STRING
            && literal.stringContent().equals(directive.from());
    }
}
