package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.WarningType;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts import declarations between default and named style.
 *
 * <ul>
 *   <li>default to named: {@code import Foo from 'x'} becomes {@code import { Foo } from 'x'}</li>
 *   <li>named to default: {@code import { Foo } from 'x'} becomes {@code import Foo from 'x'};
 *       only single-specifier imports that do not rename are converted</li>
 * </ul>
 *
 * <p>Both rewrites assume the module exports the binding under both forms.
 */
final class ImportStylePass implements TransformationPass {

    private final ImportStyle from;
    private final ImportStyle to;

    ImportStylePass(ImportStyle from, ImportStyle to) {
        this.from = from;
        this.to = to;
    }

    @Override
    public Program apply(Program program, TransformContext context) {
        if (from == to) {
            return program;
        }
        boolean defaultToNamed = from == ImportStyle.DEFAULT && to == ImportStyle.NAMED;
        boolean namedToDefault = from == ImportStyle.NAMED && to == ImportStyle.DEFAULT;
        if (!defaultToNamed && !namedToDefault) {
            context.warn(WarningType.UNSUPPORTED_PATTERN_CONVERSION,
                "Import style conversion " + from.id() + " -> " + to.id() + " is not supported");
            return program;
        }
        int converted = 0;
        List<Statement> body = new ArrayList<>(program.body().size());
        for (Statement statement : program.body()) {
            if (statement instanceof ImportDeclaration importDeclaration) {
                if (defaultToNamed && importDeclaration.isDefaultOnly()) {
                    statement = toNamed(importDeclaration, importDeclaration.source());
                    converted++;
                } else if (namedToDefault && isSimpleNamed(importDeclaration)) {
                    statement = toDefault(importDeclaration);
                    converted++;
                }
            }
            body.add(statement);
        }
        if (converted == 0) {
            context.warn(WarningType.NO_MATCH, "No " + from.id() + " imports to convert to " + to.id());
            return program;
        }
        return new Program(body);
    }

    static ImportDeclaration toNamed(ImportDeclaration importDeclaration, String source) {
        Identifier local = importDeclaration.defaultBinding();
        return new ImportDeclaration(null, null, List.of(new ImportSpecifier(local.name(), local)), source,
            importDeclaration.typeOnly());
    }

    private static boolean isSimpleNamed(ImportDeclaration importDeclaration) {
        return importDeclaration.isNamedOnly()
            && importDeclaration.specifiers().size() == 1
            && importDeclaration.specifiers().get(0).imported().equals(importDeclaration.specifiers().get(0).local().name());
    }

    private static ImportDeclaration toDefault(ImportDeclaration importDeclaration) {
        Identifier local = importDeclaration.specifiers().get(0).local();
        return new ImportDeclaration(local, null, List.of(), importDeclaration.source(), importDeclaration.typeOnly());
    }
}
