package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.util.Identifiers;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts identifier names from one naming convention to another.
 *
 * <p>Covers the same identifiers as {@link RenamePass}, declarations included, so a
 * declaration and its references stay consistent. Builtins and single-word capitalized names
 * (usually components and classes) are skipped. Names already in the target shape or not in
 * the source shape are left alone, which makes the pass idempotent.
 */
final class NamingConventionPass extends AstRewriter implements TransformationPass {

    private final NamingConvention from;
    private final NamingConvention to;
    private final Map<String, String> converted = new HashMap<>();
    private TransformContext context;

    NamingConventionPass(NamingConvention from, NamingConvention to) {
        this.from = from;
        this.to = to;
    }

    @Override
    public Program apply(Program program, TransformContext context) {
        if (from == to) {
            return program;
        }
        if (to == NamingConvention.KEBAB_CASE) {
            context.warn(WarningType.UNSUPPORTED_PATTERN_CONVERSION,
                "kebab-case is not a valid identifier shape; naming conversion to kebab-case skipped");
            return program;
        }
        this.context = context;
        return rewriteProgram(program);
    }

    @Override
    public Node visitIdentifier(Identifier identifier) {
        String name = identifier.name();
        if (context.isBuiltin(name) || Identifiers.isSingleWordPascal(name)) {
            return identifier;
        }
        String newName = converted.computeIfAbsent(name, n -> Identifiers.convert(n, from, to));
        return newName.equals(name) ? identifier : new Identifier(newName);
    }
}
