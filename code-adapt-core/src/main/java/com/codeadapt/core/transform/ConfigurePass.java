package com.codeadapt.core.transform;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.directive.TransformationDirective.Configure;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import com.codeadapt.core.parser.JavaScriptParseException;
import com.codeadapt.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces the value of a configuration property.
 *
 * <p>Configuration objects are object literals assigned to a variable whose name contains
 * {@code config}, {@code options} or {@code settings} (any case). Only their top-level
 * properties are matched. The new value is parsed as an expression; text that does not
 * parse is used as a string literal. Other properties and their order are untouched. A type
 * annotation on the variable and an {@code as} or {@code satisfies} assertion around the
 * object are kept.
 */
final class ConfigurePass extends AstRewriter implements TransformationPass {

    private static final Logger log = LoggerFactory.getLogger(ConfigurePass.class);

    private final Configure directive;
    private Expression value;
    private int replaced;

    ConfigurePass(Configure directive) {
        this.directive = directive;
    }

    @Override
    public Program apply(Program program, TransformContext context) {
        this.value = parseValue(directive.value());
        Program result = rewriteProgram(program);
        if (replaced == 0) {
            context.warn(WarningType.UNKNOWN_CONFIGURE_VARIABLE,
                "No configuration property '" + directive.variable() + "' found");
            return program;
        }
        return result;
    }

    static Expression parseValue(String text) {
        try {
            return JavaScriptAstParser.parseExpression(text);
        } catch (JavaScriptParseException e) {
            log.debug("Configure value '{}' is not an expression, using it as a string: {}", text, e.getMessage());
            return Literal.string(text);
        }
    }

    /**
     * Returns the object literal assigned to a configuration variable, or null.
     */
    static ObjectExpression configObject(VariableDeclarator declarator) {
        if (!(declarator.id().untyped() instanceof Identifier id) || !Identifiers.isConfigName(id.name())) {
            return null;
        }
        Expression init = declarator.init();
        if (init instanceof TypeAssertion assertion) {
            init = assertion.expression();
        }
        return init instanceof ObjectExpression object ? object : null;
    }

    @Override
    public Node visitVariableDeclarator(VariableDeclarator variableDeclarator) {
        ObjectExpression object = configObject(variableDeclarator);
        if (object == null) {
            return super.visitVariableDeclarator(variableDeclarator);
        }
        List<ObjectMember> members = new ArrayList<>(object.properties().size());
        for (ObjectMember member : object.properties()) {
            if (member instanceof Property property && directive.variable().equals(property.key().name())) {
                replaced++;
                members.add(new Property(property.key(), value, false));
            } else {
                members.add(member);
            }
        }
        Expression init = new ObjectExpression(members);
        if (variableDeclarator.init() instanceof TypeAssertion assertion) {
            init = new TypeAssertion(init, assertion.operator(), assertion.type());
        }
        return variableDeclarator.withInit(init);
    }
}
