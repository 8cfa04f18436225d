package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.Literal;
import com.codeadapt.core.ast.JavaScriptAst.LiteralKind;
import com.codeadapt.core.ast.JavaScriptAst.ObjectExpression;
import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.directive.TransformationDirective.Configure;
import com.codeadapt.core.generator.JavaScriptCodeGenerator;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.parser.JavaScriptAstParser;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigurePass}.
 */
class ConfigurePassTest {

    private final JavaScriptCodeGenerator generator = new JavaScriptCodeGenerator();
    private final TransformContext context = new TransformContext(CustomizationMetadata.empty(), Set.of());

    private String configure(String source, String variable, String value) {
        Program result = new ConfigurePass(new Configure(variable, value)).apply(JavaScriptAstParser.parse(source), context);
        return generator.generate(result);
    }

    @Test
    void apply_objectValue_replacesWithParsedExpression() {
        String code = configure("const options = { retry: null };", "retry", "{ attempts: 3 }");

        assertThat(code).isEqualTo("const options = {\n  retry: {\n    attempts: 3\n  }\n};\n");
    }

    @Test
    void apply_nonConfigVariable_isLeftAlone() {
        String code = configure("const state = { mode: 'a' };\nconst appSettings = { mode: 'a' };", "mode", "'b'");

        assertThat(code).isEqualTo("const state = {\n  mode: 'a'\n};\nconst appSettings = {\n  mode: 'b'\n};\n");
    }

    @Test
    void apply_typedConfigWithAssertion_keepsTypeAndComments() {
        String code = configure("""
            const config: AppConfig = {
              // endpoint
              baseUrl: 'a',
              retries: 3
            } as const;
            """, "retries", "5");

        assertThat(code).isEqualTo("""
            const config: AppConfig = {
              // endpoint
              baseUrl: 'a',
              retries: 5
            } as const;
            """);
    }

    @Test
    void apply_nestedProperty_isNotMatched() {
        Program program = JavaScriptAstParser.parse("const config = { http: { timeout: 10 } };");

        Program result = new ConfigurePass(new Configure("timeout", "20")).apply(program, context);

        assertThat(result).isSameAs(program);
        assertThat(context.warnings()).hasSize(1);
    }

    @Test
    void parseValue_nonExpressionText_becomesStringLiteral() {
        assertThat(ConfigurePass.parseValue("hello world"))
            .isEqualTo(new Literal(LiteralKind.STRING, "'hello world'"));
        assertThat(ConfigurePass.parseValue("[1, 2]")).isNotInstanceOf(Literal.class);
        assertThat(ConfigurePass.parseValue("{}")).isInstanceOf(ObjectExpression.class);
    }
}
