package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.directive.TransformationDirective.Inject;
import com.codeadapt.core.generator.JavaScriptCodeGenerator;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.InjectionPoint;
import com.codeadapt.core.model.InjectionPosition;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InjectPass}.
 */
class InjectPassTest {

    private static final String SOURCE = """
        function login(user) {
          authenticate(user);
        }
        // INJECT: analytics
        export default login;
        """;

    private final JavaScriptCodeGenerator generator = new JavaScriptCodeGenerator();

    private static TransformContext context(InjectionPoint... points) {
        return new TransformContext(
            new CustomizationMetadata(List.of(), List.of(points), List.of(), List.of(), null), Set.of());
    }

    private String inject(InjectionPoint point, InjectionPosition position) {
        Program program = JavaScriptAstParser.parse(SOURCE);
        Program result = new InjectPass(new Inject(point.id(), "track();", position)).apply(program, context(point));
        return generator.generate(result);
    }

    @Test
    void apply_before_prependsToBody() {
        InjectionPoint point = new InjectionPoint("p", "", InjectionPosition.BEFORE, "function:login:start");

        assertThat(inject(point, InjectionPosition.BEFORE))
            .startsWith("function login(user) {\n  track();\n  authenticate(user);\n}\n");
    }

    @Test
    void apply_replace_replacesBody() {
        InjectionPoint point = new InjectionPoint("p", "", InjectionPosition.REPLACE, "function:login");

        assertThat(inject(point, InjectionPosition.REPLACE))
            .startsWith("function login(user) {\n  track();\n}\n");
    }

    @Test
    void apply_wrap_delimitsOriginalBody() {
        InjectionPoint point = new InjectionPoint("audit", "", InjectionPosition.WRAP, "function:login");

        assertThat(inject(point, InjectionPosition.WRAP)).startsWith("""
            function login(user) {
              track();
              // audit:begin
              authenticate(user);
              // audit:end
            }
            """);
    }

    @Test
    void apply_commentLocation_insertsAfterMarker() {
        InjectionPoint point = new InjectionPoint("analytics", "", InjectionPosition.AFTER, "comment:INJECT");

        assertThat(inject(point, InjectionPosition.AFTER))
            .contains("// INJECT: analytics\ntrack();\nexport default login;\n");
    }

    @Test
    void apply_commentLocationReplace_removesComment() {
        InjectionPoint point = new InjectionPoint("analytics", "", InjectionPosition.REPLACE, "comment:INJECT");

        assertThat(inject(point, InjectionPosition.REPLACE))
            .doesNotContain("INJECT")
            .contains("}\ntrack();\nexport default login;\n");
    }

    @Test
    void apply_arrowAssignedToVariable_convertsExpressionBody() {
        InjectionPoint point = new InjectionPoint("p", "", InjectionPosition.BEFORE, "function:square");
        TransformContext context = context(point);

        Program result = new InjectPass(new Inject("p", "log(x);", InjectionPosition.BEFORE))
            .apply(JavaScriptAstParser.parse("const square = (x) => x * x;"), context);

        assertThat(generator.generate(result))
            .isEqualTo("const square = (x) => {\n  log(x);\n  return x * x;\n};\n");
    }

    @Test
    void apply_unmatchedLocation_returnsOriginalAndWarns() {
        InjectionPoint point = new InjectionPoint("p", "", InjectionPosition.AFTER, "function:logout:end");
        TransformContext context = context(point);
        Program program = JavaScriptAstParser.parse(SOURCE);

        Program result = new InjectPass(new Inject("p", "track();", InjectionPosition.AFTER)).apply(program, context);

        assertThat(result).isSameAs(program);
        assertThat(context.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNRESOLVED_INJECTION_POINT);
    }

    @Test
    void apply_malformedLocation_warnsUnresolved() {
        InjectionPoint point = new InjectionPoint("p", "", InjectionPosition.AFTER, "line:42");
        TransformContext context = context(point);
        Program program = JavaScriptAstParser.parse(SOURCE);

        Program result = new InjectPass(new Inject("p", "track();", null)).apply(program, context);

        assertThat(result).isSameAs(program);
        assertThat(context.warnings()).singleElement()
            .satisfies(w -> assertThat(w.message()).contains("Malformed location 'line:42'"));
    }

    @Test
    void apply_unknownPoint_warnsUnresolved() {
        TransformContext context = context();
        Program program = JavaScriptAstParser.parse(SOURCE);

        Program result = new InjectPass(new Inject("missing", "track();", null)).apply(program, context);

        assertThat(result).isSameAs(program);
        assertThat(context.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNRESOLVED_INJECTION_POINT);
    }
}
