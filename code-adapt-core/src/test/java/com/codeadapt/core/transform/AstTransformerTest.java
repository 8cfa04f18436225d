package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.directive.TransformationDirective;
import com.codeadapt.core.directive.TransformationDirective.Configure;
import com.codeadapt.core.directive.TransformationDirective.Inject;
import com.codeadapt.core.directive.TransformationDirective.PatternChange;
import com.codeadapt.core.directive.TransformationDirective.Rename;
import com.codeadapt.core.directive.TransformationDirective.ReplaceImport;
import com.codeadapt.core.generator.JavaScriptCodeGenerator;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.ConfigurableVariable;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.InjectionPoint;
import com.codeadapt.core.model.InjectionPosition;
import com.codeadapt.core.model.PatternType;
import com.codeadapt.core.model.VariableType;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AstTransformer}.
 */
class AstTransformerTest {

    private final AstTransformer transformer = new AstTransformer();
    private final JavaScriptCodeGenerator generator = new JavaScriptCodeGenerator();

    private String transform(String source, CustomizationMetadata metadata, TransformationDirective... directives) {
        TransformResult result = transformer.apply(JavaScriptAstParser.parse(source), List.of(directives), metadata);
        return generator.generate(result.program());
    }

    @Test
    void apply_namingCamelToSnake_renamesDeclarationsAndReferences() {
        TransformResult result = transformer.apply(
            JavaScriptAstParser.parse("const myVar = 1; function doThing(){ return myVar; }"),
            List.of(new PatternChange(PatternType.NAMING, "camelCase", "snake_case")),
            CustomizationMetadata.empty());

        String code = generator.generate(result.program());

        assertThat(code).isEqualTo("const my_var = 1;\nfunction do_thing() {\n  return my_var;\n}\n");
        assertThat(result.warnings()).isEmpty();
        assertThat(JavaScriptAstParser.parse(code).body()).hasSize(2);
    }

    @Test
    void apply_replaceImportWithNamedStyle_rewritesDefaultImport() {
        String code = transform("import Foo from 'old-pkg';", CustomizationMetadata.empty(),
            new ReplaceImport("old-pkg", "new-pkg", ImportStyle.NAMED));

        assertThat(code).isEqualTo("import { Foo } from 'new-pkg';\n");
    }

    @Test
    void apply_injectAfterFunctionEnd_appendsToBody() {
        CustomizationMetadata metadata = new CustomizationMetadata(
            List.of(),
            List.of(new InjectionPoint("after-login-success", "After login", InjectionPosition.AFTER, "function:login:end")),
            List.of(), List.of(), null);

        String code = transform("function login(user) { authenticate(user); }", metadata,
            new Inject("after-login-success", "trackEvent(\"login\");", InjectionPosition.AFTER));

        assertThat(code).isEqualTo("function login(user) {\n  authenticate(user);\n  trackEvent(\"login\");\n}\n");
    }

    @Test
    void apply_configureUnknownVariable_leavesCodeAndWarns() {
        String source = "const config = { apiKey: 'abc' };";
        Program program = JavaScriptAstParser.parse(source);

        TransformResult result = transformer.apply(program,
            List.of(new Configure("doesNotExist", "1")), CustomizationMetadata.empty());

        assertThat(result.program()).isEqualTo(program);
        assertThat(result.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNKNOWN_CONFIGURE_VARIABLE);
    }

    @Test
    void apply_namingTwice_isIdempotent() {
        PatternChange toSnake = new PatternChange(PatternType.NAMING, "camelCase", "snake_case");
        Program program = JavaScriptAstParser.parse("let pageSize = 10; const itemCount = pageSize * 2;");

        Program once = transformer.apply(program, List.of(toSnake), CustomizationMetadata.empty()).program();
        Program twice = transformer.apply(once, List.of(toSnake), CustomizationMetadata.empty()).program();

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void apply_configureSameDirectiveTwice_givesSameOutput() {
        String source = "const config = { apiKey: 'abc', timeout: 5000, retries: 3 };";
        CustomizationMetadata metadata = new CustomizationMetadata(
            List.of(new ConfigurableVariable("apiKey", VariableType.STRING, "API key", "abc")),
            List.of(), List.of(), List.of(), null);
        Configure configure = new Configure("apiKey", "'xyz'");

        String first = transform(source, metadata, configure);
        String second = transform(source, metadata, configure);

        assertThat(first)
            .isEqualTo(second)
            .isEqualTo("const config = {\n  apiKey: 'xyz',\n  timeout: 5000,\n  retries: 3\n};\n");
    }

    @Test
    void apply_directivesInOrder_foldsEachOverPreviousResult() {
        String code = transform("function fetchData() { return load(); }", CustomizationMetadata.empty(),
            new Rename("function", "fetchData", "loadData"),
            new PatternChange(PatternType.NAMING, "camelCase", "snake_case"));

        assertThat(code).isEqualTo("function load_data() {\n  return load();\n}\n");
    }

    @Test
    void apply_noOpPatternChange_leavesProgramUnchanged() {
        Program program = JavaScriptAstParser.parse("const myVar = 1;");

        TransformResult result = transformer.apply(program,
            List.of(new PatternChange(PatternType.NAMING, "camelCase", "camelCase")), CustomizationMetadata.empty());

        assertThat(result.program()).isEqualTo(program);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void apply_unsupportedErrorHandlingPair_warnsUnsupported() {
        Program program = JavaScriptAstParser.parse("doWork(function (err, data) {});");

        TransformResult result = transformer.apply(program,
            List.of(new PatternChange(PatternType.ERROR_HANDLING, "callbacks", "promises")), CustomizationMetadata.empty());

        assertThat(result.program()).isEqualTo(program);
        assertThat(result.warnings()).singleElement()
            .satisfies(w -> {
                assertThat(w.type()).isEqualTo(WarningType.UNSUPPORTED_PATTERN_CONVERSION);
                assertThat(w.message()).contains("callbacks -> promises");
            });
    }

    @Test
    void apply_renameExtraBuiltin_isSkipped() {
        AstTransformer withBuiltins = new AstTransformer(Set.of("$store"));
        Program program = JavaScriptAstParser.parse("$store.commit('x');");

        TransformResult result = withBuiltins.apply(program,
            List.of(new Rename("identifier", "$store", "store")), CustomizationMetadata.empty());

        assertThat(result.program()).isEqualTo(program);
        assertThat(result.warnings()).extracting(AdaptationWarning::type).containsExactly(WarningType.NO_MATCH);
    }

    @Test
    void apply_typeScriptAuthModule_keepsTypesThroughAdaptation() {
        String source = """
            import jwt from 'jsonwebtoken';
            import type { Request, Response, NextFunction } from 'express';

            const config = {
              accessTokenSecret: process.env.JWT_ACCESS_SECRET || 'your-access-secret',
              accessTokenExpiry: '15m'
            };

            interface TokenPayload {
              userId: string;
              role?: string;
            }

            export const generateTokens = (user: { id: string; role?: string }) => {
              const payload: TokenPayload = { userId: user.id, role: user.role };
              return jwt.sign(payload, config.accessTokenSecret, { expiresIn: config.accessTokenExpiry });
            };

            export const authorize = (...roles: string[]) => {
              return (req: Request, res: Response, next: NextFunction) => {
                const decoded = jwt.verify(req.headers.authorization, config.accessTokenSecret) as TokenPayload;
                if (roles.length && !roles.includes(decoded.role || '')) {
                  return res.status(403).json({ error: 'Insufficient permissions' });
                }
                next();
              };
            };

            export async function findUser(id: string): Promise<User | null> {
              return null;
            }
            """;

        TransformResult result = transformer.apply(JavaScriptAstParser.parse(source), List.of(
            new Rename("function", "generateTokens", "issueTokens"),
            new ReplaceImport("jsonwebtoken", "jose", null),
            new Configure("accessTokenExpiry", "'1h'")), CustomizationMetadata.empty());
        String code = generator.generate(result.program());

        assertThat(result.warnings()).isEmpty();
        assertThat(code)
            .contains("import jwt from 'jose';")
            .contains("import type { Request, Response, NextFunction } from 'express';")
            .contains("accessTokenExpiry: '1h'")
            .contains("interface TokenPayload {\n  userId: string;\n  role?: string;\n}\n")
            .contains("export const issueTokens = (user: { id: string; role?: string }) => {")
            .contains("const payload: TokenPayload = {")
            .contains("export const authorize = (...roles: string[]) => {")
            .contains("return (req: Request, res: Response, next: NextFunction) => {")
            .contains(") as TokenPayload;")
            .contains("export async function findUser(id: string): Promise<User | null> {");
        assertThat(JavaScriptAstParser.parse(code)).isEqualTo(result.program());
    }

    @Test
    void apply_renameComponent_renamesJsxTags() {
        String code = transform("""
            import LoginForm from './LoginForm';
            const page = <LoginForm onSubmit={save}><LoginForm.Field /></LoginForm>;
            """, CustomizationMetadata.empty(), new Rename("component", "LoginForm", "SignInForm"));

        assertThat(code).isEqualTo("""
            import SignInForm from './LoginForm';
            const page = <SignInForm onSubmit={save}><SignInForm.Field /></SignInForm>;
            """);
    }

    @Test
    void apply_renameLowercaseName_leavesIntrinsicTags() {
        String code = transform("const div = 1;\nconst el = <div>{div}</div>;", CustomizationMetadata.empty(),
            new Rename("variable", "div", "box"));

        assertThat(code).isEqualTo("const box = 1;\nconst el = <div>{box}</div>;\n");
    }

    @Test
    void apply_emptyDirectiveList_returnsSameProgram() {
        Program program = JavaScriptAstParser.parse("run();");

        TransformResult result = transformer.apply(program, List.of(), null);

        assertThat(result.program()).isSameAs(program);
        assertThat(result.warnings()).isEmpty();
    }
}
