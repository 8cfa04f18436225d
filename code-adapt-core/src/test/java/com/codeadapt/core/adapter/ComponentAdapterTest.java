package com.codeadapt.core.adapter;

import com.codeadapt.core.config.AdapterConfig;
import com.codeadapt.core.directive.TransformationDirective.Configure;
import com.codeadapt.core.directive.TransformationDirective.ReplaceImport;
import com.codeadapt.core.generator.CodeFormatter;
import com.codeadapt.core.generator.StyleConfig;
import com.codeadapt.core.model.AdaptationPlan;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.AdaptedResult;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ExportStyle;
import com.codeadapt.core.model.GeneratedFile;
import com.codeadapt.core.model.Instructions;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.TargetContext;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ComponentAdapter}.
 */
class ComponentAdapterTest {

    private static final String SOURCE = """
        import axios from 'axios';
        const config = { apiUrl: "https://api.example.com" };
        export async function fetchUser(userId) {
          return axios.get(config.apiUrl + '/users/' + userId);
        }
        """;

    private static Component component(String repository, String url, String license, String commit) {
        return new Component("user-service", "UserService", SOURCE, null, "api",
            repository, url, license, commit, null);
    }

    private static TargetContext target(NamingConvention naming, boolean typescript, String packageManager,
                                        List<String> installed) {
        return new TargetContext(naming, null, ExportStyle.NAMED, null, null, typescript, "react",
            packageManager, installed, null);
    }

    @Test
    void adapt_snakeCaseTarget_convertsFormatsAndConfigures() {
        ComponentAdapter adapter = new ComponentAdapter();

        AdaptedResult result = adapter.adapt(component(null, null, null, null),
            target(NamingConvention.SNAKE_CASE, false, null, List.of()),
            Map.of("apiUrl", "'https://staging.example.com'"));

        assertThat(result.code())
            .contains("apiUrl: 'https://staging.example.com'")
            .contains("\n\nexport async function fetch_user(user_id) {\n")
            .contains("config.apiUrl + '/users/' + user_id");
        assertThat(result.filename()).isEqualTo("user_service.js");
        assertThat(result.warnings()).isEmpty();
        assertThat(result.files()).singleElement()
            .satisfies(f -> assertThat(f.content()).isEqualTo(result.code()));
        assertThat(JavaScriptAstParser.parse(result.code()).body()).hasSize(3);
    }

    @Test
    void adapt_withoutTarget_keepsCodeEquivalent() {
        AdaptedResult result = new ComponentAdapter().adapt(component(null, null, null, null), null, null);

        assertThat(result.appliedPlan().transformations()).isEmpty();
        assertThat(result.filename()).isEqualTo("user-service.js");
        assertThat(JavaScriptAstParser.parse(result.code()))
            .isEqualTo(JavaScriptAstParser.parse(new CodeFormatter(StyleConfig.defaults()).format(SOURCE)));
    }

    @Test
    void adapt_unknownCustomization_returnsCodeWithSingleWarning() {
        AdaptedResult result = new ComponentAdapter().adapt(component(null, null, null, null),
            TargetContext.empty(), Map.of("doesNotExist", "1"));

        assertThat(result.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNKNOWN_CONFIGURE_VARIABLE);
        assertThat(result.hasWarnings()).isTrue();
        assertThat(result.code()).contains("https://api.example.com");
    }

    @Test
    void applyPlan_existingPlan_isRevalidatedAndApplied() {
        AdaptationPlan plan = new AdaptationPlan("user-service", List.of(
            new ReplaceImport("axios", "ky", null),
            new Configure("missing", "1")),
            List.of(new GeneratedFile("config/api.js", "export const api = {base:'x'};", "API config")));

        AdaptedResult result = new ComponentAdapter().applyPlan(component(null, null, null, null), plan,
            target(null, false, null, List.of()));

        assertThat(result.code()).startsWith("import axios from 'ky';");
        assertThat(result.appliedPlan().transformations()).containsExactly(new ReplaceImport("axios", "ky", null));
        assertThat(result.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNKNOWN_CONFIGURE_VARIABLE);
        assertThat(result.files()).extracting(GeneratedFile::relativePath)
            .containsExactly("user-service.js", "config/api.js");
        assertThat(result.files().get(1).content()).isEqualTo("export const api = {\n  base: 'x'\n};\n");
        assertThat(result.instructions().setup())
            .containsExactly("Configure settings in config/api.js", "Ensure react is properly configured");
    }

    @Test
    void applyPlan_unformattableAddition_keepsContentAndWarns() {
        AdaptationPlan plan = new AdaptationPlan("user-service", List.of(),
            List.of(new GeneratedFile("broken.js", "export const = ;", "Helper")));

        AdaptedResult result = new ComponentAdapter().applyPlan(component(null, null, null, null), plan, null);

        assertThat(result.files().get(1).content()).isEqualTo("export const = ;");
        assertThat(result.warnings()).singleElement().satisfies(w -> {
            assertThat(w.type()).isEqualTo(WarningType.FORMAT_ERROR);
            assertThat(w.message()).startsWith("Could not format broken.js");
        });
    }

    @Test
    void adapt_formattingDisabled_keepsGeneratorOutput() {
        AdapterConfig config = new AdapterConfig(null, null, null, new AdapterConfig.FormatConfig(false));

        AdaptedResult result = new ComponentAdapter(config).adapt(component(null, null, null, null), null, null);

        assertThat(result.code()).contains("const config = {\n  apiUrl: \"https://api.example.com\"\n};");
    }

    @Test
    void adapt_targetStyle_overridesConfiguredStyle() {
        TargetContext target = new TargetContext(null, null, null, null, null, false, null, null, List.of(),
            new StyleConfig(4, StyleConfig.QuoteStyle.DOUBLE, false));

        AdaptedResult result = new ComponentAdapter().adapt(component(null, null, null, null), target, null);

        assertThat(result.code()).startsWith("import axios from \"axios\";\n")
            .contains("\n    return axios.get(");
    }

    @Test
    void adapt_attribution_prependedToMainFileOnly() {
        AdaptedResult result = new ComponentAdapter().adapt(
            component("acme/widgets", "https://github.com/acme/widgets", "MIT", "abc123"), null, null);

        assertThat(result.attribution()).isEqualTo("""
            // Adapted from acme/widgets (https://github.com/acme/widgets)
            // License: MIT
            // Original commit: abc123
            """);
        assertThat(result.code()).doesNotContain("Adapted from");
        assertThat(result.files().get(0).content()).isEqualTo(result.attribution() + "\n" + result.code());
    }

    @Test
    void attribution_noSource_isEmpty() {
        assertThat(ComponentAdapter.attribution(component(null, null, "MIT", null))).isEmpty();
        assertThat(ComponentAdapter.attribution(component(null, "https://x.dev/c", null, null)))
            .isEqualTo("// Adapted from https://x.dev/c\n");
    }

    @Test
    void filename_typescriptPascalTarget_usesConventionAndExtension() {
        assertThat(ComponentAdapter.filename(component(null, null, null, null),
            target(NamingConvention.PASCAL_CASE, true, null, List.of()))).isEqualTo("UserService.ts");
        assertThat(ComponentAdapter.filename(component(null, null, null, null),
            target(NamingConvention.UNDETERMINED, false, null, List.of()))).isEqualTo("user-service.js");
    }

    @Test
    void adapt_nameWithSpaces_buildsFilenameAndUsageIdentifier() {
        Component component = new Component("login-form", "Login Form", "export function LoginForm() {}",
            null, null, null, null, null, null, null);

        AdaptedResult result = new ComponentAdapter().adapt(component,
            target(null, false, null, List.of()), null);

        assertThat(result.filename()).isEqualTo("login-form.js");
        assertThat(result.instructions().usage())
            .isEqualTo("import { LoginForm } from './login-form';\n\n// Use the component\nLoginForm();");
    }

    @Test
    void instructions_missingDependencies_useTargetPackageManager() {
        Component cataloged = component(null, null, null, null).withMetadata(new CustomizationMetadata(
            List.of(), List.of(), List.of(), List.of("axios", "react"), null));
        AdaptationPlan plan = new AdaptationPlan("user-service", List.of(),
            List.of(new GeneratedFile(".env.example", "API_KEY=", "Example env file")));

        Instructions instructions = ComponentAdapter.instructions(cataloged, plan,
            target(null, false, "pnpm", List.of("react")), List.of("Set environment variables: API_KEY"),
            "user-service.js");

        assertThat(instructions.install()).containsExactly("pnpm add axios");
        assertThat(instructions.setup()).containsExactly(
            "Set environment variables as shown in .env.example",
            "Set environment variables: API_KEY");
    }

    @Test
    void instructions_allInstalled_noInstallStep() {
        Component cataloged = component(null, null, null, null).withMetadata(new CustomizationMetadata(
            List.of(), List.of(), List.of(), List.of("axios"), null));

        Instructions instructions = ComponentAdapter.instructions(cataloged,
            new AdaptationPlan("user-service", List.of(), List.of()),
            target(null, false, null, List.of("axios")), List.of(), "user-service.js");

        assertThat(instructions.install()).isEmpty();
    }

    @Test
    void usage_exportStyles_buildMatchingImport() {
        assertThat(ComponentAdapter.usage("UserService", ExportStyle.DEFAULT, "user-service.js"))
            .isEqualTo("import UserService from './user-service';\n\n// Use the component\nUserService();");
        assertThat(ComponentAdapter.usage("UserService", ExportStyle.COMMONJS, "user-service.js"))
            .startsWith("const { UserService } = require('./user-service');");
        assertThat(ComponentAdapter.usage("UserService", null, "user_service.ts"))
            .startsWith("import { UserService } from './user_service';");
    }
}
