package com.codeadapt.core.adapter;

import com.codeadapt.core.directive.TransformationDirective.Rename;
import com.codeadapt.core.model.AdaptationPlan;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.ExportStyle;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.TargetContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ComponentFiles}.
 */
class ComponentFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void readComponent_sourceFile_derivesIdAndName() throws IOException {
        Path file = tempDir.resolve("login-form.ts");
        Files.writeString(file, "export const login = () => true;");

        Component component = ComponentFiles.readComponent(file);

        assertThat(component.id()).isEqualTo("login-form");
        assertThat(component.name()).isEqualTo("LoginForm");
        assertThat(component.language()).isEqualTo("typescript");
        assertThat(component.source()).isEqualTo("export const login = () => true;");
    }

    @Test
    void readComponent_jsonFile_readsRecord() throws IOException {
        Path file = tempDir.resolve("component.json");
        Files.writeString(file, """
            {
              "id": "auth-client",
              "name": "AuthClient",
              "source": "const config = { retries: 3 };",
              "repository": "acme/auth",
              "license": "MIT",
              "metadata": {
                "variables": [ { "name": "retries", "type": "number", "defaultValue": "3" } ],
                "injectionPoints": [ { "id": "p1", "kind": "after", "location": "function:login:end" } ]
              }
            }
            """);

        Component component = ComponentFiles.readComponent(file);

        assertThat(component.repository()).isEqualTo("acme/auth");
        assertThat(component.language()).isEqualTo("javascript");
        assertThat(component.metadata().findVariable("retries")).isPresent();
        assertThat(component.metadata().findInjectionPoint("p1")).get()
            .satisfies(p -> assertThat(p.location()).isEqualTo("function:login:end"));
    }

    @Test
    void readTarget_json_mapsConventionIds() throws IOException {
        Path file = tempDir.resolve("target.json");
        Files.writeString(file, """
            { "namingConvention": "snake_case", "exportStyle": "default", "typescript": true,
              "packageManager": "yarn", "installedDependencies": ["react"] }
            """);

        TargetContext target = ComponentFiles.readTarget(file);

        assertThat(target.namingConvention()).isEqualTo(NamingConvention.SNAKE_CASE);
        assertThat(target.exportStyle()).isEqualTo(ExportStyle.DEFAULT);
        assertThat(target.typescript()).isTrue();
        assertThat(target.installedDependencies()).containsExactly("react");
    }

    @Test
    void toJsonThenReadPlan_keepsDirectives() throws IOException {
        AdaptationPlan plan = new AdaptationPlan("c1", List.of(new Rename("identifier", "a", "b")), List.of());
        Path file = tempDir.resolve("plan.json");
        Files.writeString(file, ComponentFiles.toJson(plan));

        assertThat(ComponentFiles.readPlan(file)).isEqualTo(plan);
    }

    @Test
    void readCustomizations_json_returnsMap() throws IOException {
        Path file = tempDir.resolve("values.json");
        Files.writeString(file, "{ \"apiUrl\": \"'https://x.dev'\", \"API_KEY\": \"k\" }");

        assertThat(ComponentFiles.readCustomizations(file))
            .containsEntry("apiUrl", "'https://x.dev'")
            .containsEntry("API_KEY", "k");
    }

    @Test
    void readComponent_missingFile_throwsComponentLoadException() {
        assertThatThrownBy(() -> ComponentFiles.readComponent(tempDir.resolve("missing.js")))
            .isInstanceOf(ComponentLoadException.class)
            .hasMessageContaining("missing.js");
    }

    @Test
    void readPlan_malformedJson_throwsComponentLoadException() throws IOException {
        Path file = tempDir.resolve("plan.json");
        Files.writeString(file, "{ \"componentId\": ");

        assertThatThrownBy(() -> ComponentFiles.readPlan(file))
            .isInstanceOf(ComponentLoadException.class)
            .hasMessageStartingWith("Failed to read AdaptationPlan");
    }
}
