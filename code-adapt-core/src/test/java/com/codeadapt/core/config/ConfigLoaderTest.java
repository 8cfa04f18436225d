package com.codeadapt.core.config;

import com.codeadapt.core.generator.StyleConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("codeadapt.yml");
        Files.writeString(configFile, """
            style:
              indentWidth: 4
              quoteStyle: double
              blankLineBetweenDeclarations: false

            suggestions:
              enabled: true
              timeoutMillis: 2500
              confidenceThreshold: 0.8

            naming:
              extraBuiltins:
                - $store
                - i18n

            format:
              enabled: false
            """);

        AdapterConfig config = ConfigLoader.load(configFile);

        assertThat(config.style()).isEqualTo(new StyleConfig(4, StyleConfig.QuoteStyle.DOUBLE, false));
        assertThat(config.suggestions().enabled()).isTrue();
        assertThat(config.suggestions().timeoutMillis()).isEqualTo(2500L);
        assertThat(config.suggestions().confidenceThreshold()).isEqualTo(0.8);
        assertThat(config.naming().extraBuiltinSet()).containsExactlyInAnyOrder("$store", "i18n");
        assertThat(config.format().enabled()).isFalse();
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codeadapt.yml");
        Files.writeString(configFile, """
            style:
              quoteStyle: single
            suggestions:
              timeoutMillis: -5
            """);

        AdapterConfig config = ConfigLoader.load(configFile);

        assertThat(config.style().indentWidth()).isEqualTo(2);
        assertThat(config.suggestions().enabled()).isFalse();
        assertThat(config.suggestions().timeoutMillis()).isEqualTo(10_000L);
        assertThat(config.naming().extraBuiltins()).isEmpty();
        assertThat(config.format().enabled()).isTrue();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("codeadapt.yml");
        Files.writeString(configFile, """
            style:
              indentWidth: 3
              trailingCommas: true
            """);

        AdapterConfig config = ConfigLoader.load(configFile);

        assertThat(config.style().indentWidth()).isEqualTo(3);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        AdapterConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yml"));

        assertThat(config).isEqualTo(AdapterConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(AdapterConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(AdapterConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codeadapt.yml");
        Files.writeString(configFile, "style: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AdapterConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codeadapt.yml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AdapterConfig.defaults());
    }
}
