package com.codeadapt.core.config;

import com.codeadapt.core.generator.StyleConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Root configuration of the adapter.
 *
 * <p>Loaded from {@code codeadapt.yml}. Missing sections fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * style:
 *   indentWidth: 4
 *   quoteStyle: double
 *   blankLineBetweenDeclarations: true
 *
 * suggestions:
 *   enabled: true
 *   timeoutMillis: 5000
 *   confidenceThreshold: 0.8
 *
 * naming:
 *   extraBuiltins:
 *     - $
 *     - jQuery
 *
 * format:
 *   enabled: true
 * }</pre>
 *
 * @param style default output style, used when the target context has none
 * @param suggestions suggestion settings
 * @param naming naming settings
 * @param format formatter settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdapterConfig(
    @JsonProperty("style") StyleConfig style,
    @JsonProperty("suggestions") SuggestionConfig suggestions,
    @JsonProperty("naming") NamingConfig naming,
    @JsonProperty("format") FormatConfig format
) {
    public AdapterConfig {
        if (style == null) {
            style = StyleConfig.defaults();
        }
        if (suggestions == null) {
            suggestions = SuggestionConfig.defaults();
        }
        if (naming == null) {
            naming = new NamingConfig(List.of());
        }
        if (format == null) {
            format = new FormatConfig(true);
        }
    }

    public static AdapterConfig defaults() {
        return new AdapterConfig(null, null, null, null);
    }

    /**
     * Suggestion settings.
     *
     * @param enabled whether a configured suggester is consulted
     * @param timeoutMillis how long to wait for suggestions
     * @param confidenceThreshold minimum confidence of accepted suggestions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SuggestionConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("timeoutMillis") Long timeoutMillis,
        @JsonProperty("confidenceThreshold") Double confidenceThreshold
    ) {
        public SuggestionConfig {
            if (enabled == null) {
                enabled = false;
            }
            if (timeoutMillis == null || timeoutMillis <= 0) {
                timeoutMillis = 10_000L;
            }
            if (confidenceThreshold == null) {
                confidenceThreshold = 0.7;
            }
        }

        public static SuggestionConfig defaults() {
            return new SuggestionConfig(null, null, null);
        }
    }

    /**
     * Naming settings.
     *
     * @param extraBuiltins names never renamed, in addition to the standard globals
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamingConfig(
        @JsonProperty("extraBuiltins") List<String> extraBuiltins
    ) {
        public NamingConfig {
            extraBuiltins = extraBuiltins != null ? List.copyOf(extraBuiltins) : List.of();
        }

        public Set<String> extraBuiltinSet() {
            return Set.copyOf(extraBuiltins);
        }
    }

    /**
     * Formatter settings.
     *
     * @param enabled whether generated code is run through the formatter
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FormatConfig(
        @JsonProperty("enabled") Boolean enabled
    ) {
        public FormatConfig {
            if (enabled == null) {
                enabled = true;
            }
        }
    }
}
