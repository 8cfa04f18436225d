package com.codeadapt.core.generator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Output style used by the code generator and the formatter.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * style:
 *   indentWidth: 4
 *   quoteStyle: double
 *   blankLineBetweenDeclarations: true
 * }</pre>
 *
 * @param indentWidth number of spaces per indentation level (defaults to 2)
 * @param quoteStyle quote character for string literals and module names
 * @param blankLineBetweenDeclarations whether top-level function and class declarations
 *                                     are separated by an empty line
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StyleConfig(
    @JsonProperty("indentWidth") int indentWidth,
    @JsonProperty("quoteStyle") QuoteStyle quoteStyle,
    @JsonProperty("blankLineBetweenDeclarations") boolean blankLineBetweenDeclarations
) {
    public StyleConfig {
        if (indentWidth <= 0) {
            indentWidth = 2;
        }
        if (quoteStyle == null) {
            quoteStyle = QuoteStyle.SINGLE;
        }
    }

    /**
     * Default formatting style: two spaces, single quotes, blank lines between declarations.
     */
    public static StyleConfig defaults() {
        return new StyleConfig(2, QuoteStyle.SINGLE, true);
    }

    /**
     * Style that keeps string literals exactly as written.
     */
    public static StyleConfig preserving() {
        return new StyleConfig(2, QuoteStyle.PRESERVE, false);
    }

    /**
     * Quote character preference.
     */
    public enum QuoteStyle {
        SINGLE('\''),
        DOUBLE('"'),
        /** Keep literals as written; generated module names use single quotes. */
        PRESERVE('\'');

        private final char quote;

        QuoteStyle(char quote) {
            this.quote = quote;
        }

        public char quote() {
            return quote;
        }

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static QuoteStyle fromId(String id) {
            if (id == null) {
                return null;
            }
            for (QuoteStyle style : values()) {
                if (style.id().equalsIgnoreCase(id.trim())) {
                    return style;
                }
            }
            return null;
        }
    }
}
