package com.codeadapt.core.generator;

import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.parser.JavaScriptAstParser;
import com.codeadapt.core.parser.JavaScriptParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Normalizes generated source text to a {@link StyleConfig}.
 *
 * <p>The text is parsed again and printed with the configured indentation, quote style and
 * declaration spacing. String literals whose content contains a quote character keep their
 * original quotes.
 */
public class CodeFormatter {

    private static final Logger log = LoggerFactory.getLogger(CodeFormatter.class);

    private final StyleConfig style;
    private final JavaScriptCodeGenerator generator;

    public CodeFormatter(StyleConfig style) {
        this.style = Objects.requireNonNull(style, "style must not be null");
        this.generator = new JavaScriptCodeGenerator(style);
    }

    public StyleConfig style() {
        return style;
    }

    /**
     * Formats source text.
     *
     * @param source JavaScript source
     * @return formatted source
     * @throws FormatException if the text cannot be parsed or printed
     */
    public String format(String source) {
        Objects.requireNonNull(source, "source must not be null");
        try {
            Program program = JavaScriptAstParser.parse(source);
            String formatted = generator.generate(program);
            log.debug("Formatted {} characters with indent {} and {} quotes",
                source.length(), style.indentWidth(), style.quoteStyle().id());
            return formatted;
        } catch (JavaScriptParseException | IllegalArgumentException e) {
            throw new FormatException("Failed to format code: " + e.getMessage(), e);
        }
    }
}
