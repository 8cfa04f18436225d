package com.codeadapt.core.parser;

import com.codeadapt.core.ast.JavaScriptAst.Expression;
import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.ast.JavaScriptAst.Statement;
import com.codeadapt.parser.JavaScriptLexer;
import com.codeadapt.parser.JavaScriptParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Parses JavaScript component source into a {@link Program}.
 *
 * <p>Uses the ANTLR grammar generated into {@code com.codeadapt.parser} and converts the
 * parse tree into the immutable {@link com.codeadapt.core.ast.JavaScriptAst} model. Every
 * call works on a fresh lexer, parser and token stream, so the parser is safe to use from
 * concurrent requests.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Program program = JavaScriptAstParser.parse("const apiUrl = 'https://example.com';");
 * Expression value = JavaScriptAstParser.parseExpression("{ retries: 3 }");
 * }</pre>
 *
 * <p>Syntax errors are never recovered from: the first one is reported as a
 * {@link JavaScriptParseException}.
 *
 * @since 1.0.0
 */
public final class JavaScriptAstParser {

    private static final Logger log = LoggerFactory.getLogger(JavaScriptAstParser.class);

    private JavaScriptAstParser() {
        // Utility class - no instantiation
    }

    /**
     * Parses a complete module.
     *
     * @param source source text
     * @return parsed program
     * @throws JavaScriptParseException if the source has a syntax error
     */
    public static Program parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        ParserSession session = new ParserSession(source);
        JavaScriptParser.ProgramContext tree = session.parser.program();
        session.errors.throwIfFailed();
        Program program = new AstBuilder(session.tokens).program(tree);
        log.debug("Parsed {} top-level statements", program.body().size());
        return program;
    }

    /**
     * Parses a code fragment as an independent statement list.
     *
     * @param code statements to parse
     * @return parsed statements, comments included
     * @throws JavaScriptParseException if the code has a syntax error
     */
    public static List<Statement> parseStatements(String code) {
        return parse(code).body();
    }

    /**
     * Parses a single expression.
     *
     * @param source expression text
     * @return parsed expression
     * @throws JavaScriptParseException if the text is not exactly one expression
     */
    public static Expression parseExpression(String source) {
        Objects.requireNonNull(source, "source must not be null");
        ParserSession session = new ParserSession(source);
        JavaScriptParser.ExpressionOnlyContext tree = session.parser.expressionOnly();
        session.errors.throwIfFailed();
        return new AstBuilder(session.tokens).expression(tree.singleExpression());
    }

    /**
     * Returns true if the text parses as a single expression.
     */
    public static boolean isExpression(String source) {
        try {
            parseExpression(source);
            return true;
        } catch (JavaScriptParseException e) {
            log.trace("Not an expression: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Lexer, token stream and parser for one parse call.
     */
    private static final class ParserSession {
        private final CommonTokenStream tokens;
        private final JavaScriptParser parser;
        private final FirstErrorListener errors = new FirstErrorListener();

        ParserSession(String source) {
            CharStream input = CharStreams.fromString(source);
            JavaScriptLexer lexer = new JavaScriptLexer(input);
            lexer.removeErrorListeners();
            lexer.addErrorListener(errors);
            this.tokens = new CommonTokenStream(lexer);
            this.parser = new JavaScriptParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(errors);
        }
    }

    /**
     * Remembers the first syntax error reported by the lexer or the parser.
     */
    private static final class FirstErrorListener extends BaseErrorListener {
        private String message;
        private int line;
        private int column;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            if (message == null) {
                this.message = msg;
                this.line = line;
                this.column = charPositionInLine;
            }
        }

        void throwIfFailed() {
            if (message != null) {
                throw new JavaScriptParseException(message, line, column);
            }
        }
    }
}
