package com.codeadapt.parser;

import org.antlr.v4.runtime.*;

/**
 * Base class for the JavaScript parser with the lookahead helpers used by its predicates.
 *
 * <p>Whitespace is skipped by the lexer, so line terminators are detected by comparing
 * token line numbers.
 */
public abstract class JavaScriptParserBase extends Parser {

    protected JavaScriptParserBase(TokenStream input) {
        super(input);
    }

    /**
     * Returns true when the next token starts on a later line than the previous token ends.
     */
    protected boolean lineTerminatorAhead() {
        Token previous = _input.LT(-1);
        Token next = _input.LT(1);
        if (previous == null || next == null) {
            return true;
        }
        return next.getLine() > endLine(previous);
    }

    protected boolean noLineTerminatorAhead() {
        return !lineTerminatorAhead();
    }

    protected boolean closeBrace() {
        return _input.LT(1).getType() == JavaScriptParser.CloseBrace;
    }

    /**
     * Expression statements cannot start with a brace, a function or a class keyword.
     */
    protected boolean notOpenBraceAndNotFunction() {
        int nextTokenType = _input.LT(1).getType();
        if (nextTokenType == JavaScriptParser.Async) {
            return _input.LT(2).getType() != JavaScriptParser.Function_;
        }
        return nextTokenType != JavaScriptParser.OpenBrace
            && nextTokenType != JavaScriptParser.Function_
            && nextTokenType != JavaScriptParser.Class;
    }

    private static int endLine(Token token) {
        String text = token.getText();
        int line = token.getLine();
        if (text == null) {
            return line;
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
