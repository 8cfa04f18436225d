package com.codeadapt.parser;

import org.antlr.v4.runtime.*;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Base class for the JavaScript lexer.
 *
 * <p>Tracks the last token on the default channel so that a {@code /} can be classified
 * as the start of a regular expression literal or as a division operator, and a {@code <}
 * as the start of a JSX element or as a comparison.
 *
 * <p>Template substitutions and JSX expression containers push the default mode. Each of
 * them keeps its own brace depth, so that the {@code }} closing the substitution can be told
 * apart from the ones closing object literals and blocks inside it.
 */
public abstract class JavaScriptLexerBase extends Lexer {

    private final Deque<Integer> braceDepths = new ArrayDeque<>();
    private Token lastToken;
    private boolean closingTag;

    protected JavaScriptLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public Token nextToken() {
        Token next = super.nextToken();
        if (next.getChannel() == Token.DEFAULT_CHANNEL) {
            lastToken = next;
        }
        return next;
    }

    /**
     * A regular expression may start wherever an operand is expected, that is anywhere
     * except directly after a value-producing token.
     */
    protected boolean isRegexPossible() {
        if (lastToken == null) {
            return true;
        }
        switch (lastToken.getType()) {
            case JavaScriptLexer.Identifier:
            case JavaScriptLexer.PrivateIdentifier:
            case JavaScriptLexer.NullLiteral:
            case JavaScriptLexer.BooleanLiteral:
            case JavaScriptLexer.This:
            case JavaScriptLexer.Super:
            case JavaScriptLexer.CloseBracket:
            case JavaScriptLexer.CloseParen:
            case JavaScriptLexer.DecimalLiteral:
            case JavaScriptLexer.HexIntegerLiteral:
            case JavaScriptLexer.OctalIntegerLiteral:
            case JavaScriptLexer.BinaryIntegerLiteral:
            case JavaScriptLexer.StringLiteral:
            case JavaScriptLexer.BackTick:
            case JavaScriptLexer.RegularExpressionLiteral:
            case JavaScriptLexer.PlusPlus:
            case JavaScriptLexer.MinusMinus:
            case JavaScriptLexer.JsxTagEnd:
            case JavaScriptLexer.JsxSelfClose:
            case JavaScriptLexer.Type_:
            case JavaScriptLexer.Interface:
            case JavaScriptLexer.Readonly:
            case JavaScriptLexer.Abstract:
            case JavaScriptLexer.Public:
            case JavaScriptLexer.Private:
            case JavaScriptLexer.Protected:
            case JavaScriptLexer.Declare:
            case JavaScriptLexer.Override:
                return false;
            default:
                return true;
        }
    }

    /**
     * A {@code <} opens a JSX element where an operand is expected and the next character
     * starts a tag name or closes a fragment opener.
     */
    protected boolean isJsxTagStart() {
        int next = _input.LA(1);
        boolean tagStart = Character.isLetter(next) || next == '_' || next == '$' || next == '>';
        return tagStart && isRegexPossible();
    }

    protected void openBrace() {
        if (!braceDepths.isEmpty()) {
            braceDepths.push(braceDepths.pop() + 1);
        }
    }

    protected void closeBrace() {
        if (!braceDepths.isEmpty()) {
            braceDepths.push(braceDepths.pop() - 1);
        }
    }

    protected boolean isSubstitutionClose() {
        return !braceDepths.isEmpty() && braceDepths.peek() == 0;
    }

    protected void openSubstitution() {
        braceDepths.push(0);
    }

    protected void closeSubstitution() {
        braceDepths.pop();
    }

    protected void closingJsxTag() {
        closingTag = true;
    }

    /**
     * Ends a tag at {@code >}. An opening tag continues with its children; a closing tag
     * also leaves the children of the element it closes.
     */
    protected void endJsxTag() {
        if (closingTag) {
            popMode();
            popMode();
        } else {
            mode(JavaScriptLexer.JSX_CHILDREN);
        }
        closingTag = false;
    }

    /**
     * {@code </>} closes a fragment, so {@code />} right after the {@code <} is a slash and a
     * tag end.
     */
    protected boolean isSelfClosePossible() {
        return lastToken == null || lastToken.getType() != JavaScriptLexer.JsxTagStart;
    }

    protected void selfCloseJsxTag() {
        closingTag = false;
    }

    @Override
    public void reset() {
        lastToken = null;
        closingTag = false;
        braceDepths.clear();
        super.reset();
    }
}
