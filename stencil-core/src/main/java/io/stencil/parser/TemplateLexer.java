/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.stencil.parser;

import io.stencil.common.Resource;

import static io.stencil.parser.TokenType.*;

/**
 * Hand-rolled lexer for templates. Runs in two modes: in text mode everything
 * up to the next recognized {@code $} opener is a single {@link TokenType#TEXT}
 * token, verbatim. After an opener that takes arguments the lexer switches to
 * argument mode and produces expression tokens until the matching closing
 * parenthesis, which is emitted as {@link TokenType#STATEMENT_CLOSE}.
 */
public class TemplateLexer extends BaseLexer {

    private boolean inArgs;
    private int depth;
    private int statementLine;
    private String statementText;

    public TemplateLexer(Resource resource) {
        super(resource);
    }

    // ========== Main Scanner ==========

    @Override
    protected TokenType scanToken() {
        if (inArgs) {
            if (isAtEnd()) {
                throw error("unterminated argument list for " + statementText + ", missing ')'", statementLine);
            }
            return scanArgument();
        }
        if (isAtEnd()) {
            return EOF;
        }
        if (openerLength(pos) > 0) {
            return scanOpener();
        }
        while (!isAtEnd()) {
            if (peek() == '$' && openerLength(pos) > 0) {
                break;
            }
            advance();
        }
        return TEXT;
    }

    /**
     * Returns the length of the statement keyword (including the '$') if a
     * recognized opener starts at the given index, 1 for the short print
     * form, and 0 otherwise.
     */
    private int openerLength(int index) {
        if (index >= length || source.charAt(index) != '$') {
            return 0;
        }
        if (index + 1 < length && source.charAt(index + 1) == '(') {
            return 1;
        }
        int end = index + 1;
        while (end < length && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        if (end == index + 1 || !isIdentifierStart(source.charAt(index + 1))) {
            return 0;
        }
        return StatementType.of(source.substring(index + 1, end)) == null ? 0 : end - index;
    }

    private TokenType scanOpener() {
        int keywordLength = openerLength(pos);
        statementLine = line;
        if (keywordLength == 1) { // $(
            advance();
            advance();
            statementText = "$(";
            enterArgs();
            return SHORT_PRINT_OPEN;
        }
        for (int i = 0; i < keywordLength; i++) {
            advance();
        }
        statementText = source.substring(tokenStart, pos);
        StatementType statement = StatementType.of(statementText.substring(1));
        if (statement.args) {
            if (!match('(')) {
                throw error("expected '(' after " + statementText, statementLine);
            }
            enterArgs();
        }
        return STATEMENT_OPEN;
    }

    private void enterArgs() {
        inArgs = true;
        depth = 0;
    }

    private TokenType scanArgument() {
        char c = advance();
        if (isWhitespace(c)) {
            while (isWhitespace(peek())) {
                advance();
            }
            return WS;
        }
        switch (c) {
            case '(':
                depth++;
                return L_PAREN;
            case ')':
                if (depth == 0) {
                    inArgs = false;
                    return STATEMENT_CLOSE;
                }
                depth--;
                return R_PAREN;
            case '[':
                return L_BRACKET;
            case ']':
                return R_BRACKET;
            case '.':
                return DOT;
            case ',':
                return COMMA;
            case '@':
                return AT;
            case '\'':
            case '"':
                return scanString(c);
            case '=':
                if (match('=')) {
                    return match('=') ? EQ_EQ_EQ : EQ_EQ;
                }
                return EQ;
            case '!':
                if (match('=')) {
                    return match('=') ? NOT_EQ_EQ : NOT_EQ;
                }
                return NOT;
            case '<':
                return match('=') ? LT_EQ : LT;
            case '>':
                return match('=') ? GT_EQ : GT;
            case '&':
                if (match('&')) {
                    return AMP_AMP;
                }
                break;
            case '|':
                if (match('|')) {
                    return PIPE_PIPE;
                }
                break;
            case '-':
                if (isDigit(peek())) {
                    return scanNumber();
                }
                break;
            default:
                if (isDigit(c)) {
                    return scanNumber();
                }
                if (isIdentifierStart(c)) {
                    return scanIdentifier();
                }
        }
        throw error("unexpected character '" + c + "' in arguments of " + statementText, tokenLine);
    }

    private TokenType scanString(char quote) {
        while (!isAtEnd()) {
            char c = advance();
            if (c == '\\') {
                if (!isAtEnd()) {
                    advance();
                }
            } else if (c == quote) {
                return STRING;
            }
        }
        throw error("unterminated string in arguments of " + statementText, statementLine);
    }

    private TokenType scanNumber() {
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peek(1))) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        char e = peek();
        if (e == 'e' || e == 'E') {
            int offset = (peek(1) == '+' || peek(1) == '-') ? 2 : 1;
            if (isDigit(peek(offset))) {
                for (int i = 0; i < offset; i++) {
                    advance();
                }
                while (isDigit(peek())) {
                    advance();
                }
            }
        }
        return NUMBER;
    }

    private TokenType scanIdentifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        TokenType keyword = TokenType.keyword(source.substring(tokenStart, pos));
        return keyword == null ? IDENT : keyword;
    }

}
