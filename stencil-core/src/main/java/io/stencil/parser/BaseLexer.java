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

import io.stencil.ParseException;
import io.stencil.common.Resource;

import java.util.ArrayList;
import java.util.List;

import static io.stencil.parser.TokenType.*;

/**
 * Abstract base class for lexers. Provides common utilities for character
 * handling, position tracking, and tokenization.
 */
public abstract class BaseLexer {

    protected final Resource resource;
    protected final String source;
    protected final int length;

    protected int pos;
    protected int line;
    protected int col;
    protected int tokenStart;
    protected int tokenLine;
    protected int tokenCol;

    protected BaseLexer(Resource resource) {
        this.resource = resource;
        this.source = resource.getText();
        this.length = source.length();
        this.pos = 0;
        this.line = 0;
        this.col = 0;
    }

    // ========== Public API ==========

    public Token nextToken() {
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
        TokenType type = scanToken();
        return new Token(resource, type, tokenStart, tokenLine, tokenCol, source.substring(tokenStart, pos));
    }

    protected abstract TokenType scanToken();

    // ========== Tokenization Utilities ==========

    /**
     * Tokenizes the whole source, dropping tokens that are not primary
     * (white space within argument lists). The last token is always EOF.
     */
    public static List<Token> tokenize(BaseLexer lexer) {
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            if (token.type.primary) {
                list.add(token);
            }
        } while (token.type != EOF);
        return list;
    }

    protected ParseException error(String message, int zeroBasedLine) {
        String component = resource.isAnonymous() ? null : resource.getRelativePath();
        return new ParseException(message, component, zeroBasedLine + 1);
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : source.charAt(pos);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : source.charAt(index);
    }

    protected char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
        return c;
    }

    protected boolean match(char expected) {
        if (pos >= length || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    // ========== Character Classification ==========

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    // '$' is not an identifier character, it always opens a statement
    protected static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    protected static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

}
