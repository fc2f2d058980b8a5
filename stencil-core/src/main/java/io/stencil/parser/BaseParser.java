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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static io.stencil.parser.TokenType.*;

public abstract class BaseParser {

    static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    private static final int MAX_DEPTH = 256;

    protected final Resource resource;
    protected final List<Token> tokens;
    private final int size;

    private int position = 0;
    private int depth = 0;

    protected BaseParser(Resource resource, List<Token> tokens) {
        this.resource = resource;
        this.tokens = tokens;
        size = tokens.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, position - 7);
        int end = Math.min(position + 7, size);
        for (int i = start; i < end; i++) {
            if (i == 0) {
                sb.append("| ");
            }
            if (i == position) {
                sb.append(">>");
            }
            sb.append(tokens.get(i));
            sb.append(' ');
        }
        if (position == size) {
            sb.append(">>");
        }
        sb.append("|");
        return sb.toString();
    }

    protected String componentName() {
        return resource.isAnonymous() ? null : resource.getRelativePath();
    }

    protected ParseException error(String message) {
        return error(message, peekToken());
    }

    protected ParseException error(String message, Token token) {
        if (logger.isTraceEnabled()) {
            logger.trace("parse error at {}: {}\n{}\nparser state: {}", token.getPositionDisplay(), message, token.getLineText(), this);
        }
        return new ParseException(message, componentName(), token.getLine());
    }

    // ========== Nesting guard ==========

    protected void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("too much nesting");
        }
    }

    protected void exit() {
        depth--;
    }

    // ========== Token navigation ==========

    protected TokenType peek() {
        return peekToken().type;
    }

    protected TokenType peek(int offset) {
        int index = position + offset;
        return index < size ? tokens.get(index).type : EOF;
    }

    protected Token peekToken() {
        return position < size ? tokens.get(position) : Token.EMPTY;
    }

    protected boolean peekIf(TokenType type) {
        return peek() == type;
    }

    protected boolean peekAnyOf(TokenType[] types) {
        TokenType current = peek();
        for (TokenType type : types) {
            if (current == type) {
                return true;
            }
        }
        return false;
    }

    protected boolean consumeIf(TokenType type) {
        if (peekIf(type)) {
            next();
            return true;
        }
        return false;
    }

    protected Token consume(TokenType type, String expected) {
        if (!peekIf(type)) {
            Token token = peekToken();
            String found = token.type == EOF ? "end of template" : "'" + token + "'";
            throw error("expected " + expected + " but found " + found, token);
        }
        return next();
    }

    protected Token next() {
        return position < size ? tokens.get(position++) : Token.EMPTY;
    }

}
