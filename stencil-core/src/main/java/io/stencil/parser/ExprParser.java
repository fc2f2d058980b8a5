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
import io.stencil.template.Terms;

import java.util.ArrayList;
import java.util.List;

import static io.stencil.parser.TokenType.*;

/**
 * Recursive descent parser for the expression grammar used inside statement
 * argument lists, lowest precedence first:
 * <pre>
 * or         := and ( '||' and )*
 * and        := equality ( '&amp;&amp;' equality )*
 * equality   := relational ( ('===' | '==' | '!==' | '!=') relational )*
 * relational := unary ( ('&lt;' | '&lt;=' | '&gt;' | '&gt;=') unary )*
 * unary      := '!' unary | postfix
 * postfix    := primary ( '.' name | '[' or ']' )*
 * primary    := literal | name '(' args ')' | name | '@' name | '(' or ')'
 * </pre>
 */
public class ExprParser extends BaseParser {

    private static final TokenType[] EQUALITY = {EQ_EQ_EQ, EQ_EQ, NOT_EQ_EQ, NOT_EQ};
    private static final TokenType[] RELATIONAL = {LT, LT_EQ, GT, GT_EQ};
    private static final TokenType[] LITERALS = {STRING, NUMBER, TRUE, FALSE, NULL, UNDEFINED};

    public ExprParser(Resource resource, List<Token> tokens) {
        super(resource, tokens);
    }

    public Expr parseExpr() {
        enter();
        try {
            return parseOr();
        } finally {
            exit();
        }
    }

    private Expr parseOr() {
        Expr left = parseAnd();
        while (peekIf(PIPE_PIPE)) {
            Token op = next();
            left = new Expr.Binary(op.type, left, parseAnd(), op.getLine());
        }
        return left;
    }

    private Expr parseAnd() {
        Expr left = parseEquality();
        while (peekIf(AMP_AMP)) {
            Token op = next();
            left = new Expr.Binary(op.type, left, parseEquality(), op.getLine());
        }
        return left;
    }

    private Expr parseEquality() {
        Expr left = parseRelational();
        while (peekAnyOf(EQUALITY)) {
            Token op = next();
            left = new Expr.Binary(op.type, left, parseRelational(), op.getLine());
        }
        return left;
    }

    private Expr parseRelational() {
        Expr left = parseUnary();
        while (peekAnyOf(RELATIONAL)) {
            Token op = next();
            left = new Expr.Binary(op.type, left, parseUnary(), op.getLine());
        }
        return left;
    }

    private Expr parseUnary() {
        if (peekIf(NOT)) {
            Token op = next();
            enter();
            try {
                return new Expr.Unary(op.type, parseUnary(), op.getLine());
            } finally {
                exit();
            }
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr expr = parsePrimary();
        while (true) {
            if (peekIf(DOT)) {
                Token dot = next();
                Token name = peekToken();
                if (name.type != IDENT && !name.type.keyword) {
                    throw error("expected property name after '.'", name);
                }
                next();
                expr = new Expr.Member(expr, name.text, dot.getLine());
            } else if (peekIf(L_BRACKET)) {
                Token bracket = next();
                Expr index = parseExpr();
                consume(R_BRACKET, "']'");
                expr = new Expr.Index(expr, index, bracket.getLine());
            } else {
                return expr;
            }
        }
    }

    private Expr parsePrimary() {
        Token token = peekToken();
        if (peekAnyOf(LITERALS)) {
            next();
            return new Expr.Literal(Terms.literalValue(token), token.getLine());
        }
        switch (token.type) {
            case IDENT:
                next();
                if (peekIf(L_PAREN)) {
                    return parseToolCall(token);
                }
                return new Expr.Local(token.text, token.getLine());
            case AT:
                next();
                Token name = consume(IDENT, "global name after '@'");
                return new Expr.Global(name.text, token.getLine());
            case L_PAREN:
                next();
                Expr inner = parseExpr();
                consume(R_PAREN, "')'");
                return new Expr.Group(inner, token.getLine());
            default:
                String found = token.type == STATEMENT_CLOSE ? "')'" : "'" + token + "'";
                throw error("expected expression but found " + found, token);
        }
    }

    private Expr parseToolCall(Token name) {
        consume(L_PAREN, "'('");
        List<Expr> args = new ArrayList<>();
        if (!peekIf(R_PAREN)) {
            do {
                args.add(parseExpr());
            } while (consumeIf(COMMA));
        }
        consume(R_PAREN, "')' to close call to " + name.text);
        return new Expr.ToolCall(name.text, args, name.getLine());
    }

}
