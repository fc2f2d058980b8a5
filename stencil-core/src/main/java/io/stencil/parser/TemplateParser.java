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

import io.stencil.CompositionException;
import io.stencil.common.Resource;
import io.stencil.common.StringUtils;
import io.stencil.template.Terms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.stencil.parser.TokenType.*;

/**
 * Builds the node tree of a component. Block statements are parsed by
 * recursing into {@link #parseBody} with the set of statements that may end
 * the block, mismatched or missing terminators are fatal.
 */
public class TemplateParser extends ExprParser {

    private static final Set<StatementType> IF_TERMINATORS = EnumSet.of(StatementType.ELSEIF, StatementType.ELSE, StatementType.ENDIF);
    private static final Set<StatementType> FOREACH_TERMINATORS = EnumSet.of(StatementType.ENDFOREACH);
    private static final Set<StatementType> REPLACE_TERMINATORS = EnumSet.of(StatementType.ENDREPLACE);

    public TemplateParser(Resource resource) {
        super(resource, BaseLexer.tokenize(new TemplateLexer(resource)));
    }

    public List<Node> parse() {
        List<Node> body = parseBody(Collections.emptySet(), null, false);
        consume(EOF, "end of template");
        return body;
    }

    /**
     * Parses nodes until EOF or until a statement in {@code terminators},
     * which is left for the caller to consume.
     *
     * @param opener     the statement that opened this block, null at the top level
     * @param inReplace  true within a replacement body, where placeholders are illegal
     */
    private List<Node> parseBody(Set<StatementType> terminators, Token opener, boolean inReplace) {
        enter();
        try {
            List<Node> body = new ArrayList<>();
            while (true) {
                Token token = peekToken();
                switch (token.type) {
                    case EOF:
                        if (opener != null) {
                            throw error("missing " + closerOf(opener) + " for " + statementText(opener)
                                    + " opened at line " + opener.getLine(), token);
                        }
                        return body;
                    case TEXT:
                        next();
                        body.add(new Node.Text(token.text, token.getLine()));
                        break;
                    case SHORT_PRINT_OPEN:
                        next();
                        body.add(new Node.Print(parseSingleExpr(token), true, token.getLine()));
                        break;
                    case STATEMENT_OPEN:
                        StatementType statement = token.getStatement();
                        if (terminators.contains(statement)) {
                            return body;
                        }
                        body.add(parseStatement(token, statement, opener, inReplace));
                        break;
                    default:
                        throw error("unexpected '" + token + "'", token);
                }
            }
        } finally {
            exit();
        }
    }

    private Node parseStatement(Token token, StatementType statement, Token opener, boolean inReplace) {
        switch (statement) {
            case PRINT:
                next();
                return new Node.Print(parseSingleExpr(token), false, token.getLine());
            case LOG:
                next();
                return new Node.Log(parseSingleExpr(token), token.getLine());
            case IF:
                return parseIf(inReplace);
            case FOREACH:
                return parseForeach(inReplace);
            case RENDER:
                return parseRender();
            case INCLUDE:
                next();
                return new Node.Include(parseName(token), token.getLine());
            case PLACE:
                next();
                String name = parseName(token);
                if (inReplace) {
                    throw CompositionException.misplaced(name, componentName(), token.getLine());
                }
                return new Node.Place(name, token.getLine());
            default:
                String message = "unexpected " + statement.display();
                if (opener != null) {
                    message = message + ", expected " + closerOf(opener) + " for " + statementText(opener)
                            + " opened at line " + opener.getLine();
                }
                throw error(message, token);
        }
    }

    private Node parseIf(boolean inReplace) {
        Token opener = next();
        List<Node.Branch> branches = new ArrayList<>();
        Expr condition = parseSingleExpr(opener);
        branches.add(new Node.Branch(condition, parseBody(IF_TERMINATORS, opener, inReplace), opener.getLine()));
        List<Node> elseBody = null;
        while (true) {
            Token token = next(); // always a terminator, parseBody fails on EOF
            StatementType statement = token.getStatement();
            if (statement == StatementType.ENDIF) {
                break;
            }
            if (elseBody != null) {
                throw error(statement.display() + " is not allowed after $else", token);
            }
            if (statement == StatementType.ELSEIF) {
                Expr elseIfCondition = parseSingleExpr(token);
                branches.add(new Node.Branch(elseIfCondition, parseBody(IF_TERMINATORS, opener, inReplace), token.getLine()));
            } else { // ELSE
                elseBody = parseBody(IF_TERMINATORS, opener, inReplace);
            }
        }
        return new Node.If(List.copyOf(branches), elseBody == null ? null : List.copyOf(elseBody), opener.getLine());
    }

    private Node parseForeach(boolean inReplace) {
        Token opener = next();
        List<Expr> args = parseArgs(opener);
        if (args.size() != 2 && args.size() != 3) {
            throw error("$foreach expects (item, collection) or (item, index, collection) but found "
                    + args.size() + " argument(s)", opener);
        }
        String itemName = loopVariable(args.get(0), opener);
        String indexName = args.size() == 3 ? loopVariable(args.get(1), opener) : null;
        if (itemName.equals(indexName)) {
            throw error("$foreach item and index cannot have the same name: " + itemName, opener);
        }
        Expr collection = args.get(args.size() - 1);
        List<Node> body = parseBody(FOREACH_TERMINATORS, opener, inReplace);
        next(); // $endforeach
        return new Node.Foreach(itemName, indexName, collection, List.copyOf(body), opener.getLine());
    }

    private String loopVariable(Expr expr, Token opener) {
        if (expr instanceof Expr.Local local) {
            return local.name();
        }
        throw error("$foreach loop variable must be a plain name", opener);
    }

    private Node parseRender() {
        Token opener = next();
        Expr component = parseExpr();
        Map<String, Expr> bindings = new LinkedHashMap<>();
        while (consumeIf(COMMA)) {
            Token name = consume(IDENT, "name=value binding");
            consume(EQ, "'=' after binding name " + name.text);
            if (bindings.containsKey(name.text)) {
                throw error("duplicate binding: " + name.text, name);
            }
            bindings.put(name.text, parseExpr());
        }
        consume(STATEMENT_CLOSE, "')' to close " + statementText(opener));
        Map<String, List<Node>> replacements = new LinkedHashMap<>();
        while (true) {
            Token token = peekToken();
            if (token.type == TEXT) {
                if (!token.text.isBlank()) {
                    throw error("only $replace blocks may appear inside $render, found text: "
                            + StringUtils.truncate(token.text.trim(), 20, true), token);
                }
                next();
                continue;
            }
            StatementType statement = token.getStatement();
            if (statement == StatementType.ENDRENDER) {
                next();
                break;
            }
            if (statement == StatementType.REPLACE) {
                next();
                String name = parseName(token);
                if (replacements.containsKey(name)) {
                    throw error("duplicate $replace for placeholder: " + name, token);
                }
                List<Node> body = parseBody(REPLACE_TERMINATORS, token, true);
                next(); // $endreplace
                replacements.put(name, List.copyOf(body));
                continue;
            }
            if (token.type == EOF) {
                throw error("missing $endrender for $render opened at line " + opener.getLine(), token);
            }
            throw error("only $replace blocks may appear inside $render, found '" + token + "'", token);
        }
        return new Node.Render(component, Collections.unmodifiableMap(bindings),
                Collections.unmodifiableMap(replacements), opener.getLine());
    }

    // ========== Arguments ==========

    private List<Expr> parseArgs(Token opener) {
        List<Expr> args = new ArrayList<>();
        if (!peekIf(STATEMENT_CLOSE)) {
            do {
                args.add(parseExpr());
            } while (consumeIf(COMMA));
        }
        consume(STATEMENT_CLOSE, "')' to close " + statementText(opener));
        return args;
    }

    private Expr parseSingleExpr(Token opener) {
        if (peekIf(STATEMENT_CLOSE)) {
            throw error(statementText(opener) + " expects an expression", opener);
        }
        Expr expr = parseExpr();
        if (peekIf(COMMA)) {
            throw error(statementText(opener) + " accepts exactly one argument", peekToken());
        }
        consume(STATEMENT_CLOSE, "')' to close " + statementText(opener));
        return expr;
    }

    private String parseName(Token opener) {
        Token name = peekToken();
        if (name.type != STRING) {
            throw error(statementText(opener) + " expects a single quoted name", opener);
        }
        next();
        if (peekIf(COMMA)) {
            throw error(statementText(opener) + " accepts exactly one argument", peekToken());
        }
        consume(STATEMENT_CLOSE, "')' to close " + statementText(opener));
        return (String) Terms.literalValue(name);
    }

    private static String statementText(Token opener) {
        StatementType statement = opener.getStatement();
        return statement == null ? opener.text + ")" : statement.display();
    }

    private static String closerOf(Token opener) {
        StatementType statement = opener.getStatement();
        if (statement == null) {
            return "')'";
        }
        return switch (statement) {
            case IF, ELSEIF, ELSE -> "$endif";
            case FOREACH -> "$endforeach";
            case RENDER -> "$endrender";
            case REPLACE -> "$endreplace";
            default -> "end of " + statement.display();
        };
    }

}
