/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.ccscan;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * A precedence-climbing parser for #if conditions.
 *
 * The input is the non-white tokens of the rest of the directive
 * line. Macros are not expanded.
 */
public class ExprParser {

    /** Binding strength, weakest first. */
    /* pp */ enum Precedence {
        LOWEST, OR, AND, COMPARE, BANG, PARENS;

        @Nonnull
        Precedence next() {
            return values()[ordinal() + 1];
        }
    }

    private final List<Token> tokens;
    private final Token end;
    private int index;

    /**
     * @param tokens the condition, without white tokens.
     * @param end the token which terminated the line, used to report
     * a premature end of the condition.
     */
    public ExprParser(@Nonnull List<Token> tokens, @Nonnull Token end) {
        this.tokens = tokens;
        this.end = end;
        this.index = 0;
    }

    /**
     * Parses the whole condition.
     *
     * @throws ExpressionException if the condition is malformed or
     * followed by unexpected tokens.
     */
    @Nonnull
    public Expr parse()
            throws ExpressionException {
        if (tokens.isEmpty())
            throw new ExpressionException(end, "Expected expression");
        Expr expr = expr(Precedence.LOWEST);
        Token tok = expr_token();
        if (tok != end)
            throw new ExpressionException(tok, "Unexpected token after expression: " + tok.getText());
        return expr;
    }

    @Nonnull
    private Token expr_token() {
        if (index < tokens.size())
            return tokens.get(index++);
        return end;
    }

    private void expr_untoken(@Nonnull Token tok) {
        if (tok == end)
            return;
        if (index == 0 || tokens.get(index - 1) != tok)
            throw new InternalException("Cannot unget " + tok + " at " + index);
        index--;
    }

    @Nonnull
    private Token expr_peek() {
        Token tok = expr_token();
        expr_untoken(tok);
        return tok;
    }

    /* Returns null if the token is not an infix operator. */
    @CheckForNull
    private static Precedence expr_priority(@Nonnull Token op) {
        switch (op.getType()) {
            case LOR:
                return Precedence.OR;
            case LAND:
                return Precedence.AND;
            case EQ:
            case NE:
            case LT:
            case LE:
            case GT:
            case GE:
                return Precedence.COMPARE;
            default:
                return null;
        }
    }

    @Nonnull
    private static Expr.Compare.Operator expr_compare(@Nonnull Token op) {
        switch (op.getType()) {
            case EQ:
                return Expr.Compare.Operator.EQ;
            case NE:
                return Expr.Compare.Operator.NE;
            case LT:
                return Expr.Compare.Operator.LT;
            case LE:
                return Expr.Compare.Operator.LE;
            case GT:
                return Expr.Compare.Operator.GT;
            case GE:
                return Expr.Compare.Operator.GE;
            default:
                throw new InternalException("Not a comparison: " + op);
        }
    }

    @Nonnull
    private Expr expr(@Nonnull Precedence priority)
            throws ExpressionException {
        Token tok = expr_token();
        Expr lhs;

        switch (tok.getType()) {
            case NOT:
                lhs = new Expr.Not(expr(Precedence.BANG.next()));
                break;
            case LPAREN:
                lhs = expr(Precedence.LOWEST.next());
                expect(TokenType.RPAREN, "Missing ) in expression");
                break;
            case INTEGER:
                try {
                    lhs = new Expr.ConstantInt(Literals.parseInteger(tok.getText()));
                } catch (NumberFormatException e) {
                    throw new ExpressionException(tok, "Bad integer literal: " + tok.getText());
                }
                break;
            case IDENTIFIER:
                if (tok.is("defined"))
                    lhs = defined();
                else if (Literals.isIdentifier(tok.getText()))
                    lhs = ident(tok);
                else
                    throw new ExpressionException(tok, "Bad token in expression: " + tok.getText());
                break;
            case NL:
            case EOF:
                throw new ExpressionException(tok, "Unexpected end of expression");
            default:
                throw new ExpressionException(tok, "Bad token in expression: " + tok.getText());
        }

        EXPR:
        for (;;) {
            Token op = expr_token();
            Precedence pri = expr_priority(op);
            if (pri == null || pri.compareTo(priority) < 0) {
                expr_untoken(op);
                break EXPR;
            }
            Expr rhs = expr(pri.next());
            switch (op.getType()) {
                case LOR:
                    lhs = new Expr.Or(lhs, rhs);
                    break;
                case LAND:
                    lhs = new Expr.And(lhs, rhs);
                    break;
                default:
                    lhs = new Expr.Compare(lhs, expr_compare(op), rhs);
                    break;
            }
        }

        return lhs;
    }

    @Nonnull
    private Expr defined()
            throws ExpressionException {
        Token la = expr_token();
        boolean paren = false;
        if (la.getType() == TokenType.LPAREN) {
            paren = true;
            la = expr_token();
        }
        if (la.getType() != TokenType.IDENTIFIER || !Literals.isIdentifier(la.getText()))
            throw new ExpressionException(la, "defined() needs identifier, not " + la.getText());
        if (paren)
            expect(TokenType.RPAREN, "Missing ) in defined()");
        return new Expr.Defined(la.getText());
    }

    /* A plain macro name, or an invocation if ( follows. */
    @Nonnull
    private Expr ident(@Nonnull Token name)
            throws ExpressionException {
        if (expr_peek().getType() != TokenType.LPAREN)
            return new Expr.Ident(name.getText());
        expr_token();
        List<Expr> args = new ArrayList<Expr>();
        if (expr_peek().getType() == TokenType.RPAREN) {
            expr_token();
            return new Expr.Apply(name.getText(), args);
        }
        ARGS:
        for (;;) {
            args.add(expr(Precedence.LOWEST));
            Token tok = expr_token();
            switch (tok.getType()) {
                case COMMA:
                    break;
                case RPAREN:
                    break ARGS;
                default:
                    throw new ExpressionException(tok,
                            "Bad token in arguments of " + name.getText() + ": " + tok.getText());
            }
        }
        return new Expr.Apply(name.getText(), args);
    }

    private void expect(@Nonnull TokenType type, @Nonnull String msg)
            throws ExpressionException {
        Token tok = expr_token();
        if (tok.getType() != type)
            throw new ExpressionException(tok, msg + ". Got " + tok.getText());
    }
}
