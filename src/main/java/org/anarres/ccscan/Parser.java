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

import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.anarres.ccscan.TokenType.*;

/**
 * Extracts the preprocessor directives of a C or C++ file.
 *
 * Directives are not executed: macros are recorded but never
 * expanded, and every branch of a conditional block is parsed.
 * A malformed directive is reported to the {@link ParserListener}
 * and skipped to the end of its line.
 *
 * A Parser consumes its {@link Lexer}; it may be used once.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final String name;
    private final Lexer lexer;
    private ParserListener listener;

    /* Source tokens */
    private Token source_token;

    private boolean hasMain;
    private boolean unterminated;

    public Parser(@Nonnull String name, @Nonnull Lexer lexer) {
        this.name = name;
        this.lexer = lexer;
        this.listener = new DefaultParserListener();
    }

    public Parser(@Nonnull String name, @Nonnull byte[] content) {
        this(name, new Lexer(content));
    }

    /**
     * Parses the given content with a {@link DefaultParserListener}.
     *
     * @param name the file name used when reporting problems.
     * @throws LexerException if the content cannot be tokenized.
     */
    @Nonnull
    public static SourceInfo parse(@Nonnull String name, @Nonnull byte[] content)
            throws LexerException {
        return new Parser(name, content).parse();
    }

    @Nonnull
    public static SourceInfo parse(@Nonnull String input)
            throws LexerException {
        return new Parser("<input>", new Lexer(input)).parse();
    }

    /**
     * Sets the ParserListener which receives warnings and errors.
     */
    public void setListener(@Nonnull ParserListener listener) {
        this.listener = listener;
    }

    @Nonnull
    public ParserListener getListener() {
        return listener;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Parses the whole input.
     *
     * If a conditional block is still open at the end of the input,
     * the error is reported and no directives are returned.
     *
     * @throws LexerException if the input cannot be tokenized.
     */
    @Nonnull
    public SourceInfo parse()
            throws LexerException {
        PVector<Directive> directives = directives(null);
        if (unterminated) {
            LOG.debug("{}: discarding {} directives after unterminated conditional", name, directives.size());
            return new SourceInfo(TreePVector.<Directive>empty(), hasMain);
        }
        return new SourceInfo(directives, hasMain);
    }

    /**
     * Handles an error.
     *
     * The installed ParserListener receives the error.
     */
    protected void error(@Nonnull Token tok, @Nonnull String msg) {
        listener.handleError(name, tok.getLine(), tok.getColumn(), msg);
    }

    /**
     * Handles a warning.
     *
     * The installed ParserListener receives the warning.
     */
    protected void warning(@Nonnull Token tok, @Nonnull String msg) {
        listener.handleWarning(name, tok.getLine(), tok.getColumn(), msg);
    }

    @Nonnull
    private Token source_token()
            throws LexerException {
        if (source_token != null) {
            Token tok = source_token;
            source_token = null;
            return tok;
        }
        return lexer.token();
    }

    private void source_untoken(@Nonnull Token tok) {
        if (this.source_token != null)
            throw new InternalException("Cannot return two tokens");
        this.source_token = tok;
    }

    @Nonnull
    private Token source_token_nonwhite()
            throws LexerException {
        Token tok;
        do {
            tok = source_token();
        } while (tok.getType().isWhite());
        return tok;
    }

    /**
     * Returns an NL or an EOF token.
     *
     * If white is true, a warning is issued for the first nonwhite
     * token skipped.
     */
    @Nonnull
    private Token source_skipline(boolean white)
            throws LexerException {
        for (;;) {
            Token tok = source_token();
            switch (tok.getType()) {
                case NL:
                case EOF:
                    return tok;
                default:
                    if (white && !tok.getType().isWhite()) {
                        warning(tok, "Unexpected nonwhite token " + tok.getText());
                        white = false;
                    }
                    break;
            }
        }
    }

    /* Skips the rest of a bad line, unless tok already ended it. */
    private void source_recover(@Nonnull Token tok)
            throws LexerException {
        switch (tok.getType()) {
            case NL:
            case EOF:
                break;
            default:
                source_skipline(false);
                break;
        }
    }

    private static boolean isBranch(@Nonnull String keyword) {
        return "elif".equals(keyword)
                || "elifdef".equals(keyword)
                || "elifndef".equals(keyword)
                || "else".equals(keyword)
                || "endif".equals(keyword);
    }

    /**
     * Parses directives up to the end of input, or up to the next
     * branch directive of the given block, which is left unread.
     */
    @Nonnull
    private PVector<Directive> directives(@CheckForNull State state)
            throws LexerException {
        PVector<Directive> result = TreePVector.empty();
        Token prev = null;
        for (;;) {
            Token tok = source_token();
            switch (tok.getType()) {
                case EOF:
                    if (state != null) {
                        if (!unterminated)
                            error(state.getStart(), "Unterminated #" + state.getStart().getValue());
                        unterminated = true;
                    }
                    return result;

                case DIRECTIVE:
                    String keyword = tok.getValue();
                    if (isBranch(keyword)) {
                        if (state == null) {
                            error(tok, "#" + keyword + " without #if");
                            source_skipline(false);
                            break;
                        }
                        source_untoken(tok);
                        return result;
                    }
                    PVector<Directive> parsed = directive(tok);
                    if (unterminated)
                        return result;
                    result = result.plusAll(parsed);
                    break;

                case IDENTIFIER:
                    if (tok.is("main") && prev != null && prev.is("int")) {
                        Token la = source_token_nonwhite();
                        if (la.getType() == LPAREN)
                            hasMain = true;
                        source_untoken(la);
                    }
                    break;

                default:
                    break;
            }
            /* A directive consumes its line. */
            if (tok.getType() == DIRECTIVE)
                prev = null;
            else if (!tok.getType().isWhite())
                prev = tok;
        }
    }

    /**
     * Parses one directive and, for a conditional, everything up to
     * its #endif.
     *
     * Returns nothing if the directive was bad.
     */
    @Nonnull
    private PVector<Directive> directive(@Nonnull Token tok)
            throws LexerException {
        String keyword = tok.getValue();
        if (keyword == null)
            throw new InternalException("Directive token without keyword: " + tok);
        Directive directive;
        switch (keyword) {
            case "include":
                directive = include(false);
                break;
            case "include_next":
                directive = include(true);
                break;
            case "define":
                directive = define();
                break;
            case "undef":
                directive = undef();
                break;
            case "if":
            case "ifdef":
            case "ifndef":
                return ifblock(tok);
            default:
                throw new InternalException("Unknown directive #" + keyword);
        }
        if (directive == null)
            return TreePVector.empty();
        return TreePVector.singleton(directive);
    }

    @CheckForNull
    private Directive include(boolean next)
            throws LexerException {
        Token tok = source_token_nonwhite();

        String path;
        boolean system;

        switch (tok.getType()) {
            case LT: {
                StringBuilder buf = new StringBuilder();
                /* Whitespace and comments inside <...> collapse to one space, none at the ends. */
                boolean space = false;
                HEADER:
                for (;;) {
                    Token part = source_token();
                    switch (part.getType()) {
                        case GT:
                            break HEADER;
                        case NL:
                        case EOF:
                            error(part, "Unterminated #include <...>");
                            return null;
                        default:
                            if (part.getType().isWhite()) {
                                space = true;
                                break;
                            }
                            if (space && buf.length() > 0)
                                buf.append(' ');
                            space = false;
                            buf.append(part.getText());
                            break;
                    }
                }
                path = buf.toString();
                system = true;
                break;
            }
            case STRING: {
                String text = tok.getText();
                path = text.substring(1, text.length() - 1);
                if (path.indexOf('"') >= 0) {
                    error(tok, "Malformed #include, quotes inside path: " + text);
                    source_skipline(false);
                    return null;
                }
                system = false;
                break;
            }
            default:
                error(tok, "Expected string or header, not " + tok.getText());
                source_recover(tok);
                return null;
        }

        if (path.isEmpty()) {
            error(tok, "Empty #include path");
            source_skipline(false);
            return null;
        }

        source_skipline(true);
        return new Directive.Include(path, system, next);
    }

    @CheckForNull
    private Directive define()
            throws LexerException {
        Token tok = source_token_nonwhite();
        if (tok.getType() != IDENTIFIER || !Literals.isIdentifier(tok.getText())) {
            error(tok, "Expected identifier, not " + tok.getText());
            source_recover(tok);
            return null;
        }

        String name = tok.getText();
        if ("defined".equals(name)) {
            error(tok, "Cannot redefine name 'defined'");
            source_skipline(false);
            return null;
        }

        List<String> args;
        boolean functionLike;

        tok = source_token();
        if (tok.getType() == LPAREN) {
            functionLike = true;
            tok = source_token_nonwhite();
            if (tok.getType() != RPAREN) {
                args = new ArrayList<String>();
                ARGS:
                for (;;) {
                    if (tok.getType() == NL || tok.getType() == EOF) {
                        error(tok, "Unterminated macro parameter list");
                        return null;
                    }
                    boolean ellipsis = tok.is("...");
                    if (!ellipsis && (tok.getType() != IDENTIFIER || !Literals.isIdentifier(tok.getText()))) {
                        error(tok, "error in macro parameters: " + tok.getText());
                        source_skipline(false);
                        return null;
                    }
                    args.add(tok.getText());
                    tok = source_token_nonwhite();
                    switch (tok.getType()) {
                        case COMMA:
                            if (ellipsis) {
                                error(tok, "ellipsis must be on last argument");
                                source_skipline(false);
                                return null;
                            }
                            break;
                        case RPAREN:
                            break ARGS;
                        case NL:
                        case EOF:
                            /* Do not skip line. */
                            error(tok, "Unterminated macro parameters");
                            return null;
                        default:
                            error(tok, "Bad token in macro parameters: " + tok.getText());
                            source_skipline(false);
                            return null;
                    }
                    tok = source_token_nonwhite();
                }
            } else {
                args = Collections.emptyList();
            }
        } else {
            functionLike = false;
            args = Collections.emptyList();
            source_untoken(tok);
        }

        List<String> body = new ArrayList<String>();
        EXPANSION:
        for (;;) {
            tok = source_token();
            switch (tok.getType()) {
                case NL:
                case EOF:
                    break EXPANSION;
                default:
                    if (!tok.getType().isWhite())
                        body.add(tok.getText());
                    break;
            }
        }

        Directive.Define d = new Directive.Define(name, functionLike, args, body);
        LOG.debug("{}: defined macro {}", this.name, d);
        return d;
    }

    @CheckForNull
    private Directive undef()
            throws LexerException {
        Token tok = source_token_nonwhite();
        if (tok.getType() != IDENTIFIER || !Literals.isIdentifier(tok.getText())) {
            error(tok, "Expected identifier, not " + tok.getText());
            source_recover(tok);
            return null;
        }
        source_skipline(true);
        return new Directive.Undefine(tok.getText());
    }

    /**
     * Parses a conditional block from its opening directive up to
     * and including the matching #endif.
     *
     * If the opening condition is bad, the directive is skipped: the
     * bodies of all branches are returned in order, unconditionally.
     * A bad #elif is skipped likewise, so its body continues the
     * branch before it. A branch after #else is reported and dropped.
     * Returns nothing if the input ends first.
     */
    @Nonnull
    private PVector<Directive> ifblock(@Nonnull Token start)
            throws LexerException {
        State state = new State(start);
        List<ConditionalBranch> branches = new ArrayList<ConditionalBranch>();
        ConditionalBranch.Kind kind = ConditionalBranch.Kind.IF;
        Expr condition = condition(start);
        boolean skipped = condition == null;
        boolean discard = false;
        PVector<Directive> body = TreePVector.empty();
        PVector<Directive> flat = TreePVector.empty();

        for (;;) {
            body = body.plusAll(directives(state));
            if (unterminated)
                return TreePVector.empty();

            Token tok = source_token();
            String keyword = tok.getValue();
            if (tok.getType() != DIRECTIVE || keyword == null)
                throw new InternalException("Expected a branch directive, not " + tok);

            if ("endif".equals(keyword)) {
                source_skipline(true);
            } else if ("else".equals(keyword)) {
                source_skipline(true);
                if (state.sawElse())
                    error(tok, "#else after #else");
            } else if (state.sawElse()) {
                error(tok, "#" + keyword + " after #else");
                source_skipline(false);
            } else {
                Expr next = condition(tok);
                if (next == null)
                    continue;
                if (!discard && !skipped)
                    branches.add(new ConditionalBranch(kind, condition, body));
                flat = flat.plusAll(body);
                body = TreePVector.empty();
                kind = ConditionalBranch.Kind.ELIF;
                condition = next;
                continue;
            }

            if (!discard && !skipped)
                branches.add(new ConditionalBranch(kind, condition, body));
            flat = flat.plusAll(body);
            body = TreePVector.empty();

            if ("endif".equals(keyword))
                break;
            if (state.sawElse()) {
                discard = true;
            } else {
                state = state.withSawElse();
                kind = ConditionalBranch.Kind.ELSE;
                condition = null;
            }
        }

        if (skipped) {
            LOG.debug("{}: {} kept unconditionally after bad #{}", name, flat.size(), start.getValue());
            return flat;
        }
        return TreePVector.<Directive>singleton(new Directive.IfBlock(branches));
    }

    /**
     * Parses the condition of an #if-family directive, consuming its line.
     *
     * Returns null if the condition cannot be parsed; the error has
     * been reported.
     */
    @CheckForNull
    private Expr condition(@Nonnull Token directive)
            throws LexerException {
        String keyword = directive.getValue();
        if ("if".equals(keyword) || "elif".equals(keyword)) {
            List<Token> tokens = new ArrayList<Token>();
            Token tok;
            for (;;) {
                tok = source_token();
                if (tok.getType() == NL || tok.getType() == EOF)
                    break;
                if (!tok.getType().isWhite())
                    tokens.add(tok);
            }
            try {
                return new ExprParser(tokens, tok).parse();
            } catch (ExpressionException e) {
                error(e.getToken(), e.getMessage());
                return null;
            }
        }

        Token tok = source_token_nonwhite();
        if (tok.getType() != IDENTIFIER || !Literals.isIdentifier(tok.getText())) {
            error(tok, "Expected identifier, not " + tok.getText());
            source_recover(tok);
            return null;
        }
        source_skipline(true);
        Expr expr = new Expr.Defined(tok.getText());
        if ("ifndef".equals(keyword) || "elifndef".equals(keyword))
            expr = new Expr.Not(expr);
        return expr;
    }

    @Override
    public String toString() {
        return "Parser(" + name + ")";
    }
}
