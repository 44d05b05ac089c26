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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits C/C++ source into classified {@link Token Tokens}.
 *
 * Only the subset of the lexical syntax needed to find preprocessor
 * directives, conditions and main() is classified; everything else
 * falls into {@link TokenType#IDENTIFIER} tokens.
 *
 * At each position the leftmost match of every rule is considered.
 * The earliest match wins; at the same start the longest wins, then
 * the type declared first in {@link TokenType}. Text before the
 * winning match becomes an identifier token. The leftmost match of
 * each rule is kept in a queue and only rescanned once the lexer has
 * moved past its start.
 *
 * A Lexer is a one-shot sequence: to restart, create a new Lexer on
 * the same input.
 */
public class Lexer {

    private static final String BLANK = "[ \\t\\u000B\\f\\r]";

    /* pp */ static final List<Rule> RULES;

    static {
        List<Rule> rules = new ArrayList<Rule>();
        rules.add(new RegexRule(TokenType.DIRECTIVE,
                "#" + BLANK + "*(include_next|include|define|undef|ifdef|ifndef|if|elifdef|elifndef|elif|else|endif)(?![A-Za-z0-9_])",
                1));
        rules.add(new FixedRule(TokenType.NL, "\n"));
        rules.add(new RegexRule(TokenType.WHITESPACE, BLANK + "+", -1));
        rules.add(new RegexRule(TokenType.CONTINUE_LINE, "\\\\" + BLANK + "*\\n", -1));
        rules.add(new RegexRule(TokenType.CPPCOMMENT, "//[^\\n]*", -1));
        rules.add(new RegexRule(TokenType.CCOMMENT, "(?s)/\\*.*?\\*/", -1));
        rules.add(new RegexRule(TokenType.INTEGER,
                "(?<![A-Za-z0-9_.])(?:0[xX][0-9a-fA-F]+|0[bB][01]+|[0-9]+)[uUlL]*(?![A-Za-z0-9_.])",
                -1));
        rules.add(new RegexRule(TokenType.STRING, "\"(?:[^\"\\\\\\n]|\\\\.)*\"", -1));
        for (TokenType type : TokenType.values()) {
            if (type.isSymbol())
                rules.add(new FixedRule(type, type.getText()));
        }
        RULES = Collections.unmodifiableList(rules);
    }

    private final String input;
    private final int lastNewline;
    private final PriorityQueue<Match> matches = new PriorityQueue<Match>(RULES.size(), Match.ORDER);
    private int offset;
    private Cursor cursor;

    public Lexer(@Nonnull String input) {
        this.input = input;
        this.lastNewline = input.lastIndexOf('\n');
        this.offset = 0;
        this.cursor = Cursor.INIT;
        for (Rule rule : RULES) {
            Match match = rule.find(input, 0);
            if (match != null)
                matches.add(match);
        }
    }

    public Lexer(@Nonnull byte[] content) {
        this(new String(content, StandardCharsets.UTF_8));
    }

    /**
     * Returns every token of the given input, without the EOF sentinel.
     */
    @Nonnull
    public static PVector<Token> tokenize(@Nonnull byte[] content)
            throws LexerException {
        return new Lexer(content).tokens();
    }

    @Nonnull
    public static PVector<Token> tokenize(@Nonnull String input)
            throws LexerException {
        return new Lexer(input).tokens();
    }

    @Nonnull
    private PVector<Token> tokens()
            throws LexerException {
        PVector<Token> result = TreePVector.empty();
        for (;;) {
            Token tok = token();
            if (tok.getType() == TokenType.EOF)
                return result;
            result = result.plus(tok);
        }
    }

    /** Returns the position of the next token. */
    @Nonnull
    public Cursor getCursor() {
        return cursor;
    }

    /**
     * Returns the next token, or the EOF sentinel once the input is
     * exhausted.
     *
     * @throws LexerException on an invalid line continuation or an
     * unterminated comment.
     */
    @Nonnull
    public Token token()
            throws LexerException {
        if (offset >= input.length())
            return Token.EOF;

        /* Rescan the rules we have moved past. */
        while (!matches.isEmpty() && matches.peek().begin < offset) {
            Match stale = matches.poll();
            Match fresh = stale.rule.find(input, offset);
            if (fresh != null)
                matches.add(fresh);
        }

        Match next = matches.peek();
        if (next != null && next.begin == offset)
            return consume(next.rule.type, next.end, next.value);

        int end = next == null ? input.length() : next.begin;
        check(end);
        return consume(TokenType.IDENTIFIER, end, null);
    }

    /* Constructs which no rule accepts end up inside identifier text. */
    private void check(int end)
            throws LexerException {
        for (int i = offset; i < end; i++) {
            char c = input.charAt(i);
            if (c == '\\' && i > lastNewline)
                throw new LexerException(LexerException.Reason.CONTINUE_LINE_INVALID, cursorAt(i));
            if (c == '/' && i + 1 < end && input.charAt(i + 1) == '*')
                throw new LexerException(LexerException.Reason.MULTI_LINE_COMMENT_UNTERMINATED, cursorAt(i));
        }
    }

    @Nonnull
    private Cursor cursorAt(int index) {
        return cursor.advancedBy(input.substring(offset, index));
    }

    @Nonnull
    private Token consume(@Nonnull TokenType type, int end, @CheckForNull String value) {
        String text = input.substring(offset, end);
        Token tok = new Token(type, cursor, text, value);
        offset = end;
        cursor = cursor.advancedBy(text);
        return tok;
    }

    @Override
    public String toString() {
        return "Lexer at " + cursor + " of " + input.length() + " chars";
    }

    /* pp */ static final class Match {

        static final Comparator<Match> ORDER = new Comparator<Match>() {
            @Override
            public int compare(Match a, Match b) {
                if (a.begin != b.begin)
                    return Integer.compare(a.begin, b.begin);
                if (a.end != b.end)
                    return Integer.compare(b.end, a.end);
                return a.rule.type.compareTo(b.rule.type);
            }
        };

        final Rule rule;
        final int begin;
        final int end;
        final String value;

        Match(Rule rule, int begin, int end, String value) {
            this.rule = rule;
            this.begin = begin;
            this.end = end;
            this.value = value;
        }

        @Override
        public String toString() {
            return rule.type + "[" + begin + "," + end + ")";
        }
    }

    /* pp */ static abstract class Rule {

        final TokenType type;

        Rule(TokenType type) {
            this.type = type;
        }

        /** Returns the leftmost match at or after from, or null. */
        @CheckForNull
        abstract Match find(@Nonnull String input, int from);
    }

    private static final class FixedRule extends Rule {

        private final String text;

        FixedRule(TokenType type, String text) {
            super(type);
            this.text = text;
        }

        @Override
        Match find(String input, int from) {
            int begin = input.indexOf(text, from);
            if (begin < 0)
                return null;
            return new Match(this, begin, begin + text.length(), null);
        }
    }

    private static final class RegexRule extends Rule {

        private final Pattern pattern;
        private final int valueGroup;

        RegexRule(TokenType type, String regex, int valueGroup) {
            super(type);
            this.pattern = Pattern.compile(regex);
            this.valueGroup = valueGroup;
        }

        @Override
        Match find(String input, int from) {
            Matcher m = pattern.matcher(input);
            /* Lookbehind must see the text before the region. */
            m.useTransparentBounds(true);
            m.region(from, input.length());
            if (!m.find())
                return null;
            String value = valueGroup < 0 ? null : m.group(valueGroup);
            return new Match(this, m.start(), m.end(), value);
        }
    }
}
