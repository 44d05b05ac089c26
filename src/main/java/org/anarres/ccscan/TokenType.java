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

/**
 * The types of {@link Token} produced by the {@link Lexer}.
 *
 * The declaration order is the priority rank used to break ties
 * between matches of identical extent: earlier constants win.
 */
public enum TokenType {

    /** A '#' followed by one of the known directive keywords. */
    DIRECTIVE(null),
    /** A single newline. Terminates a directive. */
    NL(null),
    /** A run of blanks other than newlines. */
    WHITESPACE(null),
    /** A backslash, optional blanks and a newline. */
    CONTINUE_LINE(null),
    /** A C++ style comment, up to but excluding the newline. */
    CPPCOMMENT(null),
    /** A C style comment, possibly spanning lines. */
    CCOMMENT(null),
    INTEGER(null),
    STRING(null),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    SEMICOLON(";"),
    EQ("=="),
    NE("!="),
    LE("<="),
    GE(">="),
    LT("<"),
    GT(">"),
    LAND("&&"),
    LOR("||"),
    NOT("!"),
    /**
     * Anything else: identifiers, keywords and characters this lexer
     * does not classify. Has no matcher of its own.
     */
    IDENTIFIER(null),
    /** The end-of-input sentinel. Never part of a token sequence. */
    EOF(null);

    private final String text;

    private TokenType(@CheckForNull String text) {
        this.text = text;
    }

    /**
     * Returns the fixed text of a symbol or operator, or null
     * if this type has variable content.
     */
    @CheckForNull
    public String getText() {
        return text;
    }

    public boolean isSymbol() {
        return text != null;
    }

    /**
     * Returns true for tokens which carry no meaning inside a directive
     * line: whitespace, comments and line continuations.
     */
    public boolean isWhite() {
        switch (this) {
            case WHITESPACE:
            case CONTINUE_LINE:
            case CCOMMENT:
            case CPPCOMMENT:
                return true;
            default:
                return false;
        }
    }
}
