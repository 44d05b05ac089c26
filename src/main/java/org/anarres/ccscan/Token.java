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

import com.google.gson.JsonObject;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A lexical token.
 *
 * The text is the raw content of the input. For {@link TokenType#DIRECTIVE}
 * tokens, the value is the directive keyword without the '#'.
 */
public final class Token {

    private final TokenType type;
    private final Cursor cursor;
    private final String text;
    private final String value;

    public Token(@Nonnull TokenType type, @Nonnull Cursor cursor, @Nonnull String text, @CheckForNull String value) {
        this.type = type;
        this.cursor = cursor;
        this.text = text;
        this.value = value;
    }

    public Token(@Nonnull TokenType type, @Nonnull Cursor cursor, @Nonnull String text) {
        this(type, cursor, text, null);
    }

    /* pp */ static final Token EOF = new Token(TokenType.EOF, Cursor.EOF, "");

    @Nonnull
    public TokenType getType() {
        return type;
    }

    @Nonnull
    public Cursor getCursor() {
        return cursor;
    }

    public int getLine() {
        return cursor.getLine();
    }

    public int getColumn() {
        return cursor.getColumn();
    }

    @Nonnull
    public String getText() {
        return text;
    }

    @CheckForNull
    public String getValue() {
        return value;
    }

    /** Returns true if this is an identifier with exactly the given text. */
    public boolean is(@Nonnull String word) {
        return type == TokenType.IDENTIFIER && text.equals(word);
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("type", type.name());
        result.addProperty("at", cursor.toString());
        result.addProperty("text", text);
        if (value != null)
            result.addProperty("value", value);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Token) {
            Token o = (Token) obj;
            return o.type == type
                    && o.cursor.equals(cursor)
                    && o.text.equals(text)
                    && Objects.equals(o.value, value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return type.hashCode() ^ cursor.hashCode() ^ text.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(type);
        if (!cursor.equals(Cursor.EOF))
            buf.append('@').append(cursor);
        buf.append(']');
        if (!text.isEmpty())
            buf.append('"').append(text).append('"');
        return buf.toString();
    }
}
