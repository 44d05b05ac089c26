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

import javax.annotation.Nonnull;

/**
 * A fatal tokenizing error.
 *
 * The file cannot be tokenized past the reported position; callers
 * should treat it as unparsed.
 */
public class LexerException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** A backslash which no newline follows. */
        CONTINUE_LINE_INVALID("missing newline character after line continuation backslash"),
        /** A '/' '*' without the closing '*' '/'. */
        MULTI_LINE_COMMENT_UNTERMINATED("unterminated multi-line comment");

        private final String description;

        private Reason(String description) {
            this.description = description;
        }

        @Nonnull
        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;
    private final Cursor cursor;

    public LexerException(@Nonnull Reason reason, @Nonnull Cursor cursor) {
        super("Error at " + cursor + ": " + reason.getDescription());
        this.reason = reason;
        this.cursor = cursor;
    }

    @Nonnull
    public Reason getReason() {
        return reason;
    }

    @Nonnull
    public Cursor getCursor() {
        return cursor;
    }
}
