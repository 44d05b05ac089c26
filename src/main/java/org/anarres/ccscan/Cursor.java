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

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A position in a source file.
 *
 * Lines and columns are 1-based. The special value {@link #EOF}
 * marks the end of the input.
 */
public final class Cursor {

    /** The position of the first character of a file. */
    public static final Cursor INIT = new Cursor(1, 1);
    /** The position reported for the end-of-input sentinel. */
    public static final Cursor EOF = new Cursor(0, 0);

    private final int line;
    private final int column;

    public Cursor(@Nonnegative int line, @Nonnegative int column) {
        this.line = line;
        this.column = column;
    }

    @Nonnegative
    public int getLine() {
        return line;
    }

    @Nonnegative
    public int getColumn() {
        return column;
    }

    /**
     * Returns the position just after the given text, assuming the text
     * starts at this position.
     *
     * Newlines increment the line and reset the column; any other
     * code point increments the column.
     */
    @Nonnull
    public Cursor advancedBy(@Nonnull String text) {
        int newlines = 0;
        int tail = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                newlines++;
                tail = i + 1;
            }
        }
        int tailLength = text.codePointCount(tail, text.length());
        if (newlines == 0)
            return new Cursor(line, column + tailLength);
        return new Cursor(line + newlines, 1 + tailLength);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Cursor) {
            Cursor o = (Cursor) obj;
            return o.line == line && o.column == column;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return (line << 16) ^ column;
    }

    @Override
    public String toString() {
        if (this.equals(EOF))
            return "EOF";
        return line + ":" + column;
    }
}
