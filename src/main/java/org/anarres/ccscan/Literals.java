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
import java.util.regex.Pattern;

/**
 * Macro names and integer literals as they appear in conditions
 * and definitions.
 */
/* pp */ final class Literals {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    /* The forms accepted as a -D value. */
    private static final Pattern INTEGER = Pattern.compile(
            "(?:0[xX][0-9a-fA-F]+|0[0-7]*|[1-9][0-9]*)(?:[uU](?:ll?|LL?)?|ll?[uU]?|LL?[uU]?)?");

    private Literals() {
    }

    /* pp */ static boolean isIdentifier(@Nonnull String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    /* pp */ static boolean isInteger(@Nonnull String text) {
        return INTEGER.matcher(text).matches();
    }

    /**
     * Parses a decimal, octal, hex or binary literal, ignoring any
     * u, U, l and L suffix characters.
     *
     * @throws NumberFormatException if the text is not a literal.
     */
    /* pp */ static long parseInteger(@Nonnull String text) {
        int end = text.length();
        while (end > 0) {
            char c = text.charAt(end - 1);
            if (c != 'u' && c != 'U' && c != 'l' && c != 'L')
                break;
            end--;
        }
        String digits = text.substring(0, end);
        boolean negative = false;
        if (digits.startsWith("-") || digits.startsWith("+")) {
            negative = digits.charAt(0) == '-';
            digits = digits.substring(1);
        }
        int radix = 10;
        if (digits.length() > 2 && (digits.startsWith("0x") || digits.startsWith("0X"))) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.length() > 2 && (digits.startsWith("0b") || digits.startsWith("0B"))) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.charAt(0) == '0') {
            radix = 8;
            digits = digits.substring(1);
        }
        if (digits.isEmpty() || digits.charAt(0) == '-' || digits.charAt(0) == '+')
            throw new NumberFormatException("Not an integer literal: " + text);
        long value = Long.parseLong(digits, radix);
        return negative ? -value : value;
    }
}
