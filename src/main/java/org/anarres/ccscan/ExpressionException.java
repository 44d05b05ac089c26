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
 * A malformed #if or #elif condition, reported at the offending token.
 */
public class ExpressionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Token token;

    public ExpressionException(@Nonnull Token token, @Nonnull String msg) {
        super(msg);
        this.token = token;
    }

    @Nonnull
    public Token getToken() {
        return token;
    }
}
