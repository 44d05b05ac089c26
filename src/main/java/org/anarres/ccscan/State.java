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
 * The parse state of one open conditional block.
 */
/* pp */ final class State {

    private final Token start;
    private final boolean sawElse;

    /* pp */ State(@Nonnull Token start) {
        this(start, false);
    }

    private State(@Nonnull Token start, boolean sawElse) {
        this.start = start;
        this.sawElse = sawElse;
    }

    /** Returns the #if, #ifdef or #ifndef which opened this block. */
    @Nonnull
    /* pp */ Token getStart() {
        return start;
    }

    /* Required for #elif and a second #else. */
    /* pp */ boolean sawElse() {
        return sawElse;
    }

    @Nonnull
    /* pp */ State withSawElse() {
        return new State(start, true);
    }

    @Override
    public String toString() {
        return "#" + start.getValue() + "@" + start.getCursor()
                + ", sawelse=" + sawElse;
    }
}
