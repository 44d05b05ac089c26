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

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Walks a directive tree under a set of macros and reports the
 * includes a preprocessor would reach.
 *
 * Definitions and undefinitions take effect for the rest of their
 * own directive list. A taken branch is walked over a copy of the
 * environment, so nothing it defines or undefines is seen after its
 * block. The caller's environment is never modified.
 */
public final class Evaluator {

    private PVector<Directive.Include> includes = TreePVector.empty();

    private Evaluator() {
    }

    /**
     * Returns the reachable includes in traversal order, duplicates kept.
     */
    @Nonnull
    public static PVector<Directive.Include> reachableIncludes(@Nonnull SourceInfo info, @Nonnull Environment env) {
        Evaluator evaluator = new Evaluator();
        evaluator.walk(info.getDirectives(), env);
        return evaluator.includes;
    }

    /**
     * Returns the environment after the top-level directives of the
     * file. Definitions inside conditional blocks are not included.
     */
    @Nonnull
    public static Environment definitions(@Nonnull SourceInfo info, @Nonnull Environment env) {
        return new Evaluator().walk(info.getDirectives(), env);
    }

    /* pp */ static long valueOf(@Nonnull Directive.Define define) {
        if (define.isFunctionLike() || define.getBody().isEmpty())
            return 1;
        try {
            return Literals.parseInteger(define.getBody().get(0));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Nonnull
    private Environment walk(@Nonnull List<Directive> directives, @Nonnull Environment env) {
        for (Directive d : directives) {
            if (d instanceof Directive.Include) {
                includes = includes.plus((Directive.Include) d);
            } else if (d instanceof Directive.Define) {
                Directive.Define define = (Directive.Define) d;
                env = env.define(define.getName(), valueOf(define));
            } else if (d instanceof Directive.Undefine) {
                env = env.undefine(((Directive.Undefine) d).getName());
            } else if (d instanceof Directive.IfBlock) {
                for (ConditionalBranch branch : ((Directive.IfBlock) d).getBranches()) {
                    Expr condition = branch.getCondition();
                    if (condition == null || condition.test(env)) {
                        walk(branch.getBody(), env);
                        break;
                    }
                }
            } else {
                throw new InternalException("Unknown directive " + d);
            }
        }
        return env;
    }
}
