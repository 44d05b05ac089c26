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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The structure of one parsed file: its top-level directives and
 * whether it defines main().
 */
public final class SourceInfo {

    private final PVector<Directive> directives;
    private final boolean hasMain;

    public SourceInfo(@Nonnull List<Directive> directives, boolean hasMain) {
        this.directives = TreePVector.from(directives);
        this.hasMain = hasMain;
    }

    @Nonnull
    public PVector<Directive> getDirectives() {
        return directives;
    }

    public boolean hasMain() {
        return hasMain;
    }

    /**
     * Returns every include of every branch, in source order,
     * regardless of conditions.
     */
    @Nonnull
    public PVector<Directive.Include> collectIncludes() {
        return collect(TreePVector.<Directive.Include>empty(), directives);
    }

    @Nonnull
    private static PVector<Directive.Include> collect(@Nonnull PVector<Directive.Include> result, @Nonnull List<Directive> directives) {
        for (Directive d : directives) {
            if (d instanceof Directive.Include) {
                result = result.plus((Directive.Include) d);
            } else if (d instanceof Directive.IfBlock) {
                for (ConditionalBranch branch : ((Directive.IfBlock) d).getBranches())
                    result = collect(result, branch.getBody());
            }
        }
        return result;
    }

    /**
     * Returns the includes reachable under the given macros.
     *
     * @see Evaluator#reachableIncludes(SourceInfo, Environment)
     */
    @Nonnull
    public PVector<Directive.Include> collectReachableIncludes(@Nonnull Environment env) {
        return Evaluator.reachableIncludes(this, env);
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        JsonArray a = new JsonArray();
        for (Directive d : directives)
            a.add(d.toJson());
        result.add("directives", a);
        result.addProperty("hasMain", hasMain);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof SourceInfo) {
            SourceInfo o = (SourceInfo) obj;
            return o.hasMain == hasMain && o.directives.equals(directives);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return directives.hashCode() ^ (hasMain ? 1 : 0);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
