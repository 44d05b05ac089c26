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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * One arm of an {@link Directive.IfBlock}.
 */
public final class ConditionalBranch {

    public enum Kind {
        /** #if, #ifdef, #ifndef */
        IF,
        /** #elif, #elifdef, #elifndef */
        ELIF,
        /** #else */
        ELSE
    }

    private final Kind kind;
    private final Expr condition;
    private final PVector<Directive> body;

    public ConditionalBranch(@Nonnull Kind kind, @CheckForNull Expr condition, @Nonnull List<Directive> body) {
        if ((kind == Kind.ELSE) != (condition == null))
            throw new IllegalArgumentException("Only an ELSE branch has no condition: " + kind + " " + condition);
        this.kind = kind;
        this.condition = condition;
        this.body = TreePVector.from(body);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /** Returns the condition, or null for an ELSE branch. */
    @CheckForNull
    public Expr getCondition() {
        return condition;
    }

    @Nonnull
    public PVector<Directive> getBody() {
        return body;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", kind.name());
        if (condition != null)
            result.addProperty("condition", condition.toString());
        JsonArray a = new JsonArray();
        for (Directive d : body)
            a.add(d.toJson());
        result.add("body", a);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ConditionalBranch) {
            ConditionalBranch o = (ConditionalBranch) obj;
            return o.kind == kind
                    && Objects.equals(o.condition, condition)
                    && o.body.equals(body);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() ^ Objects.hashCode(condition) ^ body.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("#").append(kind.name().toLowerCase());
        if (condition != null)
            buf.append(' ').append(condition);
        buf.append('\n');
        for (Directive d : body)
            buf.append(d).append('\n');
        return buf.toString();
    }
}
