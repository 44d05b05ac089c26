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
import com.google.gson.JsonPrimitive;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.TreeSet;

/**
 * Files which must be compiled as one unit.
 *
 * All lists are sorted.
 */
public final class SourceGroup {

    private final PVector<String> sources;
    private final PVector<String> dependsOn;
    private final PVector<String> subGroups;

    public SourceGroup(@Nonnull Collection<String> sources, @Nonnull Collection<String> dependsOn, @Nonnull Collection<String> subGroups) {
        this.sources = sorted(sources);
        this.dependsOn = sorted(dependsOn);
        this.subGroups = sorted(subGroups);
    }

    @Nonnull
    private static PVector<String> sorted(@Nonnull Collection<String> values) {
        return TreePVector.from(new TreeSet<String>(values));
    }

    /** Returns the file names of this group. */
    @Nonnull
    public PVector<String> getSources() {
        return sources;
    }

    /** Returns the ids of the other groups this group includes from. */
    @Nonnull
    public PVector<String> getDependsOn() {
        return dependsOn;
    }

    /** Returns the ids of the groups merged into this one, or nothing. */
    @Nonnull
    public PVector<String> getSubGroups() {
        return subGroups;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.add("sources", toJson(sources));
        if (!dependsOn.isEmpty())
            result.add("dependsOn", toJson(dependsOn));
        if (!subGroups.isEmpty())
            result.add("subGroups", toJson(subGroups));
        return result;
    }

    @Nonnull
    private static JsonArray toJson(@Nonnull PVector<String> values) {
        JsonArray a = new JsonArray();
        for (String value : values)
            a.add(new JsonPrimitive(value));
        return a;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof SourceGroup) {
            SourceGroup o = (SourceGroup) obj;
            return o.sources.equals(sources)
                    && o.dependsOn.equals(dependsOn)
                    && o.subGroups.equals(subGroups);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return sources.hashCode() ^ dependsOn.hashCode() ^ subGroups.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
