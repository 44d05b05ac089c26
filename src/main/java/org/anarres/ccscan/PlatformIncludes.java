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

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The platforms under which each include of a file is reachable.
 */
public final class PlatformIncludes {

    private final SortedSet<Platform> platforms;
    private final Map<Directive.Include, SortedSet<Platform>> includes;

    private PlatformIncludes(@Nonnull SortedSet<Platform> platforms, @Nonnull Map<Directive.Include, SortedSet<Platform>> includes) {
        this.platforms = platforms;
        this.includes = includes;
    }

    /**
     * Evaluates the file once per platform, with the platform's
     * predefined macros on top of the given base environment.
     */
    @Nonnull
    public static PlatformIncludes compute(@Nonnull SourceInfo info, @Nonnull Environment base, @Nonnull Collection<Platform> platforms) {
        SortedSet<Platform> all = new TreeSet<Platform>(platforms);
        Map<Directive.Include, SortedSet<Platform>> includes = new LinkedHashMap<Directive.Include, SortedSet<Platform>>();
        for (Directive.Include include : info.collectIncludes())
            if (!includes.containsKey(include))
                includes.put(include, new TreeSet<Platform>());
        for (Platform platform : all) {
            Environment env = base.plus(Platforms.getEnvironment(platform));
            for (Directive.Include include : Evaluator.reachableIncludes(info, env))
                includes.get(include).add(platform);
        }
        return new PlatformIncludes(Collections.unmodifiableSortedSet(all), includes);
    }

    @Nonnull
    public SortedSet<Platform> getPlatforms() {
        return platforms;
    }

    /** Returns each distinct include of the file, in source order. */
    @Nonnull
    public Collection<Directive.Include> getIncludes() {
        return Collections.unmodifiableSet(includes.keySet());
    }

    /**
     * Returns the platforms under which the include is reachable,
     * which are empty for an include this file does not have.
     */
    @Nonnull
    public SortedSet<Platform> getPlatforms(@Nonnull Directive.Include include) {
        SortedSet<Platform> result = includes.get(include);
        if (result == null)
            return Collections.emptySortedSet();
        return Collections.unmodifiableSortedSet(result);
    }

    /** Returns true if the include is reachable under some, but not all, platforms. */
    public boolean isPlatformSpecific(@Nonnull Directive.Include include) {
        int count = getPlatforms(include).size();
        return count > 0 && count < platforms.size();
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        for (Map.Entry<Directive.Include, SortedSet<Platform>> e : includes.entrySet()) {
            JsonArray a = new JsonArray();
            for (Platform platform : e.getValue())
                a.add(new JsonPrimitive(platform.toString()));
            result.add(e.getKey().toString(), a);
        }
        return result;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
