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

import com.google.gson.JsonObject;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * An immutable set of macro definitions with integer values.
 *
 * Every mutator returns a new Environment and leaves this one
 * unchanged.
 */
public final class Environment {

    private static final Environment EMPTY = new Environment(HashTreePMap.<String, Long>empty());

    private final PMap<String, Long> macros;

    private Environment(@Nonnull PMap<String, Long> macros) {
        this.macros = macros;
    }

    @Nonnull
    public static Environment empty() {
        return EMPTY;
    }

    @Nonnull
    public static Environment of(@Nonnull Map<String, ? extends Number> macros) {
        PMap<String, Long> m = HashTreePMap.empty();
        for (Map.Entry<String, ? extends Number> e : macros.entrySet())
            m = m.plus(e.getKey(), e.getValue().longValue());
        return new Environment(m);
    }

    /**
     * Parses command line style definitions.
     *
     * Each definition is NAME or NAME=VALUE, optionally prefixed by
     * -D. NAME must be an identifier and VALUE an integer literal. A
     * definition without a value defines NAME as 1.
     *
     * @throws IllegalArgumentException listing every invalid definition.
     */
    @Nonnull
    public static Environment parse(@Nonnull Iterable<String> definitions) {
        PMap<String, Long> m = HashTreePMap.empty();
        List<String> errors = new ArrayList<String>();
        for (String definition : definitions) {
            String d = definition.startsWith("-D") ? definition.substring(2) : definition;
            String name = d;
            String raw = "";
            int idx = d.indexOf('=');
            if (idx >= 0) {
                name = d.substring(0, idx);
                raw = d.substring(idx + 1);
            }
            if (!Literals.isIdentifier(name)) {
                errors.add("invalid macro name \"" + name + "\"");
                continue;
            }
            if (raw.isEmpty()) {
                m = m.plus(name, 1L);
                continue;
            }
            if (!Literals.isInteger(raw)) {
                errors.add("macro " + name + "=" + raw + ", only integer literal values are allowed");
                continue;
            }
            try {
                m = m.plus(name, Literals.parseInteger(raw));
            } catch (NumberFormatException e) {
                errors.add("macro " + name + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty())
            throw new IllegalArgumentException("Invalid macro definitions: " + String.join("; ", errors));
        return new Environment(m);
    }

    @Nonnull
    public Environment define(@Nonnull String name, long value) {
        return new Environment(macros.plus(name, value));
    }

    @Nonnull
    public Environment undefine(@Nonnull String name) {
        if (!macros.containsKey(name))
            return this;
        return new Environment(macros.minus(name));
    }

    /** Returns a new Environment with the definitions of both; other wins. */
    @Nonnull
    public Environment plus(@Nonnull Environment other) {
        return new Environment(macros.plusAll(other.macros));
    }

    public boolean isDefined(@Nonnull String name) {
        return macros.containsKey(name);
    }

    /** Returns the value of the macro, or 0 if it is not defined. */
    public long valueOf(@Nonnull String name) {
        Long value = macros.get(name);
        return value == null ? 0 : value.longValue();
    }

    @Nonnull
    public Map<String, Long> getMacros() {
        return macros;
    }

    public int size() {
        return macros.size();
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        for (Map.Entry<String, Long> e : new TreeMap<String, Long>(macros).entrySet())
            result.addProperty(e.getKey(), e.getValue());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Environment)
            return ((Environment) obj).macros.equals(macros);
        return false;
    }

    @Override
    public int hashCode() {
        return macros.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
