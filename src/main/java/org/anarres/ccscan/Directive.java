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
import java.util.List;

/**
 * A preprocessor directive extracted by the {@link Parser}.
 *
 * The subclasses nested here are the only kinds of directive.
 * Directives are immutable.
 */
public abstract class Directive {

    private Directive() {
    }

    @Nonnull
    public abstract JsonObject toJson();

    /** An #include or #include_next directive. */
    public static final class Include extends Directive {

        private final String path;
        private final boolean system;
        private final boolean next;

        public Include(@Nonnull String path, boolean system, boolean next) {
            this.path = path;
            this.system = system;
            this.next = next;
        }

        public Include(@Nonnull String path, boolean system) {
            this(path, system, false);
        }

        @Nonnull
        public String getPath() {
            return path;
        }

        /** Returns true for &lt;angle&gt; includes, false for "quoted" ones. */
        public boolean isSystem() {
            return system;
        }

        /** Returns true for #include_next. */
        public boolean isNext() {
            return next;
        }

        @Override
        public JsonObject toJson() {
            JsonObject result = new JsonObject();
            result.addProperty("include", path);
            if (system)
                result.addProperty("system", true);
            if (next)
                result.addProperty("next", true);
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Include) {
                Include o = (Include) obj;
                return o.path.equals(path) && o.system == system && o.next == next;
            }
            return false;
        }

        @Override
        public int hashCode() {
            return path.hashCode() ^ (system ? 1 : 0) ^ (next ? 2 : 0);
        }

        @Override
        public String toString() {
            String keyword = next ? "#include_next " : "#include ";
            if (system)
                return keyword + "<" + path + ">";
            return keyword + "\"" + path + "\"";
        }
    }

    /** A #define directive. The body is kept as unexpanded token text. */
    public static final class Define extends Directive {

        private final String name;
        private final boolean functionLike;
        private final PVector<String> args;
        private final PVector<String> body;

        public Define(@Nonnull String name, boolean functionLike, @Nonnull List<String> args, @Nonnull List<String> body) {
            this.name = name;
            this.functionLike = functionLike;
            this.args = TreePVector.from(args);
            this.body = TreePVector.from(body);
        }

        /** Creates an object-like macro. */
        public Define(@Nonnull String name, @Nonnull List<String> body) {
            this(name, false, TreePVector.<String>empty(), body);
        }

        @Nonnull
        public String getName() {
            return name;
        }

        /** Returns true if a parenthesised argument list followed the name. */
        public boolean isFunctionLike() {
            return functionLike;
        }

        @Nonnull
        public PVector<String> getArgs() {
            return args;
        }

        @Nonnull
        public PVector<String> getBody() {
            return body;
        }

        @Override
        public JsonObject toJson() {
            JsonObject result = new JsonObject();
            result.addProperty("define", name);
            if (functionLike) {
                JsonArray a = new JsonArray();
                for (String arg : args)
                    a.add(new JsonPrimitive(arg));
                result.add("args", a);
            }
            JsonArray b = new JsonArray();
            for (String tok : body)
                b.add(new JsonPrimitive(tok));
            result.add("body", b);
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Define) {
                Define o = (Define) obj;
                return o.name.equals(name)
                        && o.functionLike == functionLike
                        && o.args.equals(args)
                        && o.body.equals(body);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return name.hashCode() ^ args.hashCode() ^ body.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder("#define ").append(name);
            if (functionLike) {
                buf.append('(');
                for (int i = 0; i < args.size(); i++) {
                    if (i > 0)
                        buf.append(", ");
                    buf.append(args.get(i));
                }
                buf.append(')');
            }
            for (String tok : body)
                buf.append(' ').append(tok);
            return buf.toString();
        }
    }

    /** An #undef directive. */
    public static final class Undefine extends Directive {

        private final String name;

        public Undefine(@Nonnull String name) {
            this.name = name;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        public JsonObject toJson() {
            JsonObject result = new JsonObject();
            result.addProperty("undef", name);
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Undefine && ((Undefine) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return ~name.hashCode();
        }

        @Override
        public String toString() {
            return "#undef " + name;
        }
    }

    /**
     * A conditional block: #if, #ifdef or #ifndef with its #elif
     * and #else branches, up to the matching #endif.
     */
    public static final class IfBlock extends Directive {

        private final PVector<ConditionalBranch> branches;

        public IfBlock(@Nonnull List<ConditionalBranch> branches) {
            this.branches = TreePVector.from(branches);
        }

        /** Returns the branches in source order. The first is an IF branch. */
        @Nonnull
        public PVector<ConditionalBranch> getBranches() {
            return branches;
        }

        @Override
        public JsonObject toJson() {
            JsonObject result = new JsonObject();
            JsonArray a = new JsonArray();
            for (ConditionalBranch branch : branches)
                a.add(branch.toJson());
            result.add("branches", a);
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IfBlock && ((IfBlock) obj).branches.equals(branches);
        }

        @Override
        public int hashCode() {
            return branches.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder();
            for (ConditionalBranch branch : branches)
                buf.append(branch);
            return buf.append("#endif").toString();
        }
    }
}
