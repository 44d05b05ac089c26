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
 * A parsed #if or #elif condition.
 *
 * Every expression has an integer value; a condition holds when
 * its value is nonzero.
 */
public abstract class Expr {

    private Expr() {
    }

    /** Computes the value of this expression under the given macros. */
    public abstract long evaluate(@Nonnull Environment env);

    /** Returns true if this expression is nonzero under the given macros. */
    public boolean test(@Nonnull Environment env) {
        return evaluate(env) != 0;
    }

    private static long bool(boolean value) {
        return value ? 1 : 0;
    }

    /** defined(NAME) or defined NAME. */
    public static final class Defined extends Expr {

        private final String name;

        public Defined(@Nonnull String name) {
            this.name = name;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        public long evaluate(Environment env) {
            return bool(env.isDefined(name));
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Defined && ((Defined) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "defined(" + name + ")";
        }
    }

    public static final class Not extends Expr {

        private final Expr expr;

        public Not(@Nonnull Expr expr) {
            this.expr = expr;
        }

        @Nonnull
        public Expr getExpr() {
            return expr;
        }

        @Override
        public long evaluate(Environment env) {
            return bool(!expr.test(env));
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Not && ((Not) obj).expr.equals(expr);
        }

        @Override
        public int hashCode() {
            return ~expr.hashCode();
        }

        @Override
        public String toString() {
            return "!" + expr;
        }
    }

    public static final class And extends Expr {

        private final Expr left;
        private final Expr right;

        public And(@Nonnull Expr left, @Nonnull Expr right) {
            this.left = left;
            this.right = right;
        }

        @Nonnull
        public Expr getLeft() {
            return left;
        }

        @Nonnull
        public Expr getRight() {
            return right;
        }

        @Override
        public long evaluate(Environment env) {
            return bool(left.test(env) && right.test(env));
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof And) {
                And o = (And) obj;
                return o.left.equals(left) && o.right.equals(right);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return 31 * left.hashCode() + right.hashCode();
        }

        @Override
        public String toString() {
            return "(" + left + " && " + right + ")";
        }
    }

    public static final class Or extends Expr {

        private final Expr left;
        private final Expr right;

        public Or(@Nonnull Expr left, @Nonnull Expr right) {
            this.left = left;
            this.right = right;
        }

        @Nonnull
        public Expr getLeft() {
            return left;
        }

        @Nonnull
        public Expr getRight() {
            return right;
        }

        @Override
        public long evaluate(Environment env) {
            return bool(left.test(env) || right.test(env));
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Or) {
                Or o = (Or) obj;
                return o.left.equals(left) && o.right.equals(right);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return 37 * left.hashCode() + right.hashCode();
        }

        @Override
        public String toString() {
            return "(" + left + " || " + right + ")";
        }
    }

    public static final class Compare extends Expr {

        public enum Operator {
            EQ("=="),
            NE("!="),
            LT("<"),
            LE("<="),
            GT(">"),
            GE(">=");

            private final String text;

            private Operator(String text) {
                this.text = text;
            }

            @Nonnull
            public String getText() {
                return text;
            }

            /* pp */ boolean apply(long l, long r) {
                switch (this) {
                    case EQ:
                        return l == r;
                    case NE:
                        return l != r;
                    case LT:
                        return l < r;
                    case LE:
                        return l <= r;
                    case GT:
                        return l > r;
                    case GE:
                        return l >= r;
                    default:
                        throw new InternalException("Unknown comparison " + this);
                }
            }
        }

        private final Expr left;
        private final Operator op;
        private final Expr right;

        public Compare(@Nonnull Expr left, @Nonnull Operator op, @Nonnull Expr right) {
            this.left = left;
            this.op = op;
            this.right = right;
        }

        @Nonnull
        public Expr getLeft() {
            return left;
        }

        @Nonnull
        public Operator getOperator() {
            return op;
        }

        @Nonnull
        public Expr getRight() {
            return right;
        }

        @Override
        public long evaluate(Environment env) {
            return bool(op.apply(left.evaluate(env), right.evaluate(env)));
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Compare) {
                Compare o = (Compare) obj;
                return o.op == op && o.left.equals(left) && o.right.equals(right);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * left.hashCode() + op.hashCode()) + right.hashCode();
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.getText() + " " + right + ")";
        }
    }

    /**
     * A function-like macro invocation, e.g. __has_include("x.h").
     *
     * Macros are never expanded, so an invocation always evaluates
     * to 1. Includes guarded by one are kept rather than lost.
     */
    public static final class Apply extends Expr {

        private final String name;
        private final PVector<Expr> args;

        public Apply(@Nonnull String name, @Nonnull List<Expr> args) {
            this.name = name;
            this.args = TreePVector.from(args);
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public PVector<Expr> getArgs() {
            return args;
        }

        @Override
        public long evaluate(Environment env) {
            return 1;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Apply) {
                Apply o = (Apply) obj;
                return o.name.equals(name) && o.args.equals(args);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return name.hashCode() ^ args.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder(name).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0)
                    buf.append(", ");
                buf.append(args.get(i));
            }
            return buf.append(')').toString();
        }
    }

    /** A macro name. Its value is 0 when it is not defined. */
    public static final class Ident extends Expr {

        private final String name;

        public Ident(@Nonnull String name) {
            this.name = name;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        public long evaluate(Environment env) {
            return env.valueOf(name);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Ident && ((Ident) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode() * 7;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class ConstantInt extends Expr {

        private final long value;

        public ConstantInt(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public long evaluate(Environment env) {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof ConstantInt && ((ConstantInt) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }
}
