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

/**
 * How the headers of one package may be named by an #include.
 *
 * This is immutable; each mutator returns a new configuration.
 */
public final class IncludePathConfig {

    /** An additional strip_include_prefix and include_prefix pair. */
    public static final class SearchPath {

        private final String stripIncludePrefix;
        private final String includePrefix;

        public SearchPath(@Nonnull String stripIncludePrefix, @Nonnull String includePrefix) {
            this.stripIncludePrefix = stripIncludePrefix;
            this.includePrefix = includePrefix;
        }

        @Nonnull
        public String getStripIncludePrefix() {
            return stripIncludePrefix;
        }

        @Nonnull
        public String getIncludePrefix() {
            return includePrefix;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof SearchPath) {
                SearchPath o = (SearchPath) obj;
                return o.stripIncludePrefix.equals(stripIncludePrefix) && o.includePrefix.equals(includePrefix);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return stripIncludePrefix.hashCode() * 31 + includePrefix.hashCode();
        }

        @Override
        public String toString() {
            return "SearchPath(strip=" + stripIncludePrefix + ", prefix=" + includePrefix + ")";
        }
    }

    public static final IncludePathConfig DEFAULT = new IncludePathConfig("", "", "", TreePVector.<SearchPath>empty());

    private final String packageRel;
    private final String stripIncludePrefix;
    private final String includePrefix;
    private final PVector<SearchPath> searchPaths;

    private IncludePathConfig(String packageRel, String stripIncludePrefix, String includePrefix, PVector<SearchPath> searchPaths) {
        if (packageRel.startsWith("/"))
            throw new IllegalArgumentException("Package path must be repository-relative: " + packageRel);
        this.packageRel = packageRel;
        this.stripIncludePrefix = stripIncludePrefix;
        this.includePrefix = includePrefix;
        this.searchPaths = searchPaths;
    }

    /** The repository-relative path of the package, "" at the root. */
    @Nonnull
    public String getPackageRel() {
        return packageRel;
    }

    @Nonnull
    public IncludePathConfig withPackageRel(@Nonnull String packageRel) {
        return new IncludePathConfig(packageRel, stripIncludePrefix, includePrefix, searchPaths);
    }

    @Nonnull
    public String getStripIncludePrefix() {
        return stripIncludePrefix;
    }

    @Nonnull
    public IncludePathConfig withStripIncludePrefix(@Nonnull String stripIncludePrefix) {
        return new IncludePathConfig(packageRel, stripIncludePrefix, includePrefix, searchPaths);
    }

    @Nonnull
    public String getIncludePrefix() {
        return includePrefix;
    }

    @Nonnull
    public IncludePathConfig withIncludePrefix(@Nonnull String includePrefix) {
        return new IncludePathConfig(packageRel, stripIncludePrefix, includePrefix, searchPaths);
    }

    @Nonnull
    public PVector<SearchPath> getSearchPaths() {
        return searchPaths;
    }

    @Nonnull
    public IncludePathConfig withSearchPath(@Nonnull SearchPath searchPath) {
        return new IncludePathConfig(packageRel, stripIncludePrefix, includePrefix, searchPaths.plus(searchPath));
    }

    @Override
    public String toString() {
        return "IncludePathConfig(package=" + packageRel
                + ", strip=" + stripIncludePrefix
                + ", prefix=" + includePrefix
                + ", search=" + searchPaths + ")";
    }
}
