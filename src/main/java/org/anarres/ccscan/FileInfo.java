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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A file of one package, as seen by the {@link SourceGrouper}.
 *
 * The name is relative to the package and may contain slashes.
 */
public final class FileInfo {

    private final String name;
    private final PVector<String> pathVariants;
    private final PVector<PVector<String>> includeCandidates;

    /**
     * @param pathVariants every path under which this file may be included.
     * @param includeCandidates for each local include of this file,
     * the paths it may refer to, most likely first.
     */
    public FileInfo(@Nonnull String name, @Nonnull List<String> pathVariants, @Nonnull List<? extends List<String>> includeCandidates) {
        this.name = name;
        this.pathVariants = TreePVector.from(pathVariants);
        PVector<PVector<String>> candidates = TreePVector.empty();
        for (List<String> c : includeCandidates)
            candidates = candidates.plus(TreePVector.from(c));
        this.includeCandidates = candidates;
    }

    /**
     * Describes a file of the package named by the configuration.
     *
     * System includes are dropped. A quoted include may name a path
     * as written or relative to the directory of the including file.
     */
    @Nonnull
    public static FileInfo create(@Nonnull String name, @Nonnull List<Directive.Include> includes, @Nonnull IncludePathConfig config) {
        String rel = config.getPackageRel();
        String fullRel = IncludePaths.join(rel, name);

        Set<String> variants = new LinkedHashSet<String>();
        variants.add(fullRel);
        variants.add(IncludePaths.transformIncludePath(rel, config.getStripIncludePrefix(), config.getIncludePrefix(), fullRel));
        variants.add(name);
        for (IncludePathConfig.SearchPath search : config.getSearchPaths())
            variants.add(IncludePaths.transformIncludePath(rel, search.getStripIncludePrefix(), search.getIncludePrefix(), fullRel));

        List<List<String>> candidates = new ArrayList<List<String>>();
        for (Directive.Include include : includes) {
            if (include.isSystem())
                continue;
            String path = IncludePaths.clean(include.getPath());
            Set<String> c = new LinkedHashSet<String>();
            c.add(path);
            c.add(IncludePaths.join(IncludePaths.dir(name), path));
            candidates.add(new ArrayList<String>(c));
        }
        return new FileInfo(name, new ArrayList<String>(variants), candidates);
    }

    /** Describes a file at the repository root with the given quoted includes. */
    @Nonnull
    public static FileInfo create(@Nonnull String name, @Nonnull String... includes) {
        List<Directive.Include> list = new ArrayList<Directive.Include>();
        for (String include : includes)
            list.add(new Directive.Include(include, false));
        return create(name, list, IncludePathConfig.DEFAULT);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public boolean isHeader() {
        return IncludePaths.isHeader(name);
    }

    /** Returns the base name without extension. */
    @Nonnull
    public String getGroupId() {
        return IncludePaths.groupId(name);
    }

    @Nonnull
    public PVector<String> getPathVariants() {
        return pathVariants;
    }

    @Nonnull
    public PVector<PVector<String>> getIncludeCandidates() {
        return includeCandidates;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof FileInfo) {
            FileInfo o = (FileInfo) obj;
            return o.name.equals(name)
                    && o.pathVariants.equals(pathVariants)
                    && o.includeCandidates.equals(includeCandidates);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + " " + pathVariants + " -> " + includeCandidates;
    }
}
