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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits the files of one package into groups which must be
 * compiled together.
 *
 * A header and its implementation always share a group. Files
 * whose includes form a cycle are merged into one group. Every
 * file is assigned to exactly one group.
 */
public final class SourceGrouper {

    private static final Logger LOG = LoggerFactory.getLogger(SourceGrouper.class);

    private SourceGrouper() {
    }

    @Nonnull
    public static SortedMap<String, SourceGroup> groupSources(@Nonnull Collection<FileInfo> files) {
        DependencyGraph graph = DependencyGraph.build(files);
        SortedMap<String, DependencyGraph.Node> nodes = graph.getNodes();

        Map<String, String> nodeToGroup = new HashMap<String, String>();
        SortedMap<String, List<String>> components = new TreeMap<String, List<String>>();
        for (List<String> component : graph.findStronglyConnectedComponents()) {
            List<String> sources = new ArrayList<String>();
            for (String id : component)
                sources.addAll(nodes.get(id).sources);
            String name = selectGroupName(sources);
            if (component.size() > 1)
                LOG.debug("Merged {} into group {}", component, name);
            for (String id : component)
                nodeToGroup.put(id, name);
            components.put(name, component);
        }

        SortedMap<String, SourceGroup> groups = new TreeMap<String, SourceGroup>();
        for (Map.Entry<String, List<String>> e : components.entrySet()) {
            String name = e.getKey();
            List<String> component = e.getValue();
            SortedSet<String> sources = new TreeSet<String>();
            SortedSet<String> dependsOn = new TreeSet<String>();
            for (String id : component) {
                DependencyGraph.Node node = nodes.get(id);
                sources.addAll(node.sources);
                for (String target : node.adjacency) {
                    String dep = nodeToGroup.get(target);
                    if (!dep.equals(name))
                        dependsOn.add(dep);
                }
            }
            List<String> subGroups = component.size() > 1 ? component : Collections.<String>emptyList();
            groups.put(name, new SourceGroup(sources, dependsOn, subGroups));
        }

        sourceToGroupIds(groups);
        return Collections.unmodifiableSortedMap(groups);
    }

    /** Groups files by base name, without looking at their includes. */
    @Nonnull
    public static SortedMap<String, SourceGroup> identityGroups(@Nonnull Collection<FileInfo> files) {
        SortedMap<String, SortedSet<String>> sources = new TreeMap<String, SortedSet<String>>();
        for (FileInfo file : files) {
            SortedSet<String> s = sources.get(file.getGroupId());
            if (s == null) {
                s = new TreeSet<String>();
                sources.put(file.getGroupId(), s);
            }
            s.add(file.getName());
        }
        SortedMap<String, SourceGroup> groups = new TreeMap<String, SourceGroup>();
        for (Map.Entry<String, SortedSet<String>> e : sources.entrySet())
            groups.put(e.getKey(), new SourceGroup(e.getValue(), Collections.<String>emptyList(), Collections.<String>emptyList()));
        return Collections.unmodifiableSortedMap(groups);
    }

    /**
     * Names a group after its first header, or its first file if it
     * has no header.
     */
    @Nonnull
    /* pp */ static String selectGroupName(@Nonnull Collection<String> files) {
        SortedSet<String> headers = new TreeSet<String>();
        SortedSet<String> all = new TreeSet<String>();
        for (String file : files) {
            if (IncludePaths.isHeader(file))
                headers.add(file);
            all.add(file);
        }
        if (all.isEmpty())
            throw new InternalException("Empty source group");
        String selected = headers.isEmpty() ? all.first() : headers.first();
        return IncludePaths.groupId(selected);
    }

    /**
     * Returns the group of each file.
     *
     * @throws InternalException if a file is in more than one group.
     */
    @Nonnull
    /* pp */ static Map<String, String> sourceToGroupIds(@Nonnull Map<String, SourceGroup> groups) {
        Map<String, String> result = new HashMap<String, String>();
        for (Map.Entry<String, SourceGroup> e : groups.entrySet()) {
            for (String source : e.getValue().getSources()) {
                String previous = result.put(source, e.getKey());
                if (previous != null)
                    throw new InternalException("Inconsistent source groups, file " + source
                            + " assigned to both groups " + previous + " and " + e.getKey());
            }
        }
        return result;
    }

    @Nonnull
    public static JsonObject toJson(@Nonnull Map<String, SourceGroup> groups) {
        JsonObject result = new JsonObject();
        for (Map.Entry<String, SourceGroup> e : groups.entrySet())
            result.add(e.getKey(), e.getValue().toJson());
        return result;
    }
}
