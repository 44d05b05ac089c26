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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The local include graph of one package.
 *
 * Each node is a group id, the base name of its files without
 * extension, so a header and its implementation share a node. An
 * edge means a file of one node includes a file of another.
 */
/* pp */ final class DependencyGraph {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraph.class);

    /* pp */ static final class Node {

        final String id;
        final SortedSet<String> sources = new TreeSet<String>();
        final SortedSet<String> adjacency = new TreeSet<String>();

        Node(String id) {
            this.id = id;
        }

        @Override
        public String toString() {
            return id + sources + " -> " + adjacency;
        }
    }

    private final SortedMap<String, Node> nodes;

    private DependencyGraph(@Nonnull SortedMap<String, Node> nodes) {
        this.nodes = nodes;
    }

    @Nonnull
    public static DependencyGraph build(@Nonnull Collection<FileInfo> files) {
        List<FileInfo> sorted = new ArrayList<FileInfo>(files);
        Collections.sort(sorted, new Comparator<FileInfo>() {
            @Override
            public int compare(FileInfo a, FileInfo b) {
                return a.getName().compareTo(b.getName());
            }
        });

        SortedMap<String, Node> nodes = new TreeMap<String, Node>();
        Map<String, String> variants = new HashMap<String, String>();
        for (FileInfo file : sorted) {
            String id = file.getGroupId();
            Node node = nodes.get(id);
            if (node == null) {
                node = new Node(id);
                nodes.put(id, node);
            }
            node.sources.add(file.getName());
            for (String variant : file.getPathVariants())
                variants.put(variant, id);
        }

        for (FileInfo file : sorted) {
            Node node = nodes.get(file.getGroupId());
            for (List<String> candidates : file.getIncludeCandidates()) {
                for (String candidate : candidates) {
                    String target = variants.get(candidate);
                    if (target != null) {
                        node.adjacency.add(target);
                        break;
                    }
                }
            }
        }

        return new DependencyGraph(nodes);
    }

    @Nonnull
    public SortedMap<String, Node> getNodes() {
        return Collections.unmodifiableSortedMap(nodes);
    }

    @CheckForNull
    public Node getNode(@Nonnull String id) {
        return nodes.get(id);
    }

    /**
     * Returns the strongly connected components, by Tarjan's algorithm.
     *
     * Components are returned in reverse topological order: every
     * component comes after the components it depends on.
     */
    @Nonnull
    public List<List<String>> findStronglyConnectedComponents() {
        String[] ids = nodes.keySet().toArray(new String[nodes.size()]);
        Map<String, Integer> indexOf = new HashMap<String, Integer>();
        for (int i = 0; i < ids.length; i++)
            indexOf.put(ids[i], i);
        int[][] adjacency = new int[ids.length][];
        for (int i = 0; i < ids.length; i++) {
            SortedSet<String> targets = nodes.get(ids[i]).adjacency;
            adjacency[i] = new int[targets.size()];
            int j = 0;
            for (String target : targets)
                adjacency[i][j++] = indexOf.get(target);
        }
        return new Tarjan(ids, adjacency).run();
    }

    private static final class Tarjan {

        private final String[] ids;
        private final int[][] adjacency;
        private final int[] index;
        private final int[] lowLink;
        private final boolean[] onStack;
        private final int[] next;
        private final Deque<Integer> stack = new ArrayDeque<Integer>();
        private final List<List<String>> components = new ArrayList<List<String>>();
        private int counter = 0;

        Tarjan(String[] ids, int[][] adjacency) {
            this.ids = ids;
            this.adjacency = adjacency;
            this.index = new int[ids.length];
            this.lowLink = new int[ids.length];
            this.onStack = new boolean[ids.length];
            this.next = new int[ids.length];
            Arrays.fill(index, -1);
        }

        List<List<String>> run() {
            for (int v = 0; v < ids.length; v++)
                if (index[v] < 0)
                    connect(v);
            return components;
        }

        /* Iterative: an include chain may be thousands of files long. */
        private void connect(int root) {
            Deque<Integer> calls = new ArrayDeque<Integer>();
            enter(root);
            calls.push(root);
            while (!calls.isEmpty()) {
                int v = calls.peek();
                if (next[v] < adjacency[v].length) {
                    int w = adjacency[v][next[v]++];
                    if (index[w] < 0) {
                        enter(w);
                        calls.push(w);
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], index[w]);
                    }
                    continue;
                }

                calls.pop();
                if (!calls.isEmpty()) {
                    int u = calls.peek();
                    lowLink[u] = Math.min(lowLink[u], lowLink[v]);
                }
                if (lowLink[v] == index[v])
                    emit(v);
            }
        }

        private void enter(int v) {
            index[v] = counter;
            lowLink[v] = counter;
            counter++;
            stack.push(v);
            onStack[v] = true;
        }

        private void emit(int v) {
            List<String> component = new ArrayList<String>();
            for (;;) {
                int w = stack.pop();
                onStack[w] = false;
                component.add(ids[w]);
                if (w == v)
                    break;
            }
            Collections.sort(component);
            if (component.size() > 1)
                LOG.debug("Cyclic includes between {}", component);
            components.add(component);
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph" + nodes.values();
    }
}
