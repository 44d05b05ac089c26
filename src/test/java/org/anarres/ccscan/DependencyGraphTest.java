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

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DependencyGraphTest {

    @Test
    public void testNodesShareBaseName() {
        DependencyGraph graph = DependencyGraph.build(Arrays.asList(
                FileInfo.create("x.h"), FileInfo.create("x.cc", "x.h"), FileInfo.create("y.c", "x.h")));
        assertThat(graph.getNodes()).containsOnlyKeys("x", "y");
        assertThat(graph.getNode("x").sources).containsExactly("x.cc", "x.h");
        assertThat(graph.getNode("x").adjacency).containsExactly("x");
        assertThat(graph.getNode("y").adjacency).containsExactly("x");
        assertThat(graph.getNode("z")).isNull();
    }

    @Test
    public void testComponentsComeAfterTheirDependencies() {
        DependencyGraph graph = DependencyGraph.build(Arrays.asList(
                FileInfo.create("top.h", "mid.h"),
                FileInfo.create("mid.h", "low.h", "loop.h"),
                FileInfo.create("loop.h", "mid.h"),
                FileInfo.create("low.h")));
        List<List<String>> components = graph.findStronglyConnectedComponents();
        assertThat(components).containsExactly(
                Arrays.asList("low"),
                Arrays.asList("loop", "mid"),
                Arrays.asList("top"));
    }
}
