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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class IncludePathsTest {

    private static final String LIB = "libs/my_lib";
    private static final String HDR = "libs/my_lib/foo/bar.h";

    @Test
    public void testTransformIncludePath() {
        assertThat(IncludePaths.transformIncludePath(LIB, "", "", HDR)).isEqualTo("libs/my_lib/foo/bar.h");
        assertThat(IncludePaths.transformIncludePath(LIB, "", "extra", HDR)).isEqualTo("extra/foo/bar.h");
        assertThat(IncludePaths.transformIncludePath(LIB, "/libs", "", HDR)).isEqualTo("my_lib/foo/bar.h");
        assertThat(IncludePaths.transformIncludePath(LIB, "/libs", "extra", HDR)).isEqualTo("extra/my_lib/foo/bar.h");
        assertThat(IncludePaths.transformIncludePath(LIB, "foo", "", HDR)).isEqualTo("bar.h");
        assertThat(IncludePaths.transformIncludePath(LIB, "foo", "extra", HDR)).isEqualTo("extra/bar.h");
    }

    @Test
    public void testTrimPrefixMatchesWholeComponents() {
        assertThat(IncludePaths.trimPrefix("libs/my_lib/a.h", "libs")).isEqualTo("my_lib/a.h");
        assertThat(IncludePaths.trimPrefix("libs/my_lib/a.h", "libs/")).isEqualTo("my_lib/a.h");
        assertThat(IncludePaths.trimPrefix("libs/my_lib/a.h", "lib")).isEqualTo("libs/my_lib/a.h");
        assertThat(IncludePaths.trimPrefix("libs", "libs")).isEqualTo("");
        assertThat(IncludePaths.trimPrefix("a.h", "")).isEqualTo("a.h");
    }

    @Test
    public void testClean() {
        assertThat(IncludePaths.clean("")).isEqualTo(".");
        assertThat(IncludePaths.clean("./a.h")).isEqualTo("a.h");
        assertThat(IncludePaths.clean("a//b/./c.h")).isEqualTo("a/b/c.h");
        assertThat(IncludePaths.clean("a/b/../c.h")).isEqualTo("a/c.h");
        assertThat(IncludePaths.clean("../a.h")).isEqualTo("../a.h");
        assertThat(IncludePaths.clean("a/../../b.h")).isEqualTo("../b.h");
        assertThat(IncludePaths.clean("/../a.h")).isEqualTo("/a.h");
        assertThat(IncludePaths.clean("a/..")).isEqualTo(".");
    }

    @Test
    public void testJoin() {
        assertThat(IncludePaths.join("", "a.h")).isEqualTo("a.h");
        assertThat(IncludePaths.join(".", "a.h")).isEqualTo("a.h");
        assertThat(IncludePaths.join("sub", "../a.h")).isEqualTo("a.h");
        assertThat(IncludePaths.join("", "")).isEqualTo("");
    }

    @Test
    public void testNames() {
        assertThat(IncludePaths.dir("a.h")).isEqualTo(".");
        assertThat(IncludePaths.dir("sub/dir/a.h")).isEqualTo("sub/dir");
        assertThat(IncludePaths.base("sub/dir/a.h")).isEqualTo("a.h");
        assertThat(IncludePaths.extension("sub/a.tar.gz")).isEqualTo(".gz");
        assertThat(IncludePaths.extension("sub.d/Makefile")).isEqualTo("");
        assertThat(IncludePaths.groupId("sub/foo.cc")).isEqualTo("foo");
        assertThat(IncludePaths.groupId("README")).isEqualTo("README");
    }

    @Test
    public void testClassification() {
        assertThat(IncludePaths.isHeader("a.h")).isTrue();
        assertThat(IncludePaths.isHeader("a.hpp")).isTrue();
        assertThat(IncludePaths.isHeader("a.c")).isFalse();
        assertThat(IncludePaths.isSource("a.c++")).isTrue();
        assertThat(IncludePaths.isSource("start.S")).isTrue();
        assertThat(IncludePaths.isSource("a.inc")).isFalse();
    }
}
