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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FileInfoTest {

    @Test
    public void testDefaults() {
        FileInfo info = FileInfo.create("sub/a.h", "b.h", "./c.h");
        assertThat(info.getName()).isEqualTo("sub/a.h");
        assertThat(info.isHeader()).isTrue();
        assertThat(info.getGroupId()).isEqualTo("a");
        assertThat(info.getPathVariants()).containsExactly("sub/a.h");
        assertThat(info.getIncludeCandidates()).isEqualTo(Arrays.asList(
                Arrays.asList("b.h", "sub/b.h"),
                Arrays.asList("c.h", "sub/c.h")));
    }

    @Test
    public void testSystemIncludesAreDropped() {
        FileInfo info = FileInfo.create("a.c", Arrays.asList(
                new Directive.Include("stdio.h", true),
                new Directive.Include("a.h", false)), IncludePathConfig.DEFAULT);
        assertThat(info.getIncludeCandidates()).isEqualTo(Arrays.asList(Arrays.asList("a.h")));
    }

    @Test
    public void testPackageVariants() {
        IncludePathConfig config = IncludePathConfig.DEFAULT
                .withPackageRel("libs/my_lib")
                .withIncludePrefix("mylib")
                .withSearchPath(new IncludePathConfig.SearchPath("/libs", ""));
        FileInfo info = FileInfo.create("foo/bar.h", Arrays.<Directive.Include>asList(), config);
        assertThat(info.getPathVariants()).containsExactly(
                "libs/my_lib/foo/bar.h",
                "mylib/foo/bar.h",
                "foo/bar.h",
                "my_lib/foo/bar.h");
    }

    @Test
    public void testAbsolutePackageRejected() {
        assertThatThrownBy(() -> IncludePathConfig.DEFAULT.withPackageRel("/libs"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
