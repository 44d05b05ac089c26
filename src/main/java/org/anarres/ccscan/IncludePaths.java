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

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Slash-separated, repository-relative path arithmetic for include
 * paths and file names.
 */
public final class IncludePaths {

    public static final List<String> HEADER_EXTENSIONS = Collections.unmodifiableList(Arrays.asList(
            ".h", ".hh", ".hpp", ".hxx"));
    public static final List<String> SOURCE_EXTENSIONS = Collections.unmodifiableList(Arrays.asList(
            ".c", ".cc", ".cpp", ".cxx", ".c++", ".S"));

    private IncludePaths() {
    }

    /**
     * Returns the path under which a header of a package is included
     * once strip_include_prefix and include_prefix are applied.
     *
     * An absolute strip prefix is relative to the repository root, a
     * relative one to the package. An include prefix alone strips the
     * package path.
     *
     * @param packageRel the repository-relative path of the package.
     * @param stripIncludePrefix the prefix to strip, or "".
     * @param includePrefix the prefix to add, or "".
     * @param headerRel the repository-relative path of the header.
     */
    @Nonnull
    public static String transformIncludePath(@Nonnull String packageRel,
            @Nonnull String stripIncludePrefix, @Nonnull String includePrefix,
            @Nonnull String headerRel) {
        String strip;
        if (stripIncludePrefix.startsWith("/"))
            strip = stripIncludePrefix.substring(1);
        else if (!stripIncludePrefix.isEmpty())
            strip = join(packageRel, stripIncludePrefix);
        else if (!includePrefix.isEmpty())
            strip = packageRel;
        else
            strip = "";
        return join(includePrefix, trimPrefix(headerRel, strip));
    }

    /**
     * Removes a leading path prefix, matching whole components only.
     */
    @Nonnull
    public static String trimPrefix(@Nonnull String path, @Nonnull String prefix) {
        if (prefix.isEmpty())
            return path;
        if (path.equals(prefix))
            return "";
        if (path.startsWith(prefix) && (prefix.endsWith("/") || path.charAt(prefix.length()) == '/')) {
            String rest = path.substring(prefix.length());
            while (rest.startsWith("/"))
                rest = rest.substring(1);
            return rest;
        }
        return path;
    }

    /** Joins the non-empty elements with '/' and cleans the result. */
    @Nonnull
    public static String join(@Nonnull String... elements) {
        StringBuilder buf = new StringBuilder();
        for (String element : elements) {
            if (element.isEmpty())
                continue;
            if (buf.length() > 0)
                buf.append('/');
            buf.append(element);
        }
        if (buf.length() == 0)
            return "";
        return clean(buf.toString());
    }

    /**
     * Returns the shortest equivalent path: empty and "." components
     * are removed and ".." cancels the preceding component.
     */
    @Nonnull
    public static String clean(@Nonnull String path) {
        if (path.isEmpty())
            return ".";
        boolean rooted = path.startsWith("/");
        Deque<String> parts = new ArrayDeque<String>();
        for (String part : path.split("/")) {
            if (part.isEmpty() || part.equals("."))
                continue;
            if (part.equals("..")) {
                if (!parts.isEmpty() && !parts.peekLast().equals(".."))
                    parts.removeLast();
                else if (!rooted)
                    parts.addLast(part);
                continue;
            }
            parts.addLast(part);
        }
        StringBuilder buf = new StringBuilder();
        if (rooted)
            buf.append('/');
        for (Iterator<String> it = parts.iterator(); it.hasNext();) {
            buf.append(it.next());
            if (it.hasNext())
                buf.append('/');
        }
        if (buf.length() == 0)
            return ".";
        return buf.toString();
    }

    /** Returns all but the last component, or "." if there is only one. */
    @Nonnull
    public static String dir(@Nonnull String path) {
        int idx = path.lastIndexOf('/');
        if (idx < 0)
            return ".";
        return clean(path.substring(0, idx + 1));
    }

    /** Returns the last component. */
    @Nonnull
    public static String base(@Nonnull String path) {
        int idx = path.lastIndexOf('/');
        return path.substring(idx + 1);
    }

    /** Returns the extension of the last component, with its dot, or "". */
    @Nonnull
    public static String extension(@Nonnull String path) {
        String base = base(path);
        int idx = base.lastIndexOf('.');
        return idx < 0 ? "" : base.substring(idx);
    }

    /** Returns the base name without its extension. */
    @Nonnull
    public static String groupId(@Nonnull String name) {
        String base = base(name);
        return base.substring(0, base.length() - extension(base).length());
    }

    public static boolean isHeader(@Nonnull String name) {
        return HEADER_EXTENSIONS.contains(extension(name));
    }

    public static boolean isSource(@Nonnull String name) {
        return SOURCE_EXTENSIONS.contains(extension(name));
    }
}
