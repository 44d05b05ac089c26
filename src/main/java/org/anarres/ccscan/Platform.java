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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A target platform: an operating system and a CPU architecture.
 *
 * Either half may be absent, meaning any. The names follow the
 * Bazel platforms repository, so "linux/x86_64" or "osx/aarch64".
 */
public final class Platform implements Comparable<Platform> {

    public enum OS {
        ANDROID("android"),
        CHROMIUMOS("chromiumos"),
        EMSCRIPTEN("emscripten"),
        FREEBSD("freebsd"),
        FUCHSIA("fuchsia"),
        HAIKU("haiku"),
        IOS("ios"),
        LINUX("linux"),
        NETBSD("netbsd"),
        NIXOS("nixos"),
        /** Bare metal. */
        NONE("none"),
        OPENBSD("openbsd"),
        OSX("osx"),
        QNX("qnx"),
        TVOS("tvos"),
        UEFI("uefi"),
        VISIONOS("visionos"),
        VXWORKS("vxworks"),
        WASI("wasi"),
        WATCHOS("watchos"),
        WINDOWS("windows");

        private final String id;

        private OS(String id) {
            this.id = id;
        }

        @Nonnull
        public String getId() {
            return id;
        }

        /**
         * @throws IllegalArgumentException if the name is neither an
         * operating system nor an alias of one.
         */
        @Nonnull
        public static OS forName(@Nonnull String name) {
            if ("macos".equals(name))
                return OSX;
            for (OS os : values())
                if (os.id.equals(name))
                    return os;
            throw new IllegalArgumentException("Unknown OS " + name);
        }

        @Override
        public String toString() {
            return id;
        }
    }

    public enum Arch {
        AARCH32("aarch32"),
        AARCH64("aarch64"),
        ARM64_32("arm64_32"),
        ARM64E("arm64e"),
        ARMV6_M("armv6-m"),
        ARMV7("armv7"),
        ARMV7E_M("armv7e-m"),
        ARMV7E_MF("armv7e-mf"),
        ARMV7K("armv7k"),
        ARMV7_M("armv7-m"),
        ARMV8_M("armv8-m"),
        CORTEX_R52("cortex-r52"),
        CORTEX_R82("cortex-r82"),
        I386("i386"),
        MIPS64("mips64"),
        PPC("ppc"),
        PPC32("ppc32"),
        PPC64LE("ppc64le"),
        RISCV32("riscv32"),
        RISCV64("riscv64"),
        S390X("s390x"),
        WASM32("wasm32"),
        WASM64("wasm64"),
        X86_32("x86_32"),
        X86_64("x86_64");

        private final String id;

        private Arch(String id) {
            this.id = id;
        }

        @Nonnull
        public String getId() {
            return id;
        }

        /**
         * @throws IllegalArgumentException if the name is neither an
         * architecture nor an alias of one.
         */
        @Nonnull
        public static Arch forName(@Nonnull String name) {
            if ("arm".equals(name))
                return AARCH32;
            if ("arm64".equals(name))
                return AARCH64;
            if ("amd64".equals(name))
                return X86_64;
            for (Arch arch : values())
                if (arch.id.equals(name))
                    return arch;
            throw new IllegalArgumentException("Unknown architecture " + name);
        }

        @Override
        public String toString() {
            return id;
        }
    }

    private final OS os;
    private final Arch arch;

    private Platform(@CheckForNull OS os, @CheckForNull Arch arch) {
        this.os = os;
        this.arch = arch;
    }

    @Nonnull
    public static Platform of(@CheckForNull OS os, @CheckForNull Arch arch) {
        if (os == null && arch == null)
            throw new IllegalArgumentException("A platform needs an OS or an architecture");
        return new Platform(os, arch);
    }

    /**
     * Parses "os/arch", a bare "os" or "/arch", accepting aliases.
     *
     * @throws IllegalArgumentException for an unknown name.
     */
    @Nonnull
    public static Platform parse(@Nonnull String text) {
        int idx = text.indexOf('/');
        if (idx < 0)
            return of(OS.forName(text), null);
        String os = text.substring(0, idx);
        return of(os.isEmpty() ? null : OS.forName(os), Arch.forName(text.substring(idx + 1)));
    }

    @CheckForNull
    public OS getOS() {
        return os;
    }

    @CheckForNull
    public Arch getArch() {
        return arch;
    }

    private static int compare(@CheckForNull String a, @CheckForNull String b) {
        if (a == null)
            return b == null ? 0 : -1;
        if (b == null)
            return 1;
        return a.compareTo(b);
    }

    /** Orders by OS name, then by architecture name. */
    @Override
    public int compareTo(Platform o) {
        int c = compare(os == null ? null : os.getId(), o.os == null ? null : o.os.getId());
        if (c != 0)
            return c;
        return compare(arch == null ? null : arch.getId(), o.arch == null ? null : o.arch.getId());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Platform) {
            Platform o = (Platform) obj;
            return o.os == os && o.arch == arch;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(os) * 31 + Objects.hashCode(arch);
    }

    @Override
    public String toString() {
        if (arch == null)
            return os.getId();
        return (os == null ? "" : os.getId()) + "/" + arch.getId();
    }
}
