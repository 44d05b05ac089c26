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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.anarres.ccscan.Platform.Arch.*;
import static org.anarres.ccscan.Platform.OS.*;

/**
 * The macros a compiler predefines for each known platform.
 */
public final class Platforms {

    private static final Map<Platform, Environment> ENVIRONMENTS = new HashMap<Platform, Environment>();

    static {
        List<Platform.Arch> allArchs = Arrays.asList(Platform.Arch.values());
        List<Platform.OS> allOS = Arrays.asList(Platform.OS.values());

        /* Windows */
        add("_WIN32", os(WINDOWS, I386, X86_32, X86_64, AARCH32, AARCH64));
        add("_WIN64", os(WINDOWS, X86_64, AARCH64));
        add("__MINGW32__", one(WINDOWS, I386));
        add("__MINGW64__", one(WINDOWS, X86_64));
        add("_M_IX86", one(WINDOWS, I386));
        add("_M_X64", one(WINDOWS, X86_64));
        add("_M_ARM", one(WINDOWS, AARCH32));
        add("_M_ARM64", one(WINDOWS, AARCH64));

        /* Linux and Android */
        add(os(LINUX, allArchs), "linux", "__linux__", "__linux", "__gnu_linux__");
        add("__NIX__", os(NIXOS, allArchs));
        add("__NIXOS__", os(NIXOS, allArchs));
        add("__ANDROID__", os(ANDROID, AARCH32, AARCH64, X86_32, X86_64, RISCV64));
        add("__CHROMEOS__", os(CHROMIUMOS, X86_64, AARCH64, RISCV64));
        /* Apple does not define unix. */
        add(matrix(Arrays.asList(LINUX, ANDROID, CHROMIUMOS, NIXOS, FREEBSD, NETBSD, OPENBSD, HAIKU, QNX), allArchs),
                "unix", "__unix", "__unix__");

        /* WebAssembly */
        List<Platform.Arch> wasm = Arrays.asList(WASM32, WASM64);
        add("__EMSCRIPTEN__", matrix(Collections.singletonList(EMSCRIPTEN), wasm));
        add("__wasi__", matrix(Collections.singletonList(WASI), wasm));
        add("__wasm__", matrix(Arrays.asList(EMSCRIPTEN, WASI), wasm));
        add("__wasm32__", matrix(Arrays.asList(EMSCRIPTEN, WASI), Collections.singletonList(WASM32)));
        add("__wasm64__", matrix(Arrays.asList(EMSCRIPTEN, WASI), Collections.singletonList(WASM64)));

        /* BSD */
        List<Platform.Arch> bsd = Arrays.asList(I386, X86_64, AARCH64, RISCV64, PPC64LE);
        add("__FreeBSD__", matrix(Collections.singletonList(FREEBSD), bsd));
        add("__NetBSD__", matrix(Collections.singletonList(NETBSD), bsd));
        add("__OpenBSD__", matrix(Collections.singletonList(OPENBSD), bsd));

        /* QNX, Haiku, Fuchsia, VxWorks, UEFI */
        add(os(QNX, AARCH32, AARCH64, PPC32, PPC64LE, X86_32, X86_64), "__QNX__", "__QNXNTO__");
        add("__HAIKU__", os(HAIKU, X86_32, X86_64));
        add(os(FUCHSIA, AARCH64, X86_64), "__FUCHSIA__", "__Fuchsia__");
        add(os(VXWORKS, AARCH32, AARCH64, PPC32, PPC64LE, X86_32, X86_64), "__VXWORKS__", "__vxworks");
        add(os(UEFI, AARCH32, AARCH64, X86_32, X86_64, RISCV64), "__UEFI__", "__EFI__");

        /* Apple, 64-bit only */
        List<Platform> mac = os(OSX, X86_64, AARCH64, ARM64E);
        List<Platform> ios = os(IOS, AARCH64, ARM64E);
        List<Platform> tvos = os(TVOS, AARCH64);
        List<Platform> watchos = os(WATCHOS, ARMV7K, ARM64_32);
        List<Platform> visionos = os(VISIONOS, AARCH64);
        List<Platform> apple = new ArrayList<Platform>();
        apple.addAll(mac);
        apple.addAll(ios);
        apple.addAll(tvos);
        apple.addAll(watchos);
        apple.addAll(visionos);
        add(apple, "__APPLE__", "__MACH__");
        add(mac, "TARGET_OS_OSX", "TARGET_OS_MAC");
        add(ios, "TARGET_OS_IPHONE", "TARGET_OS_IOS");
        add("TARGET_OS_TV", tvos);
        add("TARGET_OS_WATCH", watchos);
        add("TARGET_OS_VISION", visionos);

        /* CPU */
        add(arch(X86_64, allOS), "__x86_64__", "__x86_64", "__amd64", "__amd64__");
        add(arch(I386, allOS), "__i386__", "__i386");
        add(arch(AARCH32, allOS), "__arm__", "__arm", "__thumb__", "__thumb");
        add(arch(AARCH64, allOS), "__aarch64__", "__arm64", "__arm64__");
        add(one(WATCHOS, ARM64_32), "__ARM64_32__", "__ARM64_32");
        add(arch(ARM64E, Arrays.asList(OSX, IOS)), "__arm64e__", "__arm64e");

        /* Bare metal Arm */
        add("__ARM_ARCH_6M__", one(NONE, ARMV6_M));
        add(one(NONE, ARMV7), "__ARM_ARCH_7__", "__ARM_ARCH_7A__");
        add("__ARM_ARCH_7M__", one(NONE, ARMV7_M));
        add("__ARM_ARCH_7EM__", one(NONE, ARMV7E_M));
        add(one(NONE, ARMV8_M), "__ARM_ARCH_8M_BASE__", "__ARM_ARCH_8M_MAIN__");

        /* PowerPC, MIPS, s390, RISC-V */
        List<Platform.OS> ppc = Arrays.asList(LINUX, FREEBSD, NETBSD, OPENBSD, QNX, VXWORKS);
        add(arch(PPC32, ppc), "__powerpc__", "__PPC__");
        add(arch(PPC64LE, ppc), "__powerpc64__", "__ppc64__");
        add("__mips64", arch(MIPS64, Arrays.asList(LINUX, NETBSD, OPENBSD, QNX, VXWORKS)));
        add(one(LINUX, S390X), "__s390x__", "__s390__");
        add("__riscv", arch(RISCV64,
                Arrays.asList(LINUX, FREEBSD, NETBSD, OPENBSD, QNX, VXWORKS, ANDROID, CHROMIUMOS, FUCHSIA, NIXOS)));
    }

    private Platforms() {
    }

    private static void add(@Nonnull String name, @Nonnull List<Platform> platforms) {
        for (Platform platform : platforms) {
            Environment env = ENVIRONMENTS.get(platform);
            if (env == null)
                env = Environment.empty();
            ENVIRONMENTS.put(platform, env.define(name, 1));
        }
    }

    private static void add(@Nonnull List<Platform> platforms, @Nonnull String... names) {
        for (String name : names)
            add(name, platforms);
    }

    @Nonnull
    private static List<Platform> one(@Nonnull Platform.OS os, @Nonnull Platform.Arch arch) {
        return Collections.singletonList(Platform.of(os, arch));
    }

    /* The given architectures of one OS, and the OS on its own. */
    @Nonnull
    private static List<Platform> os(@Nonnull Platform.OS os, @Nonnull Platform.Arch... archs) {
        return os(os, Arrays.asList(archs));
    }

    @Nonnull
    private static List<Platform> os(@Nonnull Platform.OS os, @Nonnull List<Platform.Arch> archs) {
        List<Platform> result = matrix(Collections.singletonList(os), archs);
        result.add(Platform.of(os, null));
        return result;
    }

    /* One architecture under the given OSes, and the architecture on its own. */
    @Nonnull
    private static List<Platform> arch(@Nonnull Platform.Arch arch, @Nonnull List<Platform.OS> oses) {
        List<Platform> result = matrix(oses, Collections.singletonList(arch));
        result.add(Platform.of(null, arch));
        return result;
    }

    @Nonnull
    private static List<Platform> matrix(@Nonnull List<Platform.OS> oses, @Nonnull List<Platform.Arch> archs) {
        List<Platform> result = new ArrayList<Platform>();
        for (Platform.OS os : oses)
            for (Platform.Arch arch : archs)
                result.add(Platform.of(os, arch));
        return result;
    }

    /** Returns true if the platform has predefined macros. */
    public static boolean isKnown(@Nonnull Platform platform) {
        return ENVIRONMENTS.containsKey(platform);
    }

    /**
     * Returns the predefined macros of the platform, which are
     * empty for a platform without any.
     */
    @Nonnull
    public static Environment getEnvironment(@Nonnull Platform platform) {
        Environment env = ENVIRONMENTS.get(platform);
        return env == null ? Environment.empty() : env;
    }

    /** Returns every platform with predefined macros, in order. */
    @Nonnull
    public static SortedSet<Platform> getPlatforms() {
        return Collections.unmodifiableSortedSet(new TreeSet<Platform>(ENVIRONMENTS.keySet()));
    }
}
