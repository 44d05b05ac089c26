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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Scans C and C++ files and prints their structure as JSON.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        int status = run(args, System.out);
        if (status != 0)
            System.exit(status);
    }

    /**
     * Runs the scanner.
     *
     * @return 0 on success, 1 if any file could not be read or tokenized,
     * 2 if the command line is invalid.
     */
    public static int run(@Nonnull String[] args, @Nonnull PrintStream out) throws IOException {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Includes the macro environment of each platform in the output.");
        OptionSpec<String> defineOption = parser.acceptsAll(Arrays.asList("define", "D"),
                "Defines the given macro.")
                .withRequiredArg().ofType(String.class).describedAs("name[=value]");
        OptionSpec<String> undefineOption = parser.acceptsAll(Arrays.asList("undefine", "U"),
                "Undefines the given macro, previously defined using -D.")
                .withRequiredArg().describedAs("name");
        OptionSpec<String> platformOption = parser.acceptsAll(Arrays.asList("platform", "P"),
                "Also evaluates includes under the predefined macros of the platform.")
                .withRequiredArg().ofType(String.class).describedAs("os[/arch]");
        OptionSpec<?> allPlatformsOption = parser.accepts("all-platforms",
                "Evaluates includes under every known platform.");
        OptionSpec<?> tokensOption = parser.accepts("tokens",
                "Includes the tokens of each file in the output.");
        OptionSpec<?> groupOption = parser.accepts("group",
                "Groups the files into compilation units.");
        OptionSpec<String> packageOption = parser.accepts("package",
                "The repository-relative path of the package holding the files.")
                .withRequiredArg().defaultsTo("").describedAs("path");
        OptionSpec<String> stripIncludePrefixOption = parser.accepts("strip-include-prefix",
                "The prefix removed from header paths.")
                .withRequiredArg().defaultsTo("").describedAs("prefix");
        OptionSpec<String> includePrefixOption = parser.accepts("include-prefix",
                "The prefix added to header paths.")
                .withRequiredArg().defaultsTo("").describedAs("prefix");
        OptionSpec<String> searchOption = parser.accepts("search",
                "An additional header path, as strip-prefix:include-prefix.")
                .withRequiredArg().describedAs("strip:prefix");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("Files to process.");

        OptionSet options;
        Environment env;
        SortedSet<Platform> platforms = new TreeSet<Platform>();
        IncludePathConfig config;
        try {
            options = parser.parse(args);
            if (options.has(helpOption)) {
                parser.printHelpOn(out);
                return 0;
            }

            env = Environment.parse(options.valuesOf(defineOption));
            for (String arg : options.valuesOf(undefineOption))
                env = env.undefine(arg);

            for (String arg : options.valuesOf(platformOption))
                platforms.add(Platform.parse(arg));
            if (options.has(allPlatformsOption))
                platforms.addAll(Platforms.getPlatforms());

            config = IncludePathConfig.DEFAULT
                    .withPackageRel(options.valueOf(packageOption))
                    .withStripIncludePrefix(options.valueOf(stripIncludePrefixOption))
                    .withIncludePrefix(options.valueOf(includePrefixOption));
            for (String arg : options.valuesOf(searchOption)) {
                int idx = arg.indexOf(':');
                if (idx == -1)
                    config = config.withSearchPath(new IncludePathConfig.SearchPath(arg, ""));
                else
                    config = config.withSearchPath(new IncludePathConfig.SearchPath(arg.substring(0, idx), arg.substring(idx + 1)));
            }
        } catch (OptionException | IllegalArgumentException e) {
            LOG.error(e.getMessage());
            parser.printHelpOn(System.err);
            return 2;
        }

        int status = 0;
        DefaultParserListener listener = new DefaultParserListener();
        JsonObject files = new JsonObject();
        List<FileInfo> infos = new ArrayList<FileInfo>();
        for (File input : options.valuesOf(inputsOption)) {
            String name = input.getPath().replace(File.separatorChar, '/');
            SourceInfo info;
            JsonArray tokens = new JsonArray();
            try {
                byte[] content = FileUtils.readFileToByteArray(input);
                if (options.has(tokensOption))
                    for (Token tok : Lexer.tokenize(content))
                        tokens.add(tok.toJson());
                Parser p = new Parser(name, content);
                p.setListener(listener);
                info = p.parse();
            } catch (IOException e) {
                LOG.error("{}: {}", name, e.toString());
                status = 1;
                continue;
            } catch (LexerException e) {
                LOG.error("{}: {}", name, e.getMessage());
                status = 1;
                continue;
            }

            JsonObject result = info.toJson();
            if (options.has(tokensOption))
                result.add("tokens", tokens);
            result.add("includes", toJson(info.collectReachableIncludes(env)));
            if (!platforms.isEmpty())
                result.add("platforms", PlatformIncludes.compute(info, env, platforms).toJson());
            files.add(name, result);
            infos.add(FileInfo.create(name, info.collectIncludes(), config));
        }

        JsonObject output = new JsonObject();
        output.add("files", files);
        if (options.has(groupOption))
            output.add("groups", SourceGrouper.toJson(SourceGrouper.groupSources(infos)));
        if (options.has(debugOption)) {
            JsonObject environments = new JsonObject();
            environments.add("", env.toJson());
            for (Platform platform : platforms)
                environments.add(platform.toString(), env.plus(Platforms.getEnvironment(platform)).toJson());
            output.add("environments", environments);
        }

        if (listener.getErrors() > 0 || listener.getWarnings() > 0)
            LOG.info("{} error(s), {} warning(s)", listener.getErrors(), listener.getWarnings());

        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        out.println(gson.toJson(output));
        return status;
    }

    @Nonnull
    private static JsonArray toJson(@Nonnull Collection<Directive.Include> includes) {
        JsonArray a = new JsonArray();
        for (Directive.Include include : includes)
            a.add(include.toJson());
        return a;
    }
}
